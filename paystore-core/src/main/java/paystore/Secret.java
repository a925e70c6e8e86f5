package paystore;

import java.util.Objects;

/**
 * A credential read from configuration. {@link #toString()} never reveals the value so that
 * configuration objects can be logged.
 */
public final class Secret {
  private final String value;

  private Secret(String value) {
    this.value = Objects.requireNonNull(value, "value");
  }

  public static Secret of(String value) {
    return new Secret(value);
  }

  /**
   * Returns {@code null} for a null value, otherwise wraps it.
   */
  public static Secret ofNullable(String value) {
    return value == null ? null : new Secret(value);
  }

  public String value() {
    return value;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Secret other && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return "Secret[****]";
  }
}
