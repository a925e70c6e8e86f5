package paystore.model;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * One column of a partial update: either absent (the column is not written) or present with a
 * value, where a present {@code null} writes SQL NULL.
 *
 * <p>{@link java.util.Optional} cannot express "set to null", which is why update inputs use this
 * type for every mutable column.
 *
 * @param <T> column value type
 */
public final class FieldUpdate<T> {
  private static final FieldUpdate<?> ABSENT = new FieldUpdate<>(false, null);

  private final boolean present;
  private final T value;

  private FieldUpdate(boolean present, T value) {
    this.present = present;
    this.value = value;
  }

  @SuppressWarnings("unchecked")
  public static <T> FieldUpdate<T> absent() {
    return (FieldUpdate<T>) ABSENT;
  }

  /**
   * A column to write. {@code value} may be {@code null}.
   */
  public static <T> FieldUpdate<T> of(T value) {
    return new FieldUpdate<>(true, value);
  }

  /**
   * Shorthand for {@code of(null)}.
   */
  public static <T> FieldUpdate<T> ofNull() {
    return new FieldUpdate<>(true, null);
  }

  public boolean isPresent() {
    return present;
  }

  /**
   * @throws NoSuchElementException if absent
   */
  public T value() {
    if (!present) {
      throw new NoSuchElementException("FieldUpdate is absent");
    }
    return value;
  }

  public void ifPresent(Consumer<? super T> action) {
    if (present) {
      action.accept(value);
    }
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof FieldUpdate<?> other
        && present == other.present
        && Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return present ? Objects.hash(true, value) : 0;
  }

  @Override
  public String toString() {
    return present ? "FieldUpdate[" + value + "]" : "FieldUpdate.absent";
  }
}
