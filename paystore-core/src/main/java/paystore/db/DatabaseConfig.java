package paystore.db;

import java.time.Duration;
import java.util.Objects;

/**
 * Pool sizing and timeouts shared by the master and replica pools of a logical database.
 *
 * <p>Create instances via {@link #builder()}; {@link #defaults()} matches the builder defaults.
 */
public final class DatabaseConfig {
  private final int minPoolSize;
  private final int maxPoolSize;
  private final Duration connectionTimeout;
  private final Duration queryTimeout;

  private DatabaseConfig(Builder builder) {
    if (builder.minPoolSize < 0) {
      throw new IllegalArgumentException("minPoolSize must be >= 0");
    }
    if (builder.maxPoolSize <= 0) {
      throw new IllegalArgumentException("maxPoolSize must be > 0");
    }
    if (builder.minPoolSize > builder.maxPoolSize) {
      throw new IllegalArgumentException("minPoolSize must be <= maxPoolSize");
    }
    this.minPoolSize = builder.minPoolSize;
    this.maxPoolSize = builder.maxPoolSize;
    this.connectionTimeout = requirePositive(builder.connectionTimeout, "connectionTimeout");
    this.queryTimeout = requirePositive(builder.queryTimeout, "queryTimeout");
  }

  public static Builder builder() {
    return new Builder();
  }

  public static DatabaseConfig defaults() {
    return builder().build();
  }

  public int minPoolSize() {
    return minPoolSize;
  }

  public int maxPoolSize() {
    return maxPoolSize;
  }

  /** Maximum wait for a pooled connection, including the initial connect. */
  public Duration connectionTimeout() {
    return connectionTimeout;
  }

  /** Per-statement timeout; rounded up to whole seconds for JDBC. */
  public Duration queryTimeout() {
    return queryTimeout;
  }

  int queryTimeoutSeconds() {
    long seconds = queryTimeout.toSeconds();
    return (int) Math.max(1, queryTimeout.toNanosPart() > 0 ? seconds + 1 : seconds);
  }

  @Override
  public String toString() {
    return "DatabaseConfig[minPoolSize=" + minPoolSize + ", maxPoolSize=" + maxPoolSize
        + ", connectionTimeout=" + connectionTimeout + ", queryTimeout=" + queryTimeout + "]";
  }

  private static Duration requirePositive(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be > 0");
    }
    return value;
  }

  /** Builder for {@link DatabaseConfig}. */
  public static final class Builder {
    private int minPoolSize = 1;
    private int maxPoolSize = 5;
    private Duration connectionTimeout = Duration.ofSeconds(5);
    private Duration queryTimeout = Duration.ofSeconds(10);

    private Builder() {}

    /**
     * Sets the number of idle connections kept open.
     *
     * <p>Optional. Defaults to {@code 1}.
     */
    public Builder minPoolSize(int minPoolSize) {
      this.minPoolSize = minPoolSize;
      return this;
    }

    /**
     * Sets the maximum number of connections per pool.
     *
     * <p>Optional. Defaults to {@code 5}.
     */
    public Builder maxPoolSize(int maxPoolSize) {
      this.maxPoolSize = maxPoolSize;
      return this;
    }

    /**
     * Sets the connection acquire timeout.
     *
     * <p>Optional. Defaults to {@code 5s}.
     */
    public Builder connectionTimeout(Duration connectionTimeout) {
      this.connectionTimeout = connectionTimeout;
      return this;
    }

    /**
     * Sets the statement timeout.
     *
     * <p>Optional. Defaults to {@code 10s}.
     */
    public Builder queryTimeout(Duration queryTimeout) {
      this.queryTimeout = queryTimeout;
      return this;
    }

    public DatabaseConfig build() {
      return new DatabaseConfig(this);
    }
  }
}
