package paystore.db;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseConfigTest {

  @Test
  void defaults() {
    DatabaseConfig config = DatabaseConfig.defaults();

    assertEquals(1, config.minPoolSize());
    assertEquals(5, config.maxPoolSize());
    assertEquals(Duration.ofSeconds(5), config.connectionTimeout());
    assertEquals(Duration.ofSeconds(10), config.queryTimeout());
  }

  @Test
  void queryTimeoutSeconds_roundsUp() {
    assertEquals(2, DatabaseConfig.builder().queryTimeout(Duration.ofMillis(1500)).build().queryTimeoutSeconds());
    assertEquals(1, DatabaseConfig.builder().queryTimeout(Duration.ofMillis(10)).build().queryTimeoutSeconds());
    assertEquals(3, DatabaseConfig.builder().queryTimeout(Duration.ofSeconds(3)).build().queryTimeoutSeconds());
  }

  @Test
  void minAboveMax_throws() {
    assertThrows(IllegalArgumentException.class, () ->
        DatabaseConfig.builder().minPoolSize(6).maxPoolSize(5).build());
  }

  @Test
  void nonPositiveTimeouts_throw() {
    assertThrows(IllegalArgumentException.class, () ->
        DatabaseConfig.builder().connectionTimeout(Duration.ZERO).build());
    assertThrows(IllegalArgumentException.class, () ->
        DatabaseConfig.builder().queryTimeout(Duration.ofSeconds(-1)).build());
    assertThrows(NullPointerException.class, () ->
        DatabaseConfig.builder().queryTimeout(null).build());
  }
}
