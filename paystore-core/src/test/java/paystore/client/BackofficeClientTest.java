package paystore.client;

import paystore.Secret;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BackofficeClientTest {

  private static BackofficeClientSettings settings(String baseUrl) {
    return new BackofficeClientSettings(baseUrl, "payments@example.com", Secret.of("pw"),
        Duration.ofMinutes(30));
  }

  @Test
  void resolve_joinsPathToBaseUrl() {
    BackofficeClient client = new BackofficeClient(settings("https://backoffice.example.com/api"));

    assertEquals("https://backoffice.example.com/api/v1/stores/12",
        client.resolve("/v1/stores/12").toString());
    assertEquals("https://backoffice.example.com/api/v1/stores/12",
        client.resolve("v1/stores/12").toString());
  }

  @Test
  void token_isCachedUntilTtlExpires() {
    MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    BackofficeClient client = new BackofficeClient(settings("https://bo.example.com"), clock);
    AtomicInteger issued = new AtomicInteger();

    String first = client.token(() -> "jwt-" + issued.incrementAndGet());
    clock.advance(Duration.ofMinutes(29));
    String cached = client.token(() -> "jwt-" + issued.incrementAndGet());
    clock.advance(Duration.ofMinutes(1));
    String renewed = client.token(() -> "jwt-" + issued.incrementAndGet());

    assertEquals("jwt-1", first);
    assertEquals("jwt-1", cached);
    assertEquals("jwt-2", renewed);
  }

  @Test
  void settings_rejectNonPositiveTtl() {
    assertThrows(IllegalArgumentException.class, () -> new BackofficeClientSettings(
        "https://bo.example.com", "a@example.com", Secret.of("pw"), Duration.ZERO));
  }

  private static final class MutableClock extends Clock {
    private Instant now;

    MutableClock(Instant now) {
      this.now = now;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneOffset getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(java.time.ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }
}
