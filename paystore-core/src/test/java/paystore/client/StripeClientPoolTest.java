package paystore.client;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class StripeClientPoolTest {

  private final StripeClientPool pool = new StripeClientPool(
      List.of(StripeClientSettings.of("sk_us", "US"), StripeClientSettings.of("sk_ca", "ca")), 2);

  @AfterEach
  void tearDown() {
    pool.shutdown(true);
  }

  @Test
  void settingsFor_isCaseInsensitive() {
    assertEquals("sk_ca", pool.settingsFor("CA").apiKey().value());
    assertEquals("sk_us", pool.settingsFor("us").apiKey().value());
  }

  @Test
  void settingsFor_unknownCountry_throws() {
    assertThrows(IllegalArgumentException.class, () -> pool.settingsFor("AU"));
  }

  @Test
  void submit_runsOnDaemonWorkerWithCountrySettings() {
    String result = pool.submit("US", settings ->
        settings.country() + ":" + Thread.currentThread().getName() + ":"
            + Thread.currentThread().isDaemon()).join();

    assertTrue(result.startsWith("US:stripe-client-"));
    assertTrue(result.endsWith(":true"));
  }

  @Test
  void submit_failurePropagatesThroughFuture() {
    CompletionException e = assertThrows(CompletionException.class, () ->
        pool.submit("US", settings -> {
          throw new IllegalStateException("card declined");
        }).join());

    assertInstanceOf(IllegalStateException.class, e.getCause());
  }

  @Test
  void submit_afterShutdown_isRejected() {
    pool.shutdown(false);

    assertTrue(pool.isShutdown());
    assertThrows(RejectedExecutionException.class, () -> pool.submit("US", settings -> "x"));
  }

  @Test
  void duplicateCountry_throws() {
    assertThrows(IllegalArgumentException.class, () -> new StripeClientPool(
        List.of(StripeClientSettings.of("a", "US"), StripeClientSettings.of("b", "us")), 1));
  }

  @Test
  void nonPositiveWorkers_throws() {
    assertThrows(IllegalArgumentException.class, () -> new StripeClientPool(List.of(), 0));
  }

  @Test
  void settingsToString_masksApiKey() {
    assertFalse(StripeClientSettings.of("sk_live_123", "US").toString().contains("sk_live_123"));
  }
}
