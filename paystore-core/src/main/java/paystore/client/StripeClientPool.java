package paystore.client;

import paystore.util.DaemonThreadFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fixed pool of worker threads that run blocking Stripe calls, plus the per-country account
 * settings those calls use.
 *
 * <p>The pool is owned by {@link paystore.AppContext}, which shuts it down when the context
 * closes. Calls submitted after shutdown fail with
 * {@link java.util.concurrent.RejectedExecutionException}.
 */
public final class StripeClientPool {
  private static final Logger logger = Logger.getLogger(StripeClientPool.class.getName());

  private final Map<String, StripeClientSettings> settingsByCountry;
  private final int maxWorkers;
  private final ExecutorService executor;

  public StripeClientPool(List<StripeClientSettings> settingsList, int maxWorkers) {
    Objects.requireNonNull(settingsList, "settingsList");
    if (maxWorkers <= 0) {
      throw new IllegalArgumentException("maxWorkers must be > 0");
    }
    Map<String, StripeClientSettings> byCountry = new LinkedHashMap<>();
    for (StripeClientSettings settings : settingsList) {
      if (byCountry.putIfAbsent(settings.country(), settings) != null) {
        throw new IllegalArgumentException("Duplicate Stripe settings for " + settings.country());
      }
    }
    this.settingsByCountry = Collections.unmodifiableMap(byCountry);
    this.maxWorkers = maxWorkers;
    this.executor = Executors.newFixedThreadPool(maxWorkers, new DaemonThreadFactory("stripe-client-"));
  }

  public int maxWorkers() {
    return maxWorkers;
  }

  public Map<String, StripeClientSettings> settings() {
    return settingsByCountry;
  }

  /**
   * @throws IllegalArgumentException if no account is configured for {@code country}
   */
  public StripeClientSettings settingsFor(String country) {
    StripeClientSettings settings = settingsByCountry.get(country.toUpperCase(Locale.ROOT));
    if (settings == null) {
      throw new IllegalArgumentException("No Stripe account configured for " + country);
    }
    return settings;
  }

  /**
   * Runs {@code call} with the settings of {@code country} on a worker thread.
   */
  public <T> CompletableFuture<T> submit(String country, Function<StripeClientSettings, T> call) {
    StripeClientSettings settings = settingsFor(country);
    return CompletableFuture.supplyAsync(() -> call.apply(settings), executor);
  }

  /**
   * Stops accepting calls. With {@code wait} the caller blocks until running calls finish.
   */
  public void shutdown(boolean wait) {
    executor.shutdown();
    if (!wait) {
      return;
    }
    try {
      while (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
        logger.log(Level.FINE, "Waiting for Stripe workers to finish");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
  }

  public boolean isShutdown() {
    return executor.isShutdown();
  }
}
