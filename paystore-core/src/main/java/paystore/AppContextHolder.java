package paystore;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Single registration slot for an {@link AppContext}, for hosts that must look the context up
 * instead of receiving it through their constructors.
 *
 * <p>Each host owns its holder; there is no static instance. Misuse (attaching twice, reading
 * before attaching, detaching a different context) is a programming error and fails with
 * {@link IllegalStateException}.
 */
public final class AppContextHolder {
  private final AtomicReference<AppContext> context = new AtomicReference<>();

  /**
   * @throws IllegalStateException if a context is already attached
   */
  public void attach(AppContext appContext) {
    if (appContext == null) {
      throw new IllegalArgumentException("appContext must not be null");
    }
    if (!context.compareAndSet(null, appContext)) {
      throw new IllegalStateException("App context is already set");
    }
  }

  /**
   * @throws IllegalStateException if no context is attached
   */
  public AppContext get() {
    AppContext current = context.get();
    if (current == null) {
      throw new IllegalStateException("App context is not set");
    }
    return current;
  }

  public boolean exists() {
    return context.get() != null;
  }

  /**
   * Removes {@code appContext}; the caller stays responsible for closing it.
   *
   * @throws IllegalStateException if nothing is attached or a different context is attached
   */
  public void detach(AppContext appContext) {
    AppContext current = context.get();
    if (current == null) {
      throw new IllegalStateException("App context is not set");
    }
    if (current != appContext || !context.compareAndSet(current, null)) {
      throw new IllegalStateException("A different app context is attached");
    }
  }
}
