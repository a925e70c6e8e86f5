package paystore.db;

/**
 * Connection lifecycle of a {@link Database} handle.
 */
public enum ConnectionState {
  DISCONNECTED,
  /** Pools are being opened; accessors are unavailable until {@link #CONNECTED}. */
  CONNECTING,
  CONNECTED
}
