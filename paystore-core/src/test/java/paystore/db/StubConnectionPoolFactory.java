package paystore.db;

import paystore.spi.ConnectionPool;
import paystore.spi.ConnectionPoolFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pool factory that opens no real connections and records every open and close as
 * {@code "open <pool>"} / {@code "close <pool>"}.
 */
public class StubConnectionPoolFactory implements ConnectionPoolFactory {
  private final List<String> events = Collections.synchronizedList(new ArrayList<>());
  private final List<String> openedUrls = Collections.synchronizedList(new ArrayList<>());
  private final Set<String> failingUrls = ConcurrentHashMap.newKeySet();
  private final Set<String> failingCloses = ConcurrentHashMap.newKeySet();
  private final AtomicInteger openPools = new AtomicInteger();

  public StubConnectionPoolFactory failOpen(String jdbcUrl) {
    failingUrls.add(jdbcUrl);
    return this;
  }

  public StubConnectionPoolFactory failClose(String poolName) {
    failingCloses.add(poolName);
    return this;
  }

  @Override
  public ConnectionPool open(String poolName, Endpoint endpoint, DatabaseConfig config) {
    if (failingUrls.contains(endpoint.jdbcUrl())) {
      events.add("fail " + poolName);
      throw new IllegalStateException("Cannot reach " + endpoint.jdbcUrl());
    }
    events.add("open " + poolName);
    openedUrls.add(endpoint.jdbcUrl());
    openPools.incrementAndGet();
    return new StubPool(poolName);
  }

  public List<String> events() {
    synchronized (events) {
      return List.copyOf(events);
    }
  }

  public List<String> openedUrls() {
    synchronized (openedUrls) {
      return List.copyOf(openedUrls);
    }
  }

  /** Pools opened and not yet closed. */
  public int openPools() {
    return openPools.get();
  }

  private final class StubPool implements ConnectionPool {
    private final String name;

    StubPool(String name) {
      this.name = name;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public Connection getConnection() throws SQLException {
      throw new SQLTransientConnectionException("stub pool " + name + " has no connections", "08001");
    }

    @Override
    public void close() {
      events.add("close " + name);
      openPools.decrementAndGet();
      if (failingCloses.contains(name)) {
        throw new IllegalStateException("Cannot close " + name);
      }
    }
  }
}
