package paystore.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

  @Test
  void createsNamedDaemonThreads() {
    DaemonThreadFactory factory = new DaemonThreadFactory("stripe-client-");

    Thread thread = factory.newThread(() -> {
    });

    assertTrue(thread.isDaemon());
    assertEquals("stripe-client-1", thread.getName());
  }

  @Test
  void namesAreSequentialPerFactory() {
    DaemonThreadFactory first = new DaemonThreadFactory("a-");
    DaemonThreadFactory second = new DaemonThreadFactory("b-");

    first.newThread(() -> {
    });
    Thread t2 = first.newThread(() -> {
    });
    Thread other = second.newThread(() -> {
    });

    assertEquals("a-2", t2.getName());
    assertEquals("b-1", other.getName());
  }

  @Test
  void nullPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
  }
}
