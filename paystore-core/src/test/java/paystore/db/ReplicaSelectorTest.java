package paystore.db;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReplicaSelectorTest {

  private static final List<String> CANDIDATES = List.of("jdbc:stub:r1", "jdbc:stub:r2", "jdbc:stub:r3");

  @Test
  void random_noCandidates_returnsEmpty() {
    assertEquals(Optional.empty(), ReplicaSelector.random().select(List.of()));
    assertEquals(Optional.empty(), ReplicaSelector.random().select(null));
  }

  @Test
  void random_alwaysPicksACandidate() {
    ReplicaSelector selector = ReplicaSelector.random();
    Set<String> seen = new HashSet<>();

    for (int i = 0; i < 200; i++) {
      String picked = selector.select(CANDIDATES).orElseThrow();
      assertTrue(CANDIDATES.contains(picked));
      seen.add(picked);
    }

    assertTrue(seen.size() > 1, "random selector should not be constant");
  }

  @Test
  void random_singleCandidate_returnsIt() {
    assertEquals(Optional.of("jdbc:stub:r1"), ReplicaSelector.random().select(List.of("jdbc:stub:r1")));
  }

  @Test
  void first_picksFirstCandidate() {
    assertEquals(Optional.of("jdbc:stub:r1"), ReplicaSelector.first().select(CANDIDATES));
    assertEquals(Optional.empty(), ReplicaSelector.first().select(List.of()));
  }
}
