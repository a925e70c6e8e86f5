package paystore.db;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Picks the alternative replica shared by every maindb handle of one context.
 *
 * <p>The context calls {@link #select} exactly once while it is being built and hands the result
 * to each dependent handle. Picking per handle would let one unhealthy replica fail startup with a
 * probability that grows with the number of handles.
 */
@FunctionalInterface
public interface ReplicaSelector {

  /**
   * Chooses one candidate replica URL.
   *
   * @param candidates candidate JDBC URLs, possibly empty
   * @return the chosen URL, or empty when there are no candidates (handles then use their own
   *     configured replica)
   */
  Optional<String> select(List<String> candidates);

  /** Uniformly random choice. */
  static ReplicaSelector random() {
    return candidates -> candidates == null || candidates.isEmpty()
        ? Optional.empty()
        : Optional.of(candidates.get(ThreadLocalRandom.current().nextInt(candidates.size())));
  }

  /** Always the first candidate, for deployments that pin the replica in configuration. */
  static ReplicaSelector first() {
    return candidates -> candidates == null || candidates.isEmpty()
        ? Optional.empty()
        : Optional.of(candidates.get(0));
  }
}
