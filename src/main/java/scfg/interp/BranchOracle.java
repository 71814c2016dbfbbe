package scfg.interp;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/**
 * Decides which edge a multi-way original block takes. Both interpreters ask the oracle with the
 * same arguments for the same visit, so equal oracles give comparable traces.
 */
public interface BranchOracle {

  /**
   * @param label the deciding block
   * @param visit how often {@code label} was visited before, starting at 0
   * @param edgeCount number of outgoing edges, at least 2
   * @return the index of the edge to take, in {@code [0, edgeCount)}
   */
  int choose(String label, int visit, int edgeCount);

  /** A pseudo-random oracle that only depends on {@code seed}, the label and the visit. */
  static BranchOracle seeded(long seed) {
    HashFunction hash = Hashing.murmur3_32_fixed();
    return (label, visit, edgeCount) ->
        Math.floorMod(
            hash.newHasher().putLong(seed).putString(label, UTF_8).putInt(visit).hash().asInt(),
            edgeCount);
  }

  /** Always takes the edge at {@code index}, or the last one if there are fewer edges. */
  static BranchOracle constant(int index) {
    return (label, visit, edgeCount) -> Math.min(index, edgeCount - 1);
  }
}
