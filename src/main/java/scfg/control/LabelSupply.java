package scfg.control;

import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import scfg.graph.BlockKind;

/** Hands out fresh labels for synthetic blocks, numbered per kind. */
public class LabelSupply {
  private final Set<String> taken;
  private final Map<BlockKind, Integer> counters = new EnumMap<>(BlockKind.class);

  public LabelSupply(Collection<String> existing) {
    this.taken = new HashSet<>(existing);
  }

  /** Returns {@code <prefix><n>} for the smallest n that gives an unused label. */
  public String fresh(BlockKind kind) {
    if (!kind.isSynthetic()) {
      throw new IllegalArgumentException("Original blocks are never created: " + kind);
    }
    while (true) {
      int n = counters.getOrDefault(kind, 0);
      counters.put(kind, n + 1);
      String label = kind.prefix + n;
      if (taken.add(label)) {
        return label;
      }
    }
  }
}
