package scfg.restructure;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import scfg.control.ControlVariableAllocator;
import scfg.region.Region;

/**
 * State of one restructuring run and the recursion that drives both passes. Each level folds the
 * loops of a block set and then decomposes the remaining acyclic graph into branches; folded loops
 * are structured one level further down once the branch pass places them in the tree.
 */
final class StructuringContext {
  final WorkGraph graph;
  final ControlVariableAllocator allocator = new ControlVariableAllocator();

  private final LoopRestructuring loops = new LoopRestructuring(this);
  private final BranchRestructuring branches = new BranchRestructuring(this);
  private final long roundBound;
  private long rounds = 0;

  StructuringContext(WorkGraph graph, long roundBound) {
    this.graph = graph;
    this.roundBound = roundBound;
  }

  /** Counts one round of structuring on {@code labels} against the round bound. */
  void countRound(Supplier<? extends Collection<String>> labels) {
    rounds++;
    if (rounds > roundBound) {
      throw new NonConvergenceError(rounds, roundBound, labels.get());
    }
  }

  long rounds() {
    return rounds;
  }

  /**
   * Structures the blocks {@code labels}, which must form a single-entry region entered through
   * {@code entry}. Blocks created on the way belong to the result.
   */
  Region structure(Set<String> labels, String entry) {
    countRound(() -> labels);
    allocator.openScope();
    for (String label : labels) {
      if (graph.hasForwardEdge(label, entry)) {
        throw new InternalInvariantError("Entry " + entry + " lies on a cycle of", labels);
      }
    }

    Set<String> scope = new LinkedHashSet<>(labels);
    List<LoopRestructuring.FoldedLoop> folded = loops.foldLoops(scope);

    List<Unit> units = new ArrayList<>();
    Set<String> inLoops = new HashSet<>();
    for (LoopRestructuring.FoldedLoop loop : folded) {
      int ordinal = loop.members.stream().mapToInt(graph::ordinal).min().getAsInt();
      units.add(Unit.loop(loop.entry, loop.members, ordinal, () -> loops.materialize(loop)));
      inLoops.addAll(loop.members);
    }
    for (String label : scope) {
      if (!inLoops.contains(label)) {
        units.add(Unit.block(label, graph.ordinal(label)));
      }
    }
    units.sort((left, right) -> Integer.compare(left.ordinal, right.ordinal));

    View view = new View(graph);
    units.forEach(view::add);
    Region result =
        branches.decompose(view, new LinkedHashSet<>(view.units()), view.unitOf(entry));

    for (LoopRestructuring.FoldedLoop loop : folded) {
      if (loop.headerVariable != null) {
        allocator.assign(result, loop.headerVariable);
      }
      if (loop.exitVariable != null) {
        allocator.assign(result, loop.exitVariable);
      }
    }
    allocator.closeScope();
    return result;
  }

  static ImmutableList<String> sorted(Collection<String> labels, WorkGraph graph) {
    return ImmutableList.sortedCopyOf(graph.byOrdinal(), labels);
  }
}
