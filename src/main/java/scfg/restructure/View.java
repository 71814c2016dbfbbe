package scfg.restructure;

import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.jooq.lambda.Seq;

/**
 * The blocks of one structuring level grouped into {@link Unit}s. Successors are derived from the
 * current forward edges of the {@link WorkGraph}, so they reflect every redirect.
 */
final class View {
  private final WorkGraph graph;
  private final Map<String, Unit> unitOf = new HashMap<>();
  private final Set<Unit> units = new LinkedHashSet<>();

  View(WorkGraph graph) {
    this.graph = graph;
  }

  void add(Unit unit) {
    units.add(unit);
    for (String member : unit.members) {
      unitOf.put(member, unit);
    }
  }

  Unit addBlock(String label) {
    Unit unit = Unit.block(label, graph.ordinal(label));
    add(unit);
    return unit;
  }

  Unit unitOf(String label) {
    Unit unit = unitOf.get(label);
    if (unit == null) {
      throw new IllegalArgumentException(label + " is not part of this level");
    }
    return unit;
  }

  /** All units in the order they were added. */
  Set<Unit> units() {
    return units;
  }

  /**
   * Distinct units within {@code scope} that {@code unit} has a forward edge to. For a block the
   * order follows the discriminants of its edges.
   */
  List<Unit> successors(Unit unit, Set<Unit> scope) {
    List<Unit> successors = new ArrayList<>();
    for (String member : unit.members) {
      for (String target : graph.forwardTargets(member)) {
        if (unit.members.contains(target)) {
          continue;
        }
        @Nullable Unit successor = unitOf.get(target);
        if (successor != null && scope.contains(successor) && !successors.contains(successor)) {
          successors.add(successor);
        }
      }
    }
    return successors;
  }

  /** Re-targets every edge from a member of {@code from} to {@code oldTarget}. */
  void redirect(Unit from, String oldTarget, String newTarget) {
    for (String member : from.members) {
      graph.redirect(member, oldTarget, newTarget);
    }
  }

  ImmutableSet<String> labelsOf(Collection<Unit> units) {
    return Seq.seq(units).flatMap(u -> Seq.seq(u.members)).collect(ImmutableSet.toImmutableSet());
  }
}
