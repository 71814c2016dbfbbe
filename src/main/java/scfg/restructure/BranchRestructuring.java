package scfg.restructure;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Iterables;
import com.google.common.collect.ListMultimap;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.jooq.lambda.Seq;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scfg.control.ControlVariable;
import scfg.graph.BlockKind;
import scfg.graph.Edge;
import scfg.region.Region;
import scfg.utils.Dominance;

/**
 * Decomposes the acyclic unit graph of a structuring level into linear chains and branches.
 *
 * <p>From the entry, units with a single successor form a chain. The first unit with several
 * successors is the head of a branch. Arm i holds everything the i-th successor dominates, provided
 * the head is its only predecessor; the rest is the tail. The tail must be entered at a single
 * unit, the immediate post-dominator of the head, unless a tail variable selects between several
 * entries. Arms are decomposed recursively, tails iteratively.
 */
final class BranchRestructuring {
  private static final Logger LOGGER = LoggerFactory.getLogger("BranchRestructuring");

  private final StructuringContext ctx;

  BranchRestructuring(StructuringContext ctx) {
    this.ctx = ctx;
  }

  /**
   * Decomposes {@code scope}, whose only entry is {@code entry} and which has exactly one unit
   * without successors inside {@code scope}.
   *
   * <p>Tails are decomposed in this loop rather than recursively, so a long sequence of branches
   * does not grow the stack; only arms and loop bodies recurse.
   */
  Region decompose(View view, Set<Unit> scope, Unit entry) {
    Deque<PendingBranch> pending = new ArrayDeque<>();
    Set<Unit> current = scope;
    Unit currentEntry = entry;
    Region region;
    while (true) {
      Set<Unit> level = current;
      ctx.countRound(() -> view.labelsOf(level));
      List<Unit> chain = new ArrayList<>();
      Set<Unit> visited = new HashSet<>();
      Unit unit = currentEntry;
      List<Unit> successors;
      while (true) {
        if (!visited.add(unit)) {
          throw new InternalInvariantError("Cycle left after folding loops", view.labelsOf(chain));
        }
        chain.add(unit);
        successors = view.successors(unit, level);
        if (successors.size() != 1) {
          break;
        }
        unit = successors.get(0);
      }
      if (successors.isEmpty()) {
        region = linear(chain);
        break;
      }
      PendingBranch branch = split(view, new LinkedHashSet<>(level), chain, successors);
      pending.push(branch);
      ctx.allocator.openScope();
      current = branch.tail;
      currentEntry = branch.tailEntry;
    }
    while (!pending.isEmpty()) {
      ctx.allocator.closeScope();
      region = complete(view, pending.pop(), region);
    }
    return region;
  }

  /** A branch whose arms are structured and whose tail is still to be decomposed. */
  private static final class PendingBranch {
    public final List<Unit> chain;
    public final Unit head;
    public final Set<Unit> scope;
    public final Map<Unit, Region> armRegions;
    public final Set<Unit> tail;
    public final Unit tailEntry;
    @Nullable public final ControlVariable tailVariable;

    PendingBranch(
        List<Unit> chain,
        Set<Unit> scope,
        Map<Unit, Region> armRegions,
        Set<Unit> tail,
        Unit tailEntry,
        @Nullable ControlVariable tailVariable) {
      this.chain = chain;
      this.head = Iterables.getLast(chain);
      this.scope = scope;
      this.armRegions = armRegions;
      this.tail = tail;
      this.tailEntry = tailEntry;
      this.tailVariable = tailVariable;
    }
  }

  /**
   * Splits the units after the head of {@code chain} into arms and a tail and structures the arms.
   * Successor and predecessor lists are computed once for the whole scope, so a step is linear in
   * the size of the scope.
   */
  private PendingBranch split(View view, Set<Unit> scope, List<Unit> chain, List<Unit> successors) {
    WorkGraph graph = ctx.graph;
    Unit head = Iterables.getLast(chain);
    if (head.isLoop()) {
      throw new InternalInvariantError("A loop has more than one exit", head.members);
    }
    ImmutableSet<Unit> original = ImmutableSet.copyOf(scope);
    Set<Unit> remaining = new LinkedHashSet<>(scope);
    remaining.removeAll(chain);

    Map<Unit, List<Unit>> successorsOf = new HashMap<>();
    ListMultimap<Unit, Unit> predecessorsOf = ArrayListMultimap.create();
    for (Unit unit : original) {
      List<Unit> targets = view.successors(unit, original);
      successorsOf.put(unit, targets);
      for (Unit target : targets) {
        predecessorsOf.put(target, unit);
      }
    }
    Dominance<Unit> dominance = Dominance.dominators(head, successorsOf::get);
    List<Unit> sinks = Seq.seq(remaining).filter(u -> successorsOf.get(u).isEmpty()).toList();
    if (sinks.size() != 1) {
      throw new InternalInvariantError("Region has no single exit", view.labelsOf(sinks));
    }
    Dominance<Unit> postDominance =
        Dominance.postDominators(sinks.get(0), dominance.reachable(), successorsOf::get);
    Optional<Unit> merge = postDominance.immediateDominator(head);

    Map<Unit, Set<Unit>> arms = new LinkedHashMap<>();
    for (Unit successor : successors) {
      if (predecessorsOf.get(successor).equals(ImmutableList.of(head))) {
        arms.put(successor, new LinkedHashSet<>());
      }
    }
    // Reverse postorder visits every immediate dominator before the units it dominates.
    Map<Unit, Unit> armEntryOf = new HashMap<>();
    for (Unit unit : dominance.reachable()) {
      Optional<Unit> idom = dominance.immediateDominator(unit);
      if (!idom.isPresent()) {
        continue;
      }
      @Nullable Unit armEntry;
      if (idom.get() == head) {
        armEntry = arms.containsKey(unit) ? unit : null;
      } else {
        armEntry = armEntryOf.get(idom.get());
      }
      if (armEntry != null) {
        armEntryOf.put(unit, armEntry);
      }
    }
    Set<Unit> tail = new LinkedHashSet<>();
    for (Unit unit : remaining) {
      @Nullable Unit armEntry = armEntryOf.get(unit);
      if (armEntry != null) {
        arms.get(armEntry).add(unit);
      } else {
        tail.add(unit);
      }
    }
    List<Unit> tailHeaders =
        Seq.seq(tail)
            .filter(u -> Seq.seq(predecessorsOf.get(u)).anyMatch(p -> !tail.contains(p)))
            .sorted(u -> u.ordinal)
            .toList();
    if (tailHeaders.isEmpty()) {
      throw new InternalInvariantError("Branch tail is never entered", view.labelsOf(tail));
    }

    Unit tailEntry;
    ControlVariable tailVariable = null;
    if (tailHeaders.size() == 1) {
      tailEntry = tailHeaders.get(0);
      if (!merge.isPresent() || merge.get() != tailEntry) {
        throw new InternalInvariantError(
            "Tail entry " + tailEntry + " is not the merge point of " + head.entry,
            view.labelsOf(tail));
      }
      if (successors.contains(tailEntry)) {
        String fill = graph.addPassThrough(BlockKind.SYNTHETIC_FILL, tailEntry.entry);
        view.redirect(head, tailEntry.entry, fill);
        Unit arm = view.addBlock(fill);
        scope.add(arm);
        arms.put(arm, new LinkedHashSet<>(ImmutableList.of(arm)));
      }
    } else {
      tailVariable = ctx.allocator.allocate(ControlVariable.Purpose.TAIL);
      String dispatch =
          graph.addDispatch(
              BlockKind.SYNTHETIC_HEAD,
              tailVariable,
              Seq.seq(tailHeaders).map(u -> u.entry).toList());
      tailEntry = view.addBlock(dispatch);
      scope.add(tailEntry);
      for (int j = 0; j < tailHeaders.size(); j++) {
        Unit tailHeader = tailHeaders.get(j);
        // Redirecting one header never changes the predecessors of another.
        for (Unit pred : predecessorsOf.get(tailHeader)) {
          if (tail.contains(pred)) {
            continue;
          }
          String assignment = graph.addAssignment(ImmutableMap.of(tailVariable, j), dispatch);
          view.redirect(pred, tailHeader.entry, assignment);
          Unit unit = view.addBlock(assignment);
          scope.add(unit);
          if (pred == head) {
            arms.put(unit, new LinkedHashSet<>(ImmutableList.of(unit)));
          } else {
            arms.get(armEntryOf.get(pred)).add(unit);
          }
        }
      }
      Set<Unit> newTail = new LinkedHashSet<>();
      newTail.add(tailEntry);
      newTail.addAll(tail);
      tail.clear();
      tail.addAll(newTail);
    }

    for (Set<Unit> arm : arms.values()) {
      closeArm(view, scope, arm, tailEntry);
    }
    checkProgress(view, original, arms.values(), tail);
    LOGGER.debug(
        "Branch at {}: {} arm(s), tail entered at {}", head.entry, arms.size(), tailEntry.entry);

    Map<Unit, Region> armRegions = new LinkedHashMap<>();
    for (Map.Entry<Unit, Set<Unit>> arm : arms.entrySet()) {
      ctx.allocator.openScope();
      armRegions.put(arm.getKey(), decompose(view, arm.getValue(), arm.getKey()));
      ctx.allocator.closeScope();
    }
    return new PendingBranch(chain, scope, armRegions, tail, tailEntry, tailVariable);
  }

  /** Builds the branch region of {@code branch} once its tail is structured. */
  private Region complete(View view, PendingBranch branch, Region tailRegion) {
    ImmutableSortedMap.Builder<Integer, Region> byDiscriminant = ImmutableSortedMap.naturalOrder();
    for (Edge edge : ctx.graph.forwardEdges(branch.head.entry)) {
      @Nullable Region arm = branch.armRegions.get(view.unitOf(edge.target));
      if (arm == null) {
        throw new InternalInvariantError(
            "Edge " + edge + " does not lead into an arm", view.labelsOf(branch.scope));
      }
      byDiscriminant.put(edge.discriminant.orElse(0), arm);
    }
    Region.Branch region =
        new Region.Branch(linear(branch.chain), byDiscriminant.build(), tailRegion);
    if (branch.tailVariable != null) {
      ctx.allocator.assign(region, branch.tailVariable);
    }
    return region;
  }

  /** Joins the edges leaving {@code arm} in a synthetic tail block if several units leave it. */
  private void closeArm(View view, Set<Unit> scope, Set<Unit> arm, Unit tailEntry) {
    List<Unit> exiting =
        Seq.seq(arm)
            .filter(u -> Seq.seq(view.successors(u, scope)).anyMatch(s -> !arm.contains(s)))
            .toList();
    if (exiting.size() <= 1) {
      return;
    }
    String join = ctx.graph.addPassThrough(BlockKind.SYNTHETIC_TAIL, tailEntry.entry);
    for (Unit unit : exiting) {
      view.redirect(unit, tailEntry.entry, join);
    }
    Unit unit = view.addBlock(join);
    scope.add(unit);
    arm.add(unit);
  }

  /** Every part must hold fewer of the units that existed before this step than the whole did. */
  private static void checkProgress(
      View view, Set<Unit> original, Collection<Set<Unit>> arms, Set<Unit> tail) {
    List<Set<Unit>> parts = new ArrayList<>(arms);
    parts.add(tail);
    for (Set<Unit> part : parts) {
      long old = Seq.seq(part).filter(original::contains).count();
      if (part.isEmpty() || old >= original.size()) {
        throw new InternalInvariantError("Branch did not shrink its region", view.labelsOf(part));
      }
    }
  }

  private static Region linear(List<Unit> chain) {
    return new Region.Linear(Seq.seq(chain).map(Unit::materialize).toList());
  }
}
