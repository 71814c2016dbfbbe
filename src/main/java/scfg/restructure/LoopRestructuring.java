package scfg.restructure;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Iterables;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;
import org.jooq.lambda.Seq;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scfg.control.ControlVariable;
import scfg.graph.BlockKind;
import scfg.graph.Edge;
import scfg.region.Region;
import scfg.utils.GraphUtils;
import scfg.utils.StronglyConnectedComponents;

/**
 * Folds every cycle of a structuring level into a loop with a single header and a single exit
 * target. Three shapes are tried in turn:
 *
 * <ol>
 *   <li><em>latch</em>: the only block jumping back to the header is also the only block leaving
 *       the loop, and it does nothing else. It becomes the latch as is.
 *   <li><em>head-controlled</em>: the only exiting block chooses between leaving and a body that
 *       runs back to the header without touching the rest of the loop. The body is structured
 *       separately from the header part.
 *   <li><em>general</em>: every backedge and exit edge goes through an assignment block to a
 *       synthetic latch dispatching on a backedge variable; several headers are joined by a header
 *       variable, several exit targets are selected after the loop by an exit variable.
 * </ol>
 *
 * The first two shapes need no control variables.
 */
final class LoopRestructuring {
  private static final Logger LOGGER = LoggerFactory.getLogger("LoopRestructuring");

  enum Shape {
    LATCH,
    HEAD_CONTROLLED,
    GENERAL
  }

  /** A rewritten cycle, ready to be structured once the branch pass places it. */
  static final class FoldedLoop {
    final Shape shape;
    final String entry;
    final ImmutableSet<String> members;
    final ImmutableSet<String> headerPart;
    @Nullable final String bodyEntry;
    final ImmutableSet<String> bodyPart;
    @Nullable final ControlVariable headerVariable;
    @Nullable final ControlVariable backedgeVariable;
    @Nullable final ControlVariable exitVariable;
    /** The block whose edges leaving {@link #members} are the exits of the loop. */
    final String exitSource;

    FoldedLoop(
        Shape shape,
        String entry,
        Set<String> members,
        Set<String> headerPart,
        @Nullable String bodyEntry,
        Set<String> bodyPart,
        @Nullable ControlVariable headerVariable,
        @Nullable ControlVariable backedgeVariable,
        @Nullable ControlVariable exitVariable,
        String exitSource) {
      this.shape = shape;
      this.entry = entry;
      this.members = ImmutableSet.copyOf(members);
      this.headerPart = ImmutableSet.copyOf(headerPart);
      this.bodyEntry = bodyEntry;
      this.bodyPart = ImmutableSet.copyOf(bodyPart);
      this.headerVariable = headerVariable;
      this.backedgeVariable = backedgeVariable;
      this.exitVariable = exitVariable;
      this.exitSource = exitSource;
    }
  }

  /** What a cycle looks like from the outside, computed right before it is rewritten. */
  private static final class Cycle {
    final Set<String> members;
    final List<String> headers;
    final List<String> exiting;
    final List<String> exitTargets;
    final List<String> backSources;

    Cycle(
        Set<String> members,
        List<String> headers,
        List<String> exiting,
        List<String> exitTargets,
        List<String> backSources) {
      this.members = members;
      this.headers = headers;
      this.exiting = exiting;
      this.exitTargets = exitTargets;
      this.backSources = backSources;
    }
  }

  private final StructuringContext ctx;

  LoopRestructuring(StructuringContext ctx) {
    this.ctx = ctx;
  }

  /**
   * Folds all cycles among {@code scope}, the one with the smallest ordinal first. Blocks created
   * on the way are added to {@code scope}.
   */
  List<FoldedLoop> foldLoops(Set<String> scope) {
    WorkGraph graph = ctx.graph;
    ImmutableList<String> labels = ImmutableList.copyOf(scope);
    Set<String> within = new HashSet<>(labels);
    Function<String, List<String>> successors =
        l -> Seq.seq(graph.forwardTargets(l)).filter(within::contains).toList();
    List<ImmutableList<String>> cycles =
        Seq.seq(StronglyConnectedComponents.of(labels, successors))
            .filter(c -> StronglyConnectedComponents.isCyclic(c, successors))
            .map(c -> StructuringContext.sorted(c, graph))
            .sorted(c -> graph.ordinal(c.get(0)))
            .toList();

    List<FoldedLoop> folded = new ArrayList<>();
    for (List<String> members : cycles) {
      FoldedLoop loop = fold(scope, describe(scope, new LinkedHashSet<>(members)));
      LOGGER.debug(
          "Folded {} loop {} entered at {}, leaving from {}",
          loop.shape,
          loop.members,
          loop.entry,
          loop.exitSource);
      folded.add(loop);
    }
    return folded;
  }

  private Cycle describe(Set<String> scope, Set<String> members) {
    WorkGraph graph = ctx.graph;
    List<String> headers = new ArrayList<>();
    for (String label : scope) {
      if (members.contains(label)) {
        continue;
      }
      for (String target : graph.forwardTargets(label)) {
        if (members.contains(target) && !headers.contains(target)) {
          headers.add(target);
        }
      }
    }
    headers.sort(graph.byOrdinal());

    List<String> exiting = new ArrayList<>();
    Set<String> exitTargets = new LinkedHashSet<>();
    List<String> backSources = new ArrayList<>();
    for (String member : members) {
      List<String> targets = graph.forwardTargets(member);
      if (Seq.seq(targets).anyMatch(t -> !members.contains(t))) {
        exiting.add(member);
      }
      if (Seq.seq(targets).anyMatch(headers::contains)) {
        backSources.add(member);
      }
      Seq.seq(targets).filter(t -> !members.contains(t)).forEach(exitTargets::add);
    }
    if (headers.isEmpty() || exitTargets.isEmpty()) {
      throw new InternalInvariantError("Cycle without entry or without exit", members);
    }
    return new Cycle(members, headers, exiting, new ArrayList<>(exitTargets), backSources);
  }

  private FoldedLoop fold(Set<String> scope, Cycle cycle) {
    FoldedLoop loop = asLatchLoop(cycle);
    if (loop == null) {
      loop = asHeadControlledLoop(scope, cycle);
    }
    if (loop == null) {
      loop = asGeneralLoop(scope, cycle);
    }
    return loop;
  }

  @Nullable
  private FoldedLoop asLatchLoop(Cycle cycle) {
    if (cycle.headers.size() != 1
        || cycle.exiting.size() != 1
        || cycle.exitTargets.size() != 1
        || !cycle.backSources.equals(cycle.exiting)) {
      return null;
    }
    String header = cycle.headers.get(0);
    String latch = cycle.exiting.get(0);
    String exit = cycle.exitTargets.get(0);
    if (!ImmutableSet.copyOf(ctx.graph.forwardTargets(latch))
        .equals(ImmutableSet.of(header, exit))) {
      return null;
    }
    ctx.graph.markBackedge(latch, header);
    return new FoldedLoop(
        Shape.LATCH,
        header,
        cycle.members,
        cycle.members,
        null,
        ImmutableSet.of(),
        null,
        null,
        null,
        latch);
  }

  @Nullable
  private FoldedLoop asHeadControlledLoop(Set<String> scope, Cycle cycle) {
    if (cycle.headers.size() != 1 || cycle.exiting.size() != 1 || cycle.exitTargets.size() != 1) {
      return null;
    }
    WorkGraph graph = ctx.graph;
    String header = cycle.headers.get(0);
    String decision = cycle.exiting.get(0);
    String exit = cycle.exitTargets.get(0);
    List<String> targets = graph.forwardTargets(decision);
    if (targets.size() != 2 || !targets.contains(exit)) {
      return null;
    }
    String bodyEntry = targets.get(0).equals(exit) ? targets.get(1) : targets.get(0);
    if (bodyEntry.equals(header)) {
      return null;
    }

    Set<String> body =
        GraphUtils.reachable(
            bodyEntry,
            l ->
                Seq.seq(graph.forwardTargets(l))
                    .filter(t -> cycle.members.contains(t) && !t.equals(header))
                    .toList());
    if (body.contains(decision)) {
      return null;
    }
    Set<String> headerPart =
        Seq.seq(cycle.members).filter(l -> !body.contains(l)).toCollection(LinkedHashSet::new);
    for (String member : headerPart) {
      for (String target : graph.forwardTargets(member)) {
        boolean entersBody =
            body.contains(target) && !(member.equals(decision) && target.equals(bodyEntry));
        if (target.equals(header) || entersBody) {
          return null;
        }
      }
    }
    for (String member : body) {
      for (String target : graph.forwardTargets(member)) {
        boolean leavesBody = !body.contains(target) && !target.equals(header);
        if (target.equals(bodyEntry) || leavesBody) {
          return null;
        }
      }
    }

    Set<String> bodyPart = new LinkedHashSet<>(StructuringContext.sorted(body, graph));
    List<String> sources =
        Seq.seq(bodyPart).filter(l -> graph.hasForwardEdge(l, header)).toList();
    boolean singleLatch =
        sources.size() == 1
            && graph.forwardTargets(sources.get(0)).equals(ImmutableList.of(header));
    if (singleLatch) {
      graph.markBackedge(sources.get(0), header);
    } else {
      String join = graph.addPassThrough(BlockKind.SYNTHETIC_CONTINUE, header);
      for (String source : sources) {
        graph.redirect(source, header, join);
      }
      graph.markBackedge(join, header);
      bodyPart.add(join);
      scope.add(join);
    }

    Set<String> members = new LinkedHashSet<>(headerPart);
    members.addAll(bodyPart);
    return new FoldedLoop(
        Shape.HEAD_CONTROLLED,
        header,
        members,
        headerPart,
        bodyEntry,
        bodyPart,
        null,
        null,
        null,
        decision);
  }

  private FoldedLoop asGeneralLoop(Set<String> scope, Cycle cycle) {
    WorkGraph graph = ctx.graph;
    Set<String> members = new LinkedHashSet<>(cycle.members);
    List<String> headers = cycle.headers;

    ControlVariable headerVariable = null;
    String entry;
    if (headers.size() > 1) {
      headerVariable = ctx.allocator.allocate(ControlVariable.Purpose.HEADER);
      entry = graph.addDispatch(BlockKind.SYNTHETIC_HEAD, headerVariable, headers);
      members.add(entry);
      for (String pred : ImmutableList.copyOf(scope)) {
        if (cycle.members.contains(pred)) {
          continue;
        }
        for (String target : graph.forwardTargets(pred)) {
          int index = headers.indexOf(target);
          if (index >= 0) {
            String assignment =
                graph.addAssignment(ImmutableMap.of(headerVariable, index), entry);
            graph.redirect(pred, target, assignment);
            scope.add(assignment);
          }
        }
      }
    } else {
      entry = Iterables.getOnlyElement(headers);
    }

    ControlVariable backedgeVariable = ctx.allocator.allocate(ControlVariable.Purpose.BACKEDGE);
    List<String> exitTargets = cycle.exitTargets;
    ControlVariable exitVariable = null;
    String continuation;
    if (exitTargets.size() > 1) {
      exitVariable = ctx.allocator.allocate(ControlVariable.Purpose.EXIT);
      continuation = graph.addDispatch(BlockKind.SYNTHETIC_EXIT, exitVariable, exitTargets);
      scope.add(continuation);
    } else {
      continuation = exitTargets.get(0);
    }
    String latch =
        graph.addDispatch(
            BlockKind.SYNTHETIC_LATCH, backedgeVariable, ImmutableList.of(entry, continuation));
    graph.markBackedge(latch, entry);
    members.add(latch);

    for (String member : cycle.members) {
      for (String target : graph.forwardTargets(member)) {
        Map<ControlVariable, Integer> values = new LinkedHashMap<>();
        int header = headers.indexOf(target);
        if (header >= 0) {
          values.put(backedgeVariable, 0);
          if (headerVariable != null) {
            values.put(headerVariable, header);
          }
        } else if (!cycle.members.contains(target)) {
          values.put(backedgeVariable, 1);
          if (exitVariable != null) {
            values.put(exitVariable, exitTargets.indexOf(target));
          }
        } else {
          continue;
        }
        String assignment = graph.addAssignment(values, latch);
        graph.redirect(member, target, assignment);
        members.add(assignment);
      }
    }
    scope.addAll(members);

    return new FoldedLoop(
        Shape.GENERAL,
        entry,
        members,
        members,
        null,
        ImmutableSet.of(),
        headerVariable,
        backedgeVariable,
        exitVariable,
        exitVariable != null ? continuation : latch);
  }

  /**
   * Discriminants of the edges from {@code block} that leave {@code members}, keyed by the value
   * that selects them. Read when the loop region is built, so later redirects are reflected.
   */
  private ImmutableSortedMap<Integer, String> exitsOf(String block, Set<String> members) {
    ImmutableSortedMap.Builder<Integer, String> exits = ImmutableSortedMap.naturalOrder();
    for (Edge edge : ctx.graph.forwardEdges(block)) {
      if (!members.contains(edge.target)) {
        exits.put(edge.discriminant.orElse(0), edge.target);
      }
    }
    return exits.build();
  }

  /** Structures the parts of a folded loop, each as a level of its own. */
  Region.Loop materialize(FoldedLoop loop) {
    Region header = ctx.structure(loop.headerPart, loop.entry);
    Region body =
        loop.bodyEntry == null
            ? Region.Linear.empty()
            : ctx.structure(loop.bodyPart, loop.bodyEntry);
    Region.Loop region =
        new Region.Loop(
            header,
            body,
            Optional.ofNullable(loop.exitVariable),
            exitsOf(loop.exitSource, loop.members));
    if (loop.backedgeVariable != null) {
      ctx.allocator.assign(region, loop.backedgeVariable);
    }
    return region;
  }
}
