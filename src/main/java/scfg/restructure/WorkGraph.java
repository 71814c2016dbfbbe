package scfg.restructure;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.jooq.lambda.Seq;
import scfg.control.ControlVariable;
import scfg.control.LabelSupply;
import scfg.graph.Block;
import scfg.graph.BlockKind;
import scfg.graph.Edge;
import scfg.graph.Scfg;

/**
 * The mutable graph restructuring works on. Blocks are only ever added or re-targeted, never
 * removed. Every block has an ordinal: original blocks are numbered in declaration order, synthetic
 * ones after them in creation order. Ordinals break all ties, which keeps the result
 * deterministic.
 *
 * <p>Edges marked as backedges are invisible to {@link #forwardEdges(String)}: once a loop is
 * folded, its interior is acyclic as far as the passes are concerned.
 */
final class WorkGraph {

  private static final class Node {
    final String label;
    final int ordinal;
    final BlockKind kind;
    final List<Edge> edges = new ArrayList<>();
    final Set<String> backedges = new LinkedHashSet<>();
    final Map<ControlVariable, Integer> assignments = new LinkedHashMap<>();
    @Nullable ControlVariable dispatch;

    Node(String label, int ordinal, BlockKind kind) {
      this.label = label;
      this.ordinal = ordinal;
      this.kind = kind;
    }
  }

  private final Map<String, Node> nodes = new LinkedHashMap<>();
  private final LabelSupply labels;

  private WorkGraph(LabelSupply labels) {
    this.labels = labels;
  }

  static WorkGraph copyOf(Scfg scfg) {
    WorkGraph graph = new WorkGraph(new LabelSupply(scfg.labels()));
    for (String label : scfg.labels()) {
      graph.put(label, BlockKind.ORIGINAL);
    }
    for (String label : scfg.labels()) {
      graph.node(label).edges.addAll(scfg.successors(label));
    }
    return graph;
  }

  private Node put(String label, BlockKind kind) {
    Node node = new Node(label, nodes.size(), kind);
    nodes.put(label, node);
    return node;
  }

  private Node node(String label) {
    Node node = nodes.get(label);
    if (node == null) {
      throw new IllegalArgumentException("No block labelled " + label);
    }
    return node;
  }

  /** Adds a synthetic block without edges and returns its fresh label. */
  String addBlock(BlockKind kind) {
    return put(labels.fresh(kind), kind).label;
  }

  void addEdge(String source, String target, Optional<Integer> discriminant) {
    node(target);
    node(source).edges.add(new Edge(source, target, discriminant));
  }

  /** A block of {@code kind} with a single edge to {@code target}. */
  String addPassThrough(BlockKind kind, String target) {
    String label = addBlock(kind);
    addEdge(label, target, Optional.empty());
    return label;
  }

  /** An assignment block writing {@code values}, then continuing at {@code target}. */
  String addAssignment(Map<ControlVariable, Integer> values, String target) {
    String label = addPassThrough(BlockKind.SYNTHETIC_ASSIGNMENT, target);
    node(label).assignments.putAll(values);
    return label;
  }

  /** A block of {@code kind} that continues at {@code targets[v]} if {@code variable} is v. */
  String addDispatch(BlockKind kind, ControlVariable variable, List<String> targets) {
    String label = addBlock(kind);
    node(label).dispatch = variable;
    for (int i = 0; i < targets.size(); i++) {
      addEdge(label, targets.get(i), Optional.of(i));
    }
    return label;
  }

  /**
   * Points every edge from {@code source} to {@code oldTarget} at {@code newTarget} instead. Edge
   * order and discriminants stay the same.
   *
   * @return the number of re-targeted edges
   */
  int redirect(String source, String oldTarget, String newTarget) {
    node(newTarget);
    List<Edge> edges = node(source).edges;
    int redirected = 0;
    for (int i = 0; i < edges.size(); i++) {
      if (edges.get(i).target.equals(oldTarget)) {
        edges.set(i, edges.get(i).withTarget(newTarget));
        redirected++;
      }
    }
    return redirected;
  }

  void markBackedge(String source, String target) {
    node(source).backedges.add(target);
  }

  /** Outgoing edges that are not backedges, in edge order. */
  List<Edge> forwardEdges(String label) {
    Node node = node(label);
    return Seq.seq(node.edges).filter(e -> !node.backedges.contains(e.target)).toList();
  }

  /** Distinct targets of the forward edges, ordered by discriminant. */
  List<String> forwardTargets(String label) {
    return Seq.seq(forwardEdges(label))
        .sorted(e -> e.discriminant.orElse(Integer.MIN_VALUE))
        .map(e -> e.target)
        .distinct()
        .toList();
  }

  /** Whether some forward edge leads from {@code source} to {@code target}. */
  boolean hasForwardEdge(String source, String target) {
    return forwardTargets(source).contains(target);
  }

  int ordinal(String label) {
    return node(label).ordinal;
  }

  int size() {
    return nodes.size();
  }

  /** All labels in ordinal order. */
  ImmutableList<String> labels() {
    return ImmutableList.copyOf(nodes.keySet());
  }

  Comparator<String> byOrdinal() {
    return Comparator.comparingInt(this::ordinal);
  }

  ImmutableMap<String, Block> snapshot() {
    ImmutableMap.Builder<String, Block> blocks = ImmutableMap.builder();
    for (Node node : nodes.values()) {
      blocks.put(
          node.label,
          new Block(
              node.label,
              node.kind,
              ImmutableList.copyOf(node.edges),
              ImmutableSet.copyOf(node.backedges),
              ImmutableMap.copyOf(node.assignments),
              Optional.ofNullable(node.dispatch)));
    }
    return blocks.build();
  }
}
