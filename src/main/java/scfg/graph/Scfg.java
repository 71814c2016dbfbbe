package scfg.graph;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.jooq.lambda.Seq;
import scfg.utils.GraphUtils;
import scfg.utils.Worklist;

/**
 * An immutable structured control-flow graph: blocks in declaration order, a single entry and a set
 * of exit blocks.
 *
 * <p>Every instance satisfies the following: all labels are reachable from the entry, every edge
 * connects declared blocks, exits and only exits have no outgoing edges, blocks with more than one
 * edge tag each of them with a distinct discriminant, and every block reaches some exit.
 */
public final class Scfg {
  private final ImmutableMap<String, Block> blocks;
  private final String entry;
  private final ImmutableSet<String> exits;
  private final ImmutableListMultimap<String, String> predecessors;

  private Scfg(ImmutableMap<String, Block> blocks, String entry, ImmutableSet<String> exits) {
    this.blocks = blocks;
    this.entry = entry;
    this.exits = exits;
    ImmutableListMultimap.Builder<String, String> preds = ImmutableListMultimap.builder();
    for (Block block : blocks.values()) {
      for (String target : block.targets()) {
        preds.put(target, block.label);
      }
    }
    this.predecessors = preds.build();
  }

  /**
   * Builds and validates a graph.
   *
   * @param labels the block labels, in the order that breaks ties during restructuring
   * @param edges the edges; per source block their order is kept
   * @throws MalformedGraphError if the result would violate any of the graph invariants
   */
  public static Scfg of(
      List<String> labels, List<Edge> edges, String entry, Collection<String> exits) {
    Set<String> declared = new LinkedHashSet<>();
    for (String label : labels) {
      if (!declared.add(label)) {
        throw new MalformedGraphError("Duplicate block label", ImmutableList.of(label));
      }
    }
    if (declared.isEmpty()) {
      throw new MalformedGraphError("Graph has no blocks", ImmutableList.of());
    }
    if (!declared.contains(entry)) {
      throw new MalformedGraphError("Entry is not a block", ImmutableList.of(entry));
    }
    if (exits.isEmpty()) {
      throw new MalformedGraphError("Graph has no exit", ImmutableList.of());
    }
    List<String> undeclaredExits = Seq.seq(exits).filter(e -> !declared.contains(e)).toList();
    if (!undeclaredExits.isEmpty()) {
      throw new MalformedGraphError("Exit is not a block", undeclaredExits);
    }

    ListMultimap<String, Edge> outgoing = LinkedListMultimap.create();
    for (Edge edge : edges) {
      if (!declared.contains(edge.source) || !declared.contains(edge.target)) {
        throw new MalformedGraphError(
            "Edge " + edge + " references an unknown block",
            Seq.of(edge.source, edge.target).filter(l -> !declared.contains(l)).toList());
      }
      outgoing.put(edge.source, edge);
    }

    ImmutableMap.Builder<String, Block> blocks = ImmutableMap.builder();
    for (String label : declared) {
      List<Edge> out = outgoing.get(label);
      boolean isExit = exits.contains(label);
      if (isExit && !out.isEmpty()) {
        throw new MalformedGraphError("Exit has outgoing edges", ImmutableList.of(label));
      }
      if (!isExit && out.isEmpty()) {
        throw new MalformedGraphError(
            "Block has no outgoing edges but is not an exit", ImmutableList.of(label));
      }
      if (out.size() > 1) {
        checkDiscriminants(label, out);
      }
      blocks.put(label, Block.original(label, ImmutableList.copyOf(out)));
    }

    Scfg scfg = new Scfg(blocks.build(), entry, ImmutableSet.copyOf(exits));
    scfg.checkReachability();
    return scfg;
  }

  private static void checkDiscriminants(String label, List<Edge> out) {
    Set<Integer> seen = new HashSet<>();
    for (Edge edge : out) {
      if (!edge.discriminant.isPresent()) {
        throw new MalformedGraphError(
            "Edge " + edge + " of a multi-way block has no discriminant", ImmutableList.of(label));
      }
      if (!seen.add(edge.discriminant.get())) {
        throw new MalformedGraphError(
            "Discriminant " + edge.discriminant.get() + " is used twice", ImmutableList.of(label));
      }
    }
  }

  private void checkReachability() {
    Set<String> reachable = GraphUtils.reachable(entry, l -> blocks.get(l).targets());
    List<String> unreachable =
        Seq.seq(blocks.keySet()).filter(l -> !reachable.contains(l)).toList();
    if (!unreachable.isEmpty()) {
      throw new MalformedGraphError("Blocks are unreachable from the entry", unreachable);
    }

    Set<String> reachesExit = Worklist.closure(exits, predecessors::get);
    List<String> stuck = Seq.seq(blocks.keySet()).filter(l -> !reachesExit.contains(l)).toList();
    if (!stuck.isEmpty()) {
      throw new MalformedGraphError("Blocks cannot reach any exit", stuck);
    }
  }

  public String entry() {
    return entry;
  }

  public ImmutableSet<String> exits() {
    return exits;
  }

  public boolean isExit(String label) {
    return exits.contains(label);
  }

  /** All labels in declaration order. */
  public ImmutableList<String> labels() {
    return blocks.keySet().asList();
  }

  public ImmutableMap<String, Block> blocks() {
    return blocks;
  }

  public Block block(String label) {
    Block block = blocks.get(label);
    if (block == null) {
      throw new IllegalArgumentException("No block labelled " + label);
    }
    return block;
  }

  /** The outgoing edges of {@code label}, in declaration order. */
  public ImmutableList<Edge> successors(String label) {
    return block(label).edges;
  }

  /** The distinct predecessors of {@code label}, in declaration order. */
  public ImmutableList<String> predecessors(String label) {
    return predecessors.get(label);
  }

  public int size() {
    return blocks.size();
  }

  @Override
  public String toString() {
    return "Scfg(entry="
        + entry
        + ", exits="
        + exits
        + ", blocks=["
        + Joiner.on("; ").join(blocks.values())
        + "])";
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Collects blocks and edges. Unless set explicitly, the entry is the first block and the exits
   * are the blocks without outgoing edges.
   */
  public static final class Builder {
    private final List<String> labels = new ArrayList<>();
    private final List<Edge> edges = new ArrayList<>();
    private final Set<String> exits = new LinkedHashSet<>();
    @Nullable private String entry;

    private Builder() {}

    /**
     * Declares a block with edges to {@code targets}. If there are at least two targets, the i-th
     * edge gets discriminant i.
     */
    public Builder block(String label, String... targets) {
      labels.add(label);
      if (targets.length == 1) {
        edges.add(Edge.unconditional(label, targets[0]));
      } else {
        for (int i = 0; i < targets.length; i++) {
          edges.add(Edge.conditional(label, targets[i], i));
        }
      }
      return this;
    }

    public Builder edge(String source, String target, int discriminant) {
      edges.add(Edge.conditional(source, target, discriminant));
      return this;
    }

    public Builder edge(String source, String target) {
      edges.add(Edge.unconditional(source, target));
      return this;
    }

    public Builder entry(String label) {
      this.entry = label;
      return this;
    }

    public Builder exit(String... labels) {
      exits.addAll(Arrays.asList(labels));
      return this;
    }

    public Scfg build() {
      if (labels.isEmpty()) {
        throw new MalformedGraphError("Graph has no blocks", ImmutableList.of());
      }
      String entryLabel = Optional.ofNullable(entry).orElse(labels.get(0));
      Set<String> exitLabels = exits;
      if (exitLabels.isEmpty()) {
        Set<String> sources = Seq.seq(edges).map(e -> e.source).toSet();
        exitLabels =
            Seq.seq(labels)
                .filter(l -> !sources.contains(l))
                .toCollection(LinkedHashSet::new);
      }
      return Scfg.of(labels, edges, entryLabel, exitLabels);
    }
  }
}
