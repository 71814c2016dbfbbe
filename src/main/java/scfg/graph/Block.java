package scfg.graph;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Optional;
import org.jooq.lambda.Seq;
import scfg.control.ControlVariable;

/**
 * A basic block, identified by its label. Blocks carry no instructions; synthetic blocks may write
 * control variables ({@link #assignments}) or select their outgoing edge by the value of a control
 * variable ({@link #dispatchVariable}).
 */
public final class Block {
  public final String label;
  public final BlockKind kind;
  public final ImmutableList<Edge> edges;
  /** Targets of the outgoing edges that close a loop. */
  public final ImmutableSet<String> backedges;

  public final ImmutableMap<ControlVariable, Integer> assignments;
  public final Optional<ControlVariable> dispatchVariable;

  public Block(
      String label,
      BlockKind kind,
      ImmutableList<Edge> edges,
      ImmutableSet<String> backedges,
      ImmutableMap<ControlVariable, Integer> assignments,
      Optional<ControlVariable> dispatchVariable) {
    this.label = label;
    this.kind = kind;
    this.edges = edges;
    this.backedges = backedges;
    this.assignments = assignments;
    this.dispatchVariable = dispatchVariable;
  }

  public static Block original(String label, ImmutableList<Edge> edges) {
    return new Block(
        label, BlockKind.ORIGINAL, edges, ImmutableSet.of(), ImmutableMap.of(), Optional.empty());
  }

  public ImmutableList<String> targets() {
    return Seq.seq(edges).map(e -> e.target).distinct().collect(ImmutableList.toImmutableList());
  }

  public boolean isBackedge(Edge edge) {
    return edge.source.equals(label) && backedges.contains(edge.target);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(label);
    if (kind.isSynthetic()) {
      sb.append(" <").append(kind).append(">");
    }
    if (!assignments.isEmpty()) {
      sb.append(" ").append(Joiner.on(", ").withKeyValueSeparator(" = ").join(assignments));
    }
    dispatchVariable.ifPresent(v -> sb.append(" switch ").append(v));
    return sb.append(" ").append(edges).toString();
  }
}
