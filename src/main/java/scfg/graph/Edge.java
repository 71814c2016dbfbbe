package scfg.graph;

import java.util.Objects;
import java.util.Optional;

/**
 * A directed control-flow edge. Edges leaving a block with more than one edge are tagged with the
 * discriminant that selects them.
 */
public final class Edge {
  public final String source;
  public final String target;
  public final Optional<Integer> discriminant;

  public Edge(String source, String target, Optional<Integer> discriminant) {
    this.source = source;
    this.target = target;
    this.discriminant = discriminant;
  }

  public static Edge unconditional(String source, String target) {
    return new Edge(source, target, Optional.empty());
  }

  public static Edge conditional(String source, String target, int discriminant) {
    return new Edge(source, target, Optional.of(discriminant));
  }

  /** The same edge with a different target; the discriminant is kept. */
  public Edge withTarget(String newTarget) {
    return new Edge(source, newTarget, discriminant);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Edge edge = (Edge) o;
    return source.equals(edge.source)
        && target.equals(edge.target)
        && discriminant.equals(edge.discriminant);
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, target, discriminant);
  }

  @Override
  public String toString() {
    return discriminant
        .map(d -> source + " -" + d + "-> " + target)
        .orElse(source + " -> " + target);
  }
}
