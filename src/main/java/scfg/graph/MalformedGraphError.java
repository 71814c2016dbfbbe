package scfg.graph;

import java.util.Collection;
import scfg.RestructuringError;

/** Raised while building an {@link Scfg} that violates one of the graph invariants. */
public class MalformedGraphError extends RestructuringError {

  public MalformedGraphError(String message, Collection<String> labels) {
    super(message, labels);
  }
}
