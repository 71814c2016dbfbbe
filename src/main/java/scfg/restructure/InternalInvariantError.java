package scfg.restructure;

import java.util.Collection;
import scfg.RestructuringError;

/**
 * An invariant of the restructuring algorithm failed. This is a bug, never the fault of the input
 * graph; {@link #labels} names the blocks that were being restructured.
 */
public class InternalInvariantError extends RestructuringError {

  public InternalInvariantError(String message, Collection<String> labels) {
    super(message, labels);
  }
}
