package scfg.restructure;

import java.util.Collection;

/** Restructuring needed more rounds than {@link RestructuringOptions#roundBound(int)} allows. */
public class NonConvergenceError extends InternalInvariantError {
  public final long rounds;

  public NonConvergenceError(long rounds, long bound, Collection<String> labels) {
    super("No fixed point after " + rounds + " rounds (bound " + bound + ") while at", labels);
    this.rounds = rounds;
  }
}
