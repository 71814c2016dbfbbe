package scfg;

import com.google.common.collect.ImmutableSet;
import java.util.Collection;

/** Basic error class in this project. */
public class RestructuringError extends RuntimeException {

  /** Labels of the blocks the error is about, possibly empty. */
  public final ImmutableSet<String> labels;

  public RestructuringError(String message, Collection<String> labels) {
    super(message);
    this.labels = ImmutableSet.copyOf(labels);
  }

  public RestructuringError(String message) {
    this(message, ImmutableSet.of());
  }

  @Override
  public String getMessage() {
    if (labels.isEmpty()) {
      return super.getMessage();
    }
    return super.getMessage() + " " + labels;
  }
}
