package scfg.restructure;

import com.google.common.base.Preconditions;
import scfg.EnvVar;

/** Tuning knobs of {@link RegionTreeBuilder}. Defaults come from the environment. */
public final class RestructuringOptions {
  public static final int DEFAULT_ROUND_FACTOR = 8;

  public final int roundFactor;
  /** Log every produced tree at info level. */
  public final boolean dumpTree;

  private RestructuringOptions(Builder builder) {
    this.roundFactor = builder.roundFactor;
    this.dumpTree = builder.dumpTree;
  }

  /**
   * The maximal number of structuring rounds for a graph of {@code blocks} blocks: {@code
   * roundFactor * (blocks + 1)^2}.
   */
  public long roundBound(int blocks) {
    return (long) roundFactor * (blocks + 1) * (blocks + 1);
  }

  public static RestructuringOptions defaults() {
    return builder().build();
  }

  /** Reads {@link EnvVar#SCFG_ROUND_FACTOR} and {@link EnvVar#SCFG_DUMP}. */
  public static RestructuringOptions fromEnvironment() {
    return builder()
        .roundFactor(EnvVar.SCFG_ROUND_FACTOR.intValue(DEFAULT_ROUND_FACTOR))
        .dumpTree(EnvVar.SCFG_DUMP.isSetToOne())
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder().roundFactor(roundFactor).dumpTree(dumpTree);
  }

  public static final class Builder {
    private int roundFactor = DEFAULT_ROUND_FACTOR;
    private boolean dumpTree = false;

    private Builder() {}

    public Builder roundFactor(int roundFactor) {
      Preconditions.checkArgument(roundFactor >= 0, "roundFactor must not be negative");
      this.roundFactor = roundFactor;
      return this;
    }

    public Builder dumpTree(boolean dumpTree) {
      this.dumpTree = dumpTree;
      return this;
    }

    public RestructuringOptions build() {
      return new RestructuringOptions(this);
    }
  }
}
