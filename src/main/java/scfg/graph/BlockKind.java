package scfg.graph;

public enum BlockKind {
  ORIGINAL(""),
  SYNTHETIC_ENTRY("synth_entry_"),
  SYNTHETIC_RETURN("synth_return_"),
  SYNTHETIC_ASSIGNMENT("synth_assign_"),
  /** Dispatches on a header or tail variable to the original entry blocks. */
  SYNTHETIC_HEAD("synth_head_"),
  /** Dispatches on a backedge variable: 0 loops back, 1 leaves the loop. */
  SYNTHETIC_LATCH("synth_latch_"),
  SYNTHETIC_EXIT("synth_exit_"),
  SYNTHETIC_TAIL("synth_tail_"),
  SYNTHETIC_FILL("synth_fill_"),
  SYNTHETIC_CONTINUE("synth_continue_");

  /** Label prefix of fresh blocks of this kind. */
  public final String prefix;

  BlockKind(String prefix) {
    this.prefix = prefix;
  }

  public boolean isSynthetic() {
    return this != ORIGINAL;
  }
}
