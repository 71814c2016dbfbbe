package scfg.control;

import java.util.Objects;

/**
 * A synthetic integer variable that routes control through dispatch blocks. Written by assignment
 * blocks, read by exactly one kind of dispatch.
 */
public final class ControlVariable {

  public enum Purpose {
    /** Selects one of several loop headers. */
    HEADER,
    /** 0 continues a loop, 1 leaves it. */
    BACKEDGE,
    /** Selects one of several loop exit targets. */
    EXIT,
    /** Selects one of several entries into the tail of a branch. */
    TAIL
  }

  public final int id;
  public final Purpose purpose;

  public ControlVariable(int id, Purpose purpose) {
    this.id = id;
    this.purpose = purpose;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ControlVariable that = (ControlVariable) o;
    return id == that.id && purpose == that.purpose;
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, purpose);
  }

  @Override
  public String toString() {
    return "cv" + id;
  }
}
