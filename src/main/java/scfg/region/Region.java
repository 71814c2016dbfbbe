package scfg.region;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Sets;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import scfg.control.ControlVariable;

/**
 * A single-entry single-exit region. Regions compare by identity: two structurally equal regions
 * at different places of a tree are different regions. Compare trees by their printed form.
 */
public interface Region extends RegionNode {

  /** Poor man's ADT. */
  <T> T match(
      Function<Linear, T> matchLinear,
      Function<Branch, T> matchBranch,
      Function<Loop, T> matchLoop);

  /** Children executed one after the other. Only a loop body may be empty. */
  final class Linear implements Region {
    public final ImmutableList<RegionNode> children;

    public Linear(List<? extends RegionNode> children) {
      this.children = ImmutableList.copyOf(children);
    }

    public static Linear empty() {
      return new Linear(ImmutableList.of());
    }

    public boolean isEmpty() {
      return children.isEmpty();
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitLinear(this);
    }

    @Override
    public <T> T match(
        Function<Linear, T> matchLinear,
        Function<Branch, T> matchBranch,
        Function<Loop, T> matchLoop) {
      return matchLinear.apply(this);
    }
  }

  /**
   * A head region whose last block selects one of the arms by discriminant; all arms continue at
   * the entry of the tail. Several discriminants may share one arm.
   */
  final class Branch implements Region {
    public final Region head;
    public final ImmutableSortedMap<Integer, Region> arms;
    public final Region tail;

    public Branch(Region head, ImmutableSortedMap<Integer, Region> arms, Region tail) {
      this.head = head;
      this.arms = arms;
      this.tail = tail;
    }

    /** The arms without repetitions, in order of their smallest discriminant. */
    public ImmutableList<Region> distinctArms() {
      Set<Region> seen = Sets.newIdentityHashSet();
      ImmutableList.Builder<Region> distinct = ImmutableList.builder();
      for (Region arm : arms.values()) {
        if (seen.add(arm)) {
          distinct.add(arm);
        }
      }
      return distinct.build();
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitBranch(this);
    }

    @Override
    public <T> T match(
        Function<Linear, T> matchLinear,
        Function<Branch, T> matchBranch,
        Function<Loop, T> matchLoop) {
      return matchBranch.apply(this);
    }
  }

  /**
   * A loop. The header runs first; if it ends in a backedge the loop repeats, if it ends in an edge
   * to the body's entry the body runs and ends in a backedge, otherwise the loop is left.
   */
  final class Loop implements Region {
    public final Region header;
    public final Region body;
    /** Selects the exit target after leaving the loop, if there is more than one. */
    public final Optional<ControlVariable> exitVariable;
    /**
     * Maps the value of the exit variable, or without one the discriminant of the exiting edge, to
     * the block control continues at after the loop.
     */
    public final ImmutableSortedMap<Integer, String> exits;

    public Loop(
        Region header,
        Region body,
        Optional<ControlVariable> exitVariable,
        ImmutableSortedMap<Integer, String> exits) {
      this.header = header;
      this.body = body;
      this.exitVariable = exitVariable;
      this.exits = exits;
    }

    @Override
    public <T> T acceptVisitor(Visitor<T> visitor) {
      return visitor.visitLoop(this);
    }

    @Override
    public <T> T match(
        Function<Linear, T> matchLinear,
        Function<Branch, T> matchBranch,
        Function<Loop, T> matchLoop) {
      return matchLoop.apply(this);
    }
  }
}
