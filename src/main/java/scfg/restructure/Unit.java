package scfg.restructure;

import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableSet;
import java.util.Set;
import java.util.function.Supplier;
import org.jetbrains.annotations.Nullable;
import scfg.region.BlockNode;
import scfg.region.Region;
import scfg.region.RegionNode;

/**
 * A node of the acyclic graph the branch pass decomposes: a single block, or a folded loop that is
 * treated as one node. Compared by identity.
 */
final class Unit {
  final String entry;
  final ImmutableSet<String> members;
  /** Smallest ordinal of the members. */
  final int ordinal;

  @Nullable private final Supplier<Region.Loop> loop;

  private Unit(
      String entry, Set<String> members, int ordinal, @Nullable Supplier<Region.Loop> loop) {
    this.entry = entry;
    this.members = ImmutableSet.copyOf(members);
    this.ordinal = ordinal;
    this.loop = loop;
  }

  static Unit block(String label, int ordinal) {
    return new Unit(label, ImmutableSet.of(label), ordinal, null);
  }

  /** The loop region is built on first use and only once. */
  static Unit loop(String header, Set<String> members, int ordinal, Supplier<Region.Loop> build) {
    return new Unit(header, members, ordinal, Suppliers.memoize(build::get));
  }

  boolean isLoop() {
    return loop != null;
  }

  RegionNode materialize() {
    if (loop == null) {
      return new BlockNode(entry);
    }
    return loop.get();
  }

  @Override
  public String toString() {
    return isLoop() ? "loop@" + entry + members : entry;
  }
}
