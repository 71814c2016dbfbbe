package scfg.region;

/** A node of the region tree: either a single block or a nested {@link Region}. */
public interface RegionNode {

  <T> T acceptVisitor(Visitor<T> visitor);

  interface Visitor<T> {

    T visitBlock(BlockNode that);

    T visitLinear(Region.Linear that);

    T visitBranch(Region.Branch that);

    T visitLoop(Region.Loop that);
  }
}
