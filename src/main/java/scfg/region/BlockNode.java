package scfg.region;

/** Leaf of the region tree, referring to a block by its label. */
public final class BlockNode implements RegionNode {
  public final String label;

  public BlockNode(String label) {
    this.label = label;
  }

  @Override
  public <T> T acceptVisitor(Visitor<T> visitor) {
    return visitor.visitBlock(this);
  }

  @Override
  public String toString() {
    return label;
  }
}
