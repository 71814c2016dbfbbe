package scfg.region;

import com.google.common.base.Joiner;
import java.util.Map;
import org.jooq.lambda.Seq;

/**
 * Prints a region tree as a single-line s-expression, e.g. {@code (branch (linear a) {0: (linear
 * b), 1: (linear c)} (linear d))}. The output only depends on the structure of the tree, so equal
 * output means equal trees.
 *
 * <p>Loops print as {@code (loop header body [exitVariable] {value: target, ...})}; the exit
 * variable is only printed if there is one.
 */
public class RegionPrinter implements RegionNode.Visitor<CharSequence> {

  public RegionPrinter() {}

  public static String print(RegionNode node) {
    return node.acceptVisitor(new RegionPrinter()).toString();
  }

  @Override
  public CharSequence visitBlock(BlockNode that) {
    return that.label;
  }

  @Override
  public CharSequence visitLinear(Region.Linear that) {
    StringBuilder sb = new StringBuilder("(linear");
    for (RegionNode child : that.children) {
      sb.append(" ").append(child.acceptVisitor(this));
    }
    return sb.append(")");
  }

  @Override
  public CharSequence visitBranch(Region.Branch that) {
    StringBuilder sb = new StringBuilder("(branch ");
    sb.append(that.head.acceptVisitor(this)).append(" {");
    sb.append(
        Joiner.on(", ")
            .join(
                Seq.seq(that.arms.entrySet())
                    .map(arm -> arm.getKey() + ": " + arm.getValue().acceptVisitor(this))
                    .toList()));
    sb.append("} ").append(that.tail.acceptVisitor(this));
    return sb.append(")");
  }

  @Override
  public CharSequence visitLoop(Region.Loop that) {
    StringBuilder sb = new StringBuilder("(loop ");
    sb.append(that.header.acceptVisitor(this)).append(" ");
    sb.append(that.body.acceptVisitor(this)).append(" ");
    that.exitVariable.ifPresent(v -> sb.append("[").append(v).append("] "));
    sb.append("{");
    boolean first = true;
    for (Map.Entry<Integer, String> exit : that.exits.entrySet()) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      sb.append(exit.getKey()).append(": ").append(exit.getValue());
    }
    return sb.append("})");
  }
}
