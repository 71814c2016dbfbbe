package scfg.region;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

public class Regions {

  /**
   * The label of the block through which control enters {@code node}.
   *
   * @throws IllegalArgumentException for an empty {@link Region.Linear}
   */
  public static String entryLabel(RegionNode node) {
    RegionNode current = node;
    while (!(current instanceof BlockNode)) {
      current =
          ((Region) current)
              .match(
                  linear -> {
                    if (linear.isEmpty()) {
                      throw new IllegalArgumentException("An empty region has no entry");
                    }
                    return linear.children.get(0);
                  },
                  branch -> branch.head,
                  loop -> loop.header);
    }
    return ((BlockNode) current).label;
  }

  /** Only an empty {@link Region.Linear} is empty. */
  public static boolean isEmpty(RegionNode node) {
    return node instanceof Region.Linear && ((Region.Linear) node).isEmpty();
  }

  /**
   * The labels of all leaves below {@code node} in execution order of a depth-first walk: heads
   * before arms before tails, headers before bodies. Shared arms are listed once.
   */
  public static ImmutableList<String> leaves(RegionNode node) {
    ImmutableList.Builder<String> leaves = ImmutableList.builder();
    Deque<RegionNode> stack = new ArrayDeque<>();
    stack.push(node);
    while (!stack.isEmpty()) {
      RegionNode current = stack.pop();
      if (current instanceof BlockNode) {
        leaves.add(((BlockNode) current).label);
        continue;
      }
      List<RegionNode> children =
          ((Region) current)
              .match(
                  linear -> linear.children,
                  branch ->
                      ImmutableList.<RegionNode>builder()
                          .add(branch.head)
                          .addAll(branch.distinctArms())
                          .add(branch.tail)
                          .build(),
                  loop -> ImmutableList.<RegionNode>of(loop.header, loop.body));
      for (RegionNode child : Lists.reverse(children)) {
        stack.push(child);
      }
    }
    return leaves.build();
  }
}
