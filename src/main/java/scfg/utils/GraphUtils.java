package scfg.utils;

import static org.jooq.lambda.tuple.Tuple.tuple;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import org.jooq.lambda.tuple.Tuple2;

public class GraphUtils {

  /**
   * Walks all nodes reachable via {@code successors} from {@code seed} and calls {@code onDiscover}
   * and {@code onFinish} in preorder resp. postorder. Successors are visited in the order the
   * function returns them.
   *
   * @param seed Seed of the depth-first traversal
   * @param onDiscover Called with reachable nodes in preorder
   * @param onFinish Called with reachable nodes in postorder
   */
  public static <T> void walkDepthFirst(
      T seed,
      Function<T, ? extends Iterable<T>> successors,
      Consumer<T> onDiscover,
      Consumer<T> onFinish) {
    Deque<Tuple2<T, Integer>> greyStack = new ArrayDeque<>();
    Set<T> discovered = new HashSet<>();
    Map<T, List<T>> children = new HashMap<>();
    greyStack.addFirst(tuple(seed, -1));
    while (!greyStack.isEmpty()) {
      Tuple2<T, Integer> nextGrey = greyStack.removeFirst();
      T node = nextGrey.v1;
      int counter = nextGrey.v2;

      if (counter < 0) {
        // we haven't yet discovered this node
        discovered.add(node);
        onDiscover.accept(node);
        children.put(node, ImmutableList.copyOf(successors.apply(node)));
        // next time only visit children
        greyStack.addFirst(tuple(node, 0));
      } else if (counter < children.get(node).size()) {
        // we have to visit all children first
        T child = children.get(node).get(counter);
        greyStack.addFirst(tuple(node, counter + 1));
        if (!discovered.contains(child)) {
          greyStack.addFirst(tuple(child, -1));
        }
      } else {
        // All children were visited! we can finish this node
        onFinish.accept(node);
      }
    }
  }

  /** Nodes reachable from {@code seed} (including it), in preorder. */
  public static <T> Set<T> reachable(T seed, Function<T, ? extends Iterable<T>> successors) {
    Set<T> reached = new LinkedHashSet<>();
    walkDepthFirst(seed, successors, reached::add, n -> {});
    return reached;
  }

  /**
   * Nodes reachable from {@code seed} in reverse postorder. On an acyclic graph this is a
   * topological order.
   */
  public static <T> ImmutableList<T> reversePostorder(
      T seed, Function<T, ? extends Iterable<T>> successors) {
    Deque<T> stack = new ArrayDeque<>();
    walkDepthFirst(seed, successors, n -> {}, stack::addFirst);
    return ImmutableList.copyOf(stack);
  }
}
