package scfg.utils;

import static org.jooq.lambda.tuple.Tuple.tuple;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.jooq.lambda.tuple.Tuple2;

/**
 * Tarjan's algorithm, without recursion so that deep graphs don't overflow the stack. Edges to
 * nodes outside of the given node collection are ignored.
 */
public class StronglyConnectedComponents {

  /**
   * Computes the strongly connected components of the sub-graph induced by {@code nodes}. The
   * components come in reverse topological order; roots are tried in iteration order of {@code
   * nodes}, which makes the result deterministic.
   */
  public static <T> ImmutableList<ImmutableList<T>> of(
      Collection<T> nodes, Function<T, ? extends Iterable<T>> successors) {
    Set<T> universe = new HashSet<>(nodes);
    Map<T, Integer> index = new HashMap<>();
    Map<T, Integer> lowlink = new HashMap<>();
    Deque<T> stack = new ArrayDeque<>();
    Set<T> onStack = new HashSet<>();
    List<ImmutableList<T>> components = new ArrayList<>();
    int counter = 0;

    for (T root : nodes) {
      if (index.containsKey(root)) {
        continue;
      }
      Deque<Tuple2<T, Iterator<T>>> work = new ArrayDeque<>();
      index.put(root, counter);
      lowlink.put(root, counter);
      counter++;
      stack.push(root);
      onStack.add(root);
      work.push(tuple(root, successors.apply(root).iterator()));

      while (!work.isEmpty()) {
        Tuple2<T, Iterator<T>> top = work.peek();
        T node = top.v1;
        if (top.v2.hasNext()) {
          T next = top.v2.next();
          if (!universe.contains(next)) {
            continue;
          }
          if (!index.containsKey(next)) {
            index.put(next, counter);
            lowlink.put(next, counter);
            counter++;
            stack.push(next);
            onStack.add(next);
            work.push(tuple(next, successors.apply(next).iterator()));
          } else if (onStack.contains(next)) {
            lowlink.put(node, Math.min(lowlink.get(node), index.get(next)));
          }
          continue;
        }

        work.pop();
        if (!work.isEmpty()) {
          T parent = work.peek().v1;
          lowlink.put(parent, Math.min(lowlink.get(parent), lowlink.get(node)));
        }
        if (lowlink.get(node).equals(index.get(node))) {
          List<T> component = new ArrayList<>();
          T member;
          do {
            member = stack.pop();
            onStack.remove(member);
            component.add(member);
          } while (!member.equals(node));
          components.add(ImmutableList.copyOf(component));
        }
      }
    }
    return ImmutableList.copyOf(components);
  }

  /** A component is cyclic if it has more than one member or its only member loops to itself. */
  public static <T> boolean isCyclic(
      Collection<T> component, Function<T, ? extends Iterable<T>> successors) {
    if (component.size() > 1) {
      return true;
    }
    T only = Iterables.getOnlyElement(component);
    return Iterables.contains(successors.apply(only), only);
  }
}
