package scfg.utils;

import static org.jooq.lambda.tuple.Tuple.tuple;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.jetbrains.annotations.Nullable;
import org.jooq.lambda.Seq;

/**
 * Dominator tree of a graph, computed with the iterative algorithm of Cooper, Harvey and Kennedy.
 * Post-dominators are the dominators of the reversed graph.
 */
public class Dominance<T> {
  private final T root;
  /** Maps every reachable node to its immediate dominator; the root maps to itself. */
  private final Map<T, T> idoms;

  private final ImmutableList<T> reversePostorder;

  private Dominance(T root, Map<T, T> idoms, ImmutableList<T> reversePostorder) {
    this.root = root;
    this.idoms = idoms;
    this.reversePostorder = reversePostorder;
  }

  /** Dominators of all nodes reachable from {@code entry}. */
  public static <T> Dominance<T> dominators(
      T entry, Function<T, ? extends Iterable<T>> successors) {
    ImmutableList<T> rpo = GraphUtils.reversePostorder(entry, successors);
    Map<T, Integer> order = new HashMap<>();
    ListMultimap<T, T> preds = ArrayListMultimap.create();
    for (T node : rpo) {
      order.put(node, order.size());
      for (T succ : successors.apply(node)) {
        preds.put(succ, node);
      }
    }

    Map<T, T> idoms = new HashMap<>();
    idoms.put(entry, entry);
    boolean changed = true;
    while (changed) {
      changed = false;
      for (T node : rpo.subList(1, rpo.size())) {
        T newIdom = null;
        for (T pred : preds.get(node)) {
          if (!idoms.containsKey(pred)) {
            continue;
          }
          newIdom = newIdom == null ? pred : intersect(pred, newIdom, idoms, order);
        }
        if (newIdom != null && !newIdom.equals(idoms.get(node))) {
          idoms.put(node, newIdom);
          changed = true;
        }
      }
    }
    return new Dominance<>(entry, idoms, rpo);
  }

  /**
   * Post-dominators of the sub-graph induced by {@code nodes}, with {@code exit} as the single
   * sink.
   */
  public static <T> Dominance<T> postDominators(
      T exit, Collection<T> nodes, Function<T, ? extends Iterable<T>> successors) {
    Set<T> universe = new HashSet<>(nodes);
    ListMultimap<T, T> preds = ArrayListMultimap.create();
    for (T node : nodes) {
      for (T succ : successors.apply(node)) {
        if (universe.contains(succ)) {
          preds.put(succ, node);
        }
      }
    }
    return dominators(exit, preds::get);
  }

  private static <T> T intersect(T a, T b, Map<T, T> idoms, Map<T, Integer> order) {
    while (!a.equals(b)) {
      while (order.get(a) > order.get(b)) {
        a = idoms.get(a);
      }
      while (order.get(b) > order.get(a)) {
        b = idoms.get(b);
      }
    }
    return a;
  }

  public T root() {
    return root;
  }

  /** The nodes this dominator tree covers, in reverse postorder of the walk from the root. */
  public ImmutableList<T> reachable() {
    return reversePostorder;
  }

  public boolean contains(T node) {
    return idoms.containsKey(node);
  }

  public Optional<T> immediateDominator(T dominated) {
    @Nullable T idom = idoms.get(dominated);
    if (idom == null || dominated.equals(root)) {
      return Optional.empty();
    }
    return Optional.of(idom);
  }

  public boolean dominates(T dominator, T dominated) {
    return contains(dominated) && dominatorPath(dominated).anyMatch(dominator::equals);
  }

  public boolean strictlyDominates(T dominator, T dominated) {
    return !dominator.equals(dominated) && dominates(dominator, dominated);
  }

  /** The reflexive transitive path of immediate dominators starting from {@code dominated}. */
  public Seq<T> dominatorPath(T dominated) {
    return Seq.of(dominated)
        .concat(
            Seq.unfold(
                dominated,
                b -> {
                  Optional<T> optIdom = immediateDominator(b);
                  return optIdom.map(idom -> tuple(idom, idom));
                }));
  }
}
