package scfg.utils;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.function.Function;

/**
 * A first-in first-out queue of pending items that holds every item at most once. An item that was
 * dequeued may be enqueued again.
 */
public class Worklist<T> {
  /** Items currently in the queue. */
  private final Set<T> queued;

  private final Deque<T> queue;

  public Worklist(Collection<T> initial) {
    queue = new ArrayDeque<>();
    queued = new LinkedHashSet<>();
    initial.forEach(this::enqueue);
  }

  /**
   * Every item reachable from {@code seeds} through {@code next}, seeds included, in breadth-first
   * order.
   */
  public static <T> Set<T> closure(Collection<T> seeds, Function<T, ? extends Iterable<T>> next) {
    Set<T> reached = new LinkedHashSet<>(seeds);
    Worklist<T> worklist = new Worklist<>(seeds);
    while (!worklist.isEmpty()) {
      for (T item : next.apply(worklist.dequeue())) {
        if (reached.add(item)) {
          worklist.enqueue(item);
        }
      }
    }
    return reached;
  }

  /** Enqueues {@code element} at the back unless it is already queued. */
  public void enqueue(T element) {
    if (queued.add(element)) {
      queue.addLast(element);
    }
  }

  /**
   * Dequeues the oldest item of the work list.
   *
   * @throws NoSuchElementException if this work list is empty
   */
  public T dequeue() {
    T element = queue.removeFirst();
    queued.remove(element);
    return element;
  }

  public boolean isEmpty() {
    return queue.isEmpty();
  }

  public int size() {
    return queue.size();
  }
}
