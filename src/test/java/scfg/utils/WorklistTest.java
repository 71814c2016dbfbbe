package scfg.utils;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import java.util.NoSuchElementException;
import org.junit.Test;

public class WorklistTest {

  @Test
  public void dequeue_returnsItemsInInsertionOrder() {
    Worklist<String> worklist = new Worklist<>(ImmutableList.of("a", "b"));
    worklist.enqueue("c");

    assertThat(worklist.dequeue(), is("a"));
    assertThat(worklist.dequeue(), is("b"));
    assertThat(worklist.dequeue(), is("c"));
    assertThat(worklist.isEmpty(), is(true));
  }

  @Test
  public void enqueue_ignoresQueuedDuplicates() {
    Worklist<String> worklist = new Worklist<>(ImmutableList.of("a", "b", "a"));
    worklist.enqueue("b");

    assertThat(worklist.size(), is(2));
  }

  @Test
  public void enqueue_acceptsAnItemAgainOnceDequeued() {
    Worklist<String> worklist = new Worklist<>(ImmutableList.of("a"));
    worklist.dequeue();
    worklist.enqueue("a");

    assertThat(worklist.size(), is(1));
    assertThat(worklist.dequeue(), is("a"));
  }

  @Test(expected = NoSuchElementException.class)
  public void dequeue_onEmptyWorklist_throws() {
    new Worklist<String>(ImmutableList.of()).dequeue();
  }

  @Test
  public void closure_reachesEverythingBreadthFirst() {
    ImmutableListMultimap<Integer, Integer> next =
        ImmutableListMultimap.<Integer, Integer>builder()
            .putAll(1, 2, 3)
            .putAll(2, 4)
            .putAll(3, 1, 5)
            .putAll(6, 1)
            .build();

    assertThat(Worklist.closure(ImmutableList.of(1), next::get), contains(1, 2, 3, 4, 5));
    assertThat(Worklist.closure(ImmutableList.of(6, 4), next::get), contains(6, 4, 1, 2, 3, 5));
  }
}
