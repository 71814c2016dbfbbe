package scfg.utils;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;

import com.google.common.collect.ImmutableListMultimap;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

public class GraphUtilsTest {

  private static final ImmutableListMultimap<Integer, Integer> GRAPH =
      ImmutableListMultimap.<Integer, Integer>builder()
          .putAll(1, 2, 3)
          .putAll(2, 4)
          .putAll(3, 4)
          .putAll(4, 1, 5)
          .build();

  @Test
  public void walkDepthFirst_visitsChildrenInOrder() {
    List<Integer> pre = new ArrayList<>();
    List<Integer> post = new ArrayList<>();
    GraphUtils.walkDepthFirst(1, GRAPH::get, pre::add, post::add);

    assertThat(pre, contains(1, 2, 4, 5, 3));
    assertThat(post, contains(5, 4, 2, 3, 1));
  }

  @Test
  public void reachable_isInPreorder() {
    assertThat(GraphUtils.reachable(3, GRAPH::get), contains(3, 4, 1, 2, 5));
  }

  @Test
  public void reversePostorder() {
    assertThat(GraphUtils.reversePostorder(1, GRAPH::get), contains(1, 3, 2, 4, 5));
  }
}
