package scfg.graph;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.fail;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.Test;
import scfg.ExampleGraphs;

public class ScfgTest {

  private static MalformedGraphError malformed(Scfg.Builder builder) {
    try {
      builder.build();
    } catch (MalformedGraphError e) {
      return e;
    }
    fail("Expected a MalformedGraphError");
    return null;
  }

  @Test
  public void builder_defaultsToFirstBlockAndSinks() {
    Scfg scfg = ExampleGraphs.loopWithTwoExits();

    assertThat(scfg.entry(), is("entry"));
    assertThat(scfg.exits(), contains("X1", "X2"));
    assertThat(scfg.labels(), contains("entry", "h", "b", "X1", "X2"));
    assertThat(scfg.size(), is(5));
  }

  @Test
  public void builder_numbersMultiWayEdges() {
    Scfg scfg = ExampleGraphs.diamond();

    assertThat(
        scfg.successors("A"),
        contains(Edge.conditional("A", "B", 0), Edge.conditional("A", "C", 1)));
    assertThat(scfg.successors("B"), contains(Edge.unconditional("B", "D")));
    assertThat(scfg.successors("D"), is(empty()));
  }

  @Test
  public void predecessors_areDistinctAndInDeclarationOrder() {
    Scfg scfg =
        Scfg.builder()
            .block("A", "C", "B")
            .block("B")
            .edge("B", "C", 0)
            .edge("B", "C", 1)
            .block("C")
            .build();

    assertThat(scfg.predecessors("C"), contains("A", "B"));
    assertThat(scfg.predecessors("A"), is(empty()));
  }

  @Test
  public void duplicateLabel_isRejected() {
    MalformedGraphError e = malformed(Scfg.builder().block("A", "B").block("A").block("B"));
    assertThat(e.labels, contains("A"));
  }

  @Test
  public void edgeToUnknownBlock_isRejected() {
    MalformedGraphError e = malformed(Scfg.builder().block("A", "nowhere").block("B"));
    assertThat(e.labels, contains("nowhere"));
  }

  @Test
  public void unreachableBlock_isRejected() {
    MalformedGraphError e =
        malformed(Scfg.builder().block("A", "C").block("B", "C").block("C").entry("A"));
    assertThat(e.labels, contains("B"));
    assertThat(e.getMessage(), containsString("unreachable"));
  }

  @Test
  public void blockThatCannotReachAnExit_isRejected() {
    MalformedGraphError e =
        malformed(
            Scfg.builder().block("A", "B", "D").block("B", "C").block("C", "B").block("D"));
    assertThat(e.labels, contains("B", "C"));
  }

  @Test
  public void exitWithEdges_isRejected() {
    MalformedGraphError e = malformed(Scfg.builder().block("A", "B").block("B", "A").exit("B"));
    assertThat(e.labels, contains("B"));
  }

  @Test
  public void nonExitWithoutEdges_isRejected() {
    MalformedGraphError e =
        malformed(Scfg.builder().block("A", "B", "C").block("B").block("C").exit("C"));
    assertThat(e.labels, contains("B"));
  }

  @Test
  public void missingDiscriminant_isRejected() {
    MalformedGraphError e =
        malformed(Scfg.builder().block("A").edge("A", "B").edge("A", "C").block("B").block("C"));
    assertThat(e.labels, contains("A"));
  }

  @Test
  public void repeatedDiscriminant_isRejected() {
    MalformedGraphError e =
        malformed(
            Scfg.builder().block("A").edge("A", "B", 1).edge("A", "C", 1).block("B").block("C"));
    assertThat(e.getMessage(), containsString("used twice"));
  }

  @Test
  public void emptyGraph_isRejected() {
    MalformedGraphError e = malformed(Scfg.builder());
    assertThat(e.labels, is(empty()));
  }

  @Test
  public void unknownEntry_isRejected() {
    List<String> labels = ImmutableList.of("A");
    try {
      Scfg.of(labels, ImmutableList.of(), "B", ImmutableList.of("A"));
      fail("Expected a MalformedGraphError");
    } catch (MalformedGraphError e) {
      assertThat(e.labels, contains("B"));
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void unknownLabel_hasNoBlock() {
    ExampleGraphs.diamond().block("E");
  }

  @Test
  public void edges_printTheirDiscriminant() {
    assertThat(Edge.conditional("A", "B", 3).toString(), is(equalTo("A -3-> B")));
    assertThat(Edge.unconditional("A", "B").toString(), is(equalTo("A -> B")));
  }
}
