package scfg.interp;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.is;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import java.util.List;
import org.junit.Test;
import scfg.ExampleGraphs;
import scfg.graph.Scfg;
import scfg.region.BlockNode;
import scfg.region.Region;
import scfg.region.RegionTree;
import scfg.restructure.RegionTreeBuilder;
import scfg.restructure.RestructuringOptions;

public class RegionInterpreterTest {
  private static final int LIMIT = 200;

  private static RegionTree build(Scfg scfg) {
    return RegionTreeBuilder.build(scfg, RestructuringOptions.defaults());
  }

  private static void assertSameTrace(Scfg scfg, long seed) {
    RegionTree tree = build(scfg);
    List<String> expected = new GraphInterpreter(scfg, BranchOracle.seeded(seed), LIMIT).run();
    List<String> actual = new RegionInterpreter(tree, BranchOracle.seeded(seed), LIMIT).run();
    assertThat("seed " + seed + " on " + tree.dump(), actual, is(equalTo(expected)));
  }

  @Test
  public void whileLoop_repeatsTheBody() {
    RegionTree tree = build(ExampleGraphs.whileLoop());

    assertThat(
        new RegionInterpreter(tree, BranchOracle.constant(0), 5).run(),
        contains("entry", "header", "body", "header", "body"));
    assertThat(
        new RegionInterpreter(tree, BranchOracle.constant(1), 5).run(),
        contains("entry", "header", "exit"));
  }

  @Test
  public void syntheticBlocksAreNotTraced() {
    RegionTree tree = build(ExampleGraphs.loopWithTwoExits());

    assertThat(
        new RegionInterpreter(tree, BranchOracle.constant(1), LIMIT).run(),
        contains("entry", "h", "X1"));
    assertThat(
        new RegionInterpreter(tree, BranchOracle.constant(0), 7).run(),
        contains("entry", "h", "b", "h", "b", "h", "b"));
  }

  @Test
  public void irreducibleLoop_keepsItsControlVariables() {
    RegionTree tree = build(ExampleGraphs.irreducible());
    RegionInterpreter interpreter = new RegionInterpreter(tree, BranchOracle.constant(1), LIMIT);

    assertThat(interpreter.run(), contains("A", "C", "D"));
    // cv0 selects the header, cv1 leaves the loop
    assertThat(interpreter.environment(), hasKey(0));
    assertThat(interpreter.environment().get(1), is(1));
  }

  @Test
  public void tracesMatchTheOriginalGraph() {
    List<Scfg> graphs =
        ImmutableList.of(
            ExampleGraphs.diamond(),
            ExampleGraphs.ifThen(),
            ExampleGraphs.whileLoop(),
            ExampleGraphs.selfLoop(),
            ExampleGraphs.diamondInLoop(),
            ExampleGraphs.entryInLoop(),
            ExampleGraphs.irreducible(),
            ExampleGraphs.loopWithTwoExits(),
            ExampleGraphs.crossingBranches(),
            ExampleGraphs.nestedLoops(),
            ExampleGraphs.whileWithContinue(),
            ExampleGraphs.diamondChain(5),
            ExampleGraphs.nestedWhileLoops(4));
    for (Scfg scfg : graphs) {
      for (long seed = 0; seed < 20; seed++) {
        assertSameTrace(scfg, seed);
      }
    }
  }

  @Test(expected = IllegalStateException.class)
  public void inconsistentTree_isDetected() {
    RegionTree built = build(ExampleGraphs.diamond());
    Region skipping =
        new Region.Linear(ImmutableList.of(new BlockNode("A"), new BlockNode("D")));
    RegionTree broken =
        new RegionTree(skipping, built.blocks(), "A", "D", ImmutableListMultimap.of());

    new RegionInterpreter(broken, BranchOracle.constant(0), LIMIT).run();
  }

  @Test(expected = IllegalStateException.class)
  public void interpreterRunsOnlyOnce() {
    RegionInterpreter interpreter =
        new RegionInterpreter(build(ExampleGraphs.diamond()), BranchOracle.constant(0), LIMIT);
    interpreter.run();
    interpreter.run();
  }
}
