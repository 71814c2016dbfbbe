package scfg.restructure;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;

import com.pholser.junit.quickcheck.From;
import com.pholser.junit.quickcheck.Property;
import com.pholser.junit.quickcheck.generator.Size;
import com.pholser.junit.quickcheck.runner.JUnitQuickcheck;
import java.util.List;
import org.junit.runner.RunWith;
import scfg.graph.Block;
import scfg.graph.BlockKind;
import scfg.graph.Scfg;
import scfg.graph.ScfgGenerator;
import scfg.interp.BranchOracle;
import scfg.interp.GraphInterpreter;
import scfg.interp.RegionInterpreter;
import scfg.region.RegionTree;

@RunWith(JUnitQuickcheck.class)
public class RestructuringPropertiesTest {
  private static final int TRACE_LIMIT = 200;
  private static final int SEEDS = 5;

  private static RegionTree build(Scfg scfg) {
    return RegionTreeBuilder.build(scfg, RestructuringOptions.defaults());
  }

  @Property(trials = 300)
  public void everyBlockIsALeafExactlyOnce(
      @From(ScfgGenerator.class) @Size(max = 14) Scfg scfg) {
    RegionTree tree = build(scfg);

    assertThat(tree.leaves(), containsInAnyOrder(tree.blocks().keySet().toArray()));
  }

  @Property(trials = 300)
  public void regionTreeRunsLikeTheGraph(@From(ScfgGenerator.class) @Size(max = 14) Scfg scfg) {
    RegionTree tree = build(scfg);

    for (long seed = 0; seed < SEEDS; seed++) {
      List<String> expected =
          new GraphInterpreter(scfg, BranchOracle.seeded(seed), TRACE_LIMIT).run();
      List<String> actual =
          new RegionInterpreter(tree, BranchOracle.seeded(seed), TRACE_LIMIT).run();
      assertThat(tree.dump(), actual, is(equalTo(expected)));
    }
  }

  @Property(trials = 200)
  public void restructuringIsDeterministic(@From(ScfgGenerator.class) @Size(max = 14) Scfg scfg) {
    RegionTree first = build(scfg);
    RegionTree second = build(scfg);

    assertThat(second.dump(), is(equalTo(first.dump())));
    assertThat(second.blocks().toString(), is(equalTo(first.blocks().toString())));
  }

  @Property(trials = 200)
  public void onlySyntheticBlocksTouchControlVariables(
      @From(ScfgGenerator.class) @Size(max = 14) Scfg scfg) {
    RegionTree tree = build(scfg);

    for (Block block : tree.blocks().values()) {
      if (block.kind == BlockKind.ORIGINAL) {
        assertThat(block.label, block.assignments.isEmpty(), is(true));
        assertThat(block.label, block.dispatchVariable.isPresent(), is(false));
      }
    }
    assertThat(tree.block(tree.exit()).edges.isEmpty(), is(true));
  }
}
