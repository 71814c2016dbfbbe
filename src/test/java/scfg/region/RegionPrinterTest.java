package scfg.region;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.util.Optional;
import org.junit.Before;
import org.junit.Test;
import scfg.control.ControlVariable;
import scfg.control.ControlVariable.Purpose;

public class RegionPrinterTest {

  private Region.Branch branch;
  private Region.Loop loop;

  private static Region.Linear linear(String... labels) {
    ImmutableList.Builder<RegionNode> children = ImmutableList.builder();
    for (String label : labels) {
      children.add(new BlockNode(label));
    }
    return new Region.Linear(children.build());
  }

  @Before
  public void setup() {
    Region shared = linear("C");
    branch =
        new Region.Branch(
            linear("A"), ImmutableSortedMap.of(0, linear("B"), 1, shared, 2, shared), linear("D"));
    loop =
        new Region.Loop(
            linear("H"),
            new Region.Linear(ImmutableList.of(new BlockNode("X"), branch)),
            Optional.of(new ControlVariable(4, Purpose.EXIT)),
            ImmutableSortedMap.of(0, "E1", 1, "E2"));
  }

  @Test
  public void emptyLinear() {
    assertThat(RegionPrinter.print(Region.Linear.empty()), is(equalTo("(linear)")));
  }

  @Test
  public void branchPrintsEveryArmKey() {
    assertThat(
        RegionPrinter.print(branch),
        is(
            equalTo(
                "(branch (linear A) {0: (linear B), 1: (linear C), 2: (linear C)} (linear D))")));
  }

  @Test
  public void loopPrintsItsExitVariable() {
    assertThat(
        RegionPrinter.print(loop),
        is(
            equalTo(
                "(loop (linear H) (linear X (branch (linear A) "
                    + "{0: (linear B), 1: (linear C), 2: (linear C)} (linear D))) "
                    + "[cv4] {0: E1, 1: E2})")));
  }

  @Test
  public void leavesListSharedArmsOnce() {
    assertThat(Regions.leaves(loop), contains("H", "X", "A", "B", "C", "D"));
    assertThat(branch.distinctArms().size(), is(2));
  }

  @Test
  public void entryLabelDescendsIntoTheFirstChild() {
    assertThat(Regions.entryLabel(loop), is("H"));
    assertThat(Regions.entryLabel(loop.body), is("X"));
    assertThat(Regions.isEmpty(loop.body), is(false));
    assertThat(Regions.isEmpty(Region.Linear.empty()), is(true));
  }

  @Test(expected = IllegalArgumentException.class)
  public void emptyRegionHasNoEntry() {
    Regions.entryLabel(Region.Linear.empty());
  }
}
