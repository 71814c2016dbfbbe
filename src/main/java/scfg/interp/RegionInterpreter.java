package scfg.interp;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.jooq.lambda.Seq;
import scfg.control.ControlVariable;
import scfg.graph.Block;
import scfg.graph.BlockKind;
import scfg.graph.Edge;
import scfg.region.BlockNode;
import scfg.region.Region;
import scfg.region.RegionNode;
import scfg.region.RegionTree;
import scfg.region.Regions;

/**
 * Executes a {@link RegionTree} by walking the regions rather than the edges: a linear region runs
 * its children in order, a branch runs the arm its head selects, a loop repeats while its header or
 * body ends in a backedge. Control variables are kept in an environment keyed by id.
 *
 * <p>Only original blocks show up in the trace, so it can be compared with the one of {@link
 * GraphInterpreter}. Whenever control leaves a region somewhere other than where the tree says it
 * should, an {@link IllegalStateException} is thrown.
 */
public class RegionInterpreter {
  private final RegionTree tree;
  private final BranchOracle oracle;
  private final int limit;
  private final long maxSteps;

  private final List<String> trace = new ArrayList<>();
  private final Map<String, Integer> visits = new HashMap<>();
  private final Map<Integer, Integer> environment = new HashMap<>();
  private long steps = 0;
  private boolean halted = false;

  /** @param limit the trace is cut after this many visits of original blocks */
  public RegionInterpreter(RegionTree tree, BranchOracle oracle, int limit) {
    Preconditions.checkArgument(limit > 0, "limit must be positive");
    this.tree = tree;
    this.oracle = oracle;
    this.limit = limit;
    this.maxSteps = (long) limit * (tree.blocks().size() + 1) * 4;
  }

  /**
   * The visited original labels, up to an exit or up to the limit. An interpreter instance runs
   * only once.
   */
  public ImmutableList<String> run() {
    Preconditions.checkState(steps == 0, "Already ran");
    tree.root().acceptVisitor(new Executor());
    return ImmutableList.copyOf(trace);
  }

  /** The value each control variable id had at the end of the run. */
  public Map<Integer, Integer> environment() {
    return environment;
  }

  private boolean isBackedge(Edge edge) {
    return tree.block(edge.source).isBackedge(edge);
  }

  private void expectEntry(Optional<Edge> edge, RegionNode next) {
    String expected = Regions.entryLabel(next);
    if (!edge.isPresent() || !edge.get().target.equals(expected)) {
      throw new IllegalStateException(
          "Control left to " + edge.map(e -> e.target).orElse("nowhere") + ", not " + expected);
    }
  }

  private Optional<Edge> step(String label) {
    Block block = tree.block(label);
    if (++steps > maxSteps) {
      throw new IllegalStateException("No end after " + maxSteps + " steps, at " + label);
    }
    int visit = 0;
    if (block.kind == BlockKind.ORIGINAL) {
      trace.add(label);
      visit = visits.merge(label, 1, Integer::sum) - 1;
      if (trace.size() >= limit) {
        halted = true;
        return Optional.empty();
      }
    }
    block.assignments.forEach((variable, value) -> environment.put(variable.id, value));

    if (block.dispatchVariable.isPresent()) {
      ControlVariable variable = block.dispatchVariable.get();
      @Nullable Integer value = environment.get(variable.id);
      if (value == null) {
        throw new IllegalStateException(label + " reads " + variable + " before any write");
      }
      return Optional.of(
          Seq.seq(block.edges)
              .filter(e -> e.discriminant.equals(Optional.of(value)))
              .findFirst()
              .orElseThrow(
                  () -> new IllegalStateException(label + " has no edge for " + value)));
    }
    if (block.edges.isEmpty()) {
      return Optional.empty();
    }
    if (block.edges.size() == 1) {
      return Optional.of(block.edges.get(0));
    }
    return Optional.of(block.edges.get(oracle.choose(label, visit, block.edges.size())));
  }

  private class Executor implements RegionNode.Visitor<Optional<Edge>> {

    @Override
    public Optional<Edge> visitBlock(BlockNode that) {
      return step(that.label);
    }

    @Override
    public Optional<Edge> visitLinear(Region.Linear that) {
      Optional<Edge> last = Optional.empty();
      for (int i = 0; i < that.children.size(); i++) {
        RegionNode child = that.children.get(i);
        if (i > 0) {
          expectEntry(last, child);
        }
        last = child.acceptVisitor(this);
        if (halted) {
          return Optional.empty();
        }
      }
      return last;
    }

    @Override
    public Optional<Edge> visitBranch(Region.Branch that) {
      Optional<Edge> selector = that.head.acceptVisitor(this);
      if (halted) {
        return Optional.empty();
      }
      Edge edge = selector.orElseThrow(() -> new IllegalStateException("Branch head has no exit"));
      @Nullable Region arm = that.arms.get(edge.discriminant.orElse(0));
      if (arm == null) {
        throw new IllegalStateException("No arm for " + edge);
      }
      expectEntry(selector, arm);
      Optional<Edge> leaving = arm.acceptVisitor(this);
      if (halted) {
        return Optional.empty();
      }
      expectEntry(leaving, that.tail);
      return that.tail.acceptVisitor(this);
    }

    @Override
    public Optional<Edge> visitLoop(Region.Loop that) {
      while (true) {
        Optional<Edge> leaving = that.header.acceptVisitor(this);
        if (halted) {
          return Optional.empty();
        }
        Edge edge = leaving.orElseThrow(() -> new IllegalStateException("Loop header ends"));
        if (isBackedge(edge)) {
          continue;
        }
        if (!Regions.isEmpty(that.body) && edge.target.equals(Regions.entryLabel(that.body))) {
          Optional<Edge> back = that.body.acceptVisitor(this);
          if (halted) {
            return Optional.empty();
          }
          if (!back.map(RegionInterpreter.this::isBackedge).orElse(false)) {
            throw new IllegalStateException("Loop body did not end in a backedge: " + back);
          }
          continue;
        }
        return leaving;
      }
    }
  }
}
