package scfg.restructure;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Multiset;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import org.jooq.lambda.Seq;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scfg.RestructuringError;
import scfg.graph.BlockKind;
import scfg.graph.Scfg;
import scfg.region.Region;
import scfg.region.RegionTree;

/**
 * Turns an {@link Scfg} into a tree of nested single-entry single-exit regions.
 *
 * <p>The graph is copied, given a synthetic entry if its entry has predecessors and a synthetic
 * return if it has several exits, and then structured level by level: loops are folded first,
 * then the remaining acyclic graph is split into chains and branches, recursing into every loop,
 * arm and tail. The result covers every block of the final graph exactly once.
 *
 * <p>Each call works on its own copy, so concurrent calls on different graphs are fine.
 */
public final class RegionTreeBuilder {
  private static final Logger LOGGER = LoggerFactory.getLogger("RegionTreeBuilder");

  private RegionTreeBuilder() {}

  /** Uses {@link RestructuringOptions#fromEnvironment()}. */
  public static RegionTree build(Scfg scfg) {
    return build(scfg, RestructuringOptions.fromEnvironment());
  }

  /**
   * @throws InternalInvariantError if the algorithm broke one of its own invariants
   * @throws NonConvergenceError if it needed more rounds than {@code options} allow
   * @throws InternalInvariantError also if loops and branches nest deeper than the stack allows
   */
  public static RegionTree build(Scfg scfg, RestructuringOptions options) {
    try {
      return restructure(scfg, options);
    } catch (StackOverflowError unused) {
      InternalInvariantError e =
          new InternalInvariantError(
              "Regions nest too deeply to restructure", ImmutableList.of(scfg.entry()));
      LOGGER.warn("Restructuring the graph entered at {} failed: {}", scfg.entry(), e.getMessage());
      throw e;
    } catch (RestructuringError e) {
      LOGGER.warn("Restructuring the graph entered at {} failed: {}", scfg.entry(), e.getMessage());
      throw e;
    }
  }

  private static RegionTree restructure(Scfg scfg, RestructuringOptions options) {
    WorkGraph graph = WorkGraph.copyOf(scfg);
    String entry = scfg.entry();
    if (!scfg.predecessors(entry).isEmpty()) {
      entry = graph.addPassThrough(BlockKind.SYNTHETIC_ENTRY, entry);
      LOGGER.debug("{} has predecessors, entering through {}", scfg.entry(), entry);
    }
    String exit;
    if (scfg.exits().size() > 1) {
      exit = graph.addBlock(BlockKind.SYNTHETIC_RETURN);
      for (String original : scfg.exits()) {
        graph.addEdge(original, exit, Optional.empty());
      }
      LOGGER.debug("Joined exits {} in {}", scfg.exits(), exit);
    } else {
      exit = scfg.exits().iterator().next();
    }

    StructuringContext ctx = new StructuringContext(graph, options.roundBound(scfg.size()));
    Region root = ctx.structure(new LinkedHashSet<>(graph.labels()), entry);
    RegionTree tree = new RegionTree(root, graph.snapshot(), entry, exit, ctx.allocator.table());
    verifyCoverage(tree);

    LOGGER.debug(
        "Restructured {} blocks into {} blocks in {} rounds",
        scfg.size(),
        graph.size(),
        ctx.rounds());
    if (options.dumpTree) {
      LOGGER.info("Region tree of {}: {}", scfg.entry(), tree.dump());
    }
    return tree;
  }

  /** Every block of the final graph must be a leaf of the tree exactly once. */
  private static void verifyCoverage(RegionTree tree) {
    Multiset<String> leaves = HashMultiset.create(tree.leaves());
    List<String> offending =
        Seq.seq(tree.blocks().keySet())
            .filter(label -> leaves.count(label) != 1)
            .concat(Seq.seq(leaves.elementSet()).filter(l -> !tree.blocks().containsKey(l)))
            .toList();
    if (!offending.isEmpty()) {
      throw new InternalInvariantError(
          "Blocks not covered exactly once by the region tree", ImmutableList.copyOf(offending));
    }
  }
}
