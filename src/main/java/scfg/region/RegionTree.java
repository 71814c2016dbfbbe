package scfg.region;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import scfg.control.ControlVariable;
import scfg.graph.Block;

/**
 * The result of restructuring: the region tree, the final block table (original and synthetic
 * blocks) and the control variables, keyed by the region that owns them.
 */
public final class RegionTree {
  private final Region root;
  private final ImmutableMap<String, Block> blocks;
  private final String entry;
  private final String exit;
  private final ImmutableListMultimap<Region, ControlVariable> variables;

  public RegionTree(
      Region root,
      ImmutableMap<String, Block> blocks,
      String entry,
      String exit,
      ImmutableListMultimap<Region, ControlVariable> variables) {
    this.root = root;
    this.blocks = blocks;
    this.entry = entry;
    this.exit = exit;
    this.variables = variables;
  }

  public Region root() {
    return root;
  }

  public ImmutableMap<String, Block> blocks() {
    return blocks;
  }

  public Block block(String label) {
    Block block = blocks.get(label);
    if (block == null) {
      throw new IllegalArgumentException("No block labelled " + label);
    }
    return block;
  }

  /** The entry block, which may be a synthetic entry in front of the original one. */
  public String entry() {
    return entry;
  }

  /** The single exit block, which is a synthetic return if the graph had several exits. */
  public String exit() {
    return exit;
  }

  public ImmutableListMultimap<Region, ControlVariable> variables() {
    return variables;
  }

  public ImmutableList<ControlVariable> variablesOf(Region owner) {
    return variables.get(owner);
  }

  /** All variables, without the repetitions caused by sibling regions reusing ids. */
  public ImmutableSet<ControlVariable> distinctVariables() {
    return ImmutableSet.copyOf(variables.values());
  }

  public ImmutableList<String> leaves() {
    return Regions.leaves(root);
  }

  public String dump() {
    return RegionPrinter.print(root);
  }

  @Override
  public String toString() {
    return dump();
  }
}
