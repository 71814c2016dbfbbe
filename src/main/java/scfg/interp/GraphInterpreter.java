package scfg.interp;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import scfg.graph.Edge;
import scfg.graph.Scfg;

/** Walks an {@link Scfg} from its entry; a {@link BranchOracle} picks at multi-way blocks. */
public class GraphInterpreter {
  private final Scfg scfg;
  private final BranchOracle oracle;
  private final int limit;

  /** @param limit the trace is cut after this many visits */
  public GraphInterpreter(Scfg scfg, BranchOracle oracle, int limit) {
    Preconditions.checkArgument(limit > 0, "limit must be positive");
    this.scfg = scfg;
    this.oracle = oracle;
    this.limit = limit;
  }

  /** The visited labels, up to an exit or up to the limit. */
  public ImmutableList<String> run() {
    ImmutableList.Builder<String> trace = ImmutableList.builder();
    Map<String, Integer> visits = new HashMap<>();
    String current = scfg.entry();
    int steps = 0;
    while (true) {
      trace.add(current);
      steps++;
      int visit = visits.merge(current, 1, Integer::sum) - 1;
      List<Edge> edges = scfg.successors(current);
      if (steps >= limit || edges.isEmpty()) {
        return trace.build();
      }
      Edge taken =
          edges.size() == 1 ? edges.get(0) : edges.get(oracle.choose(current, visit, edges.size()));
      current = taken.target;
    }
  }
}
