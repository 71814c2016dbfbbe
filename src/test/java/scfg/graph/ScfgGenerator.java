package scfg.graph;

import com.pholser.junit.quickcheck.generator.GenerationStatus;
import com.pholser.junit.quickcheck.generator.Generator;
import com.pholser.junit.quickcheck.generator.Size;
import com.pholser.junit.quickcheck.random.SourceOfRandomness;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Generates valid graphs with arbitrary control flow: a random spanning tree from the entry makes
 * every block reachable, random extra edges add loops, irreducible regions and crossing branches.
 * The last one to three blocks are the exits.
 */
public class ScfgGenerator extends Generator<Scfg> {
  private static final int MAX_EXTRA_EDGES = 2;
  private int sizeHint = 10;

  public ScfgGenerator() {
    super(Scfg.class);
  }

  public void configure(Size size) {
    sizeHint = size.max();
  }

  @Override
  public Scfg generate(SourceOfRandomness random, GenerationStatus status) {
    int n = random.nextInt(1, Math.max(1, sizeHint));
    if (n == 1) {
      return Scfg.builder().block("b0").build();
    }
    int exits = random.nextInt(1, Math.min(3, n - 1));
    int inner = n - exits;

    List<List<Integer>> targets = new ArrayList<>();
    for (int i = 0; i < inner; i++) {
      targets.add(new ArrayList<>());
    }
    for (int i = 1; i < n; i++) {
      targets.get(random.nextInt(0, Math.min(i, inner) - 1)).add(i);
    }
    for (List<Integer> out : targets) {
      int extra = random.nextInt(0, MAX_EXTRA_EDGES);
      for (int e = 0; e < extra; e++) {
        out.add(random.nextInt(0, n - 1));
      }
      if (out.isEmpty()) {
        out.add(random.nextInt(inner, n - 1));
      }
    }
    Set<Integer> reachesExit = reachingExit(targets, inner, n);
    for (int i = 0; i < inner; i++) {
      if (!reachesExit.contains(i)) {
        targets.get(i).add(random.nextInt(inner, n - 1));
      }
    }

    Scfg.Builder builder = Scfg.builder();
    for (int i = 0; i < n; i++) {
      builder.block(label(i), labels(i < inner ? targets.get(i) : new ArrayList<>()));
    }
    return builder.build();
  }

  private static Set<Integer> reachingExit(List<List<Integer>> targets, int inner, int n) {
    Set<Integer> reaching = new HashSet<>();
    for (int i = inner; i < n; i++) {
      reaching.add(i);
    }
    boolean changed = true;
    while (changed) {
      changed = false;
      for (int i = 0; i < inner; i++) {
        if (!reaching.contains(i) && targets.get(i).stream().anyMatch(reaching::contains)) {
          reaching.add(i);
          changed = true;
        }
      }
    }
    return reaching;
  }

  private static String label(int index) {
    return "b" + index;
  }

  private static String[] labels(List<Integer> indices) {
    return indices.stream().map(ScfgGenerator::label).toArray(String[]::new);
  }
}
