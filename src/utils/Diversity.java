package utils;

import java.util.List;

/**
 * Population diversity measures over symbol sequences.
 */
public final class Diversity {

  private Diversity() {}

  /** Normalized Hamming distance [0,1]; positions beyond the shorter sequence count as mismatches. */
  public static double hamming01(List<Integer> a, List<Integer> b) {
    int n = Math.max(a.size(), b.size());
    if (n == 0) return 0.0;
    int common = Math.min(a.size(), b.size());
    int d = n - common;
    for (int i = 0; i < common; i++) if (!a.get(i).equals(b.get(i))) d++;
    return d / (double) n;
  }

  /** Mean Hamming distance to medoid: simple O(n_pop^2); for large populations, sample pairs. */
  public static double meanHammingToMedoid(List<? extends List<Integer>> pop) {
    int n = pop.size();
    if (n < 2) return 0.0;
    double bestSum = Double.POSITIVE_INFINITY;
    for (int i = 0; i < n; i++) {
      double sum = 0.0;
      for (int j = 0; j < n; j++) if (i != j) sum += hamming01(pop.get(i), pop.get(j));
      if (sum < bestSum) bestSum = sum;
    }
    return bestSum / (n - 1);
  }

  /** Mean entropy per locus (normalized by log(alphabetSize)), over the loci every member has. */
  public static double meanLocusEntropy(List<? extends List<Integer>> pop, int alphabetSize) {
    int n = pop.size();
    if (n == 0) return 0.0;
    int L = Integer.MAX_VALUE;
    for (List<Integer> ind : pop) L = Math.min(L, ind.size());
    if (L == 0) return 0.0;
    int[] counts = new int[alphabetSize];
    double acc = 0.0;
    for (int i = 0; i < L; i++) {
      java.util.Arrays.fill(counts, 0);
      for (List<Integer> ind : pop) counts[ind.get(i)]++;
      double h = 0.0;
      for (int c : counts) {
        if (c == 0) continue;
        double p = c / (double) n;
        h -= p * Math.log(p);
      }
      acc += h / Math.log(alphabetSize);
    }
    return acc / L;
  }
}
