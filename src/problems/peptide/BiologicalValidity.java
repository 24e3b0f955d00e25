package problems.peptide;

import java.util.List;

/**
 * Fast heuristics approximating whether a peptide resembles a viable, soluble
 * biological sequence. A sequence passes only if every rule holds:
 * <ol>
 * <li>it is not empty;</li>
 * <li>its mean hydropathy lies in [{@value #MIN_MEAN_HYDROPATHY}, {@value #MAX_MEAN_HYDROPATHY}];</li>
 * <li>it contains no adjacent CC or PP pair;</li>
 * <li>it contains no run of {@value #MAX_RUN} or more identical residues.</li>
 * </ol>
 */
public final class BiologicalValidity {

    public static final double MIN_MEAN_HYDROPATHY = -1.5;
    public static final double MAX_MEAN_HYDROPATHY = 3.0;
    public static final int MAX_RUN = 4;

    private BiologicalValidity() {
    }

    public static boolean isValid(List<Integer> seq) {
        if (seq.isEmpty()) return false;
        return hasPlausibleHydropathy(seq) && !hasForbiddenPair(seq) && !hasLongRun(seq);
    }

    static boolean hasPlausibleHydropathy(List<Integer> seq) {
        double sum = 0.0;
        for (int aa : seq) sum += Alphabet.hydropathy(aa);
        double mean = sum / seq.size();
        return mean >= MIN_MEAN_HYDROPATHY && mean <= MAX_MEAN_HYDROPATHY;
    }

    static boolean hasForbiddenPair(List<Integer> seq) {
        for (int i = 1; i < seq.size(); i++) {
            int a = seq.get(i - 1), b = seq.get(i);
            if (a == b && (a == Alphabet.CYS || a == Alphabet.PRO)) return true;
        }
        return false;
    }

    static boolean hasLongRun(List<Integer> seq) {
        int run = 1;
        for (int i = 1; i < seq.size(); i++) {
            if (seq.get(i).equals(seq.get(i - 1))) {
                if (++run >= MAX_RUN) return true;
            } else {
                run = 1;
            }
        }
        return false;
    }
}
