package metaheuristics.ls;

import problems.SequenceProblem;
import solutions.Sequence;

/**
 * Positional hill climbing restricted to the feasible region. For every
 * position in order, all alternative symbols are tried; candidates failing
 * {@link SequenceProblem#isFeasible} are skipped and the best strictly
 * improving symbol is committed before moving on. One pass only.
 *
 * Only feasible inputs are accepted, so the output is always feasible.
 */
public class HillClimber implements LocalImprover<Sequence> {

    private final SequenceProblem problem;

    public HillClimber(SequenceProblem problem) {
        this.problem = problem;
    }

    /**
     * @throws IllegalArgumentException
     *             if {@code seq} fails the problem's validity predicate.
     */
    @Override
    public Sequence improve(Sequence seq) {
        if (!problem.isFeasible(seq)) {
            throw new IllegalArgumentException("Hill climbing needs a valid starting point, got " + seq);
        }
        double bestScore = problem.fitness(seq);
        final int alphabet = problem.alphabetSize();

        for (int pos = 0; pos < seq.size(); pos++) {
            int orig = seq.get(pos);
            int bestSym = orig;
            double bestLocal = bestScore;

            for (int sym = 0; sym < alphabet; sym++) {
                if (sym == orig) continue;
                seq.set(pos, sym);
                if (!problem.isFeasible(seq)) continue;
                double score = problem.fitness(seq);
                if (score < bestLocal) {
                    bestLocal = score;
                    bestSym = sym;
                }
            }

            seq.set(pos, bestSym);
            bestScore = bestLocal;
        }
        return seq;
    }
}
