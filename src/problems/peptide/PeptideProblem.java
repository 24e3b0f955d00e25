package problems.peptide;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import problems.Move;
import problems.Neighbour;
import problems.SequenceProblem;
import solutions.Sequence;

/**
 * Fixed-length peptide design.
 *
 * Minimize:  E(x) = sum_i -S(x_i, motif[i mod |motif|]) + sum_i A(x_i, x_{i+1})
 *
 * where S is the substitution matrix and A the pairwise neighbourhood energy of
 * the {@link ScoringProvider}. In best-of-catalog mode the first term is the
 * minimum over every motif of the catalog. The scoring configuration is fixed
 * at construction, so one instance always scores the same way and may be shared
 * by engines running side by side.
 */
public class PeptideProblem implements SequenceProblem {

    /** Share of substitution moves in a sampled neighbourhood; the rest are swaps. */
    public static final double SUBSTITUTION_SHARE = 0.7;

    private final ScoringProvider scoring;
    private final MotifCatalog catalog;
    private final ScoringConfig config;
    private final int[] motif;

    public PeptideProblem(ScoringProvider scoring, MotifCatalog catalog, ScoringConfig config) {
        if (config.motifIndex() >= catalog.size()) {
            throw new IllegalArgumentException("motifIndex " + config.motifIndex()
                    + " out of range, catalog has " + catalog.size() + " motifs");
        }
        this.scoring = scoring;
        this.catalog = catalog;
        this.config = config;
        this.motif = catalog.encoded(config.motifIndex());
    }

    /** Problem over the tables and motifs shipped with the library. */
    public static PeptideProblem withDefaults(ScoringConfig config) {
        return new PeptideProblem(TableScoringProvider.fromClasspath(), MotifCatalog.fromClasspath(), config);
    }

    @Override
    public int alphabetSize() { return ScoringProvider.ALPHABET_SIZE; }

    @Override
    public int targetLength() { return motif.length; }

    // ------------------- Evaluation -------------------

    @Override
    public double fitness(Sequence individual) {
        double alignment;
        if (config.bestOfCatalog()) {
            alignment = Double.POSITIVE_INFINITY;
            for (int m = 0; m < catalog.size(); m++) {
                alignment = Math.min(alignment, alignmentEnergy(individual, catalog.encoded(m)));
            }
        } else {
            alignment = alignmentEnergy(individual, motif);
        }
        return alignment + neighbourhoodEnergy(individual);
    }

    /** Negated substitution score against a motif repeated along the sequence. */
    double alignmentEnergy(Sequence individual, int[] reference) {
        double e = 0.0;
        for (int i = 0; i < individual.size(); i++) {
            e -= scoring.substitutionScore(individual.get(i), reference[i % reference.length]);
        }
        return e;
    }

    double neighbourhoodEnergy(Sequence individual) {
        double e = 0.0;
        for (int i = 1; i < individual.size(); i++) {
            e += scoring.adjacencyScore(individual.get(i - 1), individual.get(i));
        }
        return e;
    }

    @Override
    public double adjacencyScore(int a, int b) {
        return scoring.adjacencyScore(a, b);
    }

    @Override
    public boolean isFeasible(Sequence individual) {
        return BiologicalValidity.isValid(individual);
    }

    // ------------------- Moves -------------------

    @Override
    public Sequence randomIndividual(Random rng) {
        Sequence s = new Sequence(motif.length);
        for (int i = 0; i < motif.length; i++) s.add(rng.nextInt(alphabetSize()));
        return s;
    }

    @Override
    public List<Neighbour<Sequence, Move>> neighbourhood(Random rng, Sequence individual, int size) {
        List<Neighbour<Sequence, Move>> out = new ArrayList<>(size);
        final int n = individual.size();
        for (int k = 0; k < size; k++) {
            if (rng.nextDouble() < SUBSTITUTION_SHARE) {
                if (n == 0) continue;
                int pos = rng.nextInt(n);
                int old = individual.get(pos);
                int sym = rng.nextInt(alphabetSize() - 1);
                if (sym >= old) sym++; // uniform over the other symbols
                Move mv = new Move.Substitution(pos, old, sym);
                Sequence neigh = individual.copy();
                applyMove(neigh, mv);
                out.add(new Neighbour<>(neigh, mv));
            } else {
                if (n < 2) continue;
                int p1 = rng.nextInt(n);
                int p2 = rng.nextInt(n - 1);
                if (p2 >= p1) p2++;
                Move mv = new Move.Swap(p1, p2);
                Sequence neigh = individual.copy();
                applyMove(neigh, mv);
                out.add(new Neighbour<>(neigh, mv));
            }
        }
        return out;
    }

    @Override
    public void applyMove(Sequence individual, Move move) {
        if (move instanceof Move.Substitution) {
            Move.Substitution s = (Move.Substitution) move;
            checkPosition(individual, s.position(), move);
            if (individual.get(s.position()) != s.oldSymbol()) {
                throw new IllegalArgumentException("Stale move " + move + ": position holds "
                        + individual.get(s.position()));
            }
            if (s.newSymbol() < 0 || s.newSymbol() >= alphabetSize()) {
                throw new IllegalArgumentException("Symbol out of range in " + move);
            }
            individual.set(s.position(), s.newSymbol());
        } else if (move instanceof Move.Swap) {
            Move.Swap s = (Move.Swap) move;
            checkPosition(individual, s.p1(), move);
            checkPosition(individual, s.p2(), move);
            individual.swap(s.p1(), s.p2());
        } else {
            throw new UnsupportedOperationException(move.getClass().getSimpleName()
                    + " is not supported on fixed-length peptides");
        }
    }

    private static void checkPosition(Sequence individual, int pos, Move move) {
        if (pos < 0 || pos >= individual.size()) {
            throw new IllegalArgumentException("Move " + move + " out of range for length " + individual.size());
        }
    }

    /** Truncates, or pads with random residues, to the target length. */
    @Override
    public void repair(Sequence individual, Random rng) {
        while (individual.size() > motif.length) individual.remove(individual.size() - 1);
        while (individual.size() < motif.length) individual.add(rng.nextInt(alphabetSize()));
    }

    @Override
    public String toString() {
        return "PeptideProblem[motif=" + catalog.get(config.motifIndex()).letters()
                + (config.bestOfCatalog() ? ", best-of-catalog" : "") + "]";
    }
}
