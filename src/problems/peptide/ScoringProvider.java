package problems.peptide;

/**
 * Pairwise score lookups the peptide energy is composed from. Symbols are
 * alphabet indices in {@code 0..ALPHABET_SIZE-1}.
 */
public interface ScoringProvider {

    int ALPHABET_SIZE = Alphabet.SIZE;

    /** Similarity of residue {@code a} to residue {@code b} (higher is more similar). */
    double substitutionScore(int a, int b);

    /** Energy of residue {@code b} immediately following residue {@code a} (lower is better). */
    double adjacencyScore(int a, int b);
}
