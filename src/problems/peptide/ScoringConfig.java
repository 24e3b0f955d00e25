package problems.peptide;

/**
 * Which reference motif the energy aligns against. In best-of-catalog mode the
 * substitution term is the minimum over every motif, while the selected motif
 * still fixes the target length.
 *
 * @param motifIndex
 *            Index of the selected motif in the catalog.
 * @param bestOfCatalog
 *            Whether to score against every motif and keep the lowest energy.
 */
public record ScoringConfig(int motifIndex, boolean bestOfCatalog) {

    public ScoringConfig {
        if (motifIndex < 0) throw new IllegalArgumentException("motifIndex must be >= 0, got " + motifIndex);
    }

    public static ScoringConfig motif(int motifIndex) {
        return new ScoringConfig(motifIndex, false);
    }

    public static ScoringConfig bestOfCatalog(int motifIndex) {
        return new ScoringConfig(motifIndex, true);
    }
}
