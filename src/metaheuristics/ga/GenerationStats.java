package metaheuristics.ga;

/**
 * Fitness summary of the population after one generation. Diversity values
 * are NaN when diversity tracking is off.
 */
public record GenerationStats(int generation, double min, double max, double mean,
		double divHamming, double divEntropy) {
}
