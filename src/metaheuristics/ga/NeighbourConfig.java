package metaheuristics.ga;

/**
 * Parameters of the {@link NeighbourGA}.
 *
 * @param populationSize
 *            Number of individuals per generation.
 * @param generations
 *            Number of generations of a run.
 * @param crossoverProbability
 *            Probability that a parent pair is recombined rather than copied.
 * @param mutationProbability
 *            Probability of each of the two length-preserving mutations,
 *            applied independently to every child.
 * @param crossover
 *            Recombination strategy.
 * @param elitism
 *            Whether the previous generation's best is carried over.
 * @param localSearch
 *            Whether children may undergo hill-climbing refinement.
 * @param maxRegenerationAttempts
 *            Cap on random individuals generated to replace one invalid child.
 */
public record NeighbourConfig(int populationSize, int generations,
		double crossoverProbability, double mutationProbability,
		Crossover crossover, Elitism elitism, boolean localSearch,
		int maxRegenerationAttempts) {

	public enum Crossover {
		/** Per-position coin exchange between the two parents. */
		UNIFORM,
		/** Allele choice by full fitness of the child being built. */
		GUIDED,
		/** Allele choice by adjacency score against the left neighbour. */
		GUIDED_LOCAL
	}

	public enum Elitism {
		/** The previous generation's best is reinserted into a random slot if it was lost. */
		REINSERT_BEST,
		/** Plain generational replacement. */
		NONE
	}

	public NeighbourConfig {
		if (populationSize < 1) throw new IllegalArgumentException("populationSize must be >= 1, got " + populationSize);
		if (generations < 0) throw new IllegalArgumentException("generations must be >= 0, got " + generations);
		GAConfig.checkProbability("crossoverProbability", crossoverProbability);
		GAConfig.checkProbability("mutationProbability", mutationProbability);
		if (crossover == null) throw new IllegalArgumentException("crossover must not be null");
		if (elitism == null) throw new IllegalArgumentException("elitism must not be null");
		if (maxRegenerationAttempts < 1) {
			throw new IllegalArgumentException("maxRegenerationAttempts must be >= 1, got " + maxRegenerationAttempts);
		}
	}

	public static NeighbourConfig defaults() {
		return new NeighbourConfig(400, 500, 0.9, 0.25, Crossover.GUIDED, Elitism.REINSERT_BEST, true, 10_000);
	}

	public NeighbourConfig withPopulationSize(int populationSize) {
		return new NeighbourConfig(populationSize, generations, crossoverProbability, mutationProbability,
				crossover, elitism, localSearch, maxRegenerationAttempts);
	}

	public NeighbourConfig withGenerations(int generations) {
		return new NeighbourConfig(populationSize, generations, crossoverProbability, mutationProbability,
				crossover, elitism, localSearch, maxRegenerationAttempts);
	}

	public NeighbourConfig withProbabilities(double crossoverProbability, double mutationProbability) {
		return new NeighbourConfig(populationSize, generations, crossoverProbability, mutationProbability,
				crossover, elitism, localSearch, maxRegenerationAttempts);
	}

	public NeighbourConfig withCrossover(Crossover crossover) {
		return new NeighbourConfig(populationSize, generations, crossoverProbability, mutationProbability,
				crossover, elitism, localSearch, maxRegenerationAttempts);
	}

	public NeighbourConfig withElitism(Elitism elitism) {
		return new NeighbourConfig(populationSize, generations, crossoverProbability, mutationProbability,
				crossover, elitism, localSearch, maxRegenerationAttempts);
	}

	public NeighbourConfig withLocalSearch(boolean localSearch) {
		return new NeighbourConfig(populationSize, generations, crossoverProbability, mutationProbability,
				crossover, elitism, localSearch, maxRegenerationAttempts);
	}

	public NeighbourConfig withMaxRegenerationAttempts(int maxRegenerationAttempts) {
		return new NeighbourConfig(populationSize, generations, crossoverProbability, mutationProbability,
				crossover, elitism, localSearch, maxRegenerationAttempts);
	}
}
