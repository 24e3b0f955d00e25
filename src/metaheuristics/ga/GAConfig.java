package metaheuristics.ga;

/**
 * Parameters of the baseline {@link GeneticAlgorithm}.
 *
 * @param populationSize
 *            Number of individuals per generation.
 * @param generations
 *            Number of generations of a run.
 * @param crossoverProbability
 *            Probability that a child is recombined rather than cloned from
 *            its first parent.
 * @param crossover
 *            Recombination operator.
 * @param mutationProbability
 *            Probability that a child undergoes one mutation.
 * @param tournamentSize
 *            Number of draws per tournament.
 * @param mutationWeights
 *            Relative weights of the mutation operators.
 * @param minLength
 *            Deletion is only applied above this length; 0 means the
 *            problem's target length.
 * @param maxLength
 *            Insertion is only applied below this length; 0 means the
 *            problem's target length.
 */
public record GAConfig(int populationSize, int generations,
		double crossoverProbability, Crossover crossover,
		double mutationProbability, int tournamentSize,
		MutationWeights mutationWeights, int minLength, int maxLength) {

	public enum Crossover {
		SINGLE_POINT, UNIFORM
	}

	/**
	 * Relative weights of the four mutation operators; one operator is drawn
	 * per mutation with probability proportional to its weight.
	 */
	public record MutationWeights(double substitution, double insertion, double deletion, double swap) {

		public MutationWeights {
			if (substitution < 0 || insertion < 0 || deletion < 0 || swap < 0
					|| Double.isNaN(substitution + insertion + deletion + swap)) {
				throw new IllegalArgumentException("Mutation weights must be >= 0");
			}
			if (substitution + insertion + deletion + swap <= 0) {
				throw new IllegalArgumentException("At least one mutation weight must be positive");
			}
		}

		public static MutationWeights defaults() {
			return new MutationWeights(0.35, 0.20, 0.20, 0.25);
		}

		public double total() {
			return substitution + insertion + deletion + swap;
		}
	}

	public GAConfig {
		if (populationSize < 1) throw new IllegalArgumentException("populationSize must be >= 1, got " + populationSize);
		if (generations < 0) throw new IllegalArgumentException("generations must be >= 0, got " + generations);
		checkProbability("crossoverProbability", crossoverProbability);
		checkProbability("mutationProbability", mutationProbability);
		if (crossover == null) throw new IllegalArgumentException("crossover must not be null");
		if (tournamentSize < 1) throw new IllegalArgumentException("tournamentSize must be >= 1, got " + tournamentSize);
		if (mutationWeights == null) throw new IllegalArgumentException("mutationWeights must not be null");
		if (minLength < 0 || maxLength < 0) throw new IllegalArgumentException("length bounds must be >= 0");
		if (minLength > 0 && maxLength > 0 && minLength > maxLength) {
			throw new IllegalArgumentException("minLength " + minLength + " > maxLength " + maxLength);
		}
	}

	static void checkProbability(String name, double p) {
		if (!(p >= 0.0 && p <= 1.0)) throw new IllegalArgumentException(name + " must be in [0, 1], got " + p);
	}

	/** Fixed-length defaults: insertion and deletion never fire. */
	public static GAConfig defaults() {
		return new GAConfig(400, 200, 0.9, Crossover.SINGLE_POINT, 0.3, 3, MutationWeights.defaults(), 0, 0);
	}

	public GAConfig withPopulationSize(int populationSize) {
		return new GAConfig(populationSize, generations, crossoverProbability, crossover, mutationProbability,
				tournamentSize, mutationWeights, minLength, maxLength);
	}

	public GAConfig withGenerations(int generations) {
		return new GAConfig(populationSize, generations, crossoverProbability, crossover, mutationProbability,
				tournamentSize, mutationWeights, minLength, maxLength);
	}

	public GAConfig withCrossover(Crossover crossover, double crossoverProbability) {
		return new GAConfig(populationSize, generations, crossoverProbability, crossover, mutationProbability,
				tournamentSize, mutationWeights, minLength, maxLength);
	}

	public GAConfig withMutation(double mutationProbability, MutationWeights mutationWeights) {
		return new GAConfig(populationSize, generations, crossoverProbability, crossover, mutationProbability,
				tournamentSize, mutationWeights, minLength, maxLength);
	}

	public GAConfig withTournamentSize(int tournamentSize) {
		return new GAConfig(populationSize, generations, crossoverProbability, crossover, mutationProbability,
				tournamentSize, mutationWeights, minLength, maxLength);
	}

	/** Variable-length mode: sequences may grow up to {@code maxLength} and shrink down to {@code minLength}. */
	public GAConfig withLengthBounds(int minLength, int maxLength) {
		return new GAConfig(populationSize, generations, crossoverProbability, crossover, mutationProbability,
				tournamentSize, mutationWeights, minLength, maxLength);
	}
}
