package metaheuristics.ts;

/**
 * Parameters of a {@link TabuSearch} run.
 *
 * @param iterations
 *            Fixed iteration budget.
 * @param neighbourhoodSize
 *            Number of neighbours sampled per iteration.
 * @param tabuLength
 *            Capacity of the tabu list.
 * @param aspirationMargin
 *            A tabu move is still admissible when its candidate beats the
 *            current fitness by more than this margin.
 * @param reheatInterval
 *            The tabu list is cleared every this many iterations.
 */
public record TabuConfig(int iterations, int neighbourhoodSize, int tabuLength,
		double aspirationMargin, int reheatInterval) {

	public TabuConfig {
		if (iterations < 0) throw new IllegalArgumentException("iterations must be >= 0, got " + iterations);
		if (neighbourhoodSize < 1) throw new IllegalArgumentException("neighbourhoodSize must be >= 1, got " + neighbourhoodSize);
		if (tabuLength < 1) throw new IllegalArgumentException("tabuLength must be >= 1, got " + tabuLength);
		if (!(aspirationMargin >= 0.0) || Double.isInfinite(aspirationMargin)) {
			throw new IllegalArgumentException("aspirationMargin must be a finite value >= 0, got " + aspirationMargin);
		}
		if (reheatInterval < 1) throw new IllegalArgumentException("reheatInterval must be >= 1, got " + reheatInterval);
	}

	public static TabuConfig defaults() {
		return new TabuConfig(1000, 50, 10, 1.0, 10_000);
	}

	public TabuConfig withIterations(int iterations) {
		return new TabuConfig(iterations, neighbourhoodSize, tabuLength, aspirationMargin, reheatInterval);
	}

	public TabuConfig withNeighbourhoodSize(int neighbourhoodSize) {
		return new TabuConfig(iterations, neighbourhoodSize, tabuLength, aspirationMargin, reheatInterval);
	}

	public TabuConfig withTabuLength(int tabuLength) {
		return new TabuConfig(iterations, neighbourhoodSize, tabuLength, aspirationMargin, reheatInterval);
	}

	public TabuConfig withAspirationMargin(double aspirationMargin) {
		return new TabuConfig(iterations, neighbourhoodSize, tabuLength, aspirationMargin, reheatInterval);
	}

	public TabuConfig withReheatInterval(int reheatInterval) {
		return new TabuConfig(iterations, neighbourhoodSize, tabuLength, aspirationMargin, reheatInterval);
	}
}
