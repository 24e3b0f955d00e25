package problems;

import java.util.List;
import java.util.Random;

/**
 * Contract between a search strategy and the problem it optimizes. The
 * problem owns everything domain specific (how individuals look, how they
 * are scored and how they are perturbed), so the engines only deal with
 * individuals, moves and fitness values. Fitness is minimized.
 *
 * @param <I>
 *            Type of an individual (candidate solution).
 * @param <M>
 *            Type of a recorded move between two individuals.
 */
public interface Problem<I, M> {

	/**
	 * Generates a uniformly random individual satisfying every shape invariant
	 * of the problem (e.g. the target length of fixed-length problems).
	 *
	 * @param rng
	 *            The engine's random number generator.
	 * @return A new individual.
	 */
	I randomIndividual(Random rng);

	/**
	 * Evaluates an individual. Must be pure and deterministic for a given
	 * problem instance; lower is better and the result is never NaN.
	 *
	 * @param individual
	 *            The individual being evaluated.
	 * @return The fitness (energy) of the individual.
	 */
	double fitness(I individual);

	/**
	 * Samples single-move neighbours of an individual. The individual itself
	 * is not modified. Implementations may return fewer than {@code size}
	 * neighbours when a drawn operator is not applicable to the individual.
	 *
	 * @param rng
	 *            The engine's random number generator.
	 * @param individual
	 *            The individual whose neighbourhood is sampled.
	 * @param size
	 *            The number of draws.
	 * @return The sampled neighbours, each with the move that produced it.
	 */
	List<Neighbour<I, M>> neighbourhood(Random rng, I individual, int size);

	/**
	 * Applies a move in place. Applying a move to the individual it was
	 * generated from reproduces the reported neighbour exactly.
	 *
	 * @param individual
	 *            The individual being modified.
	 * @param move
	 *            The move to apply.
	 * @throws IllegalArgumentException
	 *             if the move's positions do not match the individual.
	 * @throws UnsupportedOperationException
	 *             if the problem does not support the kind of move.
	 */
	void applyMove(I individual, M move);

	/**
	 * Restores shape invariants in place. Must be idempotent. The default
	 * implementation does nothing.
	 *
	 * @param individual
	 *            The individual being repaired.
	 * @param rng
	 *            Source of randomness for any symbols the repair must invent.
	 */
	default void repair(I individual, Random rng) {
		// no-op by default
	}

}
