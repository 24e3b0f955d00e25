package metaheuristics.ga;

import java.util.Random;

import problems.SequenceProblem;
import solutions.Sequence;

/**
 * Recombination operators shared by the GA engines. Parents are never
 * modified; children are fresh sequences.
 */
public final class Crossovers {

	private Crossovers() {
	}

	/**
	 * Single-point crossover. A cut is drawn uniformly in [1, min(|a|, |b|)) and
	 * the child takes {@code a} before the cut and {@code b} from the cut on, so
	 * its length is {@code |b|}. When no cut exists (a parent shorter than 2)
	 * the child is a copy of {@code a}.
	 *
	 *              cut
	 *    a: A1 ... Ac-1 | Ac ... An
	 *    b: B1 ... Bc-1 | Bc ... Bm
	 *
	 *    child: A1 ... Ac-1 | Bc ... Bm
	 */
	public static Sequence singlePoint(Sequence a, Sequence b, Random rng) {
		int common = Math.min(a.size(), b.size());
		if (common < 2) return a.copy();
		int cut = 1 + rng.nextInt(common - 1);
		Sequence child = new Sequence(b.size());
		child.addAll(a.subList(0, cut));
		child.addAll(b.subList(cut, b.size()));
		return child;
	}

	/**
	 * Uniform crossover producing one child shaped like {@code a}: every
	 * position both parents have is taken from {@code a} or {@code b} with a
	 * fair coin.
	 */
	public static Sequence uniform(Sequence a, Sequence b, Random rng) {
		Sequence child = a.copy();
		int common = Math.min(a.size(), b.size());
		for (int i = 0; i < common; i++) {
			if (rng.nextBoolean()) child.set(i, b.get(i));
		}
		return child;
	}

	/**
	 * Uniform crossover producing two complementary children: at every common
	 * position a fair coin decides whether the parents' alleles are exchanged.
	 */
	public static Sequence[] uniformPair(Sequence a, Sequence b, Random rng) {
		Sequence childA = a.copy();
		Sequence childB = b.copy();
		int common = Math.min(a.size(), b.size());
		for (int i = 0; i < common; i++) {
			if (rng.nextBoolean()) {
				childA.set(i, b.get(i));
				childB.set(i, a.get(i));
			}
		}
		return new Sequence[] {childA, childB};
	}

	/**
	 * Guided uniform crossover. Starting from a copy of {@code a}, every position
	 * where the parents disagree keeps whichever allele gives the lower full
	 * fitness of the child built so far (ties keep {@code a}'s). Finally, with
	 * probability 1/2 position 0 takes {@code b}'s allele to keep diversity.
	 */
	public static Sequence guided(SequenceProblem problem, Sequence a, Sequence b, Random rng) {
		Sequence child = a.copy();
		int common = Math.min(a.size(), b.size());
		for (int i = 0; i < common; i++) {
			int alleleA = a.get(i), alleleB = b.get(i);
			if (alleleA == alleleB) continue;

			child.set(i, alleleB);
			double fitB = problem.fitness(child);
			child.set(i, alleleA);
			double fitA = problem.fitness(child);

			if (fitB < fitA) child.set(i, alleleB);
		}
		randomizeFirstLocus(child, b, rng);
		return child;
	}

	/**
	 * Cheaper variant of {@link #guided}: instead of the full fitness, each
	 * disagreeing position compares the adjacency score of both alleles against
	 * the already fixed left neighbour. Position 0 has no left neighbour and
	 * keeps {@code a}'s allele before the diversity step.
	 */
	public static Sequence guidedLocal(SequenceProblem problem, Sequence a, Sequence b, Random rng) {
		Sequence child = a.copy();
		int common = Math.min(a.size(), b.size());
		for (int i = 1; i < common; i++) {
			int alleleA = a.get(i), alleleB = b.get(i);
			if (alleleA == alleleB) continue;
			int left = child.get(i - 1);
			if (problem.adjacencyScore(left, alleleB) < problem.adjacencyScore(left, alleleA)) {
				child.set(i, alleleB);
			}
		}
		randomizeFirstLocus(child, b, rng);
		return child;
	}

	private static void randomizeFirstLocus(Sequence child, Sequence other, Random rng) {
		if (rng.nextBoolean() && !child.isEmpty() && !other.isEmpty()) {
			child.set(0, other.get(0));
		}
	}

}
