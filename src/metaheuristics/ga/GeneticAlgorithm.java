package metaheuristics.ga;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import problems.SequenceProblem;
import solutions.Sequence;

/**
 * Baseline generational GA. Each child comes from two tournament-selected
 * parents, a probability-gated crossover and at most one weighted mutation.
 * There is no elitism: the final population may lose the best individual seen
 * during the run.
 */
public class GeneticAlgorithm extends AbstractGA {

	private static final Logger logger = LogManager.getLogger(GeneticAlgorithm.class.getName());

	private final GAConfig config;
	private final int minLength;
	private final int maxLength;

	public GeneticAlgorithm(SequenceProblem problem, GAConfig config) {
		super(problem, config.populationSize(), config.generations());
		this.config = config;
		this.minLength = config.minLength() > 0 ? config.minLength() : problem.targetLength();
		this.maxLength = config.maxLength() > 0 ? config.maxLength() : problem.targetLength();
		if (minLength > maxLength) {
			throw new IllegalArgumentException("Length bounds [" + minLength + ", " + maxLength
					+ "] are empty for target length " + problem.targetLength());
		}
		logger.debug("Length bounds [{}, {}]", minLength, maxLength);
	}

	@Override
	protected String name() {
		return "GA";
	}

	@Override
	protected Population nextGeneration(Population population, double[] fitness) {
		Population next = new Population(popSize);
		while (next.size() < popSize) {
			Sequence parent1 = population.get(tournament(fitness, config.tournamentSize()));
			Sequence parent2 = population.get(tournament(fitness, config.tournamentSize()));
			Sequence child = crossover(parent1, parent2);
			mutate(child);
			next.add(child);
		}
		return next;
	}

	protected Sequence crossover(Sequence parent1, Sequence parent2) {
		if (rng.nextDouble() >= config.crossoverProbability()) return parent1.copy();
		switch (config.crossover()) {
			case UNIFORM:
				return Crossovers.uniform(parent1, parent2, rng);
			case SINGLE_POINT:
			default:
				return Crossovers.singlePoint(parent1, parent2, rng);
		}
	}

	/**
	 * With the mutation probability, applies one operator drawn by weight.
	 * Insertion only applies below the maximum length and deletion only above
	 * the minimum length; when the drawn one does not apply, a swap is tried
	 * instead.
	 */
	protected void mutate(Sequence child) {
		if (rng.nextDouble() >= config.mutationProbability()) return;

		GAConfig.MutationWeights w = config.mutationWeights();
		double r = rng.nextDouble() * w.total();
		final int alphabet = problem.alphabetSize();

		if (r < w.substitution()) {
			Mutations.substitute(child, alphabet, rng);
			return;
		}
		r -= w.substitution();
		if (r < w.insertion()) {
			if (child.size() < maxLength) {
				Mutations.insert(child, alphabet, rng);
				return;
			}
		} else if (r - w.insertion() < w.deletion()) {
			if (child.size() > minLength) {
				Mutations.delete(child, rng);
				return;
			}
		}
		Mutations.swap(child, rng);
	}

}
