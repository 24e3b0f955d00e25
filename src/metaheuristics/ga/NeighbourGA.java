package metaheuristics.ga;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import metaheuristics.ls.HillClimber;
import metaheuristics.ls.LocalImprover;
import problems.SequenceProblem;
import solutions.Sequence;

/**
 * Fixed-length GA with problem-aware operators. Parents are picked by size-3
 * tournaments and bred in pairs:
 * <ol>
 * <li>crossover (uniform or guided, see {@link NeighbourConfig.Crossover});</li>
 * <li>substitution and range inversion, each with the mutation probability,
 * followed by repair to the target length;</li>
 * <li>replacement of children failing the problem's validity predicate by
 * fresh random valid individuals;</li>
 * <li>occasional hill-climbing refinement, more likely for short sequences.
 * The climber only visits valid sequences, so refined children stay valid.</li>
 * </ol>
 * The initial population goes through the same validity filter. With {@link NeighbourConfig.Elitism#REINSERT_BEST} the best individual of a
 * generation is guaranteed to survive into the next one.
 */
public class NeighbourGA extends AbstractGA {

	public static final int TOURNAMENT_SIZE = 3;

	/** Probability that a child is considered for refinement at all. */
	public static final double REFINEMENT_GATE = 0.20;
	/** Refinement probability for sequences up to {@link #SHORT_LENGTH} symbols. */
	public static final double SHORT_REFINEMENT = 0.60;
	/** Refinement probability for longer sequences. */
	public static final double LONG_REFINEMENT = 0.20;
	public static final int SHORT_LENGTH = 5;

	/** Regeneration attempts after which a warning is logged. */
	private static final int SLOW_REGENERATION = 1_000;

	private static final Logger logger = LogManager.getLogger(NeighbourGA.class.getName());

	private final NeighbourConfig config;

	/** Optional local improver; a {@link HillClimber} unless replaced. */
	protected LocalImprover<Sequence> improver;

	public NeighbourGA(SequenceProblem problem, NeighbourConfig config) {
		super(problem, config.populationSize(), config.generations());
		this.config = config;
		this.improver = config.localSearch() ? new HillClimber(problem) : null;
	}

	public void setImprover(LocalImprover<Sequence> improver) {
		this.improver = improver;
	}

	@Override
	protected String name() {
		return "NeighbourGA";
	}

	/**
	 * Random initial population, filtered by the validity predicate like every
	 * later child.
	 */
	@Override
	protected Population initializePopulation() {
		Population population = new Population(popSize);
		while (population.size() < popSize) {
			population.add(ensureValid(problem.randomIndividual(rng)));
		}
		return population;
	}

	@Override
	protected Population nextGeneration(Population population, double[] fitness) {
		Population next = new Population(popSize);

		while (next.size() < popSize) {
			Sequence parentA = population.get(tournament(fitness, TOURNAMENT_SIZE));
			Sequence parentB = population.get(tournament(fitness, TOURNAMENT_SIZE));

			Sequence[] children = crossover(parentA, parentB);
			Sequence childA = children[0], childB = children[1];

			mutate(childA);
			mutate(childB);
			problem.repair(childA, rng);
			problem.repair(childB, rng);

			childA = ensureValid(childA);
			childB = ensureValid(childB);

			refine(childA);
			refine(childB);

			next.add(childA);
			if (next.size() < popSize) next.add(childB);
		}

		if (config.elitism() == NeighbourConfig.Elitism.REINSERT_BEST) {
			keepElite(population.get(bestIndex(fitness)), next);
		}
		return next;
	}

	protected Sequence[] crossover(Sequence parentA, Sequence parentB) {
		if (rng.nextDouble() >= config.crossoverProbability()) {
			return new Sequence[] {parentA.copy(), parentB.copy()};
		}
		switch (config.crossover()) {
			case GUIDED:
				return new Sequence[] {
					Crossovers.guided(problem, parentA, parentB, rng),
					Crossovers.guided(problem, parentB, parentA, rng)
				};
			case GUIDED_LOCAL:
				return new Sequence[] {
					Crossovers.guidedLocal(problem, parentA, parentB, rng),
					Crossovers.guidedLocal(problem, parentB, parentA, rng)
				};
			case UNIFORM:
			default:
				return Crossovers.uniformPair(parentA, parentB, rng);
		}
	}

	/** Length-preserving mutations, each applied independently. */
	protected void mutate(Sequence child) {
		if (rng.nextDouble() < config.mutationProbability()) {
			Mutations.substitute(child, problem.alphabetSize(), rng);
		}
		if (rng.nextDouble() < config.mutationProbability()) {
			Mutations.invert(child, rng);
		}
	}

	protected void refine(Sequence child) {
		if (improver == null) return;
		if (rng.nextDouble() >= REFINEMENT_GATE) return;
		double p = child.size() <= SHORT_LENGTH ? SHORT_REFINEMENT : LONG_REFINEMENT;
		if (rng.nextDouble() < p) {
			improver.improve(child);
		}
	}

	/**
	 * Returns the child itself when it passes the validity predicate, otherwise
	 * the first repaired random individual that does.
	 *
	 * @throws UnsatisfiableConstraintException
	 *             if no valid individual is found within the configured number
	 *             of attempts.
	 */
	protected Sequence ensureValid(Sequence child) {
		if (problem.isFeasible(child)) return child;
		for (int attempt = 1; attempt <= config.maxRegenerationAttempts(); attempt++) {
			Sequence cand = problem.randomIndividual(rng);
			problem.repair(cand, rng);
			if (problem.isFeasible(cand)) return cand;
			if (attempt == SLOW_REGENERATION) {
				logger.warn("No valid individual after {} attempts on {}; continuing up to {}",
						attempt, problem, config.maxRegenerationAttempts());
			}
		}
		throw new UnsatisfiableConstraintException(config.maxRegenerationAttempts());
	}

	/** Reinserts the elite into a random slot when no equal individual survived. */
	protected void keepElite(Sequence elite, Population next) {
		if (!next.contains(elite)) {
			next.set(rng.nextInt(next.size()), elite.copy());
		}
	}

}
