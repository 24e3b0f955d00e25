package metaheuristics.ga;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import metaheuristics.RunResult;
import problems.SequenceProblem;
import solutions.Sequence;
import utils.Diversity;
import utils.MetricsLogger;

/**
 * Abstract class for generational GAs over symbol sequences. It considers the
 * minimization of the fitness given by a {@link SequenceProblem}.
 *
 * Subclasses decide how one generation is bred from the previous one
 * ({@link #nextGeneration}); this class owns the run loop, fitness bookkeeping,
 * tournament selection and progress reporting. Every run draws its randomness
 * from a generator seeded by {@link #run(long)}, so an instance must not be
 * shared by concurrent runs.
 */
public abstract class AbstractGA {

	@SuppressWarnings("serial")
	public static class Population extends ArrayList<Sequence> {
		public Population() {
			super();
		}

		public Population(int capacity) {
			super(capacity);
		}
	}

	private static final Logger logger = LogManager.getLogger(AbstractGA.class.getName());

	/**
	 * The problem being optimized.
	 */
	protected final SequenceProblem problem;

	/**
	 * The size of the population.
	 */
	protected final int popSize;

	/**
	 * The number of generations of a run.
	 */
	protected final int generations;

	/**
	 * The random number generator of the current run.
	 */
	protected Random rng;

	protected MetricsLogger metricsLogger;
	protected MetricsLogger.RunInfo runInfo;

	/**
	 * Whether generation statistics include population diversity. Enabled
	 * automatically when a metrics logger is attached.
	 */
	protected boolean trackDiversity = false;

	/**
	 * The constructor for the GA class.
	 *
	 * @param problem
	 *            The problem being optimized.
	 * @param popSize
	 *            Population size.
	 * @param generations
	 *            Number of generations.
	 */
	protected AbstractGA(SequenceProblem problem, int popSize, int generations) {
		this.problem = problem;
		this.popSize = popSize;
		this.generations = generations;
	}

	public void setMetricsLogger(MetricsLogger logger, MetricsLogger.RunInfo runInfo) {
		this.metricsLogger = logger;
		this.runInfo = runInfo;
		if (logger != null) this.trackDiversity = true;
	}

	/**
	 * Breeds the next generation.
	 *
	 * @param population
	 *            The current population.
	 * @param fitness
	 *            Fitness of each member of {@code population}, by index.
	 * @return A new population of {@link #popSize} fresh individuals.
	 */
	protected abstract Population nextGeneration(Population population, double[] fitness);

	/**
	 * @return Short algorithm name used in logs.
	 */
	protected abstract String name();

	/**
	 * GA mainframe: initializes a population and evolves it for a fixed number
	 * of generations, with no early stop.
	 *
	 * @param seed
	 *            Seed of the run's random number generator.
	 * @return The lowest-fitness member of the final population and one
	 *         {@link GenerationStats} per generation.
	 */
	public RunResult<Sequence, GenerationStats> run(long seed) {
		rng = new Random(seed);
		final long t0 = System.nanoTime();
		logger.info("{} on {}: pop={}, generations={}, seed={}", name(), problem, popSize, generations, seed);

		Population population = initializePopulation();
		double[] fitness = evaluate(population);
		final double initialFit = fitness[bestIndex(fitness)];
		double bestSoFar = initialFit;
		logger.debug("(Gen. 0) best = {}", initialFit);

		List<GenerationStats> trace = new ArrayList<>(generations);
		double accDivHamming = 0.0, accDivEntropy = 0.0;

		for (int g = 0; g < generations; g++) {
			population = nextGeneration(population, fitness);
			fitness = evaluate(population);

			GenerationStats stats = statistics(g, population, fitness);
			trace.add(stats);
			accDivHamming += stats.divHamming();
			accDivEntropy += stats.divEntropy();

			if (stats.min() < bestSoFar) {
				bestSoFar = stats.min();
				logger.debug("(Gen. {}) best = {}", g + 1, bestSoFar);
			}
			if (metricsLogger != null) {
				long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
				metricsLogger.logGeneration(runInfo, seed, g, elapsedMs, stats.min(),
						stats.min(), stats.max(), stats.mean(), stats.divHamming(), stats.divEntropy());
			}
		}

		int bi = bestIndex(fitness);
		Sequence best = population.get(bi);
		long totalMs = (System.nanoTime() - t0) / 1_000_000L;
		logger.info("{} finished after {} generations: best = {} (gen. 0: {}) in {} s",
				name(), generations, fitness[bi], initialFit, totalMs / 1000.0);

		if (metricsLogger != null) {
			double n = Math.max(1, generations);
			metricsLogger.logRunSummary(runInfo, seed, generations, totalMs, initialFit, fitness[bi],
					best.toString(), accDivHamming / n, accDivEntropy / n);
		}
		return new RunResult<>(best, fitness[bi], initialFit, trace);
	}

	/**
	 * Randomly generates an initial population to start the GA.
	 *
	 * @return A population of individuals.
	 */
	protected Population initializePopulation() {
		Population population = new Population(popSize);
		while (population.size() < popSize) {
			population.add(problem.randomIndividual(rng));
		}
		return population;
	}

	protected double[] evaluate(Population population) {
		double[] fitness = new double[population.size()];
		for (int i = 0; i < fitness.length; i++) {
			fitness[i] = problem.fitness(population.get(i));
		}
		return fitness;
	}

	/**
	 * Index of the lowest fitness; the first one wins ties.
	 */
	protected static int bestIndex(double[] fitness) {
		int best = 0;
		for (int i = 1; i < fitness.length; i++) {
			if (fitness[i] < fitness[best]) best = i;
		}
		return best;
	}

	/**
	 * Tournament selection: samples {@code k} members uniformly with
	 * replacement and returns the index of the fittest; the first one seen
	 * wins ties.
	 */
	protected int tournament(double[] fitness, int k) {
		int best = rng.nextInt(fitness.length);
		for (int i = 1; i < k; i++) {
			int idx = rng.nextInt(fitness.length);
			if (fitness[idx] < fitness[best]) best = idx;
		}
		return best;
	}

	protected GenerationStats statistics(int generation, Population population, double[] fitness) {
		DescriptiveStatistics ds = new DescriptiveStatistics(fitness);
		double divH = Double.NaN, divE = Double.NaN;
		if (trackDiversity) {
			divH = Diversity.meanHammingToMedoid(population);
			divE = Diversity.meanLocusEntropy(population, problem.alphabetSize());
		}
		return new GenerationStats(generation, ds.getMin(), ds.getMax(), ds.getMean(), divH, divE);
	}

}
