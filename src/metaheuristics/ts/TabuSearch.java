package metaheuristics.ts;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import metaheuristics.RunResult;
import problems.Neighbour;
import problems.Problem;
import utils.MetricsLogger;

/**
 * Trajectory tabu search over any {@link Problem}. Each iteration samples a
 * neighbourhood of the current individual and moves to its best admissible
 * member, even when that member is worse than the current one. A move is
 * admissible when it is not in the tabu list or when its candidate beats the
 * current fitness by more than the aspiration margin. The tabu list is cleared
 * periodically ("reheat"). Fitness is minimized.
 *
 * @param <I>
 *            Type of an individual.
 * @param <M>
 *            Type of a move.
 */
public class TabuSearch<I, M> {

	private static final Logger logger = LogManager.getLogger(TabuSearch.class.getName());

	private final Problem<I, M> problem;
	private final TabuConfig config;

	private MetricsLogger metricsLogger;
	private MetricsLogger.RunInfo runInfo;

	public TabuSearch(Problem<I, M> problem, TabuConfig config) {
		this.problem = problem;
		this.config = config;
	}

	public void setMetricsLogger(MetricsLogger metricsLogger, MetricsLogger.RunInfo runInfo) {
		this.metricsLogger = metricsLogger;
		this.runInfo = runInfo;
	}

	/**
	 * Runs the search for the configured number of iterations.
	 *
	 * @param seed
	 *            Seed of the run's random number generator.
	 * @return The best individual and one (iteration, best fitness) record per
	 *         iteration.
	 */
	public RunResult<I, IterationRecord> run(long seed) {
		final Random rng = new Random(seed);
		final long t0 = System.nanoTime();
		logger.info("Tabu search on {} with {} (seed {})", problem, config, seed);

		I current = problem.randomIndividual(rng);
		double currentFit = problem.fitness(current);
		I best = current;
		double bestFit = currentFit;
		final double initialFit = currentFit;

		TabuList<M> tabu = new TabuList<>(config.tabuLength());
		List<IterationRecord> trace = new ArrayList<>(config.iterations());

		for (int it = 0; it < config.iterations(); it++) {

			// Best admissible neighbour; the first one seen wins ties.
			I chosen = null;
			M chosenMove = null;
			double chosenFit = Double.POSITIVE_INFINITY;
			for (Neighbour<I, M> n : problem.neighbourhood(rng, current, config.neighbourhoodSize())) {
				double f = problem.fitness(n.candidate());
				if (tabu.contains(n.move()) && !aspires(f, currentFit)) continue;
				if (chosen == null || f < chosenFit) {
					chosen = n.candidate();
					chosenMove = n.move();
					chosenFit = f;
				}
			}

			if (chosen != null) {
				current = chosen;
				currentFit = chosenFit;
				tabu.push(chosenMove);
			}

			if (currentFit < bestFit) {
				best = current;
				bestFit = currentFit;
				logger.debug("(Iter. {}) best = {}", it, bestFit);
			}
			trace.add(new IterationRecord(it, bestFit));

			if (metricsLogger != null) {
				long elapsedMs = (System.nanoTime() - t0) / 1_000_000L;
				metricsLogger.logGeneration(runInfo, seed, it, elapsedMs, bestFit,
						currentFit, currentFit, currentFit, Double.NaN, Double.NaN);
			}

			if (it != 0 && it % config.reheatInterval() == 0) {
				tabu.clear();
			}
		}

		long totalMs = (System.nanoTime() - t0) / 1_000_000L;
		logger.info("Tabu search finished after {} iterations: best = {} (start {}) in {} s",
				config.iterations(), bestFit, initialFit, totalMs / 1000.0);
		if (metricsLogger != null) {
			metricsLogger.logRunSummary(runInfo, seed, config.iterations(), totalMs,
					initialFit, bestFit, String.valueOf(best), Double.NaN, Double.NaN);
		}
		return new RunResult<>(best, bestFit, initialFit, trace);
	}

	/** Aspiration criterion: a tabu candidate is admissible if it beats current by the margin. */
	protected boolean aspires(double candidateFit, double currentFit) {
		return candidateFit + config.aspirationMargin() < currentFit;
	}

}
