package metaheuristics;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of one engine run.
 *
 * @param best
 *            The best individual found.
 * @param bestFitness
 *            Its fitness.
 * @param initialFitness
 *            Fitness of the starting point (best of the initial population
 *            for population engines).
 * @param trace
 *            One progress record per iteration or generation.
 */
public record RunResult<I, T>(I best, double bestFitness, double initialFitness, List<T> trace) {

	public RunResult {
		trace = Collections.unmodifiableList(trace);
	}

}
