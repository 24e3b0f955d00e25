package metaheuristics.ts;

/**
 * Progress of a trajectory search after one iteration.
 */
public record IterationRecord(int iteration, double bestFitness) {
}
