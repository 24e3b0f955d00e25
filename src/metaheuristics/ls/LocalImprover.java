package metaheuristics.ls;

/**
 * Local improver interface (e.g., hill climbing).
 * Works directly on an individual of the population.
 */
public interface LocalImprover<I> {
    /**
     * Improves the given individual.
     * @param individual starting point; may be modified in place
     * @return the improved individual (may be the same reference)
     */
    I improve(I individual);
}
