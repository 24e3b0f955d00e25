package problems;

/**
 * A neighbour produced by {@link Problem#neighbourhood}: the candidate and the
 * move that turns the originating individual into it.
 */
public record Neighbour<I, M>(I candidate, M move) {
}
