package problems;

/**
 * An elementary, recorded transformation of a symbol sequence. Moves are
 * values: two moves are equal when they have the same kind and the same
 * recorded fields, which is what tabu membership relies on.
 */
public interface Move {

	/** Replaces the symbol at {@code position}, which must currently be {@code oldSymbol}. */
	record Substitution(int position, int oldSymbol, int newSymbol) implements Move {
	}

	/** Exchanges the symbols at two distinct positions. */
	record Swap(int p1, int p2) implements Move {
	}

	/** Inserts {@code symbol} before {@code position} (0..length). */
	record Insertion(int position, int symbol) implements Move {
	}

	/** Removes the symbol at {@code position}, which must currently be {@code symbol}. */
	record Deletion(int position, int symbol) implements Move {
	}

}
