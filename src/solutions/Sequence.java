package solutions;

import java.util.ArrayList;
import java.util.Collection;

/**
 * A candidate solution: an ordered sequence of symbol indices drawn from a
 * fixed alphabet. Individuals are mutated in place by the engines, so callers
 * that need a snapshot must {@link #copy()} first.
 */
@SuppressWarnings("serial")
public class Sequence extends ArrayList<Integer> {

	public Sequence() {
		super();
	}

	public Sequence(int capacity) {
		super(capacity);
	}

	public Sequence(Collection<Integer> symbols) {
		super(symbols);
	}

	/**
	 * Builds a sequence from raw symbol indices.
	 */
	public static Sequence of(int... symbols) {
		Sequence s = new Sequence(symbols.length);
		for (int v : symbols) s.add(v);
		return s;
	}

	public Sequence copy() {
		return new Sequence(this);
	}

	/**
	 * Exchanges the symbols at two positions.
	 */
	public void swap(int p1, int p2) {
		Integer tmp = get(p1);
		set(p1, get(p2));
		set(p2, tmp);
	}

	/**
	 * Reverses the closed range [from, to].
	 */
	public void reverse(int from, int to) {
		while (from < to) {
			swap(from++, to--);
		}
	}

}
