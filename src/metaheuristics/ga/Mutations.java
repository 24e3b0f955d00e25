package metaheuristics.ga;

import java.util.Random;

import solutions.Sequence;

/**
 * Elementary mutation operators shared by the GA engines. Each one mutates the
 * sequence in place and reports whether it was applicable.
 */
public final class Mutations {

	private Mutations() {
	}

	/** Replaces one position with a different symbol. */
	public static boolean substitute(Sequence s, int alphabetSize, Random rng) {
		if (s.isEmpty()) return false;
		int pos = rng.nextInt(s.size());
		int old = s.get(pos);
		int sym = rng.nextInt(alphabetSize - 1);
		if (sym >= old) sym++;
		s.set(pos, sym);
		return true;
	}

	/** Inserts a random symbol at a random position in [0, |s|]. */
	public static boolean insert(Sequence s, int alphabetSize, Random rng) {
		int pos = rng.nextInt(s.size() + 1);
		s.add(pos, rng.nextInt(alphabetSize));
		return true;
	}

	/** Removes the symbol at a random position. */
	public static boolean delete(Sequence s, Random rng) {
		if (s.isEmpty()) return false;
		s.remove(rng.nextInt(s.size()));
		return true;
	}

	/** Exchanges two distinct positions. */
	public static boolean swap(Sequence s, Random rng) {
		if (s.size() < 2) return false;
		int p1 = rng.nextInt(s.size());
		int p2 = rng.nextInt(s.size() - 1);
		if (p2 >= p1) p2++;
		s.swap(p1, p2);
		return true;
	}

	/** Reverses a random contiguous range [i, j] with i &lt; j; needs at least 3 symbols. */
	public static boolean invert(Sequence s, Random rng) {
		if (s.size() < 3) return false;
		int i = rng.nextInt(s.size() - 1);
		int j = i + 1 + rng.nextInt(s.size() - i - 1);
		s.reverse(i, j);
		return true;
	}

}
