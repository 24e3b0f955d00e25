package problems;

import solutions.Sequence;

/**
 * A problem whose individuals are symbol sequences over a fixed alphabet.
 * The population engines need the extra structure exposed here (alphabet,
 * target length, domain validity, local pair scores) to build their
 * sequence-specific operators.
 */
public interface SequenceProblem extends Problem<Sequence, Move> {

	/**
	 * @return The number of symbols; valid symbols are {@code 0..alphabetSize()-1}.
	 */
	int alphabetSize();

	/**
	 * @return The length every individual must have in fixed-length engines.
	 */
	int targetLength();

	/**
	 * Domain-validity predicate. The default accepts every sequence.
	 */
	default boolean isFeasible(Sequence individual) {
		return true;
	}

	/**
	 * Score contribution of symbol {@code b} following symbol {@code a}. Used
	 * by cheap local approximations of the full fitness; lower is better.
	 */
	double adjacencyScore(int a, int b);

}
