package utils;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import solutions.Sequence;

/**
 * A test for {@link Diversity}.
 */
public class DiversityTest {

	private static final double PRECISION = 1e-9;

	@Test
	public void hammingCountsExtraLengthAsMismatches() {
		assertEquals(0.0, Diversity.hamming01(Sequence.of(1, 2, 3), Sequence.of(1, 2, 3)), PRECISION);
		assertEquals(0.25, Diversity.hamming01(Sequence.of(1, 2, 3), Sequence.of(1, 2, 3, 4)), PRECISION);
		assertEquals(0.5, Diversity.hamming01(Sequence.of(1, 2, 3, 4), Sequence.of(1, 0, 3, 0)), PRECISION);
		assertEquals(0.0, Diversity.hamming01(new Sequence(), new Sequence()), PRECISION);
	}

	@Test
	public void medoidDistance() {
		List<Sequence> pop = Arrays.asList(Sequence.of(0, 0), Sequence.of(0, 1), Sequence.of(1, 1));
		// medoid (0,1) is at distance 1/2 from both others
		assertEquals(0.5, Diversity.meanHammingToMedoid(pop), PRECISION);
		assertEquals(0.0, Diversity.meanHammingToMedoid(Collections.singletonList(Sequence.of(3))), PRECISION);
	}

	@Test
	public void entropyOfUniformAndMonomorphicPopulations() {
		List<Sequence> same = Arrays.asList(Sequence.of(2, 2), Sequence.of(2, 2));
		assertEquals(0.0, Diversity.meanLocusEntropy(same, 4), PRECISION);

		List<Sequence> spread = Arrays.asList(Sequence.of(0), Sequence.of(1), Sequence.of(2), Sequence.of(3));
		assertEquals(1.0, Diversity.meanLocusEntropy(spread, 4), PRECISION);
	}
}
