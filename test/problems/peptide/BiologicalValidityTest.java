package problems.peptide;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import solutions.Sequence;

/**
 * A test for {@link BiologicalValidity}.
 */
@RunWith(Parameterized.class)
public class BiologicalValidityTest {

	private final String peptide;
	private final boolean expected;

	public BiologicalValidityTest(String peptide, boolean expected) {
		this.peptide = peptide;
		this.expected = expected;
	}

	@Test
	public final void test() {
		assertEquals("Wrong verdict for '" + peptide + "'", expected, BiologicalValidity.isValid(Alphabet.parse(peptide)));
	}

	@Parameters(name = "{0} -> {1}")
	public static Collection<Object[]> getInstances() {
		List<Object[]> list = new ArrayList<>();
		list.add(new Object[] {"", false});            // empty
		list.add(new Object[] {"GGAGGVGKS", true});
		list.add(new Object[] {"AGYLLGKLGAALKG", true});
		list.add(new Object[] {"AAAA", false});        // run of 4
		list.add(new Object[] {"AAAVAAAV", true});     // runs of 3 are fine
		list.add(new Object[] {"LLLLV", false});       // run of 4 at the start
		list.add(new Object[] {"AVCCAV", false});      // CC
		list.add(new Object[] {"AVPPAV", false});      // PP
		list.add(new Object[] {"ACPCPA", true});       // C and P, never doubled
		list.add(new Object[] {"RKRKRK", false});      // mean hydropathy -4.2
		list.add(new Object[] {"IVIVIV", false});      // mean hydropathy 4.35
		list.add(new Object[] {"G", true});            // mean -0.4
		list.add(new Object[] {"LA", true});           // mean 2.8
		return list;
	}

	@Test
	public void rejectsEmptySequence() {
		assertFalse(BiologicalValidity.isValid(new Sequence()));
	}

	@Test
	public void rejectsEveryHomopolymerOfFour() {
		for (int aa = 0; aa < Alphabet.SIZE; aa++) {
			Sequence s = Sequence.of(Alphabet.indexOf('A'), Alphabet.indexOf('V'), aa, aa, aa, aa, Alphabet.indexOf('S'));
			assertFalse("Run of " + Alphabet.letterOf(aa), BiologicalValidity.isValid(s));
		}
	}

	@Test
	public void meanHydropathyWindow() {
		assertTrue(BiologicalValidity.hasPlausibleHydropathy(Arrays.asList(
				Alphabet.indexOf('A'), Alphabet.indexOf('K'))));          // (1.8 - 3.9) / 2 = -1.05
		assertFalse(BiologicalValidity.hasPlausibleHydropathy(Arrays.asList(
				Alphabet.indexOf('S'), Alphabet.indexOf('R'))));          // -2.65
		assertTrue(BiologicalValidity.hasPlausibleHydropathy(Arrays.asList(
				Alphabet.indexOf('M'), Alphabet.indexOf('I'), Alphabet.indexOf('C'), Alphabet.indexOf('A'))));
	}
}
