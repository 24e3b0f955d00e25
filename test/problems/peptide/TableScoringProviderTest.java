package problems.peptide;

import static org.junit.Assert.*;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;

import org.junit.Test;

/**
 * A test for {@link TableScoringProvider}.
 */
public class TableScoringProviderTest {

	private static final double PRECISION = Math.pow(2, -16);

	private final TableScoringProvider tables = TableScoringProvider.fromClasspath();

	@Test
	public void blosumIsMappedOntoAlphabetOrder() {
		assertEquals(4, tables.substitutionScore(Alphabet.indexOf('A'), Alphabet.indexOf('A')), PRECISION);
		assertEquals(11, tables.substitutionScore(Alphabet.indexOf('W'), Alphabet.indexOf('W')), PRECISION);
		assertEquals(9, tables.substitutionScore(Alphabet.indexOf('C'), Alphabet.indexOf('C')), PRECISION);
		assertEquals(-4, tables.substitutionScore(Alphabet.indexOf('W'), Alphabet.indexOf('N')), PRECISION);
		assertEquals(3, tables.substitutionScore(Alphabet.indexOf('I'), Alphabet.indexOf('V')), PRECISION);
	}

	@Test
	public void tablesAreSymmetric() {
		for (int a = 0; a < ScoringProvider.ALPHABET_SIZE; a++) {
			for (int b = 0; b < ScoringProvider.ALPHABET_SIZE; b++) {
				assertEquals(tables.substitutionScore(a, b), tables.substitutionScore(b, a), PRECISION);
				assertEquals(tables.adjacencyScore(a, b), tables.adjacencyScore(b, a), PRECISION);
				assertFalse(Double.isNaN(tables.adjacencyScore(a, b)));
			}
		}
	}

	@Test
	public void parsesRowsInAnyOrder() throws IOException {
		StringBuilder sb = new StringBuilder("# comment\n");
		String letters = new StringBuilder(Alphabet.LETTERS).reverse().toString();
		for (char c : letters.toCharArray()) sb.append(' ').append(c);
		sb.append('\n');
		for (char r : letters.toCharArray()) {
			sb.append(r);
			for (char c : letters.toCharArray()) sb.append(' ').append(r == c ? "1" : "0");
			sb.append('\n');
		}
		double[][] t = TableScoringProvider.parse(new BufferedReader(new StringReader(sb.toString())), "test");
		for (int i = 0; i < ScoringProvider.ALPHABET_SIZE; i++) {
			for (int j = 0; j < ScoringProvider.ALPHABET_SIZE; j++) {
				assertEquals(i == j ? 1.0 : 0.0, t[i][j], PRECISION);
			}
		}
	}

	@Test(expected = IllegalStateException.class)
	public void rejectsMissingRows() throws IOException {
		String header = String.join(" ", Alphabet.LETTERS.split("")) + "\n";
		TableScoringProvider.parse(new BufferedReader(new StringReader(header)), "test");
	}

	@Test(expected = IllegalStateException.class)
	public void rejectsMissingResource() {
		TableScoringProvider.readTable("peptide/no-such-table.txt");
	}

	@Test(expected = IllegalArgumentException.class)
	public void rejectsWrongShape() {
		new TableScoringProvider(new double[3][3], new double[20][20]);
	}
}
