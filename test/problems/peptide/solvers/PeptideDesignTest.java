package problems.peptide.solvers;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

/**
 * A test for {@link PeptideDesign}.
 */
public class PeptideDesignTest {

	private final ByteArrayOutputStream out = new ByteArrayOutputStream();
	private PrintStream stdout;

	@Before
	public void captureOutput() {
		stdout = System.out;
		System.setOut(new PrintStream(out, true));
	}

	@After
	public void restoreOutput() {
		System.setOut(stdout);
	}

	private String output() {
		return new String(out.toByteArray(), StandardCharsets.UTF_8);
	}

	@Test
	public void parsesBothOptionForms() {
		Map<String, String> m = PeptideDesign.parseArgsToMap(
				new String[] {"--seed=5", "--pop", "30", "--tabu", "--motif", "2", "stray"});
		assertEquals("5", m.get("seed"));
		assertEquals("30", m.get("pop"));
		assertEquals("true", m.get("tabu"));
		assertEquals("2", m.get("motif"));
		assertEquals(30, PeptideDesign.getInt(m, new String[] {"generations", "pop"}, 1));
		assertEquals(0.5, PeptideDesign.getDouble(m, new String[] {"mut"}, 0.5), 0.0);
	}

	@Test
	public void booleanSpellings() {
		assertTrue(PeptideDesign.parseBool("Yes", false));
		assertFalse(PeptideDesign.parseBool("off", true));
		assertTrue(PeptideDesign.parseBool("maybe", true));
	}

	@Test
	public void listsMotifs() throws IOException {
		PeptideDesign.main(new String[] {"--list-motifs"});
		String text = output();
		assertTrue(text.contains("0: GGAGGVGKS"));
		assertTrue(text.contains("12: KWRWKRWKK"));
	}

	@Test
	public void comparesEnginesOnOneMotif() throws IOException {
		PeptideDesign.main(new String[] {"--motif", "1", "--pop", "20", "--gens", "3", "--tabu", "--ts-iterations", "20"});
		String text = output();
		assertTrue(text.contains("=== MOTIF 1: RGD ==="));
		assertTrue(text.contains("NeighbourGA:"));
		assertTrue(text.contains("Tabu:"));
		assertTrue(text.contains("=== OVERALL STATISTICS ==="));
	}
}
