package utils;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import metaheuristics.ga.NeighbourConfig;
import metaheuristics.ga.NeighbourGA;
import metaheuristics.ts.TabuConfig;
import metaheuristics.ts.TabuSearch;
import problems.peptide.PeptideProblem;
import problems.peptide.ScoringConfig;

/**
 * A test for {@link MetricsLogger}.
 */
public class MetricsLoggerTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private static List<String> lines(Path p) throws IOException {
		return Files.readAllLines(p, StandardCharsets.UTF_8);
	}

	@Test
	public void writesHeadersAndQuotesFields() throws IOException {
		Path dir = folder.getRoot().toPath().resolve("out");
		try (MetricsLogger log = MetricsLogger.inDirectory(dir, false)) {
			MetricsLogger.RunInfo info = new MetricsLogger.RunInfo("RGD", "GA", "pop=10, gens=2");
			log.logGeneration(info, 7L, 0, 3L, -1.5, -1.5, 2.0, 0.25, 0.1, 0.2);
			log.logRunSummary(info, 7L, 1, 3L, 1.0, -1.5, "[1, 2]", 0.1, 0.2);
		}
		List<String> gens = lines(dir.resolve("results_gens.csv"));
		List<String> runs = lines(dir.resolve("results_runs.csv"));
		assertEquals(2, gens.size());
		assertEquals(2, runs.size());
		assertTrue(gens.get(0).startsWith("timestamp,problem,algo,variant,seed,step"));
		assertTrue(gens.get(1).contains(",RGD,GA,\"pop=10, gens=2\",7,0,3,-1.500000,"));
		assertTrue(runs.get(1).contains("\"[1, 2]\""));
	}

	@Test
	public void appendingKeepsOneHeader() throws IOException {
		File dir = folder.newFolder("append");
		MetricsLogger.RunInfo info = new MetricsLogger.RunInfo("RGD", "Tabu", "x");
		for (int i = 0; i < 2; i++) {
			try (MetricsLogger log = MetricsLogger.inDirectory(dir.toPath(), true)) {
				log.logRunSummary(info, i, 1, 1L, 0.0, 0.0, "s", 0.0, 0.0);
			}
		}
		List<String> runs = lines(dir.toPath().resolve("results_runs.csv"));
		assertEquals(3, runs.size());
		assertTrue(runs.get(0).startsWith("timestamp"));
	}

	@Test
	public void enginesReportEveryStep() throws IOException {
		Path dir = folder.getRoot().toPath();
		PeptideProblem problem = PeptideProblem.withDefaults(ScoringConfig.motif(1));
		try (MetricsLogger log = MetricsLogger.inDirectory(dir, false)) {
			NeighbourGA ga = new NeighbourGA(problem, NeighbourConfig.defaults().withPopulationSize(20).withGenerations(5));
			ga.setMetricsLogger(log, new MetricsLogger.RunInfo("RGD", "NeighbourGA", "small"));
			ga.run(1);

			TabuSearch<?, ?> ts = new TabuSearch<>(problem, TabuConfig.defaults().withIterations(7));
			ts.setMetricsLogger(log, new MetricsLogger.RunInfo("RGD", "Tabu", "small"));
			ts.run(1);
		}
		assertEquals(1 + 5 + 7, lines(dir.resolve("results_gens.csv")).size());
		assertEquals(1 + 2, lines(dir.resolve("results_runs.csv")).size());
	}
}
