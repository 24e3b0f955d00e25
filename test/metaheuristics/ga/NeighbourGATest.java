package metaheuristics.ga;

import static org.junit.Assert.*;

import java.util.List;
import java.util.Random;

import org.junit.Test;

import metaheuristics.RunResult;
import metaheuristics.ls.HillClimber;
import problems.peptide.Alphabet;
import problems.peptide.BiologicalValidity;
import problems.peptide.MotifCatalog;
import problems.peptide.PeptideProblem;
import problems.peptide.ScoringConfig;
import problems.peptide.TableScoringProvider;
import solutions.Sequence;

/**
 * A test for {@link NeighbourGA}.
 */
public class NeighbourGATest {

	private static final double PRECISION = 1e-9;

	private final PeptideProblem problem = PeptideProblem.withDefaults(ScoringConfig.motif(0));

	private final NeighbourConfig small = NeighbourConfig.defaults().withPopulationSize(50).withGenerations(30);

	private static void assertWellFormed(PeptideProblem problem, RunResult<Sequence, GenerationStats> r) {
		assertEquals(problem.targetLength(), r.best().size());
		for (int aa : r.best()) assertTrue(aa >= 0 && aa < 20);
		assertTrue("best must pass the validity predicate", BiologicalValidity.isValid(r.best()));
		assertEquals(problem.fitness(r.best()), r.bestFitness(), PRECISION);
	}

	@Test
	public void designsValidPeptideForFirstMotif() {
		RunResult<Sequence, GenerationStats> r = new NeighbourGA(problem, small).run(2024);
		assertEquals(9, r.best().size());
		assertWellFormed(problem, r);
		assertTrue(r.bestFitness() <= r.initialFitness());
		assertEquals(30, r.trace().size());
	}

	@Test
	public void elitismKeepsGenerationBestNonIncreasing() {
		List<GenerationStats> trace = new NeighbourGA(problem, small).run(8).trace();
		for (int g = 1; g < trace.size(); g++) {
			assertTrue(trace.get(g).min() <= trace.get(g - 1).min() + PRECISION);
		}
	}

	@Test
	public void sameSeedSameRun() {
		NeighbourGA ga = new NeighbourGA(problem, small.withGenerations(10));
		RunResult<Sequence, GenerationStats> a = ga.run(5);
		RunResult<Sequence, GenerationStats> b = ga.run(5);
		assertEquals(a.best(), b.best());
		assertEquals(a.trace(), b.trace());
	}

	@Test
	public void uniformCrossoverWithoutElitism() {
		NeighbourConfig cfg = small.withCrossover(NeighbourConfig.Crossover.UNIFORM)
				.withElitism(NeighbourConfig.Elitism.NONE)
				.withLocalSearch(false);
		assertWellFormed(problem, new NeighbourGA(problem, cfg).run(11));
	}

	@Test
	public void guidedLocalCrossover() {
		NeighbourConfig cfg = small.withCrossover(NeighbourConfig.Crossover.GUIDED_LOCAL);
		RunResult<Sequence, GenerationStats> r = new NeighbourGA(problem, cfg).run(12);
		assertWellFormed(problem, r);
		assertTrue(r.bestFitness() <= r.initialFitness());
	}

	@Test
	public void bestOfCatalogScoring() {
		PeptideProblem best = PeptideProblem.withDefaults(ScoringConfig.bestOfCatalog(2));
		assertWellFormed(best, new NeighbourGA(best, small.withGenerations(10)).run(13));
	}

	@Test
	public void replacementImproverIsUsed() {
		final int[] calls = {0};
		NeighbourGA ga = new NeighbourGA(problem, small.withLocalSearch(false));
		ga.setImprover(s -> {
			calls[0]++;
			return s;
		});
		ga.run(21);
		assertTrue(calls[0] > 0);
	}

	@Test
	public void refinementOnlySeesValidChildren() {
		NeighbourGA ga = new NeighbourGA(problem, small.withElitism(NeighbourConfig.Elitism.NONE));
		HillClimber climber = new HillClimber(problem);
		final int[] calls = {0};
		ga.setImprover(s -> {
			assertTrue("refined child must be valid: " + s, BiologicalValidity.isValid(s));
			calls[0]++;
			Sequence out = climber.improve(s);
			assertTrue(BiologicalValidity.isValid(out));
			return out;
		});
		ga.rng = new Random(31);

		// all-basic parents: every child they breed fails the hydropathy rule
		AbstractGA.Population basic = new AbstractGA.Population();
		for (int i = 0; i < 50; i++) basic.add(Alphabet.parse("RRKRRKRRK"));
		double[] fitness = ga.evaluate(basic);
		for (int round = 0; round < 40; round++) {
			for (Sequence child : ga.nextGeneration(basic, fitness)) {
				assertTrue(BiologicalValidity.isValid(child));
			}
		}
		assertTrue(calls[0] > 0);
	}

	@Test
	public void unsatisfiablePredicateFailsAfterConfiguredAttempts() {
		PeptideProblem impossible = new PeptideProblem(TableScoringProvider.fromClasspath(),
				MotifCatalog.fromClasspath(), ScoringConfig.motif(0)) {
			@Override
			public boolean isFeasible(Sequence individual) {
				return false;
			}
		};
		NeighbourGA ga = new NeighbourGA(impossible, small.withMaxRegenerationAttempts(5));
		try {
			ga.run(1);
			fail("Expected UnsatisfiableConstraintException");
		} catch (UnsatisfiableConstraintException e) {
			assertEquals(5, e.getAttempts());
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void rejectsZeroRegenerationAttempts() {
		small.withMaxRegenerationAttempts(0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void rejectsMutationProbabilityAboveOne() {
		small.withProbabilities(0.9, 1.01);
	}
}
