package problems.peptide.solvers;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import metaheuristics.RunResult;
import metaheuristics.ga.GAConfig;
import metaheuristics.ga.GeneticAlgorithm;
import metaheuristics.ga.NeighbourConfig;
import metaheuristics.ga.NeighbourGA;
import metaheuristics.ts.TabuConfig;
import metaheuristics.ts.TabuSearch;
import problems.Move;
import problems.peptide.Alphabet;
import problems.peptide.MotifCatalog;
import problems.peptide.PeptideProblem;
import problems.peptide.ScoringConfig;
import problems.peptide.ScoringProvider;
import problems.peptide.TableScoringProvider;
import solutions.Sequence;
import utils.MetricsLogger;

/**
 * Command-line comparison of the engines on the motif catalog: for every
 * selected motif it runs the baseline GA and the NeighbourGA (and optionally
 * tabu search) and prints the best peptides plus a summary table.
 */
public class PeptideDesign {

    private static final Logger logger = LogManager.getLogger(PeptideDesign.class.getName());

    /** Best result of one engine on one motif. */
    record Outcome(int motif, String engine, Sequence best, double fitness, double seconds) {}

    public static void main(String[] args) throws IOException {
        if (hasFlag(args, "--help") || hasFlag(args, "-h")) {
            printHelp();
            return;
        }

        Map<String, String> cli = parseArgsToMap(args);
        MotifCatalog catalog = MotifCatalog.fromClasspath();

        if (getBool(cli, new String[]{"list-motifs"}, false)) {
            System.out.println("Available motifs:");
            for (int i = 0; i < catalog.size(); i++) {
                MotifCatalog.Motif m = catalog.get(i);
                System.out.println(i + ": " + m.letters() + (m.description().isEmpty() ? "" : "  (" + m.description() + ")"));
            }
            return;
        }

        long seed = Long.parseLong(cli.getOrDefault("seed", "0"));
        int generations = getInt(cli, new String[]{"generations", "gens"}, 200);
        int popSize = getInt(cli, new String[]{"pop", "popSize"}, 400);
        double xover = getDouble(cli, new String[]{"crossover", "xover"}, 0.9);
        double mut = getDouble(cli, new String[]{"mutation", "mut"}, 0.3);
        int tournament = getInt(cli, new String[]{"tournament"}, 3);
        boolean bestMotif = getBool(cli, new String[]{"best-motif"}, false);
        boolean tabuOn = getBool(cli, new String[]{"tabu", "ts"}, false);
        String resultsDir = cli.get("results-dir");

        List<Integer> motifs = new ArrayList<>();
        if (cli.containsKey("motif")) {
            motifs.add(Integer.parseInt(cli.get("motif")));
        } else {
            for (int i = 0; i < catalog.size(); i++) motifs.add(i);
        }

        GAConfig gaConfig = GAConfig.defaults()
                .withPopulationSize(popSize)
                .withGenerations(generations)
                .withCrossover(GAConfig.Crossover.SINGLE_POINT, xover)
                .withMutation(mut, GAConfig.MutationWeights.defaults())
                .withTournamentSize(tournament);
        NeighbourConfig neighConfig = NeighbourConfig.defaults()
                .withPopulationSize(popSize)
                .withGenerations(generations)
                .withProbabilities(xover, mut);
        TabuConfig tabuConfig = TabuConfig.defaults()
                .withIterations(getInt(cli, new String[]{"ts-iterations"}, generations * 10));

        ScoringProvider scoring = TableScoringProvider.fromClasspath();
        MetricsLogger metrics = (resultsDir != null)
                ? MetricsLogger.inDirectory(Paths.get(resultsDir), true)
                : null;

        List<Outcome> outcomes = new ArrayList<>();
        try {
            System.out.println("=== COMPARATIVE ANALYSIS: GA vs NeighbourGA" + (tabuOn ? " vs Tabu" : "") + " ===");
            for (int motifIdx : motifs) {
                ScoringConfig scoringConfig = bestMotif
                        ? ScoringConfig.bestOfCatalog(motifIdx)
                        : ScoringConfig.motif(motifIdx);
                PeptideProblem problem = new PeptideProblem(scoring, catalog, scoringConfig);
                String tag = catalog.get(motifIdx).letters() + (bestMotif ? "/best" : "");
                long runSeed = seed + motifIdx;
                System.out.println("=== MOTIF " + motifIdx + ": " + catalog.get(motifIdx).letters() + " ===");

                GeneticAlgorithm ga = new GeneticAlgorithm(problem, gaConfig);
                NeighbourGA neigh = new NeighbourGA(problem, neighConfig);
                if (metrics != null) {
                    ga.setMetricsLogger(metrics, new MetricsLogger.RunInfo(tag, "GA", gaConfig.toString()));
                    neigh.setMetricsLogger(metrics, new MetricsLogger.RunInfo(tag, "NeighbourGA", neighConfig.toString()));
                }

                long t = System.nanoTime();
                RunResult<Sequence, ?> r = ga.run(runSeed);
                outcomes.add(report(motifIdx, "GA", r, t));

                t = System.nanoTime();
                r = neigh.run(runSeed);
                outcomes.add(report(motifIdx, "NeighbourGA", r, t));

                if (tabuOn) {
                    TabuSearch<Sequence, Move> ts = new TabuSearch<>(problem, tabuConfig);
                    if (metrics != null) {
                        ts.setMetricsLogger(metrics, new MetricsLogger.RunInfo(tag, "Tabu", tabuConfig.toString()));
                    }
                    t = System.nanoTime();
                    r = ts.run(runSeed);
                    outcomes.add(report(motifIdx, "Tabu", r, t));
                }
                System.out.println();
            }
        } finally {
            if (metrics != null) metrics.close();
        }

        printSummary(catalog, outcomes);
    }

    private static Outcome report(int motif, String engine, RunResult<Sequence, ?> r, long startNanos) {
        double secs = (System.nanoTime() - startNanos) / 1e9;
        System.out.printf(Locale.US, "%-12s best %s (fitness=%.4f, start=%.4f)  (Time: %.2fs)%n",
                engine + ":", Alphabet.format(r.best()), r.bestFitness(), r.initialFitness(), secs);
        return new Outcome(motif, engine, r.best(), r.bestFitness(), secs);
    }

    private static void printSummary(MotifCatalog catalog, List<Outcome> outcomes) {
        System.out.println("=== SUMMARY (lower is better) ===");
        System.out.printf(Locale.US, "%-3s %-25s %-12s %-24s %10s%n", "ID", "Motif", "Engine", "Best", "Fitness");
        System.out.println("-".repeat(80));
        Map<String, Integer> wins = new LinkedHashMap<>();
        int i = 0;
        while (i < outcomes.size()) {
            int motif = outcomes.get(i).motif();
            Outcome winner = null;
            boolean tie = false;
            for (; i < outcomes.size() && outcomes.get(i).motif() == motif; i++) {
                Outcome o = outcomes.get(i);
                wins.putIfAbsent(o.engine(), 0);
                String name = catalog.get(motif).letters();
                System.out.printf(Locale.US, "%-3d %-25s %-12s %-24s %10.4f%n", motif,
                        name.length() > 24 ? name.substring(0, 24) : name,
                        o.engine(), Alphabet.format(o.best()), o.fitness());
                if (winner == null || o.fitness() < winner.fitness()) {
                    winner = o;
                    tie = false;
                } else if (o.fitness() == winner.fitness()) {
                    tie = true;
                }
            }
            if (winner != null && !tie) wins.merge(winner.engine(), 1, Integer::sum);
        }
        System.out.println();
        System.out.println("=== OVERALL STATISTICS ===");
        for (Map.Entry<String, Integer> e : wins.entrySet()) {
            System.out.printf(Locale.US, "%-12s wins: %d%n", e.getKey(), e.getValue());
        }
        logger.info("Compared {} engine runs", outcomes.size());
    }

    /* ====================== Simple CLI Helpers ====================== */

    static Map<String, String> parseArgsToMap(String[] args) {
        Map<String, String> map = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (!a.startsWith("--")) continue;

            // --key=value
            int eq = a.indexOf('=');
            if (eq > 2) {
                map.put(a.substring(2, eq).trim(), a.substring(eq + 1).trim());
                continue;
            }

            // --key value, or a bare boolean flag
            String k = a.substring(2).trim();
            String v = "true";
            if ((i + 1) < args.length && !args[i + 1].startsWith("--")) {
                v = args[++i].trim();
            }
            map.put(k, v);
        }
        return map;
    }

    static boolean hasFlag(String[] args, String flag) {
        for (String a : args) if (a.equals(flag)) return true;
        return false;
    }

    static int getInt(Map<String, String> m, String[] keys, int def) {
        for (String k : keys) if (m.containsKey(k)) return Integer.parseInt(m.get(k));
        return def;
    }

    static double getDouble(Map<String, String> m, String[] keys, double def) {
        for (String k : keys) if (m.containsKey(k)) return Double.parseDouble(m.get(k));
        return def;
    }

    static boolean getBool(Map<String, String> m, String[] keys, boolean def) {
        for (String k : keys) if (m.containsKey(k)) return parseBool(m.get(k), def);
        return def;
    }

    static boolean parseBool(String s, boolean def) {
        if (s == null) return def;
        switch (s.toLowerCase(Locale.ROOT)) {
            case "1": case "true": case "yes": case "y": case "on": return true;
            case "0": case "false": case "no": case "n": case "off": return false;
            default: return def;
        }
    }

    static void printHelp() {
        System.out.println("Usage (named parameters in any order):");
        System.out.println("  --seed <n>                     (default: 0; motif i runs with seed+i)");
        System.out.println("  --generations|--gens <n>       (default: 200)");
        System.out.println("  --pop|--popSize <n>            (default: 400)");
        System.out.println("  --crossover|--xover <p>        (default: 0.9)");
        System.out.println("  --mutation|--mut <p>           (default: 0.3)");
        System.out.println("  --tournament <k>               (baseline GA; default: 3)");
        System.out.println("  --motif <idx>                  (default: every motif)");
        System.out.println("  --best-motif <true/false>      (score against the best motif of the catalog)");
        System.out.println("  --tabu <true/false>            (also run tabu search)");
        System.out.println("  --ts-iterations <n>            (default: 10 x generations)");
        System.out.println("  --results-dir <dir>            (append CSV metrics to results_runs.csv / results_gens.csv)");
        System.out.println("  --list-motifs                  (print the catalog and exit)");
    }
}
