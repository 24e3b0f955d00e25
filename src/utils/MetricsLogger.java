package utils;

import java.io.*;
import java.nio.file.*;
import java.time.*;
import java.util.*;

/**
 * CSV sink for per-step progress ({@code results_gens.csv}) and per-run
 * summaries ({@code results_runs.csv}). Steps are generations for the
 * population engines and iterations for tabu search.
 */
public final class MetricsLogger implements AutoCloseable {
  private final PrintWriter runsOut;
  private final PrintWriter gensOut;

  /** Identifies the runs written by one engine configuration. */
  public static record RunInfo(String problem, String algo, String variant) {}

  public MetricsLogger(Path runsCsv, Path gensCsv, boolean append) throws IOException {
    boolean runsExists = Files.exists(runsCsv);
    boolean gensExists = Files.exists(gensCsv);
    this.runsOut = new PrintWriter(Files.newBufferedWriter(runsCsv, openOptions(append)));
    this.gensOut = new PrintWriter(Files.newBufferedWriter(gensCsv, openOptions(append)));
    if (!append || !runsExists) {
      runsOut.println(String.join(",",
        "timestamp","problem","algo","variant","seed",
        "steps","time_ms",
        "initial_f","best_f","best_seq",
        "div_hamming_avg","div_entropy_avg"));
      runsOut.flush();
    }
    if (!append || !gensExists) {
      gensOut.println(String.join(",",
        "timestamp","problem","algo","variant","seed",
        "step","elapsed_ms","best_f","min_f","max_f","mean_f",
        "div_hamming","div_entropy"));
      gensOut.flush();
    }
  }

  /** Opens {@code results_runs.csv} and {@code results_gens.csv} inside a directory, creating it if needed. */
  public static MetricsLogger inDirectory(Path dir, boolean append) throws IOException {
    Files.createDirectories(dir);
    return new MetricsLogger(dir.resolve("results_runs.csv"), dir.resolve("results_gens.csv"), append);
  }

  private static OpenOption[] openOptions(boolean append) {
    return append
      ? new OpenOption[] {StandardOpenOption.CREATE, StandardOpenOption.APPEND}
      : new OpenOption[] {StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE};
  }

  public void logGeneration(RunInfo info, long seed,
                            int step, long elapsedMs, double bestF,
                            double minF, double maxF, double meanF,
                            double divHamming, double divEntropy) {
    gensOut.printf(Locale.US,
      "%s,%s,%s,%s,%d,%d,%d,%.6f,%.6f,%.6f,%.6f,%.6f,%.6f%n",
      Instant.now(), csv(info.problem()), csv(info.algo()), csv(info.variant()), seed,
      step, elapsedMs, bestF, minF, maxF, meanF, divHamming, divEntropy);
    gensOut.flush();
  }

  public void logRunSummary(RunInfo info, long seed, int steps, long timeMs,
                            double initialF, double bestF, String bestSeq,
                            double divHammingAvg, double divEntropyAvg) {
    runsOut.printf(Locale.US,
      "%s,%s,%s,%s,%d,%d,%d,%.6f,%.6f,%s,%.6f,%.6f%n",
      Instant.now(), csv(info.problem()), csv(info.algo()), csv(info.variant()), seed,
      steps, timeMs, initialF, bestF, csv(bestSeq), divHammingAvg, divEntropyAvg);
    runsOut.flush();
  }

  /** Quotes a field when it contains a separator. */
  private static String csv(String s) {
    if (s == null) return "";
    if (s.indexOf(',') < 0 && s.indexOf('"') < 0) return s;
    return '"' + s.replace("\"", "\"\"") + '"';
  }

  @Override public void close() { gensOut.close(); runsOut.close(); }
}
