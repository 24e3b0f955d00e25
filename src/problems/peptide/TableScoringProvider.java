package problems.peptide;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A {@link ScoringProvider} backed by two 20x20 tables: a substitution matrix
 * (BLOSUM62 by default) and a pairwise neighbourhood energy table.
 *
 * Table files are whitespace separated. Lines starting with '#' are comments,
 * the first remaining line lists the column letters and every following line
 * starts with its row letter. Rows and columns may come in any order; they are
 * mapped onto {@link Alphabet} indices through their letters.
 */
public class TableScoringProvider implements ScoringProvider {

    public static final String BLOSUM62_RESOURCE = "peptide/blosum62.txt";
    public static final String ADJACENCY_RESOURCE = "peptide/nepre_f6.txt";

    private static final Logger logger = LogManager.getLogger(TableScoringProvider.class.getName());

    private final double[][] substitution;
    private final double[][] adjacency;

    public TableScoringProvider(double[][] substitution, double[][] adjacency) {
        this.substitution = checkShape(substitution, "substitution");
        this.adjacency = checkShape(adjacency, "adjacency");
    }

    /**
     * Loads the tables shipped with the library.
     */
    public static TableScoringProvider fromClasspath() {
        return new TableScoringProvider(readTable(BLOSUM62_RESOURCE), readTable(ADJACENCY_RESOURCE));
    }

    @Override
    public double substitutionScore(int a, int b) {
        return substitution[a][b];
    }

    @Override
    public double adjacencyScore(int a, int b) {
        return adjacency[a][b];
    }

    /**
     * Reads a headed table from the classpath.
     *
     * @throws IllegalStateException
     *             if the resource is missing or malformed.
     */
    public static double[][] readTable(String resource) {
        InputStream in = TableScoringProvider.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) throw new IllegalStateException("Missing scoring table " + resource);
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            return parse(br, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Couldn't read scoring table " + resource, e);
        }
    }

    static double[][] parse(BufferedReader br, String source) throws IOException {
        List<String[]> rows = new ArrayList<>();
        for (String ln; (ln = br.readLine()) != null; ) {
            ln = ln.trim();
            if (ln.isEmpty() || ln.startsWith("#")) continue;
            rows.add(ln.split("\\s+"));
        }
        if (rows.isEmpty()) throw new IllegalStateException("Empty scoring table " + source);

        String[] header = rows.get(0);
        if (header.length != ALPHABET_SIZE) {
            throw new IllegalStateException(source + ": expected " + ALPHABET_SIZE + " columns, found " + header.length);
        }
        int[] columns = new int[header.length];
        for (int j = 0; j < header.length; j++) columns[j] = letterIndex(header[j], source);

        double[][] table = new double[ALPHABET_SIZE][ALPHABET_SIZE];
        boolean[] seen = new boolean[ALPHABET_SIZE];
        for (String[] row : rows.subList(1, rows.size())) {
            if (row.length != ALPHABET_SIZE + 1) {
                throw new IllegalStateException(source + ": couldn't parse row starting with " + row[0]);
            }
            int r = letterIndex(row[0], source);
            if (seen[r]) logger.warn("{}: row {} appears more than once, keeping the last one", source, row[0]);
            seen[r] = true;
            for (int j = 0; j < ALPHABET_SIZE; j++) {
                table[r][columns[j]] = Double.parseDouble(row[j + 1]);
            }
        }
        for (int r = 0; r < ALPHABET_SIZE; r++) {
            if (!seen[r]) throw new IllegalStateException(source + ": no row for " + Alphabet.letterOf(r));
        }
        logger.debug("Loaded {}x{} table from {}", ALPHABET_SIZE, ALPHABET_SIZE, source);
        return table;
    }

    private static int letterIndex(String token, String source) {
        if (token.length() != 1) throw new IllegalStateException(source + ": bad residue label '" + token + "'");
        return Alphabet.indexOf(token.charAt(0));
    }

    private static double[][] checkShape(double[][] table, String name) {
        if (table == null || table.length != ALPHABET_SIZE) {
            throw new IllegalArgumentException(name + " table must have " + ALPHABET_SIZE + " rows");
        }
        double[][] copy = new double[ALPHABET_SIZE][];
        for (int i = 0; i < ALPHABET_SIZE; i++) {
            if (table[i].length != ALPHABET_SIZE) {
                throw new IllegalArgumentException(name + " table row " + i + " must have " + ALPHABET_SIZE + " columns");
            }
            copy[i] = table[i].clone();
        }
        return copy;
    }
}
