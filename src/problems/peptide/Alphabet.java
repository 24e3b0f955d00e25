package problems.peptide;

import solutions.Sequence;

/**
 * The 20 standard amino acids, indexed in one-letter-code alphabetical order
 * (A=0, C=1, ..., Y=19), together with their Kyte-Doolittle hydropathy.
 */
public final class Alphabet {

    public static final int SIZE = 20;

    public static final String LETTERS = "ACDEFGHIKLMNPQRSTVWY";

    public static final int CYS = LETTERS.indexOf('C');
    public static final int PRO = LETTERS.indexOf('P');

    private static final double[] HYDROPATHY = {
        1.8, 2.5, -3.5, -3.5, 2.8, -0.4, -3.2, 4.5, -3.9, 3.8,
        1.9, -3.5, -1.6, -3.5, -4.5, -0.8, -0.7, 4.2, -0.9, -1.3
    };

    private Alphabet() {
    }

    /** Index of a one-letter amino acid code (case insensitive). */
    public static int indexOf(char letter) {
        int idx = LETTERS.indexOf(Character.toUpperCase(letter));
        if (idx < 0) throw new IllegalArgumentException("Undefined amino acid '" + letter + "'");
        return idx;
    }

    public static char letterOf(int symbol) {
        if (symbol < 0 || symbol >= SIZE) throw new IllegalArgumentException("Symbol out of range: " + symbol);
        return LETTERS.charAt(symbol);
    }

    public static double hydropathy(int symbol) {
        return HYDROPATHY[symbol];
    }

    public static Sequence parse(String letters) {
        Sequence s = new Sequence(letters.length());
        for (int i = 0; i < letters.length(); i++) s.add(indexOf(letters.charAt(i)));
        return s;
    }

    public static String format(Sequence sequence) {
        StringBuilder sb = new StringBuilder(sequence.size());
        for (int symbol : sequence) sb.append(letterOf(symbol));
        return sb.toString();
    }
}
