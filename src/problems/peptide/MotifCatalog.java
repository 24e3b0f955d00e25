package problems.peptide;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import solutions.Sequence;

/**
 * Ordered, immutable list of reference motifs the peptide energy aligns
 * against. Selecting a motif by index fixes the target length.
 */
public final class MotifCatalog {

  public static final String MOTIFS_RESOURCE = "peptide/motifs.txt";

  public static record Motif(String letters, String description) {
    public int length() { return letters.length(); }
  }

  private final List<Motif> motifs;
  private final List<int[]> encoded;

  public MotifCatalog(List<Motif> motifs) {
    if (motifs.isEmpty()) throw new IllegalArgumentException("Motif catalog must not be empty");
    this.motifs = Collections.unmodifiableList(new ArrayList<>(motifs));
    this.encoded = new ArrayList<>(motifs.size());
    for (Motif m : motifs) {
      if (m.letters().isEmpty()) throw new IllegalArgumentException("Empty motif in catalog");
      Sequence s = Alphabet.parse(m.letters());
      int[] idx = new int[s.size()];
      for (int i = 0; i < idx.length; i++) idx[i] = s.get(i);
      encoded.add(idx);
    }
  }

  /** Builds a catalog from bare sequences, without descriptions. */
  public static MotifCatalog of(String... letters) {
    List<Motif> list = new ArrayList<>();
    for (String l : letters) list.add(new Motif(l, ""));
    return new MotifCatalog(list);
  }

  /** Catalog shipped with the library. */
  public static MotifCatalog fromClasspath() {
    InputStream in = MotifCatalog.class.getClassLoader().getResourceAsStream(MOTIFS_RESOURCE);
    if (in == null) throw new IllegalStateException("Missing motif catalog " + MOTIFS_RESOURCE);
    List<Motif> list = new ArrayList<>();
    try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
      for (String ln; (ln = br.readLine()) != null; ) {
        ln = ln.trim();
        if (ln.isEmpty() || ln.startsWith("#")) continue;
        String[] t = ln.split("\\s+", 2);
        list.add(new Motif(t[0], t.length > 1 ? t[1].trim() : ""));
      }
    } catch (IOException e) {
      throw new IllegalStateException("Couldn't read motif catalog " + MOTIFS_RESOURCE, e);
    }
    return new MotifCatalog(list);
  }

  public int size() { return motifs.size(); }

  public Motif get(int idx) { return motifs.get(idx); }

  public List<Motif> motifs() { return motifs; }

  /** Symbol indices of motif {@code idx}; callers must not modify the array. */
  int[] encoded(int idx) { return encoded.get(idx); }
}
