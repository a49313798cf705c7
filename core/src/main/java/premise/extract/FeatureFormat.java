//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.extract;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Selects which classes of features appear in a features line, and renders that line.
 *
 * <p>Tokens are tagged by origin, {@code T:} for the conclusion and {@code H:} for hypotheses.
 * Classes are emitted in a fixed order (names, bigrams, subexpressions) and within each class
 * conclusion tokens precede hypothesis tokens, hypotheses in declaration order. A name or bigram
 * contributes one token however many times it occurs, in order of first occurrence.</p>
 */
public final class FeatureFormat {

  /** Names and subexpressions, but not bigrams. */
  public static final FeatureFormat DEFAULT = new FeatureFormat(true, false, true);

  /** Parses a comma separated list of the classes to enable: {@code names}, {@code bigrams}
    * and {@code subexprs}. An empty string enables nothing.
    * @throws IllegalArgumentException if an unknown class is named. */
  public static FeatureFormat parse (String classes) {
    boolean names = false, bigrams = false, subexprs = false;
    for (String cls : Splitter.on(',').trimResults().omitEmptyStrings().split(classes)) {
      switch (cls) {
      case "names": names = true; break;
      case "bigrams": bigrams = true; break;
      case "subexprs": subexprs = true; break;
      default: throw new IllegalArgumentException("Unknown feature class: " + cls);
      }
    }
    return new FeatureFormat(names, bigrams, subexprs);
  }

  /** Whether name tokens are emitted. */
  public final boolean names;

  /** Whether bigram tokens are emitted. */
  public final boolean bigrams;

  /** Whether subexpression tokens are emitted. */
  public final boolean subexprs;

  public FeatureFormat (boolean names, boolean bigrams, boolean subexprs) {
    this.names = names;
    this.bigrams = bigrams;
    this.subexprs = subexprs;
  }

  /** Returns the features line for {@code record}, without a line terminator. */
  public String format (TheoremPremises record) {
    List<String> tokens = new ArrayList<>();
    if (names) {
      addNames(CONCLUSION, record.conclusion, tokens);
      for (StatementFeatures hyp : record.hypotheses) addNames(HYPOTHESIS, hyp, tokens);
    }
    if (bigrams) {
      addBigrams(CONCLUSION, record.conclusion, tokens);
      for (StatementFeatures hyp : record.hypotheses) addBigrams(HYPOTHESIS, hyp, tokens);
    }
    if (subexprs) {
      addSubexprs(CONCLUSION, record.conclusion, tokens);
      for (StatementFeatures hyp : record.hypotheses) addSubexprs(HYPOTHESIS, hyp, tokens);
    }
    return Joiner.on(' ').join(tokens);
  }

  @Override public int hashCode () {
    return Objects.hash(names, bigrams, subexprs);
  }

  @Override public boolean equals (Object other) {
    if (!(other instanceof FeatureFormat)) return false;
    FeatureFormat oformat = (FeatureFormat)other;
    return names == oformat.names && bigrams == oformat.bigrams && subexprs == oformat.subexprs;
  }

  @Override public String toString () {
    List<String> classes = new ArrayList<>();
    if (names) classes.add("names");
    if (bigrams) classes.add("bigrams");
    if (subexprs) classes.add("subexprs");
    return Joiner.on(',').join(classes);
  }

  private static void addNames (String tag, StatementFeatures feats, List<String> into) {
    for (String name : feats.nameCounts.elementSet()) into.add(tag + name);
  }

  private static void addBigrams (String tag, StatementFeatures feats, List<String> into) {
    for (StatementFeatures.Bigram bigram : feats.bigramCounts.elementSet()) {
      into.add(tag + bigram);
    }
  }

  private static void addSubexprs (String tag, StatementFeatures feats, List<String> into) {
    for (String subexpr : feats.subexpressions) {
      String token = subexpr.trim();
      if (!token.isEmpty()) into.add(tag + token);
    }
  }

  private static final String CONCLUSION = "T:", HYPOTHESIS = "H:";
}
