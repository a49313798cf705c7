//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.extract;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.Multiset;
import java.util.List;

/**
 * The labeled features of one theorem: the features of its conclusion and of its hypotheses,
 * and the premises its proof uses. Premises form a multiset, kept as a list in discovery order
 * with duplicates preserved.
 */
public final class TheoremPremises {

  /** The fully qualified name of the theorem. */
  public final String name;

  /** The features of the theorem's conclusion. */
  public final StatementFeatures conclusion;

  /** The features of the theorem's retained hypotheses, in declaration order. */
  public final List<StatementFeatures> hypotheses;

  /** The premises used by the theorem's proof, one entry per use. */
  public final List<String> premises;

  public TheoremPremises (String name, StatementFeatures conclusion,
                          List<StatementFeatures> hypotheses, List<String> premises) {
    this.name = name;
    this.conclusion = conclusion;
    this.hypotheses = ImmutableList.copyOf(hypotheses);
    this.premises = ImmutableList.copyOf(premises);
  }

  /** Returns a copy of this record with its premises replaced by {@code premises}. */
  public TheoremPremises withPremises (List<String> premises) {
    return new TheoremPremises(name, conclusion, hypotheses, premises);
  }

  /** Returns the number of uses of each premise. */
  public Multiset<String> premiseCounts () {
    return ImmutableMultiset.copyOf(premises);
  }

  @Override public String toString () {
    return "TheoremPremises(" + name + ", " + hypotheses.size() + " hyps, " + premises + ")";
  }
}
