//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.extract;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.Multiset;
import java.util.List;
import java.util.Objects;

/**
 * Describes a statement by the names it mentions, the adjacent name pairs (bigrams) derived from
 * its structure, and a sequence of rendered subexpressions. Both count multisets iterate in
 * order of first occurrence.
 */
public final class StatementFeatures {

  /** A pair of names, the first applied (directly) to a term headed by the second. */
  public static final class Bigram {
    public final String first, second;

    public Bigram (String first, String second) {
      this.first = first;
      this.second = second;
    }

    @Override public int hashCode () {
      return first.hashCode() * 31 + second.hashCode();
    }
    @Override public boolean equals (Object other) {
      return (other instanceof Bigram) && first.equals(((Bigram)other).first) &&
        second.equals(((Bigram)other).second);
    }
    /** Returns the token form of this bigram: {@code first/second}. */
    @Override public String toString () {
      return first + "/" + second;
    }
  }

  /** Occurrence counts of the names mentioned by the statement. */
  public final Multiset<String> nameCounts;

  /** Occurrence counts of the bigrams of the statement. */
  public final Multiset<Bigram> bigramCounts;

  /** Rendered subexpressions, in the order in which they were encountered. */
  public final List<String> subexpressions;

  public StatementFeatures (Multiset<String> nameCounts, Multiset<Bigram> bigramCounts,
                            List<String> subexpressions) {
    this.nameCounts = ImmutableMultiset.copyOf(nameCounts);
    this.bigramCounts = ImmutableMultiset.copyOf(bigramCounts);
    this.subexpressions = ImmutableList.copyOf(subexpressions);
  }

  @Override public int hashCode () {
    return Objects.hash(nameCounts, bigramCounts, subexpressions);
  }

  @Override public boolean equals (Object other) {
    if (!(other instanceof StatementFeatures)) return false;
    StatementFeatures ofeats = (StatementFeatures)other;
    return nameCounts.equals(ofeats.nameCounts) && bigramCounts.equals(ofeats.bigramCounts) &&
      subexpressions.equals(ofeats.subexpressions);
  }

  @Override public String toString () {
    return "StatementFeatures(" + nameCounts + ", " + bigramCounts + ", " + subexpressions + ")";
  }
}
