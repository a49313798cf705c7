//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.extract;

import com.google.common.base.Preconditions;

/**
 * How a theorem's proof was authored, as recovered from its source text, along with the text
 * of the proof itself.
 */
public final class Provenance {

  /** The authoring style of a proof. */
  public enum Style {
    /** The proof is a term written directly after {@code :=}. */
    TERM,
    /** The proof is a tactic block introduced by {@code by}. */
    TACTIC;
  }

  /** The style in which the proof was written. */
  public final Style style;

  /** The source text of the proof body: after {@code :=} for term proofs, after {@code by}
    * for tactic proofs. */
  public final String body;

  public Provenance (Style style, String body) {
    this.style = Preconditions.checkNotNull(style);
    this.body = Preconditions.checkNotNull(body);
  }

  @Override public String toString () {
    return "Provenance(" + style + ", " + body.length() + " chars)";
  }
}
