//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.extract;

import java.util.List;

/**
 * Filters the premises of a theorem, reporting whether the theorem was found in its source.
 */
public interface PremiseFilter {

  /** The outcome of filtering one theorem's premises. */
  final class Verdict {
    /** The premises that survived filtering, in their original order. */
    public final List<String> premises;
    /** Whether the theorem was found (and its proof classified) in its source. */
    public final boolean found;

    public Verdict (List<String> premises, boolean found) {
      this.premises = premises;
      this.found = found;
    }
  }

  /** Filters {@code premises}, the premises of {@code theorem}. */
  Verdict apply (String theorem, List<String> premises);

  /** Returns a filter that keeps every premise and reports every theorem as {@code found}. */
  static PremiseFilter identity (boolean found) {
    return (theorem, premises) -> new Verdict(premises, found);
  }
}
