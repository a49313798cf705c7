//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.extract;

import premise.model.Term;

/**
 * Computes the features of a statement.
 */
public interface FeatureExtractor {

  /** Returns the features of {@code statement}, a closed type (it may mention locals). */
  StatementFeatures extract (Term statement);
}
