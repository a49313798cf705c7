//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.extract;

import java.io.IOException;

/**
 * Receives the records retained by an extraction run, in corpus order.
 */
public interface PremiseSink {

  /** Records {@code record}. Failure to do so is fatal to the run. */
  void insert (TheoremPremises record) throws IOException;
}
