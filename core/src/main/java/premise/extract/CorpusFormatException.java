//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.extract;

import java.io.IOException;

/**
 * Reports malformed corpus dump input.
 */
public class CorpusFormatException extends IOException {

  /** The (1-based) line on which the problem was found, or 0 if not read from a dump. */
  public final int line;

  public CorpusFormatException (int line, String message) {
    super((line > 0) ? ("line " + line + ": " + message) : message);
    this.line = line;
  }
}
