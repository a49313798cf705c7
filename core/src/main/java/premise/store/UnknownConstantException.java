//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.store;

import java.util.NoSuchElementException;

/**
 * Thrown when a name cannot be resolved to a declaration in any store of a corpus.
 */
public class UnknownConstantException extends NoSuchElementException {

  /** The name that failed to resolve. */
  public final String name;

  public UnknownConstantException (String name) {
    super("Unknown constant: " + name);
    this.name = name;
  }

  private static final long serialVersionUID = 1L;
}
