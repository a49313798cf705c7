//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.store;

/**
 * Thrown when the type of a term cannot be computed.
 */
public class TypeCheckException extends RuntimeException {

  public TypeCheckException (String message) {
    super(message);
  }

  public TypeCheckException (String message, Throwable cause) {
    super(message, cause);
  }

  private static final long serialVersionUID = 1L;
}
