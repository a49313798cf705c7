//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.model;

import com.google.common.base.Preconditions;
import java.util.Optional;

/**
 * A named declaration: its kind, its statement type and, where it has one, its value. The value
 * of a theorem is its proof term.
 */
public final class Decl {

  /** The fully qualified name of this declaration. */
  public final String name;

  /** The kind of this declaration. */
  public final DeclKind kind;

  /** The statement (type) of this declaration. */
  public final Term type;

  /** The value of this declaration, or null if it has none. */
  public final Term value;

  /** The first source line of this declaration, or 0 if its source range is unknown. */
  public final int startLine;

  /** The last source line (inclusive) of this declaration, or 0 if unknown. */
  public final int endLine;

  public Decl (String name, DeclKind kind, Term type, Term value) {
    this(name, kind, type, value, 0, 0);
  }

  public Decl (String name, DeclKind kind, Term type, Term value, int startLine, int endLine) {
    Preconditions.checkArgument(!name.isEmpty(), "Declaration name must be non-empty");
    Preconditions.checkArgument(startLine <= endLine, "Invalid line range %s-%s for %s",
                                startLine, endLine, name);
    this.name = name;
    this.kind = kind;
    this.type = Preconditions.checkNotNull(type);
    this.value = value;
    this.startLine = startLine;
    this.endLine = endLine;
  }

  /** Returns the proof term of this declaration, if it is theorem-like and has one. */
  public Optional<Term> proof () {
    return kind.isTheoremLike() ? Optional.ofNullable(value) : Optional.empty();
  }

  /** Returns true if this declaration knows the source lines on which it was written. */
  public boolean hasRange () {
    return startLine > 0;
  }

  @Override public String toString () {
    return kind + " " + name + " : " + type;
  }
}
