//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.model;

/**
 * Denotes the different kinds of declarations that appear in a proof corpus.
 */
public enum DeclKind {

  /** A proved statement. The only kind whose value is a proof term. */
  THEOREM,

  /** A statement assumed without proof. */
  AXIOM,

  /** A definition whose value may be unfolded. */
  DEFINITION,

  /** A definition whose value is never unfolded. */
  OPAQUE,

  /** An inductive type. */
  INDUCTIVE,

  /** A constructor of an inductive type. */
  CONSTRUCTOR,

  /** The eliminator of an inductive type. */
  RECURSOR;

  /** Returns true if declarations of this kind carry a proof term. */
  public boolean isTheoremLike () {
    return this == THEOREM;
  }
}
