//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.model;

import java.util.List;

/**
 * The minimal view of an expression tree needed to walk it: whether a node references a named
 * constant, and what its immediate children are. Walkers written against this interface are
 * independent of any particular term representation.
 */
public interface Expr {

  /** Returns the name of the constant referenced by this node, or null if this node is not a
    * constant reference. */
  String constName ();

  /** Returns the immediate children of this node, in left to right order. Binder types and
    * bodies, applied functions and their arguments are all children. */
  List<? extends Expr> children ();
}
