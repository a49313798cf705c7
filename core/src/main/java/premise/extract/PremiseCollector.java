//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.extract;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import premise.model.Expr;
import premise.store.TypeChecker;

/**
 * Finds the premises of a proof: the constants it references whose declared type is a
 * proposition. Every node of the proof is visited, including binder types and bodies.
 */
public class PremiseCollector {

  public PremiseCollector (TypeChecker checker) {
    _checker = checker;
  }

  /**
   * Returns the premises referenced by {@code proof}, one entry per reference, in pre-order
   * left to right.
   * @throws premise.store.UnknownConstantException if {@code proof} references a constant
   * unknown to the corpus.
   * @throws premise.store.TypeCheckException if the type of a referenced constant cannot be
   * classified.
   */
  public List<String> collect (Expr proof) {
    List<String> premises = new ArrayList<>();
    // proofs can be arbitrarily deep, so we walk with an explicit stack
    Deque<Expr> pending = new ArrayDeque<>();
    pending.push(proof);
    while (!pending.isEmpty()) {
      Expr node = pending.pop();
      String name = node.constName();
      if (name != null && _checker.isPropConst(name)) premises.add(name);
      List<? extends Expr> children = node.children();
      for (int ii = children.size()-1; ii >= 0; ii--) pending.push(children.get(ii));
    }
    return premises;
  }

  private final TypeChecker _checker;
}
