//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.store;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import premise.Corpus;
import premise.model.Decl;
import premise.model.DeclKind;
import premise.model.Term;

/**
 * Infers the types of terms against the declarations of a {@link Corpus}, and classifies types
 * as propositions or data. Inference trusts the corpus: it computes types, it does not check
 * that applications are well typed.
 */
public class TypeChecker {

  public TypeChecker (Corpus corpus) {
    _corpus = corpus;
  }

  /**
   * Returns the type of {@code term}.
   * @throws UnknownConstantException if {@code term} references a name unknown to the corpus.
   * @throws TypeCheckException if the type cannot be computed.
   */
  public Term inferType (Term term) {
    if (term instanceof Term.Local) return ((Term.Local)term).type;
    if (term instanceof Term.Const) return _corpus.resolve(((Term.Const)term).name).type;
    if (term instanceof Term.Sort) return Term.sort(((Term.Sort)term).level + 1);
    if (term instanceof Term.Lit) {
      return Term.constant(((Term.Lit)term).isNat() ? NAT_TYPE : STRING_TYPE);
    }
    if (term instanceof Term.App) {
      Term.App app = (Term.App)term;
      Term fnType = whnf(inferType(app.fn));
      if (!(fnType instanceof Term.Pi)) throw new TypeCheckException(
        "Function expected in " + term + ", but its type is " + fnType);
      return ((Term.Pi)fnType).bodyWith(app.arg);
    }
    if (term instanceof Term.Lam) {
      Term.Lam lam = (Term.Lam)term;
      Term.Local local = lam.open();
      Term bodyType = inferType(lam.bodyWith(local));
      return Term.pi(lam.binder, lam.type, bodyType.abstractLocal(local));
    }
    if (term instanceof Term.Pi) {
      Term.Pi pi = (Term.Pi)term;
      int argLevel = sortLevel(pi.type);
      int bodyLevel = sortLevel(pi.bodyWith(pi.open()));
      // impredicativity: a pi into Prop is a proposition, whatever it quantifies over
      return Term.sort((bodyLevel == 0) ? 0 : Math.max(argLevel, bodyLevel));
    }
    if (term instanceof Term.Let) {
      Term.Let let = (Term.Let)term;
      return inferType(let.body.instantiate(let.value));
    }
    throw new TypeCheckException("Loose bound variable: " + term);
  }

  /**
   * Returns true if {@code type} is a proposition, i.e. if its own type is {@code Sort 0}. Terms
   * whose type is a proposition are proofs.
   */
  public boolean isProp (Term type) {
    Term sort = whnf(inferType(type));
    return (sort instanceof Term.Sort) && ((Term.Sort)sort).level == 0;
  }

  /**
   * Returns true if the declaration named {@code name} states a proposition. The answer for each
   * name is computed once and remembered.
   * @throws UnknownConstantException if no declaration is named {@code name}.
   */
  public boolean isPropConst (String name) {
    Boolean known = _propConsts.get(name);
    if (known == null) {
      Decl decl = _corpus.resolve(name);
      _propConsts.put(name, known = isProp(decl.type));
    }
    return known;
  }

  /**
   * Reduces {@code term} to weak head normal form: beta-reduces applied lambdas, zeta-reduces
   * lets and unfolds definitions at the head until none of these apply.
   */
  public Term whnf (Term term) {
    Term cur = term;
    for (int steps = 0; steps < MAX_WHNF_STEPS; steps++) {
      if (cur instanceof Term.Let) {
        Term.Let let = (Term.Let)cur;
        cur = let.body.instantiate(let.value);
        continue;
      }
      Term head = cur.appFn();
      List<Term> args = cur.appArgs();
      if (head instanceof Term.Lam && !args.isEmpty()) {
        cur = beta(head, args);
        continue;
      }
      if (head instanceof Term.Const) {
        Decl decl = _corpus.decl(((Term.Const)head).name).orElse(null);
        if (decl != null && decl.kind == DeclKind.DEFINITION && decl.value != null) {
          cur = Term.app(decl.value, args.toArray(new Term[0]));
          continue;
        }
      }
      return cur;
    }
    throw new TypeCheckException("Reduction of " + term + " did not terminate");
  }

  private int sortLevel (Term type) {
    Term sort = whnf(inferType(type));
    if (!(sort instanceof Term.Sort)) throw new TypeCheckException(
      "Type expected, but " + type + " has type " + sort);
    return ((Term.Sort)sort).level;
  }

  private static Term beta (Term fn, List<Term> args) {
    Term cur = fn;
    int ii = 0;
    for (int ll = args.size(); ii < ll && cur instanceof Term.Lam; ii++) {
      cur = ((Term.Lam)cur).bodyWith(args.get(ii));
    }
    return Term.app(cur, args.subList(ii, args.size()).toArray(new Term[0]));
  }

  private final Corpus _corpus;
  private final Map<String,Boolean> _propConsts = new HashMap<>();

  private static final String NAT_TYPE = "Nat", STRING_TYPE = "String";
  private static final int MAX_WHNF_STEPS = 512;
}
