//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.extract;

import com.google.common.collect.LinkedHashMultiset;
import com.google.common.collect.Multiset;
import java.util.ArrayList;
import java.util.List;
import premise.model.Term;

/**
 * The default feature extractor. Counts every constant occurrence; counts a bigram for every
 * application whose head is a constant and each of its arguments that is itself headed by a
 * constant; and renders every application of depth at most {@link #MAX_SUBEXPR_DEPTH} in the
 * compact form {@code f(a,b)}, with locals and bound variables rendered as {@code *}.
 */
public class StatementFeatureExtractor implements FeatureExtractor {

  /** Applications deeper than this are not rendered as subexpressions. */
  public static final int MAX_SUBEXPR_DEPTH = 2;

  @Override public StatementFeatures extract (Term statement) {
    Multiset<String> names = LinkedHashMultiset.create();
    Multiset<StatementFeatures.Bigram> bigrams = LinkedHashMultiset.create();
    List<String> subexprs = new ArrayList<>();
    visit(statement, names, bigrams, subexprs);
    return new StatementFeatures(names, bigrams, subexprs);
  }

  private void visit (Term term, Multiset<String> names,
                      Multiset<StatementFeatures.Bigram> bigrams, List<String> subexprs) {
    if (term instanceof Term.App) {
      // visit the whole application spine at once, rather than each partial application
      Term head = term.appFn();
      List<Term> args = term.appArgs();
      String fname = head.constName();
      if (fname != null) {
        for (Term arg : args) {
          String aname = arg.appFn().constName();
          if (aname != null) bigrams.add(new StatementFeatures.Bigram(fname, aname));
        }
      }
      if (term.approxDepth() <= MAX_SUBEXPR_DEPTH) subexprs.add(render(term));
      visit(head, names, bigrams, subexprs);
      for (Term arg : args) visit(arg, names, bigrams, subexprs);

    } else {
      String name = term.constName();
      if (name != null) names.add(name);
      for (Term child : term.children()) visit(child, names, bigrams, subexprs);
    }
  }

  /** Renders {@code term} without whitespace, so that it may be used as a token. */
  protected static String render (Term term) {
    StringBuilder sb = new StringBuilder();
    render(term, sb);
    return sb.toString();
  }

  private static void render (Term term, StringBuilder sb) {
    if (term instanceof Term.App) {
      render(term.appFn(), sb);
      sb.append('(');
      boolean first = true;
      for (Term arg : term.appArgs()) {
        if (!first) sb.append(',');
        render(arg, sb);
        first = false;
      }
      sb.append(')');
    } else if (term instanceof Term.Const) {
      sb.append(((Term.Const)term).name);
    } else if (term instanceof Term.Sort) {
      sb.append((((Term.Sort)term).level == 0) ? "Prop" : "Sort");
    } else if (term instanceof Term.Lit) {
      Term.Lit lit = (Term.Lit)term;
      sb.append(lit.isNat() ? lit.value.toString() : "str");
    } else if (term instanceof Term.Lam) {
      sb.append("fun");
    } else if (term instanceof Term.Pi) {
      sb.append("forall");
    } else if (term instanceof Term.Let) {
      sb.append("let");
    } else {
      sb.append('*'); // locals and bound variables
    }
  }
}
