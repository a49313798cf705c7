//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.extract;

import com.google.common.collect.ImmutableMultiset;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.*;
import premise.Fixtures;
import premise.model.Expr;
import premise.model.Term;
import premise.store.TypeChecker;
import premise.store.UnknownConstantException;
import static org.junit.Assert.*;

public class PremiseCollectorTest {

  PremiseCollector collector;

  @Before public void setUp () throws Exception {
    collector = new PremiseCollector(new TypeChecker(Fixtures.corpus()));
  }

  @Test public void testCollect () throws Exception {
    Term proof = CorpusReader.parseTerm(
      "(app (const Eq.symm) (const Nat.zero) (const Nat.zero) " +
      "(app (const Eq.symm) (const Nat.zero) (const Nat.zero) " +
      "(app (const Eq.refl) (const Nat.zero))))");
    // pre-order, left to right, one entry per reference
    assertEquals(Arrays.asList("Eq.symm", "Eq.symm", "Eq.refl"), collector.collect(proof));
  }

  @Test public void testCollectUnderBinders () throws Exception {
    Term proof = CorpusReader.parseTerm(
      "(lam h (app (const Eq) (const Nat.zero) (const Nat.zero)) " +
      "(let x (app (const Eq) (const Nat.zero) (const Nat.zero)) " +
      "(app (const Eq.refl) (const Nat.zero)) (const Foo.bar)))");
    assertEquals(ImmutableMultiset.of("Eq.refl", "Foo.bar"),
                 ImmutableMultiset.copyOf(collector.collect(proof)));
  }

  @Test public void testMultisetIndependentOfTraversal () {
    // the same references arranged differently yield the same multiset
    Term refl = Term.app(Term.constant("Eq.refl"), Term.constant("Nat.zero"));
    Term foo = Term.constant("Foo.bar");
    Term left = Term.app(Term.constant("Nat.succ"), refl, foo, refl);
    Term right = Term.app(Term.constant("Nat.le"), Term.app(Term.constant("Nat.succ"), foo),
                          refl, refl);
    assertEquals(Arrays.asList("Eq.refl", "Foo.bar", "Eq.refl"), collector.collect(left));
    assertEquals(Arrays.asList("Foo.bar", "Eq.refl", "Eq.refl"), collector.collect(right));
    assertEquals(ImmutableMultiset.copyOf(collector.collect(left)),
                 ImmutableMultiset.copyOf(collector.collect(right)));
  }

  @Test public void testDeepProof () {
    // a proof far deeper than the call stack could recurse
    int size = 100000;
    Term[] args = new Term[size];
    Arrays.fill(args, Term.constant("Foo.bar"));
    Term proof = Term.app(Term.constant("Nat.zero"), args);
    List<String> premises = collector.collect(proof);
    assertEquals(size, premises.size());
    assertEquals(Collections.nCopies(size, "Foo.bar"), premises);
  }

  @Test(expected=UnknownConstantException.class)
  public void testUnknownConstant () throws Exception {
    collector.collect(CorpusReader.parseTerm("(app (const Unknown.lemma) (const Nat.zero))"));
  }

  @Test public void testCollectOverExpr () {
    // the walk needs only the Expr view of a tree
    Expr leaf = new Expr() {
      @Override public String constName () { return "Eq.refl"; }
      @Override public List<? extends Expr> children () { return Collections.emptyList(); }
    };
    Expr node = new Expr() {
      @Override public String constName () { return null; }
      @Override public List<? extends Expr> children () { return Arrays.asList(leaf, leaf); }
    };
    assertEquals(Arrays.asList("Eq.refl", "Eq.refl"), collector.collect(node));
  }
}
