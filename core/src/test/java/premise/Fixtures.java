//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise;

import com.google.common.base.Joiner;
import java.io.IOException;
import java.util.Collections;
import premise.extract.CorpusReader;
import premise.store.EphemeralStore;

/**
 * A small corpus shared by the tests: a prelude of natural numbers and equality, and two
 * library modules importing it.
 */
public class Fixtures {

  public static final String PRELUDE = Joiner.on("\n").join(
    "module Init.Prelude",
    "decl INDUCTIVE Nat",
    "type (sort 1)",
    "decl CONSTRUCTOR Nat.zero",
    "type (const Nat)",
    "decl CONSTRUCTOR Nat.succ",
    "type (pi n (const Nat) (const Nat))",
    "decl INDUCTIVE Eq",
    "type (pi a (const Nat) (pi b (const Nat) (sort 0)))",
    "decl CONSTRUCTOR Eq.refl",
    "type (pi a (const Nat) (app (const Eq) (bvar 0) (bvar 0)))",
    "decl AXIOM Eq.symm",
    "type (pi a (const Nat) (pi b (const Nat) " +
    "(pi h (app (const Eq) (bvar 1) (bvar 0)) (app (const Eq) (bvar 1) (bvar 2)))))",
    "decl INDUCTIVE Nat.le",
    "type (pi a (const Nat) (pi b (const Nat) (sort 0)))",
    "decl DEFINITION Pred",
    "type (sort 1)",
    "value (pi n (const Nat) (sort 0))",
    "decl AXIOM IsZero",
    "type (const Pred)",
    "end");

  public static final String LIBRARY = Joiner.on("\n").join(
    "root Mathlib",
    "module Mathlib",
    "import Mathlib.Logic.Basic",
    "import Mathlib.Logic.More",
    "end",
    "",
    "module Mathlib.Logic.Basic",
    "import Init.Prelude",
    "# n = n",
    "decl THEOREM Foo.bar 1 2",
    "type (pi n (const Nat) (app (const Eq) (bvar 0) (bvar 0)))",
    "value (lam n (const Nat) (app (const Eq.refl) (bvar 0)))",
    "decl THEOREM foo._eqn_1",
    "type (app (const Eq) (const Nat.zero) (const Nat.zero))",
    "value (app (const Eq.refl) (const Nat.zero))",
    "decl THEOREM Foo.symm_zero 3 4",
    "type (app (const Eq) (const Nat.zero) (const Nat.zero))",
    "value (app (const Eq.symm) (const Nat.zero) (const Nat.zero) " +
    "(app (const Eq.refl) (const Nat.zero)))",
    "decl DEFINITION Foo.two",
    "type (const Nat)",
    "value (app (const Nat.succ) (app (const Nat.succ) (const Nat.zero)))",
    "end",
    "",
    "module Mathlib.Logic.More",
    "import Mathlib.Logic.Basic",
    "decl THEOREM More.missing",
    "type (app (const Eq) (const Nat.zero) (const Nat.zero))",
    "value (app (const Unknown.lemma) (const Nat.zero))",
    "decl THEOREM More.le_hyp",
    "type (pi n (const Nat) (pi h (app (const Nat.le) (bvar 0) (const Nat.zero)) " +
    "(app (const Eq) (bvar 1) (const Nat.zero))))",
    "value (lam n (const Nat) (lam h (app (const Nat.le) (bvar 0) (const Nat.zero)) " +
    "(app (const Eq.refl) (const Nat.zero))))",
    "end");

  /** Returns an ephemeral store containing {@code dumps}, read in order. */
  public static EphemeralStore store (String... dumps) throws IOException {
    EphemeralStore store = new EphemeralStore("test");
    for (String dump : dumps) new CorpusReader().read(dump, store.writer());
    return store;
  }

  /** Returns a corpus over {@link #PRELUDE} and {@link #LIBRARY}. */
  public static Corpus corpus () throws IOException {
    return new Corpus(Collections.singletonList(store(PRELUDE, LIBRARY)));
  }
}
