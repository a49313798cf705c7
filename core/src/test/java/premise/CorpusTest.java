//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise;

import java.util.Arrays;
import java.util.Collections;
import org.junit.*;
import premise.model.DeclKind;
import premise.store.EphemeralStore;
import premise.store.UnknownConstantException;
import static org.junit.Assert.*;

public class CorpusTest {

  @Test public void testResolve () throws Exception {
    Corpus corpus = Fixtures.corpus();
    assertEquals(DeclKind.CONSTRUCTOR, corpus.resolve("Eq.refl").kind);
    assertFalse(corpus.decl("Nope").isPresent());
    try {
      corpus.resolve("Nope");
      fail("Resolved unknown constant");
    } catch (UnknownConstantException uce) {
      assertEquals("Nope", uce.name);
    }
  }

  @Test public void testDirectDependencies () throws Exception {
    Corpus corpus = Fixtures.corpus();
    assertEquals(Arrays.asList("Mathlib"), corpus.roots());
    assertEquals(Arrays.asList("Mathlib.Logic.Basic", "Mathlib.Logic.More"),
                 corpus.dependencies(false));
  }

  @Test public void testRecursiveDependencies () throws Exception {
    Corpus corpus = Fixtures.corpus();
    // every module follows its imports
    assertEquals(Arrays.asList("Init.Prelude", "Mathlib.Logic.Basic", "Mathlib.Logic.More"),
                 corpus.dependencies(true));
  }

  @Test public void testUnknownImportsSkipped () throws Exception {
    EphemeralStore store = Fixtures.store(String.join("\n",
      "root Top",
      "module Top",
      "import Missing.Module",
      "import Init.Prelude",
      "end"), Fixtures.PRELUDE);
    Corpus corpus = new Corpus(Collections.singletonList(store));
    assertEquals(Arrays.asList("Init.Prelude"), corpus.dependencies(false));
    assertEquals(Arrays.asList("Init.Prelude"), corpus.dependencies(true));
  }

  @Test public void testImportCycle () throws Exception {
    EphemeralStore store = Fixtures.store(String.join("\n",
      "root Top",
      "module Top", "import A", "end",
      "module A", "import B", "end",
      "module B", "import A", "end"));
    Corpus corpus = new Corpus(Collections.singletonList(store));
    assertEquals(Arrays.asList("B", "A"), corpus.dependencies(true));
  }

  @Test public void testStorePrecedence () throws Exception {
    EphemeralStore first = Fixtures.store(String.join("\n",
      "module Override", "decl AXIOM Nat.zero", "type (sort 0)", "end"));
    EphemeralStore second = Fixtures.store(Fixtures.PRELUDE);
    Corpus corpus = new Corpus(Arrays.asList(first, second));
    assertEquals(DeclKind.AXIOM, corpus.resolve("Nat.zero").kind);
    assertEquals(DeclKind.INDUCTIVE, corpus.resolve("Nat").kind);
  }
}
