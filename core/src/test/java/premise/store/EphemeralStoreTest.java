//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.store;

import java.util.Arrays;
import org.junit.*;
import premise.Fixtures;
import premise.extract.CorpusWriter;
import premise.model.Decl;
import premise.model.DeclKind;
import premise.model.ModuleData;
import premise.model.Term;
import static org.junit.Assert.*;

public class EphemeralStoreTest {

  @Test public void testBasics () throws Exception {
    EphemeralStore store = Fixtures.store(Fixtures.PRELUDE, Fixtures.LIBRARY);
    assertEquals(Arrays.asList("Init.Prelude", "Mathlib", "Mathlib.Logic.Basic",
                               "Mathlib.Logic.More"), store.moduleNames());
    assertEquals(Arrays.asList("Mathlib"), store.roots());
    assertEquals(15, store.declCount());

    Decl bar = store.decl("Foo.bar").get();
    assertEquals(DeclKind.THEOREM, bar.kind);
    assertEquals(1, bar.startLine);
    assertEquals(2, bar.endLine);
    assertTrue(bar.proof().isPresent());

    ModuleData basic = store.module("Mathlib.Logic.Basic").get();
    assertEquals(Arrays.asList("Init.Prelude"), basic.imports);
    assertEquals(4, basic.decls.size());
    assertEquals("Foo.bar", basic.decls.get(0).name);
    assertEquals("Mathlib", basic.library());
    assertEquals(Arrays.asList("Init.Prelude"), store.imports("Mathlib.Logic.Basic"));
    assertTrue(store.imports("Nope").isEmpty());
    assertFalse(store.module("Nope").isPresent());
    assertFalse(store.hasModule("Nope"));
  }

  @Test public void testRewriteModule () {
    EphemeralStore store = new EphemeralStore("test");
    writeTwice(store.writer);

    assertEquals(Arrays.asList("M"), store.moduleNames());
    ModuleData m = store.module("M").get();
    assertEquals(Arrays.asList("N"), m.imports);
    assertEquals(Arrays.asList("b", "c"), Arrays.asList(m.decls.get(0).name, m.decls.get(1).name));
    // declarations dropped by the rewrite no longer resolve
    assertFalse(store.decl("a").isPresent());
    assertTrue(store.decl("b").isPresent());
    assertTrue(store.decl("c").isPresent());
    assertEquals(2, store.declCount());
  }

  /** Writes module {@code M} with declarations {@code a, c}, then rewrites it with {@code b, c}. */
  static void writeTwice (CorpusWriter writer) {
    writer.openSession();
    writer.openModule("M");
    writer.emitDecl(new Decl("a", DeclKind.AXIOM, Term.PROP, null));
    writer.emitDecl(new Decl("c", DeclKind.AXIOM, Term.PROP, null));
    writer.closeModule();
    writer.openModule("M");
    writer.emitImport("N");
    writer.emitDecl(new Decl("b", DeclKind.AXIOM, Term.PROP, null));
    writer.emitDecl(new Decl("c", DeclKind.AXIOM, Term.PROP, null));
    writer.closeModule();
    writer.closeSession();
  }

  @Test(expected=IllegalStateException.class)
  public void testDeclOutsideModule () {
    EphemeralStore store = new EphemeralStore("test");
    store.writer.openSession();
    store.writer.emitDecl(new Decl("a", DeclKind.AXIOM, Term.PROP, null));
  }
}
