//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.store;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import org.junit.*;
import org.junit.rules.TemporaryFolder;
import premise.Corpus;
import premise.Fixtures;
import premise.extract.CorpusReader;
import premise.model.Decl;
import premise.model.DeclKind;
import premise.model.ModuleData;
import premise.model.Term;
import static org.junit.Assert.*;

public class MapDBStoreTest {

  @Rule public TemporaryFolder temp = new TemporaryFolder();

  @Test public void testMemoryStore () throws Exception {
    MapDBStore store = new MapDBStore("test");
    load(store);
    EphemeralStore reference = Fixtures.store(Fixtures.PRELUDE, Fixtures.LIBRARY);

    assertEquals(reference.moduleNames(), store.moduleNames());
    assertEquals(reference.roots(), store.roots());
    assertEquals(reference.declCount(), store.declCount());
    for (String name : reference.moduleNames()) {
      ModuleData expect = reference.module(name).get(), got = store.module(name).get();
      assertEquals(expect.imports, got.imports);
      assertEquals(expect.decls.size(), got.decls.size());
      for (int ii = 0; ii < expect.decls.size(); ii++) {
        assertDeclEquals(expect.decls.get(ii), got.decls.get(ii));
      }
    }
    assertFalse(store.decl("Nope").isPresent());
    assertFalse(store.hasModule("Nope"));
    store.close();
  }

  @Test public void testDependencies () throws Exception {
    MapDBStore store = new MapDBStore("test");
    load(store);
    Corpus corpus = new Corpus(Collections.singletonList(store));
    assertEquals(Arrays.asList("Init.Prelude", "Mathlib.Logic.Basic", "Mathlib.Logic.More"),
                 corpus.dependencies(true));
    store.close();
  }

  @Test public void testReopen () throws Exception {
    Path path = temp.getRoot().toPath().resolve("corpus.db");
    MapDBStore store = new MapDBStore("test", path);
    load(store);
    store.close();

    MapDBStore reopened = new MapDBStore("test", path);
    assertEquals(Arrays.asList("Mathlib"), reopened.roots());
    assertEquals(15, reopened.declCount());
    assertEquals(4, reopened.decl("Foo.symm_zero").get().endLine);
    reopened.clear();
    assertEquals(0, reopened.declCount());
    assertTrue(reopened.moduleNames().isEmpty());
    reopened.close();
  }

  @Test public void testRewriteModule () {
    MapDBStore store = new MapDBStore("test");
    EphemeralStoreTest.writeTwice(store.writer);
    assertEquals(Arrays.asList("N"), store.imports("M"));
    assertEquals(2, store.module("M").get().decls.size());
    assertFalse(store.decl("a").isPresent());
    assertTrue(store.decl("b").isPresent());
    assertEquals(2, store.declCount());
    store.close();
  }

  @Test public void testDeepProof () {
    Term[] args = new Term[100000];
    Arrays.fill(args, Term.constant("Foo.bar"));
    Term proof = Term.app(Term.constant("Nat.zero"), args);

    MapDBStore store = new MapDBStore("test");
    store.writer.openSession();
    store.writer.openModule("Deep");
    store.writer.emitDecl(new Decl("deep", DeclKind.THEOREM, Term.PROP, proof));
    store.writer.closeModule();
    store.writer.closeSession();

    Term read = store.decl("deep").get().value;
    assertEquals(Term.constant("Nat.zero"), read.appFn());
    assertEquals(100000, read.appArgs().size());
    assertEquals(Term.MAX_DEPTH, read.approxDepth());
    store.close();
  }

  private static void load (MapDBStore store) throws Exception {
    CorpusReader reader = new CorpusReader();
    reader.read(Fixtures.PRELUDE, store.writer);
    reader.read(Fixtures.LIBRARY, store.writer);
  }

  private static void assertDeclEquals (Decl expect, Decl got) {
    assertEquals(expect.name, got.name);
    assertEquals(expect.kind, got.kind);
    assertEquals(expect.type, got.type);
    assertEquals(expect.value, got.value);
    assertEquals(expect.startLine, got.startLine);
    assertEquals(expect.endLine, got.endLine);
  }
}
