//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.store;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.util.Arrays;
import java.util.List;
import org.junit.*;
import premise.extract.CorpusReader;
import premise.model.Decl;
import premise.model.DeclKind;
import premise.model.Term;
import static org.junit.Assert.*;

public class IOTest {

  @Test public void testDecl () throws Exception {
    Term type = CorpusReader.parseTerm(
      "(pi n (const Nat) (let m (const Nat) (lit 12345678901234567890) " +
      "(app (const Eq) (bvar 1) (bvar 0))))");
    Term value = CorpusReader.parseTerm(
      "(lam n (const Nat) (app (const magic) (lit \"wibble\") (sort 3)))");
    Decl decl = new Decl("Test.thm", DeclKind.THEOREM, type, value, 7, 9);
    Decl read = IO.declFromBytes(IO.toBytes(decl));
    assertEquals(decl.name, read.name);
    assertEquals(decl.kind, read.kind);
    assertEquals(type, read.type);
    assertEquals(value, read.value);
    assertEquals(7, read.startLine);
    assertEquals(9, read.endLine);

    Decl axiom = IO.declFromBytes(IO.toBytes(new Decl("ax", DeclKind.AXIOM, Term.PROP, null)));
    assertNull(axiom.value);
    assertFalse(axiom.hasRange());
  }

  @Test public void testDeepTerm () throws Exception {
    // a binder nest inside a long application spine
    Term body = Term.bvar(0);
    for (int ii = 0; ii < 100000; ii++) body = Term.lam("x", Term.constant("Nat"), body);
    Term[] args = new Term[100000];
    Arrays.fill(args, Term.constant("Foo.bar"));
    Term proof = Term.app(body, args);

    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    IO.writeTerm(new DataOutputStream(bytes), proof);
    Term read = IO.readTerm(new DataInputStream(new ByteArrayInputStream(bytes.toByteArray())));

    List<Term> readArgs = read.appArgs();
    assertEquals(100000, readArgs.size());
    assertEquals(Term.constant("Foo.bar"), readArgs.get(99999));
    Term lam = read.appFn();
    int lams = 0;
    while (lam instanceof Term.Lam) {
      lam = ((Term.Lam)lam).body;
      lams += 1;
    }
    assertEquals(100000, lams);
    assertEquals(Term.bvar(0), lam);
  }

  @Test public void testNames () {
    assertEquals(Arrays.asList("A", "B.c", "«weird name»"),
                 IO.namesFromBytes(IO.toBytes(Arrays.asList("A", "B.c", "«weird name»"))));
  }

  @Test(expected=IllegalArgumentException.class)
  public void testLocalsRejected () throws Exception {
    Term local = Term.local("x", Term.constant("Nat"));
    IO.writeTerm(new DataOutputStream(new ByteArrayOutputStream()), local);
  }

  @Test(expected=IllegalStateException.class)
  public void testCorrupt () {
    IO.declFromBytes(new byte[] { 0, 1, 'x', 0 });
  }
}
