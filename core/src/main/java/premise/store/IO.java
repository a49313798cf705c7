//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.store;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInput;
import java.io.DataInputStream;
import java.io.DataOutput;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import premise.model.Decl;
import premise.model.DeclKind;
import premise.model.Term;

/**
 * Binary encodings of the corpus model, used by {@link MapDBStore}.
 */
public class IO {

  /** Encodes {@code decl} into a byte array. */
  public static byte[] toBytes (Decl decl) {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (DataOutputStream out = new DataOutputStream(bytes)) {
      writeDecl(out, decl);
    } catch (IOException ioe) {
      throw new UncheckedIOException(ioe); // can't happen writing to memory
    }
    return bytes.toByteArray();
  }

  /** Decodes a declaration encoded by {@link #toBytes(Decl)}. */
  public static Decl declFromBytes (byte[] data) {
    try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(data))) {
      return readDecl(in);
    } catch (IOException ioe) {
      throw new IllegalStateException("Corrupt declaration record", ioe);
    }
  }

  /** Encodes {@code names} into a byte array. */
  public static byte[] toBytes (List<String> names) {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (DataOutputStream out = new DataOutputStream(bytes)) {
      writeNames(out, names);
    } catch (IOException ioe) {
      throw new UncheckedIOException(ioe);
    }
    return bytes.toByteArray();
  }

  /** Decodes a name list encoded by {@link #toBytes(List)}. */
  public static List<String> namesFromBytes (byte[] data) {
    try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(data))) {
      return readNames(in);
    } catch (IOException ioe) {
      throw new IllegalStateException("Corrupt name list record", ioe);
    }
  }

  public static Decl readDecl (DataInput in) throws IOException {
    String name = in.readUTF();
    DeclKind kind = readKind(in);
    Term type = readTerm(in);
    Term value = in.readBoolean() ? readTerm(in) : null;
    int startLine = in.readInt(), endLine = in.readInt();
    return new Decl(name, kind, type, value, startLine, endLine);
  }
  public static void writeDecl (DataOutput out, Decl decl) throws IOException {
    out.writeUTF(decl.name);
    writeKind(out, decl.kind);
    writeTerm(out, decl.type);
    out.writeBoolean(decl.value != null);
    if (decl.value != null) writeTerm(out, decl.value);
    out.writeInt(decl.startLine);
    out.writeInt(decl.endLine);
  }

  public static List<String> readNames (DataInput in) throws IOException {
    int count = in.readInt();
    List<String> names = new ArrayList<>(count);
    for (int ii = 0; ii < count; ii++) names.add(in.readUTF());
    return names;
  }
  public static void writeNames (DataOutput out, List<String> names) throws IOException {
    out.writeInt(names.size());
    for (String name : names) out.writeUTF(name);
  }

  public static DeclKind readKind (DataInput in) throws IOException {
    return Enum.valueOf(DeclKind.class, in.readUTF());
  }
  public static void writeKind (DataOutput out, DeclKind kind) throws IOException {
    out.writeUTF(kind.name());
  }

  /** Reads a term written by {@link #writeTerm}. */
  public static Term readTerm (DataInput in) throws IOException {
    // terms are written in pre-order; compound nodes wait on the stack for their children
    Deque<Pending> pending = new ArrayDeque<>();
    while (true) {
      byte tag = in.readByte();
      Term term;
      switch (tag) {
      case BVAR: term = Term.bvar(in.readInt()); break;
      case SORT: term = Term.sort(in.readInt()); break;
      case CONST: term = Term.constant(in.readUTF()); break;
      case NAT_LIT: term = Term.lit(new BigInteger(in.readUTF())); break;
      case STR_LIT: term = Term.lit(in.readUTF()); break;
      case APP: pending.push(new Pending(tag, null, 2)); continue;
      case LAM:
      case PI: pending.push(new Pending(tag, in.readUTF(), 2)); continue;
      case LET: pending.push(new Pending(tag, in.readUTF(), 3)); continue;
      default: throw new IOException("Unknown term tag: " + tag);
      }

      while (true) {
        Pending top = pending.peek();
        if (top == null) return term;
        top.parts.add(term);
        if (top.parts.size() < top.arity) break;
        pending.pop();
        term = top.build();
      }
    }
  }

  /** Writes {@code term} in pre-order: each node's tag and payload, then its children. */
  public static void writeTerm (DataOutput out, Term term) throws IOException {
    // proofs can be arbitrarily deep, so we walk with an explicit stack
    Deque<Term> pending = new ArrayDeque<>();
    pending.push(term);
    while (!pending.isEmpty()) {
      Term next = pending.pop();
      writeNode(out, next);
      List<Term> children = next.children();
      for (int ii = children.size()-1; ii >= 0; ii--) pending.push(children.get(ii));
    }
  }

  private static void writeNode (DataOutput out, Term term) throws IOException {
    if (term instanceof Term.BVar) {
      out.writeByte(BVAR);
      out.writeInt(((Term.BVar)term).index);
    } else if (term instanceof Term.Sort) {
      out.writeByte(SORT);
      out.writeInt(((Term.Sort)term).level);
    } else if (term instanceof Term.Const) {
      out.writeByte(CONST);
      out.writeUTF(((Term.Const)term).name);
    } else if (term instanceof Term.App) {
      out.writeByte(APP);
    } else if (term instanceof Term.Binder) {
      out.writeByte((term instanceof Term.Lam) ? LAM : PI);
      out.writeUTF(((Term.Binder)term).binder);
    } else if (term instanceof Term.Let) {
      out.writeByte(LET);
      out.writeUTF(((Term.Let)term).binder);
    } else if (term instanceof Term.Lit) {
      Term.Lit lit = (Term.Lit)term;
      out.writeByte(lit.isNat() ? NAT_LIT : STR_LIT);
      out.writeUTF(lit.value.toString());
    } else {
      // locals only exist while a binder is open, they never reach a store
      throw new IllegalArgumentException("Cannot store term: " + term);
    }
  }

  /** A compound term whose children are still being read. */
  private static class Pending {
    public final byte tag;
    public final String binder;
    public final int arity;
    public final List<Term> parts = new ArrayList<>(3);

    public Pending (byte tag, String binder, int arity) {
      this.tag = tag;
      this.binder = binder;
      this.arity = arity;
    }

    public Term build () {
      switch (tag) {
      case APP: return Term.app(parts.get(0), parts.get(1));
      case LAM: return Term.lam(binder, parts.get(0), parts.get(1));
      case PI: return Term.pi(binder, parts.get(0), parts.get(1));
      default: return Term.let(binder, parts.get(0), parts.get(1), parts.get(2));
      }
    }
  }

  private static final byte BVAR = 1, SORT = 2, CONST = 3, APP = 4, LAM = 5, PI = 6, LET = 7;
  private static final byte NAT_LIT = 8, STR_LIT = 9;

  private IO () {} // no instances
}
