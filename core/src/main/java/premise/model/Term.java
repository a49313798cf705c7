//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An immutable expression of the corpus term language: the statements and proofs of
 * declarations. Bound variables use de Bruijn indices; binders are opened by instantiating their
 * bodies with a {@link Local}.
 *
 * <p>Every term caches an approximate depth: leaves have depth zero, other nodes one more than
 * their deepest child, saturating at {@link #MAX_DEPTH}.</p>
 */
public abstract class Term implements Expr {

  /** The depth at which {@link #approxDepth} saturates. */
  public static final int MAX_DEPTH = 255;

  /** A reference to the {@code index}th enclosing binder. */
  public static final class BVar extends Term {
    public final int index;

    @Override Term instantiate (int depth, Term value) {
      if (index == depth) return value;
      else if (index > depth) return new BVar(index-1);
      else return this;
    }
    @Override Term abstractLocal (int depth, Local local) { return this; }

    @Override public int hashCode () { return index; }
    @Override public boolean equals (Object other) {
      return (other instanceof BVar) && index == ((BVar)other).index;
    }
    @Override void toString (StringBuilder sb) {
      sb.append("(bvar ").append(index).append(")");
    }

    private BVar (int index) {
      super(0);
      Preconditions.checkArgument(index >= 0, "Negative bound variable index: %s", index);
      this.index = index;
    }
  }

  /** A free variable introduced by opening a binder. A local carries its own type. */
  public static final class Local extends Term {
    public final String name;
    public final Term type;

    @Override Term instantiate (int depth, Term value) { return this; }
    @Override Term abstractLocal (int depth, Local local) {
      return (local == this) ? new BVar(depth) : this;
    }

    @Override public int hashCode () { return name.hashCode() ^ type.hashCode(); }
    @Override public boolean equals (Object other) {
      return (other instanceof Local) && name.equals(((Local)other).name) &&
        type.equals(((Local)other).type);
    }
    @Override void toString (StringBuilder sb) {
      sb.append("(local ").append(name).append(")");
    }

    private Local (String name, Term type) {
      super(0);
      this.name = name;
      this.type = type;
    }
  }

  /** A universe. {@code Sort 0} is the universe of propositions. */
  public static final class Sort extends Term {
    public final int level;

    @Override Term instantiate (int depth, Term value) { return this; }
    @Override Term abstractLocal (int depth, Local local) { return this; }

    @Override public int hashCode () { return 31 * level + 7; }
    @Override public boolean equals (Object other) {
      return (other instanceof Sort) && level == ((Sort)other).level;
    }
    @Override void toString (StringBuilder sb) {
      sb.append("(sort ").append(level).append(")");
    }

    private Sort (int level) {
      super(0);
      Preconditions.checkArgument(level >= 0, "Negative universe level: %s", level);
      this.level = level;
    }
  }

  /** A reference to a declaration by its fully qualified name. */
  public static final class Const extends Term {
    public final String name;

    @Override public String constName () { return name; }

    @Override Term instantiate (int depth, Term value) { return this; }
    @Override Term abstractLocal (int depth, Local local) { return this; }

    @Override public int hashCode () { return name.hashCode(); }
    @Override public boolean equals (Object other) {
      return (other instanceof Const) && name.equals(((Const)other).name);
    }
    @Override void toString (StringBuilder sb) {
      sb.append("(const ").append(name).append(")");
    }

    private Const (String name) {
      super(0);
      Preconditions.checkArgument(!name.isEmpty(), "Constant name must be non-empty");
      this.name = name;
    }
  }

  /** The application of {@code fn} to a single argument. */
  public static final class App extends Term {
    public final Term fn, arg;

    @Override public List<Term> children () { return ImmutableList.of(fn, arg); }

    @Override Term instantiate (int depth, Term value) {
      return new App(fn.instantiate(depth, value), arg.instantiate(depth, value));
    }
    @Override Term abstractLocal (int depth, Local local) {
      return new App(fn.abstractLocal(depth, local), arg.abstractLocal(depth, local));
    }

    @Override public int hashCode () { return fn.hashCode() * 31 + arg.hashCode(); }
    @Override public boolean equals (Object other) {
      return (other instanceof App) && fn.equals(((App)other).fn) && arg.equals(((App)other).arg);
    }
    @Override void toString (StringBuilder sb) {
      sb.append("(app ");
      fn.toString(sb);
      sb.append(" ");
      arg.toString(sb);
      sb.append(")");
    }

    private App (Term fn, Term arg) {
      super(1 + Math.max(fn.depth(), arg.depth()));
      this.fn = fn;
      this.arg = arg;
    }
  }

  /** Shared structure of the binding forms. */
  public static abstract class Binder extends Term {
    /** The name given to the bound variable in source. Not significant for equality. */
    public final String binder;
    public final Term type, body;

    /** Opens this binder: instantiates its body with a fresh local of the binder's type. */
    public Local open () {
      return new Local(binder, type);
    }

    /** Returns the body instantiated with {@code local}. */
    public Term bodyWith (Term local) {
      return body.instantiate(local);
    }

    @Override public List<Term> children () { return ImmutableList.of(type, body); }

    @Override public int hashCode () {
      return getClass().hashCode() ^ (type.hashCode() * 31 + body.hashCode());
    }
    @Override public boolean equals (Object other) {
      return (other != null) && other.getClass() == getClass() &&
        type.equals(((Binder)other).type) && body.equals(((Binder)other).body);
    }

    protected void toString (String head, StringBuilder sb) {
      sb.append("(").append(head).append(" ").append(binder).append(" ");
      type.toString(sb);
      sb.append(" ");
      body.toString(sb);
      sb.append(")");
    }

    private Binder (String binder, Term type, Term body) {
      super(1 + Math.max(type.depth(), body.depth()));
      this.binder = binder;
      this.type = type;
      this.body = body;
    }
  }

  /** A function abstraction. */
  public static final class Lam extends Binder {
    @Override Term instantiate (int depth, Term value) {
      return new Lam(binder, type.instantiate(depth, value), body.instantiate(depth+1, value));
    }
    @Override Term abstractLocal (int depth, Local local) {
      return new Lam(binder, type.abstractLocal(depth, local), body.abstractLocal(depth+1, local));
    }
    @Override void toString (StringBuilder sb) { toString("lam", sb); }

    private Lam (String binder, Term type, Term body) { super(binder, type, body); }
  }

  /** A dependent function type (a universally quantified statement when its body is a
    * proposition). */
  public static final class Pi extends Binder {
    @Override Term instantiate (int depth, Term value) {
      return new Pi(binder, type.instantiate(depth, value), body.instantiate(depth+1, value));
    }
    @Override Term abstractLocal (int depth, Local local) {
      return new Pi(binder, type.abstractLocal(depth, local), body.abstractLocal(depth+1, local));
    }
    @Override void toString (StringBuilder sb) { toString("pi", sb); }

    private Pi (String binder, Term type, Term body) { super(binder, type, body); }
  }

  /** A local definition: {@code body} with bound variable 0 standing for {@code value}. */
  public static final class Let extends Term {
    public final String binder;
    public final Term type, value, body;

    @Override public List<Term> children () { return ImmutableList.of(type, value, body); }

    @Override Term instantiate (int depth, Term with) {
      return new Let(binder, type.instantiate(depth, with), value.instantiate(depth, with),
                     body.instantiate(depth+1, with));
    }
    @Override Term abstractLocal (int depth, Local local) {
      return new Let(binder, type.abstractLocal(depth, local), value.abstractLocal(depth, local),
                     body.abstractLocal(depth+1, local));
    }

    @Override public int hashCode () {
      return (type.hashCode() * 31 + value.hashCode()) * 31 + body.hashCode();
    }
    @Override public boolean equals (Object other) {
      if (!(other instanceof Let)) return false;
      Let olet = (Let)other;
      return type.equals(olet.type) && value.equals(olet.value) && body.equals(olet.body);
    }
    @Override void toString (StringBuilder sb) {
      sb.append("(let ").append(binder).append(" ");
      type.toString(sb);
      sb.append(" ");
      value.toString(sb);
      sb.append(" ");
      body.toString(sb);
      sb.append(")");
    }

    private Let (String binder, Term type, Term value, Term body) {
      super(1 + Math.max(type.depth(), Math.max(value.depth(), body.depth())));
      this.binder = binder;
      this.type = type;
      this.value = value;
      this.body = body;
    }
  }

  /** A natural number or string literal. */
  public static final class Lit extends Term {
    /** Either a {@link BigInteger} or a {@link String}. */
    public final Object value;

    public boolean isNat () { return value instanceof BigInteger; }

    @Override Term instantiate (int depth, Term with) { return this; }
    @Override Term abstractLocal (int depth, Local local) { return this; }

    @Override public int hashCode () { return value.hashCode(); }
    @Override public boolean equals (Object other) {
      return (other instanceof Lit) && value.equals(((Lit)other).value);
    }
    @Override void toString (StringBuilder sb) {
      sb.append("(lit ");
      if (isNat()) sb.append(value);
      else {
        sb.append('"');
        for (char c : ((String)value).toCharArray()) {
          switch (c) {
          case '"': sb.append("\\\""); break;
          case '\\': sb.append("\\\\"); break;
          case '\n': sb.append("\\n"); break;
          case '\t': sb.append("\\t"); break;
          default: sb.append(c);
          }
        }
        sb.append('"');
      }
      sb.append(")");
    }

    private Lit (Object value) {
      super(0);
      Preconditions.checkArgument(value instanceof BigInteger || value instanceof String,
                                  "Unsupported literal: %s", value);
      this.value = value;
    }
  }

  /** The universe of propositions. */
  public static final Term PROP = new Sort(0);

  public static Term bvar (int index) { return new BVar(index); }
  public static Local local (String name, Term type) { return new Local(name, type); }
  public static Term sort (int level) { return (level == 0) ? PROP : new Sort(level); }
  public static Term constant (String name) { return new Const(name); }
  public static Term lam (String binder, Term type, Term body) {
    return new Lam(binder, type, body);
  }
  public static Term pi (String binder, Term type, Term body) { return new Pi(binder, type, body); }
  public static Term let (String binder, Term type, Term value, Term body) {
    return new Let(binder, type, value, body);
  }
  public static Term nat (long value) { return new Lit(BigInteger.valueOf(value)); }
  public static Term lit (Object value) { return new Lit(value); }

  /** Returns {@code fn} applied to {@code args}, left-associatively. */
  public static Term app (Term fn, Term... args) {
    Term term = fn;
    for (Term arg : args) term = new App(term, arg);
    return term;
  }

  /** Returns the non-dependent arrow {@code from -> to}. */
  public static Term arrow (Term from, Term to) {
    return new Pi("_", from, to);
  }

  /** Returns the approximate depth of this term, saturating at {@link #MAX_DEPTH}. */
  public int approxDepth () {
    return _depth;
  }

  /** Returns the head of this application spine, or this term if it is not an application. */
  public Term appFn () {
    Term term = this;
    while (term instanceof App) term = ((App)term).fn;
    return term;
  }

  /** Returns the arguments of this application spine, in application order. */
  public List<Term> appArgs () {
    if (!(this instanceof App)) return Collections.emptyList();
    List<Term> args = new ArrayList<>();
    for (Term term = this; term instanceof App; term = ((App)term).fn) args.add(((App)term).arg);
    Collections.reverse(args);
    return args;
  }

  /** Replaces the loose bound variable 0 in this term with {@code value}, which must contain no
    * loose bound variables. */
  public Term instantiate (Term value) {
    return instantiate(0, Objects.requireNonNull(value));
  }

  /** Replaces occurrences of {@code local} in this term with a bound variable referencing a
    * binder wrapped directly around the result. The inverse of {@link #instantiate}. */
  public Term abstractLocal (Local local) {
    return abstractLocal(0, local);
  }

  @Override public String constName () {
    return null;
  }

  @Override public List<Term> children () {
    return Collections.emptyList();
  }

  /** Returns this term in the prefix notation read by the corpus reader. */
  @Override public String toString () {
    StringBuilder sb = new StringBuilder();
    toString(sb);
    return sb.toString();
  }

  abstract Term instantiate (int depth, Term value);
  abstract Term abstractLocal (int depth, Local local);
  abstract void toString (StringBuilder sb);

  private int depth () {
    return _depth;
  }

  private Term (int depth) {
    _depth = Math.min(depth, MAX_DEPTH);
  }

  private final int _depth;
}
