//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.extract;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import premise.model.Decl;
import premise.model.DeclKind;
import premise.model.Term;

/**
 * Reads a corpus dump and emits its roots, modules and declarations to a {@link CorpusWriter}.
 * A dump is line oriented:
 *
 * <pre>{@code
 * root Mathlib
 * module Mathlib.Logic.Basic
 * import Init.Core
 * decl THEOREM not_not_intro 12 14
 * type (pi a (sort 0) (pi h (const Foo) (const Bar)))
 * value (lam a (sort 0) (bvar 0))
 * end
 * }</pre>
 *
 * Blank lines and lines starting with {@code #} are ignored. Terms are prefix s-expressions;
 * {@code (app f a b)} applies {@code f} to {@code a} and then {@code b}.
 */
public class CorpusReader {

  private static final Logger logger = LogManager.getLogger(CorpusReader.class);

  /**
   * Parses the s-expression {@code text} into a term.
   * @throws CorpusFormatException if {@code text} is not a well formed term.
   */
  public static Term parseTerm (String text) throws CorpusFormatException {
    return parseTerm(text, 0);
  }

  /** Reads the dump in {@code path}, emitting its contents to {@code writer}. */
  public void read (Path path, CorpusWriter writer) throws IOException {
    logger.info("Reading corpus from {}", path);
    try (BufferedReader in = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      read(in, writer);
    }
  }

  /** Reads the dump in {@code text}, emitting its contents to {@code writer}. */
  public void read (String text, CorpusWriter writer) throws IOException {
    read(new StringReader(text), writer);
  }

  /**
   * Reads a dump from {@code reader}, emitting its contents to {@code writer}. The writer's
   * session is opened before reading and closed once the whole dump has been read; it is left
   * open if reading fails.
   * @throws CorpusFormatException if the dump is malformed.
   */
  public void read (Reader reader, CorpusWriter writer) throws IOException {
    BufferedReader in = (reader instanceof BufferedReader) ?
      (BufferedReader)reader : new BufferedReader(reader);
    State state = new State(writer);
    writer.openSession();
    String line;
    while ((line = in.readLine()) != null) {
      state.lineNo += 1;
      String trimmed = line.trim();
      if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
      int sidx = trimmed.indexOf(' ');
      String key = (sidx == -1) ? trimmed : trimmed.substring(0, sidx);
      String rest = (sidx == -1) ? "" : trimmed.substring(sidx+1).trim();
      state.process(key, rest);
    }
    state.finish();
    writer.closeSession();
    logger.debug("Read {} modules ({} decls)", state.modules, state.decls);
  }

  private static class State {
    public int lineNo, modules, decls;

    public State (CorpusWriter writer) {
      _writer = writer;
    }

    public void process (String key, String rest) throws CorpusFormatException {
      switch (key) {
      case "root":
        _writer.emitRoot(requireName(key, rest));
        break;
      case "module":
        if (_module != null) throw error("module " + _module + " was not ended");
        _module = requireName(key, rest);
        _writer.openModule(_module);
        modules += 1;
        break;
      case "import":
        requireModule(key);
        if (_declName != null) throw error("import after declarations in " + _module);
        _writer.emitImport(requireName(key, rest));
        break;
      case "decl":
        requireModule(key);
        flushDecl();
        startDecl(rest);
        break;
      case "type":
        requireDecl(key);
        if (_type != null) throw error("duplicate type for " + _declName);
        _type = parseTerm(rest, lineNo);
        break;
      case "value":
        requireDecl(key);
        if (_value != null) throw error("duplicate value for " + _declName);
        _value = parseTerm(rest, lineNo);
        break;
      case "end":
        requireModule(key);
        flushDecl();
        _writer.closeModule();
        _module = null;
        break;
      default:
        throw error("unknown directive '" + key + "'");
      }
    }

    public void finish () throws CorpusFormatException {
      if (_module != null) throw error("module " + _module + " was not ended");
    }

    private void startDecl (String rest) throws CorpusFormatException {
      List<String> parts = WORDS.splitToList(rest);
      if (parts.size() != 2 && parts.size() != 4) {
        throw error("expected 'decl <KIND> <name> [<start> <end>]'");
      }
      try {
        _kind = DeclKind.valueOf(parts.get(0));
      } catch (IllegalArgumentException iae) {
        throw error("unknown declaration kind '" + parts.get(0) + "'");
      }
      _declName = parts.get(1);
      _startLine = 0;
      _endLine = 0;
      if (parts.size() == 4) {
        _startLine = parseInt(parts.get(2), lineNo);
        _endLine = parseInt(parts.get(3), lineNo);
        if (_startLine < 1 || _endLine < _startLine) {
          throw error("invalid line range " + _startLine + "-" + _endLine);
        }
      }
      _declLine = lineNo;
    }

    private void flushDecl () throws CorpusFormatException {
      if (_declName == null) return;
      if (_type == null) {
        throw new CorpusFormatException(_declLine, "declaration " + _declName + " has no type");
      }
      _writer.emitDecl(new Decl(_declName, _kind, _type, _value, _startLine, _endLine));
      decls += 1;
      _declName = null;
      _kind = null;
      _type = null;
      _value = null;
    }

    private String requireName (String key, String rest) throws CorpusFormatException {
      if (rest.isEmpty() || CharMatcher.whitespace().matchesAnyOf(rest)) {
        throw error("expected '" + key + " <name>'");
      }
      return rest;
    }

    private void requireModule (String key) throws CorpusFormatException {
      if (_module == null) throw error("'" + key + "' outside of a module");
    }

    private void requireDecl (String key) throws CorpusFormatException {
      if (_declName == null) throw error("'" + key + "' outside of a declaration");
    }

    private CorpusFormatException error (String message) {
      return new CorpusFormatException(lineNo, message);
    }

    private final CorpusWriter _writer;
    private String _module;
    private String _declName;
    private DeclKind _kind;
    private Term _type, _value;
    private int _startLine, _endLine, _declLine;
  }

  /** A quoted string token, kept distinct from bare atoms. */
  private static final class Quoted {
    public final String text;
    public Quoted (String text) { this.text = text; }
  }

  private static Term parseTerm (String text, int lineNo) throws CorpusFormatException {
    // terms can be arbitrarily deep, so we parse with an explicit stack of open lists
    Deque<List<Object>> open = new ArrayDeque<>();
    Term result = null;
    int pos = 0, len = text.length();
    while (pos < len) {
      char c = text.charAt(pos);
      if (Character.isWhitespace(c)) {
        pos += 1;
      } else if (c == '(') {
        if (result != null) throw new CorpusFormatException(lineNo, "trailing input: " + text);
        open.push(new ArrayList<>());
        pos += 1;
      } else if (c == ')') {
        if (open.isEmpty()) throw new CorpusFormatException(lineNo, "unbalanced ')': " + text);
        Term term = build(open.pop(), lineNo);
        if (open.isEmpty()) result = term;
        else open.peek().add(term);
        pos += 1;
      } else if (c == '"') {
        StringBuilder sb = new StringBuilder();
        pos = readQuoted(text, pos+1, sb, lineNo);
        if (open.isEmpty()) throw new CorpusFormatException(lineNo, "string outside term: " + text);
        open.peek().add(new Quoted(sb.toString()));
      } else {
        int start = pos;
        while (pos < len && !isDelimiter(text.charAt(pos))) pos += 1;
        if (open.isEmpty()) throw new CorpusFormatException(lineNo, "atom outside term: " + text);
        open.peek().add(text.substring(start, pos));
      }
    }
    if (!open.isEmpty()) throw new CorpusFormatException(lineNo, "unbalanced '(': " + text);
    if (result == null) throw new CorpusFormatException(lineNo, "missing term");
    return result;
  }

  private static Term build (List<Object> items, int lineNo) throws CorpusFormatException {
    if (items.isEmpty() || !(items.get(0) instanceof String)) {
      throw new CorpusFormatException(lineNo, "term must start with a constructor name");
    }
    String ctor = (String)items.get(0);
    List<Object> args = items.subList(1, items.size());
    switch (ctor) {
    case "const":
      checkArity(ctor, args, 1, lineNo);
      return Term.constant(atom(args.get(0), lineNo));
    case "app":
      if (args.size() < 2) {
        throw new CorpusFormatException(lineNo, "app requires a function and an argument");
      }
      Term fn = term(args.get(0), lineNo);
      Term[] appArgs = new Term[args.size()-1];
      for (int ii = 0; ii < appArgs.length; ii++) appArgs[ii] = term(args.get(ii+1), lineNo);
      return Term.app(fn, appArgs);
    case "lam":
      checkArity(ctor, args, 3, lineNo);
      return Term.lam(atom(args.get(0), lineNo), term(args.get(1), lineNo),
                      term(args.get(2), lineNo));
    case "pi":
      checkArity(ctor, args, 3, lineNo);
      return Term.pi(atom(args.get(0), lineNo), term(args.get(1), lineNo),
                     term(args.get(2), lineNo));
    case "let":
      checkArity(ctor, args, 4, lineNo);
      return Term.let(atom(args.get(0), lineNo), term(args.get(1), lineNo),
                      term(args.get(2), lineNo), term(args.get(3), lineNo));
    case "bvar":
      checkArity(ctor, args, 1, lineNo);
      return Term.bvar(parseInt(atom(args.get(0), lineNo), lineNo));
    case "sort":
      checkArity(ctor, args, 1, lineNo);
      return Term.sort(parseInt(atom(args.get(0), lineNo), lineNo));
    case "lit":
      checkArity(ctor, args, 1, lineNo);
      Object value = args.get(0);
      if (value instanceof Quoted) return Term.lit(((Quoted)value).text);
      try {
        BigInteger nat = new BigInteger(atom(value, lineNo));
        if (nat.signum() < 0) throw new CorpusFormatException(lineNo, "negative literal " + nat);
        return Term.lit(nat);
      } catch (NumberFormatException nfe) {
        throw new CorpusFormatException(lineNo, "invalid literal '" + value + "'");
      }
    default:
      throw new CorpusFormatException(lineNo, "unknown term constructor '" + ctor + "'");
    }
  }

  private static void checkArity (String ctor, List<Object> args, int arity, int lineNo)
    throws CorpusFormatException {
    if (args.size() != arity) throw new CorpusFormatException(
      lineNo, ctor + " takes " + arity + " argument(s), got " + args.size());
  }

  private static String atom (Object item, int lineNo) throws CorpusFormatException {
    if (item instanceof String) return (String)item;
    throw new CorpusFormatException(lineNo, "expected a name, got a term");
  }

  private static Term term (Object item, int lineNo) throws CorpusFormatException {
    if (item instanceof Term) return (Term)item;
    throw new CorpusFormatException(lineNo, "expected a term, got '" + item + "'");
  }

  private static int parseInt (String text, int lineNo) throws CorpusFormatException {
    try {
      int value = Integer.parseInt(text);
      if (value < 0) throw new CorpusFormatException(lineNo, "negative number " + value);
      return value;
    } catch (NumberFormatException nfe) {
      throw new CorpusFormatException(lineNo, "invalid number '" + text + "'");
    }
  }

  private static int readQuoted (String text, int pos, StringBuilder into, int lineNo)
    throws CorpusFormatException {
    for (int ll = text.length(); pos < ll; pos++) {
      char c = text.charAt(pos);
      if (c == '"') return pos+1;
      if (c == '\\') {
        if (++pos == ll) break;
        char e = text.charAt(pos);
        switch (e) {
        case 'n': into.append('\n'); break;
        case 't': into.append('\t'); break;
        case '"': case '\\': into.append(e); break;
        default: throw new CorpusFormatException(lineNo, "invalid escape '\\" + e + "'");
        }
      } else into.append(c);
    }
    throw new CorpusFormatException(lineNo, "unterminated string: " + text);
  }

  private static boolean isDelimiter (char c) {
    return c == '(' || c == ')' || c == '"' || Character.isWhitespace(c);
  }

  private static final Splitter WORDS = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();
}
