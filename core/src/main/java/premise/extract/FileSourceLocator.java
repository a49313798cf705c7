//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.extract;

import com.google.common.base.Joiner;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import premise.Corpus;
import premise.model.Decl;
import premise.model.Names;

/**
 * Locates theorems in source files laid out by module name under a root directory: module
 * {@code A.B.C} lives in {@code <root>/A/B/C.lean}. A theorem's source text is the range of lines
 * recorded in its declaration. A premise is considered mentioned by a piece of text if the text
 * contains an identifier equal to the premise's name or to one of its dotted suffixes (so that
 * {@code Nat.add_comm} is found in {@code add_comm} and in {@code h.add_comm}).
 */
public class FileSourceLocator implements SourceLocator {

  private static final Logger logger = LogManager.getLogger(FileSourceLocator.class);

  /** The extension of source files. */
  public static final String SOURCE_EXT = ".lean";

  public FileSourceLocator (Path sourceRoot, Corpus corpus) {
    _sourceRoot = sourceRoot;
    _corpus = corpus;
  }

  @Override public Optional<Path> sourcePath (String module) {
    Path path = _sourceRoot.resolve(Joiner.on('/').join(Names.components(module)) + SOURCE_EXT);
    return Files.isRegularFile(path) ? Optional.of(path) : Optional.empty();
  }

  @Override public Optional<Provenance> provenance (String theorem, Path source) {
    String text = spanText(theorem, source);
    int didx = text.indexOf(":=");
    if (didx == -1) return Optional.empty();
    String body = text.substring(didx+2);
    Matcher tactic = TACTIC_START.matcher(body);
    if (tactic.lookingAt()) {
      return Optional.of(new Provenance(Provenance.Style.TACTIC, body.substring(tactic.end())));
    }
    return Optional.of(new Provenance(Provenance.Style.TERM, body));
  }

  @Override public List<String> narrow (String theorem, List<String> premises, Path source) {
    return mentioned(premises, spanText(theorem, source));
  }

  @Override public List<String> restrict (List<String> premises, Provenance provenance) {
    return mentioned(premises, provenance.body);
  }

  /** Returns the elements of {@code premises} mentioned in {@code text}, in order. */
  protected static List<String> mentioned (List<String> premises, String text) {
    if (premises.isEmpty() || text.isEmpty()) return Collections.emptyList();
    Set<String> idents = new HashSet<>();
    Matcher m = IDENT.matcher(text);
    while (m.find()) {
      String ident = m.group();
      while (ident.endsWith(".")) ident = ident.substring(0, ident.length()-1);
      if (!ident.isEmpty()) idents.addAll(Names.suffixes(ident));
    }
    List<String> kept = new ArrayList<>();
    for (String premise : premises) {
      for (String suffix : Names.suffixes(premise)) {
        if (idents.contains(suffix)) {
          kept.add(premise);
          break;
        }
      }
    }
    return kept;
  }

  /** Returns the source text of {@code theorem}, or the empty string if it has no recorded
    * range or its source cannot be read. */
  protected String spanText (String theorem, Path source) {
    Optional<Decl> odecl = _corpus.decl(theorem);
    if (!odecl.isPresent() || !odecl.get().hasRange()) return "";
    Decl decl = odecl.get();
    List<String> lines = lines(source);
    int start = Math.min(decl.startLine, lines.size()+1) - 1;
    int end = Math.min(decl.endLine, lines.size());
    return Joiner.on('\n').join(lines.subList(start, end));
  }

  private List<String> lines (Path source) {
    // theorems are processed module by module, so we need only remember the current file
    if (!source.equals(_curSource)) {
      _curSource = source;
      try {
        _curLines = Files.readAllLines(source, StandardCharsets.UTF_8);
      } catch (IOException ioe) {
        logger.warn("Unable to read source {}, its theorems will mention no premises", source, ioe);
        _curLines = Collections.emptyList();
      }
    }
    return _curLines;
  }

  private final Path _sourceRoot;
  private final Corpus _corpus;
  private Path _curSource;
  private List<String> _curLines = Collections.emptyList();

  private static final Pattern IDENT = Pattern.compile(
    "[\\p{L}_][\\p{L}\\p{N}_'!?.\\u2080-\\u2089]*");
  private static final Pattern TACTIC_START = Pattern.compile("\\s*by(\\s|$)");
}
