//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.extract;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import premise.Corpus;
import premise.model.Decl;
import premise.model.ModuleData;
import premise.model.Names;
import premise.store.TypeCheckException;
import premise.store.UnknownConstantException;

/**
 * Runs extraction over the modules of a corpus, module by module and declaration by declaration,
 * passing retained records to a {@link PremiseSink}. Processing is sequential: the order in which
 * records reach the sink is the order of the modules and of the declarations within them.
 */
public class CorpusDriver {

  private static final Logger logger = LogManager.getLogger(CorpusDriver.class);

  /** Substrings that mark the names of compiler generated lemmas. */
  public static final List<String> GENERATED_MARKERS = ImmutableList.of(
    "_eqn_", "_proof_", "_match_");

  /**
   * Returns true if {@code name} denotes a declaration that is never extracted: one whose name
   * contains {@code !} or a guillemet, or one of the {@link #GENERATED_MARKERS}.
   */
  public static boolean isExcluded (String name) {
    if (EXCLUDED_CHARS.matchesAnyOf(name)) return true;
    for (String marker : GENERATED_MARKERS) if (name.contains(marker)) return true;
    return false;
  }

  public CorpusDriver (Corpus corpus, TheoremProcessor processor, SourceLocator locator,
                       UserOptions options) {
    _corpus = corpus;
    _processor = processor;
    _locator = locator;
    _options = options;
  }

  /**
   * Returns the modules extracted by {@link #extract}: the dependencies of the corpus (direct
   * or transitive, per the options) that belong to the target library.
   */
  public List<String> targetModules () {
    List<String> targets = new ArrayList<>();
    for (String module : _corpus.dependencies(_options.recursive)) {
      if (Names.root(module).equals(_options.targetLibrary)) targets.add(module);
    }
    return targets;
  }

  /**
   * Extracts every target module, in order, into {@code sink}.
   * @throws IOException if the sink fails, in which case the run is abandoned.
   */
  public ExtractStats extract (PremiseSink sink) throws IOException {
    List<String> modules = targetModules();
    ExtractStats stats = new ExtractStats();
    int count = 0;
    for (String name : modules) {
      count += 1;
      logger.info("Extracting premises from {} ({}/{})", name, count, modules.size());
      ModuleData module = _corpus.module(name).orElseThrow(
        () -> new IllegalStateException("Dependency vanished: " + name));
      stats.add(processModule(module, sink));
    }
    logger.info("Extraction complete: {}", stats);
    return stats;
  }

  /**
   * Extracts the single module named {@code name} into {@code sink}.
   * @throws NoSuchElementException if the corpus has no such module.
   * @throws IOException if the sink fails.
   */
  public ExtractStats extractFromModule (String name, PremiseSink sink) throws IOException {
    ModuleData module = _corpus.module(name).orElseThrow(
      () -> new NoSuchElementException("Unknown module: " + name));
    logger.info("Extracting premises from {}", name);
    ExtractStats stats = processModule(module, sink);
    logger.info("Extraction complete: {}", stats);
    return stats;
  }

  /**
   * Extracts the declarations of {@code module} into {@code sink}. A declaration whose
   * statement or proof cannot be analysed is logged and skipped.
   */
  public ExtractStats processModule (ModuleData module, PremiseSink sink) throws IOException {
    ExtractStats stats = new ExtractStats();
    stats.modules = 1;
    PremiseFilter filter = filterFor(module.name);

    for (Decl decl : module.decls) {
      stats.decls += 1;
      if (isExcluded(decl.name)) {
        stats.excluded += 1;
        continue;
      }

      Optional<TheoremPremises> orecord;
      try {
        orecord = _processor.process(decl, _options.minDepth, _options.maxDepth);
      } catch (UnknownConstantException | TypeCheckException e) {
        logger.warn("Skipping {}: {}", decl.name, e.getMessage());
        stats.failed += 1;
        continue;
      }
      if (!orecord.isPresent()) {
        stats.rejected += 1;
        continue;
      }

      TheoremPremises record = orecord.get();
      PremiseFilter.Verdict verdict = filter.apply(record.name, record.premises);
      stats.total += 1;
      if (verdict.found) stats.found += 1;
      if (verdict.premises.isEmpty()) {
        stats.empty += 1;
        continue;
      }
      sink.insert(record.withPremises(verdict.premises));
      stats.emitted += 1;
    }

    if (_options.user) {
      logger.info("{}: found {}/{} theorems in source ({})", module.name, stats.found,
                  stats.total, ratio(stats.found, stats.total));
    }
    return stats;
  }

  /**
   * Returns the premise filter for theorems of {@code module}. Without source filtering every
   * premise is kept and every theorem found. With it, premises are narrowed to those mentioned
   * in the theorem's source text and, if the theorem's proof can be classified, restricted to
   * those mentioned in the proof; theorems whose proof cannot be classified, and all theorems
   * of modules whose source cannot be located, are reported not found.
   */
  protected PremiseFilter filterFor (String module) {
    if (!_options.user) return PremiseFilter.identity(true);

    Optional<Path> osource = _locator.sourcePath(module);
    if (!osource.isPresent()) {
      logger.debug("No source located for {}", module);
      return PremiseFilter.identity(false);
    }

    Path source = osource.get();
    return (theorem, premises) -> {
      List<String> narrowed = _locator.narrow(theorem, premises, source);
      Optional<Provenance> oprov = _locator.provenance(theorem, source);
      if (oprov.isPresent()) {
        return new PremiseFilter.Verdict(_locator.restrict(narrowed, oprov.get()), true);
      } else {
        return new PremiseFilter.Verdict(narrowed, false);
      }
    };
  }

  private static String ratio (int found, int total) {
    return (total == 0) ? "n/a" : String.format("%.1f%%", 100.0 * found / total);
  }

  private final Corpus _corpus;
  private final TheoremProcessor _processor;
  private final SourceLocator _locator;
  private final UserOptions _options;

  private static final CharMatcher EXCLUDED_CHARS = CharMatcher.anyOf("!«»");
}
