//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import premise.Corpus;
import premise.extract.CorpusDriver;
import premise.extract.CorpusReader;
import premise.extract.ExtractStats;
import premise.extract.FileSourceLocator;
import premise.extract.PremiseCollector;
import premise.extract.PremiseWriter;
import premise.extract.SourceLocator;
import premise.extract.StatementFeatureExtractor;
import premise.extract.TheoremProcessor;
import premise.extract.UserOptions;
import premise.store.DeclStore;
import premise.store.EphemeralStore;
import premise.store.MapDBStore;
import premise.store.TypeChecker;

/**
 * Extracts premise selection data from a corpus into a labels file and a features file.
 */
@Command(name = "premise-extract", mixinStandardHelpOptions = true, version = "premise 1.0",
         description = "Extracts premise selection training data from a proof corpus.")
public class ExtractPremises implements Callable<Integer> {

  private static final Logger logger = LogManager.getLogger(ExtractPremises.class);

  /** The file extension that identifies a MapDB corpus store. */
  public static final String STORE_EXT = ".db";

  @Parameters(index = "0", paramLabel = "<labels>",
              description = "Output file: one line of premise names per theorem")
  Path labels;

  @Parameters(index = "1", paramLabel = "<features>",
              description = "Output file: one line of statement features per theorem")
  Path features;

  @Parameters(index = "2", paramLabel = "<recursive>",
              description = "'true' to extract all transitive dependencies of the corpus roots")
  String recursive;

  @Parameters(index = "3", paramLabel = "<user>",
              description = "'true' to restrict premises to those mentioned in source")
  String user;

  @Option(names = "--corpus", paramLabel = "<path>",
          description = "Corpus dump, or a MapDB store ending in " + STORE_EXT)
  Path corpus;

  @Option(names = "--import-to", paramLabel = "<path>",
          description = "Also persist a corpus dump to this MapDB store")
  Path importTo;

  @Option(names = "--config", paramLabel = "<file>", description = "Configuration properties")
  Path configFile;

  @Option(names = "--source-root", paramLabel = "<dir>",
          description = "Directory holding the corpus sources, used when <user> is true")
  Path sourceRoot;

  @Option(names = "--min-depth", paramLabel = "<n>", description = "Minimum proof depth")
  Integer minDepth;

  @Option(names = "--max-depth", paramLabel = "<n>",
          description = "Maximum proof depth (exclusive)")
  Integer maxDepth;

  @Option(names = "--target", paramLabel = "<library>",
          description = "Root namespace of the modules to extract")
  String target;

  @Option(names = "--module", paramLabel = "<module>",
          description = "Extract only this module")
  String module;

  @Option(names = "--features", paramLabel = "<classes>",
          description = "Comma separated feature classes: names, bigrams, subexprs")
  String featureClasses;

  public static void main (String[] args) {
    System.exit(new CommandLine(new ExtractPremises()).execute(args));
  }

  @Override public Integer call () {
    try {
      ExtractStats stats = run();
      logger.info("Wrote {} theorems to {} and {}", stats.emitted, labels, features);
      return 0;
    } catch (IOException ioe) {
      logger.error("Extraction failed: {}", ioe.getMessage(), ioe);
      return 1;
    } catch (IllegalArgumentException | NoSuchElementException e) {
      logger.error(e.getMessage());
      return 1;
    }
  }

  /** Resolves the configuration, opens the corpus and runs the extraction. */
  protected ExtractStats run () throws IOException {
    ExtractConfig config = ExtractConfig.load(configFile).
      override(ExtractConfig.CORPUS, corpus).
      override(ExtractConfig.IMPORT_TO, importTo).
      override(ExtractConfig.SOURCE_ROOT, sourceRoot).
      override(ExtractConfig.MIN_DEPTH, minDepth).
      override(ExtractConfig.MAX_DEPTH, maxDepth).
      override(ExtractConfig.TARGET, target).
      override(ExtractConfig.MODULE, module).
      override(ExtractConfig.FEATURES, featureClasses);
    UserOptions options = config.toOptions("true".equals(recursive), "true".equals(user));
    logger.info("Extracting with {}", options);

    Path corpusPath = config.corpus().orElseThrow(() -> new IllegalArgumentException(
      "No corpus given: use --corpus or set " + ExtractConfig.PREFIX + ExtractConfig.CORPUS));

    // truncate the outputs before the corpus is read
    try (PremiseWriter out = PremiseWriter.open(labels, features, options.format);
         DeclStore store = openStore(corpusPath, config.importTo())) {
      Corpus corpus = new Corpus(Collections.singletonList(store));
      TypeChecker checker = new TypeChecker(corpus);
      TheoremProcessor processor = new TheoremProcessor(
        checker, new StatementFeatureExtractor(), new PremiseCollector(checker));

      SourceLocator locator = SourceLocator.NONE;
      Optional<Path> root = config.sourceRoot();
      if (root.isPresent()) locator = new FileSourceLocator(root.get(), corpus);
      else if (options.user) logger.warn("No source root configured, no theorem will be found");

      CorpusDriver driver = new CorpusDriver(corpus, processor, locator, options);
      Optional<String> single = config.module();
      return single.isPresent() ? driver.extractFromModule(single.get(), out) :
        driver.extract(out);
    }
  }

  /**
   * Opens the corpus at {@code path}: a MapDB store if its name ends in {@link #STORE_EXT},
   * otherwise a dump which is read into memory or, if {@code importTo} is given, into a MapDB
   * store at that path.
   */
  protected static DeclStore openStore (Path path, Optional<Path> importTo) throws IOException {
    String name = String.valueOf(path.getFileName());
    if (name.endsWith(STORE_EXT)) {
      logger.info("Opening corpus store {}", path);
      MapDBStore store = new MapDBStore(name, path);
      if (store.moduleNames().isEmpty()) logger.warn("Corpus store {} is empty", path);
      return store;
    }

    DeclStore store;
    if (importTo.isPresent()) {
      logger.info("Importing corpus to {}", importTo.get());
      MapDBStore mstore = new MapDBStore(name, importTo.get());
      mstore.clear();
      store = mstore;
    } else {
      store = new EphemeralStore(name);
    }
    try {
      new CorpusReader().read(path, store.writer());
    } catch (IOException | RuntimeException e) {
      store.close();
      throw e;
    }
    logger.info("Loaded {} declarations in {} modules", store.declCount(),
                store.moduleNames().size());
    return store;
  }
}
