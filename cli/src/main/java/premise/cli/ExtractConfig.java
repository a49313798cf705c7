//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import premise.extract.FeatureFormat;
import premise.extract.UserOptions;

/**
 * Extraction settings, layered from (lowest to highest precedence): the {@code premise.properties}
 * resource on the classpath, an optional configuration file, {@code premise.*} system properties
 * and finally values supplied on the command line via {@link #override}.
 */
public class ExtractConfig {

  private static final Logger logger = LogManager.getLogger(ExtractConfig.class);

  /** The prefix shared by all configuration keys. */
  public static final String PREFIX = "premise.";

  /** The classpath resource that supplies defaults. */
  public static final String DEFAULTS_RESOURCE = "/premise.properties";

  public static final String CORPUS = "corpus";
  public static final String IMPORT_TO = "importTo";
  public static final String SOURCE_ROOT = "sourceRoot";
  public static final String MIN_DEPTH = "minDepth";
  public static final String MAX_DEPTH = "maxDepth";
  public static final String TARGET = "target";
  public static final String MODULE = "module";
  public static final String FEATURES = "features";

  /**
   * Loads the defaults, overlays {@code configFile} (if non-null) and then any {@code premise.*}
   * system properties.
   */
  public static ExtractConfig load (Path configFile) throws IOException {
    Properties props = new Properties();
    try (InputStream in = ExtractConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
      if (in != null) props.load(in);
      else logger.debug("No {} on classpath, using built in defaults", DEFAULTS_RESOURCE);
    }
    if (configFile != null) {
      logger.info("Loading configuration from {}", configFile);
      try (Reader in = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
        props.load(in);
      }
    }
    Properties sys = System.getProperties();
    for (String key : sys.stringPropertyNames()) {
      if (key.startsWith(PREFIX)) props.setProperty(key, sys.getProperty(key));
    }
    return new ExtractConfig(props);
  }

  public ExtractConfig (Properties props) {
    _props = props;
  }

  /** Returns a copy of this config with {@code key} set to {@code value}, unless {@code value}
    * is null, in which case this config is returned unchanged. */
  public ExtractConfig override (String key, Object value) {
    if (value == null) return this;
    Properties props = new Properties();
    props.putAll(_props);
    props.setProperty(PREFIX + key, String.valueOf(value));
    return new ExtractConfig(props);
  }

  /** Returns the (trimmed, non-empty) value of {@code key}, if it is set. */
  public Optional<String> get (String key) {
    String value = _props.getProperty(PREFIX + key);
    if (value == null || value.trim().isEmpty()) return Optional.empty();
    return Optional.of(value.trim());
  }

  /**
   * Returns the integer value of {@code key}, or {@code defval} if it is not set.
   * @throws IllegalArgumentException if the value is not an integer.
   */
  public int getInt (String key, int defval) {
    Optional<String> value = get(key);
    if (!value.isPresent()) return defval;
    try {
      return Integer.parseInt(value.get());
    } catch (NumberFormatException nfe) {
      throw new IllegalArgumentException(
        "Invalid integer for " + PREFIX + key + ": '" + value.get() + "'");
    }
  }

  public Optional<Path> corpus () { return get(CORPUS).map(Paths::get); }
  public Optional<Path> importTo () { return get(IMPORT_TO).map(Paths::get); }
  public Optional<Path> sourceRoot () { return get(SOURCE_ROOT).map(Paths::get); }
  public Optional<String> module () { return get(MODULE); }

  /**
   * Returns the extraction options described by this config, with the supplied flags.
   * @throws IllegalArgumentException if a setting is malformed or the depth bounds are inverted.
   */
  public UserOptions toOptions (boolean recursive, boolean user) {
    UserOptions defs = UserOptions.DEFAULT;
    int minDepth = getInt(MIN_DEPTH, defs.minDepth);
    int maxDepth = getInt(MAX_DEPTH, defs.maxDepth);
    if (minDepth < 0 || maxDepth < minDepth) throw new IllegalArgumentException(
      "Invalid depth bounds [" + minDepth + ", " + maxDepth + ")");
    FeatureFormat format = get(FEATURES).map(FeatureFormat::parse).orElse(defs.format);
    return defs.withDepths(minDepth, maxDepth).
      withFormat(format).
      withTargetLibrary(get(TARGET).orElse(defs.targetLibrary)).
      withRecursive(recursive).
      withUser(user);
  }

  @Override public String toString () {
    return "ExtractConfig" + _props;
  }

  private final Properties _props;
}
