//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.extract;

import com.google.common.base.Joiner;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * A {@link PremiseSink} that writes each record as one line to each of two text destinations:
 * the labels (premise names, space separated, duplicates kept) and the features (as rendered by
 * a {@link FeatureFormat}). Line <i>i</i> of both destinations always describes the same
 * theorem.
 */
public class PremiseWriter implements PremiseSink, Closeable {

  /**
   * Opens UTF-8 writers on {@code labels} and {@code features}, truncating both files.
   */
  public static PremiseWriter open (Path labels, Path features, FeatureFormat format)
    throws IOException {
    BufferedWriter lout = Files.newBufferedWriter(labels, StandardCharsets.UTF_8, TRUNCATE);
    try {
      return new PremiseWriter(
        lout, Files.newBufferedWriter(features, StandardCharsets.UTF_8, TRUNCATE), format);
    } catch (IOException ioe) {
      lout.close();
      throw ioe;
    }
  }

  public PremiseWriter (Writer labels, Writer features, FeatureFormat format) {
    _labels = labels;
    _features = features;
    _format = format;
  }

  @Override public void insert (TheoremPremises record) throws IOException {
    String labels = Joiner.on(' ').join(record.premises);
    String features = _format.format(record);
    _labels.write(labels);
    _labels.write('\n');
    _features.write(features);
    _features.write('\n');
    _count += 1;
  }

  /** Returns the number of records written so far. */
  public int count () {
    return _count;
  }

  /** Closes both destinations, flushing any buffered lines. Both are closed even if closing
    * the first fails. */
  @Override public void close () throws IOException {
    try {
      _labels.close();
    } finally {
      _features.close();
    }
  }

  private final Writer _labels, _features;
  private final FeatureFormat _format;
  private int _count;

  private static final StandardOpenOption[] TRUNCATE = {
    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE };
}
