//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.extract;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Relates theorems to the source text in which they were written, so that premises introduced
 * by elaboration (and absent from what a human wrote) can be filtered out.
 */
public interface SourceLocator {

  /** A locator that knows no sources: every module is unresolved. */
  SourceLocator NONE = new SourceLocator() {
    @Override public Optional<Path> sourcePath (String module) {
      return Optional.empty();
    }
    @Override public Optional<Provenance> provenance (String theorem, Path source) {
      return Optional.empty();
    }
    @Override public List<String> narrow (String theorem, List<String> premises, Path source) {
      return premises;
    }
    @Override public List<String> restrict (List<String> premises, Provenance provenance) {
      return premises;
    }
  };

  /** Returns the path of the source file of {@code module}, if it can be found. */
  Optional<Path> sourcePath (String module);

  /** Classifies how {@code theorem}, written in {@code source}, was proved. Returns nothing if
    * the theorem's proof cannot be found or classified. */
  Optional<Provenance> provenance (String theorem, Path source);

  /** Returns the elements of {@code premises} that are mentioned in the source text of
    * {@code theorem} in {@code source}, in their original order. */
  List<String> narrow (String theorem, List<String> premises, Path source);

  /** Returns the elements of {@code premises} that are mentioned in the proof described by
    * {@code provenance}, in their original order. */
  List<String> restrict (List<String> premises, Provenance provenance);
}
