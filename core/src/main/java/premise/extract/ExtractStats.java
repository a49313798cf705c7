//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.extract;

/**
 * Counts what happened to the declarations seen by an extraction run.
 */
public class ExtractStats {

  /** The number of modules processed. */
  public int modules;

  /** The number of declarations seen. */
  public int decls;

  /** Declarations skipped because their name marks them as generated. */
  public int excluded;

  /** Declarations that were not theorems, or whose proof failed the depth gate. */
  public int rejected;

  /** Declarations skipped because their statement or proof could not be analysed. */
  public int failed;

  /** Records written to the sink. */
  public int emitted;

  /** Records dropped because filtering left them without premises. */
  public int empty;

  /** Records whose theorem was found in its source (always all of them without filtering). */
  public int found;

  /** Records produced, whether or not they were emitted. */
  public int total;

  /** Adds the counts of {@code other} to this. */
  public void add (ExtractStats other) {
    modules += other.modules;
    decls += other.decls;
    excluded += other.excluded;
    rejected += other.rejected;
    failed += other.failed;
    emitted += other.emitted;
    empty += other.empty;
    found += other.found;
    total += other.total;
  }

  @Override public String toString () {
    return String.format("%d modules, %d decls: %d excluded, %d rejected, %d failed, " +
                         "%d emitted, %d without premises (%d/%d found)",
                         modules, decls, excluded, rejected, failed, emitted, empty, found, total);
  }
}
