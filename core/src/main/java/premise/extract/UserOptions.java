//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.extract;

import com.google.common.base.Preconditions;
import premise.model.Term;

/**
 * The options that control an extraction run. Instances are immutable; the {@code with}
 * methods return modified copies.
 */
public final class UserOptions {

  /** The default options: depths [0, 255), no source filtering, the default format, direct
    * dependencies of the corpus that belong to {@code Mathlib}. */
  public static final UserOptions DEFAULT = new UserOptions(
    0, Term.MAX_DEPTH, false, FeatureFormat.DEFAULT, "Mathlib", false);

  /** The smallest approximate proof depth that is extracted (inclusive). */
  public final int minDepth;

  /** The approximate proof depth above which proofs are skipped (exclusive). */
  public final int maxDepth;

  /** Whether premises are filtered by their presence in the theorem's source text. */
  public final boolean user;

  /** The classes of features written for each theorem. */
  public final FeatureFormat format;

  /** The root namespace of the library whose modules are extracted. */
  public final String targetLibrary;

  /** Whether modules transitively imported by the corpus are extracted, rather than only its
    * direct imports. */
  public final boolean recursive;

  public UserOptions (int minDepth, int maxDepth, boolean user, FeatureFormat format,
                      String targetLibrary, boolean recursive) {
    Preconditions.checkArgument(minDepth >= 0, "minDepth must be non-negative: %s", minDepth);
    Preconditions.checkArgument(minDepth <= maxDepth, "minDepth %s exceeds maxDepth %s",
                                minDepth, maxDepth);
    this.minDepth = minDepth;
    this.maxDepth = maxDepth;
    this.user = user;
    this.format = Preconditions.checkNotNull(format);
    this.targetLibrary = Preconditions.checkNotNull(targetLibrary);
    this.recursive = recursive;
  }

  public UserOptions withDepths (int minDepth, int maxDepth) {
    return new UserOptions(minDepth, maxDepth, user, format, targetLibrary, recursive);
  }
  public UserOptions withUser (boolean user) {
    return new UserOptions(minDepth, maxDepth, user, format, targetLibrary, recursive);
  }
  public UserOptions withFormat (FeatureFormat format) {
    return new UserOptions(minDepth, maxDepth, user, format, targetLibrary, recursive);
  }
  public UserOptions withTargetLibrary (String targetLibrary) {
    return new UserOptions(minDepth, maxDepth, user, format, targetLibrary, recursive);
  }
  public UserOptions withRecursive (boolean recursive) {
    return new UserOptions(minDepth, maxDepth, user, format, targetLibrary, recursive);
  }

  @Override public String toString () {
    return String.format(
      "UserOptions(depth=[%d,%d), user=%s, format=%s, target=%s, recursive=%s)",
      minDepth, maxDepth, user, format, targetLibrary, recursive);
  }
}
