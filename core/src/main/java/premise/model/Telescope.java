//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.model;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/**
 * A statement split into its leading quantified arguments and its conclusion. Each argument is
 * a local standing for the opened binder; the conclusion mentions these locals in place of the
 * bound variables.
 */
public final class Telescope {

  /** Strips the leading pi binders from {@code type}. */
  public static Telescope of (Term type) {
    List<Term.Local> args = new ArrayList<>();
    Term cur = type;
    while (cur instanceof Term.Pi) {
      Term.Pi pi = (Term.Pi)cur;
      Term.Local arg = pi.open();
      args.add(arg);
      cur = pi.bodyWith(arg);
    }
    return new Telescope(args, cur);
  }

  /** The quantified arguments, outermost first. */
  public final List<Term.Local> args;

  /** The statement remaining once every argument has been stripped. */
  public final Term conclusion;

  private Telescope (List<Term.Local> args, Term conclusion) {
    this.args = ImmutableList.copyOf(args);
    this.conclusion = conclusion;
  }
}
