//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.model;

import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for dotted hierarchical names.
 */
public class Names {

  /** Returns the first component of {@code name}. */
  public static String root (String name) {
    int didx = name.indexOf('.');
    return (didx == -1) ? name : name.substring(0, didx);
  }

  /** Returns {@code name} and each of its dotted suffixes, longest first. {@code A.b.c} yields
    * {@code A.b.c}, {@code b.c} and {@code c}. */
  public static List<String> suffixes (String name) {
    List<String> suffixes = new ArrayList<>();
    suffixes.add(name);
    for (int ii = name.indexOf('.'); ii != -1 && ii < name.length()-1;
         ii = name.indexOf('.', ii+1)) {
      suffixes.add(name.substring(ii+1));
    }
    return suffixes;
  }

  /** Returns the dotted components of {@code name}. */
  public static List<String> components (String name) {
    return DOT.splitToList(name);
  }

  private static final Splitter DOT = Splitter.on('.');

  private Names () {} // no instances
}
