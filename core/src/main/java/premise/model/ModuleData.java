//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.model;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A module of the corpus: its dotted name, the modules it imports and the declarations it
 * contains, both in source order.
 */
public final class ModuleData {

  /** The dotted name of this module, e.g. {@code Mathlib.Order.Basic}. */
  public final String name;

  /** The modules imported by this module. */
  public final List<String> imports;

  /** The declarations of this module. */
  public final List<Decl> decls;

  public ModuleData (String name, List<String> imports, List<Decl> decls) {
    this.name = name;
    this.imports = ImmutableList.copyOf(imports);
    this.decls = ImmutableList.copyOf(decls);
  }

  /** Returns the root namespace of this module, i.e. the library to which it belongs. */
  public String library () {
    return Names.root(name);
  }

  @Override public String toString () {
    return "ModuleData(" + name + ", " + imports.size() + " imports, " + decls.size() + " decls)";
  }
}
