//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.store;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import premise.extract.CorpusWriter;
import premise.model.Decl;
import premise.model.ModuleData;

/**
 * Contains the modules and declarations of a single library (or of a whole corpus).
 */
public abstract class DeclStore implements AutoCloseable {

  /**
   * The user friendly name of this store.
   */
  public final String name;

  /**
   * Returns a writer that can be used to populate this store.
   */
  public abstract CorpusWriter writer ();

  /**
   * Returns the declaration named {@code name}, if it is part of this store.
   */
  public abstract Optional<Decl> decl (String name);

  /**
   * Returns the module named {@code name}, with its declarations in source order, if it is part
   * of this store.
   */
  public abstract Optional<ModuleData> module (String name);

  /**
   * Returns the names of all modules in this store, in the order in which they were written.
   */
  public abstract List<String> moduleNames ();

  /**
   * Returns true if this store contains a module named {@code name}.
   */
  public boolean hasModule (String name) {
    return moduleNames().contains(name);
  }

  /**
   * Returns the modules imported by {@code module}, empty if this store does not contain it.
   */
  public List<String> imports (String module) {
    return module(module).map(mod -> mod.imports).orElse(Collections.emptyList());
  }

  /**
   * Returns the root modules of this store: those whose imports make up the corpus being
   * extracted. Empty if this store only supplies dependencies.
   */
  public abstract List<String> roots ();

  /**
   * Returns the number of declarations in this store.
   */
  public abstract int declCount ();

  @Override public void close () {
    // nada by default
  }

  @Override public String toString () {
    return getClass().getSimpleName() + "(" + name + ")";
  }

  protected DeclStore (String name) {
    this.name = name;
  }
}
