//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise;

import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import premise.model.Decl;
import premise.model.ModuleData;
import premise.store.DeclStore;
import premise.store.UnknownConstantException;

/**
 * The main entry point for corpus data. A Corpus groups together a set of related {@link
 * DeclStore}s (generally the library being extracted and the libraries it depends on) and
 * resolves names across them.
 */
public class Corpus {

  /**
   * Creates a corpus with the supplied set of stores. The stores should be in order of
   * precedence: the first store having the highest precedence, the last having the lowest. Names
   * are resolved by querying each store in turn, and the first to claim knowledge of a name is
   * considered definitive.
   */
  public Corpus (Iterable<? extends DeclStore> stores) {
    _stores = Lists.newArrayList(stores);
  }

  /**
   * Returns all stores known to this corpus, from highest precedence to lowest.
   */
  public Iterable<DeclStore> stores () {
    return _stores;
  }

  /**
   * Returns the declaration named {@code name}, if any store knows it.
   */
  public Optional<Decl> decl (String name) {
    for (DeclStore store : _stores) {
      Optional<Decl> odecl = store.decl(name);
      if (odecl.isPresent()) return odecl;
    }
    return Optional.empty();
  }

  /**
   * Resolves the declaration named {@code name}.
   * @throws UnknownConstantException if no store knows {@code name}.
   */
  public Decl resolve (String name) {
    return decl(name).orElseThrow(() -> new UnknownConstantException(name));
  }

  /**
   * Returns the module named {@code name}, if any store knows it.
   */
  public Optional<ModuleData> module (String name) {
    for (DeclStore store : _stores) {
      Optional<ModuleData> omod = store.module(name);
      if (omod.isPresent()) return omod;
    }
    return Optional.empty();
  }

  /**
   * Returns the root modules of all stores, in precedence order, without duplicates.
   */
  public List<String> roots () {
    Set<String> roots = new LinkedHashSet<>();
    for (DeclStore store : _stores) roots.addAll(store.roots());
    return new ArrayList<>(roots);
  }

  /**
   * Returns the modules on which the roots of this corpus depend. If {@code recursive} is false,
   * these are the modules directly imported by the roots, in import order. Otherwise they are
   * all modules transitively imported by the roots, ordered so that every module follows the
   * modules it imports. Roots themselves are never included, and imports unknown to every store
   * are skipped.
   */
  public List<String> dependencies (boolean recursive) {
    List<String> roots = roots();
    Set<String> deps = new LinkedHashSet<>();
    if (!recursive) {
      for (String root : roots) deps.addAll(imports(root));
    } else {
      Set<String> seen = new HashSet<>(roots);
      for (String root : roots) {
        for (String imp : imports(root)) visitImports(imp, seen, deps);
      }
    }
    deps.removeAll(roots);
    List<String> known = new ArrayList<>();
    for (String dep : deps) if (isKnown(dep)) known.add(dep);
    return known;
  }

  private void visitImports (String module, Set<String> seen, Set<String> into) {
    if (!seen.add(module)) return;
    for (String imp : imports(module)) visitImports(imp, seen, into);
    into.add(module);
  }

  /**
   * Returns the imports of {@code module} according to the first store that contains it.
   */
  public List<String> imports (String module) {
    for (DeclStore store : _stores) {
      if (store.hasModule(module)) return store.imports(module);
    }
    return Collections.emptyList();
  }

  private boolean isKnown (String module) {
    for (DeclStore store : _stores) if (store.hasModule(module)) return true;
    return false;
  }

  private final List<DeclStore> _stores;
}
