//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.store;

import com.carrotsearch.hppc.IntObjectMap;
import com.carrotsearch.hppc.IntObjectOpenHashMap;
import com.carrotsearch.hppc.ObjectIntMap;
import com.carrotsearch.hppc.ObjectIntOpenHashMap;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import premise.extract.BatchWriter;
import premise.extract.CorpusWriter;
import premise.model.Decl;
import premise.model.ModuleData;

/**
 * A completely in-memory store. Declarations and modules are assigned increasing integer ids
 * (starting at 1, so that 0 denotes absence) in the order in which they are written.
 */
public class EphemeralStore extends DeclStore {

  /** A writer that can be used to write declarations to this store. Rewriting a module replaces
    * its previous contents. */
  public final CorpusWriter writer = new BatchWriter() {

    @Override protected void storeRoot (String module) {
      if (!_roots.contains(module)) _roots.add(module);
    }

    @Override protected void storeModule (ModuleData module) {
      int moduleId = _moduleIds.get(module.name);
      if (moduleId == 0) {
        moduleId = _moduleNames.size()+1;
        _moduleIds.put(module.name, moduleId);
        _moduleNames.add(module.name);
      } else {
        for (Decl old : _modules.get(moduleId).decls) removeDecl(old.name);
      }
      _modules.put(moduleId, module);
      for (Decl decl : module.decls) storeDecl(decl);
    }
  };

  public EphemeralStore (String name) {
    super(name);
  }

  @Override public CorpusWriter writer () {
    return writer;
  }

  @Override public Optional<Decl> decl (String name) {
    int declId = _declIds.get(name);
    return (declId == 0) ? Optional.empty() : Optional.of(_decls.get(declId));
  }

  @Override public Optional<ModuleData> module (String name) {
    int moduleId = _moduleIds.get(name);
    return (moduleId == 0) ? Optional.empty() : Optional.of(_modules.get(moduleId));
  }

  @Override public boolean hasModule (String name) {
    return _moduleIds.containsKey(name);
  }

  @Override public List<String> moduleNames () {
    return Collections.unmodifiableList(_moduleNames);
  }

  @Override public List<String> roots () {
    return Collections.unmodifiableList(_roots);
  }

  @Override public int declCount () {
    return _decls.size();
  }

  private void storeDecl (Decl decl) {
    int declId = _declIds.get(decl.name);
    if (declId == 0) {
      declId = ++_lastDeclId;
      _declIds.put(decl.name, declId);
    }
    _decls.put(declId, decl);
  }

  private void removeDecl (String name) {
    int declId = _declIds.remove(name);
    if (declId != 0) _decls.remove(declId);
  }

  private final ObjectIntMap<String> _declIds = new ObjectIntOpenHashMap<>();
  private final IntObjectMap<Decl> _decls = new IntObjectOpenHashMap<>();
  private final ObjectIntMap<String> _moduleIds = new ObjectIntOpenHashMap<>();
  private final IntObjectMap<ModuleData> _modules = new IntObjectOpenHashMap<>();
  private final List<String> _moduleNames = new ArrayList<>();
  private final List<String> _roots = new ArrayList<>();
  private int _lastDeclId;
}
