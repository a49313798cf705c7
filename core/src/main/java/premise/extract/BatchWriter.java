//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.extract;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import premise.model.Decl;
import premise.model.ModuleData;

/**
 * A writer that batches up the imports and declarations of a single module and stores them all
 * at once when the module is closed.
 */
public abstract class BatchWriter extends CorpusWriter {

  @Override public void openSession () {
    // nada
  }

  @Override public void emitRoot (String module) {
    storeRoot(module);
  }

  @Override public void openModule (String name) {
    Preconditions.checkState(_curModule == null, "Module %s is still open.", _curModule);
    _curModule = name;
  }

  @Override public void emitImport (String module) {
    checkOpen();
    _imports.add(module);
  }

  @Override public void emitDecl (Decl decl) {
    checkOpen();
    _decls.add(decl);
  }

  @Override public void closeModule () {
    checkOpen();
    storeModule(new ModuleData(_curModule, _imports, _decls));
    _curModule = null;
    _imports.clear();
    _decls.clear();
  }

  @Override public void closeSession () {
    Preconditions.checkState(_curModule == null, "Module %s was never closed.", _curModule);
  }

  protected abstract void storeRoot (String module);
  protected abstract void storeModule (ModuleData module);

  private void checkOpen () {
    if (_curModule == null) throw new IllegalStateException("No module is open.");
  }

  protected String _curModule;
  protected final List<String> _imports = new ArrayList<>();
  protected final List<Decl> _decls = new ArrayList<>();
}
