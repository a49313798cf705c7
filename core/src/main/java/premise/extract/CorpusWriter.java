//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.extract;

import premise.model.Decl;

/**
 * Provides an API via which a corpus reader (or an exporter running inside a proof assistant)
 * emits the modules and declarations of a corpus. Calls should occur in the following order:
 *
 * <pre>{@code
 * [openSession
 *   emitRoot*
 *   [openModule
 *     emitImport*
 *     emitDecl*
 *   closeModule]*
 * closeSession]
 * }</pre>
 *
 * A * indicates that a method can be called zero or more times. Roots may also be emitted
 * between modules.
 */
public abstract class CorpusWriter {

  public abstract void openSession ();

  /** Notes that {@code module} is a root of the corpus: its imports are the corpus's direct
    * dependencies. */
  public abstract void emitRoot (String module);

  public abstract void openModule (String name);
  public abstract void emitImport (String module);
  public abstract void emitDecl (Decl decl);
  public abstract void closeModule ();

  public abstract void closeSession ();
}
