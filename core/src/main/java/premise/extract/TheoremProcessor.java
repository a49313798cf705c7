//
// Premise - mines proof corpora for premise selection data
// See the LICENSE file in the project root for terms

package premise.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import premise.model.Decl;
import premise.model.Telescope;
import premise.model.Term;
import premise.store.TypeChecker;

/**
 * Turns a theorem into a {@link TheoremPremises} record: the features of its conclusion and of
 * its hypotheses, and the premises used by its proof.
 */
public class TheoremProcessor {

  public TheoremProcessor (TypeChecker checker, FeatureExtractor features,
                           PremiseCollector collector) {
    _checker = checker;
    _features = features;
    _collector = collector;
  }

  /**
   * Processes {@code decl}. Returns nothing if {@code decl} is not theorem-like, or if the
   * approximate depth of its proof lies outside [{@code minDepth}, {@code maxDepth}).
   *
   * <p>Hypotheses are the arguments of the statement whose type is itself a proposition; those
   * whose features contain no bigrams are dropped. Data parameters contribute no features of
   * their own.</p>
   *
   * @throws premise.store.UnknownConstantException if the statement or proof references a name
   * unknown to the corpus.
   * @throws premise.store.TypeCheckException if the type of an argument or premise cannot be
   * computed.
   */
  public Optional<TheoremPremises> process (Decl decl, int minDepth, int maxDepth) {
    Optional<Term> oproof = decl.proof();
    if (!oproof.isPresent()) return Optional.empty();
    Term proof = oproof.get();

    Telescope tele = Telescope.of(decl.type);
    StatementFeatures conclusion = _features.extract(tele.conclusion);
    List<StatementFeatures> hypotheses = new ArrayList<>();
    for (Term.Local arg : tele.args) {
      if (!_checker.isProp(arg.type)) continue;
      StatementFeatures hyp = _features.extract(arg.type);
      if (!hyp.bigramCounts.isEmpty()) hypotheses.add(hyp);
    }

    int depth = proof.approxDepth();
    if (depth < minDepth || depth >= maxDepth) return Optional.empty();
    return Optional.of(new TheoremPremises(decl.name, conclusion, hypotheses,
                                           _collector.collect(proof)));
  }

  private final TypeChecker _checker;
  private final FeatureExtractor _features;
  private final PremiseCollector _collector;
}
