package qseries.pipeline;

import java.util.List;
import java.util.Optional;
import java.util.function.IntFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qseries.algebra.BigRational;
import qseries.algebra.RationalFunction;
import qseries.core.GosperResult;
import qseries.core.PetkovsekSolution;
import qseries.core.ProofResult;
import qseries.core.Recurrence;
import qseries.core.TelescopingOptions;
import qseries.core.ZeilbergerResult;
import qseries.gosper.QGosper;
import qseries.model.HypergeometricSeries;
import qseries.model.IndexDependence;
import qseries.nonterminating.NonterminatingProver;
import qseries.petkovsek.QPetkovsek;
import qseries.util.Timing;
import qseries.verify.WzVerifier;
import qseries.zeilberger.IndexDependenceDetector;
import qseries.zeilberger.QZeilberger;

/**
 * Entry points for the five telescoping workflows.
 *
 * <p>Expected negative outcomes (not summable, no recurrence, no roots, failed proof) come back as
 * values. Only precondition violations throw.
 */
public final class Pipeline {
  private static final Logger LOG = LoggerFactory.getLogger(Pipeline.class);

  private final TelescopingOptions options;

  public Pipeline() {
    this(TelescopingOptions.defaults());
  }

  public Pipeline(TelescopingOptions options) {
    this.options = TelescopingOptions.normalize(options);
  }

  public TelescopingOptions options() {
    return options;
  }

  /** Workflow 1: indefinite summation. */
  public GosperResult gosper(HypergeometricSeries series, BigRational q) {
    LOG.info("Running q-Gosper on {} at q={}", series, q);
    Timing timer = Timing.start();
    GosperResult result = QGosper.sum(series, q);
    LOG.info(
        "q-Gosper finished in {} ms: {}",
        timer.elapsedMillis(),
        result.isSummable() ? "summable" : "not summable");
    return result;
  }

  /** Workflow 2: recurrence discovery for the definite sum at index {@code n}. */
  public Optional<ZeilbergerResult> zeilberger(
      HypergeometricSeries series, int n, BigRational q, IndexDependenceDetector detector) {
    IndexDependence dependence = detector.detect(series, n, q);
    return zeilberger(series, q, dependence);
  }

  public Optional<ZeilbergerResult> zeilberger(
      HypergeometricSeries series, BigRational q, IndexDependence dependence) {
    LOG.info(
        "Running q-Zeilberger on {} at q={} (max order {})", series, q, options.maxOrder());
    Timing timer = Timing.start();
    Optional<ZeilbergerResult> result = new QZeilberger(options).find(series, q, dependence);
    if (result.isPresent()) {
      LOG.info(
          "Found recurrence of order {} in {} ms", result.get().order(), timer.elapsedMillis());
    } else {
      LOG.info(
          "No recurrence up to order {} ({} ms)", options.maxOrder(), timer.elapsedMillis());
    }
    return result;
  }

  /** Workflow 3: independent certificate check over {@code k = 0..maxK}. */
  public boolean verify(
      HypergeometricSeries series,
      BigRational q,
      Recurrence recurrence,
      RationalFunction certificate,
      IndexDependence dependence,
      int maxK) {
    LOG.info(
        "Verifying order-{} certificate for {} over k=0..{}", recurrence.order(), series, maxK);
    Timing timer = Timing.start();
    boolean valid = WzVerifier.verify(series, q, recurrence, certificate, dependence, maxK);
    LOG.info("Certificate {} in {} ms", valid ? "verified" : "rejected", timer.elapsedMillis());
    return valid;
  }

  /** Workflow 4: closed-form solutions of a constant-coefficient recurrence. */
  public List<PetkovsekSolution> petkovsek(List<BigRational> coefficients, BigRational q) {
    LOG.info("Running q-Petkovsek on {} at q={}", coefficients, q);
    Timing timer = Timing.start();
    List<PetkovsekSolution> solutions = new QPetkovsek(options).solve(coefficients, q);
    LOG.info("Found {} solution(s) in {} ms", solutions.size(), timer.elapsedMillis());
    return solutions;
  }

  /** Workflow 5: nonterminating identity proof. */
  public ProofResult prove(
      IntFunction<HypergeometricSeries> lhs,
      IntFunction<BigRational> rhs,
      BigRational q,
      int nTest,
      IndexDependenceDetector detector) {
    LOG.info("Proving identity at q={} from n={} (max order {})", q, nTest, options.maxOrder());
    Timing timer = Timing.start();
    ProofResult result = new NonterminatingProver(options, detector).prove(lhs, rhs, q, nTest);
    if (result.isProved()) {
      LOG.info(
          "Proved with recurrence of order {} in {} ms", result.order(), timer.elapsedMillis());
    } else {
      LOG.info("Proof failed in {} ms: {}", timer.elapsedMillis(), result.message());
    }
    return result;
  }
}
