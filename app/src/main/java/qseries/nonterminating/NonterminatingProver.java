package qseries.nonterminating;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.IntFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qseries.algebra.BigRational;
import qseries.core.ProofFailureReason;
import qseries.core.ProofResult;
import qseries.core.TelescopingOptions;
import qseries.core.ZeilbergerResult;
import qseries.model.HypergeometricSeries;
import qseries.verify.DefiniteSums;
import qseries.zeilberger.IndexDependenceDetector;
import qseries.zeilberger.QZeilberger;

/**
 * Proves a nonterminating identity by specialising a parameter to {@code q^{-n}} (Chen, Hou and
 * Mu).
 *
 * <p>The left side, terminating for each {@code n}, yields a recurrence at the test index. The
 * right side must satisfy the recurrence re-derived at up to three nearby indices, and both sides
 * must agree on {@code n = 0..d}.
 */
public final class NonterminatingProver {
  private static final Logger LOG = LoggerFactory.getLogger(NonterminatingProver.class);

  private final TelescopingOptions options;
  private final IndexDependenceDetector detector;
  private final QZeilberger engine;

  public NonterminatingProver(TelescopingOptions options, IndexDependenceDetector detector) {
    this.options = TelescopingOptions.normalize(options);
    this.detector = Objects.requireNonNull(detector, "detector");
    this.engine = new QZeilberger(this.options);
  }

  public NonterminatingProver() {
    this(TelescopingOptions.defaults(), IndexDependenceDetector.heuristic());
  }

  public ProofResult prove(
      IntFunction<HypergeometricSeries> lhs,
      IntFunction<BigRational> rhs,
      BigRational q,
      int nTest) {
    Objects.requireNonNull(lhs, "lhs");
    Objects.requireNonNull(rhs, "rhs");
    Objects.requireNonNull(q, "q");

    HypergeometricSeries atTest = lhs.apply(nTest);
    if (!atTest.isTerminating()) {
      return ProofResult.failed(
          ProofFailureReason.LHS_NOT_TERMINATING, "LHS at n=" + nTest + " is not terminating");
    }

    Optional<ZeilbergerResult> found = engine.find(atTest, nTest, q, detector);
    if (found.isEmpty()) {
      return ProofResult.failed(
          ProofFailureReason.NO_RECURRENCE,
          "No recurrence for LHS up to order " + options.maxOrder());
    }
    ZeilbergerResult recurrence = found.get();
    int d = recurrence.order();
    LOG.debug("LHS recurrence of order {} at n={}", d, nTest);

    List<Integer> checkpoints =
        nTest >= 2 ? List.of(nTest - 2, nTest - 1, nTest) : List.of(nTest);
    for (int n : checkpoints) {
      HypergeometricSeries series = lhs.apply(n);
      if (!series.isTerminating()) {
        continue;
      }
      Optional<ZeilbergerResult> local = engine.find(series, n, q, detector);
      if (local.isEmpty()) {
        LOG.debug("No recurrence re-derived at n={}; checkpoint skipped", n);
        continue;
      }
      int localOrder = local.get().order();
      List<BigRational> values = new ArrayList<>(localOrder + 1);
      for (int j = 0; j <= localOrder; j++) {
        values.add(rhs.apply(n + j));
      }
      if (!local.get().recurrence().apply(values).isZero()) {
        return ProofResult.failed(
            ProofFailureReason.RECURRENCE_MISMATCH,
            "RHS does not satisfy LHS recurrence at n=" + n);
      }
    }

    for (int n = 0; n <= d; n++) {
      BigRational left = DefiniteSums.sum(lhs.apply(n), q, options.maxSumTerms());
      BigRational right = rhs.apply(n);
      if (!left.equals(right)) {
        LOG.debug("Initial condition n={}: LHS {} but RHS {}", n, left, right);
        return ProofResult.failed(
            ProofFailureReason.INITIAL_CONDITION_MISMATCH, "Initial condition mismatch at n=" + n);
      }
    }
    return ProofResult.proved(recurrence.recurrence(), d + 1);
  }
}
