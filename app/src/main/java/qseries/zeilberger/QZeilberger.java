package qseries.zeilberger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qseries.algebra.BigRational;
import qseries.algebra.LinearSystems;
import qseries.algebra.RationalFunction;
import qseries.core.Recurrence;
import qseries.core.TelescopingOptions;
import qseries.core.ZeilbergerResult;
import qseries.gosper.GosperNormalForm;
import qseries.gosper.TermRatios;
import qseries.model.HypergeometricSeries;
import qseries.model.IndexDependence;

/**
 * q-Zeilberger creative telescoping over concrete term values.
 *
 * <p>For {@code d = 1..maxOrder} the engine looks for constants {@code c_0..c_{d-1}} (with {@code
 * c_d = 1}) and antidifference values {@code g_1..g_K} satisfying {@code g_{k+1} - g_k = sum_j c_j
 * F(n+j,k)} for {@code k = 0..K}, where {@code g_0 = g_{K+1} = 0} and {@code K} is the last index
 * with a non-zero term. The first order with a consistent, non-trivial solution wins.
 */
public final class QZeilberger {
  private static final Logger LOG = LoggerFactory.getLogger(QZeilberger.class);
  private static final int RECHECKED_EQUATIONS = 11;

  private final TelescopingOptions options;

  public QZeilberger() {
    this(TelescopingOptions.defaults());
  }

  public QZeilberger(TelescopingOptions options) {
    this.options = TelescopingOptions.normalize(options);
  }

  public TelescopingOptions options() {
    return options;
  }

  /** Detects which parameters move with {@code n}, then searches as below. */
  public Optional<ZeilbergerResult> find(
      HypergeometricSeries series, int n, BigRational q, IndexDependenceDetector detector) {
    Objects.requireNonNull(detector, "detector");
    return find(series, q, detector.detect(series, n, q));
  }

  /**
   * Searches for a recurrence of order at most {@code maxOrder}.
   *
   * @return the recurrence and its certificate, or empty when no order up to the cap works
   * @throws IllegalArgumentException if the series does not terminate
   */
  public Optional<ZeilbergerResult> find(
      HypergeometricSeries series, BigRational q, IndexDependence dependence) {
    Objects.requireNonNull(series, "series");
    Objects.requireNonNull(dependence, "dependence");
    if (!series.isTerminating()) {
      throw new IllegalArgumentException("Series is not index-terminating: " + series);
    }
    RationalFunction baseRatio = TermRatios.of(series, q);
    GosperNormalForm form = GosperNormalForm.of(baseRatio, q);

    for (int d = 1; d <= options.maxOrder(); d++) {
      Optional<OrderSolution> solution = solveAtOrder(series, q, d, dependence);
      if (solution.isPresent()) {
        OrderSolution found = solution.get();
        RationalFunction certificate =
            CertificateBuilder.build(found.antidifference(), found.baseTerms(), q, form.c());
        LOG.debug("Recurrence of order {} found: {}", d, found.coefficients());
        return Optional.of(
            new ZeilbergerResult(new Recurrence(found.coefficients()), certificate));
      }
      LOG.debug("No recurrence of order {}", d);
    }
    return Optional.empty();
  }

  private Optional<OrderSolution> solveAtOrder(
      HypergeometricSeries series, BigRational q, int d, IndexDependence dependence) {
    int cap = options.maxSearchIndex();
    List<List<BigRational>> terms = new ArrayList<>(d + 1);
    for (int j = 0; j <= d; j++) {
      terms.add(TermRatios.termValues(TermRatios.of(series.shifted(j, dependence), q), q, cap));
    }

    int maxK = 0;
    for (int k = 0; k <= cap; k++) {
      for (List<BigRational> values : terms) {
        if (!values.get(k).isZero()) {
          maxK = k;
        }
      }
    }
    if (maxK == 0) {
      return Optional.empty();
    }
    if (maxK == cap) {
      LOG.warn("Terms still non-zero at search index {}; assuming the sum ends there", cap);
    }

    // unknowns: g_1..g_maxK then c_0..c_{d-1}
    int columns = maxK + d;
    List<List<BigRational>> matrix = new ArrayList<>(maxK + 1);
    List<BigRational> rhs = new ArrayList<>(maxK + 1);
    for (int k = 0; k <= maxK; k++) {
      List<BigRational> row = new ArrayList<>(Collections.nCopies(columns, BigRational.ZERO));
      if (k + 1 <= maxK) {
        row.set(k, BigRational.ONE);
      }
      if (k >= 1) {
        row.set(k - 1, row.get(k - 1).subtract(BigRational.ONE));
      }
      for (int j = 0; j < d; j++) {
        row.set(maxK + j, terms.get(j).get(k).negate());
      }
      matrix.add(row);
      rhs.add(terms.get(d).get(k));
    }

    Optional<List<BigRational>> solved = LinearSystems.solve(matrix, rhs, columns);
    if (solved.isEmpty()) {
      return Optional.empty();
    }
    List<BigRational> solution = solved.get();
    List<BigRational> antidifference = solution.subList(0, maxK);
    List<BigRational> coefficients = new ArrayList<>(solution.subList(maxK, columns));
    if (coefficients.stream().allMatch(BigRational::isZero)) {
      LOG.debug("Order {} only admits the trivial recurrence S(n+{}) = 0", d, d);
      return Optional.empty();
    }
    coefficients.add(BigRational.ONE);

    int recheck = Math.min(maxK + 1, RECHECKED_EQUATIONS);
    for (int k = 0; k < recheck; k++) {
      BigRational gk = k == 0 ? BigRational.ZERO : antidifference.get(k - 1);
      BigRational gNext = k + 1 <= maxK ? antidifference.get(k) : BigRational.ZERO;
      BigRational sum = BigRational.ZERO;
      for (int j = 0; j <= d; j++) {
        sum = sum.add(coefficients.get(j).multiply(terms.get(j).get(k)));
      }
      if (!gNext.subtract(gk).equals(sum)) {
        LOG.warn("Order {} solution fails telescoping re-check at k={}", d, k);
        return Optional.empty();
      }
    }
    return Optional.of(new OrderSolution(coefficients, antidifference, terms.get(0)));
  }

  private record OrderSolution(
      List<BigRational> coefficients,
      List<BigRational> antidifference,
      List<BigRational> baseTerms) {
    OrderSolution {
      coefficients = List.copyOf(coefficients);
      antidifference = List.copyOf(antidifference);
      baseTerms = List.copyOf(baseTerms);
    }
  }
}
