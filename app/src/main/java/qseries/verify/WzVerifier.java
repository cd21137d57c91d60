package qseries.verify;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qseries.algebra.BigRational;
import qseries.algebra.RationalFunction;
import qseries.core.Recurrence;
import qseries.gosper.TermRatios;
import qseries.model.HypergeometricSeries;
import qseries.model.IndexDependence;

/**
 * Checks {@code sum_j c_j F(n+j,k) = G(n,k+1) - G(n,k)} with {@code G(n,k) = R(q^k) F(n,k)} for
 * {@code k = 0..maxK}, recomputing every term value from the series itself.
 *
 * <p>Indices the certificate cannot speak for are skipped rather than failed: {@code k} with
 * {@code F(n,k) = 0} (past the base series' termination, including the gap before the shifted
 * series terminate), poles of {@code R} at {@code q^k} or {@code q^{k+1}}, and {@code k} with
 * {@code F(n,k+1) = 0}.
 */
public final class WzVerifier {
  private static final Logger LOG = LoggerFactory.getLogger(WzVerifier.class);

  private WzVerifier() {}

  public static boolean verify(
      HypergeometricSeries series,
      BigRational q,
      Recurrence recurrence,
      RationalFunction certificate,
      IndexDependence dependence,
      int maxK) {
    Objects.requireNonNull(series, "series");
    Objects.requireNonNull(recurrence, "recurrence");
    Objects.requireNonNull(certificate, "certificate");
    Objects.requireNonNull(dependence, "dependence");
    if (maxK < 0) {
      throw new IllegalArgumentException("maxK must be non-negative: " + maxK);
    }
    int d = recurrence.order();
    List<List<BigRational>> terms = new ArrayList<>(d + 1);
    for (int j = 0; j <= d; j++) {
      terms.add(
          TermRatios.termValues(TermRatios.of(series.shifted(j, dependence), q), q, maxK + 1));
    }
    List<BigRational> base = terms.get(0);

    BigRational x = BigRational.ONE;
    for (int k = 0; k <= maxK; k++, x = x.multiply(q)) {
      if (base.get(k).isZero()) {
        continue;
      }
      BigRational lhs = BigRational.ZERO;
      for (int j = 0; j <= d; j++) {
        lhs = lhs.add(recurrence.coefficient(j).multiply(terms.get(j).get(k)));
      }
      Optional<BigRational> rAtK = certificate.evaluate(x);
      if (rAtK.isEmpty() || base.get(k + 1).isZero()) {
        continue;
      }
      Optional<BigRational> rAtNext = certificate.evaluate(x.multiply(q));
      if (rAtNext.isEmpty()) {
        continue;
      }
      BigRational rhs =
          rAtNext.get().multiply(base.get(k + 1)).subtract(rAtK.get().multiply(base.get(k)));
      if (!lhs.equals(rhs)) {
        LOG.debug("Telescoping identity fails at k={}: {} != {}", k, lhs, rhs);
        return false;
      }
    }
    return true;
  }
}
