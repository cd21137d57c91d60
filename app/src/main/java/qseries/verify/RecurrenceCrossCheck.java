package qseries.verify;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.IntFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qseries.algebra.BigRational;
import qseries.core.TelescopingOptions;
import qseries.core.ZeilbergerResult;
import qseries.model.HypergeometricSeries;
import qseries.zeilberger.IndexDependenceDetector;
import qseries.zeilberger.QZeilberger;

/**
 * Certificate-free check of a recurrence family: at each {@code n} the recurrence is derived
 * again and applied to directly summed values {@code S(n)..S(n+d)}.
 *
 * <p>Constant coefficients at a concrete {@code q} may differ between indices, which is why the
 * recurrence is re-derived instead of reused.
 */
public final class RecurrenceCrossCheck {
  private static final Logger LOG = LoggerFactory.getLogger(RecurrenceCrossCheck.class);

  private RecurrenceCrossCheck() {}

  /**
   * @param expectedOrder order found elsewhere; each index may use up to one more
   * @return true when every {@code n} in {@code [nStart, nStart + nCount)} passes
   */
  public static boolean check(
      IntFunction<HypergeometricSeries> builder,
      int expectedOrder,
      BigRational q,
      int nStart,
      int nCount,
      IndexDependenceDetector detector,
      TelescopingOptions options) {
    Objects.requireNonNull(builder, "builder");
    Objects.requireNonNull(detector, "detector");
    TelescopingOptions effective =
        TelescopingOptions.normalize(options).withMaxOrder(expectedOrder + 1);
    QZeilberger engine = new QZeilberger(effective);

    for (int i = 0; i < nCount; i++) {
      int n = nStart + i;
      Optional<ZeilbergerResult> found = engine.find(builder.apply(n), n, q, detector);
      if (found.isEmpty()) {
        LOG.debug("No recurrence re-derived at n={}", n);
        return false;
      }
      int d = found.get().order();
      List<BigRational> sums = new ArrayList<>(d + 1);
      for (int j = 0; j <= d; j++) {
        sums.add(DefiniteSums.sum(builder.apply(n + j), q, effective.maxSumTerms()));
      }
      if (!found.get().recurrence().apply(sums).isZero()) {
        LOG.debug("Recurrence does not annihilate direct sums at n={}", n);
        return false;
      }
    }
    return true;
  }
}
