package qseries.gosper;

import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qseries.algebra.BigRational;
import qseries.algebra.RationalFunction;
import qseries.algebra.RationalPolynomial;
import qseries.core.GosperResult;
import qseries.model.HypergeometricSeries;

/**
 * Indefinite q-hypergeometric summation.
 *
 * <p>With {@code r = sigma/tau * c(qx)/c(x)}, a polynomial {@code f} solving {@code sigma(x)
 * f(qx) - tau(x/q) f(x) = c(x)} gives the antidifference certificate {@code y(x) = tau(x/q) f(x) /
 * c(x)}: the partial sums satisfy {@code S_{k+1} - S_k = t_k} for {@code S_k = y(q^k) t_k}.
 */
public final class QGosper {
  private static final Logger LOG = LoggerFactory.getLogger(QGosper.class);

  private QGosper() {}

  public static GosperResult sum(HypergeometricSeries series, BigRational q) {
    Objects.requireNonNull(series, "series");
    RationalFunction ratio = TermRatios.of(series, q);
    GosperNormalForm form = GosperNormalForm.of(ratio, q);
    RationalPolynomial tauBack = form.tau().qShift(q, -1);
    Optional<RationalPolynomial> f = KeyEquationSolver.solve(form.sigma(), tauBack, form.c(), q);
    if (f.isEmpty()) {
      LOG.debug("No polynomial solution of the key equation for {}", series);
      return GosperResult.notSummable();
    }
    return GosperResult.summable(RationalFunction.of(tauBack.multiply(f.get()), form.c()));
  }
}
