package qseries.gosper;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import qseries.algebra.BigRational;
import qseries.algebra.RationalFunction;
import qseries.core.GosperResult;
import qseries.model.HypergeometricSeries;
import qseries.model.QMonomial;

final class QGosperTest {

  private static final BigRational Q = BigRational.of(1, 3);

  @Test
  void summableSeriesTelescopes() {
    HypergeometricSeries series =
        new HypergeometricSeries(
            List.of(QMonomial.qPower(3), QMonomial.qPower(1)),
            List.of(QMonomial.qPower(2)),
            QMonomial.qPower(1));
    GosperResult result = QGosper.sum(series, Q);
    assertTrue(result.isSummable(), "2phi1(q^3, q; q^2; q, q) has a rational certificate");

    RationalFunction y = result.certificate();
    List<BigRational> terms = TermRatios.termValues(TermRatios.of(series, Q), Q, 7);
    BigRational x = BigRational.ONE;
    for (int k = 0; k < 7; k++) {
      Optional<BigRational> yk = y.evaluate(x);
      Optional<BigRational> yNext = y.evaluate(x.multiply(Q));
      assertTrue(yk.isPresent() && yNext.isPresent(), "Certificate should be finite at q^" + k);
      BigRational difference =
          yNext.get().multiply(terms.get(k + 1)).subtract(yk.get().multiply(terms.get(k)));
      assertEquals(terms.get(k), difference, "S_{k+1} - S_k should equal t_k at k=" + k);
      x = x.multiply(Q);
    }
  }

  @Test
  void zeroPhiZeroIsNotSummable() {
    HypergeometricSeries series =
        new HypergeometricSeries(List.of(), List.of(), QMonomial.qPower(1));
    GosperResult result = QGosper.sum(series, Q);
    assertFalse(result.isSummable(), "0phi0(;;q,q) has no q-hypergeometric antidifference");
    assertNull(result.certificate());
  }
}
