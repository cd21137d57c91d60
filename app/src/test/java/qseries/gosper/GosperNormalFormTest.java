package qseries.gosper;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import qseries.algebra.BigRational;
import qseries.algebra.RationalFunction;
import qseries.algebra.RationalPolynomial;
import qseries.examples.Identities;
import qseries.model.HypergeometricSeries;

final class GosperNormalFormTest {

  private static final BigRational Q = BigRational.of(1, 3);

  @Test
  void reconstructsTheRatio() {
    HypergeometricSeries series = Identities.qVandermonde().lhs().apply(5);
    RationalFunction ratio = TermRatios.of(series, Q);
    GosperNormalForm form = GosperNormalForm.of(ratio, Q);
    assertEquals(ratio, form.reconstruct(Q), "sigma c(qx) / (tau c(x)) should equal the ratio");
    assertTrue(
        QDispersion.positive(form.sigma(), form.tau(), Q).isEmpty(),
        "sigma and tau(q^j x) should be coprime for j >= 1");
  }

  @Test
  void stripsSharedShiftIntoC() {
    // sigma = 1 - q^3 x, tau = 1 - q^2 x share the shift j = 1
    RationalFunction ratio =
        RationalFunction.of(
            RationalPolynomial.linear(BigRational.ONE, Q.pow(3).negate()),
            RationalPolynomial.linear(BigRational.ONE, Q.pow(2).negate()));
    GosperNormalForm form = GosperNormalForm.of(ratio, Q);
    assertEquals(0, form.sigma().degree(), "sigma should be constant after stripping");
    assertEquals(0, form.tau().degree(), "tau should be constant after stripping");
    assertEquals(1, form.c().degree(), "c should carry the shared factor");
    assertEquals(ratio, form.reconstruct(Q));
  }
}
