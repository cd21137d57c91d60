package qseries.verify;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import qseries.algebra.BigRational;
import qseries.algebra.RationalFunction;
import qseries.algebra.RationalPolynomial;
import qseries.core.ZeilbergerResult;
import qseries.examples.Identities;
import qseries.examples.Identity;
import qseries.model.HypergeometricSeries;
import qseries.model.IndexDependence;
import qseries.testing.TestDefaults;
import qseries.zeilberger.QZeilberger;

final class WzVerifierTest {

  private static final BigRational Q = BigRational.of(1, 3);
  private static final int N = 5;

  private HypergeometricSeries series;
  private IndexDependence dependence;
  private ZeilbergerResult result;

  @BeforeEach
  void findRecurrence() {
    Identity vandermonde = Identities.qVandermonde();
    series = vandermonde.lhs().apply(N);
    dependence = vandermonde.detector().detect(series, N, Q);
    result = new QZeilberger().find(series, Q, dependence).orElseThrow();
  }

  @Test
  void acceptsEngineCertificate() {
    assertTrue(
        WzVerifier.verify(
            series, Q, result.recurrence(), result.certificate(), dependence, 10),
        "The engine's own certificate should verify over k = 0..10");
    assertTrue(
        WzVerifier.verify(
            series,
            Q,
            result.recurrence(),
            result.certificate(),
            dependence,
            TestDefaults.verifyWindow()),
        "The certificate should verify over the configured window");
  }

  @Test
  void rejectsDoubledCertificate() {
    RationalFunction doubled =
        RationalFunction.of(
            result.certificate().numerator().scale(BigRational.of(2)),
            result.certificate().denominator());
    assertFalse(
        WzVerifier.verify(series, Q, result.recurrence(), doubled, dependence, 10),
        "Doubling the certificate should break the telescoping identity");
  }

  @Test
  void rejectsNegativeWindow() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            WzVerifier.verify(
                series, Q, result.recurrence(), result.certificate(), dependence, -1));
  }

  @Test
  void skipsIndicesAtCertificatePoles() {
    // Agrees with the engine certificate at 1 and q; has a pole at q^2.
    BigRational q2 = Q.multiply(Q);
    RationalPolynomial vanishing =
        RationalPolynomial.linear(BigRational.MINUS_ONE, BigRational.ONE)
            .multiply(RationalPolynomial.linear(Q.negate(), BigRational.ONE));
    RationalFunction poleAtQ2 =
        result
            .certificate()
            .add(
                RationalFunction.of(
                    vanishing, RationalPolynomial.linear(q2.negate(), BigRational.ONE)));
    assertTrue(
        WzVerifier.verify(series, Q, result.recurrence(), poleAtQ2, dependence, 2),
        "k = 1 and k = 2 touch the pole at q^2 and are skipped");

    RationalFunction poleElsewhere =
        result
            .certificate()
            .add(
                RationalFunction.of(
                    vanishing, RationalPolynomial.linear(BigRational.of(-7), BigRational.ONE)));
    assertFalse(
        WzVerifier.verify(series, Q, result.recurrence(), poleElsewhere, dependence, 2),
        "Without a pole at q^2 the wrong value at q^2 is checked and caught");
  }
}
