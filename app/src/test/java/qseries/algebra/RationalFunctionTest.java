package qseries.algebra;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

final class RationalFunctionTest {

  @Test
  void normalisesToLowestTermsWithMonicDenominator() {
    RationalFunction f =
        RationalFunction.of(
            RationalPolynomial.ofLongs(-1, 0, 1), RationalPolynomial.ofLongs(-2, 2));
    assertEquals(RationalPolynomial.of(BigRational.of(1, 2), BigRational.of(1, 2)), f.numerator());
    assertTrue(f.isPolynomial(), "(x^2 - 1) / (2x - 2) should reduce to a polynomial");
    assertEquals(
        RationalFunction.of(RationalPolynomial.ofLongs(1, 1), RationalPolynomial.ofLongs(2)),
        f,
        "Equal functions should compare equal structurally");
  }

  @Test
  void rejectsZeroDenominator() {
    assertThrows(
        IllegalArgumentException.class,
        () -> RationalFunction.of(RationalPolynomial.one(), RationalPolynomial.zero()));
  }

  @Test
  void arithmeticRoundTrips() {
    RationalFunction a =
        RationalFunction.of(RationalPolynomial.ofLongs(1, 2), RationalPolynomial.ofLongs(3, 1));
    RationalFunction b =
        RationalFunction.of(RationalPolynomial.ofLongs(0, 1), RationalPolynomial.ofLongs(1, -1));
    assertEquals(a, a.add(b).subtract(b), "(a + b) - b");
    assertEquals(a, a.multiply(b).divide(b), "(a * b) / b");
    assertTrue(a.subtract(a).isZero(), "a - a");
  }

  @Test
  void evaluationReportsPoles() {
    RationalFunction f =
        RationalFunction.of(RationalPolynomial.one(), RationalPolynomial.ofLongs(-1, 3));
    assertEquals(Optional.empty(), f.evaluate(BigRational.of(1, 3)), "x = 1/3 is a pole");
    assertEquals(Optional.of(BigRational.of(1, 2)), f.evaluate(BigRational.ONE));
  }
}
