package qseries.gosper;

import java.util.List;
import java.util.Objects;
import qseries.algebra.BigRational;
import qseries.algebra.RationalFunction;
import qseries.algebra.RationalPolynomial;

/**
 * Decomposition {@code r(x) = sigma(x)/tau(x) * c(qx)/c(x)} of a term ratio, with {@code
 * sigma(x)} and {@code tau(q^j x)} coprime for every {@code j >= 1}.
 */
public record GosperNormalForm(
    RationalPolynomial sigma, RationalPolynomial tau, RationalPolynomial c) {

  public GosperNormalForm {
    Objects.requireNonNull(sigma, "sigma");
    Objects.requireNonNull(tau, "tau");
    Objects.requireNonNull(c, "c");
  }

  public static GosperNormalForm of(RationalFunction ratio, BigRational q) {
    return of(ratio.numerator(), ratio.denominator(), q);
  }

  /** Strips the largest positive dispersion until none remains. */
  public static GosperNormalForm of(
      RationalPolynomial numerator, RationalPolynomial denominator, BigRational q) {
    TermRatios.requireNonZeroBase(q);
    RationalPolynomial sigma = numerator;
    RationalPolynomial tau = denominator;
    RationalPolynomial c = RationalPolynomial.one();
    while (true) {
      List<Integer> dispersion = QDispersion.positive(sigma, tau, q);
      if (dispersion.isEmpty()) {
        break;
      }
      int j = dispersion.get(dispersion.size() - 1);
      RationalPolynomial g = sigma.gcd(tau.qShift(q, j));
      if (g.isConstant()) {
        break;
      }
      sigma = sigma.exactDivide(g);
      tau = tau.exactDivide(g.qShift(q, -j));
      for (int i = 1; i <= j; i++) {
        c = c.multiply(g.qShift(q, -i));
      }
    }
    return new GosperNormalForm(sigma, tau, c);
  }

  /** {@code sigma(x) c(qx) / (tau(x) c(x))}, equal to the ratio this form was built from. */
  public RationalFunction reconstruct(BigRational q) {
    return RationalFunction.of(sigma.multiply(c.qShift(q)), tau.multiply(c));
  }
}
