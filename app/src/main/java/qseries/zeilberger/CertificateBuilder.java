package qseries.zeilberger;

import java.util.ArrayList;
import java.util.List;
import qseries.algebra.BigRational;
import qseries.algebra.Interpolation;
import qseries.algebra.Interpolation.Point;
import qseries.algebra.RationalFunction;
import qseries.algebra.RationalPolynomial;

/**
 * Rebuilds {@code R(x) = f(x)/c(x)} from antidifference values: {@code f} interpolates {@code
 * g_k c(q^k) / F(n,k)} at {@code x = q^k} while the base term is non-zero, plus {@code f(1) = 0}
 * from {@code g_0 = 0}.
 */
final class CertificateBuilder {

  private CertificateBuilder() {}

  static RationalFunction build(
      List<BigRational> antidifference,
      List<BigRational> baseTerms,
      BigRational q,
      RationalPolynomial c) {
    List<Point> points = new ArrayList<>();
    points.add(new Point(BigRational.ONE, BigRational.ZERO));
    BigRational x = BigRational.ONE;
    for (int k = 1; k <= antidifference.size(); k++) {
      x = x.multiply(q);
      BigRational term = baseTerms.get(k);
      if (term.isZero()) {
        break;
      }
      BigRational value = antidifference.get(k - 1).divide(term).multiply(c.evaluate(x));
      points.add(new Point(x, value));
    }
    return RationalFunction.of(Interpolation.lagrange(points), c);
  }
}
