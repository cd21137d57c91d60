package qseries.gosper;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import qseries.algebra.BigRational;
import qseries.algebra.RationalFunction;
import qseries.algebra.RationalPolynomial;
import qseries.model.HypergeometricSeries;
import qseries.model.QMonomial;

/** Term ratio {@code t_{k+1}/t_k} of a basic hypergeometric series, in {@code x = q^k}. */
public final class TermRatios {

  private TermRatios() {}

  /**
   * {@code prod (1 - a_i x) / ((1 - q x) prod (1 - b_j x)) * (-1)^e x^e z} with {@code e = 1+s-r},
   * all parameters evaluated at {@code q}.
   *
   * @throws IllegalArgumentException if {@code q} is zero
   */
  public static RationalFunction of(HypergeometricSeries series, BigRational q) {
    Objects.requireNonNull(series, "series");
    requireNonZeroBase(q);

    RationalPolynomial numerator = RationalPolynomial.one();
    for (QMonomial a : series.upper()) {
      numerator = numerator.multiply(oneMinus(a.evaluate(q)));
    }
    RationalPolynomial denominator = oneMinus(q);
    for (QMonomial b : series.lower()) {
      denominator = denominator.multiply(oneMinus(b.evaluate(q)));
    }

    int e = series.extraFactorExponent();
    BigRational extra = series.argument().evaluate(q);
    if (e % 2 != 0) {
      extra = extra.negate();
    }
    if (e >= 0) {
      numerator = numerator.multiply(RationalPolynomial.monomial(extra, e));
    } else {
      denominator = denominator.multiply(RationalPolynomial.monomial(BigRational.ONE, -e));
      numerator = numerator.scale(extra);
    }
    return RationalFunction.of(numerator, denominator);
  }

  /**
   * Term values {@code t_0..t_count} from {@code t_0 = 1} and {@code t_{k+1} = t_k r(q^k)}.
   *
   * <p>A pole of the ratio zeroes the term, and every term after a zero stays zero.
   */
  public static List<BigRational> termValues(RationalFunction ratio, BigRational q, int count) {
    requireNonZeroBase(q);
    List<BigRational> values = new ArrayList<>(count + 1);
    BigRational term = BigRational.ONE;
    values.add(term);
    BigRational x = BigRational.ONE;
    for (int k = 0; k < count; k++) {
      if (!term.isZero()) {
        Optional<BigRational> r = ratio.evaluate(x);
        term = r.isPresent() ? term.multiply(r.get()) : BigRational.ZERO;
      }
      values.add(term);
      x = x.multiply(q);
    }
    return List.copyOf(values);
  }

  static void requireNonZeroBase(BigRational q) {
    Objects.requireNonNull(q, "q");
    if (q.isZero()) {
      throw new IllegalArgumentException("Base value q must be non-zero");
    }
  }

  private static RationalPolynomial oneMinus(BigRational a) {
    return RationalPolynomial.linear(BigRational.ONE, a.negate());
  }
}
