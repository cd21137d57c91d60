package qseries.algebra;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Dense univariate polynomial with {@link BigRational} coefficients, stored in ascending order.
 *
 * <p>Trailing zero coefficients are trimmed on construction, so the zero polynomial has no
 * coefficients and degree {@code -1}.
 */
public final class RationalPolynomial {
  private static final RationalPolynomial ZERO = new RationalPolynomial(List.of());
  private static final RationalPolynomial ONE = new RationalPolynomial(List.of(BigRational.ONE));

  private final List<BigRational> coefficients;

  private RationalPolynomial(List<BigRational> trimmed) {
    this.coefficients = trimmed;
  }

  public static RationalPolynomial of(List<BigRational> coefficients) {
    Objects.requireNonNull(coefficients, "coefficients");
    int end = coefficients.size();
    while (end > 0 && coefficients.get(end - 1).isZero()) {
      end--;
    }
    if (end == 0) {
      return ZERO;
    }
    return new RationalPolynomial(List.copyOf(coefficients.subList(0, end)));
  }

  public static RationalPolynomial of(BigRational... coefficients) {
    return of(Arrays.asList(coefficients));
  }

  public static RationalPolynomial ofLongs(long... coefficients) {
    List<BigRational> values = new ArrayList<>(coefficients.length);
    for (long c : coefficients) {
      values.add(BigRational.of(c));
    }
    return of(values);
  }

  public static RationalPolynomial zero() {
    return ZERO;
  }

  public static RationalPolynomial one() {
    return ONE;
  }

  public static RationalPolynomial constant(BigRational c) {
    return of(List.of(c));
  }

  /** {@code c * x^degree}. */
  public static RationalPolynomial monomial(BigRational c, int degree) {
    if (degree < 0) {
      throw new IllegalArgumentException("degree must be non-negative: " + degree);
    }
    List<BigRational> values = new ArrayList<>(Collections.nCopies(degree + 1, BigRational.ZERO));
    values.set(degree, c);
    return of(values);
  }

  /** {@code constantTerm + slope * x}. */
  public static RationalPolynomial linear(BigRational constantTerm, BigRational slope) {
    return of(constantTerm, slope);
  }

  public List<BigRational> coefficients() {
    return coefficients;
  }

  public int degree() {
    return coefficients.size() - 1;
  }

  public BigRational coefficient(int index) {
    if (index < 0 || index >= coefficients.size()) {
      return BigRational.ZERO;
    }
    return coefficients.get(index);
  }

  public BigRational leadingCoefficient() {
    return isZero() ? BigRational.ZERO : coefficients.get(coefficients.size() - 1);
  }

  public boolean isZero() {
    return coefficients.isEmpty();
  }

  public boolean isConstant() {
    return coefficients.size() <= 1;
  }

  public boolean isOne() {
    return coefficients.size() == 1 && coefficients.get(0).isOne();
  }

  public RationalPolynomial add(RationalPolynomial other) {
    int size = Math.max(coefficients.size(), other.coefficients.size());
    List<BigRational> values = new ArrayList<>(size);
    for (int i = 0; i < size; i++) {
      values.add(coefficient(i).add(other.coefficient(i)));
    }
    return of(values);
  }

  public RationalPolynomial subtract(RationalPolynomial other) {
    return add(other.negate());
  }

  public RationalPolynomial negate() {
    return scale(BigRational.MINUS_ONE);
  }

  public RationalPolynomial multiply(RationalPolynomial other) {
    if (isZero() || other.isZero()) {
      return ZERO;
    }
    int size = coefficients.size() + other.coefficients.size() - 1;
    List<BigRational> values = new ArrayList<>(Collections.nCopies(size, BigRational.ZERO));
    for (int i = 0; i < coefficients.size(); i++) {
      BigRational a = coefficients.get(i);
      if (a.isZero()) {
        continue;
      }
      for (int j = 0; j < other.coefficients.size(); j++) {
        values.set(i + j, values.get(i + j).add(a.multiply(other.coefficients.get(j))));
      }
    }
    return of(values);
  }

  public RationalPolynomial scale(BigRational factor) {
    if (factor.isZero() || isZero()) {
      return ZERO;
    }
    List<BigRational> values = new ArrayList<>(coefficients.size());
    for (BigRational c : coefficients) {
      values.add(c.multiply(factor));
    }
    return of(values);
  }

  public RationalPolynomial divide(BigRational divisor) {
    if (divisor.isZero()) {
      throw new ArithmeticException("Polynomial division by zero scalar");
    }
    return scale(divisor.reciprocal());
  }

  /** Polynomial long division; the remainder has degree below the divisor's. */
  public Division divideAndRemainder(RationalPolynomial divisor) {
    if (divisor.isZero()) {
      throw new ArithmeticException("Polynomial division by zero");
    }
    if (degree() < divisor.degree()) {
      return new Division(ZERO, this);
    }
    BigRational lead = divisor.leadingCoefficient();
    List<BigRational> remainder = new ArrayList<>(coefficients);
    List<BigRational> quotient =
        new ArrayList<>(Collections.nCopies(degree() - divisor.degree() + 1, BigRational.ZERO));
    for (int i = degree(); i >= divisor.degree(); i--) {
      BigRational top = remainder.get(i);
      if (top.isZero()) {
        continue;
      }
      BigRational factor = top.divide(lead);
      int shift = i - divisor.degree();
      quotient.set(shift, factor);
      for (int j = 0; j <= divisor.degree(); j++) {
        BigRational sub = factor.multiply(divisor.coefficient(j));
        remainder.set(shift + j, remainder.get(shift + j).subtract(sub));
      }
    }
    return new Division(of(quotient), of(remainder));
  }

  /**
   * Division that is expected to leave no remainder.
   *
   * @throws IllegalArgumentException if {@code divisor} does not divide this polynomial
   */
  public RationalPolynomial exactDivide(RationalPolynomial divisor) {
    Division division = divideAndRemainder(divisor);
    if (!division.remainder().isZero()) {
      throw new IllegalArgumentException(divisor + " does not divide " + this);
    }
    return division.quotient();
  }

  /** Horner evaluation. */
  public BigRational evaluate(BigRational x) {
    BigRational result = BigRational.ZERO;
    for (int i = coefficients.size() - 1; i >= 0; i--) {
      result = result.multiply(x).add(coefficients.get(i));
    }
    return result;
  }

  public RationalPolynomial monic() {
    if (isZero()) {
      return ZERO;
    }
    BigRational lead = leadingCoefficient();
    return lead.isOne() ? this : divide(lead);
  }

  /** {@code p(q * x)}: coefficient {@code i} is scaled by {@code q^i}. */
  public RationalPolynomial qShift(BigRational q) {
    if (isZero() || q.isOne()) {
      return this;
    }
    List<BigRational> values = new ArrayList<>(coefficients.size());
    BigRational power = BigRational.ONE;
    for (BigRational c : coefficients) {
      values.add(c.multiply(power));
      power = power.multiply(q);
    }
    return of(values);
  }

  /** {@code p(q^j * x)} for any integer {@code j}. */
  public RationalPolynomial qShift(BigRational q, int j) {
    if (j == 0 || isZero()) {
      return this;
    }
    return qShift(q.pow(j));
  }

  /** Monic greatest common divisor; {@code gcd(0, 0)} is zero. */
  public RationalPolynomial gcd(RationalPolynomial other) {
    if (isZero()) {
      return other.monic();
    }
    if (other.isZero()) {
      return monic();
    }
    RationalPolynomial a = degree() >= other.degree() ? this : other;
    RationalPolynomial b = a == this ? other : this;
    a = a.monic();
    b = b.monic();
    while (!b.isZero()) {
      RationalPolynomial r = a.divideAndRemainder(b).remainder().monic();
      a = b;
      b = r;
    }
    return a.monic();
  }

  /**
   * Resultant of two polynomials via the Euclidean remainder sequence.
   *
   * <p>Vanishes exactly when the two polynomials share a root (or either is zero).
   */
  public BigRational resultant(RationalPolynomial other) {
    if (isZero() || other.isZero()) {
      return BigRational.ZERO;
    }
    int m = degree();
    int n = other.degree();
    if (m == 0) {
      return leadingCoefficient().pow(n);
    }
    if (n == 0) {
      return other.leadingCoefficient().pow(m);
    }
    if (m < n) {
      BigRational swapped = other.resultant(this);
      return ((long) m * n) % 2 == 0 ? swapped : swapped.negate();
    }
    RationalPolynomial remainder = divideAndRemainder(other).remainder();
    if (remainder.isZero()) {
      return BigRational.ZERO;
    }
    int r = remainder.degree();
    // res(a, b) = (-1)^{mn} * lc(b)^{m - r} * res(b, a mod b)
    BigRational factor = other.leadingCoefficient().pow(m - r);
    if (((long) m * n) % 2 != 0) {
      factor = factor.negate();
    }
    return factor.multiply(other.resultant(remainder));
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof RationalPolynomial other)) {
      return false;
    }
    return coefficients.equals(other.coefficients);
  }

  @Override
  public int hashCode() {
    return coefficients.hashCode();
  }

  @Override
  public String toString() {
    if (isZero()) {
      return "0";
    }
    StringBuilder builder = new StringBuilder();
    for (int i = coefficients.size() - 1; i >= 0; i--) {
      BigRational c = coefficients.get(i);
      if (c.isZero()) {
        continue;
      }
      if (builder.length() > 0) {
        builder.append(c.signum() < 0 ? " - " : " + ");
      } else if (c.signum() < 0) {
        builder.append('-');
      }
      BigRational magnitude = c.abs();
      boolean showCoefficient = i == 0 || !magnitude.isOne();
      if (showCoefficient) {
        builder.append(magnitude);
      }
      if (i > 0) {
        if (showCoefficient) {
          builder.append('*');
        }
        builder.append('x');
        if (i > 1) {
          builder.append('^').append(i);
        }
      }
    }
    return builder.toString();
  }

  /** Quotient and remainder of a polynomial division. */
  public record Division(RationalPolynomial quotient, RationalPolynomial remainder) {
    public Division {
      Objects.requireNonNull(quotient, "quotient");
      Objects.requireNonNull(remainder, "remainder");
    }
  }
}
