package qseries.algebra;

import java.util.Objects;
import java.util.Optional;

/**
 * Quotient of two {@link RationalPolynomial}s in lowest terms.
 *
 * <p>The denominator is always monic and the zero function is {@code 0/1}, so two equal functions
 * have equal numerator and denominator.
 */
public final class RationalFunction {
  private final RationalPolynomial numerator;
  private final RationalPolynomial denominator;

  private RationalFunction(RationalPolynomial numerator, RationalPolynomial denominator) {
    this.numerator = numerator;
    this.denominator = denominator;
  }

  public static RationalFunction of(RationalPolynomial numerator, RationalPolynomial denominator) {
    Objects.requireNonNull(numerator, "numerator");
    Objects.requireNonNull(denominator, "denominator");
    if (denominator.isZero()) {
      throw new IllegalArgumentException("Rational function with zero denominator");
    }
    if (numerator.isZero()) {
      return new RationalFunction(RationalPolynomial.zero(), RationalPolynomial.one());
    }
    RationalPolynomial common = numerator.gcd(denominator);
    RationalPolynomial num = numerator;
    RationalPolynomial den = denominator;
    if (!common.isOne()) {
      num = num.exactDivide(common);
      den = den.exactDivide(common);
    }
    BigRational lead = den.leadingCoefficient();
    if (!lead.isOne()) {
      num = num.divide(lead);
      den = den.divide(lead);
    }
    return new RationalFunction(num, den);
  }

  public static RationalFunction of(RationalPolynomial polynomial) {
    return of(polynomial, RationalPolynomial.one());
  }

  public static RationalFunction constant(BigRational value) {
    return of(RationalPolynomial.constant(value));
  }

  public RationalPolynomial numerator() {
    return numerator;
  }

  public RationalPolynomial denominator() {
    return denominator;
  }

  public boolean isZero() {
    return numerator.isZero();
  }

  public boolean isPolynomial() {
    return denominator.isOne();
  }

  public RationalFunction add(RationalFunction other) {
    return of(
        numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
        denominator.multiply(other.denominator));
  }

  public RationalFunction subtract(RationalFunction other) {
    return add(other.negate());
  }

  public RationalFunction multiply(RationalFunction other) {
    return of(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
  }

  public RationalFunction divide(RationalFunction other) {
    if (other.isZero()) {
      throw new ArithmeticException("Division by zero rational function");
    }
    return of(numerator.multiply(other.denominator), denominator.multiply(other.numerator));
  }

  public RationalFunction negate() {
    return new RationalFunction(numerator.negate(), denominator);
  }

  public RationalFunction scale(BigRational factor) {
    return of(numerator.scale(factor), denominator);
  }

  /** Value at {@code x}, or empty when {@code x} is a pole. */
  public Optional<BigRational> evaluate(BigRational x) {
    BigRational den = denominator.evaluate(x);
    if (den.isZero()) {
      return Optional.empty();
    }
    return Optional.of(numerator.evaluate(x).divide(den));
  }

  /** {@code r(q * x)}. */
  public RationalFunction qShift(BigRational q) {
    return of(numerator.qShift(q), denominator.qShift(q));
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof RationalFunction other)) {
      return false;
    }
    return numerator.equals(other.numerator) && denominator.equals(other.denominator);
  }

  @Override
  public int hashCode() {
    return Objects.hash(numerator, denominator);
  }

  @Override
  public String toString() {
    if (isPolynomial()) {
      return numerator.toString();
    }
    return "(" + numerator + ") / (" + denominator + ")";
  }
}
