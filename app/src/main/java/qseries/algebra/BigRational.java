package qseries.algebra;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Exact rational number {@code numerator / denominator} over {@link BigInteger}.
 *
 * <p>Values are always stored in lowest terms with a strictly positive denominator, so {@link
 * #equals(Object)} is structural.
 */
public final class BigRational implements Comparable<BigRational> {
  public static final BigRational ZERO = new BigRational(BigInteger.ZERO, BigInteger.ONE);
  public static final BigRational ONE = new BigRational(BigInteger.ONE, BigInteger.ONE);
  public static final BigRational MINUS_ONE =
      new BigRational(BigInteger.ONE.negate(), BigInteger.ONE);

  private final BigInteger numerator;
  private final BigInteger denominator;

  private BigRational(BigInteger numerator, BigInteger denominator) {
    this.numerator = numerator;
    this.denominator = denominator;
  }

  public static BigRational of(BigInteger numerator, BigInteger denominator) {
    Objects.requireNonNull(numerator, "numerator");
    Objects.requireNonNull(denominator, "denominator");
    if (denominator.signum() == 0) {
      throw new ArithmeticException("Zero denominator");
    }
    if (numerator.signum() == 0) {
      return ZERO;
    }
    if (denominator.signum() < 0) {
      numerator = numerator.negate();
      denominator = denominator.negate();
    }
    BigInteger gcd = numerator.gcd(denominator);
    if (!gcd.equals(BigInteger.ONE)) {
      numerator = numerator.divide(gcd);
      denominator = denominator.divide(gcd);
    }
    return new BigRational(numerator, denominator);
  }

  public static BigRational of(long numerator, long denominator) {
    return of(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
  }

  public static BigRational of(long value) {
    return of(BigInteger.valueOf(value), BigInteger.ONE);
  }

  public static BigRational of(BigInteger value) {
    return of(value, BigInteger.ONE);
  }

  /** Parses {@code "p"} or {@code "p/q"}. */
  public static BigRational parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("Empty rational literal");
    }
    String trimmed = raw.trim();
    int slash = trimmed.indexOf('/');
    try {
      if (slash < 0) {
        return of(new BigInteger(trimmed));
      }
      BigInteger num = new BigInteger(trimmed.substring(0, slash).trim());
      BigInteger den = new BigInteger(trimmed.substring(slash + 1).trim());
      if (den.signum() == 0) {
        throw new IllegalArgumentException("Zero denominator in " + raw);
      }
      return of(num, den);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid rational literal: " + raw, ex);
    }
  }

  public BigInteger numerator() {
    return numerator;
  }

  public BigInteger denominator() {
    return denominator;
  }

  public boolean isZero() {
    return numerator.signum() == 0;
  }

  public boolean isOne() {
    return numerator.equals(BigInteger.ONE) && denominator.equals(BigInteger.ONE);
  }

  public boolean isInteger() {
    return denominator.equals(BigInteger.ONE);
  }

  public int signum() {
    return numerator.signum();
  }

  public BigRational add(BigRational other) {
    if (isZero()) {
      return other;
    }
    if (other.isZero()) {
      return this;
    }
    if (denominator.equals(other.denominator)) {
      return of(numerator.add(other.numerator), denominator);
    }
    return of(
        numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
        denominator.multiply(other.denominator));
  }

  public BigRational subtract(BigRational other) {
    return add(other.negate());
  }

  public BigRational multiply(BigRational other) {
    if (isZero() || other.isZero()) {
      return ZERO;
    }
    if (isOne()) {
      return other;
    }
    if (other.isOne()) {
      return this;
    }
    return of(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
  }

  public BigRational divide(BigRational other) {
    if (other.isZero()) {
      throw new ArithmeticException("Division by zero");
    }
    return of(numerator.multiply(other.denominator), denominator.multiply(other.numerator));
  }

  public BigRational negate() {
    if (isZero()) {
      return this;
    }
    return new BigRational(numerator.negate(), denominator);
  }

  public BigRational abs() {
    return numerator.signum() < 0 ? negate() : this;
  }

  public BigRational reciprocal() {
    return ONE.divide(this);
  }

  /**
   * Exact integer power by repeated squaring.
   *
   * @throws IllegalArgumentException if this value is zero and {@code exponent} is negative
   */
  public BigRational pow(long exponent) {
    if (exponent == 0) {
      return ONE;
    }
    if (exponent < 0) {
      if (isZero()) {
        throw new IllegalArgumentException("Zero base with negative exponent " + exponent);
      }
      return reciprocal().pow(-exponent);
    }
    BigRational result = ONE;
    BigRational base = this;
    long e = exponent;
    while (e > 0) {
      if ((e & 1L) == 1L) {
        result = result.multiply(base);
      }
      e >>= 1;
      if (e > 0) {
        base = base.multiply(base);
      }
    }
    return result;
  }

  @Override
  public int compareTo(BigRational other) {
    return numerator.multiply(other.denominator).compareTo(other.numerator.multiply(denominator));
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof BigRational other)) {
      return false;
    }
    return numerator.equals(other.numerator) && denominator.equals(other.denominator);
  }

  @Override
  public int hashCode() {
    return 31 * numerator.hashCode() + denominator.hashCode();
  }

  @Override
  public String toString() {
    return isInteger() ? numerator.toString() : numerator + "/" + denominator;
  }
}
