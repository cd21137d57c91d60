package qseries.model;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import qseries.algebra.BigRational;

/** A series parameter {@code coefficient * q^power}. */
public record QMonomial(BigRational coefficient, int power) {

  public QMonomial {
    Objects.requireNonNull(coefficient, "coefficient");
  }

  /** {@code q^power}. */
  public static QMonomial qPower(int power) {
    return new QMonomial(BigRational.ONE, power);
  }

  /** {@code c * q^0}. */
  public static QMonomial constant(BigRational c) {
    return new QMonomial(c, 0);
  }

  public QMonomial multiply(QMonomial other) {
    return new QMonomial(coefficient.multiply(other.coefficient), power + other.power);
  }

  public QMonomial divide(QMonomial other) {
    if (other.coefficient.isZero()) {
      throw new ArithmeticException("Division by zero monomial");
    }
    return new QMonomial(coefficient.divide(other.coefficient), power - other.power);
  }

  public QMonomial negate() {
    return new QMonomial(coefficient.negate(), power);
  }

  public QMonomial pow(int exponent) {
    return new QMonomial(coefficient.pow(exponent), Math.multiplyExact(power, exponent));
  }

  /**
   * Square root with a rational coefficient and an integral power, when one exists.
   *
   * <p>The coefficient must be a non-negative perfect square and the power even.
   */
  public Optional<QMonomial> sqrt() {
    if (power % 2 != 0 || coefficient.signum() < 0) {
      return Optional.empty();
    }
    BigInteger num = coefficient.numerator();
    BigInteger den = coefficient.denominator();
    BigInteger numRoot = num.sqrt();
    BigInteger denRoot = den.sqrt();
    if (!numRoot.multiply(numRoot).equals(num) || !denRoot.multiply(denRoot).equals(den)) {
      return Optional.empty();
    }
    return Optional.of(new QMonomial(BigRational.of(numRoot, denRoot), power / 2));
  }

  /** {@code coefficient * q^power} at a concrete base. */
  public BigRational evaluate(BigRational q) {
    if (power == 0) {
      return coefficient;
    }
    return coefficient.multiply(q.pow(power));
  }

  /** Returns {@code n} when this monomial is exactly {@code q^{-n}} with {@code n >= 0}. */
  public OptionalInt negativePowerOrder() {
    if (coefficient.isOne() && power <= 0) {
      return OptionalInt.of(-power);
    }
    return OptionalInt.empty();
  }

  /** Same coefficient, power moved by {@code delta}. */
  public QMonomial shiftPower(int delta) {
    return delta == 0 ? this : new QMonomial(coefficient, power + delta);
  }

  @Override
  public String toString() {
    if (power == 0) {
      return coefficient.toString();
    }
    String base = power == 1 ? "q" : "q^" + power;
    return coefficient.isOne() ? base : coefficient + "*" + base;
  }
}
