package qseries.petkovsek;

import java.util.List;
import qseries.algebra.BigRational;
import qseries.core.ClosedForm;
import qseries.model.QMonomial;

/** Bounded search for a q-Pochhammer reading of a solution ratio. */
final class ClosedForms {
  private static final int GEOMETRIC_RANGE = 20;
  private static final int SINGLE_FACTOR_RANGE = 10;
  private static final int DOUBLE_FACTOR_RANGE = 6;

  private ClosedForms() {}

  /**
   * Tries {@code (1-q^a)/(1-q^b)}, then {@code (1-q^a1)(1-q^a2)/((1-q^b1)(1-q^b2))}, over small
   * non-zero exponents.
   *
   * @return null for zero and pure q-power ratios, and when nothing matches
   */
  static ClosedForm decompose(BigRational ratio, BigRational q) {
    if (ratio.isZero() || q.isZero()) {
      return null;
    }
    for (int m = -GEOMETRIC_RANGE; m <= GEOMETRIC_RANGE; m++) {
      if (q.pow(m).equals(ratio)) {
        return null;
      }
    }

    for (int a = -SINGLE_FACTOR_RANGE; a <= SINGLE_FACTOR_RANGE; a++) {
      BigRational numerator = oneMinusPower(q, a);
      if (a == 0 || numerator.isZero()) {
        continue;
      }
      for (int b = -SINGLE_FACTOR_RANGE; b <= SINGLE_FACTOR_RANGE; b++) {
        BigRational denominator = oneMinusPower(q, b);
        if (b == 0 || denominator.isZero()) {
          continue;
        }
        if (numerator.divide(denominator).equals(ratio)) {
          return ClosedForm.pochhammerRatio(
              List.of(QMonomial.qPower(a)), List.of(QMonomial.qPower(b)));
        }
      }
    }

    for (int a1 = -DOUBLE_FACTOR_RANGE; a1 <= DOUBLE_FACTOR_RANGE; a1++) {
      BigRational n1 = oneMinusPower(q, a1);
      if (a1 == 0 || n1.isZero()) {
        continue;
      }
      for (int a2 = a1; a2 <= DOUBLE_FACTOR_RANGE; a2++) {
        BigRational n2 = oneMinusPower(q, a2);
        if (a2 == 0 || n2.isZero()) {
          continue;
        }
        BigRational numerator = n1.multiply(n2);
        for (int b1 = -DOUBLE_FACTOR_RANGE; b1 <= DOUBLE_FACTOR_RANGE; b1++) {
          BigRational d1 = oneMinusPower(q, b1);
          if (b1 == 0 || d1.isZero()) {
            continue;
          }
          for (int b2 = b1; b2 <= DOUBLE_FACTOR_RANGE; b2++) {
            BigRational d2 = oneMinusPower(q, b2);
            if (b2 == 0 || d2.isZero()) {
              continue;
            }
            if (numerator.divide(d1.multiply(d2)).equals(ratio)) {
              return ClosedForm.pochhammerRatio(
                  List.of(QMonomial.qPower(a1), QMonomial.qPower(a2)),
                  List.of(QMonomial.qPower(b1), QMonomial.qPower(b2)));
            }
          }
        }
      }
    }
    return null;
  }

  private static BigRational oneMinusPower(BigRational q, int exponent) {
    return BigRational.ONE.subtract(q.pow(exponent));
  }
}
