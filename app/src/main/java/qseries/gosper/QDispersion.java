package qseries.gosper;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import qseries.algebra.BigRational;
import qseries.algebra.RationalPolynomial;

/**
 * q-dispersion set: the shifts {@code j} for which {@code a(x)} and {@code b(q^j x)} share a
 * non-trivial factor.
 */
public final class QDispersion {

  private QDispersion() {}

  /** All {@code j} in {@code [0, deg a * deg b]}, ascending. */
  public static List<Integer> of(RationalPolynomial a, RationalPolynomial b, BigRational q) {
    return range(a, b, q, 0);
  }

  /** Same as {@link #of} but starting from {@code j = 1}. */
  public static List<Integer> positive(RationalPolynomial a, RationalPolynomial b, BigRational q) {
    return range(a, b, q, 1);
  }

  private static List<Integer> range(
      RationalPolynomial a, RationalPolynomial b, BigRational q, int start) {
    Objects.requireNonNull(a, "a");
    Objects.requireNonNull(b, "b");
    TermRatios.requireNonZeroBase(q);
    // zero or constant inputs cannot share a factor of positive degree
    if (a.degree() < 1 || b.degree() < 1) {
      return List.of();
    }
    int bound = Math.multiplyExact(a.degree(), b.degree());
    List<Integer> shifts = new ArrayList<>();
    for (int j = start; j <= bound; j++) {
      if (a.resultant(b.qShift(q, j)).isZero()) {
        shifts.add(j);
      }
    }
    return List.copyOf(shifts);
  }
}
