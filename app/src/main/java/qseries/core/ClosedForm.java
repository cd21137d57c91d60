package qseries.core;

import java.util.List;
import java.util.Objects;
import qseries.algebra.BigRational;
import qseries.model.QMonomial;

/**
 * {@code scalar * q^{qPowerCoefficient * n(n-1)/2} * prod (a_i;q)_n / prod (b_j;q)_n}.
 *
 * <p>Pure geometric solutions {@code q^{mn}} have no closed form; the ratio alone describes them.
 */
public record ClosedForm(
    BigRational scalar,
    long qPowerCoefficient,
    List<QMonomial> numeratorFactors,
    List<QMonomial> denominatorFactors) {

  public ClosedForm {
    Objects.requireNonNull(scalar, "scalar");
    numeratorFactors = List.copyOf(Objects.requireNonNull(numeratorFactors, "numeratorFactors"));
    denominatorFactors =
        List.copyOf(Objects.requireNonNull(denominatorFactors, "denominatorFactors"));
  }

  /** Unit scalar, no q-power, just the Pochhammer factors. */
  public static ClosedForm pochhammerRatio(
      List<QMonomial> numeratorFactors, List<QMonomial> denominatorFactors) {
    return new ClosedForm(BigRational.ONE, 0, numeratorFactors, denominatorFactors);
  }
}
