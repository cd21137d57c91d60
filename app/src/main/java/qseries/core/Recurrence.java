package qseries.core;

import java.util.List;
import java.util.Objects;
import qseries.algebra.BigRational;

/** Constant coefficients {@code c_0..c_d} of {@code sum_j c_j S(n+j) = 0}. */
public record Recurrence(List<BigRational> coefficients) {

  public Recurrence {
    coefficients = List.copyOf(Objects.requireNonNull(coefficients, "coefficients"));
    if (coefficients.size() < 2) {
      throw new IllegalArgumentException(
          "A recurrence needs at least two coefficients, got " + coefficients.size());
    }
  }

  public static Recurrence of(BigRational... coefficients) {
    return new Recurrence(List.of(coefficients));
  }

  public int order() {
    return coefficients.size() - 1;
  }

  public BigRational coefficient(int j) {
    return coefficients.get(j);
  }

  public BigRational leadingCoefficient() {
    return coefficients.get(order());
  }

  /**
   * {@code sum_j c_j * values[j]}.
   *
   * @throws IllegalArgumentException unless exactly {@code order() + 1} values are given
   */
  public BigRational apply(List<BigRational> values) {
    if (values.size() != coefficients.size()) {
      throw new IllegalArgumentException(
          "Expected " + coefficients.size() + " values, got " + values.size());
    }
    BigRational total = BigRational.ZERO;
    for (int j = 0; j < coefficients.size(); j++) {
      total = total.add(coefficients.get(j).multiply(values.get(j)));
    }
    return total;
  }
}
