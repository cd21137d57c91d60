package qseries.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.SortedSet;

/**
 * Parameters of a basic hypergeometric series {@code r phi s(a_1..a_r; b_1..b_s; q, z)}.
 *
 * <p>The series is {@code sum_k (a_1;q)_k..(a_r;q)_k / ((q;q)_k (b_1;q)_k..(b_s;q)_k) *
 * [(-1)^k q^{k(k-1)/2}]^{1+s-r} * z^k}.
 */
public record HypergeometricSeries(
    List<QMonomial> upper, List<QMonomial> lower, QMonomial argument) {

  public HypergeometricSeries {
    upper = List.copyOf(Objects.requireNonNull(upper, "upper"));
    lower = List.copyOf(Objects.requireNonNull(lower, "lower"));
    Objects.requireNonNull(argument, "argument");
  }

  public int r() {
    return upper.size();
  }

  public int s() {
    return lower.size();
  }

  /** Exponent {@code 1 + s - r} of the extra factor {@code (-1)^k q^{k(k-1)/2}}. */
  public int extraFactorExponent() {
    return 1 + s() - r();
  }

  /** Smallest {@code n} such that some upper parameter equals {@code q^{-n}}. */
  public OptionalInt terminationOrder() {
    OptionalInt best = OptionalInt.empty();
    for (QMonomial a : upper) {
      OptionalInt order = a.negativePowerOrder();
      if (order.isPresent() && (best.isEmpty() || order.getAsInt() < best.getAsInt())) {
        best = order;
      }
    }
    return best;
  }

  public boolean isTerminating() {
    return terminationOrder().isPresent();
  }

  /**
   * The series for {@code n + j}: each index-dependent upper parameter loses {@code j} from its
   * power, and a dependent argument gains {@code j}.
   */
  public HypergeometricSeries shifted(int j, IndexDependence dependence) {
    Objects.requireNonNull(dependence, "dependence");
    SortedSet<Integer> positions = dependence.upperPositions();
    if (!positions.isEmpty() && positions.last() >= upper.size()) {
      throw new IllegalArgumentException(
          "Index-dependent position "
              + positions.last()
              + " is out of range for "
              + upper.size()
              + " upper parameters");
    }
    if (j == 0) {
      return this;
    }
    List<QMonomial> shiftedUpper = new ArrayList<>(upper);
    for (int i = 0; i < shiftedUpper.size(); i++) {
      if (dependence.dependsOnUpper(i)) {
        shiftedUpper.set(i, shiftedUpper.get(i).shiftPower(-j));
      }
    }
    QMonomial shiftedArgument = dependence.argumentDependent() ? argument.shiftPower(j) : argument;
    return new HypergeometricSeries(shiftedUpper, lower, shiftedArgument);
  }

  @Override
  public String toString() {
    return r() + "phi" + s() + "(" + upper + "; " + lower + "; q, " + argument + ")";
  }
}
