package qseries.zeilberger;

import java.util.SortedSet;
import java.util.TreeSet;
import qseries.algebra.BigRational;
import qseries.model.HypergeometricSeries;
import qseries.model.IndexDependence;
import qseries.model.QMonomial;

/**
 * Pattern-based detection for standard shapes such as q-Vandermonde.
 *
 * <p>An upper parameter depends on {@code n} when it evaluates to {@code q^{-n}}. The argument is
 * taken to depend on {@code n} when its power is non-zero and raising the power changes its value.
 * That second rule also fires for a constant argument like {@code q}; callers with such series
 * should supply a {@link IndexDependenceDetector#fixed fixed} dependence instead.
 */
public final class HeuristicIndexDependenceDetector implements IndexDependenceDetector {
  static final HeuristicIndexDependenceDetector INSTANCE = new HeuristicIndexDependenceDetector();

  private HeuristicIndexDependenceDetector() {}

  @Override
  public IndexDependence detect(HypergeometricSeries series, int n, BigRational q) {
    BigRational qToMinusN = q.pow(-n);
    SortedSet<Integer> positions = new TreeSet<>();
    for (int i = 0; i < series.upper().size(); i++) {
      if (series.upper().get(i).evaluate(q).equals(qToMinusN)) {
        positions.add(i);
      }
    }
    QMonomial z = series.argument();
    boolean argumentDependent =
        z.power() != 0 && !z.evaluate(q).equals(z.shiftPower(1).evaluate(q));
    return new IndexDependence(positions, argumentDependent);
  }
}
