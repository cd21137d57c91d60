package qseries.zeilberger;

import java.util.Objects;
import qseries.algebra.BigRational;
import qseries.model.HypergeometricSeries;
import qseries.model.IndexDependence;

/** Decides which parameters of a series built for index {@code n} move with {@code n}. */
@FunctionalInterface
public interface IndexDependenceDetector {

  IndexDependence detect(HypergeometricSeries series, int n, BigRational q);

  /** Ignores the series and always answers {@code dependence}. */
  static IndexDependenceDetector fixed(IndexDependence dependence) {
    Objects.requireNonNull(dependence, "dependence");
    return (series, n, q) -> dependence;
  }

  static IndexDependenceDetector heuristic() {
    return HeuristicIndexDependenceDetector.INSTANCE;
  }
}
