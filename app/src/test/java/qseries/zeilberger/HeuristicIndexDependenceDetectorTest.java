package qseries.zeilberger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import org.junit.jupiter.api.Test;
import qseries.algebra.BigRational;
import qseries.examples.Identities;
import qseries.model.IndexDependence;

final class HeuristicIndexDependenceDetectorTest {

  private static final BigRational Q = BigRational.of(1, 3);

  @Test
  void detectsVandermondeShape() {
    IndexDependence dependence =
        IndexDependenceDetector.heuristic()
            .detect(Identities.qVandermonde().lhs().apply(5), 5, Q);
    assertEquals(Set.of(0), dependence.upperPositions(), "Only q^-n depends on n");
    assertTrue(dependence.argumentDependent(), "q^(n+1) moves with n");
  }

  @Test
  void constantArgumentWithoutQPowerIsIndependent() {
    IndexDependence dependence =
        IndexDependenceDetector.heuristic().detect(Identities.qBinomial().lhs().apply(3), 3, Q);
    assertEquals(Set.of(0), dependence.upperPositions());
    assertFalse(dependence.argumentDependent(), "The argument 2 never moves");
  }

  @Test
  void constantQPowerArgumentIsMisread() {
    IndexDependence dependence =
        IndexDependenceDetector.heuristic()
            .detect(Identities.qChuVandermonde().lhs().apply(3), 3, Q);
    assertTrue(
        dependence.argumentDependent(),
        "The heuristic reads any q-power argument as dependent; a fixed detector corrects it");
  }

  @Test
  void fixedDetectorIgnoresSeries() {
    IndexDependence fixed = IndexDependence.of(Set.of(1), false);
    assertEquals(
        fixed,
        IndexDependenceDetector.fixed(fixed)
            .detect(Identities.qVandermonde().lhs().apply(2), 2, Q));
  }
}
