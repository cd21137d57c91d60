package qseries.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import org.junit.jupiter.api.Test;
import qseries.algebra.BigRational;

final class HypergeometricSeriesTest {

  @Test
  void terminationOrderIsSmallestNegativePower() {
    HypergeometricSeries series =
        new HypergeometricSeries(
            List.of(QMonomial.qPower(2), QMonomial.qPower(-4), QMonomial.qPower(-1)),
            List.of(QMonomial.qPower(3)),
            QMonomial.qPower(1));
    assertEquals(OptionalInt.of(1), series.terminationOrder());
    assertTrue(series.isTerminating());
    assertEquals(-1, series.extraFactorExponent(), "3phi1 has e = 1 + 1 - 3");
  }

  @Test
  void scaledParameterDoesNotTerminate() {
    HypergeometricSeries series =
        new HypergeometricSeries(
            List.of(new QMonomial(BigRational.of(2), -3)), List.of(), QMonomial.qPower(1));
    assertFalse(series.isTerminating(), "2 q^-3 is not of the form q^-n");
  }

  @Test
  void shiftedMovesOnlyDependentParameters() {
    HypergeometricSeries series =
        new HypergeometricSeries(
            List.of(QMonomial.qPower(-3), QMonomial.qPower(2)),
            List.of(QMonomial.qPower(3)),
            QMonomial.qPower(4));
    HypergeometricSeries shifted = series.shifted(2, IndexDependence.of(Set.of(0), true));
    assertEquals(QMonomial.qPower(-5), shifted.upper().get(0));
    assertEquals(QMonomial.qPower(2), shifted.upper().get(1), "Position 1 is index-free");
    assertEquals(series.lower(), shifted.lower());
    assertEquals(QMonomial.qPower(6), shifted.argument());
    assertSame(series, series.shifted(0, IndexDependence.none()));
  }

  @Test
  void monomialHelpers() {
    QMonomial square = new QMonomial(BigRational.of(4, 9), 2);
    assertEquals(Optional.of(new QMonomial(BigRational.of(2, 3), 1)), square.sqrt());
    assertEquals(Optional.empty(), QMonomial.qPower(1).sqrt(), "Odd power has no square root");
    assertEquals(OptionalInt.of(3), QMonomial.qPower(-3).negativePowerOrder());
    QMonomial scaled = new QMonomial(BigRational.of(2), 2);
    assertEquals(BigRational.of(2, 9), scaled.evaluate(BigRational.of(1, 3)));
  }

  @Test
  void dependenceRejectsNegativePositions() {
    assertThrows(IllegalArgumentException.class, () -> IndexDependence.of(Set.of(-1), false));
    assertTrue(IndexDependence.none().upperPositions().isEmpty());
    assertFalse(IndexDependence.none().argumentDependent());
  }
}
