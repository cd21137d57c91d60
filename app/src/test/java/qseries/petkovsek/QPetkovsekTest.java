package qseries.petkovsek;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Test;
import qseries.algebra.BigRational;
import qseries.core.ClosedForm;
import qseries.core.PetkovsekSolution;
import qseries.core.Recurrence;
import qseries.core.TelescopingOptions;
import qseries.model.QMonomial;

final class QPetkovsekTest {

  private static final BigRational Q = BigRational.of(1, 3);

  @Test
  void findsBothRationalRoots() {
    // (r - 1/2)(r - 1/3) = r^2 - 5/6 r + 1/6
    List<PetkovsekSolution> solutions =
        new QPetkovsek()
            .solve(List.of(BigRational.of(1, 6), BigRational.of(-5, 6), BigRational.ONE), Q);
    assertEquals(2, solutions.size(), "Both roots should be found");
    assertEquals(BigRational.of(1, 3), solutions.get(0).ratio(), "Roots come back ascending");
    assertEquals(BigRational.of(1, 2), solutions.get(1).ratio());
    assertNull(solutions.get(0).closedForm(), "q^1 is a pure q-power ratio");
  }

  @Test
  void cubicWithIntegerRoots() {
    // (r - 1)(r - 2)(r - 3) = r^3 - 6r^2 + 11r - 6
    List<PetkovsekSolution> solutions =
        new QPetkovsek()
            .solve(
                List.of(
                    BigRational.of(-6), BigRational.of(11), BigRational.of(-6), BigRational.ONE),
                Q);
    assertEquals(
        List.of(BigRational.ONE, BigRational.of(2), BigRational.of(3)),
        solutions.stream().map(PetkovsekSolution::ratio).toList(),
        "Exactly the three integer roots, ascending");
  }

  @Test
  void firstOrderRatioIsMinusC0OverC1() {
    List<PetkovsekSolution> solutions =
        new QPetkovsek().solve(List.of(BigRational.of(3, 4), BigRational.of(-5, 2)), Q);
    assertEquals(1, solutions.size(), "Order 1 has exactly one solution");
    assertEquals(BigRational.of(3, 10), solutions.get(0).ratio());
  }

  @Test
  void noRationalRootsGivesEmptyList() {
    List<PetkovsekSolution> solutions =
        new QPetkovsek()
            .solve(Recurrence.of(BigRational.ONE, BigRational.of(2), BigRational.of(3)), Q);
    assertTrue(solutions.isEmpty(), "1 + 2r + 3r^2 has no real roots");
  }

  @Test
  void firstOrderReadsPochhammerRatio() {
    // y(n+1)/y(n) = (1 - q^2)/(1 - q^3) = 12/13 at q = 1/3
    List<PetkovsekSolution> solutions =
        new QPetkovsek().solve(List.of(BigRational.of(-12, 13), BigRational.ONE), Q);
    assertEquals(1, solutions.size());
    PetkovsekSolution solution = solutions.get(0);
    assertEquals(BigRational.of(12, 13), solution.ratio());
    assertTrue(solution.hasClosedForm(), "12/13 should decompose");
    ClosedForm form = solution.closedForm();
    assertEquals(List.of(QMonomial.qPower(2)), form.numeratorFactors());
    assertEquals(List.of(QMonomial.qPower(3)), form.denominatorFactors());
  }

  @Test
  void zeroConstantTermAddsZeroRoot() {
    // r^2 - r = r (r - 1)
    List<PetkovsekSolution> solutions =
        new QPetkovsek()
            .solve(List.of(BigRational.ZERO, BigRational.MINUS_ONE, BigRational.ONE), Q);
    assertEquals(BigRational.ZERO, solutions.get(0).ratio());
    assertEquals(BigRational.ONE, solutions.get(1).ratio());
  }

  @Test
  void repeatedZeroRootIsReportedOnce() {
    List<PetkovsekSolution> solutions =
        new QPetkovsek().solve(List.of(BigRational.ZERO, BigRational.ZERO, BigRational.ONE), Q);
    assertEquals(
        List.of(BigRational.ZERO),
        solutions.stream().map(PetkovsekSolution::ratio).toList(),
        "r^2 has the single distinct root 0");
  }

  @Test
  void zeroRootMergesWithDeflatedRootsAscending() {
    // r (r - 2)(r + 1) = r^3 - r^2 - 2r
    List<PetkovsekSolution> solutions =
        new QPetkovsek()
            .solve(
                List.of(
                    BigRational.ZERO, BigRational.of(-2), BigRational.MINUS_ONE, BigRational.ONE),
                Q);
    assertEquals(
        List.of(BigRational.MINUS_ONE, BigRational.ZERO, BigRational.of(2)),
        solutions.stream().map(PetkovsekSolution::ratio).toList(),
        "Distinct roots in ascending order");
  }

  @Test
  void candidateCapAbandonsSearch() {
    TelescopingOptions capped = new TelescopingOptions(3, 50, 100, 1, 10_000, 10);
    List<BigRational> cubic =
        List.of(BigRational.of(-6), BigRational.of(11), BigRational.of(-6), BigRational.ONE);
    List<PetkovsekSolution> solutions = new QPetkovsek(capped).solve(cubic, Q);
    assertTrue(solutions.isEmpty(), "Four candidates exceed a cap of one");
  }

  @Test
  void rejectsDegenerateInput() {
    QPetkovsek solver = new QPetkovsek();
    assertThrows(IllegalArgumentException.class, () -> solver.solve(List.of(BigRational.ONE), Q));
    assertThrows(
        IllegalArgumentException.class,
        () -> solver.solve(List.of(BigRational.ONE, BigRational.ZERO), Q));
  }

  @Test
  void divisorsAreSortedAndComplete() {
    assertEquals(
        List.of(BigInteger.ONE, BigInteger.TWO, BigInteger.valueOf(3), BigInteger.valueOf(6)),
        new QPetkovsek().positiveDivisors(BigInteger.valueOf(-6)));
  }
}
