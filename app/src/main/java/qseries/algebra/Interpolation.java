package qseries.algebra;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/** Polynomial interpolation through exact sample points. */
public final class Interpolation {

  private Interpolation() {}

  /** A sample {@code (x, y)} of the polynomial being reconstructed. */
  public record Point(BigRational x, BigRational y) {
    public Point {
      Objects.requireNonNull(x, "x");
      Objects.requireNonNull(y, "y");
    }
  }

  /**
   * Lagrange interpolation: the unique polynomial of degree below {@code points.size()} through
   * every point.
   *
   * @throws IllegalArgumentException if two points share an abscissa
   */
  public static RationalPolynomial lagrange(List<Point> points) {
    Objects.requireNonNull(points, "points");
    Set<BigRational> seen = new HashSet<>();
    for (Point point : points) {
      if (!seen.add(point.x())) {
        throw new IllegalArgumentException("Duplicate interpolation abscissa " + point.x());
      }
    }
    RationalPolynomial result = RationalPolynomial.zero();
    for (int i = 0; i < points.size(); i++) {
      Point pi = points.get(i);
      if (pi.y().isZero()) {
        continue;
      }
      RationalPolynomial basis = RationalPolynomial.one();
      BigRational denominator = BigRational.ONE;
      for (int j = 0; j < points.size(); j++) {
        if (i == j) {
          continue;
        }
        BigRational xj = points.get(j).x();
        basis = basis.multiply(RationalPolynomial.linear(xj.negate(), BigRational.ONE));
        denominator = denominator.multiply(pi.x().subtract(xj));
      }
      result = result.add(basis.scale(pi.y().divide(denominator)));
    }
    return result;
  }
}
