package qseries.examples;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.IntFunction;
import qseries.algebra.BigRational;
import qseries.model.HypergeometricSeries;
import qseries.zeilberger.IndexDependenceDetector;

/**
 * A terminating identity family {@code lhs(n) = rhs(n, q)}.
 *
 * <p>{@code detector} says which parameters of {@code lhs(n)} move with {@code n}.
 */
public record Identity(
    String name,
    String description,
    IntFunction<HypergeometricSeries> lhs,
    BiFunction<Integer, BigRational, BigRational> rhs,
    IndexDependenceDetector detector) {

  public Identity {
    Objects.requireNonNull(name, "name");
    description = description == null ? "" : description;
    Objects.requireNonNull(lhs, "lhs");
    Objects.requireNonNull(rhs, "rhs");
    detector = detector == null ? IndexDependenceDetector.heuristic() : detector;
  }

  public IntFunction<BigRational> rhsAt(BigRational q) {
    Objects.requireNonNull(q, "q");
    return n -> rhs.apply(n, q);
  }
}
