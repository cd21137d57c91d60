package qseries.gosper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qseries.algebra.BigRational;
import qseries.algebra.LinearSystems;
import qseries.algebra.RationalPolynomial;

/** Polynomial solutions of the key equation {@code sigma(x) f(qx) - tau(x) f(x) = c(x)}. */
public final class KeyEquationSolver {
  private static final Logger LOG = LoggerFactory.getLogger(KeyEquationSolver.class);

  private KeyEquationSolver() {}

  public static Optional<RationalPolynomial> solve(
      RationalPolynomial sigma, RationalPolynomial tau, RationalPolynomial c, BigRational q) {
    TermRatios.requireNonZeroBase(q);
    if (c.isZero()) {
      return Optional.of(RationalPolynomial.zero());
    }
    if (sigma.isZero() && tau.isZero()) {
      return Optional.empty();
    }
    if (sigma.isZero()) {
      RationalPolynomial.Division division = c.negate().divideAndRemainder(tau);
      return division.remainder().isZero() ? Optional.of(division.quotient()) : Optional.empty();
    }
    if (tau.isZero()) {
      if (c.degree() < sigma.degree()) {
        return Optional.empty();
      }
      return solveWithDegree(sigma, tau, c, q, c.degree() - sigma.degree());
    }
    for (int degree : degreeCandidates(sigma, tau, c, q)) {
      Optional<RationalPolynomial> solution = solveWithDegree(sigma, tau, c, q, degree);
      if (solution.isPresent()) {
        LOG.debug("Key equation solved with deg f = {}", degree);
        return solution;
      }
    }
    return Optional.empty();
  }

  private static List<Integer> degreeCandidates(
      RationalPolynomial sigma, RationalPolynomial tau, RationalPolynomial c, BigRational q) {
    int dSigma = sigma.degree();
    int dTau = tau.degree();
    int dC = c.degree();
    Set<Integer> candidates = new LinkedHashSet<>();
    if (dSigma != dTau) {
      int top = Math.max(dSigma, dTau);
      if (dC >= top) {
        candidates.add(dC - top);
      }
      if (dC + 1 >= top) {
        candidates.add(dC - top + 1);
      }
      return List.copyOf(candidates);
    }

    // equal degrees: the leading terms cancel when q^deg f = lc(tau)/lc(sigma)
    BigRational ratio = tau.leadingCoefficient().divide(sigma.leadingCoefficient());
    boolean matched = false;
    for (int d = 0; d <= dC; d++) {
      if (q.pow(d).equals(ratio)) {
        candidates.add(d);
        matched = true;
        break;
      }
    }
    if (!matched || dC >= dSigma) {
      candidates.add(dC >= dSigma ? dC - dSigma : 0);
    }
    List<Integer> base = new ArrayList<>(candidates);
    for (int d : base) {
      candidates.add(d + 1);
    }
    return List.copyOf(candidates);
  }

  private static Optional<RationalPolynomial> solveWithDegree(
      RationalPolynomial sigma,
      RationalPolynomial tau,
      RationalPolynomial c,
      BigRational q,
      int degree) {
    int unknowns = degree + 1;
    int equations = Math.max(Math.max(sigma.degree(), tau.degree()) + degree, c.degree()) + 1;
    List<BigRational> qPowers = new ArrayList<>(unknowns);
    BigRational power = BigRational.ONE;
    for (int j = 0; j < unknowns; j++) {
      qPowers.add(power);
      power = power.multiply(q);
    }
    List<List<BigRational>> matrix = new ArrayList<>(equations);
    List<BigRational> rhs = new ArrayList<>(equations);
    for (int k = 0; k < equations; k++) {
      List<BigRational> row = new ArrayList<>(Collections.nCopies(unknowns, BigRational.ZERO));
      for (int j = 0; j <= Math.min(k, degree); j++) {
        BigRational shifted = sigma.coefficient(k - j).multiply(qPowers.get(j));
        row.set(j, shifted.subtract(tau.coefficient(k - j)));
      }
      matrix.add(row);
      rhs.add(c.coefficient(k));
    }
    return LinearSystems.solve(matrix, rhs, unknowns).map(RationalPolynomial::of);
  }
}
