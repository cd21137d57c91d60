package qseries.petkovsek;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qseries.algebra.BigRational;
import qseries.core.PetkovsekSolution;
import qseries.core.Recurrence;
import qseries.core.TelescopingOptions;

/**
 * q-hypergeometric solutions of constant-coefficient recurrences.
 *
 * <p>A solution with constant ratio {@code r = y(n+1)/y(n)} must be a root of the characteristic
 * polynomial {@code c_0 + c_1 r + ... + c_d r^d}; rational roots are found with the rational-root
 * theorem on the integer-scaled coefficients.
 */
public final class QPetkovsek {
  private static final Logger LOG = LoggerFactory.getLogger(QPetkovsek.class);

  private final TelescopingOptions options;

  public QPetkovsek() {
    this(TelescopingOptions.defaults());
  }

  public QPetkovsek(TelescopingOptions options) {
    this.options = TelescopingOptions.normalize(options);
  }

  public List<PetkovsekSolution> solve(Recurrence recurrence, BigRational q) {
    return solve(recurrence.coefficients(), q);
  }

  /**
   * @throws IllegalArgumentException with fewer than two coefficients or a zero leading one
   */
  public List<PetkovsekSolution> solve(List<BigRational> coefficients, BigRational q) {
    Objects.requireNonNull(coefficients, "coefficients");
    Objects.requireNonNull(q, "q");
    if (coefficients.size() < 2) {
      throw new IllegalArgumentException(
          "Need at least two coefficients (order >= 1), got " + coefficients.size());
    }
    int d = coefficients.size() - 1;
    if (coefficients.get(d).isZero()) {
      throw new IllegalArgumentException("Leading coefficient c_" + d + " must be non-zero");
    }

    if (d == 1) {
      BigRational ratio = coefficients.get(0).divide(coefficients.get(1)).negate();
      return List.of(new PetkovsekSolution(ratio, ClosedForms.decompose(ratio, q)));
    }

    BigInteger lcm = BigInteger.ONE;
    for (BigRational c : coefficients) {
      lcm = lcm(lcm, c.denominator());
    }
    BigInteger constantTerm = scaled(coefficients.get(0), lcm);
    BigInteger leading = scaled(coefficients.get(d), lcm);

    if (constantTerm.signum() == 0) {
      // r = 0 is a root; the rest are roots of the polynomial with every factor r removed
      int zeros = 0;
      while (coefficients.get(zeros).isZero()) {
        zeros++;
      }
      TreeMap<BigRational, PetkovsekSolution> byRatio = new TreeMap<>();
      byRatio.put(BigRational.ZERO, new PetkovsekSolution(BigRational.ZERO, null));
      if (d - zeros >= 1) {
        for (PetkovsekSolution solution :
            solve(coefficients.subList(zeros, coefficients.size()), q)) {
          byRatio.putIfAbsent(solution.ratio(), solution);
        }
      }
      return List.copyOf(byRatio.values());
    }

    List<BigInteger> numerators = positiveDivisors(constantTerm);
    List<BigInteger> denominators = positiveDivisors(leading);
    long candidateCount = (long) numerators.size() * denominators.size();
    if (candidateCount > options.maxCandidateProduct()) {
      LOG.warn(
          "Rational-root search abandoned: {} candidates exceed cap {}",
          candidateCount,
          options.maxCandidateProduct());
      return List.of();
    }

    TreeSet<BigRational> candidates = new TreeSet<>();
    for (BigInteger p : numerators) {
      for (BigInteger s : denominators) {
        candidates.add(BigRational.of(p, s));
        candidates.add(BigRational.of(p.negate(), s));
      }
    }
    List<PetkovsekSolution> solutions = new ArrayList<>();
    for (BigRational candidate : candidates) {
      if (characteristic(coefficients, candidate).isZero()) {
        solutions.add(new PetkovsekSolution(candidate, ClosedForms.decompose(candidate, q)));
      }
    }
    return List.copyOf(solutions);
  }

  /** Horner evaluation of {@code c_0 + c_1 r + ... + c_d r^d}. */
  static BigRational characteristic(List<BigRational> coefficients, BigRational r) {
    BigRational result = BigRational.ZERO;
    for (int j = coefficients.size() - 1; j >= 0; j--) {
      result = result.multiply(r).add(coefficients.get(j));
    }
    return result;
  }

  /** Positive divisors of {@code |n|} by trial division up to {@code sqrt|n|} and the trial cap. */
  List<BigInteger> positiveDivisors(BigInteger n) {
    BigInteger abs = n.abs();
    if (abs.signum() == 0) {
      return List.of();
    }
    TreeSet<BigInteger> divisors = new TreeSet<>();
    BigInteger root = abs.sqrt();
    BigInteger limit = root.min(BigInteger.valueOf(options.maxTrialDivisor()));
    for (BigInteger i = BigInteger.ONE; i.compareTo(limit) <= 0; i = i.add(BigInteger.ONE)) {
      BigInteger[] qr = abs.divideAndRemainder(i);
      if (qr[1].signum() == 0) {
        divisors.add(i);
        divisors.add(qr[0]);
      }
    }
    return List.copyOf(divisors);
  }

  private static BigInteger scaled(BigRational c, BigInteger lcm) {
    return c.numerator().multiply(lcm.divide(c.denominator()));
  }

  private static BigInteger lcm(BigInteger a, BigInteger b) {
    return a.divide(a.gcd(b)).multiply(b);
  }
}
