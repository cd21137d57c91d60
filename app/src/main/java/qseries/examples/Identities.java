package qseries.examples;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import qseries.algebra.BigRational;
import qseries.model.HypergeometricSeries;
import qseries.model.IndexDependence;
import qseries.model.QMonomial;
import qseries.zeilberger.IndexDependenceDetector;

/** Classical terminating summations, specialised with {@code a = q^{-n}}. */
public final class Identities {
  private static final Map<String, Identity> CATALOGUE = buildCatalogue();

  private Identities() {}

  /** {@code 2phi1(q^{-n}, q^2; q^3; q, q^{n+1}) = (q;q)_n / (q^3;q)_n}. */
  public static Identity qVandermonde() {
    return new Identity(
        "vandermonde",
        "2phi1(q^-n, q^2; q^3; q, q^(n+1)) = (q;q)_n / (q^3;q)_n",
        n -> twoPhiOne(n, 3, n + 1),
        (n, q) -> pochhammer(q, q, n).divide(pochhammer(q.pow(3), q, n)),
        IndexDependenceDetector.heuristic());
  }

  /** q-Gauss with {@code b = q^2}, {@code c = q^4}: argument {@code c/(ab) = q^{n+2}}. */
  public static Identity qGauss() {
    return new Identity(
        "gauss",
        "2phi1(q^-n, q^2; q^4; q, q^(n+2)) = (q^2;q)_n / (q^4;q)_n",
        n -> twoPhiOne(n, 4, n + 2),
        (n, q) -> pochhammer(q.pow(2), q, n).divide(pochhammer(q.pow(4), q, n)),
        IndexDependenceDetector.heuristic());
  }

  /**
   * q-Chu-Vandermonde with argument {@code q}, {@code b = q^2}, {@code c = q^5}.
   *
   * <p>The argument is constant in {@code n}, which the heuristic detector cannot tell, so the
   * dependence is fixed.
   */
  public static Identity qChuVandermonde() {
    return new Identity(
        "chu-vandermonde",
        "2phi1(q^-n, q^2; q^5; q, q) = (q^3;q)_n / (q^5;q)_n * q^(2n)",
        n -> twoPhiOne(n, 5, 1),
        (n, q) ->
            pochhammer(q.pow(3), q, n).divide(pochhammer(q.pow(5), q, n)).multiply(q.pow(2L * n)),
        IndexDependenceDetector.fixed(IndexDependence.of(Set.of(0), false)));
  }

  /** Terminating q-binomial theorem {@code 1phi0(q^{-n};;q,2) = (2q^{-n};q)_n}. */
  public static Identity qBinomial() {
    BigRational z = BigRational.of(2);
    return new Identity(
        "binomial",
        "1phi0(q^-n;;q,2) = (2q^-n;q)_n",
        n -> series(List.of(QMonomial.qPower(-n)), List.of(), QMonomial.constant(z)),
        (n, q) -> pochhammer(z.multiply(q.pow(-n)), q, n),
        IndexDependenceDetector.heuristic());
  }

  public static List<Identity> all() {
    return List.copyOf(CATALOGUE.values());
  }

  public static Set<String> names() {
    return CATALOGUE.keySet();
  }

  /**
   * @throws IllegalArgumentException for a name not in the catalogue
   */
  public static Identity byName(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Unknown identity: " + name);
    }
    Identity identity = CATALOGUE.get(name.trim().toLowerCase(Locale.ROOT));
    if (identity == null) {
      throw new IllegalArgumentException(
          "Unknown identity: " + name + " (known: " + String.join(", ", names()) + ")");
    }
    return identity;
  }

  /** Finite q-Pochhammer symbol {@code (a;q)_n = prod_{k<n} (1 - a q^k)}; {@code 1} for n <= 0. */
  public static BigRational pochhammer(BigRational a, BigRational q, int n) {
    BigRational result = BigRational.ONE;
    BigRational aqk = a;
    for (int k = 0; k < n; k++) {
      result = result.multiply(BigRational.ONE.subtract(aqk));
      aqk = aqk.multiply(q);
    }
    return result;
  }

  /** {@code 2phi1(q^{-n}, q^2; q^lowerPower; q, q^argumentPower)}. */
  private static HypergeometricSeries twoPhiOne(int n, int lowerPower, int argumentPower) {
    return series(
        List.of(QMonomial.qPower(-n), QMonomial.qPower(2)),
        List.of(QMonomial.qPower(lowerPower)),
        QMonomial.qPower(argumentPower));
  }

  private static HypergeometricSeries series(
      List<QMonomial> upper, List<QMonomial> lower, QMonomial argument) {
    return new HypergeometricSeries(upper, lower, argument);
  }

  private static Map<String, Identity> buildCatalogue() {
    Map<String, Identity> catalogue = new LinkedHashMap<>();
    for (Identity identity : List.of(qVandermonde(), qGauss(), qChuVandermonde(), qBinomial())) {
      catalogue.put(identity.name(), identity);
    }
    return Collections.unmodifiableMap(catalogue);
  }
}
