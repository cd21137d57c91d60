package qseries.core;

import qseries.algebra.RationalFunction;

/**
 * Outcome of indefinite summation.
 *
 * <p>When summable, {@code certificate} is {@code y(x)} with partial sums {@code S_k = y(q^k)
 * t_k}; otherwise it is {@code null}.
 */
public record GosperResult(RationalFunction certificate) {

  public static GosperResult summable(RationalFunction certificate) {
    if (certificate == null) {
      throw new IllegalArgumentException("A summable result needs a certificate");
    }
    return new GosperResult(certificate);
  }

  public static GosperResult notSummable() {
    return new GosperResult(null);
  }

  public boolean isSummable() {
    return certificate != null;
  }
}
