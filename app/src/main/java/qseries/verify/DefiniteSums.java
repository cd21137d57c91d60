package qseries.verify;

import java.util.Optional;
import qseries.algebra.BigRational;
import qseries.algebra.RationalFunction;
import qseries.gosper.TermRatios;
import qseries.model.HypergeometricSeries;

/** Direct summation of a terminating series at a concrete base. */
public final class DefiniteSums {

  private DefiniteSums() {}

  /**
   * {@code sum_k t_k} by term-ratio accumulation, stopping when the ratio vanishes, hits a pole,
   * or after {@code maxTerms} steps.
   */
  public static BigRational sum(HypergeometricSeries series, BigRational q, int maxTerms) {
    RationalFunction ratio = TermRatios.of(series, q);
    BigRational total = BigRational.ONE;
    BigRational term = BigRational.ONE;
    BigRational x = BigRational.ONE;
    for (int k = 0; k < maxTerms; k++) {
      Optional<BigRational> r = ratio.evaluate(x);
      if (r.isEmpty() || r.get().isZero()) {
        break;
      }
      term = term.multiply(r.get());
      total = total.add(term);
      x = x.multiply(q);
    }
    return total;
  }
}
