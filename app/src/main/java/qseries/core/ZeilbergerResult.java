package qseries.core;

import java.util.Objects;
import qseries.algebra.RationalFunction;

/**
 * A recurrence for {@code S(n) = sum_k F(n,k)} with its WZ certificate {@code R}, where {@code
 * G(n,k) = R(q^k) F(n,k)} telescopes the recurrence.
 */
public record ZeilbergerResult(Recurrence recurrence, RationalFunction certificate) {

  public ZeilbergerResult {
    Objects.requireNonNull(recurrence, "recurrence");
    Objects.requireNonNull(certificate, "certificate");
  }

  public int order() {
    return recurrence.order();
  }
}
