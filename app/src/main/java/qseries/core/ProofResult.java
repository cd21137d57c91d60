package qseries.core;

import java.util.List;
import java.util.Objects;
import qseries.algebra.BigRational;

/**
 * Outcome of a nonterminating-identity proof.
 *
 * <p>A proved result carries the shared recurrence and the number of initial conditions checked;
 * a failed one carries a reason and a message naming the offending index where there is one.
 */
public record ProofResult(
    Recurrence recurrence,
    int initialConditionsChecked,
    ProofFailureReason reason,
    String message) {

  public ProofResult {
    if (reason == null) {
      Objects.requireNonNull(recurrence, "recurrence");
      if (initialConditionsChecked < 1) {
        throw new IllegalArgumentException(
            "initialConditionsChecked must be positive: " + initialConditionsChecked);
      }
    } else {
      Objects.requireNonNull(message, "message");
    }
  }

  public static ProofResult proved(Recurrence recurrence, int initialConditionsChecked) {
    return new ProofResult(recurrence, initialConditionsChecked, null, null);
  }

  public static ProofResult failed(ProofFailureReason reason, String message) {
    return new ProofResult(null, 0, Objects.requireNonNull(reason, "reason"), message);
  }

  public boolean isProved() {
    return reason == null;
  }

  public int order() {
    return recurrence == null ? 0 : recurrence.order();
  }

  public List<BigRational> coefficients() {
    return recurrence == null ? List.of() : recurrence.coefficients();
  }
}
