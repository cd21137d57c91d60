package qseries.core;

import java.util.Objects;
import qseries.algebra.BigRational;

/** A q-hypergeometric solution {@code y(n+1)/y(n) = ratio} of a constant recurrence. */
public record PetkovsekSolution(BigRational ratio, ClosedForm closedForm) {

  public PetkovsekSolution {
    Objects.requireNonNull(ratio, "ratio");
  }

  public boolean hasClosedForm() {
    return closedForm != null;
  }
}
