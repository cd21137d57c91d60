package qseries.verify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import qseries.algebra.BigRational;
import qseries.core.TelescopingOptions;
import qseries.examples.Identities;
import qseries.examples.Identity;

final class RecurrenceCrossCheckTest {

  private static final BigRational Q = BigRational.of(1, 3);

  @Test
  void acceptsVandermondeFamily() {
    Identity vandermonde = Identities.qVandermonde();
    assertTrue(
        RecurrenceCrossCheck.check(
            vandermonde.lhs(), 1, Q, 1, 4, vandermonde.detector(), TelescopingOptions.defaults()),
        "Re-derived recurrences should annihilate direct sums for n = 1..4");
  }

  @Test
  void directSumsMatchClosedForms() {
    for (Identity identity : Identities.all()) {
      for (int n = 0; n <= 4; n++) {
        assertEquals(
            identity.rhsAt(Q).apply(n),
            DefiniteSums.sum(identity.lhs().apply(n), Q, 100),
            identity.name() + " at n=" + n);
      }
    }
  }
}
