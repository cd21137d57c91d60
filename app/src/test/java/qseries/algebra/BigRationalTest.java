package qseries.algebra;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;

final class BigRationalTest {

  @Test
  void normalisesSignAndLowestTerms() {
    BigRational value = BigRational.of(6, -8);
    assertEquals(BigInteger.valueOf(-3), value.numerator(), "Sign should move to the numerator");
    assertEquals(BigInteger.valueOf(4), value.denominator(), "Denominator should be reduced");
    assertEquals(BigRational.of(-3, 4), value);
  }

  @Test
  void parsesIntegersAndFractions() {
    assertEquals(BigRational.of(7), BigRational.parse("7"));
    assertEquals(BigRational.of(-1, 3), BigRational.parse(" -2/6 "));
    assertThrows(IllegalArgumentException.class, () -> BigRational.parse("1/0"));
    assertThrows(IllegalArgumentException.class, () -> BigRational.parse("abc"));
  }

  @Test
  void arithmeticIsExact() {
    BigRational third = BigRational.of(1, 3);
    BigRational sixth = BigRational.of(1, 6);
    assertEquals(BigRational.of(1, 2), third.add(sixth));
    assertEquals(sixth, third.subtract(sixth));
    assertEquals(BigRational.of(1, 18), third.multiply(sixth));
    assertEquals(BigRational.of(2), third.divide(sixth));
    assertEquals(BigRational.of(3), third.reciprocal());
    assertTrue(third.compareTo(sixth) > 0, "1/3 should compare above 1/6");
  }

  @Test
  void integerPowersAcceptNegativeExponents() {
    BigRational q = BigRational.of(1, 3);
    assertEquals(BigRational.of(1, 81), q.pow(4));
    assertEquals(BigRational.of(27), q.pow(-3));
    assertEquals(BigRational.ONE, BigRational.ZERO.pow(0));
    assertThrows(IllegalArgumentException.class, () -> BigRational.ZERO.pow(-1));
  }

  @Test
  void printsInParseableForm() {
    assertEquals("-5/7", BigRational.of(-5, 7).toString());
    assertEquals("4", BigRational.of(8, 2).toString());
    assertEquals(BigRational.of(-5, 7), BigRational.parse(BigRational.of(-5, 7).toString()));
  }
}
