/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import java.math.BigInteger;
import org.junit.jupiter.api.Test;

class ValuesTest {

  @Test
  void widensAndNarrowsWithoutLoss() {
    assertEquals(7L, Values.coerce(7, Long.class));
    assertEquals(7, Values.coerce(7L, int.class));
    assertEquals((short) -3, Values.coerce(-3L, Short.class));
    assertEquals((byte) 127, Values.coerce(127, byte.class));
    assertEquals(2, Values.coerce(2.0d, Integer.class));
    assertEquals(5L, Values.coerce(new BigDecimal("5.000"), Long.class));
    assertEquals(1.5d, Values.coerce(1.5f, Double.class));
  }

  @Test
  void nonNumbersAndMatchingTypesPassThrough() {
    assertEquals("a", Values.coerce("a", Long.class));
    Long same = 9L;
    assertEquals(same, Values.coerce(same, Long.class));
  }

  @Test
  void rejectsValuesThatWouldChange() {
    assertThrows(IllegalArgumentException.class, () -> Values.coerce(4294967297L, Integer.class));
    assertThrows(IllegalArgumentException.class, () -> Values.coerce(1.9d, Integer.class));
    assertThrows(IllegalArgumentException.class, () -> Values.coerce(0.5f, long.class));
    assertThrows(IllegalArgumentException.class, () -> Values.coerce(Double.NaN, Long.class));
    assertThrows(IllegalArgumentException.class, () -> Values.coerce(9.3e18d, Long.class));
    assertThrows(IllegalArgumentException.class, () -> Values.coerce(128, Byte.class));
    assertThrows(IllegalArgumentException.class, () -> Values.coerce(40000, short.class));
    assertThrows(
        IllegalArgumentException.class,
        () -> Values.coerce(BigInteger.ONE.shiftLeft(64), Long.class));
  }
}
