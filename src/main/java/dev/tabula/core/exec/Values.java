/* Tabula © 2025 Tabula Devs — MIT */
package dev.tabula.core.exec;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Numeric widening/narrowing for loosely typed key arguments such as {@code get(User.class, 1)}.
 *
 * <p>Conversions are exact: a key that cannot be represented by the column type is rejected with
 * {@link IllegalArgumentException} instead of being bound as a different value.
 */
final class Values {

  private Values() {}

  static Object coerce(Object value, Class<?> target) {
    if (!(value instanceof Number number) || target.isInstance(value)) {
      return value;
    }
    if (target == Long.class || target == long.class) {
      return exactLong(number, target);
    }
    if (target == Integer.class || target == int.class) {
      return (int) checkRange(number, target, Integer.MIN_VALUE, Integer.MAX_VALUE);
    }
    if (target == Short.class || target == short.class) {
      return (short) checkRange(number, target, Short.MIN_VALUE, Short.MAX_VALUE);
    }
    if (target == Byte.class || target == byte.class) {
      return (byte) checkRange(number, target, Byte.MIN_VALUE, Byte.MAX_VALUE);
    }
    if (target == Double.class || target == double.class) {
      return number.doubleValue();
    }
    if (target == Float.class || target == float.class) {
      return number.floatValue();
    }
    return value;
  }

  private static long checkRange(Number number, Class<?> target, long min, long max) {
    long exact = exactLong(number, target);
    if (exact < min || exact > max) {
      throw doesNotFit(number, target);
    }
    return exact;
  }

  private static long exactLong(Number number, Class<?> target) {
    if (number instanceof Double || number instanceof Float) {
      double d = number.doubleValue();
      // 2^63 itself is not representable as a long
      if (Double.isNaN(d) || d != Math.rint(d) || d < -0x1p63 || d >= 0x1p63) {
        throw doesNotFit(number, target);
      }
      return (long) d;
    }
    try {
      if (number instanceof BigInteger big) {
        return big.longValueExact();
      }
      if (number instanceof BigDecimal big) {
        return big.longValueExact();
      }
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException(
          "key value " + number + " does not fit " + target.getSimpleName(), e);
    }
    return number.longValue();
  }

  private static IllegalArgumentException doesNotFit(Number number, Class<?> target) {
    return new IllegalArgumentException(
        "key value " + number + " does not fit " + target.getSimpleName());
  }
}
