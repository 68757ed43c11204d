package io.arbor.service.xml.xpath;

import io.arbor.node.Attribute;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Conversions between the values predicates and functions work with: {@link Boolean},
 * {@link Double}, {@link String}, {@link Attribute} and {@code null} for a missing attribute.
 */
public final class XPathValues {

  /** Hidden constructor. */
  private XPathValues() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Converts a value to a boolean. Strings are true if not empty, numbers if neither zero nor NaN,
   * attributes if present.
   *
   * @param value the value
   * @return the boolean
   */
  public static boolean toBoolean(final @Nullable Object value) {
    if (value == null) {
      return false;
    }
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    if (value instanceof Double) {
      final double number = (Double) value;
      return number != 0 && !Double.isNaN(number);
    }
    if (value instanceof Attribute) {
      return true;
    }
    return !value.toString().isEmpty();
  }

  /**
   * Converts a value to a number. Strings which aren't numbers yield NaN.
   *
   * @param value the value
   * @return the number
   */
  public static double toNumber(final @Nullable Object value) {
    if (value == null) {
      return Double.NaN;
    }
    if (value instanceof Double) {
      return (Double) value;
    }
    if (value instanceof Boolean) {
      return (Boolean) value ? 1 : 0;
    }
    final String text = toString(value).strip();
    if (text.isEmpty()) {
      return Double.NaN;
    }
    try {
      return Double.parseDouble(text);
    } catch (final NumberFormatException e) {
      return Double.NaN;
    }
  }

  /**
   * Converts a value to a string. Integral numbers have no fraction digits.
   *
   * @param value the value
   * @return the string
   */
  public static String toString(final @Nullable Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof Attribute) {
      return ((Attribute) value).getValue();
    }
    if (value instanceof Double) {
      return toString(((Double) value).doubleValue());
    }
    return value.toString();
  }

  /**
   * Converts a number to a string. Integral numbers have no fraction digits.
   *
   * @param number the number
   * @return the string
   */
  public static String toString(final double number) {
    if (Double.isNaN(number)) {
      return "NaN";
    }
    if (Double.isInfinite(number)) {
      return number > 0 ? "Infinity" : "-Infinity";
    }
    if (number == Math.rint(number) && Math.abs(number) < 1e15) {
      return Long.toString((long) number);
    }
    return Double.toString(number);
  }
}
