package io.arbor.utils;

import io.arbor.exception.InvalidContentException;

import static java.util.Objects.requireNonNull;

/**
 * Convenience operations for XML-specific character and name checks.
 */
public final class XmlChars {

  /** Hidden constructor. */
  private XmlChars() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Checks if the specified code point is a valid XML 1.0 character.
   *
   * @param ch the code point to be checked
   * @return result of comparison
   */
  public static boolean isValidChar(final int ch) {
    return ch >= 0x20 && ch <= 0xD7FF || ch == 0xA || ch == 0x9 || ch == 0xD
        || ch >= 0xE000 && ch <= 0xFFFD || ch >= 0x10000 && ch <= 0x10FFFF;
  }

  /**
   * Checks if the specified code point is a name start character, as required by NCNames.
   *
   * @param ch code point
   * @return result of check
   */
  public static boolean isNCStartChar(final int ch) {
    return ch < 0x80
        ? ch >= 'A' && ch <= 'Z' || ch >= 'a' && ch <= 'z' || ch == '_'
        : ch < 0x300
            ? ch >= 0xC0 && ch != 0xD7 && ch != 0xF7
            : ch >= 0x370 && ch <= 0x37D || ch >= 0x37F && ch <= 0x1FFF
                || ch >= 0x200C && ch <= 0x200D || ch >= 0x2070 && ch <= 0x218F
                || ch >= 0x2C00 && ch <= 0x2FEF || ch >= 0x3001 && ch <= 0xD7FF
                || ch >= 0xF900 && ch <= 0xFDCF || ch >= 0xFDF0 && ch <= 0xFFFD
                || ch >= 0x10000 && ch <= 0xEFFFF;
  }

  /**
   * Checks if the specified code point may appear after the first character of an NCName.
   *
   * @param ch code point
   * @return result of check
   */
  public static boolean isNCChar(final int ch) {
    return isNCStartChar(ch) || (ch < 0x100
        ? ch >= '0' && ch <= '9' || ch == '-' || ch == '.' || ch == 0xB7
        : ch >= 0x300 && ch <= 0x36F || ch == 0x203F || ch == 0x2040);
  }

  /**
   * Checks if the specified string consists of valid XML characters only.
   *
   * @param value the string to check
   * @return {@code true} if every code point is a valid character
   */
  public static boolean isValidText(final String value) {
    return requireNonNull(value).codePoints().allMatch(XmlChars::isValidChar);
  }

  /**
   * Checks if the specified string is a valid NCName, that is a name without colons.
   *
   * @param value the string to check
   * @return result of check
   */
  public static boolean isNCName(final String value) {
    return isName(value, false);
  }

  /**
   * Checks if the specified string is a valid XML name, colons included.
   *
   * @param value the string to check
   * @return result of check
   */
  public static boolean isName(final String value) {
    return isName(value, true);
  }

  private static boolean isName(final String value, final boolean allowColon) {
    requireNonNull(value);
    if (value.isEmpty()) {
      return false;
    }
    int i = 0;
    while (i < value.length()) {
      final int ch = value.codePointAt(i);
      final boolean valid;
      if (allowColon && ch == ':') {
        valid = true;
      } else {
        valid = i == 0 ? isNCStartChar(ch) : isNCChar(ch);
      }
      if (!valid) {
        return false;
      }
      i += Character.charCount(ch);
    }
    return true;
  }

  /**
   * Ensures that {@code value} consists of valid XML characters.
   *
   * @param value the character data
   * @return {@code value}
   * @throws InvalidContentException if an invalid character is contained
   */
  public static String checkText(final String value) {
    if (!isValidText(value)) {
      throw new InvalidContentException("Invalid XML character data: '%s'", printable(value));
    }
    return value;
  }

  /**
   * Ensures that {@code value} is a valid NCName.
   *
   * @param value the name
   * @return {@code value}
   * @throws InvalidContentException if it's not a valid NCName
   */
  public static String checkNCName(final String value) {
    if (!isNCName(value)) {
      throw new InvalidContentException("Invalid XML name: '%s'", printable(value));
    }
    return value;
  }

  /**
   * Ensures that {@code value} is a valid XML name.
   *
   * @param value the name
   * @return {@code value}
   * @throws InvalidContentException if it's not a valid name
   */
  public static String checkName(final String value) {
    if (!isName(value)) {
      throw new InvalidContentException("Invalid XML name: '%s'", printable(value));
    }
    return value;
  }

  private static String printable(final String value) {
    final StringBuilder builder = new StringBuilder(value.length());
    value.codePoints().forEach(ch -> {
      if (isValidChar(ch) && ch >= 0x20) {
        builder.appendCodePoint(ch);
      } else {
        builder.append(String.format("\\u%04X", ch));
      }
    });
    return builder.toString();
  }
}
