package io.arbor.service.xml.xpath.parser;

import static java.util.Objects.requireNonNull;

/**
 * A token of an XPath expression.
 *
 * @param type the type of the token
 * @param value the matched text
 * @param offset the offset of the token in the expression
 */
public record XPathToken(TokenType type, String value, int offset) {

  public XPathToken {
    requireNonNull(type);
    requireNonNull(value);
  }

  /**
   * Determines if this token is a name with the given text.
   *
   * @param name the expected text
   * @return {@code true} if it is
   */
  public boolean isName(final String name) {
    return type == TokenType.NAME && value.equals(name);
  }

  @Override
  public String toString() {
    return type + "(" + value + ")@" + offset;
  }
}
