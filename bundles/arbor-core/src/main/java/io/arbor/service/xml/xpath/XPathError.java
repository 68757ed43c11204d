package io.arbor.service.xml.xpath;

/**
 * Kinds of syntax errors raised while tokenizing or parsing an XPath expression.
 */
public enum XPathError {

  /** Empty input, or an empty operand of a union. */
  MISSING_LOCATION_PATH("Missing location path"),

  /** A name followed by {@code ::} which is not an axis name. */
  INVALID_AXIS("Invalid axis"),

  /** A location step without a node test. */
  MISSING_NODE_TEST("Missing node test"),

  /** An opening {@code [} without its closing counterpart. */
  UNTERMINATED_BRACKET("Unterminated bracket"),

  /** An opening {@code (} without its closing counterpart. */
  UNTERMINATED_PARENTHESIS("Unterminated parenthesis"),

  /** A string literal without its closing quote. */
  UNTERMINATED_STRING("Unterminated string literal"),

  /** A predicate body which is not a recognized expression. */
  INVALID_PREDICATE("Invalid predicate"),

  /** A character sequence no token matches. */
  UNRECOGNIZED_TOKEN("Unrecognized token"),

  /** Input left over after a complete expression. */
  UNEXPECTED_TOKEN("Unexpected token");

  /** Error message. */
  private final String message;

  XPathError(final String message) {
    this.message = message;
  }

  /**
   * Returns the error message of the respective error.
   *
   * @return error message
   */
  public String getMessage() {
    return message;
  }
}
