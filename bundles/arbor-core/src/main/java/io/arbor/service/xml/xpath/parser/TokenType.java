package io.arbor.service.xml.xpath.parser;

/**
 * <p>
 * Types of tokens of the supported XPath subset, in the order the scanner tries them. Each type
 * carries the regular expression matching it.
 * </p>
 */
public enum TokenType {
  /** Single- or double-quoted string literal. */
  STRING("\"[^\"]*\"|'[^']*'"),
  /** Integer or decimal number. */
  NUMBER("\\d+(?:\\.\\d+)?"),
  /** Name, also used for axis names, node types, functions and operator names. */
  NAME("[\\p{L}_][\\p{L}\\p{N}_.\\-]*"),
  /** Token type that represents '::'. */
  AXIS_SEPARATOR("::"),
  /** Token type that represents ':'. */
  COLON(":"),
  /** Token type that represents '//'. */
  SLASH_SLASH("//"),
  /** Token type that represents '/'. */
  SLASH("/"),
  /** Token type that represents '['. */
  OPEN_BRACKET("\\["),
  /** Token type that represents ']'. */
  CLOSE_BRACKET("\\]"),
  /** Token type that represents '('. */
  OPEN_PARENS("\\("),
  /** Token type that represents ')'. */
  CLOSE_PARENS("\\)"),
  /** Token type that represents '@'. */
  AT("@"),
  /** Token type that represents '..'. */
  DOT_DOT("\\.\\."),
  /** Token type that represents '.'. */
  DOT("\\."),
  /** Token type that represents ','. */
  COMMA(","),
  /** Token type that represents '!='. */
  NOT_EQUALS("!="),
  /** Token type that represents '='. */
  EQUALS("="),
  /** Token type that represents '&lt;='. */
  LESS_OR_EQUAL("<="),
  /** Token type that represents '&lt;'. */
  LESS("<"),
  /** Token type that represents '&gt;='. */
  GREATER_OR_EQUAL(">="),
  /** Token type that represents '&gt;'. */
  GREATER(">"),
  /** Token type that represents '*'. */
  ASTERISK("\\*"),
  /** Token type that represents '|'. */
  UNION("\\|"),
  /** Token type that represents '$'. */
  DOLLAR("\\$"),
  /** Token type that represents '+'. */
  PLUS("\\+"),
  /** Token type that represents '-'. */
  MINUS("-"),
  /** Whitespace between tokens. */
  WHITESPACE("\\s+");

  /** The regular expression. */
  private final String pattern;

  TokenType(final String pattern) {
    this.pattern = pattern;
  }

  /**
   * Get the regular expression matching tokens of this type.
   *
   * @return the regular expression
   */
  public String getPattern() {
    return pattern;
  }

  /**
   * Get the name of the capturing group of this type in the scanner's pattern.
   *
   * @return the group name
   */
  String getGroupName() {
    return name().replace("_", "");
  }
}
