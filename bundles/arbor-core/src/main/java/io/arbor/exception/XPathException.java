package io.arbor.exception;

import static java.util.Objects.requireNonNull;

/**
 * Base class of failures related to XPath expressions.
 */
public abstract class XPathException extends ArborRuntimeException {

  private static final long serialVersionUID = 1L;

  /** Maximum number of characters of the remaining expression quoted in messages. */
  private static final int EXCERPT_LENGTH = 20;

  /** The expression text. */
  private final String expression;

  /**
   * Constructor.
   *
   * @param expression the expression text
   * @param message the message
   */
  protected XPathException(final String expression, final String message) {
    super(message);
    this.expression = requireNonNull(expression);
  }

  /**
   * Get the expression which caused the failure.
   *
   * @return the expression text
   */
  public String getExpression() {
    return expression;
  }

  /**
   * Returns the text of {@code expression} starting at {@code offset}, cut after
   * {@value #EXCERPT_LENGTH} characters.
   *
   * @param expression the expression text
   * @param offset the offset of the excerpt
   * @return the excerpt, ending with an ellipsis if it is cut
   */
  public static String excerpt(final String expression, final int offset) {
    final int start = Math.max(0, Math.min(offset, expression.length()));
    final String rest = expression.substring(start);
    if (rest.length() > EXCERPT_LENGTH) {
      return rest.substring(0, EXCERPT_LENGTH) + "…";
    }
    return rest;
  }
}
