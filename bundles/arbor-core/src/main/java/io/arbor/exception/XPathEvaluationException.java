package io.arbor.exception;

/**
 * Raised when a syntactically valid expression fails at run time, e.g. because of an unknown
 * function or namespace prefix, or because it can't be used to construct nodes.
 */
public final class XPathEvaluationException extends XPathException {

  private static final long serialVersionUID = 1L;

  /**
   * Constructor.
   *
   * @param expression the expression text
   * @param message the message
   */
  public XPathEvaluationException(final String expression, final String message) {
    super(expression, String.format("%s in '%s'", message, expression));
  }
}
