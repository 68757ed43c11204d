package io.arbor.exception;

import io.arbor.service.xml.xpath.XPathError;
import org.checkerframework.checker.index.qual.NonNegative;

import static java.util.Objects.requireNonNull;

/**
 * Raised when an expression can't be tokenized or parsed. The message names the error kind, the
 * offset and an excerpt of the text remaining at that offset.
 */
public final class XPathSyntaxException extends XPathException {

  private static final long serialVersionUID = 1L;

  /** Offset into the expression. */
  private final int offset;

  /** Kind of error. */
  private final XPathError error;

  /**
   * Constructor.
   *
   * @param expression the expression text
   * @param offset the offset of the offending character
   * @param error the kind of error
   */
  public XPathSyntaxException(final String expression, final @NonNegative int offset,
      final XPathError error) {
    super(expression, String.format("%s at offset %d: '%s'", requireNonNull(error).getMessage(), offset,
        excerpt(expression, offset)));
    this.offset = offset;
    this.error = error;
  }

  public int getOffset() {
    return offset;
  }

  public XPathError getError() {
    return error;
  }
}
