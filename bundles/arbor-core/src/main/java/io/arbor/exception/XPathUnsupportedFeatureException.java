package io.arbor.exception;

import org.checkerframework.checker.index.qual.NonNegative;

import static java.util.Objects.requireNonNull;

/**
 * Raised for constructs of XPath 1.0 which are recognized but deliberately not implemented, for
 * instance the attribute axis outside of predicates.
 */
public final class XPathUnsupportedFeatureException extends XPathException {

  private static final long serialVersionUID = 1L;

  /** Offset into the expression. */
  private final int offset;

  /** Name of the unsupported construct. */
  private final String construct;

  /**
   * Constructor.
   *
   * @param expression the expression text
   * @param offset the offset of the construct
   * @param construct a description of the unsupported construct
   */
  public XPathUnsupportedFeatureException(final String expression, final @NonNegative int offset,
      final String construct) {
    super(expression, String.format("Unsupported XPath construct '%s' at offset %d: '%s'",
        requireNonNull(construct), offset, excerpt(expression, offset)));
    this.offset = offset;
    this.construct = construct;
  }

  public int getOffset() {
    return offset;
  }

  public String getConstruct() {
    return construct;
  }
}
