package io.arbor.exception;

/**
 * Root of all failures raised by Arbor. Every failure is unchecked and raised synchronously at the
 * point of the offending call; no partial mutation is rolled back.
 */
public class ArborRuntimeException extends RuntimeException {

  /** General ID. */
  private static final long serialVersionUID = 1L;

  /**
   * Constructor.
   *
   * @param message the message
   */
  public ArborRuntimeException(final String message) {
    super(message);
  }

  /**
   * Constructor taking a format string.
   *
   * @param message the message format, see {@link String#format(String, Object...)}
   * @param args the format arguments
   */
  public ArborRuntimeException(final String message, final Object... args) {
    super(String.format(message, args));
  }

  /**
   * Constructor.
   *
   * @param message the message
   * @param cause the cause
   */
  public ArborRuntimeException(final String message, final Throwable cause) {
    super(message, cause);
  }

  /**
   * Constructor.
   *
   * @param cause the cause
   */
  public ArborRuntimeException(final Throwable cause) {
    super(cause);
  }
}
