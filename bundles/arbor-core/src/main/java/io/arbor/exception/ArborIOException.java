package io.arbor.exception;

/**
 * Wraps failures of reading or writing markup text.
 */
public final class ArborIOException extends ArborRuntimeException {

  private static final long serialVersionUID = 1L;

  /**
   * Constructor.
   *
   * @param message the message
   * @param cause the underlying I/O or parser failure
   */
  public ArborIOException(final String message, final Throwable cause) {
    super(message, cause);
  }

  /**
   * Constructor.
   *
   * @param cause the underlying I/O or parser failure
   */
  public ArborIOException(final Throwable cause) {
    super(cause);
  }
}
