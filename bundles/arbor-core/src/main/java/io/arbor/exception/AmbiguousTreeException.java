package io.arbor.exception;

/**
 * Raised when more than one node matches where exactly one was required.
 */
public final class AmbiguousTreeException extends ArborRuntimeException {

  private static final long serialVersionUID = 1L;

  public AmbiguousTreeException(final String message) {
    super(message);
  }

  public AmbiguousTreeException(final String message, final Object... args) {
    super(message, args);
  }
}
