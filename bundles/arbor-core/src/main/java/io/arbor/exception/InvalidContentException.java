package io.arbor.exception;

/**
 * Raised for invalid character data, invalid names and comment or processing instruction
 * content that cannot be serialized.
 */
public final class InvalidContentException extends ArborRuntimeException {

  private static final long serialVersionUID = 1L;

  public InvalidContentException(final String message) {
    super(message);
  }

  public InvalidContentException(final String message, final Object... args) {
    super(message, args);
  }
}
