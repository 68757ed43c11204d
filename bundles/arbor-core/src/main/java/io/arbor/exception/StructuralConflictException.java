package io.arbor.exception;

/**
 * Raised when a structural change would break single ownership, acyclicity or the document
 * constraints, for instance attaching an already attached node or detaching the document root.
 */
public final class StructuralConflictException extends ArborRuntimeException {

  private static final long serialVersionUID = 1L;

  public StructuralConflictException(final String message) {
    super(message);
  }

  public StructuralConflictException(final String message, final Object... args) {
    super(message, args);
  }
}
