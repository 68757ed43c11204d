package io.arbor.service.xml.shredder;

import static java.util.Objects.requireNonNull;

/**
 * A processing instruction.
 *
 * @param target the target
 * @param content the data following the target
 */
public record ProcessingInstructionEvent(String target, String content) implements XmlEvent {

  public ProcessingInstructionEvent {
    requireNonNull(target);
    requireNonNull(content);
  }
}
