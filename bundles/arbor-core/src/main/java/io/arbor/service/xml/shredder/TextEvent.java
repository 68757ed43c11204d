package io.arbor.service.xml.shredder;

import static java.util.Objects.requireNonNull;

/**
 * Character data, possibly one of several consecutive chunks.
 *
 * @param content the characters
 */
public record TextEvent(String content) implements XmlEvent {

  public TextEvent {
    requireNonNull(content);
  }
}
