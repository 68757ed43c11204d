package io.arbor.service.xml.shredder;

import static java.util.Objects.requireNonNull;

/**
 * The end of a tag.
 *
 * @param namespace the namespace, empty for none
 * @param localName the local name
 */
public record TagEndEvent(String namespace, String localName) implements XmlEvent {

  public TagEndEvent {
    requireNonNull(namespace);
    requireNonNull(localName);
  }
}
