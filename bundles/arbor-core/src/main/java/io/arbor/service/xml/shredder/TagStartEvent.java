package io.arbor.service.xml.shredder;

import com.google.common.collect.ImmutableMap;
import io.arbor.node.QualifiedName;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * The start of a tag with its attributes.
 *
 * @param namespace the namespace, empty for none
 * @param localName the local name
 * @param attributes the attributes in document order
 */
public record TagStartEvent(String namespace, String localName,
    Map<QualifiedName, String> attributes) implements XmlEvent {

  public TagStartEvent {
    requireNonNull(namespace);
    requireNonNull(localName);
    attributes = ImmutableMap.copyOf(attributes);
  }

  public TagStartEvent(final String namespace, final String localName) {
    this(namespace, localName, ImmutableMap.of());
  }
}
