package io.arbor.service.xml.shredder;

/**
 * An event of a markup stream, consumed by the {@link TreeBuilder}.
 */
public interface XmlEvent {
}
