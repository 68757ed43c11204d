package io.arbor.node;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import io.arbor.exception.StructuralConflictException;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Insertion-ordered attributes of one {@link TagNode}, keyed by qualified name.
 */
public final class Attributes implements Iterable<Attribute> {

  /** The owning tag. */
  private final TagNode node;

  /** The attributes. */
  private Map<QualifiedName, Attribute> attributes = new LinkedHashMap<>();

  Attributes(final TagNode node) {
    this.node = requireNonNull(node);
  }

  public TagNode getNode() {
    return node;
  }

  public int size() {
    return attributes.size();
  }

  public boolean isEmpty() {
    return attributes.isEmpty();
  }

  public boolean contains(final QualifiedName name) {
    return attributes.containsKey(requireNonNull(name));
  }

  public @Nullable Attribute get(final QualifiedName name) {
    return attributes.get(requireNonNull(name));
  }

  /**
   * Get an attribute.
   *
   * @param universalName the name in bracket notation
   * @return the attribute or {@code null}
   */
  public @Nullable Attribute get(final String universalName) {
    return get(QualifiedName.parse(universalName));
  }

  public @Nullable Attribute get(final String namespace, final String localName) {
    return get(QualifiedName.of(namespace, localName));
  }

  /**
   * Get the value of an attribute.
   *
   * @param universalName the name in bracket notation
   * @return the value or {@code null} if there is no such attribute
   */
  public @Nullable String getValue(final String universalName) {
    final Attribute attribute = get(universalName);
    return attribute == null ? null : attribute.getValue();
  }

  /**
   * Sets the value of an attribute, which is added if it doesn't exist.
   *
   * @param name the name
   * @param value the value
   * @return the attribute
   */
  public Attribute set(final QualifiedName name, final String value) {
    final Attribute existing = attributes.get(requireNonNull(name));
    if (existing != null) {
      existing.setValue(value);
      return existing;
    }
    final Attribute attribute = new Attribute(this, name, value);
    attributes.put(name, attribute);
    return attribute;
  }

  /**
   * Sets the value of an attribute, which is added if it doesn't exist.
   *
   * @param universalName the name in bracket notation
   * @param value the value
   * @return the attribute
   */
  public Attribute set(final String universalName, final String value) {
    return set(QualifiedName.parse(universalName), value);
  }

  /**
   * Removes an attribute.
   *
   * @param name the name
   * @return the removed attribute or {@code null} if there was none
   */
  public @Nullable Attribute remove(final QualifiedName name) {
    final Attribute attribute = attributes.remove(requireNonNull(name));
    if (attribute != null) {
      attribute.owner = null;
    }
    return attribute;
  }

  public @Nullable Attribute remove(final String universalName) {
    return remove(QualifiedName.parse(universalName));
  }

  /**
   * Get a snapshot of names and values.
   *
   * @return the names mapped to the values in insertion order
   */
  public ImmutableMap<QualifiedName, String> asMap() {
    final ImmutableMap.Builder<QualifiedName, String> builder = ImmutableMap.builder();
    for (final Attribute attribute : attributes.values()) {
      builder.put(attribute.getQualifiedName(), attribute.getValue());
    }
    return builder.build();
  }

  @Override
  public Iterator<Attribute> iterator() {
    return Collections.unmodifiableCollection(attributes.values()).iterator();
  }

  void rename(final Attribute attribute, final QualifiedName newName) {
    final QualifiedName oldName = attribute.getQualifiedName();
    if (oldName.equals(newName)) {
      return;
    }
    if (attributes.containsKey(newName)) {
      throw new StructuralConflictException("The tag %s already has an attribute %s.",
          node.getQualifiedName(), newName);
    }
    final Map<QualifiedName, Attribute> renamed = new LinkedHashMap<>();
    for (final Map.Entry<QualifiedName, Attribute> entry : attributes.entrySet()) {
      if (entry.getValue() == attribute) {
        renamed.put(newName, attribute);
      } else {
        renamed.put(entry.getKey(), entry.getValue());
      }
    }
    attributes = renamed;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("attributes", asMap()).toString();
  }
}
