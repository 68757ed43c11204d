package io.arbor.node;

import com.google.common.base.MoreObjects;
import io.arbor.exception.InvalidContentException;
import io.arbor.exception.StructuralConflictException;
import io.arbor.utils.XmlChars;
import org.checkerframework.checker.nullness.qual.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * An attribute of a {@link TagNode}. Renaming an attribute re-keys the owning {@link Attributes}
 * while keeping its position.
 */
public final class Attribute {

  /** The owning collection, {@code null} once the attribute is removed. */
  @Nullable
  Attributes owner;

  /** The name. */
  private QualifiedName name;

  /** The value. */
  private String value;

  Attribute(final Attributes owner, final QualifiedName name, final String value) {
    this.owner = requireNonNull(owner);
    this.name = requireNonNull(name);
    this.value = XmlChars.checkText(value);
  }

  public QualifiedName getQualifiedName() {
    return name;
  }

  public String getLocalName() {
    return name.getLocalName();
  }

  public String getNamespace() {
    return name.getNamespace();
  }

  public String getValue() {
    return value;
  }

  /**
   * Set the value.
   *
   * @param value the new value
   * @throws InvalidContentException if {@code value} contains invalid XML characters
   */
  public void setValue(final String value) {
    this.value = XmlChars.checkText(value);
  }

  /**
   * Set the local name.
   *
   * @param localName the new local name
   * @throws StructuralConflictException if the owning tag already has an attribute with the new name
   */
  public void setLocalName(final String localName) {
    rename(name.withLocalName(localName));
  }

  /**
   * Set the namespace.
   *
   * @param namespace the new namespace, the empty string for none
   * @throws StructuralConflictException if the owning tag already has an attribute with the new name
   */
  public void setNamespace(final String namespace) {
    rename(name.withNamespace(namespace));
  }

  private void rename(final QualifiedName newName) {
    if (owner != null) {
      owner.rename(this, newName);
    }
    name = newName;
  }

  /**
   * Get the tag this attribute belongs to.
   *
   * @return the tag or {@code null} if the attribute was removed
   */
  public @Nullable TagNode getNode() {
    return owner == null ? null : owner.getNode();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("name", name).add("value", value).toString();
  }
}
