package io.arbor.node;

import io.arbor.exception.InvalidContentException;
import io.arbor.utils.XmlChars;

import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Immutable namespace and local name pair identifying a tag or attribute independent of any
 * prefix. The namespace is the empty string if a name isn't in any namespace.
 *
 * <p>
 * The external string form is the bracket notation {@code {namespace}local-name}, or just the
 * local name without a namespace.
 * </p>
 */
public final class QualifiedName implements Comparable<QualifiedName> {

  /** The namespace, the empty string if there is none. */
  private final String namespace;

  /** The local name. */
  private final String localName;

  private QualifiedName(final String namespace, final String localName) {
    this.namespace = XmlChars.checkText(requireNonNull(namespace));
    this.localName = XmlChars.checkNCName(requireNonNull(localName));
  }

  /**
   * Creates a name without namespace.
   *
   * @param localName the local name, which must be a valid NCName
   * @return the qualified name
   * @throws InvalidContentException if {@code localName} isn't a valid NCName
   */
  public static QualifiedName of(final String localName) {
    return new QualifiedName("", localName);
  }

  /**
   * Creates a name.
   *
   * @param namespace the namespace, the empty string for none
   * @param localName the local name, which must be a valid NCName
   * @return the qualified name
   * @throws InvalidContentException if {@code localName} isn't a valid NCName
   */
  public static QualifiedName of(final String namespace, final String localName) {
    return new QualifiedName(namespace, localName);
  }

  /**
   * Parses the bracket notation {@code {namespace}local-name} or a plain local name.
   *
   * @param universalName the name in bracket notation
   * @return the qualified name
   * @throws InvalidContentException if the notation is malformed or the local name invalid
   */
  public static QualifiedName parse(final String universalName) {
    requireNonNull(universalName);
    if (universalName.startsWith("{")) {
      final int end = universalName.indexOf('}');
      if (end < 0) {
        throw new InvalidContentException("Unterminated namespace in '%s'.", universalName);
      }
      return new QualifiedName(universalName.substring(1, end), universalName.substring(end + 1));
    }
    return new QualifiedName("", universalName);
  }

  public String getNamespace() {
    return namespace;
  }

  public String getLocalName() {
    return localName;
  }

  /**
   * Determines if the name is in a namespace.
   *
   * @return {@code true} if the namespace isn't empty
   */
  public boolean hasNamespace() {
    return !namespace.isEmpty();
  }

  /**
   * Returns a copy with another local name.
   *
   * @param localName the new local name
   * @return the new qualified name
   */
  public QualifiedName withLocalName(final String localName) {
    return new QualifiedName(namespace, localName);
  }

  /**
   * Returns a copy with another namespace.
   *
   * @param namespace the new namespace
   * @return the new qualified name
   */
  public QualifiedName withNamespace(final String namespace) {
    return new QualifiedName(namespace, localName);
  }

  /**
   * Returns the bracket notation of this name.
   *
   * @return {@code {namespace}local-name}, or the local name if there is no namespace
   */
  public String getUniversalName() {
    return namespace.isEmpty() ? localName : "{" + namespace + "}" + localName;
  }

  @Override
  public int compareTo(final QualifiedName other) {
    final int result = namespace.compareTo(other.namespace);
    return result == 0 ? localName.compareTo(other.localName) : result;
  }

  @Override
  public boolean equals(final Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof QualifiedName)) {
      return false;
    }
    final QualifiedName other = (QualifiedName) obj;
    return namespace.equals(other.namespace) && localName.equals(other.localName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(namespace, localName);
  }

  @Override
  public String toString() {
    return getUniversalName();
  }
}
