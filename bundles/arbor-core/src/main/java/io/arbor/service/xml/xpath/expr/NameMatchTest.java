package io.arbor.service.xml.xpath.expr;

import io.arbor.node.Node;
import io.arbor.node.QualifiedName;
import io.arbor.node.TagNode;
import io.arbor.service.xml.xpath.Namespaces;
import org.checkerframework.checker.nullness.qual.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Matches tags by local name and namespace. An unprefixed name is in the default namespace of the
 * evaluation.
 */
public final class NameMatchTest implements NodeTest {

  @Nullable
  private final String prefix;

  private final String localName;

  public NameMatchTest(final @Nullable String prefix, final String localName) {
    this.prefix = prefix;
    this.localName = requireNonNull(localName);
  }

  public @Nullable String getPrefix() {
    return prefix;
  }

  public String getLocalName() {
    return localName;
  }

  /**
   * Resolves the name this test matches.
   *
   * @param namespaces the namespaces to resolve the prefix with
   * @return the qualified name
   */
  public QualifiedName resolve(final Namespaces namespaces) {
    return QualifiedName.of(namespaces.resolveTagNamespace(prefix), localName);
  }

  @Override
  public boolean matches(final Node node, final Namespaces namespaces) {
    if (!(node instanceof TagNode)) {
      return false;
    }
    final TagNode tag = (TagNode) node;
    return tag.getLocalName().equals(localName)
        && tag.getNamespace().equals(namespaces.resolveTagNamespace(prefix));
  }

  @Override
  public String toString() {
    return prefix == null ? localName : prefix + ":" + localName;
  }
}
