package io.arbor.service.xml.xpath.expr;

import io.arbor.node.Attribute;
import io.arbor.node.TagNode;
import io.arbor.service.xml.xpath.EvaluationContext;
import org.checkerframework.checker.nullness.qual.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Selects an attribute of the context node ({@code @name}). Unprefixed attribute names are in no
 * namespace.
 */
public final class AttributeValue implements Expression {

  @Nullable
  private final String prefix;

  private final String localName;

  public AttributeValue(final @Nullable String prefix, final String localName) {
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
   * Returns the attribute of the context node.
   *
   * @param context the evaluation context
   * @return the attribute or {@code null} if the context node doesn't have it
   */
  @Override
  public @Nullable Attribute evaluate(final EvaluationContext context) {
    if (!(context.getNode() instanceof TagNode)) {
      return null;
    }
    final String namespace = context.getNamespaces().resolveAttributeNamespace(prefix);
    return ((TagNode) context.getNode()).getAttributes().get(namespace, localName);
  }

  @Override
  public String toString() {
    return prefix == null ? "@" + localName : "@" + prefix + ":" + localName;
  }
}
