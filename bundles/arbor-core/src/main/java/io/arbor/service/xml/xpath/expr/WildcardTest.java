package io.arbor.service.xml.xpath.expr;

import io.arbor.node.Node;
import io.arbor.node.TagNode;
import io.arbor.service.xml.xpath.Namespaces;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Matches all tags ({@code *}), or all tags of one namespace ({@code prefix:*}).
 */
public final class WildcardTest implements NodeTest {

  @Nullable
  private final String prefix;

  public WildcardTest(final @Nullable String prefix) {
    this.prefix = prefix;
  }

  public @Nullable String getPrefix() {
    return prefix;
  }

  @Override
  public boolean matches(final Node node, final Namespaces namespaces) {
    return node instanceof TagNode
        && (prefix == null
            || ((TagNode) node).getNamespace().equals(namespaces.resolveTagNamespace(prefix)));
  }

  @Override
  public String toString() {
    return prefix == null ? "*" : prefix + ":*";
  }
}
