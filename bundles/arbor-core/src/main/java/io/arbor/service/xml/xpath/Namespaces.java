package io.arbor.service.xml.xpath;

import com.google.common.collect.ImmutableMap;
import io.arbor.exception.XPathEvaluationException;
import io.arbor.node.Node;
import io.arbor.node.TagNode;
import io.arbor.settings.Constants;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Resolves prefixes of an expression to namespaces. The empty prefix denotes the default namespace
 * of unprefixed tag names, which falls back to the namespace of the start node of an evaluation.
 */
public final class Namespaces {

  /** The expression text, for error messages. */
  private final String expression;

  /** Prefix to namespace mapping. */
  private final Map<String, String> mapping;

  /** The namespace of unprefixed tag names. */
  private final String defaultNamespace;

  private Namespaces(final String expression, final Map<String, String> mapping,
      final String defaultNamespace) {
    this.expression = expression;
    this.mapping = mapping;
    this.defaultNamespace = defaultNamespace;
  }

  /**
   * Creates the namespaces of an evaluation.
   *
   * @param expression the expression text
   * @param start the node the evaluation starts at
   * @param mapping prefix to namespace mapping or {@code null}
   * @return the namespaces
   */
  public static Namespaces create(final String expression, final Node start,
      final @Nullable Map<String, String> mapping) {
    requireNonNull(expression);
    requireNonNull(start);
    final Map<String, String> copy = mapping == null ? ImmutableMap.of() : ImmutableMap.copyOf(mapping);
    String defaultNamespace = copy.get("");
    if (defaultNamespace == null) {
      final TagNode tag = start instanceof TagNode ? (TagNode) start : start.getParent();
      defaultNamespace = tag == null ? "" : tag.getNamespace();
    }
    return new Namespaces(expression, copy, defaultNamespace);
  }

  public String getExpression() {
    return expression;
  }

  public String getDefaultNamespace() {
    return defaultNamespace;
  }

  /**
   * Resolves the prefix of a tag name.
   *
   * @param prefix the prefix or {@code null} for an unprefixed name
   * @return the namespace
   * @throws XPathEvaluationException if the prefix isn't mapped
   */
  public String resolveTagNamespace(final @Nullable String prefix) {
    return prefix == null ? defaultNamespace : resolve(prefix);
  }

  /**
   * Resolves the prefix of an attribute name. Unprefixed attributes are in no namespace.
   *
   * @param prefix the prefix or {@code null} for an unprefixed name
   * @return the namespace
   * @throws XPathEvaluationException if the prefix isn't mapped
   */
  public String resolveAttributeNamespace(final @Nullable String prefix) {
    return prefix == null ? "" : resolve(prefix);
  }

  private String resolve(final String prefix) {
    final String namespace = mapping.get(prefix);
    if (namespace != null) {
      return namespace;
    }
    if (prefix.equals("xml")) {
      return Constants.XML_NAMESPACE;
    }
    throw new XPathEvaluationException(expression, "Unknown namespace prefix '" + prefix + "'");
  }
}
