package io.arbor.service.xml.xpath;

import com.google.common.collect.ImmutableList;
import io.arbor.node.Node;
import io.arbor.service.xml.xpath.expr.XPathExpression;
import io.arbor.service.xml.xpath.functions.FunctionRegistry;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Entry point for evaluating expressions of the supported XPath subset against the node model.
 *
 * <pre>
 * QueryResults items = XPath.evaluate(root, "//item[@state='open']", null);
 * </pre>
 */
public final class XPath {

  /** Hidden constructor. */
  private XPath() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Compiles an expression with the shared {@link XPathCompiler}.
   *
   * @param expression the expression text
   * @return the compiled expression
   */
  public static XPathExpression compile(final String expression) {
    return XPathCompiler.getDefault().compile(expression);
  }

  public static QueryResults evaluate(final Node node, final String expression) {
    return evaluate(node, expression, null);
  }

  /**
   * Evaluates an expression with a node as context.
   *
   * @param node the context node
   * @param expression the expression text
   * @param namespaces prefix to namespace mapping or {@code null}, the empty prefix sets the
   *        namespace of unprefixed tag names
   * @return the selected nodes
   * @throws io.arbor.exception.XPathException if the expression can't be compiled or evaluated
   */
  public static QueryResults evaluate(final Node node, final String expression,
      final @Nullable Map<String, String> namespaces) {
    return evaluate(ImmutableList.of(requireNonNull(node)), expression, namespaces);
  }

  /**
   * Evaluates an expression with each of the given nodes as context and merges the results.
   *
   * @param nodes the context nodes
   * @param expression the expression text
   * @param namespaces prefix to namespace mapping or {@code null}
   * @return the selected nodes without duplicates
   * @throws io.arbor.exception.XPathException if the expression can't be compiled or evaluated
   */
  public static QueryResults evaluate(final Iterable<Node> nodes, final String expression,
      final @Nullable Map<String, String> namespaces) {
    return evaluate(nodes, compile(expression), namespaces, FunctionRegistry.getDefault());
  }

  /**
   * Evaluates a compiled expression with custom functions.
   *
   * @param nodes the context nodes
   * @param expression the compiled expression
   * @param namespaces prefix to namespace mapping or {@code null}
   * @param functions the functions predicates may call
   * @return the selected nodes without duplicates
   * @throws io.arbor.exception.XPathEvaluationException if the expression can't be evaluated
   */
  public static QueryResults evaluate(final Iterable<Node> nodes, final XPathExpression expression,
      final @Nullable Map<String, String> namespaces, final FunctionRegistry functions) {
    requireNonNull(nodes);
    return new XPathEvaluator(expression, functions).evaluate(nodes, namespaces);
  }
}
