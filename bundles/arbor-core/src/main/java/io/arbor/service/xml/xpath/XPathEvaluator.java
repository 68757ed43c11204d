package io.arbor.service.xml.xpath;

import com.google.common.collect.Sets;
import io.arbor.api.Axis;
import io.arbor.axis.filter.DefaultFilters;
import io.arbor.node.DocumentNode;
import io.arbor.node.Node;
import io.arbor.node.TagNode;
import io.arbor.service.xml.xpath.expr.Expression;
import io.arbor.service.xml.xpath.expr.LocationPath;
import io.arbor.service.xml.xpath.expr.LocationStep;
import io.arbor.service.xml.xpath.expr.XPathExpression;
import io.arbor.service.xml.xpath.functions.FunctionRegistry;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Evaluates compiled expressions step by step. Each step maps every node of the current context
 * to the candidates of its axis which pass the node test and the predicates. The nodes of a step
 * and of a union are merged in the order they are found, without duplicates.
 *
 * <p>
 * The first step of an absolute path is evaluated with the topmost tag of the context node's tree
 * as its context, so {@code /a} selects the {@code a} children of the root tag.
 * </p>
 *
 * <p>
 * Evaluation runs without default filters, so node type tests see comments and processing
 * instructions.
 * </p>
 */
final class XPathEvaluator {

  /** The expression. */
  private final XPathExpression expression;

  /** The available functions. */
  private final FunctionRegistry functions;

  /**
   * Constructor.
   *
   * @param expression the compiled expression
   * @param functions the functions predicates may call
   */
  XPathEvaluator(final XPathExpression expression, final FunctionRegistry functions) {
    this.expression = requireNonNull(expression);
    this.functions = requireNonNull(functions);
  }

  /**
   * Evaluates the expression for each start node.
   *
   * @param startNodes the context nodes
   * @param mapping prefix to namespace mapping or {@code null}
   * @return the selected nodes
   */
  QueryResults evaluate(final Iterable<Node> startNodes,
      final @Nullable Map<String, String> mapping) {
    try (DefaultFilters.Scope ignored = DefaultFilters.alter(false)) {
      final Set<Node> seen = Sets.newIdentityHashSet();
      final List<Node> results = new ArrayList<>();
      for (final Node start : startNodes) {
        final Namespaces namespaces = Namespaces.create(expression.getSource(), start, mapping);
        for (final LocationPath path : expression.getPaths()) {
          for (final Node node : evaluatePath(path, start, namespaces)) {
            if (!(node instanceof DocumentNode) && seen.add(node)) {
              results.add(node);
            }
          }
        }
      }
      return new QueryResults(results);
    }
  }

  private List<Node> evaluatePath(final LocationPath path, final Node start,
      final Namespaces namespaces) {
    List<Node> context = Collections.singletonList(path.isAbsolute() ? topmost(start) : start);
    for (final LocationStep step : path.getSteps()) {
      final Set<Node> seen = Sets.newIdentityHashSet();
      final List<Node> next = new ArrayList<>();
      for (final Node node : context) {
        for (final Node selected : evaluateStep(step, node, namespaces)) {
          if (seen.add(selected)) {
            next.add(selected);
          }
        }
      }
      if (next.isEmpty()) {
        return next;
      }
      context = next;
    }
    return context;
  }

  /**
   * Get the node absolute paths start at.
   *
   * @param node a node of the tree
   * @return the topmost node which has no parent tag, the root tag for a document
   */
  private static Node topmost(final Node node) {
    if (node instanceof DocumentNode) {
      final TagNode root = ((DocumentNode) node).getRootNode();
      return root == null ? node : root;
    }
    Node top = node;
    while (top.getParent() != null) {
      top = top.getParent();
    }
    return top;
  }

  /**
   * Selects the nodes of one step for one context node.
   *
   * @param step the step
   * @param node the context node
   * @param namespaces the namespaces of the evaluation
   * @return the selected nodes in axis order
   */
  List<Node> evaluateStep(final LocationStep step, final Node node, final Namespaces namespaces) {
    List<Node> candidates = new ArrayList<>();
    final Axis axis = step.getAxis().createAxis(node);
    for (final Node candidate : axis) {
      if (step.getNodeTest().matches(candidate, namespaces)) {
        candidates.add(candidate);
      }
    }
    for (final Expression predicate : step.getPredicates()) {
      final List<Node> passed = new ArrayList<>(candidates.size());
      final int size = candidates.size();
      for (int i = 0; i < size; i++) {
        final Node candidate = candidates.get(i);
        final EvaluationContext context = new EvaluationContext(candidate, i + 1, size, namespaces,
            functions, expression.getSource());
        if (matches(predicate.evaluate(context), i + 1)) {
          passed.add(candidate);
        }
      }
      candidates = passed;
    }
    return candidates;
  }

  private static boolean matches(final @Nullable Object value, final int position) {
    if (value instanceof Double) {
      return (Double) value == position;
    }
    return XPathValues.toBoolean(value);
  }
}
