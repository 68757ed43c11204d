package io.arbor.service.xml.xpath;

import com.google.common.base.MoreObjects;
import io.arbor.node.Node;
import io.arbor.service.xml.xpath.functions.FunctionRegistry;
import org.checkerframework.checker.index.qual.Positive;

import static java.util.Objects.requireNonNull;

/**
 * The context a predicate is evaluated in: the candidate node, its 1-based position within the
 * candidates of its step and the number of candidates.
 */
public final class EvaluationContext {

  private final Node node;

  private final int position;

  private final int size;

  private final Namespaces namespaces;

  private final FunctionRegistry functions;

  private final String expression;

  /**
   * Constructor.
   *
   * @param node the context node
   * @param position the 1-based position of the node
   * @param size the number of candidates
   * @param namespaces the namespaces of the evaluation
   * @param functions the functions available
   * @param expression the expression text
   */
  public EvaluationContext(final Node node, final @Positive int position, final @Positive int size,
      final Namespaces namespaces, final FunctionRegistry functions, final String expression) {
    this.node = requireNonNull(node);
    this.position = position;
    this.size = size;
    this.namespaces = requireNonNull(namespaces);
    this.functions = requireNonNull(functions);
    this.expression = requireNonNull(expression);
  }

  public Node getNode() {
    return node;
  }

  public int getPosition() {
    return position;
  }

  public int getSize() {
    return size;
  }

  public Namespaces getNamespaces() {
    return namespaces;
  }

  public FunctionRegistry getFunctions() {
    return functions;
  }

  public String getExpression() {
    return expression;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("node", node)
                      .add("position", position)
                      .add("size", size)
                      .toString();
  }
}
