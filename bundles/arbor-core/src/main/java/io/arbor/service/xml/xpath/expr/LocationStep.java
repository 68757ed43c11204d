package io.arbor.service.xml.xpath.expr;

import com.google.common.collect.ImmutableList;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * One step of a location path: an axis, a node test and predicates.
 */
public final class LocationStep {

  private final AxisType axis;

  private final NodeTest nodeTest;

  private final List<Expression> predicates;

  public LocationStep(final AxisType axis, final NodeTest nodeTest,
      final List<Expression> predicates) {
    this.axis = requireNonNull(axis);
    this.nodeTest = requireNonNull(nodeTest);
    this.predicates = ImmutableList.copyOf(predicates);
  }

  public AxisType getAxis() {
    return axis;
  }

  public NodeTest getNodeTest() {
    return nodeTest;
  }

  public List<Expression> getPredicates() {
    return predicates;
  }

  /**
   * Determines if the step selects at most one child per context node when the tree is well-formed
   * for it: a named child step whose predicates only compare attributes with literals.
   *
   * @return {@code true} if it does
   */
  public boolean isUnambiguouslyLocatable() {
    if (axis != AxisType.CHILD || !(nodeTest instanceof NameMatchTest)) {
      return false;
    }
    for (final Expression predicate : predicates) {
      if (!isAttributeEquality(predicate)) {
        return false;
      }
    }
    return true;
  }

  private static boolean isAttributeEquality(final Expression expression) {
    if (!(expression instanceof BooleanOperator)) {
      return false;
    }
    final BooleanOperator operator = (BooleanOperator) expression;
    switch (operator.getOperator()) {
      case AND:
        return isAttributeEquality(operator.getLeft()) && isAttributeEquality(operator.getRight());
      case EQUALS:
        return operator.getLeft() instanceof AttributeValue
            && operator.getRight() instanceof StringLiteral
            || operator.getLeft() instanceof StringLiteral
                && operator.getRight() instanceof AttributeValue;
      default:
        return false;
    }
  }

  @Override
  public String toString() {
    final StringBuilder builder = new StringBuilder();
    builder.append(axis.getAxisName()).append("::").append(nodeTest);
    for (final Expression predicate : predicates) {
      builder.append('[').append(predicate).append(']');
    }
    return builder.toString();
  }
}
