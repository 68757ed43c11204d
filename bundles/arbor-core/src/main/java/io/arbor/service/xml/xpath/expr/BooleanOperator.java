package io.arbor.service.xml.xpath.expr;

import io.arbor.node.Attribute;
import io.arbor.service.xml.xpath.EvaluationContext;
import io.arbor.service.xml.xpath.XPathValues;
import org.checkerframework.checker.nullness.qual.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A logical connective or a comparison of two operands.
 */
public final class BooleanOperator implements Expression {

  /** The operators. */
  public enum Operator {
    OR("or"),
    AND("and"),
    EQUALS("="),
    NOT_EQUALS("!="),
    LESS("<"),
    LESS_OR_EQUAL("<="),
    GREATER(">"),
    GREATER_OR_EQUAL(">=");

    private final String symbol;

    Operator(final String symbol) {
      this.symbol = symbol;
    }

    public String getSymbol() {
      return symbol;
    }

    /**
     * Determines if this operator is {@code and} or {@code or}.
     *
     * @return {@code true} for a logical connective, {@code false} for a comparison
     */
    public boolean isLogical() {
      return this == OR || this == AND;
    }
  }

  private final Operator operator;

  private final Expression left;

  private final Expression right;

  public BooleanOperator(final Operator operator, final Expression left, final Expression right) {
    this.operator = requireNonNull(operator);
    this.left = requireNonNull(left);
    this.right = requireNonNull(right);
  }

  public Operator getOperator() {
    return operator;
  }

  public Expression getLeft() {
    return left;
  }

  public Expression getRight() {
    return right;
  }

  @Override
  public Boolean evaluate(final EvaluationContext context) {
    switch (operator) {
      case OR:
        return XPathValues.toBoolean(left.evaluate(context))
            || XPathValues.toBoolean(right.evaluate(context));
      case AND:
        return XPathValues.toBoolean(left.evaluate(context))
            && XPathValues.toBoolean(right.evaluate(context));
      default:
        return compare(left.evaluate(context), right.evaluate(context));
    }
  }

  private boolean compare(final @Nullable Object leftValue, final @Nullable Object rightValue) {
    // A missing attribute never compares.
    if (leftValue == null || rightValue == null) {
      return false;
    }
    final Object first = leftValue instanceof Attribute ? ((Attribute) leftValue).getValue() : leftValue;
    final Object second =
        rightValue instanceof Attribute ? ((Attribute) rightValue).getValue() : rightValue;

    switch (operator) {
      case EQUALS:
        return equal(first, second);
      case NOT_EQUALS:
        return !equal(first, second);
      default:
    }

    final double a = XPathValues.toNumber(first);
    final double b = XPathValues.toNumber(second);
    switch (operator) {
      case LESS:
        return a < b;
      case LESS_OR_EQUAL:
        return a <= b;
      case GREATER:
        return a > b;
      case GREATER_OR_EQUAL:
        return a >= b;
      default:
        throw new IllegalStateException("Unexpected operator: " + operator);
    }
  }

  private static boolean equal(final Object first, final Object second) {
    if (first instanceof Boolean || second instanceof Boolean) {
      return XPathValues.toBoolean(first) == XPathValues.toBoolean(second);
    }
    if (first instanceof Double || second instanceof Double) {
      return XPathValues.toNumber(first) == XPathValues.toNumber(second);
    }
    return XPathValues.toString(first).equals(XPathValues.toString(second));
  }

  @Override
  public String toString() {
    return operand(left) + " " + operator.getSymbol() + " " + operand(right);
  }

  private String operand(final Expression operand) {
    if (operand instanceof BooleanOperator) {
      final Operator inner = ((BooleanOperator) operand).operator;
      if (!operator.isLogical() || (operator == Operator.AND && inner == Operator.OR)) {
        return "(" + operand + ")";
      }
    }
    return operand.toString();
  }
}
