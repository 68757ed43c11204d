package io.arbor.service.xml.xpath.expr;

import io.arbor.service.xml.xpath.EvaluationContext;
import io.arbor.service.xml.xpath.XPathValues;

/**
 * A number literal. Used as a whole predicate it is a positional test.
 */
public final class NumberLiteral implements Expression {

  private final double value;

  public NumberLiteral(final double value) {
    this.value = value;
  }

  public double getValue() {
    return value;
  }

  @Override
  public Double evaluate(final EvaluationContext context) {
    return value;
  }

  @Override
  public String toString() {
    return XPathValues.toString(value);
  }
}
