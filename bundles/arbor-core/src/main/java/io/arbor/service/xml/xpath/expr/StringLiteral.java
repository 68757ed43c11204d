package io.arbor.service.xml.xpath.expr;

import io.arbor.service.xml.xpath.EvaluationContext;

import static java.util.Objects.requireNonNull;

/**
 * A string literal.
 */
public final class StringLiteral implements Expression {

  private final String value;

  public StringLiteral(final String value) {
    this.value = requireNonNull(value);
  }

  public String getValue() {
    return value;
  }

  @Override
  public String evaluate(final EvaluationContext context) {
    return value;
  }

  @Override
  public String toString() {
    return value.indexOf('\'') >= 0 ? '"' + value + '"' : '\'' + value + '\'';
  }
}
