package io.arbor.service.xml.xpath.expr;

import io.arbor.service.xml.xpath.EvaluationContext;

import static java.util.Objects.requireNonNull;

/**
 * Tests for the existence of an attribute, an {@link AttributeValue} used as a boolean.
 */
public final class HasAttribute implements Expression {

  private final AttributeValue attribute;

  public HasAttribute(final AttributeValue attribute) {
    this.attribute = requireNonNull(attribute);
  }

  public AttributeValue getAttribute() {
    return attribute;
  }

  @Override
  public Boolean evaluate(final EvaluationContext context) {
    return attribute.evaluate(context) != null;
  }

  @Override
  public String toString() {
    return attribute.toString();
  }
}
