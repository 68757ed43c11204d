package io.arbor.service.xml.xpath.expr;

import io.arbor.service.xml.xpath.EvaluationContext;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An expression within a predicate.
 *
 * <p>
 * Evaluation yields a {@link Boolean}, a {@link Double}, a {@link String}, an
 * {@link io.arbor.node.Attribute}, or {@code null} for a missing attribute.
 * </p>
 */
public interface Expression {

  /**
   * Evaluates the expression.
   *
   * @param context the context node with its position and size
   * @return the value
   */
  @Nullable
  Object evaluate(EvaluationContext context);
}
