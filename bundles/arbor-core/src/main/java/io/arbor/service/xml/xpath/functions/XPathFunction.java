package io.arbor.service.xml.xpath.functions;

import io.arbor.service.xml.xpath.EvaluationContext;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * A function callable from predicates.
 */
@FunctionalInterface
public interface XPathFunction {

  /**
   * Applies the function.
   *
   * @param context the context of the predicate the call is part of
   * @param arguments the evaluated arguments, {@code null} for missing attributes
   * @return a {@link Boolean}, {@link Double} or {@link String}
   * @throws io.arbor.exception.XPathEvaluationException if the arguments are not acceptable
   */
  Object apply(EvaluationContext context, List<@Nullable Object> arguments);
}
