package io.arbor.service.xml.xpath.expr;

import com.google.common.collect.ImmutableList;
import io.arbor.exception.XPathEvaluationException;
import io.arbor.service.xml.xpath.EvaluationContext;
import io.arbor.service.xml.xpath.functions.XPathFunction;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * A call of a function of the {@link io.arbor.service.xml.xpath.functions.FunctionRegistry} the
 * expression is evaluated with.
 */
public final class FunctionCall implements Expression {

  private final String name;

  private final List<Expression> arguments;

  public FunctionCall(final String name, final List<Expression> arguments) {
    this.name = requireNonNull(name);
    this.arguments = ImmutableList.copyOf(arguments);
  }

  public String getName() {
    return name;
  }

  public List<Expression> getArguments() {
    return arguments;
  }

  /**
   * Evaluates the arguments and applies the function.
   *
   * @throws XPathEvaluationException if no function with the name is registered
   */
  @Override
  public Object evaluate(final EvaluationContext context) {
    final XPathFunction function = context.getFunctions().get(name);
    if (function == null) {
      throw new XPathEvaluationException(context.getExpression(), "Unknown function '" + name + "'");
    }
    final List<Object> values = new ArrayList<>(arguments.size());
    for (final Expression argument : arguments) {
      values.add(argument.evaluate(context));
    }
    return function.apply(context, values);
  }

  @Override
  public String toString() {
    return name + arguments.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
  }
}
