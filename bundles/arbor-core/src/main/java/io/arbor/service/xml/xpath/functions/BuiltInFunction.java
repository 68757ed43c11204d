package io.arbor.service.xml.xpath.functions;

import io.arbor.exception.XPathEvaluationException;
import io.arbor.service.xml.xpath.EvaluationContext;
import io.arbor.service.xml.xpath.XPathValues;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * The functions every {@link FunctionRegistry#withBuiltIns() registry with built-ins} provides.
 * Functions which default to the context node take its full text.
 */
public enum BuiltInFunction implements XPathFunction {

  BOOLEAN("boolean", 1, 1) {
    @Override
    Object call(final EvaluationContext context, final List<@Nullable Object> arguments) {
      return XPathValues.toBoolean(arguments.get(0));
    }
  },

  CONCAT("concat", 2, Integer.MAX_VALUE) {
    @Override
    Object call(final EvaluationContext context, final List<@Nullable Object> arguments) {
      final StringBuilder builder = new StringBuilder();
      for (final Object argument : arguments) {
        builder.append(XPathValues.toString(argument));
      }
      return builder.toString();
    }
  },

  CONTAINS("contains", 2, 2) {
    @Override
    Object call(final EvaluationContext context, final List<@Nullable Object> arguments) {
      return XPathValues.toString(arguments.get(0)).contains(XPathValues.toString(arguments.get(1)));
    }
  },

  ENDS_WITH("ends-with", 2, 2) {
    @Override
    Object call(final EvaluationContext context, final List<@Nullable Object> arguments) {
      return XPathValues.toString(arguments.get(0)).endsWith(XPathValues.toString(arguments.get(1)));
    }
  },

  LAST("last", 0, 0) {
    @Override
    Object call(final EvaluationContext context, final List<@Nullable Object> arguments) {
      return (double) context.getSize();
    }
  },

  NOT("not", 1, 1) {
    @Override
    Object call(final EvaluationContext context, final List<@Nullable Object> arguments) {
      return !XPathValues.toBoolean(arguments.get(0));
    }
  },

  POSITION("position", 0, 0) {
    @Override
    Object call(final EvaluationContext context, final List<@Nullable Object> arguments) {
      return (double) context.getPosition();
    }
  },

  STARTS_WITH("starts-with", 2, 2) {
    @Override
    Object call(final EvaluationContext context, final List<@Nullable Object> arguments) {
      return XPathValues.toString(arguments.get(0))
                        .startsWith(XPathValues.toString(arguments.get(1)));
    }
  },

  STRING_LENGTH("string-length", 0, 1) {
    @Override
    Object call(final EvaluationContext context, final List<@Nullable Object> arguments) {
      final String text = arguments.isEmpty()
          ? context.getNode().getFullText()
          : XPathValues.toString(arguments.get(0));
      return (double) text.codePointCount(0, text.length());
    }
  },

  NORMALIZE_SPACE("normalize-space", 0, 1) {
    @Override
    Object call(final EvaluationContext context, final List<@Nullable Object> arguments) {
      final String text = arguments.isEmpty()
          ? context.getNode().getFullText()
          : XPathValues.toString(arguments.get(0));
      return text.strip().replaceAll("[ \\t\\r\\n]+", " ");
    }
  };

  /** The name in expressions. */
  private final String functionName;

  /** Minimum number of arguments. */
  private final int minArity;

  /** Maximum number of arguments. */
  private final int maxArity;

  BuiltInFunction(final String functionName, final int minArity, final int maxArity) {
    this.functionName = functionName;
    this.minArity = minArity;
    this.maxArity = maxArity;
  }

  public String getFunctionName() {
    return functionName;
  }

  @Override
  public Object apply(final EvaluationContext context, final List<@Nullable Object> arguments) {
    final int count = arguments.size();
    if (count < minArity || count > maxArity) {
      throw new XPathEvaluationException(context.getExpression(),
          "Function '" + functionName + "' called with " + count + " arguments");
    }
    return call(context, arguments);
  }

  abstract Object call(EvaluationContext context, List<@Nullable Object> arguments);
}
