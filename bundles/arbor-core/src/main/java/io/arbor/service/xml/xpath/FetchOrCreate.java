package io.arbor.service.xml.xpath;

import com.google.common.collect.ImmutableList;
import io.arbor.axis.filter.DefaultFilters;
import io.arbor.exception.AmbiguousTreeException;
import io.arbor.exception.XPathEvaluationException;
import io.arbor.node.Node;
import io.arbor.node.QualifiedName;
import io.arbor.node.TagNode;
import io.arbor.service.xml.xpath.expr.AttributeValue;
import io.arbor.service.xml.xpath.expr.BooleanOperator;
import io.arbor.service.xml.xpath.expr.Expression;
import io.arbor.service.xml.xpath.expr.LocationPath;
import io.arbor.service.xml.xpath.expr.LocationStep;
import io.arbor.service.xml.xpath.expr.NameMatchTest;
import io.arbor.service.xml.xpath.expr.StringLiteral;
import io.arbor.service.xml.xpath.expr.XPathExpression;
import io.arbor.service.xml.xpath.functions.FunctionRegistry;
import io.arbor.utils.LogWrapper;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds the single tag an unambiguous expression selects and creates the missing tags of its
 * branch if there is none. Repeating a call returns the same tag without further changes. The
 * steps of an absolute path start at the root tag, like they do in queries.
 */
public final class FetchOrCreate {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER =
      new LogWrapper(LoggerFactory.getLogger(FetchOrCreate.class));

  /** Hidden constructor. */
  private FetchOrCreate() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Returns the tag selected by an expression, creating it and its missing ancestors.
   *
   * @param context the context tag
   * @param expression an expression of named child steps with optional attribute equality
   *        predicates
   * @param mapping prefix to namespace mapping or {@code null}
   * @return the existing or created tag
   * @throws XPathEvaluationException if the expression isn't unambiguous
   * @throws AmbiguousTreeException if more than one tag matches a step
   */
  public static TagNode fetchOrCreate(final TagNode context, final String expression,
      final @Nullable Map<String, String> mapping) {
    final XPathExpression compiled = XPath.compile(expression);
    if (!compiled.isUnambiguouslyLocatable()) {
      throw new XPathEvaluationException(expression,
          "Expression doesn't unambiguously locate a single tag");
    }
    final QueryResults existing = XPath.evaluate(ImmutableList.of(context), compiled, mapping,
        FunctionRegistry.getDefault());
    if (existing.size() > 1) {
      throw new AmbiguousTreeException("The expression '%s' selects %d tags.", expression,
          existing.size());
    }
    if (existing.size() == 1) {
      return (TagNode) existing.get(0);
    }
    try (DefaultFilters.Scope ignored = DefaultFilters.alter(false)) {
      return create(context, compiled, mapping);
    }
  }

  private static TagNode create(final TagNode context, final XPathExpression compiled,
      final @Nullable Map<String, String> mapping) {
    final String expression = compiled.getSource();
    final Namespaces namespaces = Namespaces.create(expression, context, mapping);
    final XPathEvaluator evaluator = new XPathEvaluator(compiled, FunctionRegistry.getDefault());
    final LocationPath path = compiled.getPaths().get(0);

    TagNode cursor = context;
    if (path.isAbsolute()) {
      while (cursor.getParent() != null) {
        cursor = cursor.getParent();
      }
    }
    for (final LocationStep step : path.getSteps()) {
      final List<Node> matches = evaluator.evaluateStep(step, cursor, namespaces);
      if (matches.size() > 1) {
        throw new AmbiguousTreeException("The step '%s' selects %d tags below %s.", step,
            matches.size(), cursor.getLocationPath());
      }
      if (matches.isEmpty()) {
        final TagNode created = createTag(step, namespaces);
        cursor.appendChildren(created);
        LOGWRAPPER.debug("Created {} at {}.", created.getQualifiedName(),
            created.getLocationPath());
        cursor = created;
      } else {
        cursor = (TagNode) matches.get(0);
      }
    }
    return cursor;
  }

  private static TagNode createTag(final LocationStep step, final Namespaces namespaces) {
    final QualifiedName name = ((NameMatchTest) step.getNodeTest()).resolve(namespaces);
    final Map<QualifiedName, String> attributes = new LinkedHashMap<>();
    for (final Expression predicate : step.getPredicates()) {
      collectAttributes(predicate, namespaces, attributes);
    }
    return new TagNode(name, attributes);
  }

  private static void collectAttributes(final Expression expression, final Namespaces namespaces,
      final Map<QualifiedName, String> attributes) {
    final BooleanOperator operator = (BooleanOperator) expression;
    if (operator.getOperator() == BooleanOperator.Operator.AND) {
      collectAttributes(operator.getLeft(), namespaces, attributes);
      collectAttributes(operator.getRight(), namespaces, attributes);
      return;
    }
    final AttributeValue attribute;
    final StringLiteral literal;
    if (operator.getLeft() instanceof AttributeValue) {
      attribute = (AttributeValue) operator.getLeft();
      literal = (StringLiteral) operator.getRight();
    } else {
      attribute = (AttributeValue) operator.getRight();
      literal = (StringLiteral) operator.getLeft();
    }
    final QualifiedName name = QualifiedName.of(
        namespaces.resolveAttributeNamespace(attribute.getPrefix()), attribute.getLocalName());
    final String previous = attributes.put(name, literal.getValue());
    if (previous != null && !previous.equals(literal.getValue())) {
      throw new XPathEvaluationException(namespaces.getExpression(),
          "Conflicting values for attribute " + name);
    }
  }
}
