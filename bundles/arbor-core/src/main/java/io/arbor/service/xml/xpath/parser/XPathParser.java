package io.arbor.service.xml.xpath.parser;

import io.arbor.exception.XPathSyntaxException;
import io.arbor.exception.XPathUnsupportedFeatureException;
import io.arbor.service.xml.xpath.XPathError;
import io.arbor.service.xml.xpath.expr.AttributeValue;
import io.arbor.service.xml.xpath.expr.AxisType;
import io.arbor.service.xml.xpath.expr.BooleanOperator;
import io.arbor.service.xml.xpath.expr.BooleanOperator.Operator;
import io.arbor.service.xml.xpath.expr.Expression;
import io.arbor.service.xml.xpath.expr.FunctionCall;
import io.arbor.service.xml.xpath.expr.HasAttribute;
import io.arbor.service.xml.xpath.expr.LocationPath;
import io.arbor.service.xml.xpath.expr.LocationStep;
import io.arbor.service.xml.xpath.expr.NameMatchTest;
import io.arbor.service.xml.xpath.expr.NodeTest;
import io.arbor.service.xml.xpath.expr.NodeTypeTest;
import io.arbor.service.xml.xpath.expr.NumberLiteral;
import io.arbor.service.xml.xpath.expr.ProcessingInstructionTest;
import io.arbor.service.xml.xpath.expr.StringLiteral;
import io.arbor.service.xml.xpath.expr.WildcardTest;
import io.arbor.service.xml.xpath.expr.XPathExpression;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * <h1>XPath Parser</h1>
 * <p>
 * Parses an expression of the supported XPath subset into an immutable syntax tree. The expression
 * is sent to the {@link XPathScanner} which categorizes the symbols by creating tokens. The parser
 * receives these tokens, skips whitespace and checks the grammar, descending recursively:
 * </p>
 *
 * <pre>
 * Expression   ::= Path ('|' Path)*
 * Path         ::= ('/' | '//')? Step (('/' | '//') Step)*
 * Step         ::= '.' | '..' | (AxisName '::')? NodeTest Predicate*
 * NodeTest     ::= '*' | NAME ':' '*' | NAME ':' NAME | NAME
 *                | ('node' | 'text' | 'comment') '(' ')'
 *                | 'processing-instruction' '(' STRING? ')'
 * Predicate    ::= '[' OrExpr ']'
 * OrExpr       ::= AndExpr ('or' AndExpr)*
 * AndExpr      ::= Comparison ('and' Comparison)*
 * Comparison   ::= Primary (('=' | '!=' | '&lt;' | '&lt;=' | '&gt;' | '&gt;=') Primary)?
 * Primary      ::= '(' OrExpr ')' | '@' NAME (':' NAME)? | STRING | NUMBER
 *                | NAME '(' (OrExpr (',' OrExpr)*)? ')'
 * </pre>
 *
 * <p>
 * Constructs of XPath 1.0 outside of this grammar which the scanner recognizes are reported with
 * an {@link XPathUnsupportedFeatureException}, all other failures with an
 * {@link XPathSyntaxException}.
 * </p>
 */
public final class XPathParser {

  /** The expression text. */
  private final String expression;

  /** The tokens without whitespace. */
  private final List<XPathToken> tokens;

  /** Index of the current token. */
  private int position;

  /** Opening brackets and parentheses which are not closed yet, the innermost on top. */
  private final Deque<XPathToken> openTokens = new ArrayDeque<>();

  /**
   * Constructor. Initializes the internal state.
   *
   * @param expression the expression to parse
   * @throws XPathSyntaxException if the expression can't be tokenized
   */
  public XPathParser(final String expression) {
    this.expression = requireNonNull(expression);
    this.tokens = new XPathScanner(expression).tokenize()
                                              .stream()
                                              .filter(token -> token.type() != TokenType.WHITESPACE)
                                              .collect(Collectors.toList());
  }

  /**
   * Starts parsing the expression.
   *
   * @return the syntax tree
   * @throws XPathSyntaxException if the expression isn't valid
   * @throws XPathUnsupportedFeatureException if the expression uses an unsupported construct
   */
  public XPathExpression parse() {
    if (tokens.isEmpty()) {
      throw syntaxError(0, XPathError.MISSING_LOCATION_PATH);
    }

    final List<LocationPath> paths = new ArrayList<>();
    paths.add(parsePath());
    while (is(TokenType.UNION, true)) {
      paths.add(parsePath());
    }

    // after the parsing of the expression no token must be left
    if (current() != null) {
      throw syntaxError(current().offset(), XPathError.UNEXPECTED_TOKEN);
    }
    return new XPathExpression(expression, paths);
  }

  /**
   * Parses the rule Path according to the following production rule:
   * <p>
   * Path ::= ('/' | '//')? Step (('/' | '//') Step)* .
   * </p>
   */
  private LocationPath parsePath() {
    final List<LocationStep> steps = new ArrayList<>();
    boolean absolute = false;

    final XPathToken first = current();
    if (first == null || first.type() == TokenType.UNION) {
      throw syntaxError(offset(), XPathError.MISSING_LOCATION_PATH);
    }

    if (is(TokenType.SLASH, true)) {
      absolute = true;
      if (current() == null || current().type() == TokenType.UNION) {
        throw unsupported(first.offset(), "selecting the document node");
      }
    } else if (is(TokenType.SLASH_SLASH, true)) {
      absolute = true;
      steps.add(descendantOrSelfStep());
    }

    steps.add(parseStep());
    while (true) {
      if (is(TokenType.SLASH, true)) {
        steps.add(parseStep());
      } else if (is(TokenType.SLASH_SLASH, true)) {
        steps.add(descendantOrSelfStep());
        steps.add(parseStep());
      } else {
        break;
      }
    }
    return new LocationPath(absolute, steps);
  }

  private static LocationStep descendantOrSelfStep() {
    return new LocationStep(AxisType.DESCENDANT_OR_SELF, new NodeTypeTest(NodeTypeTest.Type.NODE),
        List.of());
  }

  /**
   * Parses the rule Step according to the following production rule:
   * <p>
   * Step ::= '.' | '..' | (AxisName '::')? NodeTest Predicate* .
   * </p>
   */
  private LocationStep parseStep() {
    final XPathToken token = current();
    if (token == null) {
      throw syntaxError(offset(), XPathError.MISSING_NODE_TEST);
    }

    switch (token.type()) {
      case DOT:
        consume();
        return new LocationStep(AxisType.SELF, new NodeTypeTest(NodeTypeTest.Type.NODE), List.of());
      case DOT_DOT:
        consume();
        return new LocationStep(AxisType.PARENT, new NodeTypeTest(NodeTypeTest.Type.NODE),
            List.of());
      case AT:
        throw unsupported(token.offset(), "attribute axis outside of a predicate");
      case DOLLAR:
        throw unsupported(token.offset(), "variable reference");
      default:
    }

    AxisType axis = AxisType.CHILD;
    if (token.type() == TokenType.NAME && lookAhead(1) == TokenType.AXIS_SEPARATOR) {
      if (token.isName("attribute")) {
        throw unsupported(token.offset(), "attribute axis outside of a predicate");
      }
      if (token.isName("namespace")) {
        throw unsupported(token.offset(), "namespace axis");
      }
      axis = AxisType.fromName(token.value());
      if (axis == null) {
        throw syntaxError(token.offset(), XPathError.INVALID_AXIS);
      }
      consume();
      consume();
    }

    final NodeTest nodeTest = parseNodeTest();
    final List<Expression> predicates = new ArrayList<>();
    while (current() != null && current().type() == TokenType.OPEN_BRACKET) {
      predicates.add(parsePredicate());
    }
    return new LocationStep(axis, nodeTest, predicates);
  }

  /**
   * Parses the rule NodeTest according to the following production rule:
   * <p>
   * NodeTest ::= '*' | NAME ':' '*' | NAME ':' NAME | NAME | ('node' | 'text' | 'comment') '(' ')'
   * | 'processing-instruction' '(' STRING? ')' .
   * </p>
   */
  private NodeTest parseNodeTest() {
    final XPathToken token = current();
    if (token == null) {
      throw syntaxError(offset(), XPathError.MISSING_NODE_TEST);
    }
    if (is(TokenType.ASTERISK, true)) {
      return new WildcardTest(null);
    }
    if (token.type() != TokenType.NAME) {
      throw syntaxError(token.offset(), XPathError.MISSING_NODE_TEST);
    }

    if (lookAhead(1) == TokenType.COLON) {
      consume();
      consume();
      if (is(TokenType.ASTERISK, true)) {
        return new WildcardTest(token.value());
      }
      final XPathToken localName = current();
      if (localName == null || localName.type() != TokenType.NAME) {
        throw syntaxError(localName == null ? offset() : localName.offset(),
            XPathError.MISSING_NODE_TEST);
      }
      consume();
      if (current() != null && current().type() == TokenType.OPEN_PARENS) {
        throw unsupported(token.offset(), "function call as a location step");
      }
      return new NameMatchTest(token.value(), localName.value());
    }

    if (lookAhead(1) != TokenType.OPEN_PARENS) {
      consume();
      return new NameMatchTest(null, token.value());
    }

    switch (token.value()) {
      case "node":
        return parseTypeTest(new NodeTypeTest(NodeTypeTest.Type.NODE));
      case "text":
        return parseTypeTest(new NodeTypeTest(NodeTypeTest.Type.TEXT));
      case "comment":
        return parseTypeTest(new NodeTypeTest(NodeTypeTest.Type.COMMENT));
      case "processing-instruction": {
        consume();
        final XPathToken open = openParenthesis();
        String target = null;
        if (current() != null && current().type() == TokenType.STRING) {
          target = unquote(current());
          consume();
        }
        closeParenthesis(open);
        return new ProcessingInstructionTest(target);
      }
      default:
        throw unsupported(token.offset(), "function call as a location step");
    }
  }

  private NodeTest parseTypeTest(final NodeTest test) {
    consume();
    closeParenthesis(openParenthesis());
    return test;
  }

  /**
   * Parses the rule Predicate according to the following production rule:
   * <p>
   * Predicate ::= '[' OrExpr ']' .
   * </p>
   */
  private Expression parsePredicate() {
    final XPathToken open = current();
    consume();
    openTokens.push(open);
    if (current() == null) {
      throw syntaxError(open.offset(), XPathError.UNTERMINATED_BRACKET);
    }
    if (current().type() == TokenType.CLOSE_BRACKET) {
      throw syntaxError(current().offset(), XPathError.INVALID_PREDICATE);
    }
    final Expression predicate = parseOrExpr();
    if (current() == null) {
      throw syntaxError(open.offset(), XPathError.UNTERMINATED_BRACKET);
    }
    if (current().type() != TokenType.CLOSE_BRACKET) {
      throw invalidOperand(current());
    }
    consume();
    openTokens.pop();
    return asBoolean(predicate);
  }

  /**
   * Parses the rule OrExpr according to the following production rule:
   * <p>
   * OrExpr ::= AndExpr ('or' AndExpr)* .
   * </p>
   */
  private Expression parseOrExpr() {
    Expression expression = parseAndExpr();
    while (current() != null && current().isName("or")) {
      consume();
      expression =
          new BooleanOperator(Operator.OR, asBoolean(expression), asBoolean(parseAndExpr()));
    }
    return expression;
  }

  /**
   * Parses the rule AndExpr according to the following production rule:
   * <p>
   * AndExpr ::= Comparison ('and' Comparison)* .
   * </p>
   */
  private Expression parseAndExpr() {
    Expression expression = parseComparison();
    while (current() != null && current().isName("and")) {
      consume();
      expression =
          new BooleanOperator(Operator.AND, asBoolean(expression), asBoolean(parseComparison()));
    }
    return expression;
  }

  /**
   * Parses the rule Comparison according to the following production rule:
   * <p>
   * Comparison ::= Primary (('=' | '!=' | '&lt;' | '&lt;=' | '&gt;' | '&gt;=') Primary)? .
   * </p>
   */
  private Expression parseComparison() {
    final Expression left = parsePrimary();
    checkNoArithmetic();
    final Operator operator = comparisonOperator(current());
    if (operator == null) {
      return left;
    }
    consume();
    final Expression right = parsePrimary();
    checkNoArithmetic();
    return new BooleanOperator(operator, left, right);
  }

  private void checkNoArithmetic() {
    final XPathToken token = current();
    if (token == null) {
      return;
    }
    switch (token.type()) {
      case PLUS:
      case MINUS:
      case ASTERISK:
        throw unsupported(token.offset(), "arithmetic operator '" + token.value() + "'");
      case NAME:
        if (token.isName("div") || token.isName("mod")) {
          throw unsupported(token.offset(), "arithmetic operator '" + token.value() + "'");
        }
        break;
      default:
    }
  }

  private static @Nullable Operator comparisonOperator(final @Nullable XPathToken token) {
    if (token == null) {
      return null;
    }
    switch (token.type()) {
      case EQUALS:
        return Operator.EQUALS;
      case NOT_EQUALS:
        return Operator.NOT_EQUALS;
      case LESS:
        return Operator.LESS;
      case LESS_OR_EQUAL:
        return Operator.LESS_OR_EQUAL;
      case GREATER:
        return Operator.GREATER;
      case GREATER_OR_EQUAL:
        return Operator.GREATER_OR_EQUAL;
      default:
        return null;
    }
  }

  /**
   * Parses the rule Primary according to the following production rule:
   * <p>
   * Primary ::= '(' OrExpr ')' | '@' NAME (':' NAME)? | STRING | NUMBER | NAME '(' (OrExpr (','
   * OrExpr)*)? ')' .
   * </p>
   */
  private Expression parsePrimary() {
    final XPathToken token = current();
    if (token == null) {
      throw unterminated();
    }

    switch (token.type()) {
      case OPEN_PARENS: {
        final XPathToken open = openParenthesis();
        final Expression expression = parseOrExpr();
        closeParenthesis(open);
        return expression;
      }
      case AT:
        return parseAttribute();
      case STRING:
        consume();
        return new StringLiteral(unquote(token));
      case NUMBER:
        consume();
        return new NumberLiteral(Double.parseDouble(token.value()));
      case MINUS:
        throw unsupported(token.offset(), "arithmetic operator '-'");
      case DOLLAR:
        throw unsupported(token.offset(), "variable reference");
      case DOT:
        throw unsupported(token.offset(), "context item in a predicate");
      case DOT_DOT:
      case SLASH:
      case SLASH_SLASH:
      case ASTERISK:
        throw unsupported(token.offset(), "location path in a predicate");
      case NAME:
        if (lookAhead(1) == TokenType.OPEN_PARENS) {
          return parseFunctionCall();
        }
        throw unsupported(token.offset(), "location path in a predicate");
      default:
        throw invalidOperand(token);
    }
  }

  private AttributeValue parseAttribute() {
    final XPathToken at = current();
    consume();
    final XPathToken name = current();
    if (name == null) {
      throw unterminated();
    }
    if (name.type() == TokenType.ASTERISK) {
      throw unsupported(at.offset(), "attribute wildcard");
    }
    if (name.type() != TokenType.NAME) {
      throw syntaxError(name.offset(), XPathError.INVALID_PREDICATE);
    }
    consume();
    if (is(TokenType.COLON, true)) {
      final XPathToken localName = current();
      if (localName == null) {
        throw unterminated();
      }
      if (localName.type() == TokenType.ASTERISK) {
        throw unsupported(at.offset(), "attribute wildcard");
      }
      if (localName.type() != TokenType.NAME) {
        throw syntaxError(localName.offset(), XPathError.INVALID_PREDICATE);
      }
      consume();
      return new AttributeValue(name.value(), localName.value());
    }
    return new AttributeValue(null, name.value());
  }

  private FunctionCall parseFunctionCall() {
    final XPathToken name = current();
    consume();
    final XPathToken open = openParenthesis();
    final List<Expression> arguments = new ArrayList<>();
    if (current() != null && current().type() != TokenType.CLOSE_PARENS) {
      arguments.add(parseOrExpr());
      while (is(TokenType.COMMA, true)) {
        arguments.add(parseOrExpr());
      }
    }
    closeParenthesis(open);
    return new FunctionCall(name.value(), arguments);
  }

  private XPathToken openParenthesis() {
    final XPathToken open = current();
    if (open == null || open.type() != TokenType.OPEN_PARENS) {
      throw syntaxError(open == null ? offset() : open.offset(), XPathError.MISSING_NODE_TEST);
    }
    consume();
    openTokens.push(open);
    return open;
  }

  private void closeParenthesis(final XPathToken open) {
    if (current() == null || current().type() != TokenType.CLOSE_PARENS) {
      throw syntaxError(open.offset(), XPathError.UNTERMINATED_PARENTHESIS);
    }
    consume();
    openTokens.pop();
  }

  /**
   * An attribute used where a boolean is expected tests for its existence.
   */
  private static Expression asBoolean(final Expression expression) {
    return expression instanceof AttributeValue
        ? new HasAttribute((AttributeValue) expression)
        : expression;
  }

  private XPathSyntaxException unterminated() {
    final XPathToken open = openTokens.peek();
    if (open == null) {
      return syntaxError(offset(), XPathError.INVALID_PREDICATE);
    }
    return syntaxError(open.offset(), open.type() == TokenType.OPEN_BRACKET
        ? XPathError.UNTERMINATED_BRACKET
        : XPathError.UNTERMINATED_PARENTHESIS);
  }

  private XPathSyntaxException invalidOperand(final XPathToken token) {
    return syntaxError(token.offset(), XPathError.INVALID_PREDICATE);
  }

  private XPathSyntaxException syntaxError(final int offset, final XPathError error) {
    return new XPathSyntaxException(expression, offset, error);
  }

  private XPathUnsupportedFeatureException unsupported(final int offset, final String construct) {
    return new XPathUnsupportedFeatureException(expression, offset, construct);
  }

  private @Nullable XPathToken current() {
    return position < tokens.size() ? tokens.get(position) : null;
  }

  private @Nullable TokenType lookAhead(final int distance) {
    final int index = position + distance;
    return index < tokens.size() ? tokens.get(index).type() : null;
  }

  /**
   * Get the offset of the current token, or the end of the expression if all tokens are consumed.
   */
  private int offset() {
    final XPathToken token = current();
    return token == null ? expression.length() : token.offset();
  }

  private void consume() {
    position++;
  }

  /**
   * Checks if the current token is of the specified type and consumes it if requested.
   *
   * @param type the expected type
   * @param consume {@code true} to consume a matching token
   * @return {@code true} if the current token is of the type
   */
  private boolean is(final TokenType type, final boolean consume) {
    final XPathToken token = current();
    if (token == null || token.type() != type) {
      return false;
    }
    if (consume) {
      consume();
    }
    return true;
  }

  private static String unquote(final XPathToken token) {
    final String value = token.value();
    return value.substring(1, value.length() - 1);
  }
}
