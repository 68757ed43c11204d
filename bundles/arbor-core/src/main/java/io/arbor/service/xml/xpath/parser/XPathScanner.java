package io.arbor.service.xml.xpath.parser;

import com.google.common.collect.ImmutableList;
import io.arbor.exception.XPathSyntaxException;
import io.arbor.service.xml.xpath.XPathError;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * <p>
 * Lexical scanner to extract tokens from an expression.
 * </p>
 * <p>
 * At each position the token types are tried in their declaration order, the first matching one
 * wins. Two-character operators are declared before their one-character prefixes, so the longest
 * operator is taken. Whitespace tokens are retained, the parser skips them.
 * </p>
 */
public final class XPathScanner {

  /** Alternation of all token types, each in a named group. */
  private static final Pattern TOKEN_PATTERN = Pattern.compile(Stream.of(TokenType.values())
                                                                     .map(type -> "(?<"
                                                                         + type.getGroupName()
                                                                         + ">"
                                                                         + type.getPattern()
                                                                         + ")")
                                                                     .collect(Collectors.joining("|")));

  /** The expression to scan. */
  private final String expression;

  /**
   * Constructor.
   *
   * @param expression the expression to scan
   */
  public XPathScanner(final String expression) {
    this.expression = requireNonNull(expression);
  }

  /**
   * Splits the expression into tokens.
   *
   * @return the tokens, whitespace included
   * @throws XPathSyntaxException if a string literal is unterminated or a character isn't part of
   *         any token
   */
  public List<XPathToken> tokenize() {
    final ImmutableList.Builder<XPathToken> tokens = ImmutableList.builder();
    final Matcher matcher = TOKEN_PATTERN.matcher(expression);
    int position = 0;
    while (position < expression.length()) {
      matcher.region(position, expression.length());
      if (!matcher.lookingAt()) {
        final char ch = expression.charAt(position);
        throw new XPathSyntaxException(expression, position,
            ch == '"' || ch == '\'' ? XPathError.UNTERMINATED_STRING : XPathError.UNRECOGNIZED_TOKEN);
      }
      tokens.add(new XPathToken(typeOf(matcher), matcher.group(), position));
      position = matcher.end();
    }
    return tokens.build();
  }

  private static TokenType typeOf(final Matcher matcher) {
    for (final TokenType type : TokenType.values()) {
      if (matcher.group(type.getGroupName()) != null) {
        return type;
      }
    }
    throw new IllegalStateException("Match without token type: " + matcher.group());
  }
}
