package io.arbor.service.xml.xpath;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.arbor.service.xml.xpath.expr.XPathExpression;
import io.arbor.service.xml.xpath.parser.XPathParser;
import io.arbor.settings.Constants;
import io.arbor.utils.LogWrapper;
import org.checkerframework.checker.index.qual.NonNegative;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Compiles expressions through a bounded cache of recently used syntax trees. Compiled expressions
 * are immutable and may be shared between threads.
 */
public final class XPathCompiler {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER =
      new LogWrapper(LoggerFactory.getLogger(XPathCompiler.class));

  /** The compiler used by {@link XPath}. */
  private static final XPathCompiler DEFAULT = new XPathCompiler(Constants.xpathCacheSize());

  /** Expression text to syntax tree. */
  private final Cache<String, XPathExpression> cache;

  /**
   * Constructor.
   *
   * @param cacheSize the maximum number of cached expressions, {@code 0} disables caching
   */
  public XPathCompiler(final @NonNegative int cacheSize) {
    checkArgument(cacheSize >= 0, "The cache size must not be negative: %s", cacheSize);
    cache = Caffeine.newBuilder().maximumSize(cacheSize).build();
  }

  /**
   * Get the shared compiler, whose cache size is configured by the system property
   * {@value Constants#XPATH_CACHE_SIZE_PROPERTY}.
   *
   * @return the compiler
   */
  public static XPathCompiler getDefault() {
    return DEFAULT;
  }

  /**
   * Compiles an expression.
   *
   * @param expression the expression text
   * @return the syntax tree
   * @throws io.arbor.exception.XPathSyntaxException if the expression is malformed
   * @throws io.arbor.exception.XPathUnsupportedFeatureException if it uses an unsupported construct
   */
  public XPathExpression compile(final String expression) {
    requireNonNull(expression);
    return cache.get(expression, this::parse);
  }

  /**
   * Get the approximate number of cached expressions.
   *
   * @return the number of cached expressions
   */
  public long size() {
    cache.cleanUp();
    return cache.estimatedSize();
  }

  private XPathExpression parse(final String expression) {
    LOGWRAPPER.debug("Compiling XPath expression '{}'.", expression);
    return new XPathParser(expression).parse();
  }
}
