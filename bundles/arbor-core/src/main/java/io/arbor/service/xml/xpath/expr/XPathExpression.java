package io.arbor.service.xml.xpath.expr;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * A compiled, immutable expression: the union of one or more location paths.
 */
public final class XPathExpression {

  /** The text the expression was compiled from. */
  private final String source;

  private final List<LocationPath> paths;

  public XPathExpression(final String source, final List<LocationPath> paths) {
    checkArgument(!paths.isEmpty(), "An expression needs at least one location path.");
    this.source = requireNonNull(source);
    this.paths = ImmutableList.copyOf(paths);
  }

  public String getSource() {
    return source;
  }

  public List<LocationPath> getPaths() {
    return paths;
  }

  /**
   * Determines by static inspection if the expression denotes at most one node: a single path of
   * named child steps whose predicates are conjunctions of attribute equality tests.
   *
   * @return {@code true} if it does
   */
  public boolean isUnambiguouslyLocatable() {
    if (paths.size() != 1) {
      return false;
    }
    for (final LocationStep step : paths.get(0).getSteps()) {
      if (!step.isUnambiguouslyLocatable()) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns the expression in normalized form, abbreviations expanded.
   */
  @Override
  public String toString() {
    return paths.stream().map(LocationPath::toString).collect(Collectors.joining(" | "));
  }
}
