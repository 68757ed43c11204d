package io.arbor.axis.filter;

import com.google.common.collect.ImmutableList;
import io.arbor.api.Axis;
import io.arbor.api.Filter;
import io.arbor.axis.AbstractAxis;
import io.arbor.node.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

/**
 * <p>
 * Perform a test on a given axis.
 * </p>
 * <p>
 * Only nodes which pass all filters are returned. The traversal of the wrapped axis isn't
 * affected by the filters.
 * </p>
 */
public final class FilterAxis extends AbstractAxis {

  /** Axis to test. */
  private final Axis axis;

  /** Tests to apply to the axis. */
  private final List<Filter> axisFilters;

  /**
   * Constructor initializing internal state.
   *
   * @param axis axis to iterate over
   * @param axisFilters tests to perform for each node found with the axis
   */
  public FilterAxis(final Axis axis, final Filter... axisFilters) {
    super(axis.getStartNode(), axis.includeSelf());
    this.axis = axis;
    this.axisFilters = ImmutableList.copyOf(axisFilters);
  }

  @Override
  public void reset(final Node node) {
    super.reset(node);
    if (axis != null) {
      axis.reset(node);
    }
  }

  @Override
  protected @Nullable Node nextNode() {
    while (axis.hasNext()) {
      final Node node = axis.next();
      if (passes(node)) {
        return node;
      }
    }
    return done();
  }

  private boolean passes(final Node node) {
    for (final Filter filter : axisFilters) {
      if (!filter.filter(node)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns the inner axis.
   *
   * @return the axis
   */
  public Axis getAxis() {
    return axis;
  }

  /**
   * Returns the filters.
   *
   * @return the filters
   */
  public List<Filter> getFilters() {
    return axisFilters;
  }
}
