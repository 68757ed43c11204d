package io.arbor.service.xml.xpath.expr;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A sequence of location steps, absolute if it starts at the root tag of the tree.
 */
public final class LocationPath {

  private final boolean absolute;

  private final List<LocationStep> steps;

  public LocationPath(final boolean absolute, final List<LocationStep> steps) {
    checkArgument(!steps.isEmpty(), "A location path needs at least one step.");
    this.absolute = absolute;
    this.steps = ImmutableList.copyOf(steps);
  }

  public boolean isAbsolute() {
    return absolute;
  }

  public List<LocationStep> getSteps() {
    return steps;
  }

  @Override
  public String toString() {
    return steps.stream()
                .map(LocationStep::toString)
                .collect(Collectors.joining("/", absolute ? "/" : "", ""));
  }
}
