package io.arbor.service.xml.xpath.expr;

import io.arbor.api.Axis;
import io.arbor.axis.AncestorAxis;
import io.arbor.axis.ChildAxis;
import io.arbor.axis.DescendantAxis;
import io.arbor.axis.FollowingAxis;
import io.arbor.axis.FollowingSiblingAxis;
import io.arbor.axis.IncludeSelf;
import io.arbor.axis.ParentAxis;
import io.arbor.axis.PrecedingAxis;
import io.arbor.axis.PrecedingSiblingAxis;
import io.arbor.axis.SelfAxis;
import io.arbor.node.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.function.Function;

/**
 * The supported XPath axes, each backed by one of the node model's axes. Reverse axes yield the
 * nearest node first, so positions count from the context node.
 */
public enum AxisType {
  ANCESTOR("ancestor", node -> new AncestorAxis(node)),
  ANCESTOR_OR_SELF("ancestor-or-self", node -> new AncestorAxis(node, IncludeSelf.YES)),
  CHILD("child", ChildAxis::new),
  DESCENDANT("descendant", node -> new DescendantAxis(node)),
  DESCENDANT_OR_SELF("descendant-or-self", node -> new DescendantAxis(node, IncludeSelf.YES)),
  FOLLOWING("following", node -> new FollowingAxis(node, false)),
  FOLLOWING_SIBLING("following-sibling", FollowingSiblingAxis::new),
  PARENT("parent", ParentAxis::new),
  PRECEDING("preceding", node -> new PrecedingAxis(node, false)),
  PRECEDING_SIBLING("preceding-sibling", PrecedingSiblingAxis::new),
  SELF("self", SelfAxis::new);

  /** The name in expressions. */
  private final String axisName;

  /** Creates the axis for a context node. */
  private final Function<Node, Axis> factory;

  AxisType(final String axisName, final Function<Node, Axis> factory) {
    this.axisName = axisName;
    this.factory = factory;
  }

  public String getAxisName() {
    return axisName;
  }

  /**
   * Creates the unfiltered axis for a context node.
   *
   * @param node the context node
   * @return the axis
   */
  public Axis createAxis(final Node node) {
    return factory.apply(node);
  }

  /**
   * Looks up an axis by its name.
   *
   * @param name the name in an expression
   * @return the axis type or {@code null} if there is none with this name
   */
  public static @Nullable AxisType fromName(final String name) {
    for (final AxisType type : values()) {
      if (type.axisName.equals(name)) {
        return type;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return axisName;
  }
}
