package io.arbor.axis;

import io.arbor.node.Node;
import io.arbor.node.ParentNode;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collections;
import java.util.Iterator;

/**
 * Iterate over the children of a node. Leaf nodes have none.
 */
public final class ChildAxis extends AbstractAxis {

  /** Iterator over the children, created on first access. */
  @Nullable
  private Iterator<Node> children;

  /**
   * Constructor initializing internal state.
   *
   * @param node the parent of the children
   */
  public ChildAxis(final Node node) {
    super(node);
  }

  @Override
  public void reset(final Node node) {
    super.reset(node);
    children = null;
  }

  @Override
  protected @Nullable Node nextNode() {
    if (children == null) {
      final Node start = getStartNode();
      children = start instanceof ParentNode
          ? ((ParentNode) start).getChildNodes().iterator()
          : Collections.emptyIterator();
    }
    return children.hasNext() ? children.next() : done();
  }
}
