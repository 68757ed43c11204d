package io.arbor.axis;

import io.arbor.node.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Iterate over the parent tag of a node, if there is one.
 */
public final class ParentAxis extends AbstractAxis {

  /** Determines if it's the first call. */
  private boolean first;

  /**
   * Constructor initializing internal state.
   *
   * @param node the node whose parent is returned
   */
  public ParentAxis(final Node node) {
    super(node);
    first = true;
  }

  @Override
  public void reset(final Node node) {
    super.reset(node);
    first = true;
  }

  @Override
  protected @Nullable Node nextNode() {
    if (first) {
      first = false;
      final Node parent = getStartNode().getParent();
      if (parent != null) {
        return parent;
      }
    }
    return done();
  }
}
