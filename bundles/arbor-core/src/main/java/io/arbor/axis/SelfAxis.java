package io.arbor.axis;

import io.arbor.node.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Iterate over the start node only.
 */
public final class SelfAxis extends AbstractAxis {

  /** Determines if it's the first call. */
  private boolean first;

  /**
   * Constructor initializing internal state.
   *
   * @param node the node to return
   */
  public SelfAxis(final Node node) {
    super(node, IncludeSelf.YES);
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
      return getStartNode();
    }
    return done();
  }
}
