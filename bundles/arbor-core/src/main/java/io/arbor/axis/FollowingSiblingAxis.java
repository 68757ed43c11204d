package io.arbor.axis;

import io.arbor.node.ChildNodes;
import io.arbor.node.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collections;
import java.util.Iterator;

/**
 * Iterate over all siblings after a node.
 */
public final class FollowingSiblingAxis extends AbstractAxis {

  /** The remaining siblings, created on first access. */
  @Nullable
  private Iterator<Node> siblings;

  /**
   * Constructor initializing internal state.
   *
   * @param node the node to start at, not included
   */
  public FollowingSiblingAxis(final Node node) {
    super(node);
  }

  @Override
  public void reset(final Node node) {
    super.reset(node);
    siblings = null;
  }

  @Override
  protected @Nullable Node nextNode() {
    if (siblings == null) {
      final Node start = getStartNode();
      final ChildNodes childNodes = start.getSiblings();
      siblings = childNodes == null
          ? Collections.emptyIterator()
          : childNodes.listIterator(childNodes.indexOf(start) + 1);
    }
    return siblings.hasNext() ? siblings.next() : done();
  }
}
