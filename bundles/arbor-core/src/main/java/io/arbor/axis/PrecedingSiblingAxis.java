package io.arbor.axis;

import io.arbor.node.ChildNodes;
import io.arbor.node.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collections;
import java.util.ListIterator;

/**
 * Iterate over all siblings before a node, the nearest first.
 */
public final class PrecedingSiblingAxis extends AbstractAxis {

  /** The remaining siblings, walked backwards, created on first access. */
  @Nullable
  private ListIterator<Node> siblings;

  /**
   * Constructor initializing internal state.
   *
   * @param node the node to start at, not included
   */
  public PrecedingSiblingAxis(final Node node) {
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
          ? Collections.emptyListIterator()
          : childNodes.listIterator(childNodes.indexOf(start));
    }
    return siblings.hasPrevious() ? siblings.previous() : done();
  }
}
