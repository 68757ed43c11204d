package io.arbor.axis;

import io.arbor.node.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Iterate over all tag ancestors of a node, the nearest first. The document sentinel is never
 * reached.
 */
public final class AncestorAxis extends AbstractAxis {

  /** The last returned node. */
  @Nullable
  private Node current;

  /** Determines if it's the first call. */
  private boolean first;

  /**
   * Constructor initializing internal state.
   *
   * @param node the node to start at, not included
   */
  public AncestorAxis(final Node node) {
    this(node, IncludeSelf.NO);
  }

  /**
   * Constructor initializing internal state.
   *
   * @param node the node to start at
   * @param includeSelf determines if the start node is included
   */
  public AncestorAxis(final Node node, final IncludeSelf includeSelf) {
    super(node, includeSelf);
    first = true;
  }

  @Override
  public void reset(final Node node) {
    super.reset(node);
    current = null;
    first = true;
  }

  @Override
  protected @Nullable Node nextNode() {
    if (first) {
      first = false;
      current = getStartNode();
      if (isSelfIncluded()) {
        return current;
      }
    }
    current = current == null ? null : current.getParent();
    return current == null ? done() : current;
  }
}
