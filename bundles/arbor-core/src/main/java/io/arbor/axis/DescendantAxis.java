package io.arbor.axis;

import io.arbor.node.Node;
import io.arbor.node.ParentNode;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Iterate over all descendants of a node in document order (pre-order).
 */
public final class DescendantAxis extends AbstractAxis {

  /** Iterators over the child nodes of the ancestors of the current node. */
  private Deque<Iterator<Node>> stack;

  /** Node whose children are visited next, descending is deferred until they are needed. */
  @Nullable
  private ParentNode pending;

  /** Determines if it's the first call. */
  private boolean first;

  /**
   * Constructor initializing internal state.
   *
   * @param node the node to start at, not included
   */
  public DescendantAxis(final Node node) {
    this(node, IncludeSelf.NO);
  }

  /**
   * Constructor initializing internal state.
   *
   * @param node the node to start at
   * @param includeSelf determines if the start node is included
   */
  public DescendantAxis(final Node node, final IncludeSelf includeSelf) {
    super(node, includeSelf);
    stack = new ArrayDeque<>();
    first = true;
  }

  @Override
  public void reset(final Node node) {
    super.reset(node);
    stack = new ArrayDeque<>();
    pending = null;
    first = true;
  }

  @Override
  protected @Nullable Node nextNode() {
    if (first) {
      first = false;
      final Node start = getStartNode();
      if (start instanceof ParentNode) {
        pending = (ParentNode) start;
      }
      if (isSelfIncluded()) {
        return start;
      }
    }

    if (pending != null) {
      stack.push(pending.getChildNodes().iterator());
      pending = null;
    }

    while (!stack.isEmpty()) {
      final Iterator<Node> children = stack.peek();
      if (children.hasNext()) {
        final Node node = children.next();
        if (node instanceof ParentNode) {
          pending = (ParentNode) node;
        }
        return node;
      }
      stack.pop();
    }

    return done();
  }
}
