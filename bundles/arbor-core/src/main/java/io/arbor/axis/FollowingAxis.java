package io.arbor.axis;

import io.arbor.node.ChildNodes;
import io.arbor.node.Node;
import io.arbor.node.ParentNode;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;

/**
 * <p>
 * Iterate over all nodes after a node in document order. Self is not included.
 * </p>
 * <p>
 * Optionally the node's own descendants come first. Then each following sibling is returned
 * together with its descendants, before climbing to the nearest ancestor which has following
 * siblings itself.
 * </p>
 */
public final class FollowingAxis extends AbstractAxis {

  /** Determines if the descendants of the start node are included. */
  private final boolean includeDescendants;

  /** Iterators over siblings still to visit, the innermost on top. */
  private Deque<Iterator<Node>> stack;

  /** Node whose children are visited next. */
  @Nullable
  private ParentNode pending;

  /** The ancestor-or-self of the start node whose following siblings are visited. */
  @Nullable
  private Node climber;

  /** Determines if it's the first call. */
  private boolean first;

  /**
   * Constructor initializing internal state.
   *
   * @param node the node to start at
   * @param includeDescendants determines if the descendants of {@code node} are included
   */
  public FollowingAxis(final Node node, final boolean includeDescendants) {
    super(node);
    this.includeDescendants = includeDescendants;
    stack = new ArrayDeque<>();
    first = true;
  }

  @Override
  public void reset(final Node node) {
    super.reset(node);
    stack = new ArrayDeque<>();
    pending = null;
    climber = null;
    first = true;
  }

  @Override
  protected @Nullable Node nextNode() {
    if (first) {
      first = false;
      final Node start = getStartNode();
      climber = start;
      stack.push(followingSiblings(start));
      if (includeDescendants && start instanceof ParentNode) {
        pending = (ParentNode) start;
      }
    }

    while (true) {
      if (pending != null) {
        stack.push(pending.getChildNodes().iterator());
        pending = null;
      }

      while (!stack.isEmpty()) {
        final Iterator<Node> nodes = stack.peek();
        if (nodes.hasNext()) {
          final Node node = nodes.next();
          if (node instanceof ParentNode) {
            pending = (ParentNode) node;
          }
          return node;
        }
        stack.pop();
      }

      // Try to find the following siblings of one of the ancestors.
      climber = climber == null ? null : climber.getParent();
      if (climber == null) {
        return done();
      }
      stack.push(followingSiblings(climber));
    }
  }

  private static Iterator<Node> followingSiblings(final Node node) {
    final ChildNodes siblings = node.getSiblings();
    if (siblings == null) {
      return Collections.emptyIterator();
    }
    return siblings.listIterator(siblings.indexOf(node) + 1);
  }
}
