package io.arbor.axis;

import io.arbor.node.ChildNodes;
import io.arbor.node.Node;
import io.arbor.node.ParentNode;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.ListIterator;

/**
 * <p>
 * Iterate over all nodes before a node in reverse document order. Self is not included.
 * </p>
 * <p>
 * Each preceding sibling is returned after its descendants, which are walked in reverse as well.
 * When the siblings are exhausted the axis climbs to the parent, which is returned only if
 * ancestors are included, and continues with the parent's preceding siblings.
 * </p>
 */
public final class PrecedingAxis extends AbstractAxis {

  /** Determines if the ancestors of the start node are included. */
  private final boolean includeAncestors;

  /** Frames of siblings walked backwards, the innermost on top. */
  private Deque<Frame> stack;

  /** The ancestor-or-self of the start node whose preceding siblings are visited. */
  @Nullable
  private Node climber;

  /** Determines if it's the first call. */
  private boolean first;

  /** Nodes to walk backwards, and the node to return once they are exhausted. */
  private static final class Frame {
    private final ListIterator<Node> nodes;

    @Nullable
    private final Node last;

    private Frame(final ListIterator<Node> nodes, final @Nullable Node last) {
      this.nodes = nodes;
      this.last = last;
    }
  }

  /**
   * Constructor initializing internal state.
   *
   * @param node the node to start at
   * @param includeAncestors determines if the ancestors of {@code node} are included
   */
  public PrecedingAxis(final Node node, final boolean includeAncestors) {
    super(node);
    this.includeAncestors = includeAncestors;
    stack = new ArrayDeque<>();
    first = true;
  }

  @Override
  public void reset(final Node node) {
    super.reset(node);
    stack = new ArrayDeque<>();
    climber = null;
    first = true;
  }

  @Override
  protected @Nullable Node nextNode() {
    if (first) {
      first = false;
      climber = getStartNode();
      stack.push(new Frame(precedingSiblings(climber), null));
    }

    while (true) {
      while (!stack.isEmpty()) {
        final Frame frame = stack.peek();
        if (frame.nodes.hasPrevious()) {
          final Node node = frame.nodes.previous();
          if (node instanceof ParentNode && !((ParentNode) node).getChildNodes().isEmpty()) {
            final ChildNodes children = ((ParentNode) node).getChildNodes();
            stack.push(new Frame(children.listIterator(children.size()), node));
            continue;
          }
          return node;
        }
        stack.pop();
        if (frame.last != null) {
          return frame.last;
        }
      }

      climber = climber == null ? null : climber.getParent();
      if (climber == null) {
        return done();
      }
      stack.push(new Frame(precedingSiblings(climber), null));
      if (includeAncestors) {
        return climber;
      }
    }
  }

  private static ListIterator<Node> precedingSiblings(final Node node) {
    final ChildNodes siblings = node.getSiblings();
    if (siblings == null) {
      return Collections.emptyListIterator();
    }
    return siblings.listIterator(siblings.indexOf(node));
  }
}
