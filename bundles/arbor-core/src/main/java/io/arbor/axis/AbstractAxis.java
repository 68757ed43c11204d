package io.arbor.axis;

import com.google.common.base.MoreObjects;
import io.arbor.api.Axis;
import io.arbor.node.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Iterator;
import java.util.NoSuchElementException;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * <p>
 * Provide standard Java iterator capability compatible with the enhanced for loop.
 * </p>
 * <p>
 * Override the "template method" {@code nextNode()} to implement an axis. Return {@code done()} if
 * the axis has no more "elements". Axes are lazy: a node is computed only when {@link #hasNext()}
 * is called.
 * </p>
 */
public abstract class AbstractAxis implements Axis {

  /** Node where the axis started. */
  private Node startNode;

  /** Include self? */
  private final IncludeSelf includeSelf;

  /** The computed next node, if {@link #state} is {@link State#READY}. */
  @Nullable
  private Node next;

  /** Current state. */
  private State state = State.NOT_READY;

  /** State of the iterator. */
  private enum State {
    /** We have computed the next element and haven't returned it yet. */
    READY,

    /** We haven't yet computed or have already returned the element. */
    NOT_READY,

    /** We have reached the end of the data and are finished. */
    DONE,

    /** We've suffered an exception and are kaput. */
    FAILED,
  }

  /**
   * Bind axis step to a start node.
   *
   * @param startNode the node to start at
   * @throws NullPointerException if {@code startNode} is {@code null}
   */
  protected AbstractAxis(final Node startNode) {
    this(startNode, IncludeSelf.NO);
  }

  /**
   * Bind axis step to a start node.
   *
   * @param startNode the node to start at
   * @param includeSelf determines if self is included
   * @throws NullPointerException if {@code startNode} or {@code includeSelf} is {@code null}
   */
  protected AbstractAxis(final Node startNode, final IncludeSelf includeSelf) {
    this.startNode = requireNonNull(startNode);
    this.includeSelf = requireNonNull(includeSelf);
  }

  @Override
  public final Iterator<Node> iterator() {
    return this;
  }

  /**
   * Signals that axis traversal is done, that is {@code hasNext()} must return false. Is callable
   * from subclasses which implement {@link #nextNode()}.
   *
   * @return {@code null} to indicate that the traversal is done
   */
  protected @Nullable Node done() {
    return null;
  }

  /**
   * {@inheritDoc}
   *
   * <p>
   * <strong>Implementors must implement {@code nextNode()} instead which is a template method called
   * from this {@code hasNext()} method.</strong>
   * </p>
   */
  @Override
  public final boolean hasNext() {
    checkState(state != State.FAILED);
    switch (state) {
      case DONE:
        return false;
      case READY:
        return true;
      case FAILED:
      case NOT_READY:
      default:
    }

    state = State.FAILED;
    next = nextNode();
    if (next == null) {
      state = State.DONE;
      return false;
    }
    state = State.READY;
    return true;
  }

  @Override
  public final Node next() {
    if (!hasNext()) {
      throw new NoSuchElementException("No more nodes in the axis!");
    }
    state = State.NOT_READY;
    final Node result = next;
    next = null;
    return result;
  }

  /**
   * Returns the next node of the axis.
   *
   * @return the next node, or {@link #done()} if there is none
   */
  protected abstract @Nullable Node nextNode();

  @Override
  public void reset(final Node node) {
    startNode = requireNonNull(node);
    next = null;
    state = State.NOT_READY;
  }

  @Override
  public final Node getStartNode() {
    return startNode;
  }

  @Override
  public final IncludeSelf includeSelf() {
    return includeSelf;
  }

  /**
   * Determines if the start node is included.
   *
   * @return {@code true} if it is, {@code false} otherwise
   */
  protected final boolean isSelfIncluded() {
    return includeSelf == IncludeSelf.YES;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("startNode", startNode)
                      .add("includeSelf", includeSelf)
                      .toString();
  }
}
