package io.arbor.node;

import com.google.common.collect.Iterators;
import io.arbor.api.Axis;
import io.arbor.api.Filter;
import io.arbor.axis.ChildAxis;
import io.arbor.axis.DescendantAxis;
import io.arbor.axis.filter.DefaultFilters;
import io.arbor.exception.StructuralConflictException;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;
import java.util.ListIterator;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkPositionIndex;

/**
 * A node which can hold children. Indexes passed to and returned by the methods of this class
 * count only the children which match the active default filters.
 */
public abstract class ParentNode extends Node {

  /** The children. */
  private final ChildNodes childNodes = new ChildNodes(this);

  /**
   * Get the unfiltered children.
   *
   * @return the child collection
   */
  public ChildNodes getChildNodes() {
    return childNodes;
  }

  /**
   * Get the number of children matching the active default filters.
   *
   * @return the filtered number of children
   */
  public @NonNegative int length() {
    int length = 0;
    for (final Node child : childNodes) {
      if (DefaultFilters.matches(child)) {
        length++;
      }
    }
    return length;
  }

  /**
   * Inserts nodes at a position.
   *
   * @param index the position among the filtered children, {@link #length()} appends
   * @param nodes the unattached nodes to insert
   * @throws IndexOutOfBoundsException if {@code index} is out of range
   * @throws StructuralConflictException if a node is attached or the insertion would create a cycle
   */
  public void insertChildren(final @NonNegative int index, final Node... nodes) {
    checkPositionIndex(index, length());
    childNodes.insert(rawIndex(index), nodes);
  }

  /**
   * Appends nodes after the last child.
   *
   * @param nodes the unattached nodes to append
   * @throws StructuralConflictException if a node is attached or the insertion would create a cycle
   */
  public void appendChildren(final Node... nodes) {
    childNodes.insert(childNodes.size(), nodes);
  }

  /**
   * Inserts nodes before the first child.
   *
   * @param nodes the unattached nodes to prepend
   * @throws StructuralConflictException if a node is attached or the insertion would create a cycle
   */
  public void prependChildren(final Node... nodes) {
    childNodes.insert(0, nodes);
  }

  /**
   * Appends a new text node.
   *
   * @param content the text
   * @return the new text node
   */
  public TextNode appendText(final String content) {
    final TextNode text = new TextNode(content);
    appendChildren(text);
    return text;
  }

  /**
   * Iterates over the children.
   *
   * @param filters additional filters
   * @return the axis
   */
  public Axis iterateChildren(final Filter... filters) {
    return filtered(new ChildAxis(this), filters);
  }

  /**
   * Iterates over all descendants in document order.
   *
   * @param filters additional filters
   * @return the axis
   */
  public Axis iterateDescendants(final Filter... filters) {
    return filtered(new DescendantAxis(this), filters);
  }

  public @Nullable Node getFirstChild() {
    return Iterators.getNext(iterateChildren(), null);
  }

  public @Nullable Node getLastChild() {
    final ListIterator<Node> children = childNodes.listIterator(childNodes.size());
    while (children.hasPrevious()) {
      final Node child = children.previous();
      if (DefaultFilters.matches(child)) {
        return child;
      }
    }
    return null;
  }

  /**
   * Get the last descendant in document order.
   *
   * @return the last descendant or {@code null} if there is none
   */
  public @Nullable Node getLastDescendant() {
    return Iterators.getLast(iterateDescendants(), null);
  }

  /**
   * Get a child.
   *
   * @param index the position among the filtered children
   * @return the child
   * @throws IndexOutOfBoundsException if {@code index} is out of range
   */
  public Node getChild(final @NonNegative int index) {
    checkElementIndex(index, length());
    return childNodes.get(rawIndex(index));
  }

  @Override
  public String getFullText() {
    final StringBuilder text = new StringBuilder();
    for (final Node node : new DescendantAxis(this)) {
      if (node instanceof TextNode) {
        text.append(((TextNode) node).getContent());
      }
    }
    return text.toString();
  }

  /**
   * Hook to veto insertions which violate constraints of a container.
   *
   * @param insertions the nodes to insert
   * @param removal the node replaced by the insertions or {@code null}
   * @throws StructuralConflictException if the insertion is not allowed
   */
  void checkInsertable(final List<Node> insertions, final @Nullable Node removal) {
  }

  void cloneChildNodes(final ParentNode copy) {
    for (final Node child : childNodes) {
      copy.childNodes.insert(copy.childNodes.size(), child.cloneNode(true));
    }
  }

  private int rawIndex(final int index) {
    int filteredIndex = 0;
    for (int i = 0, size = childNodes.size(); i < size; i++) {
      if (DefaultFilters.matches(childNodes.get(i))) {
        if (filteredIndex == index) {
          return i;
        }
        filteredIndex++;
      }
    }
    return childNodes.size();
  }
}
