package io.arbor.node;

import com.google.common.base.MoreObjects;
import io.arbor.exception.StructuralConflictException;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;

import static com.google.common.base.Preconditions.checkPositionIndex;
import static java.util.Objects.requireNonNull;

/**
 * The ordered, owned children of one {@link ParentNode}, the unfiltered "siblings" collection.
 * Public access is read-only, structure is changed through the node methods. Iterators fail fast
 * if the collection is modified while they are in use.
 */
public final class ChildNodes implements Iterable<Node> {

  /** The owning container. */
  private final ParentNode owner;

  /** The children. */
  private final List<Node> nodes = new ArrayList<>();

  /** Read-only view of {@link #nodes}. */
  private final List<Node> view = Collections.unmodifiableList(nodes);

  ChildNodes(final ParentNode owner) {
    this.owner = requireNonNull(owner);
  }

  public int size() {
    return nodes.size();
  }

  public boolean isEmpty() {
    return nodes.isEmpty();
  }

  public Node get(final @NonNegative int index) {
    return nodes.get(index);
  }

  /**
   * Get the position of a node, compared by identity.
   *
   * @param node the node
   * @return the index or {@code -1} if it isn't contained
   */
  public int indexOf(final Node node) {
    for (int i = 0, size = nodes.size(); i < size; i++) {
      if (nodes.get(i) == node) {
        return i;
      }
    }
    return -1;
  }

  @Override
  public Iterator<Node> iterator() {
    return view.iterator();
  }

  public ListIterator<Node> listIterator(final @NonNegative int index) {
    return view.listIterator(index);
  }

  /**
   * Get a read-only view of the children.
   *
   * @return the live, unmodifiable list
   */
  public List<Node> asList() {
    return view;
  }

  void insert(final @NonNegative int index, final Node... insertions) {
    checkPositionIndex(index, nodes.size());
    final List<Node> checked = checkInsertable(null, insertions);
    nodes.addAll(index, checked);
    for (final Node node : checked) {
      node.parent = owner;
    }
  }

  void remove(final Node node) {
    final int index = indexOf(node);
    if (index < 0) {
      throw new IllegalStateException("Node isn't contained in its parent's child nodes.");
    }
    nodes.remove(index);
    node.parent = null;
  }

  void replace(final Node node, final Node replacement) {
    final int index = indexOf(node);
    if (index < 0) {
      throw new IllegalStateException("Node isn't contained in its parent's child nodes.");
    }
    checkInsertable(node, replacement);
    nodes.set(index, replacement);
    node.parent = null;
    replacement.parent = owner;
  }

  /**
   * Adds a node without taking ownership, used by non-owning document views only.
   */
  void addUnowned(final Node node) {
    nodes.add(node);
  }

  private List<Node> checkInsertable(final @Nullable Node removal, final Node... insertions) {
    final List<Node> checked = new ArrayList<>(insertions.length);
    for (final Node node : insertions) {
      requireNonNull(node);
      if (node.parent != null) {
        throw new StructuralConflictException(
            "The node %s is already attached, detach or clone it first.", node);
      }
      if (node instanceof DocumentNode) {
        throw new StructuralConflictException("A document node can't be inserted.");
      }
      for (ParentNode ancestor = owner; ancestor != null; ancestor = ancestor.parent) {
        if (ancestor == node) {
          throw new StructuralConflictException(
              "The node %s can't be inserted into itself or one of its descendants.", node);
        }
      }
      for (final Node other : checked) {
        if (other == node) {
          throw new StructuralConflictException("The node %s is inserted twice.", node);
        }
      }
      checked.add(node);
    }
    owner.checkInsertable(checked, removal);
    return checked;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("owner", owner).add("size", nodes.size()).toString();
  }
}
