package io.arbor.node;

import com.google.common.collect.Iterators;
import io.arbor.api.Axis;
import io.arbor.api.Filter;
import io.arbor.axis.AncestorAxis;
import io.arbor.axis.FollowingAxis;
import io.arbor.axis.FollowingSiblingAxis;
import io.arbor.axis.PrecedingAxis;
import io.arbor.axis.PrecedingSiblingAxis;
import io.arbor.axis.filter.DefaultFilters;
import io.arbor.axis.filter.FilterAxis;
import io.arbor.exception.StructuralConflictException;
import io.arbor.service.xml.xpath.QueryResults;
import io.arbor.service.xml.xpath.XPath;
import io.arbor.settings.Constants;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Base of all nodes of the tree model.
 *
 * <p>
 * A node is owned by at most one parent. Attaching a node which already has a parent is rejected,
 * it has to be detached or cloned first, which keeps the tree acyclic by construction.
 * </p>
 *
 * <p>
 * All navigation methods return lazily evaluated axes which combine the filters returned by
 * {@link DefaultFilters#current()} with the filters passed by the caller. Filters decide which
 * nodes are yielded, they never prune the traversal of subtrees.
 * </p>
 */
public abstract class Node {

  /** The owning container, {@code null} if the node is unattached. */
  @Nullable
  ParentNode parent;

  /**
   * Get the kind of the node.
   *
   * @return the node kind
   */
  public abstract NodeKind getKind();

  /**
   * Creates an unattached copy of this node.
   *
   * @param deep {@code true} to clone descendants as well, {@code false} to copy only the node's
   *        own data
   * @return the copy
   */
  public abstract Node cloneNode(boolean deep);

  /**
   * Get the concatenated content of all text nodes of this node and its descendants, regardless of
   * the active default filters.
   *
   * @return the text content
   */
  public abstract String getFullText();

  /**
   * Get the parent tag. The document root has no parent.
   *
   * @return the parent tag or {@code null}
   */
  public @Nullable TagNode getParent() {
    return parent instanceof TagNode ? (TagNode) parent : null;
  }

  /**
   * Get the unfiltered child collection this node belongs to.
   *
   * @return the siblings, including this node, or {@code null} if the node is unattached
   */
  public @Nullable ChildNodes getSiblings() {
    return parent == null ? null : parent.getChildNodes();
  }

  /**
   * Get the number of tag ancestors. A top-level node has depth {@code 0}.
   *
   * @return the depth
   */
  public @NonNegative int getDepth() {
    int depth = 0;
    for (TagNode ancestor = getParent(); ancestor != null; ancestor = ancestor.getParent()) {
      depth++;
    }
    return depth;
  }

  /**
   * Get the position of this node among its siblings which match the active default filters.
   *
   * @return the index, or {@code -1} if the node is unattached or filtered out itself
   */
  public int getIndex() {
    if (parent == null || !DefaultFilters.matches(this)) {
      return Constants.NULL_INDEX;
    }
    int index = 0;
    for (final Node sibling : parent.getChildNodes()) {
      if (sibling == this) {
        return index;
      }
      if (DefaultFilters.matches(sibling)) {
        index++;
      }
    }
    throw new IllegalStateException("Node isn't contained in its parent's child nodes.");
  }

  /**
   * Removes this node from its parent.
   *
   * @return this node
   * @throws StructuralConflictException if this node is the root of a document
   */
  public Node detach() {
    if (parent == null) {
      return this;
    }
    if (parent instanceof DocumentNode && this instanceof TagNode) {
      throw new StructuralConflictException("The root node of a document can't be detached.");
    }
    parent.getChildNodes().remove(this);
    return this;
  }

  /**
   * Puts {@code node} at the position of this node, which is detached.
   *
   * @param node the replacement, which must be unattached
   * @return this node, now unattached
   * @throws StructuralConflictException if this node is unattached or the root of a document, or
   *         if {@code node} is attached
   */
  public Node replaceWith(final Node node) {
    requireNonNull(node);
    if (parent == null) {
      throw new StructuralConflictException("An unattached node can't be replaced.");
    }
    if (parent instanceof DocumentNode && this instanceof TagNode) {
      throw new StructuralConflictException("The root node of a document can't be replaced.");
    }
    parent.getChildNodes().replace(this, node);
    return this;
  }

  /**
   * Inserts nodes directly after this one.
   *
   * @param nodes the nodes to insert, which must be unattached
   * @throws StructuralConflictException if this node is unattached or a node is already attached
   */
  public void addFollowingSiblings(final Node... nodes) {
    final ChildNodes siblings = attachedSiblings();
    siblings.insert(siblings.indexOf(this) + 1, nodes);
  }

  /**
   * Inserts nodes directly before this one.
   *
   * @param nodes the nodes to insert, which must be unattached
   * @throws StructuralConflictException if this node is unattached or a node is already attached
   */
  public void addPrecedingSiblings(final Node... nodes) {
    final ChildNodes siblings = attachedSiblings();
    siblings.insert(siblings.indexOf(this), nodes);
  }

  private ChildNodes attachedSiblings() {
    if (parent == null) {
      throw new StructuralConflictException("Can't add siblings to an unattached node.");
    }
    return parent.getChildNodes();
  }

  /**
   * Iterates over the tag ancestors, the nearest first.
   *
   * @param filters additional filters
   * @return the axis
   */
  public Axis iterateAncestors(final Filter... filters) {
    return filtered(new AncestorAxis(this), filters);
  }

  /**
   * Iterates over all nodes after this one in document order, starting with its descendants.
   *
   * @param filters additional filters
   * @return the axis
   */
  public Axis iterateFollowing(final Filter... filters) {
    return iterateFollowing(true, filters);
  }

  /**
   * Iterates over all nodes after this one in document order.
   *
   * @param includeDescendants {@code true} to start with the node's own descendants
   * @param filters additional filters
   * @return the axis
   */
  public Axis iterateFollowing(final boolean includeDescendants, final Filter... filters) {
    return filtered(new FollowingAxis(this, includeDescendants), filters);
  }

  /**
   * Iterates over all nodes before this one in reverse document order, ancestors excluded.
   *
   * @param filters additional filters
   * @return the axis
   */
  public Axis iteratePreceding(final Filter... filters) {
    return filtered(new PrecedingAxis(this, false), filters);
  }

  /**
   * Iterates over the siblings after this node.
   *
   * @param filters additional filters
   * @return the axis
   */
  public Axis iterateFollowingSiblings(final Filter... filters) {
    return filtered(new FollowingSiblingAxis(this), filters);
  }

  /**
   * Iterates over the siblings before this node, the nearest first.
   *
   * @param filters additional filters
   * @return the axis
   */
  public Axis iteratePrecedingSiblings(final Filter... filters) {
    return filtered(new PrecedingSiblingAxis(this), filters);
  }

  public @Nullable Node fetchFollowing(final Filter... filters) {
    return Iterators.getNext(iterateFollowing(filters), null);
  }

  public @Nullable Node fetchPreceding(final Filter... filters) {
    return Iterators.getNext(iteratePreceding(filters), null);
  }

  public @Nullable Node fetchFollowingSibling(final Filter... filters) {
    return Iterators.getNext(iterateFollowingSiblings(filters), null);
  }

  public @Nullable Node fetchPrecedingSibling(final Filter... filters) {
    return Iterators.getNext(iteratePrecedingSiblings(filters), null);
  }

  /**
   * Evaluates an XPath expression with this node as context.
   *
   * @param expression the expression
   * @return the results
   */
  public QueryResults xpath(final String expression) {
    return XPath.evaluate(this, expression, null);
  }

  /**
   * Evaluates an XPath expression with this node as context.
   *
   * @param expression the expression
   * @param namespaces prefix to namespace mapping, the empty prefix denotes the default namespace
   * @return the results
   */
  public QueryResults xpath(final String expression, final @Nullable Map<String, String> namespaces) {
    return XPath.evaluate(this, expression, namespaces);
  }

  static Axis filtered(final Axis axis, final Filter... filters) {
    return new FilterAxis(axis, DefaultFilters.combine(filters));
  }
}
