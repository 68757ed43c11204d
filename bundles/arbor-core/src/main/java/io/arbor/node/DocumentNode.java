package io.arbor.node;

import com.google.common.base.MoreObjects;
import io.arbor.exception.StructuralConflictException;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Internal container above the root tag of a document, which lets navigation reach leading and
 * trailing comments and processing instructions. It holds at most one tag, never text, and can't
 * be detached, replaced or cloned. Public navigation never returns it: the parent of the root
 * tag is {@code null}.
 */
public final class DocumentNode extends ParentNode {

  /** {@code true} for a view above an unattached node, which doesn't own its child. */
  private final boolean view;

  private DocumentNode(final boolean view) {
    this.view = view;
  }

  /**
   * Creates a document with the given root.
   *
   * @param root the unattached root tag
   * @return the document
   * @throws StructuralConflictException if {@code root} is attached
   */
  public static DocumentNode create(final TagNode root) {
    final DocumentNode document = new DocumentNode(false);
    document.appendChildren(requireNonNull(root));
    return document;
  }

  /**
   * Returns the document the topmost ancestor of {@code node} belongs to. If it doesn't belong to
   * a document, a view is returned whose only child is the topmost ancestor, without that node
   * being attached to it. Views reject all insertions.
   *
   * @param node a node of the tree
   * @return the document or a view
   */
  public static DocumentNode forTree(final Node node) {
    requireNonNull(node);
    if (node instanceof DocumentNode) {
      return (DocumentNode) node;
    }
    Node top = node;
    while (top.parent != null && !(top.parent instanceof DocumentNode)) {
      top = top.parent;
    }
    if (top.parent != null) {
      return (DocumentNode) top.parent;
    }
    final DocumentNode document = new DocumentNode(true);
    document.getChildNodes().addUnowned(top);
    return document;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.DOCUMENT;
  }

  /**
   * Determines if this is a non-owning view above an unattached node.
   *
   * @return {@code true} if this is a view
   */
  public boolean isView() {
    return view;
  }

  /**
   * Get the root tag.
   *
   * @return the root tag or {@code null} if there is none
   */
  public @Nullable TagNode getRootNode() {
    for (final Node child : getChildNodes()) {
      if (child instanceof TagNode) {
        return (TagNode) child;
      }
    }
    return null;
  }

  @Override
  public Node detach() {
    throw new StructuralConflictException("A document node can't be detached.");
  }

  @Override
  public Node replaceWith(final Node node) {
    throw new StructuralConflictException("A document node can't be replaced.");
  }

  @Override
  public DocumentNode cloneNode(final boolean deep) {
    throw new StructuralConflictException("A document node can't be cloned.");
  }

  @Override
  void checkInsertable(final List<Node> insertions, final @Nullable Node removal) {
    if (view) {
      throw new StructuralConflictException("Nodes can't be inserted into a document view.");
    }
    int tags = 0;
    for (final Node child : getChildNodes()) {
      if (child instanceof TagNode && child != removal) {
        tags++;
      }
    }
    for (final Node node : insertions) {
      if (node instanceof TextNode) {
        throw new StructuralConflictException("A document can't contain text nodes.");
      }
      if (node instanceof TagNode && ++tags > 1) {
        throw new StructuralConflictException("A document can't contain more than one root tag.");
      }
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("view", view).add("root", getRootNode()).toString();
  }
}
