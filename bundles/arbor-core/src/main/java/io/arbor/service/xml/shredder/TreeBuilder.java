package io.arbor.service.xml.shredder;

import io.arbor.exception.InvalidContentException;
import io.arbor.node.CommentNode;
import io.arbor.node.DocumentNode;
import io.arbor.node.Node;
import io.arbor.node.ProcessingInstructionNode;
import io.arbor.node.QualifiedName;
import io.arbor.node.TagNode;
import io.arbor.settings.Constants;
import io.arbor.utils.LogWrapper;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Builds a tree from a stream of {@link XmlEvent}s. Consecutive text events are merged into one
 * text node. Whitespace outside of the root tag is ignored.
 *
 * <p>
 * In document mode, comments and processing instructions before and after the root tag are kept
 * as siblings of the root below a {@link DocumentNode}. Otherwise the root is returned unattached
 * and they are dropped.
 * </p>
 */
public final class TreeBuilder {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER =
      new LogWrapper(LoggerFactory.getLogger(TreeBuilder.class));

  /** Determines if a document is built. */
  private final boolean asDocument;

  /** The open tags, innermost on top. */
  private final Deque<TagNode> openTags = new ArrayDeque<>();

  /** Pending character data. */
  private final StringBuilder text = new StringBuilder();

  /** Top-level nodes before the root tag. */
  private final List<Node> leading = new ArrayList<>();

  /** Top-level nodes after the root tag. */
  private final List<Node> trailing = new ArrayList<>();

  /** The root tag, once started. */
  @Nullable
  private TagNode root;

  /** Determines if {@link #finish()} was called. */
  private boolean finished;

  /**
   * Constructor.
   *
   * @param asDocument {@code true} to attach the root to a {@link DocumentNode}
   */
  public TreeBuilder(final boolean asDocument) {
    this.asDocument = asDocument;
  }

  /**
   * Consumes the next event.
   *
   * @param event the event
   * @throws InvalidContentException if the event doesn't fit the tree built so far
   */
  public void accept(final XmlEvent event) {
    requireNonNull(event);
    checkState(!finished, "The tree is already built.");
    if (event instanceof TextEvent) {
      text.append(((TextEvent) event).content());
      return;
    }
    flushText();
    if (event instanceof TagStartEvent) {
      startTag((TagStartEvent) event);
    } else if (event instanceof TagEndEvent) {
      endTag((TagEndEvent) event);
    } else if (event instanceof CommentEvent) {
      addLeaf(new CommentNode(((CommentEvent) event).content()));
    } else if (event instanceof ProcessingInstructionEvent) {
      final ProcessingInstructionEvent instruction = (ProcessingInstructionEvent) event;
      addLeaf(new ProcessingInstructionNode(instruction.target(), instruction.content()));
    } else {
      throw new IllegalArgumentException("Unknown event: " + event);
    }
  }

  /**
   * Completes the tree.
   *
   * @return the root tag, attached to a {@link DocumentNode} in document mode
   * @throws InvalidContentException if tags are still open or there is no root tag
   */
  public TagNode finish() {
    checkState(!finished, "The tree is already built.");
    flushText();
    if (!openTags.isEmpty()) {
      throw new InvalidContentException("The tag %s is not closed.",
          openTags.peek().getQualifiedName());
    }
    if (root == null) {
      throw new InvalidContentException("The input contains no tag.");
    }
    finished = true;
    if (asDocument) {
      final DocumentNode document = DocumentNode.create(root);
      document.prependChildren(leading.toArray(new Node[0]));
      document.appendChildren(trailing.toArray(new Node[0]));
    }
    return root;
  }

  private void startTag(final TagStartEvent event) {
    for (final Map.Entry<QualifiedName, String> attribute : event.attributes().entrySet()) {
      final QualifiedName name = attribute.getKey();
      if (name.getNamespace().equals(Constants.XMLNS_NAMESPACE)
          || !name.hasNamespace() && name.getLocalName().equals("xmlns")) {
        throw new InvalidContentException(
            "Namespace declarations are not attributes, found %s on %s.", name,
            event.localName());
      }
    }
    final TagNode tag = new TagNode(QualifiedName.of(event.namespace(), event.localName()),
        event.attributes());
    if (openTags.isEmpty()) {
      if (root != null) {
        throw new InvalidContentException("A second top-level tag %s follows the root %s.",
            tag.getQualifiedName(), root.getQualifiedName());
      }
      root = tag;
    } else {
      openTags.peek().appendChildren(tag);
    }
    openTags.push(tag);
  }

  private void endTag(final TagEndEvent event) {
    final QualifiedName name = QualifiedName.of(event.namespace(), event.localName());
    final TagNode tag = openTags.poll();
    if (tag == null) {
      throw new InvalidContentException("The end of %s has no matching start.", name);
    }
    if (!tag.getQualifiedName().equals(name)) {
      throw new InvalidContentException("The end of %s doesn't match the open tag %s.", name,
          tag.getQualifiedName());
    }
  }

  private void addLeaf(final Node node) {
    if (!openTags.isEmpty()) {
      openTags.peek().appendChildren(node);
    } else if (!asDocument) {
      LOGWRAPPER.debug("Dropping top-level {} of a fragment.", node);
    } else if (root == null) {
      leading.add(node);
    } else {
      trailing.add(node);
    }
  }

  private void flushText() {
    if (text.length() == 0) {
      return;
    }
    final String content = text.toString();
    text.setLength(0);
    if (!openTags.isEmpty()) {
      openTags.peek().appendText(content);
    } else if (!content.isBlank()) {
      throw new InvalidContentException("Text outside of the root tag: '%s'.", content.strip());
    }
  }
}
