package io.arbor.node;

import com.google.common.base.MoreObjects;
import io.arbor.exception.InvalidContentException;
import io.arbor.utils.XmlChars;

/**
 * A comment. Its content must neither contain {@code --} nor end with {@code -}.
 */
public final class CommentNode extends Node {

  /** The comment text. */
  private String content;

  /**
   * Constructor.
   *
   * @param content the comment text
   * @throws InvalidContentException if {@code content} isn't allowed in a comment
   */
  public CommentNode(final String content) {
    this.content = checkContent(content);
  }

  private static String checkContent(final String content) {
    XmlChars.checkText(content);
    if (content.contains("--") || content.endsWith("-")) {
      throw new InvalidContentException(
          "A comment must neither contain '--' nor end with '-': '%s'", content);
    }
    return content;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.COMMENT;
  }

  public String getContent() {
    return content;
  }

  /**
   * Set the comment text.
   *
   * @param content the comment text
   * @throws InvalidContentException if {@code content} isn't allowed in a comment
   */
  public void setContent(final String content) {
    this.content = checkContent(content);
  }

  @Override
  public CommentNode cloneNode(final boolean deep) {
    return new CommentNode(content);
  }

  @Override
  public String getFullText() {
    return "";
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("content", content).toString();
  }
}
