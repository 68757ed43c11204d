package io.arbor.node;

import com.google.common.base.MoreObjects;
import io.arbor.exception.InvalidContentException;
import io.arbor.utils.XmlChars;

/**
 * Character data.
 */
public final class TextNode extends Node {

  /** The text. */
  private String content;

  /**
   * Constructor.
   *
   * @param content the text
   * @throws InvalidContentException if {@code content} contains invalid XML characters
   */
  public TextNode(final String content) {
    this.content = XmlChars.checkText(content);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.TEXT;
  }

  public String getContent() {
    return content;
  }

  /**
   * Set the text.
   *
   * @param content the new text
   * @throws InvalidContentException if {@code content} contains invalid XML characters
   */
  public void setContent(final String content) {
    this.content = XmlChars.checkText(content);
  }

  @Override
  public TextNode cloneNode(final boolean deep) {
    return new TextNode(content);
  }

  @Override
  public String getFullText() {
    return content;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("content", content).toString();
  }
}
