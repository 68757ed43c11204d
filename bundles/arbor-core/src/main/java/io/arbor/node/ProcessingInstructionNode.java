package io.arbor.node;

import com.google.common.base.MoreObjects;
import io.arbor.exception.InvalidContentException;
import io.arbor.utils.XmlChars;

/**
 * A processing instruction with a target and content.
 */
public final class ProcessingInstructionNode extends Node {

  /** The target, a valid name other than {@code xml}. */
  private String target;

  /** The content. */
  private String content;

  /**
   * Constructor.
   *
   * @param target the target, a valid XML name not equal to {@code xml} in any case
   * @param content the content, which must not contain {@code ?>}
   * @throws InvalidContentException if the target or the content is invalid
   */
  public ProcessingInstructionNode(final String target, final String content) {
    this.target = checkTarget(target);
    this.content = checkContent(content);
  }

  private static String checkTarget(final String target) {
    XmlChars.checkName(target);
    if (target.equalsIgnoreCase("xml")) {
      throw new InvalidContentException("The target of a processing instruction must not be '%s'.",
          target);
    }
    return target;
  }

  private static String checkContent(final String content) {
    XmlChars.checkText(content);
    if (content.contains("?>")) {
      throw new InvalidContentException(
          "The content of a processing instruction must not contain '?>': '%s'", content);
    }
    return content;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.PROCESSING_INSTRUCTION;
  }

  public String getTarget() {
    return target;
  }

  public void setTarget(final String target) {
    this.target = checkTarget(target);
  }

  public String getContent() {
    return content;
  }

  public void setContent(final String content) {
    this.content = checkContent(content);
  }

  @Override
  public ProcessingInstructionNode cloneNode(final boolean deep) {
    return new ProcessingInstructionNode(target, content);
  }

  @Override
  public String getFullText() {
    return "";
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("target", target).add("content", content).toString();
  }
}
