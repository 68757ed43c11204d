package io.arbor.service.xml.shredder;

import static java.util.Objects.requireNonNull;

/**
 * A comment.
 *
 * @param content the text between the delimiters
 */
public record CommentEvent(String content) implements XmlEvent {

  public CommentEvent {
    requireNonNull(content);
  }
}
