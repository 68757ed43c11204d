package io.arbor.api;

import com.google.common.collect.Streams;
import io.arbor.axis.IncludeSelf;
import io.arbor.node.Node;

import java.util.Iterator;
import java.util.stream.Stream;

/**
 * Lazily evaluated traversal starting at a node. An axis is an {@link Iterator} as well as an
 * {@link Iterable} returning itself, so it can be used once in an enhanced for loop.
 */
public interface Axis extends Iterator<Node>, Iterable<Node> {

  /**
   * Resets the axis to another start node.
   *
   * @param node the new start node
   */
  void reset(Node node);

  /**
   * Get the start node of the axis.
   *
   * @return the start node
   */
  Node getStartNode();

  /**
   * Determines if the start node is included.
   *
   * @return {@link IncludeSelf#YES} if it is included, {@link IncludeSelf#NO} otherwise
   */
  IncludeSelf includeSelf();

  /**
   * Get a sequential stream over the remaining nodes of this axis.
   *
   * @return the stream
   */
  default Stream<Node> stream() {
    return Streams.stream((Iterator<Node>) this);
  }
}
