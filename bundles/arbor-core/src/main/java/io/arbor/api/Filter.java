package io.arbor.api;

import io.arbor.node.Node;

/**
 * Filter for nodes, applied to the nodes an axis yields.
 */
@FunctionalInterface
public interface Filter {

  /**
   * Apply the filter on the given node.
   *
   * @param node the node to check
   * @return {@code true} if the node passes the filter, {@code false} otherwise
   */
  boolean filter(Node node);
}
