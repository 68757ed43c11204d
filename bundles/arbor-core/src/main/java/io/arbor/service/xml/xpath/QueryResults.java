package io.arbor.service.xml.xpath;

import com.google.common.collect.ImmutableList;
import io.arbor.api.Filter;
import io.arbor.node.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.AbstractList;
import java.util.List;
import java.util.RandomAccess;

/**
 * The immutable, duplicate-free result of an evaluation in the order the nodes were found.
 */
public final class QueryResults extends AbstractList<Node> implements RandomAccess {

  /** The nodes. */
  private final ImmutableList<Node> nodes;

  QueryResults(final List<Node> nodes) {
    this.nodes = ImmutableList.copyOf(nodes);
  }

  @Override
  public Node get(final int index) {
    return nodes.get(index);
  }

  @Override
  public int size() {
    return nodes.size();
  }

  public @Nullable Node first() {
    return nodes.isEmpty() ? null : nodes.get(0);
  }

  public @Nullable Node last() {
    return nodes.isEmpty() ? null : nodes.get(nodes.size() - 1);
  }

  /**
   * Get the nodes which pass all given filters.
   *
   * @param filters the filters
   * @return the remaining nodes in the same order
   */
  public QueryResults filteredBy(final Filter... filters) {
    final ImmutableList.Builder<Node> builder = ImmutableList.builder();
    for (final Node node : nodes) {
      boolean passes = true;
      for (final Filter filter : filters) {
        if (!filter.filter(node)) {
          passes = false;
          break;
        }
      }
      if (passes) {
        builder.add(node);
      }
    }
    return new QueryResults(builder.build());
  }

  /**
   * Get the nodes sorted in document order. Nodes of different trees keep the order in which their
   * trees were first encountered.
   *
   * @return the sorted results
   */
  public QueryResults inDocumentOrder() {
    return new QueryResults(DocumentOrder.sort(nodes));
  }

  public List<Node> asList() {
    return nodes;
  }
}
