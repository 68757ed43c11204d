package io.arbor.service.xml.xpath;

import io.arbor.node.ChildNodes;
import io.arbor.node.Node;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sorts nodes by the path of child indexes leading to them from the top of their tree.
 */
final class DocumentOrder {

  /** Hidden constructor. */
  private DocumentOrder() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Sorts nodes, stable for equal positions.
   *
   * @param nodes the nodes
   * @return a new sorted list
   */
  static List<Node> sort(final List<Node> nodes) {
    final Map<Node, int[]> paths = new IdentityHashMap<>();
    final Map<Object, Integer> trees = new IdentityHashMap<>();
    final Map<Node, Integer> treeOfNode = new IdentityHashMap<>();
    for (final Node node : nodes) {
      path(node, paths);
      treeOfNode.put(node, trees.computeIfAbsent(tree(node), key -> trees.size()));
    }
    final List<Node> sorted = new ArrayList<>(nodes);
    sorted.sort((first, second) -> {
      final int byTree = Integer.compare(treeOfNode.get(first), treeOfNode.get(second));
      return byTree != 0 ? byTree : Arrays.compare(paths.get(first), paths.get(second));
    });
    return sorted;
  }

  /**
   * Computes the index path of a node, reusing the paths of ancestors computed before.
   */
  private static int[] path(final Node node, final Map<Node, int[]> paths) {
    final int[] known = paths.get(node);
    if (known != null) {
      return known;
    }
    final ChildNodes siblings = node.getSiblings();
    final int[] path;
    if (siblings == null) {
      path = new int[0];
    } else {
      final Node parent = node.getParent();
      final int[] parentPath = parent == null ? new int[0] : path(parent, paths);
      path = Arrays.copyOf(parentPath, parentPath.length + 1);
      path[parentPath.length] = siblings.indexOf(node);
    }
    paths.put(node, path);
    return path;
  }

  /**
   * Identifies the tree of a node by the child collection holding its topmost tag, or by the
   * topmost node itself if it is unattached.
   */
  private static Object tree(final Node node) {
    Node top = node;
    while (top.getParent() != null) {
      top = top.getParent();
    }
    final ChildNodes siblings = top.getSiblings();
    return siblings == null ? top : siblings;
  }
}
