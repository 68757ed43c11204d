package io.arbor.axis.filter;

import com.google.common.collect.ImmutableList;
import io.arbor.api.Filter;
import io.arbor.node.CommentNode;
import io.arbor.node.ProcessingInstructionNode;
import io.arbor.node.TagNode;
import io.arbor.node.TextNode;

import java.util.List;

/**
 * Factory methods for commonly used {@link Filter}s.
 */
public final class Filters {

  private static final Filter IS_TAG_NODE = node -> node instanceof TagNode;

  private static final Filter IS_TEXT_NODE = node -> node instanceof TextNode;

  private static final Filter IS_COMMENT_NODE = node -> node instanceof CommentNode;

  private static final Filter IS_PROCESSING_INSTRUCTION_NODE =
      node -> node instanceof ProcessingInstructionNode;

  private static final Filter IS_ROOT_NODE = node -> node.getParent() == null;

  /** Hidden constructor. */
  private Filters() {
    throw new AssertionError("May never be instantiated!");
  }

  public static Filter isTagNode() {
    return IS_TAG_NODE;
  }

  public static Filter isTextNode() {
    return IS_TEXT_NODE;
  }

  public static Filter isCommentNode() {
    return IS_COMMENT_NODE;
  }

  public static Filter isProcessingInstructionNode() {
    return IS_PROCESSING_INSTRUCTION_NODE;
  }

  /**
   * Matches nodes without a parent tag, which are detached nodes and the top-level nodes of a
   * document.
   *
   * @return the filter
   */
  public static Filter isRootNode() {
    return IS_ROOT_NODE;
  }

  /**
   * Matches nodes which pass at least one of the filters.
   *
   * @param filters the filters
   * @return the combined filter
   */
  public static Filter anyOf(final Filter... filters) {
    final List<Filter> copy = ImmutableList.copyOf(filters);
    return node -> {
      for (final Filter filter : copy) {
        if (filter.filter(node)) {
          return true;
        }
      }
      return false;
    };
  }

  /**
   * Matches nodes which pass all filters.
   *
   * @param filters the filters
   * @return the combined filter
   */
  public static Filter all(final Filter... filters) {
    return all(ImmutableList.copyOf(filters));
  }

  static Filter all(final List<Filter> filters) {
    final List<Filter> copy = ImmutableList.copyOf(filters);
    return node -> {
      for (final Filter filter : copy) {
        if (!filter.filter(node)) {
          return false;
        }
      }
      return true;
    };
  }

  /**
   * Matches nodes which don't pass all filters.
   *
   * @param filters the filters
   * @return the negated conjunction of the filters
   */
  public static Filter not(final Filter... filters) {
    final Filter all = all(filters);
    return node -> !all.filter(node);
  }
}
