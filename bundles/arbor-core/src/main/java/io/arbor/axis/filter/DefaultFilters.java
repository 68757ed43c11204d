package io.arbor.axis.filter;

import com.google.common.collect.ImmutableList;
import io.arbor.api.Filter;
import io.arbor.node.Node;
import io.arbor.utils.LogWrapper;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * <p>
 * Per-thread stack of filters which all navigation, indexing and length operations of the node
 * model combine with the filters passed by the caller. The active filters are those on top of the
 * stack. Initially only tag and text nodes are visible.
 * </p>
 *
 * <pre>
 * try (DefaultFilters.Scope scope = DefaultFilters.alter(true, Filters.isTagNode())) {
 *   // only tags are visible here
 * }
 * </pre>
 */
public final class DefaultFilters {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER =
      new LogWrapper(LoggerFactory.getLogger(DefaultFilters.class));

  /** The filter active if nothing was altered. */
  private static final Filter INITIAL = Filters.anyOf(Filters.isTagNode(), Filters.isTextNode());

  /** The scopes of the current thread. */
  private static final ThreadLocal<Deque<Scope>> SCOPES = ThreadLocal.withInitial(() -> {
    final Deque<Scope> scopes = new ArrayDeque<>();
    scopes.push(new Scope(null, ImmutableList.of(INITIAL)));
    return scopes;
  });

  /** Hidden constructor. */
  private DefaultFilters() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Get the active filters of the current thread.
   *
   * @return the filters on top of the stack
   */
  public static List<Filter> current() {
    return SCOPES.get().peek().filters;
  }

  /**
   * Pushes new filters until the returned scope is closed.
   *
   * @param extend {@code true} to append {@code filters} to the active ones, {@code false} to
   *        replace them
   * @param filters the filters
   * @return the scope to close, usually with try-with-resources
   */
  public static Scope alter(final boolean extend, final Filter... filters) {
    final Deque<Scope> scopes = SCOPES.get();
    final ImmutableList.Builder<Filter> builder = ImmutableList.builder();
    if (extend) {
      builder.addAll(scopes.peek().filters);
    }
    for (final Filter filter : filters) {
      builder.add(requireNonNull(filter));
    }
    final Scope scope = new Scope(scopes, builder.build());
    scopes.push(scope);
    return scope;
  }

  /**
   * Runs a function with altered filters.
   *
   * @param extend {@code true} to append {@code filters} to the active ones, {@code false} to
   *        replace them
   * @param function the function
   * @param filters the filters
   * @param <T> the type of the result
   * @return the result of the function
   */
  public static <T> T call(final boolean extend, final Supplier<T> function,
      final Filter... filters) {
    try (Scope ignored = alter(extend, filters)) {
      return function.get();
    }
  }

  /**
   * Determines if a node passes the active filters and the given ones.
   *
   * @param node the node to test
   * @param filters additional filters
   * @return {@code true} if the node passes all filters
   */
  public static boolean matches(final Node node, final Filter... filters) {
    for (final Filter filter : current()) {
      if (!filter.filter(node)) {
        return false;
      }
    }
    for (final Filter filter : filters) {
      if (!filter.filter(node)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Combines a snapshot of the active filters with the given ones.
   *
   * @param filters additional filters
   * @return a filter which passes nodes that pass all of them
   */
  public static Filter combine(final Filter... filters) {
    return Filters.all(ImmutableList.<Filter>builder().addAll(current()).add(filters).build());
  }

  /**
   * An entry of the filter stack, popped by {@link #close()}.
   */
  public static final class Scope implements AutoCloseable {

    /** The stack this scope was pushed on, {@code null} for the initial entry. */
    @Nullable
    private final Deque<Scope> scopes;

    /** The filters. */
    private final List<Filter> filters;

    /** Determines if the scope is closed. */
    private boolean closed;

    private Scope(final @Nullable Deque<Scope> scopes, final List<Filter> filters) {
      this.scopes = scopes;
      this.filters = filters;
    }

    public List<Filter> getFilters() {
      return filters;
    }

    /**
     * Pops this scope. Inner scopes which are still open are popped and closed as well. Closing it
     * again has no effect.
     */
    @Override
    public void close() {
      if (closed || scopes == null) {
        return;
      }
      closed = true;
      if (!scopes.contains(this)) {
        return;
      }
      Scope top = scopes.pop();
      while (top != this) {
        LOGWRAPPER.warn("Closing a filter scope which is still open: {}", top.filters);
        top.closed = true;
        top = scopes.pop();
      }
    }
  }
}
