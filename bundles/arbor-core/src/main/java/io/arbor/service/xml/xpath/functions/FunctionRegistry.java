package io.arbor.service.xml.xpath.functions;

import com.google.common.base.MoreObjects;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static java.util.Objects.requireNonNull;

/**
 * Thread-safe mapping of function names to implementations. Evaluations without an explicit
 * registry use the {@link #getDefault() default registry}, to which custom functions can be added
 * globally.
 */
public final class FunctionRegistry {

  /** The registry shared by all evaluations without an explicit one. */
  private static final FunctionRegistry DEFAULT = withBuiltIns();

  /** The functions by name. */
  private final Map<String, XPathFunction> functions = new ConcurrentHashMap<>();

  /**
   * Creates an empty registry.
   */
  public FunctionRegistry() {
  }

  /**
   * Creates a registry which contains the {@link BuiltInFunction built-in functions}.
   *
   * @return the new registry
   */
  public static FunctionRegistry withBuiltIns() {
    final FunctionRegistry registry = new FunctionRegistry();
    for (final BuiltInFunction function : BuiltInFunction.values()) {
      registry.register(function.getFunctionName(), function);
    }
    return registry;
  }

  /**
   * Get the global registry.
   *
   * @return the registry
   */
  public static FunctionRegistry getDefault() {
    return DEFAULT;
  }

  /**
   * Registers a function, replacing one with the same name.
   *
   * @param name the name in expressions
   * @param function the implementation
   * @return this registry
   */
  public FunctionRegistry register(final String name, final XPathFunction function) {
    functions.put(requireNonNull(name), requireNonNull(function));
    return this;
  }

  /**
   * Removes a function.
   *
   * @param name the name in expressions
   * @return {@code true} if a function was removed
   */
  public boolean unregister(final String name) {
    return functions.remove(requireNonNull(name)) != null;
  }

  public @Nullable XPathFunction get(final String name) {
    return functions.get(requireNonNull(name));
  }

  public boolean contains(final String name) {
    return functions.containsKey(requireNonNull(name));
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("functions", functions.keySet()).toString();
  }
}
