package io.arbor.settings;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Interface to hold all constants of the node model and the XPath engine.
 */
public final class Constants {

  /**
   * Private constructor.
   */
  private Constants() {
    // Cannot be instantiated.
    throw new AssertionError("May not be instantiated!");
  }

  // --- Encoding
  // ----------------------------------------------------------

  /** Default encoding of serialized markup. */
  public static final Charset DEFAULT_ENCODING = StandardCharsets.UTF_8;

  // --- Namespaces
  // ----------------------------------------------------------

  /** The namespace bound to the reserved {@code xml} prefix. */
  public static final String XML_NAMESPACE = "http://www.w3.org/XML/1998/namespace";

  /** The namespace of namespace declarations. */
  public static final String XMLNS_NAMESPACE = "http://www.w3.org/2000/xmlns/";

  /** Local name of the identifier attribute in the {@link #XML_NAMESPACE}. */
  public static final String ID_LOCAL_NAME = "id";

  // --- Nodes
  // ----------------------------------------------------------

  /** Index of a node which is detached or hidden by the active filters. */
  public static final int NULL_INDEX = -1;

  // --- XPath
  // ----------------------------------------------------------

  /** System property to override the number of cached compiled expressions. */
  public static final String XPATH_CACHE_SIZE_PROPERTY = "arbor.xpath.cacheSize";

  /** Number of cached compiled expressions unless overridden. */
  public static final int DEFAULT_XPATH_CACHE_SIZE = 64;

  /**
   * Returns the configured size of the expression cache.
   *
   * @return the value of {@link #XPATH_CACHE_SIZE_PROPERTY}, or {@link #DEFAULT_XPATH_CACHE_SIZE}
   *         if it isn't set
   */
  public static int xpathCacheSize() {
    return Integer.getInteger(XPATH_CACHE_SIZE_PROPERTY, DEFAULT_XPATH_CACHE_SIZE);
  }
}
