package io.arbor.service.xml.xpath.expr;

import io.arbor.node.Node;
import io.arbor.service.xml.xpath.Namespaces;

/**
 * Test of a location step which a node must pass to be selected.
 */
public interface NodeTest {

  /**
   * Determines if a node passes the test.
   *
   * @param node the candidate
   * @param namespaces the namespaces to resolve prefixes with
   * @return {@code true} if the node passes
   */
  boolean matches(Node node, Namespaces namespaces);
}
