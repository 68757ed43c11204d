package io.arbor.service.xml.xpath;

import io.arbor.ArborTestHelper.TestDocument;
import io.arbor.axis.filter.Filters;
import io.arbor.node.CommentNode;
import io.arbor.node.DocumentNode;
import io.arbor.node.Node;
import io.arbor.node.TagNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.arbor.ArborTestHelper.assertNodes;
import static io.arbor.ArborTestHelper.createTestDocument;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("QueryResults")
class QueryResultsTest {

  @Test
  @DisplayName("first and last of empty results are null")
  void testEmpty() {
    final QueryResults results = new QueryResults(List.of());
    assertNull(results.first());
    assertNull(results.last());
  }

  @Test
  @DisplayName("results can't be modified")
  void testImmutable() {
    final TestDocument doc = createTestDocument();
    final QueryResults results = doc.a.xpath("b");
    assertThrows(UnsupportedOperationException.class, () -> results.add(doc.c1));
    assertThrows(UnsupportedOperationException.class, () -> results.asList().clear());
  }

  @Test
  @DisplayName("filtering keeps the order")
  void testFilteredBy() {
    final TestDocument doc = createTestDocument();
    final QueryResults results = doc.b2.xpath("node()");
    assertNodes(results.filteredBy(Filters.isTagNode()), doc.c2);
    assertNodes(results.filteredBy(Filters.not(Filters.isTagNode())), doc.bar, doc.instruction);
    assertNodes(results.filteredBy(), doc.c2, doc.bar, doc.instruction);
  }

  @Test
  @DisplayName("document order within and across trees")
  void testDocumentOrder() {
    final TestDocument doc = createTestDocument();
    final TagNode other = new TagNode("other");
    final TagNode otherChild = new TagNode("child");
    other.appendChildren(otherChild);
    final TagNode loose = new TagNode("loose");

    final List<Node> nodes = List.of(otherChild, doc.c2, loose, doc.b1, other, doc.a, doc.oops3);
    assertNodes(new QueryResults(nodes).inDocumentOrder(), other, otherChild, doc.a, doc.b1,
        doc.c2, doc.oops3, loose);
  }

  @Test
  @DisplayName("tags of a document are ordered after its leading nodes")
  void testDocumentChildren() {
    final TagNode root = new TagNode("root");
    final TagNode child = new TagNode("child");
    root.appendChildren(child);
    final DocumentNode document = DocumentNode.create(root);
    final Node comment = new CommentNode("c");
    document.prependChildren(comment);
    final QueryResults sorted = new QueryResults(List.of(child, root, comment)).inDocumentOrder();
    assertNodes(sorted, comment, root, child);
    assertSame(child, sorted.last());
  }
}
