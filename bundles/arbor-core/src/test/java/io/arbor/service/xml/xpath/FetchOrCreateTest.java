package io.arbor.service.xml.xpath;

import io.arbor.exception.AmbiguousTreeException;
import io.arbor.exception.XPathEvaluationException;
import io.arbor.node.QualifiedName;
import io.arbor.node.TagNode;
import io.arbor.service.xml.serialize.XmlSerializer;
import io.arbor.service.xml.shredder.XmlTreeParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("FetchOrCreate")
class FetchOrCreateTest {

  @Nested
  @DisplayName("Creation")
  class Creation {

    @Test
    @DisplayName("missing tags are created with the attributes of their predicates")
    void testCreateBranch() {
      final TagNode root = new TagNode("root");
      final TagNode grandchild = root.fetchOrCreateByXPath("child[@a='b']/grandchild");
      assertEquals("<root><child a=\"b\"><grandchild/></child></root>", XmlSerializer.toString(root));
      assertEquals("grandchild", grandchild.getLocalName());
      assertSame(root, grandchild.getParent().getParent());
    }

    @Test
    @DisplayName("repeating a call returns the same tag without changes")
    void testIdempotent() {
      final TagNode root = new TagNode("root");
      final TagNode first = root.fetchOrCreateByXPath("child[@a='b']/grandchild");
      final String markup = XmlSerializer.toString(root);
      assertSame(first, root.fetchOrCreateByXPath("child[@a='b']/grandchild"));
      assertSame(first, root.fetchOrCreateByXPath("child[ 'b' = @a ]/grandchild"));
      assertEquals(markup, XmlSerializer.toString(root));
    }

    @Test
    @DisplayName("existing tags are reused, other branches are left alone")
    void testPartialBranch() {
      final TagNode root = XmlTreeParser.parseString("<root><child a=\"c\"/><child a=\"b\"><x/></child></root>");
      final TagNode created = root.fetchOrCreateByXPath("child[@a='b']/y");
      assertEquals("<root><child a=\"c\"/><child a=\"b\"><x/><y/></child></root>",
          XmlSerializer.toString(root));
      assertSame(root.getChild(1), created.getParent());
      final TagNode sibling = root.fetchOrCreateByXPath("child[@a='d']");
      assertSame(root.getChild(2), sibling);
    }

    @Test
    @DisplayName("conjunctions set several attributes")
    void testConjunction() {
      final TagNode root = new TagNode("root");
      final TagNode created = root.fetchOrCreateByXPath("x[@a='1' and @b='2'][@c='3']");
      assertEquals("1", created.getAttributeValue("a"));
      assertEquals("2", created.getAttributeValue("b"));
      assertEquals("3", created.getAttributeValue("c"));
    }

    @Test
    @DisplayName("created tags use the resolved namespaces")
    void testNamespaces() {
      final TagNode root = new TagNode("{urn:x}root");
      final TagNode inherited = root.fetchOrCreateByXPath("item");
      assertEquals(QualifiedName.of("urn:x", "item"), inherited.getQualifiedName());

      final TagNode prefixed =
          root.fetchOrCreateByXPath("p:item[@p:kind='k']", Map.of("p", "urn:p"));
      assertEquals(QualifiedName.of("urn:p", "item"), prefixed.getQualifiedName());
      assertEquals("k", prefixed.getAttributes().get("urn:p", "kind").getValue());
      assertSame(prefixed, root.fetchOrCreateByXPath("q:item[@q:kind='k']", Map.of("q", "urn:p")));
    }

    @Test
    @DisplayName("absolute paths start at the root tag")
    void testAbsolutePath() {
      final TagNode root = XmlTreeParser.parseString("<root><a><b/></a></root>");
      final TagNode deep = (TagNode) root.xpath("a/b").first();
      final TagNode created = deep.fetchOrCreateByXPath("/c");
      assertSame(root, created.getParent());
      assertSame(deep, deep.fetchOrCreateByXPath("/a/b"));
      assertSame(created, root.fetchOrCreateByXPath("/c"));
      final TagNode nested = deep.fetchOrCreateByXPath("/root/c");
      assertSame(root, nested.getParent().getParent());
      assertEquals("<root><a><b/></a><c/><root><c/></root></root>", XmlSerializer.toString(root));
    }
  }

  @Nested
  @DisplayName("Failures")
  class Failures {

    @ParameterizedTest(name = "''{0}''")
    @ValueSource(strings = {"//a", "a[1]", "a | b", "*", "a/..", "a[@b]", "a[@b='c' or @b='d']",
        "a[@b!='c']", "descendant::a", "text()"})
    @DisplayName("expressions which may select several tags are rejected")
    void testNotLocatable(final String expression) {
      final TagNode root = new TagNode("root");
      assertThrows(XPathEvaluationException.class, () -> root.fetchOrCreateByXPath(expression));
      assertEquals(0, root.length());
    }

    @Test
    @DisplayName("several matching tags are ambiguous")
    void testAmbiguous() {
      final TagNode root = XmlTreeParser.parseString("<root><child/><child/></root>");
      final AmbiguousTreeException direct =
          assertThrows(AmbiguousTreeException.class, () -> root.fetchOrCreateByXPath("child"));
      assertTrue(direct.getMessage().contains("2"), direct.getMessage());
      assertThrows(AmbiguousTreeException.class,
          () -> root.fetchOrCreateByXPath("child/grandchild"));
      assertEquals(0, ((TagNode) root.getChild(0)).length());
    }

    @Test
    @DisplayName("conflicting attribute values are rejected")
    void testConflict() {
      final TagNode root = new TagNode("root");
      assertThrows(XPathEvaluationException.class,
          () -> root.fetchOrCreateByXPath("x[@a='1' and @a='2']"));
      assertEquals(0, root.length());
    }
  }
}
