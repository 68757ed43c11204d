package io.arbor.service.xml.shredder;

import io.arbor.exception.ArborIOException;
import io.arbor.node.ChildNodes;
import io.arbor.node.CommentNode;
import io.arbor.node.DocumentNode;
import io.arbor.node.NodeKind;
import io.arbor.node.ProcessingInstructionNode;
import io.arbor.node.QualifiedName;
import io.arbor.node.TagNode;
import io.arbor.node.TextNode;
import io.arbor.settings.Constants;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("XmlTreeParser")
class XmlTreeParserTest {

  @Nested
  @DisplayName("Content")
  class Content {

    @Test
    @DisplayName("comments and processing instructions are kept by default")
    void testMixedContent() {
      final TagNode root = XmlTreeParser.parseString("<a>x<!--c--><?pi  data ?><b/></a>");
      final ChildNodes children = root.getChildNodes();
      assertEquals(4, children.size());
      assertEquals("x", ((TextNode) children.get(0)).getContent());
      assertEquals("c", ((CommentNode) children.get(1)).getContent());
      final ProcessingInstructionNode instruction = (ProcessingInstructionNode) children.get(2);
      assertEquals("pi", instruction.getTarget());
      assertEquals("data", instruction.getContent());
      assertEquals(NodeKind.TAG, children.get(3).getKind());
      assertEquals(2, root.length());
    }

    @Test
    @DisplayName("comments and processing instructions can be skipped")
    void testSkipping() {
      final XmlTreeParser parser =
          XmlTreeParser.newBuilder().includeComments(false).includePIs(false).build();
      final TagNode root = parser.parse("<a>x<!--c-->y<?pi data?>z</a>");
      assertEquals(1, root.getChildNodes().size());
      assertEquals("xyz", ((TextNode) root.getChild(0)).getContent());
    }

    @Test
    @DisplayName("references and character data become one text node")
    void testCharacterData() {
      final TagNode root = XmlTreeParser.parseString("<a>&lt;&amp;<![CDATA[<b>]]>&#65;</a>");
      assertEquals(1, root.length());
      assertEquals("<&<b>A", root.getFullText());
    }

    @Test
    @DisplayName("names keep their namespaces, declarations aren't attributes")
    void testNamespaces() {
      final TagNode root = XmlTreeParser.parseString(
          "<r xmlns='urn:x' xmlns:p='urn:p'><p:c p:a='1' b='2' xml:lang='en'/></r>");
      assertEquals(QualifiedName.of("urn:x", "r"), root.getQualifiedName());
      assertEquals(0, root.getAttributes().size());
      final TagNode child = (TagNode) root.getChild(0);
      assertEquals(QualifiedName.of("urn:p", "c"), child.getQualifiedName());
      assertEquals("1", child.getAttributes().get("urn:p", "a").getValue());
      assertEquals("2", child.getAttributeValue("b"));
      assertEquals("en", child.getAttributes().get(Constants.XML_NAMESPACE, "lang").getValue());
      assertEquals(3, child.getAttributes().size());
    }

    @Test
    @DisplayName("byte streams are decoded by their declaration")
    void testInputStream() {
      final byte[] bytes = "<?xml version=\"1.0\" encoding=\"ISO-8859-1\"?><a>ü</a>"
          .getBytes(StandardCharsets.ISO_8859_1);
      final TagNode root = XmlTreeParser.newBuilder().build().parse(new ByteArrayInputStream(bytes));
      assertEquals("ü", root.getFullText());
    }
  }

  @Nested
  @DisplayName("Top-level nodes")
  class TopLevel {

    private static final String MARKUP = "<?xml version='1.0'?>\n<!--lead-->\n<a/>\n<?trail?>\n";

    @Test
    @DisplayName("a fragment drops them")
    void testFragment() {
      final TagNode root = XmlTreeParser.newBuilder().build().parse(new StringReader(MARKUP));
      assertNull(root.getSiblings());
      assertTrue(DocumentNode.forTree(root).isView());
      assertEquals(1, DocumentNode.forTree(root).getChildNodes().size());
    }

    @Test
    @DisplayName("a document keeps them around the root")
    void testDocument() {
      final TagNode root = XmlTreeParser.newBuilder().asDocument(true).build().parse(MARKUP);
      final DocumentNode document = DocumentNode.forTree(root);
      assertFalse(document.isView());
      assertSame(root, document.getRootNode());
      final ChildNodes children = document.getChildNodes();
      assertEquals(3, children.size());
      assertInstanceOf(CommentNode.class, children.get(0));
      assertSame(root, children.get(1));
      assertInstanceOf(ProcessingInstructionNode.class, children.get(2));
      assertEquals(1, document.length());
    }
  }

  @Nested
  @DisplayName("Failures")
  class Failures {

    @Test
    @DisplayName("malformed markup")
    void testMalformed() {
      assertThrows(ArborIOException.class, () -> XmlTreeParser.parseString("<a><b></a>"));
      assertThrows(ArborIOException.class, () -> XmlTreeParser.parseString("<a x='1' x='2'/>"));
      assertThrows(ArborIOException.class, () -> XmlTreeParser.parseString("<p:a/>"));
    }
  }
}
