package io.arbor.node;

import io.arbor.ArborTestHelper;
import io.arbor.ArborTestHelper.TestDocument;
import io.arbor.exception.InvalidContentException;
import io.arbor.exception.StructuralConflictException;
import io.arbor.settings.Constants;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static io.arbor.ArborTestHelper.assertNodes;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("TagNode")
class TagNodeTest {

  private TestDocument doc;

  @BeforeEach
  void setUp() {
    doc = ArborTestHelper.createTestDocument();
  }

  @Nested
  @DisplayName("Names")
  class Names {

    @Test
    @DisplayName("universal names carry the namespace in braces")
    void testUniversalName() {
      final TagNode tag = new TagNode("{urn:test}item");
      assertEquals("urn:test", tag.getNamespace());
      assertEquals("item", tag.getLocalName());
      assertEquals(QualifiedName.of("urn:test", "item"), tag.getQualifiedName());
    }

    @Test
    @DisplayName("renaming keeps the position and validates the name")
    void testRename() {
      doc.b1.setLocalName("renamed");
      doc.b1.setNamespace("urn:x");
      assertEquals("{urn:x}renamed", doc.b1.getQualifiedName().getUniversalName());
      assertEquals(1, doc.b1.getIndex());
      assertThrows(InvalidContentException.class, () -> doc.b1.setLocalName("1st"));
      assertThrows(InvalidContentException.class, () -> doc.b1.setLocalName("a:b"));
      assertThrows(InvalidContentException.class, () -> new TagNode("{urn:x"));
    }
  }

  @Nested
  @DisplayName("Identifiers")
  class Identifiers {

    @Test
    @DisplayName("xml:id is unique within the tree")
    void testUniqueId() {
      doc.c1.setId("first");
      assertEquals("first", doc.c1.getId());
      assertEquals("first",
          doc.c1.getAttributes().get(Constants.XML_NAMESPACE, "id").getValue());
      final StructuralConflictException e =
          assertThrows(StructuralConflictException.class, () -> doc.c2.setId("first"));
      assertTrue(e.getMessage().contains("/*[1]/*[1]/*[1]"), e.getMessage());
      assertNull(doc.c2.getId());
      doc.c1.setId("first");
    }

    @Test
    @DisplayName("removing and validating identifiers")
    void testRemoveId() {
      doc.c1.setId("first");
      doc.c1.setId(null);
      assertNull(doc.c1.getId());
      doc.c2.setId("first");
      assertThrows(InvalidContentException.class, () -> doc.c2.setId("no spaces"));
    }

    @Test
    @DisplayName("location paths count tag siblings")
    void testLocationPath() {
      assertEquals("/*[1]", doc.a.getLocationPath());
      assertEquals("/*[1]/*[2]", doc.b2.getLocationPath());
      assertEquals("/*[1]/*[2]/*[1]", doc.c2.getLocationPath());
    }
  }

  @Nested
  @DisplayName("Attributes")
  class AttributeAccess {

    @Test
    @DisplayName("setAttribute adds or updates")
    void testSetAttribute() {
      assertSame(doc.a, doc.a.setAttribute("i", "k"));
      doc.a.setAttribute("{urn:n}i", "l");
      assertEquals("k", doc.a.getAttributeValue("i"));
      assertEquals("l", doc.a.getAttributeValue("{urn:n}i"));
      assertEquals(2, doc.a.getAttributes().size());
      assertNull(doc.a.getAttributeValue("missing"));
    }

    @Test
    @DisplayName("renaming an attribute keeps its position")
    void testRenameAttribute() {
      doc.a.setAttribute("k", "v");
      doc.a.setAttribute("m", "w");
      final Attribute attribute = doc.a.getAttributes().get("k");
      attribute.setLocalName("renamed");
      assertEquals("[i, renamed, m]",
          doc.a.getAttributes().asMap().keySet().toString());
      assertThrows(StructuralConflictException.class, () -> attribute.setLocalName("m"));
      assertEquals("renamed", attribute.getLocalName());
      attribute.setNamespace("urn:n");
      assertSame(attribute, doc.a.getAttributes().get("urn:n", "renamed"));
      assertSame(doc.a, attribute.getNode());
    }

    @Test
    @DisplayName("removed attributes are detached")
    void testRemoveAttribute() {
      final Attribute attribute = doc.a.getAttributes().remove("i");
      assertNull(attribute.getNode());
      assertFalse(doc.a.getAttributes().contains(QualifiedName.of("i")));
      attribute.setLocalName("free");
      assertEquals("free", attribute.getLocalName());
    }

    @Test
    @DisplayName("attribute values must be valid text")
    void testInvalidValue() {
      assertThrows(InvalidContentException.class, () -> doc.a.setAttribute("v", "\u0001"));
    }
  }

  @Nested
  @DisplayName("Restructuring")
  class Restructuring {

    @Test
    @DisplayName("detach can retain the children in the former parent")
    void testDetachRetainingChildren() {
      assertSame(doc.b1, doc.b1.detach(true));
      assertNodes(doc.a.getChildNodes(), doc.oops1, doc.foo, doc.c1, doc.comment, doc.oops2,
          doc.b2, doc.oops3);
      assertEquals(0, doc.b1.getChildNodes().size());
      assertNull(doc.b1.getParent());
    }

    @Test
    @DisplayName("detach drops the subtree by default")
    void testDetach() {
      doc.b1.detach(false);
      assertNodes(doc.a.getChildNodes(), doc.oops1, doc.oops2, doc.b2, doc.oops3);
      assertNodes(doc.b1.getChildNodes(), doc.foo, doc.c1, doc.comment);
    }

    @Test
    @DisplayName("mergeTextNodes joins adjacent text and removes empty text")
    void testMergeTextNodes() {
      final TagNode tag = new TagNode("t");
      final TextNode first = new TextNode("a");
      final TagNode inner = new TagNode("inner");
      inner.appendChildren(new TextNode("x"), new TextNode(""), new TextNode("y"));
      tag.appendChildren(first, new TextNode("b"), new TextNode(""), inner, new TextNode(""));
      tag.mergeTextNodes();
      assertNodes(tag.getChildNodes(), first, inner);
      assertEquals("ab", first.getContent());
      assertEquals(1, inner.getChildNodes().size());
      assertEquals("xy", inner.getFullText());
    }
  }
}
