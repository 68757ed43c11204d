package io.arbor.node;

import io.arbor.ArborTestHelper;
import io.arbor.ArborTestHelper.TestDocument;
import io.arbor.axis.filter.Filters;
import io.arbor.exception.StructuralConflictException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ConcurrentModificationException;
import java.util.Iterator;

import static io.arbor.ArborTestHelper.assertNodes;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Node")
class NodeTest {

  private TestDocument doc;

  @BeforeEach
  void setUp() {
    doc = ArborTestHelper.createTestDocument();
  }

  @Nested
  @DisplayName("Ownership")
  class Ownership {

    @Test
    @DisplayName("an attached node can't be attached again")
    void testAttachAttached() {
      final TagNode other = new TagNode("other");
      assertThrows(StructuralConflictException.class, () -> other.appendChildren(doc.c1));
      assertSame(doc.b1, doc.c1.getParent());
      assertEquals(0, other.getChildNodes().size());
    }

    @Test
    @DisplayName("a node can't become its own descendant")
    void testCycle() {
      assertThrows(StructuralConflictException.class, () -> doc.c1.appendChildren(doc.c1));
      doc.b1.detach();
      assertThrows(StructuralConflictException.class, () -> doc.c1.appendChildren(doc.b1));
      assertNull(doc.b1.getParent());
    }

    @Test
    @DisplayName("a node can't be inserted twice at once")
    void testDuplicateInsertion() {
      final TextNode text = new TextNode("t");
      assertThrows(StructuralConflictException.class, () -> doc.c1.appendChildren(text, text));
      assertNull(text.getParent());
      assertEquals(0, doc.c1.getChildNodes().size());
    }

    @Test
    @DisplayName("a detached node can be attached elsewhere")
    void testMove() {
      doc.c1.detach();
      assertNull(doc.c1.getParent());
      assertNull(doc.c1.getSiblings());
      assertEquals(-1, doc.c1.getIndex());
      doc.b2.prependChildren(doc.c1);
      assertSame(doc.b2, doc.c1.getParent());
      assertNodes(doc.b2.getChildNodes(), doc.c1, doc.c2, doc.bar, doc.instruction);
    }

    @Test
    @DisplayName("detaching an unattached node has no effect")
    void testDetachUnattached() {
      final TagNode tag = new TagNode("t");
      assertSame(tag, tag.detach());
      assertNull(tag.getParent());
    }

    @Test
    @DisplayName("a clone is unattached and independent")
    void testClone() {
      final TagNode copy = doc.b2.cloneNode(true);
      assertNull(copy.getParent());
      ArborTestHelper.assertSameStructure(doc.b2, copy);
      copy.setAttribute("x", "z");
      assertEquals("y", doc.b2.getAttributeValue("x"));

      final TagNode shallow = doc.b2.cloneNode(false);
      assertEquals(0, shallow.getChildNodes().size());
      assertEquals("y", shallow.getAttributeValue("x"));
    }
  }

  @Nested
  @DisplayName("Siblings")
  class Siblings {

    @Test
    @DisplayName("replaceWith puts the replacement at the same position")
    void testReplaceWith() {
      final TagNode replacement = new TagNode("r");
      assertSame(doc.b1, doc.b1.replaceWith(replacement));
      assertNull(doc.b1.getParent());
      assertNodes(doc.a.getChildNodes(), doc.oops1, replacement, doc.oops2, doc.b2, doc.oops3);
    }

    @Test
    @DisplayName("an unattached node can't be replaced")
    void testReplaceUnattached() {
      assertThrows(StructuralConflictException.class,
          () -> new TagNode("t").replaceWith(new TagNode("u")));
    }

    @Test
    @DisplayName("siblings are inserted around the node")
    void testAddSiblings() {
      final TextNode before = new TextNode("before");
      final TextNode after1 = new TextNode("after1");
      final TextNode after2 = new TextNode("after2");
      doc.c1.addPrecedingSiblings(before);
      doc.c1.addFollowingSiblings(after1, after2);
      assertNodes(doc.b1.getChildNodes(), doc.foo, before, doc.c1, after1, after2, doc.comment);
      assertThrows(StructuralConflictException.class,
          () -> new TagNode("t").addFollowingSiblings(new TagNode("u")));
    }

    @Test
    @DisplayName("fetch methods return the nearest visible node")
    void testFetch() {
      assertSame(doc.oops2, doc.b1.fetchFollowingSibling());
      assertSame(doc.b2, doc.b1.fetchFollowingSibling(Filters.isTagNode()));
      assertSame(doc.oops1, doc.b1.fetchPrecedingSibling());
      assertNull(doc.oops1.fetchPrecedingSibling());
      assertSame(doc.oops2, doc.c1.fetchFollowing());
      assertSame(doc.c1, doc.c2.fetchPreceding(Filters.isTagNode()));
    }

    @Test
    @DisplayName("navigation combines default and caller filters")
    void testIterate() {
      assertNodes(doc.c2.iterateAncestors(), doc.b2, doc.a);
      assertNodes(doc.b1.iterateFollowing(false, Filters.isTagNode()), doc.b2, doc.c2);
      assertNodes(doc.b1.iterateFollowing(Filters.isTagNode()), doc.c1, doc.b2, doc.c2);
      assertNodes(doc.b2.iteratePreceding(Filters.isTextNode()), doc.oops2, doc.foo, doc.oops1);
      assertNodes(doc.b2.iteratePrecedingSiblings(), doc.oops2, doc.b1, doc.oops1);
      assertNodes(doc.b1.iterateFollowingSiblings(Filters.isTextNode()), doc.oops2, doc.oops3);
    }
  }

  @Nested
  @DisplayName("Positions")
  class Positions {

    @Test
    @DisplayName("index and depth")
    void testIndexAndDepth() {
      assertEquals(3, doc.b2.getIndex());
      assertEquals(1, doc.c1.getIndex());
      assertEquals(-1, doc.a.getIndex());
      assertEquals(0, doc.a.getDepth());
      assertEquals(2, doc.c2.getDepth());
    }

    @Test
    @DisplayName("children are addressed by filtered index")
    void testChildIndex() {
      final TagNode inserted = new TagNode("i");
      doc.b2.insertChildren(2, inserted);
      // The processing instruction is invisible, so the tag goes after it.
      assertNodes(doc.b2.getChildNodes(), doc.c2, doc.bar, doc.instruction, inserted);
      assertSame(inserted, doc.b2.getChild(2));
      assertThrows(IndexOutOfBoundsException.class, () -> doc.b2.getChild(3));
      assertThrows(IndexOutOfBoundsException.class, () -> doc.b2.insertChildren(4, new TagNode("j")));
    }

    @Test
    @DisplayName("first, last and last descendant")
    void testFirstLast() {
      assertSame(doc.foo, doc.b1.getFirstChild());
      assertSame(doc.c1, doc.b1.getLastChild());
      assertSame(doc.oops3, doc.a.getLastDescendant());
      assertNull(doc.c1.getFirstChild());
      assertNull(doc.c1.getLastDescendant());
    }
  }

  @Test
  @DisplayName("full text ignores default filters and excludes comments")
  void testFullText() {
    assertEquals("oops1foooops2baroops3", doc.a.getFullText());
    assertEquals("", doc.comment.getFullText());
    assertEquals("bar", doc.bar.getFullText());
  }

  @Test
  @DisplayName("appendText returns the new text node")
  void testAppendText() {
    final TextNode text = doc.c1.appendText("new");
    assertSame(doc.c1, text.getParent());
    assertEquals("new", doc.c1.getFullText());
  }

  @Test
  @DisplayName("iterators of the child collection fail fast")
  void testFailFast() {
    final Iterator<Node> children = doc.a.getChildNodes().iterator();
    children.next();
    doc.a.appendChildren(new TagNode("late"));
    assertThrows(ConcurrentModificationException.class, children::next);
    assertThrows(UnsupportedOperationException.class, () -> doc.a.getChildNodes().asList().clear());
  }
}
