package io.arbor.service.xml.shredder;

import io.arbor.exception.InvalidContentException;
import io.arbor.node.CommentNode;
import io.arbor.node.DocumentNode;
import io.arbor.node.QualifiedName;
import io.arbor.node.TagNode;
import io.arbor.node.TextNode;
import io.arbor.settings.Constants;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("TreeBuilder")
class TreeBuilderTest {

  @Test
  @DisplayName("adjacent text events form one text node")
  void testTextMerging() {
    final TreeBuilder builder = new TreeBuilder(false);
    builder.accept(new TagStartEvent("", "a"));
    builder.accept(new TextEvent("one "));
    builder.accept(new TextEvent("two"));
    builder.accept(new TagStartEvent("", "b"));
    builder.accept(new TagEndEvent("", "b"));
    builder.accept(new TextEvent("three"));
    builder.accept(new TagEndEvent("", "a"));
    final TagNode root = builder.finish();
    assertEquals(3, root.length());
    assertEquals("one two", ((TextNode) root.getChild(0)).getContent());
    assertEquals("three", ((TextNode) root.getChild(2)).getContent());
  }

  @Test
  @DisplayName("start events copy their attributes")
  void testAttributesCopied() {
    final Map<QualifiedName, String> attributes = new HashMap<>();
    attributes.put(QualifiedName.of("k"), "v");
    final TagStartEvent event = new TagStartEvent("urn:x", "a", attributes);
    attributes.clear();
    assertEquals("v", event.attributes().get(QualifiedName.of("k")));
    assertThrows(UnsupportedOperationException.class, () -> event.attributes().clear());
  }

  @Test
  @DisplayName("leading and trailing nodes of a document")
  void testDocument() {
    final TreeBuilder builder = new TreeBuilder(true);
    builder.accept(new TextEvent("\n "));
    builder.accept(new ProcessingInstructionEvent("style", "x"));
    builder.accept(new TagStartEvent("", "a"));
    builder.accept(new TagEndEvent("", "a"));
    builder.accept(new CommentEvent("done"));
    final TagNode root = builder.finish();
    final DocumentNode document = DocumentNode.forTree(root);
    assertEquals(3, document.getChildNodes().size());
    assertSame(root, document.getChildNodes().get(1));
    assertEquals("done", ((CommentNode) document.getChildNodes().get(2)).getContent());
    assertNull(root.getParent());
  }

  @Test
  @DisplayName("structural errors")
  void testStructuralErrors() {
    final TreeBuilder second = new TreeBuilder(false);
    second.accept(new TagStartEvent("", "a"));
    second.accept(new TagEndEvent("", "a"));
    assertThrows(InvalidContentException.class, () -> second.accept(new TagStartEvent("", "b")));

    final TreeBuilder mismatch = new TreeBuilder(false);
    mismatch.accept(new TagStartEvent("", "a"));
    assertThrows(InvalidContentException.class, () -> mismatch.accept(new TagEndEvent("urn:x", "a")));

    final TreeBuilder unmatched = new TreeBuilder(false);
    assertThrows(InvalidContentException.class, () -> unmatched.accept(new TagEndEvent("", "a")));

    final TreeBuilder unclosed = new TreeBuilder(false);
    unclosed.accept(new TagStartEvent("", "a"));
    assertThrows(InvalidContentException.class, unclosed::finish);

    final TreeBuilder empty = new TreeBuilder(true);
    empty.accept(new CommentEvent("only"));
    assertThrows(InvalidContentException.class, empty::finish);
  }

  @Test
  @DisplayName("text outside of the root tag")
  void testTopLevelText() {
    final TreeBuilder builder = new TreeBuilder(false);
    builder.accept(new TextEvent("  stray "));
    final InvalidContentException e = assertThrows(InvalidContentException.class,
        () -> builder.accept(new TagStartEvent("", "a")));
    assertTrue(e.getMessage().contains("'stray'"), e.getMessage());
  }

  @Test
  @DisplayName("namespace declarations are rejected as attributes")
  void testNamespaceDeclarations() {
    final TreeBuilder builder = new TreeBuilder(false);
    assertThrows(InvalidContentException.class, () -> builder.accept(
        new TagStartEvent("", "a", Map.of(QualifiedName.of("xmlns"), "urn:x"))));
    assertThrows(InvalidContentException.class, () -> builder.accept(new TagStartEvent("", "a",
        Map.of(QualifiedName.of(Constants.XMLNS_NAMESPACE, "p"), "urn:p"))));
  }

  @Test
  @DisplayName("a finished builder accepts nothing")
  void testFinished() {
    final TreeBuilder builder = new TreeBuilder(false);
    builder.accept(new TagStartEvent("", "a"));
    builder.accept(new TagEndEvent("", "a"));
    builder.finish();
    assertThrows(IllegalStateException.class, builder::finish);
    assertThrows(IllegalStateException.class, () -> builder.accept(new TextEvent("x")));
  }
}
