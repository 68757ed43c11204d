package io.arbor.axis.filter;

import io.arbor.api.Filter;
import io.arbor.node.CommentNode;
import io.arbor.node.DocumentNode;
import io.arbor.node.Node;
import io.arbor.node.ProcessingInstructionNode;
import io.arbor.node.TagNode;
import io.arbor.node.TextNode;
import io.arbor.service.xml.shredder.XmlTreeParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Filters")
class FiltersTest {

  private final Node tag = new TagNode("a");

  private final Node text = new TextNode("text");

  private final Node comment = new CommentNode("comment");

  private final Node instruction = new ProcessingInstructionNode("target", "");

  @Mock
  private Filter first;

  @Mock
  private Filter second;

  @Test
  @DisplayName("kind filters match their node kind only")
  void testKindFilters() {
    assertTrue(Filters.isTagNode().filter(tag));
    assertFalse(Filters.isTagNode().filter(text));
    assertTrue(Filters.isTextNode().filter(text));
    assertFalse(Filters.isTextNode().filter(comment));
    assertTrue(Filters.isCommentNode().filter(comment));
    assertFalse(Filters.isCommentNode().filter(instruction));
    assertTrue(Filters.isProcessingInstructionNode().filter(instruction));
    assertFalse(Filters.isProcessingInstructionNode().filter(tag));
  }

  @Test
  @DisplayName("root nodes have no parent tag")
  void testRootNode() {
    assertTrue(Filters.isRootNode().filter(tag));
    final TagNode root =
        XmlTreeParser.newBuilder().asDocument(true).build().parse("<!--lead--><a><b/></a>");
    final Node lead = DocumentNode.forTree(root).getChildNodes().get(0);
    assertTrue(Filters.isRootNode().filter(root));
    assertTrue(Filters.isRootNode().filter(lead));
    assertFalse(Filters.isRootNode().filter(root.getChild(0)));
  }

  @Test
  @DisplayName("anyOf stops at the first passing filter")
  void testAnyOf() {
    when(first.filter(any())).thenReturn(true);
    assertTrue(Filters.anyOf(first, second).filter(tag));
    verify(first).filter(tag);
    verify(second, never()).filter(any());
  }

  @Test
  @DisplayName("all stops at the first failing filter")
  void testAll() {
    when(first.filter(any())).thenReturn(false);
    assertFalse(Filters.all(first, second).filter(tag));
    verify(second, never()).filter(any());
  }

  @Test
  @DisplayName("not negates the conjunction")
  void testNot() {
    assertTrue(Filters.not(Filters.isTagNode(), Filters.isTextNode()).filter(tag));
    assertFalse(Filters.not(Filters.isTagNode()).filter(tag));
    assertTrue(Filters.not(Filters.isTagNode()).filter(comment));
  }

  @Test
  @DisplayName("empty combinations")
  void testEmpty() {
    assertFalse(Filters.anyOf().filter(tag));
    assertTrue(Filters.all().filter(tag));
    assertFalse(Filters.not().filter(tag));
  }
}
