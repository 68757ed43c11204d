package io.arbor.service.xml.xpath.functions;

import io.arbor.ArborTestHelper.TestDocument;
import io.arbor.exception.XPathEvaluationException;
import io.arbor.node.Attribute;
import io.arbor.node.Node;
import io.arbor.service.xml.xpath.EvaluationContext;
import io.arbor.service.xml.xpath.XPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static io.arbor.ArborTestHelper.assertNodes;
import static io.arbor.ArborTestHelper.createTestDocument;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("FunctionRegistry")
class FunctionRegistryTest {

  @Mock
  private XPathFunction function;

  @Captor
  private ArgumentCaptor<EvaluationContext> contexts;

  @Captor
  private ArgumentCaptor<List<Object>> arguments;

  private TestDocument doc;

  @BeforeEach
  void setUp() {
    doc = createTestDocument();
  }

  @Test
  @DisplayName("built-ins are registered by their names")
  void testBuiltIns() {
    final FunctionRegistry registry = FunctionRegistry.withBuiltIns();
    for (final BuiltInFunction builtIn : BuiltInFunction.values()) {
      assertSame(builtIn, registry.get(builtIn.getFunctionName()));
    }
    assertTrue(registry.contains("starts-with"));
    assertFalse(new FunctionRegistry().contains("starts-with"));
    assertTrue(FunctionRegistry.getDefault().contains("position"));
  }

  @Test
  @DisplayName("custom functions receive the context and evaluated arguments")
  void testCustomFunction() {
    when(function.apply(any(), anyList())).thenReturn(true, false);
    final FunctionRegistry registry = FunctionRegistry.withBuiltIns().register("special", function);

    final List<Node> results =
        XPath.evaluate(List.of(doc.a), XPath.compile("b[special(@x, 'lit')]"), null, registry);

    assertNodes(results, doc.b1);
    verify(function, times(2)).apply(contexts.capture(), arguments.capture());
    final List<EvaluationContext> captured = contexts.getAllValues();
    assertSame(doc.b1, captured.get(0).getNode());
    assertEquals(1, captured.get(0).getPosition());
    assertSame(doc.b2, captured.get(1).getNode());
    assertEquals(2, captured.get(1).getPosition());
    assertEquals(2, captured.get(1).getSize());

    final List<List<Object>> values = arguments.getAllValues();
    assertNull(values.get(0).get(0));
    assertEquals("y", ((Attribute) values.get(1).get(0)).getValue());
    assertEquals("lit", values.get(1).get(1));
  }

  @Test
  @DisplayName("a custom function may replace a built-in")
  void testReplaceBuiltIn() {
    when(function.apply(any(), anyList())).thenReturn(2d);
    final FunctionRegistry registry = FunctionRegistry.withBuiltIns().register("last", function);
    assertNodes(XPath.evaluate(List.of(doc.a), XPath.compile("b[last()]"), null, registry),
        doc.b2);
  }

  @Test
  @DisplayName("unregistered functions are unknown")
  void testUnregister() {
    final FunctionRegistry registry = FunctionRegistry.withBuiltIns();
    assertTrue(registry.unregister("not"));
    assertFalse(registry.unregister("not"));
    assertNull(registry.get("not"));
    final XPathEvaluationException e = assertThrows(XPathEvaluationException.class,
        () -> XPath.evaluate(List.of(doc.a), XPath.compile("b[not(@x)]"), null, registry));
    assertTrue(e.getMessage().contains("'not'"), e.getMessage());
    assertEquals("b[not(@x)]", e.getExpression());
  }
}
