package io.arbor.service.xml.xpath;

import io.arbor.node.TagNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("XPathValues")
class XPathValuesTest {

  @Test
  @DisplayName("boolean conversion")
  void testToBoolean() {
    assertFalse(XPathValues.toBoolean(null));
    assertFalse(XPathValues.toBoolean(""));
    assertTrue(XPathValues.toBoolean("false"));
    assertFalse(XPathValues.toBoolean(0d));
    assertFalse(XPathValues.toBoolean(Double.NaN));
    assertTrue(XPathValues.toBoolean(-0.5));
    final TagNode tag = new TagNode("t").setAttribute("a", "");
    assertTrue(XPathValues.toBoolean(tag.getAttributes().get("a")));
  }

  @Test
  @DisplayName("number conversion")
  void testToNumber() {
    assertEquals(12.5, XPathValues.toNumber(" 12.5 "));
    assertEquals(1, XPathValues.toNumber(true));
    assertEquals(0, XPathValues.toNumber(false));
    assertTrue(Double.isNaN(XPathValues.toNumber("twelve")));
    assertTrue(Double.isNaN(XPathValues.toNumber("")));
    assertTrue(Double.isNaN(XPathValues.toNumber(null)));
    final TagNode tag = new TagNode("t").setAttribute("n", "3");
    assertEquals(3, XPathValues.toNumber(tag.getAttributes().get("n")));
  }

  @Test
  @DisplayName("string conversion")
  void testToString() {
    assertEquals("", XPathValues.toString(null));
    assertEquals("3", XPathValues.toString(3d));
    assertEquals("-2", XPathValues.toString(-2d));
    assertEquals("0.25", XPathValues.toString(0.25));
    assertEquals("NaN", XPathValues.toString(Double.NaN));
    assertEquals("Infinity", XPathValues.toString(Double.POSITIVE_INFINITY));
    assertEquals("-Infinity", XPathValues.toString(Double.NEGATIVE_INFINITY));
    assertEquals("true", XPathValues.toString(Boolean.TRUE));
  }
}
