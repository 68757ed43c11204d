package io.arbor.service.xml.serialize;

import io.arbor.exception.ArborIOException;
import io.arbor.node.Attribute;
import io.arbor.node.CommentNode;
import io.arbor.node.DocumentNode;
import io.arbor.node.Node;
import io.arbor.node.ProcessingInstructionNode;
import io.arbor.node.TagNode;
import io.arbor.node.TextNode;
import io.arbor.settings.CharsForSerializing;
import io.arbor.settings.Constants;

import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * <h1>XmlSerializer</h1>
 *
 * <p>
 * Writes a node and its descendants as compact UTF-8 markup. A default namespace is declared
 * wherever a tag's namespace differs from the one in scope. Attributes in a namespace get
 * generated prefixes which are declared on their tag, except for the XML namespace, which is
 * always bound to {@code xml}.
 * </p>
 */
public final class XmlSerializer {

  /** Prefix of generated attribute namespace prefixes. */
  private static final String PREFIX = "ns";

  /** OutputStream to write to. */
  private final OutputStream out;

  /**
   * Constructor.
   *
   * @param out the stream to write to, which is flushed but not closed
   */
  public XmlSerializer(final OutputStream out) {
    this.out = new BufferedOutputStream(requireNonNull(out), 4096);
  }

  /**
   * Serializes a node into a string.
   *
   * @param node the node
   * @return the markup
   */
  public static String toString(final Node node) {
    final ByteArrayOutputStream out = new ByteArrayOutputStream();
    new XmlSerializer(out).serialize(node);
    return out.toString(Constants.DEFAULT_ENCODING);
  }

  /**
   * Writes a node. A document writes all of its children.
   *
   * @param node the node
   * @throws ArborIOException if writing fails
   */
  public void serialize(final Node node) {
    requireNonNull(node);
    try {
      emit(node, "");
      out.flush();
    } catch (final IOException e) {
      throw new ArborIOException("Failed to serialize " + node, e);
    }
  }

  private void emit(final Node node, final String inheritedNamespace) throws IOException {
    switch (node.getKind()) {
      case DOCUMENT:
        for (final Node child : ((DocumentNode) node).getChildNodes()) {
          emit(child, inheritedNamespace);
        }
        break;
      case TAG:
        emitTag((TagNode) node, inheritedNamespace);
        break;
      case TEXT:
        write(escape(((TextNode) node).getContent(), false));
        break;
      case COMMENT:
        out.write(CharsForSerializing.OPENCOMMENT.getBytes());
        write(((CommentNode) node).getContent());
        out.write(CharsForSerializing.CLOSECOMMENT.getBytes());
        break;
      case PROCESSING_INSTRUCTION: {
        final ProcessingInstructionNode instruction = (ProcessingInstructionNode) node;
        out.write(CharsForSerializing.OPENPI.getBytes());
        write(instruction.getTarget());
        if (!instruction.getContent().isEmpty()) {
          out.write(CharsForSerializing.SPACE.getBytes());
          write(instruction.getContent());
        }
        out.write(CharsForSerializing.CLOSEPI.getBytes());
        break;
      }
      default:
        throw new IllegalStateException("Node kind not known: " + node.getKind());
    }
  }

  private void emitTag(final TagNode tag, final String inheritedNamespace) throws IOException {
    final String localName = tag.getLocalName();
    out.write(CharsForSerializing.OPEN.getBytes());
    write(localName);
    if (!tag.getNamespace().equals(inheritedNamespace)) {
      out.write(CharsForSerializing.XMLNS.getBytes());
      write(escape(tag.getNamespace(), true));
      out.write(CharsForSerializing.QUOTE.getBytes());
    }

    final Map<String, String> prefixes = new LinkedHashMap<>();
    for (final Attribute attribute : tag.getAttributes()) {
      final String namespace = attribute.getNamespace();
      if (!namespace.isEmpty() && !namespace.equals(Constants.XML_NAMESPACE)
          && !prefixes.containsKey(namespace)) {
        prefixes.put(namespace, PREFIX + prefixes.size());
      }
    }
    for (final Map.Entry<String, String> prefix : prefixes.entrySet()) {
      out.write(CharsForSerializing.XMLNS_COLON.getBytes());
      write(prefix.getValue());
      out.write(CharsForSerializing.EQUAL_QUOTE.getBytes());
      write(escape(prefix.getKey(), true));
      out.write(CharsForSerializing.QUOTE.getBytes());
    }
    for (final Attribute attribute : tag.getAttributes()) {
      out.write(CharsForSerializing.SPACE.getBytes());
      final String namespace = attribute.getNamespace();
      if (namespace.equals(Constants.XML_NAMESPACE)) {
        out.write(CharsForSerializing.XML_COLON.getBytes());
      } else if (!namespace.isEmpty()) {
        write(prefixes.get(namespace));
        out.write(CharsForSerializing.COLON.getBytes());
      }
      write(attribute.getLocalName());
      out.write(CharsForSerializing.EQUAL_QUOTE.getBytes());
      write(escape(attribute.getValue(), true));
      out.write(CharsForSerializing.QUOTE.getBytes());
    }

    if (tag.getChildNodes().isEmpty()) {
      out.write(CharsForSerializing.SLASH_CLOSE.getBytes());
      return;
    }
    out.write(CharsForSerializing.CLOSE.getBytes());
    for (final Node child : tag.getChildNodes()) {
      emit(child, tag.getNamespace());
    }
    out.write(CharsForSerializing.OPEN_SLASH.getBytes());
    write(localName);
    out.write(CharsForSerializing.CLOSE.getBytes());
  }

  private void write(final String value) throws IOException {
    out.write(value.getBytes(Constants.DEFAULT_ENCODING));
  }

  /**
   * Replaces markup characters by references. In attribute values quotes and whitespace other than
   * the space are replaced as well, so they survive normalization.
   */
  private static String escape(final String value, final boolean attribute) {
    final StringBuilder builder = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      final char c = value.charAt(i);
      switch (c) {
        case '&':
          builder.append(CharsForSerializing.AMPERSAND_ENTITY.getChars());
          break;
        case '<':
          builder.append(CharsForSerializing.LESS_THAN_ENTITY.getChars());
          break;
        case '>':
          builder.append(CharsForSerializing.GREATER_THAN_ENTITY.getChars());
          break;
        case '"':
          builder.append(attribute ? CharsForSerializing.QUOTE_ENTITY.getChars() : "\"");
          break;
        case '\n':
        case '\t':
          builder.append(attribute ? "&#" + (int) c + ";" : String.valueOf(c));
          break;
        case '\r':
          builder.append("&#13;");
          break;
        default:
          builder.append(c);
      }
    }
    return builder.toString();
  }
}
