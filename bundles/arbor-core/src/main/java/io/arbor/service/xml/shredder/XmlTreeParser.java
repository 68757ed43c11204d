package io.arbor.service.xml.shredder;

import com.google.common.base.MoreObjects;
import io.arbor.exception.ArborIOException;
import io.arbor.node.QualifiedName;
import io.arbor.node.TagNode;
import io.arbor.utils.LogWrapper;
import org.slf4j.LoggerFactory;

import javax.xml.namespace.QName;
import javax.xml.stream.XMLEventReader;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.events.Attribute;
import javax.xml.stream.events.Comment;
import javax.xml.stream.events.ProcessingInstruction;
import javax.xml.stream.events.StartElement;
import javax.xml.stream.events.XMLEvent;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Reads markup with a StAX {@link XMLEventReader} and builds a tree with a {@link TreeBuilder}.
 * Document type declarations and external entities are not processed.
 *
 * <pre>
 * TagNode root = XmlTreeParser.newBuilder().includeComments(false).build().parse(xml);
 * </pre>
 */
public final class XmlTreeParser {

  /** {@link LogWrapper} reference. */
  private static final LogWrapper LOGWRAPPER =
      new LogWrapper(LoggerFactory.getLogger(XmlTreeParser.class));

  /** Determines if comments are kept. */
  private final boolean includeComments;

  /** Determines if processing instructions are kept. */
  private final boolean includePIs;

  /** Determines if the root is attached to a document. */
  private final boolean asDocument;

  private XmlTreeParser(final Builder builder) {
    includeComments = builder.includeComments;
    includePIs = builder.includePIs;
    asDocument = builder.asDocument;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Parses markup with the default settings.
   *
   * @param markup the markup
   * @return the root tag
   */
  public static TagNode parseString(final String markup) {
    return newBuilder().build().parse(markup);
  }

  /**
   * Parses markup.
   *
   * @param markup the markup
   * @return the root tag, attached to a document in document mode
   * @throws ArborIOException if the markup is not well-formed
   * @throws io.arbor.exception.InvalidContentException if it can't be represented by the tree
   */
  public TagNode parse(final String markup) {
    return parse(new StringReader(requireNonNull(markup)));
  }

  /**
   * Parses markup from a character stream, which is not closed.
   *
   * @param reader the stream
   * @return the root tag, attached to a document in document mode
   * @throws ArborIOException if the markup is not well-formed
   */
  public TagNode parse(final Reader reader) {
    requireNonNull(reader);
    try {
      return parse(createFactory().createXMLEventReader(reader));
    } catch (final XMLStreamException e) {
      throw new ArborIOException(e);
    }
  }

  /**
   * Parses markup from a byte stream, which is not closed. The encoding is detected from the
   * declaration.
   *
   * @param in the stream
   * @return the root tag, attached to a document in document mode
   * @throws ArborIOException if the markup is not well-formed
   */
  public TagNode parse(final InputStream in) {
    requireNonNull(in);
    try {
      return parse(createFactory().createXMLEventReader(in));
    } catch (final XMLStreamException e) {
      throw new ArborIOException(e);
    }
  }

  private TagNode parse(final XMLEventReader reader) {
    final TreeBuilder builder = new TreeBuilder(asDocument);
    try {
      while (reader.hasNext()) {
        final XMLEvent event = reader.nextEvent();
        switch (event.getEventType()) {
          case XMLStreamConstants.START_ELEMENT:
            builder.accept(toStartEvent(event.asStartElement()));
            break;
          case XMLStreamConstants.END_ELEMENT: {
            final QName name = event.asEndElement().getName();
            builder.accept(new TagEndEvent(name.getNamespaceURI(), name.getLocalPart()));
            break;
          }
          case XMLStreamConstants.CHARACTERS:
          case XMLStreamConstants.CDATA:
          case XMLStreamConstants.SPACE:
            builder.accept(new TextEvent(event.asCharacters().getData()));
            break;
          case XMLStreamConstants.COMMENT:
            if (includeComments) {
              builder.accept(new CommentEvent(((Comment) event).getText()));
            }
            break;
          case XMLStreamConstants.PROCESSING_INSTRUCTION:
            if (includePIs) {
              final ProcessingInstruction instruction = (ProcessingInstruction) event;
              final String data = instruction.getData();
              builder.accept(new ProcessingInstructionEvent(instruction.getTarget(),
                  data == null ? "" : data.strip()));
            }
            break;
          default:
            // Document start and end, DTD.
        }
      }
      return builder.finish();
    } catch (final XMLStreamException e) {
      throw new ArborIOException(e);
    } finally {
      try {
        reader.close();
      } catch (final XMLStreamException e) {
        LOGWRAPPER.warn("Failed to release the XML reader.", e);
      }
    }
  }

  private static TagStartEvent toStartEvent(final StartElement element) {
    final Map<QualifiedName, String> attributes = new LinkedHashMap<>();
    for (final Iterator<Attribute> it = element.getAttributes(); it.hasNext();) {
      final Attribute attribute = it.next();
      final QName name = attribute.getName();
      attributes.put(QualifiedName.of(name.getNamespaceURI(), name.getLocalPart()),
          attribute.getValue());
    }
    final QName name = element.getName();
    return new TagStartEvent(name.getNamespaceURI(), name.getLocalPart(), attributes);
  }

  private static XMLInputFactory createFactory() {
    final XMLInputFactory factory = XMLInputFactory.newInstance();
    factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, true);
    factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
    factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
    factory.setProperty(XMLInputFactory.IS_REPLACING_ENTITY_REFERENCES, true);
    factory.setProperty(XMLInputFactory.IS_COALESCING, true);
    return factory;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("includeComments", includeComments)
                      .add("includePIs", includePIs)
                      .add("asDocument", asDocument)
                      .toString();
  }

  /**
   * Builder of {@link XmlTreeParser} instances. Comments and processing instructions are kept and
   * no document is built by default.
   */
  public static final class Builder {

    private boolean includeComments = true;

    private boolean includePIs = true;

    private boolean asDocument;

    private Builder() {
    }

    public Builder includeComments(final boolean includeComments) {
      this.includeComments = includeComments;
      return this;
    }

    public Builder includePIs(final boolean includePIs) {
      this.includePIs = includePIs;
      return this;
    }

    public Builder asDocument(final boolean asDocument) {
      this.asDocument = asDocument;
      return this;
    }

    public XmlTreeParser build() {
      return new XmlTreeParser(this);
    }
  }
}
