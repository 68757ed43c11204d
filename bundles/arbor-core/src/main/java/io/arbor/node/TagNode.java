package io.arbor.node;

import com.google.common.base.MoreObjects;
import io.arbor.axis.DescendantAxis;
import io.arbor.axis.IncludeSelf;
import io.arbor.exception.AmbiguousTreeException;
import io.arbor.exception.StructuralConflictException;
import io.arbor.exception.XPathEvaluationException;
import io.arbor.service.xml.xpath.FetchOrCreate;
import io.arbor.settings.Constants;
import io.arbor.utils.XmlChars;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * An element with a qualified name, attributes and children.
 */
public final class TagNode extends ParentNode {

  /** Name of the identifier attribute. */
  public static final QualifiedName ID_NAME =
      QualifiedName.of(Constants.XML_NAMESPACE, Constants.ID_LOCAL_NAME);

  /** The name. */
  private QualifiedName name;

  /** The attributes. */
  private final Attributes attributes = new Attributes(this);

  /**
   * Constructor.
   *
   * @param universalName the name in bracket notation
   */
  public TagNode(final String universalName) {
    this(QualifiedName.parse(universalName));
  }

  /**
   * Constructor.
   *
   * @param name the name
   */
  public TagNode(final QualifiedName name) {
    this.name = requireNonNull(name);
  }

  /**
   * Constructor.
   *
   * @param name the name
   * @param attributes the initial attributes
   */
  public TagNode(final QualifiedName name, final Map<QualifiedName, String> attributes) {
    this(name);
    attributes.forEach(this.attributes::set);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.TAG;
  }

  public QualifiedName getQualifiedName() {
    return name;
  }

  public void setQualifiedName(final QualifiedName name) {
    this.name = requireNonNull(name);
  }

  public String getLocalName() {
    return name.getLocalName();
  }

  public void setLocalName(final String localName) {
    name = name.withLocalName(localName);
  }

  public String getNamespace() {
    return name.getNamespace();
  }

  public void setNamespace(final String namespace) {
    name = name.withNamespace(namespace);
  }

  public Attributes getAttributes() {
    return attributes;
  }

  /**
   * Get the value of an attribute.
   *
   * @param universalName the name in bracket notation
   * @return the value or {@code null} if there is no such attribute
   */
  public @Nullable String getAttributeValue(final String universalName) {
    return attributes.getValue(universalName);
  }

  /**
   * Sets an attribute, which is added if it doesn't exist.
   *
   * @param universalName the name in bracket notation
   * @param value the value
   * @return this tag
   */
  public TagNode setAttribute(final String universalName, final String value) {
    attributes.set(universalName, value);
    return this;
  }

  /**
   * Get the value of the {@code xml:id} attribute.
   *
   * @return the identifier or {@code null}
   */
  public @Nullable String getId() {
    final Attribute id = attributes.get(ID_NAME);
    return id == null ? null : id.getValue();
  }

  /**
   * Sets the {@code xml:id} attribute, which must be unique in the whole tree.
   *
   * @param id the identifier, or {@code null} to remove it
   * @throws StructuralConflictException if another tag of the tree has the same identifier
   */
  public void setId(final @Nullable String id) {
    if (id == null) {
      attributes.remove(ID_NAME);
      return;
    }
    XmlChars.checkNCName(id);
    TagNode top = this;
    while (top.getParent() != null) {
      top = top.getParent();
    }
    for (final Node node : new DescendantAxis(top, IncludeSelf.YES)) {
      if (node != this && node instanceof TagNode && id.equals(((TagNode) node).getId())) {
        throw new StructuralConflictException("The id '%s' is already used by the tag at %s.", id,
            ((TagNode) node).getLocationPath());
      }
    }
    attributes.set(ID_NAME, id);
  }

  /**
   * Get a path of the form {@code /*[1]/*[3]} which selects this tag.
   *
   * @return the location path
   */
  public String getLocationPath() {
    final List<String> steps = new ArrayList<>();
    for (TagNode node = this; node != null; node = node.getParent()) {
      final ChildNodes siblings = node.getSiblings();
      int position = 1;
      if (siblings != null) {
        for (final Node sibling : siblings) {
          if (sibling == node) {
            break;
          }
          if (sibling instanceof TagNode) {
            position++;
          }
        }
      }
      steps.add("/*[" + position + "]");
    }
    final StringBuilder path = new StringBuilder();
    for (int i = steps.size() - 1; i >= 0; i--) {
      path.append(steps.get(i));
    }
    return path.toString();
  }

  /**
   * Removes this tag from its parent.
   *
   * @param retainChildNodes {@code true} to move the children into the former parent at this tag's
   *        former position
   * @return this tag
   * @throws StructuralConflictException if this tag is the root of a document
   */
  public TagNode detach(final boolean retainChildNodes) {
    final ParentNode former = parent;
    if (!retainChildNodes || former == null) {
      detach();
      return this;
    }
    final int index = former.getChildNodes().indexOf(this);
    detach();
    final Node[] children = getChildNodes().asList().toArray(new Node[0]);
    for (final Node child : children) {
      getChildNodes().remove(child);
    }
    former.getChildNodes().insert(index, children);
    return this;
  }

  @Override
  public TagNode detach() {
    super.detach();
    return this;
  }

  /**
   * Merges adjacent text nodes and removes empty ones, recursively.
   */
  public void mergeTextNodes() {
    TextNode last = null;
    for (final Node child : getChildNodes().asList().toArray(new Node[0])) {
      if (child instanceof TextNode) {
        final TextNode text = (TextNode) child;
        if (text.getContent().isEmpty()) {
          getChildNodes().remove(text);
        } else if (last != null) {
          last.setContent(last.getContent() + text.getContent());
          getChildNodes().remove(text);
        } else {
          last = text;
        }
      } else {
        last = null;
        if (child instanceof TagNode) {
          ((TagNode) child).mergeTextNodes();
        }
      }
    }
  }

  /**
   * Returns the single tag the expression selects, creating the missing tags of its branch.
   *
   * @param expression an unambiguous XPath expression, which consists of child steps with names
   *        and optional attribute equality predicates only
   * @param namespaces prefix to namespace mapping or {@code null}
   * @return the existing or created tag
   * @throws XPathEvaluationException if the expression isn't unambiguous
   * @throws AmbiguousTreeException if more than one tag matches
   */
  public TagNode fetchOrCreateByXPath(final String expression,
      final @Nullable Map<String, String> namespaces) {
    return FetchOrCreate.fetchOrCreate(this, expression, namespaces);
  }

  public TagNode fetchOrCreateByXPath(final String expression) {
    return fetchOrCreateByXPath(expression, null);
  }

  @Override
  public TagNode cloneNode(final boolean deep) {
    final TagNode copy = new TagNode(name, attributes.asMap());
    if (deep) {
      cloneChildNodes(copy);
    }
    return copy;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
                      .add("name", name)
                      .add("attributes", attributes.size())
                      .add("children", getChildNodes().size())
                      .toString();
  }
}
