package io.arbor.node;

/**
 * Kinds of nodes of the tree model.
 */
public enum NodeKind {
  /** Element with a qualified name, attributes and children. */
  TAG,

  /** Character data. */
  TEXT,

  /** Comment. */
  COMMENT,

  /** Processing instruction. */
  PROCESSING_INSTRUCTION,

  /** Internal container above the root tag of a document. */
  DOCUMENT
}
