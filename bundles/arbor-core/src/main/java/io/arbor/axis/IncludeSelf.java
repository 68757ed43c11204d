package io.arbor.axis;

/**
 * Determines if the start node of an axis is included.
 */
public enum IncludeSelf {
  /** Yes, include it. */
  YES,

  /** No, do not include it. */
  NO
}
