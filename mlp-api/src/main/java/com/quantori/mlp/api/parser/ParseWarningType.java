package com.quantori.mlp.api.parser;

/**
 * Kind of non-fatal problem met while reading a line notation.
 */
public enum ParseWarningType {
  /**
   * Character that is neither an atom, a bond symbol, a ring label nor a branch symbol
   */
  UNKNOWN_CHARACTER,
  /**
   * Upper-case atom symbol outside the known elements, stored as carbon
   */
  UNKNOWN_ELEMENT,
  /**
   * Closing branch without an opening one
   */
  UNMATCHED_BRANCH_CLOSE,
  /**
   * Opening branch that was never closed
   */
  UNCLOSED_BRANCH,
  /**
   * Bond order symbol that no bond followed
   */
  DANGLING_BOND_SYMBOL,
  /**
   * Ring label met before any atom
   */
  RING_LABEL_WITHOUT_ATOM,
  /**
   * Ring label closed on the atom that opened it
   */
  SELF_RING_CLOSURE,
  /**
   * Ring label opened but never closed
   */
  UNCLOSED_RING
}
