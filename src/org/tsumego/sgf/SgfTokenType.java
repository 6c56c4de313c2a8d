package org.tsumego.sgf;

/**
 * Categories of token in a game record.
 */
public enum SgfTokenType
{
  /**
   * "(" - start of a game tree.
   */
  OPEN_GROUP,

  /**
   * ")" - end of a game tree.
   */
  CLOSE_GROUP,

  /**
   * ";" - start of a node.
   */
  NODE_START,

  /**
   * A property key, e.g. "B".
   */
  PROPERTY_KEY,

  /**
   * A bracketed property value.  The token text is the unescaped content between the brackets.
   */
  PROPERTY_VALUE,

  /**
   * "[]" - an empty property value.
   */
  EMPTY_VALUE,

  /**
   * End of input.
   */
  END;
}
