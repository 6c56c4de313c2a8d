package org.tsumego.sgf.exceptions;

/**
 * Exception thrown when the source contains a character that doesn't start any token (or a value is unterminated).
 */
public class LexicalException extends SgfException
{
  private static final long serialVersionUID = 1L;

  /**
   * Create a lexical exception.
   *
   * @param xiMessage - what went wrong.
   * @param xiStart   - offset of the start of the offending range.
   * @param xiEnd     - offset just beyond the end of the offending range.
   * @param xiSource  - the source text.
   */
  public LexicalException(String xiMessage, int xiStart, int xiEnd, String xiSource)
  {
    super(xiMessage, xiStart, xiEnd, xiSource);
  }
}
