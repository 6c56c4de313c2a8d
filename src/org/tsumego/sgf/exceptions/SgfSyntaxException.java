package org.tsumego.sgf.exceptions;

/**
 * Exception thrown when a token arrives that the grammar doesn't permit at that point, or when group boundaries are
 * unmatched.
 */
public class SgfSyntaxException extends SgfException
{
  private static final long serialVersionUID = 1L;

  /**
   * Create a syntax exception.
   *
   * @param xiMessage - what went wrong.
   * @param xiStart   - offset of the start of the offending token.
   * @param xiEnd     - offset just beyond the end of the offending token.
   * @param xiSource  - the source text.
   */
  public SgfSyntaxException(String xiMessage, int xiStart, int xiEnd, String xiSource)
  {
    super(xiMessage, xiStart, xiEnd, xiSource);
  }
}
