package org.tsumego.sgf.exceptions;

/**
 * Abstract class for exceptions that are a result of a malformed game record.
 *
 * Every such exception identifies the offending range of the source as [start, end) character offsets - indexes
 * into the source string, which differ from byte offsets once the record contains non-ASCII text.
 */
public abstract class SgfException extends Exception
{
  private static final long serialVersionUID = 1L;

  // Characters of context to show either side of the offending range.
  private static final int CONTEXT_CHARS = 20;

  private final int mStart;
  private final int mEnd;

  /**
   * Create an exception.
   *
   * @param xiMessage - what went wrong.
   * @param xiStart   - offset of the start of the offending range.
   * @param xiEnd     - offset just beyond the end of the offending range.
   * @param xiSource  - the source text, used to produce a context excerpt.  May be null.
   */
  protected SgfException(String xiMessage, int xiStart, int xiEnd, String xiSource)
  {
    super(describe(xiMessage, xiStart, xiEnd, xiSource));
    mStart = xiStart;
    mEnd = xiEnd;
  }

  /**
   * @return offset of the start of the offending range.
   */
  public int getStart()
  {
    return mStart;
  }

  /**
   * @return offset just beyond the end of the offending range.
   */
  public int getEnd()
  {
    return mEnd;
  }

  private static String describe(String xiMessage, int xiStart, int xiEnd, String xiSource)
  {
    StringBuilder lBuf = new StringBuilder();
    lBuf.append(xiMessage).append(" at [").append(xiStart).append(", ").append(xiEnd).append(")");

    if (xiSource != null)
    {
      int lFrom = Math.max(0, xiStart - CONTEXT_CHARS);
      int lTo = Math.min(xiSource.length(), Math.max(xiEnd, xiStart) + CONTEXT_CHARS);
      int lMarkStart = Math.min(xiStart, xiSource.length());
      int lMarkEnd = Math.min(Math.max(xiEnd, xiStart), xiSource.length());

      lBuf.append(": ");
      lBuf.append(xiSource, lFrom, lMarkStart);
      lBuf.append(">>>").append(xiSource, lMarkStart, lMarkEnd).append("<<<");
      lBuf.append(xiSource, lMarkEnd, lTo);
    }

    return lBuf.toString();
  }
}
