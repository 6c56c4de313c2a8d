package org.tsumego.sgf;

/**
 * A single token from a game record.
 *
 * Offsets are indexes of UTF-16 chars in the source string, not bytes of any encoding of it.
 */
public final class SgfToken
{
  private final SgfTokenType mType;
  private final String mText;
  private final int mStart;
  private final int mEnd;

  /**
   * Create a token.
   *
   * @param xiType  - the token category.
   * @param xiText  - the token text (unescaped content for values).
   * @param xiStart - offset of the first character of the token in the source.
   * @param xiEnd   - offset just beyond the last character of the token.
   */
  public SgfToken(SgfTokenType xiType, String xiText, int xiStart, int xiEnd)
  {
    mType = xiType;
    mText = xiText;
    mStart = xiStart;
    mEnd = xiEnd;
  }

  public SgfTokenType getType()
  {
    return mType;
  }

  public String getText()
  {
    return mText;
  }

  public int getStart()
  {
    return mStart;
  }

  public int getEnd()
  {
    return mEnd;
  }

  @Override
  public String toString()
  {
    return mType + "(" + mText + ")@[" + mStart + "," + mEnd + ")";
  }
}
