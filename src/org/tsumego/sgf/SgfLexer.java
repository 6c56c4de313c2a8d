package org.tsumego.sgf;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tsumego.sgf.exceptions.LexicalException;

/**
 * Tokenizer for game records.
 *
 * Tokens are produced lazily, one per call to {@link #nextToken}.  Once the input is exhausted, every further call
 * returns an {@link SgfTokenType#END} token.  Whitespace outside brackets is skipped.  Inside brackets, a backslash
 * escapes the character that follows it (in particular "]" and "\" itself).
 */
public class SgfLexer
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final String mSource;
  private final int mLength;
  private final ProgressListener mProgressListener;
  private int mOffset;

  /**
   * Create a lexer positioned at the start of the source.
   *
   * @param xiSource - the text to tokenize.
   */
  public SgfLexer(String xiSource)
  {
    this(xiSource, 0, null);
  }

  /**
   * Create a lexer.
   *
   * @param xiSource           - the text to tokenize.
   * @param xiStart            - the offset at which to start.
   * @param xiProgressListener - listener to notify after each token, or null.
   */
  public SgfLexer(String xiSource, int xiStart, ProgressListener xiProgressListener)
  {
    if ((xiStart < 0) || (xiStart > xiSource.length()))
    {
      throw new IndexOutOfBoundsException("Start offset " + xiStart + " outside source of length " + xiSource.length());
    }

    mSource = xiSource;
    mLength = xiSource.length();
    mOffset = xiStart;
    mProgressListener = xiProgressListener;
  }

  /**
   * @return the offset of the next character to be consumed.
   */
  public int getOffset()
  {
    return mOffset;
  }

  /**
   * Reposition the lexer.  Tokenization restarts from the specified offset.
   *
   * @param xiOffset - the offset.
   */
  public void reset(int xiOffset)
  {
    if ((xiOffset < 0) || (xiOffset > mLength))
    {
      throw new IndexOutOfBoundsException("Offset " + xiOffset + " outside source of length " + mLength);
    }
    mOffset = xiOffset;
  }

  /**
   * @return the source being tokenized.
   */
  public String getSource()
  {
    return mSource;
  }

  /**
   * @return the next token.
   *
   * @throws LexicalException if the next character doesn't start any token.
   */
  public SgfToken nextToken() throws LexicalException
  {
    while ((mOffset < mLength) && Character.isWhitespace(mSource.charAt(mOffset)))
    {
      mOffset++;
    }

    SgfToken lToken;
    if (mOffset >= mLength)
    {
      lToken = new SgfToken(SgfTokenType.END, "", mLength, mLength);
    }
    else
    {
      int lStart = mOffset;
      char c = mSource.charAt(lStart);
      switch (c)
      {
        case '(':
          lToken = single(SgfTokenType.OPEN_GROUP, lStart);
          break;

        case ')':
          lToken = single(SgfTokenType.CLOSE_GROUP, lStart);
          break;

        case ';':
          lToken = single(SgfTokenType.NODE_START, lStart);
          break;

        case '[':
          lToken = value(lStart);
          break;

        default:
          if (!isKeyChar(c))
          {
            throw new LexicalException("Invalid character '" + c + "'", lStart, lStart + 1, mSource);
          }
          int lEnd = lStart + 1;
          while ((lEnd < mLength) && isKeyChar(mSource.charAt(lEnd)))
          {
            lEnd++;
          }
          lToken = new SgfToken(SgfTokenType.PROPERTY_KEY, mSource.substring(lStart, lEnd), lStart, lEnd);
          break;
      }

      mOffset = lToken.getEnd();
    }

    if (mProgressListener != null)
    {
      mProgressListener.progress(mOffset, mLength);
    }

    LOGGER.trace(lToken);
    return lToken;
  }

  /**
   * Tokenize the remainder of the source.
   *
   * @return the tokens, ending with an END token.
   *
   * @throws LexicalException if the source contains an invalid character.
   */
  public List<SgfToken> tokenize() throws LexicalException
  {
    List<SgfToken> lTokens = new ArrayList<>();
    SgfToken lToken;
    do
    {
      lToken = nextToken();
      lTokens.add(lToken);
    }
    while (lToken.getType() != SgfTokenType.END);

    return lTokens;
  }

  private SgfToken single(SgfTokenType xiType, int xiStart)
  {
    return new SgfToken(xiType, mSource.substring(xiStart, xiStart + 1), xiStart, xiStart + 1);
  }

  private SgfToken value(int xiStart) throws LexicalException
  {
    if ((xiStart + 1 < mLength) && (mSource.charAt(xiStart + 1) == ']'))
    {
      return new SgfToken(SgfTokenType.EMPTY_VALUE, "", xiStart, xiStart + 2);
    }

    StringBuilder lValue = new StringBuilder();
    int lIndex = xiStart + 1;
    while (lIndex < mLength)
    {
      char c = mSource.charAt(lIndex++);
      if (c == ']')
      {
        return new SgfToken(SgfTokenType.PROPERTY_VALUE, lValue.toString(), xiStart, lIndex);
      }
      if (c == '\\')
      {
        if (lIndex >= mLength)
        {
          break;
        }
        c = mSource.charAt(lIndex++);
      }
      lValue.append(c);
    }

    throw new LexicalException("Unterminated property value", xiStart, mLength, mSource);
  }

  private static boolean isKeyChar(char c)
  {
    return ((c >= 'a') && (c <= 'z')) ||
           ((c >= 'A') && (c <= 'Z')) ||
           ((c >= '0') && (c <= '9')) ||
           (c == '_');
  }
}
