package org.tsumego.oracle;

import java.util.HashMap;
import java.util.Map;

import org.tsumego.oracle.exceptions.OracleProtocolException;
import org.tsumego.solver.ProofStatus;

/**
 * The qualitative results the oracle reports, with the score each maps to (in Black's frame).
 */
public enum ResultVocabulary
{
  BLACK_WIN("B:w", 1),
  BLACK_ALMOST_WIN("B:a_w", 0.9),
  BLACK_AHEAD_3("a-b:B3", 0.7),
  BLACK_AHEAD_2("a-b:B2", 0.5),
  BLACK_AHEAD_1("a-b:B1", 0.3),
  STABLE("a-b:stable", 0),
  UNSTABLE("a-b:unstable", 0),
  WHITE_AHEAD_1("a-b:w1", -0.3),
  WHITE_AHEAD_2("a-b:w2", -0.5),
  WHITE_AHEAD_3("a-b:w3", -0.7),
  WHITE_ALMOST_WIN("W:a_w", -0.9),
  WHITE_WIN("W:w", -1);

  private static final Map<String, ResultVocabulary> BY_TOKEN = new HashMap<>();
  static
  {
    for (ResultVocabulary lResult : values())
    {
      BY_TOKEN.put(lResult.mToken, lResult);
    }
  }

  /**
   * The token as it appears in oracle output.
   */
  public final String mToken;

  /**
   * The score, from -1 (certain White win) to +1 (certain Black win).
   */
  public final double mScore;

  private ResultVocabulary(String xiToken, double xiScore)
  {
    mToken = xiToken;
    mScore = xiScore;
  }

  /**
   * @return the status the oracle asserts with this result.  Only the certain results resolve anything.
   */
  public ProofStatus getStatus()
  {
    if (this == BLACK_WIN)
    {
      return ProofStatus.WIN_BLACK;
    }
    if (this == WHITE_WIN)
    {
      return ProofStatus.WIN_WHITE;
    }
    return ProofStatus.UNRESOLVED;
  }

  /**
   * @return the result for the specified token.
   *
   * @param xiToken - the token.
   *
   * @throws OracleProtocolException if the token isn't recognised.
   */
  public static ResultVocabulary fromToken(String xiToken) throws OracleProtocolException
  {
    ResultVocabulary lResult = BY_TOKEN.get(xiToken);
    if (lResult == null)
    {
      throw new OracleProtocolException("Unknown result", xiToken);
    }
    return lResult;
  }
}
