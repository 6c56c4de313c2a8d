package org.tsumego.solver;

import org.tsumego.sgf.Colour;

/**
 * Proven status of a position.
 */
public enum ProofStatus
{
  /**
   * Nothing proven yet.
   */
  UNRESOLVED(null, 0),

  /**
   * Black wins whatever White does.
   */
  WIN_BLACK(Colour.BLACK, 1),

  /**
   * White wins whatever Black does.
   */
  WIN_WHITE(Colour.WHITE, -1);

  private final Colour mWinner;
  private final double mScore;

  private ProofStatus(Colour xiWinner, double xiScore)
  {
    mWinner = xiWinner;
    mScore = xiScore;
  }

  /**
   * @return the winning colour, or null if unresolved.
   */
  public Colour getWinner()
  {
    return mWinner;
  }

  /**
   * @return the terminal score for this status in Black's frame: +1 for a Black win, -1 for a White win, 0 otherwise.
   */
  public double getScore()
  {
    return mScore;
  }

  /**
   * @return whether a win has been proven for either side.
   */
  public boolean isResolved()
  {
    return mWinner != null;
  }

  /**
   * @return the status representing a win for the specified colour.
   *
   * @param xiColour - the winner.
   */
  public static ProofStatus winFor(Colour xiColour)
  {
    return (xiColour == Colour.BLACK) ? WIN_BLACK : WIN_WHITE;
  }
}
