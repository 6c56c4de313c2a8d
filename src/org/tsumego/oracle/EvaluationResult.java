package org.tsumego.oracle;

import java.util.Collections;
import java.util.List;

import org.tsumego.sgf.SgfNode;
import org.tsumego.solver.ProofStatus;

/**
 * The oracle's answer for one evaluated position.
 */
public final class EvaluationResult
{
  private final SgfNode mMoves;
  private final double mScore;
  private final ProofStatus mState;
  private final String mResultToken;
  private final List<String> mComments;
  private final String mRaw;

  /**
   * Create an evaluation result.
   *
   * @param xiMoves       - first of a sibling chain of suggested moves (each possibly with follow-ups), or null.
   *                        Ownership passes to whoever expands with this result.
   * @param xiScore       - score in Black's frame, in [-1, +1].
   * @param xiState       - the status the oracle asserts for the evaluated position.
   * @param xiResultToken - the oracle's headline result token.
   * @param xiComments    - the comment fields from the output.
   * @param xiRaw         - the unparsed output.
   */
  public EvaluationResult(SgfNode xiMoves,
                          double xiScore,
                          ProofStatus xiState,
                          String xiResultToken,
                          List<String> xiComments,
                          String xiRaw)
  {
    mMoves = xiMoves;
    mScore = xiScore;
    mState = xiState;
    mResultToken = xiResultToken;
    mComments = Collections.unmodifiableList(xiComments);
    mRaw = xiRaw;
  }

  /**
   * @return a copy of this result asserting a different state.
   *
   * @param xiState - the state.
   */
  public EvaluationResult withState(ProofStatus xiState)
  {
    return new EvaluationResult(mMoves, mScore, xiState, mResultToken, mComments, mRaw);
  }

  public SgfNode getMoves()
  {
    return mMoves;
  }

  public double getScore()
  {
    return mScore;
  }

  public ProofStatus getState()
  {
    return mState;
  }

  public String getResultToken()
  {
    return mResultToken;
  }

  public List<String> getComments()
  {
    return mComments;
  }

  public String getRaw()
  {
    return mRaw;
  }

  @Override
  public String toString()
  {
    return mResultToken + " (score " + mScore + ", " + mState + ")";
  }
}
