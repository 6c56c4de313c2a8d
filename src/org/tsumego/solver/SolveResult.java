package org.tsumego.solver;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of a call to {@link Solver#solve}.
 */
public final class SolveResult
{
  private final ProofStatus mRootStatus;
  private final int mSimulations;
  private final int mOracleCalls;
  private final int mFailures;
  private final List<SolverNode> mRankedMoves;
  private final List<SolverNode> mCandidates;

  SolveResult(ProofStatus xiRootStatus,
              int xiSimulations,
              int xiOracleCalls,
              int xiFailures,
              List<SolverNode> xiRankedMoves,
              List<SolverNode> xiCandidates)
  {
    mRootStatus = xiRootStatus;
    mSimulations = xiSimulations;
    mOracleCalls = xiOracleCalls;
    mFailures = xiFailures;
    mRankedMoves = Collections.unmodifiableList(xiRankedMoves);
    mCandidates = Collections.unmodifiableList(xiCandidates);
  }

  /**
   * @return the proven status of the root (UNRESOLVED if the budget ran out first).
   */
  public ProofStatus getRootStatus()
  {
    return mRootStatus;
  }

  /**
   * @return whether the root's status was proven.
   */
  public boolean isSolved()
  {
    return mRootStatus.isResolved();
  }

  /**
   * @return the number of simulations that completed (including those that failed and were skipped).
   */
  public int getSimulations()
  {
    return mSimulations;
  }

  /**
   * @return the number of oracle evaluations requested.
   */
  public int getOracleCalls()
  {
    return mOracleCalls;
  }

  /**
   * @return the number of simulations abandoned because the oracle failed.
   */
  public int getFailures()
  {
    return mFailures;
  }

  /**
   * @return the root's children, most visited first.
   */
  public List<SolverNode> getRankedMoves()
  {
    return mRankedMoves;
  }

  /**
   * @return the children of the problem position (the end of the record's main line), most visited first.
   */
  public List<SolverNode> getCandidates()
  {
    return mCandidates;
  }

  /**
   * @return the most visited child of the root, or null if the root has no children.
   */
  public SolverNode getRecommendedMove()
  {
    return mRankedMoves.isEmpty() ? null : mRankedMoves.get(0);
  }

  @Override
  public String toString()
  {
    SolverNode lBest = getRecommendedMove();
    return mRootStatus + " after " + mSimulations + " simulations (" + mOracleCalls + " oracle calls, " + mFailures +
           " failures), recommended move: " + ((lBest == null) ? "none" : lBest.getMoveString());
  }
}
