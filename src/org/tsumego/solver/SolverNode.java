package org.tsumego.solver;

import org.tsumego.sgf.SgfNode;

/**
 * A record node carrying search statistics.
 *
 * Statistics are only ever mutated by the {@link SearchTree} that owns the node.
 */
public class SolverNode extends SgfNode
{
  private int mVisitCount;
  private double mScoreSum;
  private ProofStatus mStatus = ProofStatus.UNRESOLVED;

  // Whether an evaluation of this node is in flight.  The node carries one provisional visit while it is.
  private boolean mPending;

  /**
   * @return the number of times this node has been sampled.
   */
  public int getVisitCount()
  {
    return mVisitCount;
  }

  /**
   * @return the sum of the per-visit scores, each in the frame of the side that played this node's move.
   */
  public double getScoreSum()
  {
    return mScoreSum;
  }

  /**
   * @return the mean score per visit, or 0 if unvisited.
   */
  public double getAverageScore()
  {
    return (mVisitCount == 0) ? 0 : mScoreSum / mVisitCount;
  }

  /**
   * @return the proven status of this node.
   */
  public ProofStatus getStatus()
  {
    return mStatus;
  }

  /**
   * @return whether an evaluation of this node is in flight.
   */
  public boolean isPending()
  {
    return mPending;
  }

  /**
   * @return the parent, as a search node.
   */
  public SolverNode getSolverParent()
  {
    return (SolverNode)getParent();
  }

  void setStatus(ProofStatus xiStatus)
  {
    mStatus = xiStatus;
  }

  void recordVisit(double xiScore)
  {
    mVisitCount++;
    mScoreSum += xiScore;
  }

  void addVirtualLoss()
  {
    assert(!mPending) : "Node already has an evaluation in flight";
    mPending = true;
    mVisitCount++;
  }

  void removeVirtualLoss()
  {
    assert(mPending) : "Node has no evaluation in flight";
    mPending = false;
    mVisitCount--;
  }

  void resetStatistics()
  {
    mVisitCount = 0;
    mScoreSum = 0;
    mStatus = ProofStatus.UNRESOLVED;
    mPending = false;
  }

  void setStatistics(int xiVisitCount, double xiScoreSum)
  {
    mVisitCount = xiVisitCount;
    mScoreSum = xiScoreSum;
  }

  @Override
  public String toString()
  {
    return super.toString() + " (visits: " + mVisitCount + ", average: " + getAverageScore() + ", " + mStatus + ")";
  }
}
