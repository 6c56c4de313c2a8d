package org.tsumego.solver;

import org.tsumego.sgf.SgfNode;

/**
 * UCB1 applied to trees.
 *
 * Each child scores its average (in the frame of the side that chose it) plus an exploration term.  Unvisited
 * children score +infinity so that every child is sampled once before any is exploited.  Ties go to the earliest
 * child.
 */
public class UCTSelectPolicy implements SelectPolicy
{
  /**
   * The textbook exploration constant.
   */
  public static final double DEFAULT_EXPLORATION_CONSTANT = Math.sqrt(2);

  private final double mExplorationConstant;

  public UCTSelectPolicy()
  {
    this(DEFAULT_EXPLORATION_CONSTANT);
  }

  /**
   * @param xiExplorationConstant - weight of the exploration term.
   */
  public UCTSelectPolicy(double xiExplorationConstant)
  {
    mExplorationConstant = xiExplorationConstant;
  }

  public double getExplorationConstant()
  {
    return mExplorationConstant;
  }

  @Override
  public SolverNode selectChild(SolverNode xiParent)
  {
    // ln(0) is undefined.  A parent with unvisited children never needs the exploration term anyway.
    double lLogParentVisits = Math.log(Math.max(1, xiParent.getVisitCount()));

    SolverNode lBest = null;
    double lBestValue = Double.NEGATIVE_INFINITY;
    for (SgfNode lChild : xiParent)
    {
      SolverNode lCandidate = (SolverNode)lChild;
      double lValue = value(lCandidate, lLogParentVisits);
      if ((lBest == null) || (lValue > lBestValue))
      {
        lBest = lCandidate;
        lBestValue = lValue;
      }
    }

    return lBest;
  }

  /**
   * @return the UCT value of a child.
   *
   * @param xiChild           - the child.
   * @param xiLogParentVisits - natural log of the parent's visit count.
   */
  public double value(SolverNode xiChild, double xiLogParentVisits)
  {
    int lVisits = xiChild.getVisitCount();
    if (lVisits == 0)
    {
      return Double.POSITIVE_INFINITY;
    }
    return xiChild.getAverageScore() + mExplorationConstant * Math.sqrt(xiLogParentVisits / lVisits);
  }
}
