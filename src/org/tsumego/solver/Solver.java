package org.tsumego.solver;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.LinkedBlockingQueue;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tsumego.oracle.EvaluationResult;
import org.tsumego.oracle.JobBuilder;
import org.tsumego.oracle.Oracle;
import org.tsumego.oracle.exceptions.OracleException;
import org.tsumego.oracle.exceptions.OracleUnavailableException;
import org.tsumego.util.configuration.SolverConfiguration;
import org.tsumego.util.configuration.SolverConfiguration.CfgItem;

/**
 * Drives simulations over a {@link SearchTree} until the root is proven or the budget runs out.
 *
 * <p>Each simulation selects a leaf, has the oracle evaluate it, expands the leaf with the suggested moves and
 * backpropagates the score.  A leaf that is already resolved is scored directly without consulting the oracle.
 *
 * <p>With more than one simulation in flight, oracle evaluations overlap but the tree is still only touched by the
 * thread that called {@link #solve(int, int)}.  Completed evaluations are queued back to that thread, which applies
 * them one at a time.  A leaf with an evaluation in flight carries a virtual loss (one provisional visit) so that
 * other simulations prefer its siblings.
 */
public class Solver
{
  private static final Logger LOGGER = LogManager.getLogger();
  private static final Logger STATS_LOGGER = LogManager.getLogger("stats");

  /**
   * What to do when the oracle fails to evaluate a position.
   */
  public static enum FailurePolicy
  {
    /**
     * Stop the solve and report the failure to the caller.
     */
    ABORT,

    /**
     * Abandon the simulation and carry on with the next.
     */
    SKIP
  }

  /**
   * An evaluation that has finished, on its way back to the search thread.
   */
  private static final class Completion
  {
    final SolverNode mNode;
    final boolean mWidening;
    final EvaluationResult mResult;
    final Throwable mFailure;

    Completion(SolverNode xiNode, boolean xiWidening, EvaluationResult xiResult, Throwable xiFailure)
    {
      mNode = xiNode;
      mWidening = xiWidening;
      mResult = xiResult;
      mFailure = xiFailure;
    }
  }

  private final SearchTree mTree;
  private final Oracle mOracle;
  private FailurePolicy mFailurePolicy = FailurePolicy.ABORT;
  private boolean mWidenParent = false;

  // Statistics for the current solve.
  private int mSimulations;
  private int mOracleCalls;
  private int mFailures;

  /**
   * Create a solver.
   *
   * @param xiTree   - the tree to search.
   * @param xiOracle - the oracle for evaluating leaves.
   */
  public Solver(SearchTree xiTree, Oracle xiOracle)
  {
    mTree = xiTree;
    mOracle = xiOracle;
  }

  /**
   * Create a solver, with a fresh tree, set up from the machine-specific configuration.
   *
   * @param xiOracle - the oracle for evaluating leaves.
   *
   * @return the solver.
   */
  public static Solver createFromConfiguration(Oracle xiOracle)
  {
    SearchTree lTree = new SearchTree(new UCTSelectPolicy(
                                SolverConfiguration.getCfgDouble(CfgItem.EXPLORATION_CONSTANT)));
    Solver lSolver = new Solver(lTree, xiOracle);
    lSolver.setFailurePolicy(FailurePolicy.valueOf(
                                SolverConfiguration.getCfgStr(CfgItem.FAILURE_POLICY).trim().toUpperCase()));
    lSolver.setWidenParent(SolverConfiguration.getCfgBool(CfgItem.WIDEN_PARENT));
    return lSolver;
  }

  public SearchTree getTree()
  {
    return mTree;
  }

  public FailurePolicy getFailurePolicy()
  {
    return mFailurePolicy;
  }

  public void setFailurePolicy(FailurePolicy xiFailurePolicy)
  {
    mFailurePolicy = xiFailurePolicy;
  }

  public boolean isWidenParent()
  {
    return mWidenParent;
  }

  /**
   * @param xiWidenParent - whether each simulation should also re-evaluate the parent of its leaf, excluding the
   *                        moves already there, to add alternatives near the top of the tree.
   */
  public void setWidenParent(boolean xiWidenParent)
  {
    mWidenParent = xiWidenParent;
  }

  /**
   * Run simulations one at a time.
   *
   * @param xiMaxSimulations - the simulation budget.
   *
   * @return the outcome.
   *
   * @throws OracleException if the oracle fails and the failure policy is ABORT.
   */
  public SolveResult solve(int xiMaxSimulations) throws OracleException
  {
    startSolve(xiMaxSimulations, 1);

    while ((mSimulations < xiMaxSimulations) && !mTree.isSolved())
    {
      SolverNode lLeaf = mTree.select();
      mSimulations++;

      if (lLeaf.getStatus().isResolved())
      {
        mTree.backpropagate(lLeaf, lLeaf.getStatus().getScore());
        continue;
      }

      EvaluationResult lResult;
      try
      {
        lResult = evaluate(lLeaf, null);
      }
      catch (OracleException lEx)
      {
        recordFailure(lLeaf, lEx);
        continue;
      }

      mTree.expand(lLeaf, lResult);
      mTree.backpropagate(lLeaf, lResult.getScore());

      SolverNode lParent = lLeaf.getSolverParent();
      if (shouldWiden(lParent))
      {
        try
        {
          applyWidening(lParent, evaluate(lParent, JobBuilder.buildExclusions(lParent)));
        }
        catch (OracleException lEx)
        {
          recordFailure(lParent, lEx);
        }
      }
    }

    return finishSolve();
  }

  /**
   * Run simulations with up to xiMaxInFlight oracle evaluations outstanding at once.
   *
   * @param xiMaxSimulations - the simulation budget.
   * @param xiMaxInFlight    - the maximum number of concurrent evaluations.  1 is equivalent to {@link #solve(int)}.
   *
   * @return the outcome.
   *
   * @throws OracleException if the oracle fails and the failure policy is ABORT.  Evaluations already in flight
   *                         are allowed to finish (and are applied) first.
   * @throws InterruptedException if interrupted while waiting for the oracle.  Virtual losses are removed, but
   *                              results already applied remain in the tree.
   */
  public SolveResult solve(int xiMaxSimulations, int xiMaxInFlight) throws OracleException, InterruptedException
  {
    if (xiMaxInFlight <= 1)
    {
      return solve(xiMaxSimulations);
    }

    startSolve(xiMaxSimulations, xiMaxInFlight);

    BlockingQueue<Completion> lCompletions = new LinkedBlockingQueue<>();
    Set<SolverNode> lPendingLeaves = new HashSet<>();
    Set<SolverNode> lWidening = new HashSet<>();
    int lInFlight = 0;
    OracleException lAbort = null;

    try
    {
      while (true)
      {
        boolean lCanLaunch = (lAbort == null) && (mSimulations < xiMaxSimulations) && !mTree.isSolved();
        if (!lCanLaunch && (lInFlight == 0))
        {
          break;
        }

        if (lCanLaunch && (lInFlight < xiMaxInFlight))
        {
          SolverNode lLeaf = mTree.select();
          if (!lLeaf.isPending())
          {
            mSimulations++;
            if (lLeaf.getStatus().isResolved())
            {
              mTree.backpropagate(lLeaf, lLeaf.getStatus().getScore());
            }
            else
            {
              mTree.addVirtualLoss(lLeaf);
              lPendingLeaves.add(lLeaf);
              launch(lLeaf, null, false, lCompletions);
              lInFlight++;
            }
            continue;
          }

          // Every route leads to a leaf that is already being evaluated.  Wait for something to change.
          LOGGER.trace("Selected leaf already in flight - waiting for a completion");
        }

        Completion lCompletion = lCompletions.take();
        lInFlight--;

        if (lCompletion.mWidening)
        {
          lWidening.remove(lCompletion.mNode);
        }
        else
        {
          mTree.removeVirtualLoss(lCompletion.mNode);
          lPendingLeaves.remove(lCompletion.mNode);
        }

        if (lCompletion.mFailure != null)
        {
          try
          {
            recordFailure(lCompletion.mNode, asOracleException(lCompletion.mFailure));
          }
          catch (OracleException lEx)
          {
            if (lAbort == null)
            {
              lAbort = lEx;
            }
          }
          continue;
        }

        if (lCompletion.mWidening)
        {
          // The node (or the whole tree) may have been proven while the re-evaluation was in flight.
          if (lCompletion.mNode.getStatus().isResolved() || mTree.isSolved())
          {
            LOGGER.debug("Discarding re-evaluation of proven position '" + JobBuilder.buildJob(lCompletion.mNode) +
                         "'");
          }
          else
          {
            applyWidening(lCompletion.mNode, lCompletion.mResult);
          }
          continue;
        }

        mTree.expand(lCompletion.mNode, lCompletion.mResult);
        mTree.backpropagate(lCompletion.mNode, lCompletion.mResult.getScore());

        SolverNode lParent = lCompletion.mNode.getSolverParent();
        if ((lAbort == null) && shouldWiden(lParent) && lWidening.add(lParent))
        {
          launch(lParent, JobBuilder.buildExclusions(lParent), true, lCompletions);
          lInFlight++;
        }
      }
    }
    catch (InterruptedException lEx)
    {
      LOGGER.warn("Solve interrupted with " + lInFlight + " evaluation(s) in flight");
      for (SolverNode lLeaf : lPendingLeaves)
      {
        mTree.removeVirtualLoss(lLeaf);
      }
      throw lEx;
    }

    if (lAbort != null)
    {
      throw lAbort;
    }

    return finishSolve();
  }

  private void startSolve(int xiMaxSimulations, int xiMaxInFlight)
  {
    if (!mTree.hasRoot())
    {
      throw new IllegalStateException("Can't solve without a loaded tree");
    }

    mSimulations = 0;
    mOracleCalls = 0;
    mFailures = 0;

    LOGGER.info("Solving with a budget of " + xiMaxSimulations + " simulations (" + xiMaxInFlight + " in flight, " +
                "failure policy " + mFailurePolicy + (mWidenParent ? ", widening" : "") + ")");
  }

  private SolveResult finishSolve()
  {
    SolverNode lRoot = mTree.getRoot();
    SolveResult lResult = new SolveResult(lRoot.getStatus(),
                                          mSimulations,
                                          mOracleCalls,
                                          mFailures,
                                          SearchTree.rankChildren(lRoot),
                                          SearchTree.rankChildren(mTree.getProblemNode()));

    LOGGER.info("Solve complete: " + lResult);
    STATS_LOGGER.info("simulations=" + mSimulations +
                      ", oracleCalls=" + mOracleCalls +
                      ", failures=" + mFailures +
                      ", rootVisits=" + lRoot.getVisitCount() +
                      ", rootStatus=" + lRoot.getStatus());
    return lResult;
  }

  private EvaluationResult evaluate(SolverNode xiNode, String xiExclusions) throws OracleException
  {
    mOracleCalls++;
    String lJob = JobBuilder.buildJob(xiNode);
    LOGGER.debug("Evaluating '" + lJob + "'" + ((xiExclusions == null) ? "" : " excluding '" + xiExclusions + "'"));
    return mOracle.evaluate(lJob, xiExclusions);
  }

  private void launch(SolverNode xiNode,
                      String xiExclusions,
                      boolean xiWidening,
                      BlockingQueue<Completion> xiCompletions)
  {
    mOracleCalls++;
    String lJob = JobBuilder.buildJob(xiNode);
    LOGGER.debug("Launching evaluation of '" + lJob + "'" +
                 ((xiExclusions == null) ? "" : " excluding '" + xiExclusions + "'"));

    CompletableFuture<EvaluationResult> lFuture;
    try
    {
      lFuture = mOracle.evaluateAsync(lJob, xiExclusions);
    }
    catch (RuntimeException lEx)
    {
      // Report a refused evaluation (e.g. from an oracle that has been closed) like any other failure.
      lFuture = CompletableFuture.failedFuture(lEx);
    }

    lFuture.whenComplete((lResult, lFailure) ->
                           xiCompletions.add(new Completion(xiNode, xiWidening, lResult, lFailure)));
  }

  private boolean shouldWiden(SolverNode xiParent)
  {
    return mWidenParent &&
           !mTree.isSolved() &&
           (xiParent != null) &&
           (xiParent.getMoveColour() != null) &&
           !xiParent.getStatus().isResolved();
  }

  /**
   * Apply the re-evaluation of a node made with its existing moves excluded.  A win for the side to move still
   * proves the node, but a win for the other side only says that the excluded moves were needed, so it is ignored.
   */
  private void applyWidening(SolverNode xiParent, EvaluationResult xiResult)
  {
    EvaluationResult lResult = xiResult;
    if (lResult.getState().getWinner() == SearchTree.getColourToMove(xiParent).opponent())
    {
      lResult = lResult.withState(ProofStatus.UNRESOLVED);
    }

    mTree.expand(xiParent, lResult);
    mTree.backpropagate(xiParent, lResult.getScore());
  }

  private void recordFailure(SolverNode xiNode, OracleException xiEx) throws OracleException
  {
    mFailures++;
    if (mFailurePolicy == FailurePolicy.ABORT)
    {
      LOGGER.error("Oracle failed evaluating '" + JobBuilder.buildJob(xiNode) + "' - aborting", xiEx);
      throw xiEx;
    }

    LOGGER.warn("Oracle failed evaluating '" + JobBuilder.buildJob(xiNode) + "' - skipping: " + xiEx.getMessage());
  }

  private static OracleException asOracleException(Throwable xiFailure)
  {
    Throwable lCause = xiFailure;
    while ((lCause instanceof CompletionException) && (lCause.getCause() != null))
    {
      lCause = lCause.getCause();
    }

    if (lCause instanceof OracleException)
    {
      return (OracleException)lCause;
    }
    return new OracleUnavailableException("Oracle evaluation failed", lCause);
  }
}
