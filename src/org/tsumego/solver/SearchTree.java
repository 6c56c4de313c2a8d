package org.tsumego.solver;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map.Entry;
import java.util.concurrent.Executor;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.tsumego.oracle.EvaluationResult;
import org.tsumego.sgf.Colour;
import org.tsumego.sgf.NodeAllocator;
import org.tsumego.sgf.PooledNodeAllocator;
import org.tsumego.sgf.SgfNode;
import org.tsumego.sgf.SgfParser;
import org.tsumego.sgf.exceptions.SgfException;

/**
 * The search tree - a record tree whose nodes carry search statistics.
 *
 * The tree only ever grows.  All operations that mutate it (loading, expansion, backpropagation and virtual loss)
 * must be performed by a single thread at a time.  The {@link Solver} guarantees this by doing all tree work on the
 * thread that called it.
 */
public class SearchTree
{
  private static final Logger LOGGER = LogManager.getLogger();

  private static final Comparator<SolverNode> BY_VISITS_DESCENDING =
                                               Comparator.comparingInt(SolverNode::getVisitCount).reversed();

  private final SelectPolicy mSelectPolicy;
  private final NodeAllocator<SolverNode> mAllocator;

  private SolverNode mRoot;
  private SolverNode mProblemNode;

  /**
   * Create an empty search tree using UCT selection.
   */
  public SearchTree()
  {
    this(new UCTSelectPolicy());
  }

  /**
   * Create an empty search tree.
   *
   * @param xiSelectPolicy - the policy for descending through the tree.
   */
  public SearchTree(SelectPolicy xiSelectPolicy)
  {
    this(xiSelectPolicy, SolverNode::new);
  }

  /**
   * Create an empty search tree.
   *
   * @param xiSelectPolicy - the policy for descending through the tree.
   * @param xiAllocator    - allocator for nodes created by the tree (when loading a record and when copying
   *                         candidate moves that aren't already search nodes).
   */
  public SearchTree(SelectPolicy xiSelectPolicy, NodeAllocator<SolverNode> xiAllocator)
  {
    mSelectPolicy = xiSelectPolicy;
    mAllocator = xiAllocator;
  }

  /**
   * Load a record as the new tree.
   *
   * @param xiRecord - the record text.
   *
   * @return the root of the loaded tree.
   *
   * @throws SgfException if the record is malformed.
   */
  public SolverNode load(String xiRecord) throws SgfException
  {
    return load(xiRecord, null);
  }

  /**
   * Load a record as the new tree, optionally pre-sizing a pool of nodes for it first.
   *
   * @param xiRecord          - the record text.
   * @param xiPresizeExecutor - executor on which to fill the node pool, or null to allocate nodes as needed.
   *
   * @return the root of the loaded tree.
   *
   * @throws SgfException if the record is malformed.
   */
  public SolverNode load(String xiRecord, Executor xiPresizeExecutor) throws SgfException
  {
    NodeAllocator<SolverNode> lAllocator = mAllocator;
    if (xiPresizeExecutor != null)
    {
      PooledNodeAllocator<SolverNode> lPooledAllocator = new PooledNodeAllocator<>(mAllocator);
      lPooledAllocator.reserveAsync(SgfParser.estimateCapacity(xiRecord), xiPresizeExecutor);
      lAllocator = lPooledAllocator;
    }

    setRoot(new SgfParser<>(lAllocator).parse(xiRecord));
    return mRoot;
  }

  /**
   * Use an existing tree.
   *
   * @param xiRoot - the root of the tree.
   */
  public void setRoot(SolverNode xiRoot)
  {
    mRoot = xiRoot;
    mProblemNode = (SolverNode)xiRoot.getMainLineEnd();
    LOGGER.debug("Loaded tree - problem position is at depth " + mProblemNode.getDepth());
  }

  /**
   * @return the root of the tree, or null if nothing has been loaded.
   */
  public SolverNode getRoot()
  {
    return mRoot;
  }

  /**
   * @return the position the record poses as the problem - the end of the main line when the tree was loaded.
   */
  public SolverNode getProblemNode()
  {
    return mProblemNode;
  }

  /**
   * @return whether a tree is loaded.
   */
  public boolean hasRoot()
  {
    return mRoot != null;
  }

  /**
   * @return whether the root's status has been proven.
   */
  public boolean isSolved()
  {
    return (mRoot != null) && mRoot.getStatus().isResolved();
  }

  /**
   * Descend from the root to a leaf.  Resolved nodes on the way are not avoided - their averages discourage
   * selection without forbidding it.
   *
   * @return the selected leaf.
   */
  public SolverNode select()
  {
    checkLoaded();

    SolverNode lNode = mRoot;
    while (!lNode.isLeaf())
    {
      lNode = mSelectPolicy.selectChild(lNode);
    }

    LOGGER.trace("Selected " + lNode);
    return lNode;
  }

  /**
   * Grow the tree at a node with the oracle's evaluation of it.
   *
   * If the evaluation asserts a win, the node takes that status.  Every suggested move (with any follow-up moves
   * hanging off it) becomes a new child of the node with fresh statistics.
   *
   * @param xiNode   - the evaluated node.  It must not have an evaluation in flight.
   * @param xiResult - the evaluation.
   */
  public void expand(SolverNode xiNode, EvaluationResult xiResult)
  {
    if (xiNode.isPending())
    {
      throw new IllegalStateException("Can't expand " + xiNode + " while its evaluation is in flight");
    }

    if (xiResult.getState().isResolved())
    {
      xiNode.setStatus(xiResult.getState());
    }

    // Collect the candidates before adopting any, since adoption unlinks them from one another.
    List<SgfNode> lCandidates = new ArrayList<>();
    for (SgfNode lCandidate = xiResult.getMoves(); lCandidate != null; lCandidate = lCandidate.getNextSibling())
    {
      lCandidates.add(lCandidate);
    }

    for (SgfNode lCandidate : lCandidates)
    {
      xiNode.addChild(adopt(lCandidate));
    }

    LOGGER.debug("Expanded " + xiNode.getMoveString() + " with " + lCandidates.size() + " candidate(s)");
  }

  /**
   * Record a score at a node and each of its ancestors, recomputing their proof status on the way up.
   *
   * @param xiNode       - the node at which the score was obtained.
   * @param xiBlackScore - the score, in Black's frame.
   *
   * @return the number of nodes updated.
   */
  public int backpropagate(SolverNode xiNode, double xiBlackScore)
  {
    int lNumUpdated = 0;
    for (SolverNode lNode = xiNode; lNode != null; lNode = lNode.getSolverParent())
    {
      double lScore = (getMover(lNode) == Colour.BLACK) ? xiBlackScore : -xiBlackScore;
      lNode.recordVisit(lScore);
      updateStatus(lNode);
      lNumUpdated++;

      LOGGER.trace("  " + lNode);
    }

    return lNumUpdated;
  }

  /**
   * Apply the proof rule at a node.  Resolved nodes and leaves are left as they are.
   *
   * If any child is a win for the side to move, so is the node.  Otherwise, if every child is a win for the
   * opponent, so is the node.
   *
   * @param xiNode - the node.
   */
  void updateStatus(SolverNode xiNode)
  {
    if (xiNode.getStatus().isResolved() || xiNode.isLeaf())
    {
      return;
    }

    Colour lToMove = getColourToMove(xiNode);
    ProofStatus lWin = ProofStatus.winFor(lToMove);
    ProofStatus lLoss = ProofStatus.winFor(lToMove.opponent());

    boolean lAllLost = true;
    for (SgfNode lChild : xiNode)
    {
      ProofStatus lChildStatus = ((SolverNode)lChild).getStatus();
      if (lChildStatus == lWin)
      {
        xiNode.setStatus(lWin);
        LOGGER.debug("Proved " + lWin + " at " + describe(xiNode));
        return;
      }
      lAllLost &= (lChildStatus == lLoss);
    }

    if (lAllLost)
    {
      xiNode.setStatus(lLoss);
      LOGGER.debug("Proved " + lLoss + " at " + describe(xiNode));
    }
  }

  /**
   * @return the colour to move at a node: the opponent of whoever played the node's own move.  A node without a
   *         move takes the colour of its first child that has one, or Black if there's no such child.
   *
   * @param xiNode - the node.
   */
  public static Colour getColourToMove(SgfNode xiNode)
  {
    Colour lColour = xiNode.getColourToMove();
    if (lColour != null)
    {
      return lColour;
    }

    for (SgfNode lChild : xiNode)
    {
      if (lChild.getMoveColour() != null)
      {
        return lChild.getMoveColour();
      }
    }

    return Colour.BLACK;
  }

  /**
   * @return the colour in whose frame a node's statistics are kept: the colour that played its move or, for a node
   *         without one, the colour that would have moved to reach it.
   *
   * @param xiNode - the node.
   */
  public static Colour getMover(SgfNode xiNode)
  {
    Colour lColour = xiNode.getMoveColour();
    return (lColour != null) ? lColour : getColourToMove(xiNode).opponent();
  }

  /**
   * @return the children of a node, most visited first.  Children with equal visits keep their order.
   *
   * @param xiNode - the node.
   */
  public static List<SolverNode> rankChildren(SolverNode xiNode)
  {
    List<SolverNode> lChildren = new ArrayList<>(xiNode.getNumChildren());
    for (SgfNode lChild : xiNode)
    {
      lChildren.add((SolverNode)lChild);
    }
    lChildren.sort(BY_VISITS_DESCENDING);
    return lChildren;
  }

  /**
   * Mark a leaf as having an evaluation in flight.
   *
   * @param xiNode - the leaf.
   */
  void addVirtualLoss(SolverNode xiNode)
  {
    xiNode.addVirtualLoss();
  }

  /**
   * Clear the in-flight mark from a leaf.
   *
   * @param xiNode - the leaf.
   */
  void removeVirtualLoss(SolverNode xiNode)
  {
    xiNode.removeVirtualLoss();
  }

  private SolverNode adopt(SgfNode xiCandidate)
  {
    if (xiCandidate instanceof SolverNode)
    {
      SolverNode lNode = (SolverNode)xiCandidate;
      resetSubtree(lNode);
      return lNode;
    }

    return copy(xiCandidate);
  }

  private static void resetSubtree(SolverNode xiNode)
  {
    xiNode.resetStatistics();
    for (SgfNode lChild : xiNode)
    {
      resetSubtree((SolverNode)lChild);
    }
  }

  private SolverNode copy(SgfNode xiSource)
  {
    SolverNode lCopy = mAllocator.allocate();
    for (Entry<String, List<String>> lProperty : xiSource.getProperties().entrySet())
    {
      lCopy.setProperty(lProperty.getKey(), lProperty.getValue());
    }
    for (SgfNode lChild : xiSource)
    {
      lCopy.addChild(copy(lChild));
    }
    return lCopy;
  }

  private static String describe(SgfNode xiNode)
  {
    String lMove = xiNode.getMoveString();
    return (lMove == null) ? "root" : lMove + " (depth " + xiNode.getDepth() + ")";
  }

  private void checkLoaded()
  {
    if (mRoot == null)
    {
      throw new IllegalStateException("No tree loaded");
    }
  }
}
