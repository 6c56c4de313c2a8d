package org.tsumego.oracle;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.StringJoiner;

import org.tsumego.sgf.SgfNode;

/**
 * Builds the move sequences passed to the oracle.
 */
public final class JobBuilder
{
  private JobBuilder()
  {
    // Static methods only.
  }

  /**
   * @return the job for a position: the moves from the root of the tree down to (and including) the specified node,
   *         e.g. ";B[jj];W[ih];B[kk]".  Nodes without a move (such as the record root) contribute nothing.  Empty if
   *         there are no moves at all.
   *
   * @param xiNode - the node to be evaluated.
   */
  public static String buildJob(SgfNode xiNode)
  {
    Deque<String> lMoves = new ArrayDeque<>();
    for (SgfNode lNode = xiNode; lNode != null; lNode = lNode.getParent())
    {
      String lMove = lNode.getMoveString();
      if (lMove != null)
      {
        lMoves.push(lMove);
      }
    }
    return join(lMoves);
  }

  /**
   * @return the exclusion list for re-evaluating a node: the moves of its existing children, e.g. ";W[ih];W[jh]", or
   *         null if it has no children with moves.
   *
   * @param xiNode - the node to be re-evaluated.
   */
  public static String buildExclusions(SgfNode xiNode)
  {
    Deque<String> lMoves = new ArrayDeque<>();
    for (SgfNode lChild : xiNode)
    {
      String lMove = lChild.getMoveString();
      if (lMove != null)
      {
        lMoves.add(lMove);
      }
    }
    return lMoves.isEmpty() ? null : join(lMoves);
  }

  private static String join(Iterable<String> xiMoves)
  {
    StringJoiner lJoiner = new StringJoiner(";", ";", "");
    lJoiner.setEmptyValue("");
    for (String lMove : xiMoves)
    {
      lJoiner.add(lMove);
    }
    return lJoiner.toString();
  }
}
