package org.tsumego.solver;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;
import org.tsumego.oracle.EvaluationResult;
import org.tsumego.oracle.OracleOutputParser;
import org.tsumego.sgf.Colour;
import org.tsumego.sgf.SgfNode;
import org.tsumego.sgf.SgfParser;

public class SearchTreeTest
{
  private final SearchTree mTree = new SearchTree();

  private static EvaluationResult result(double xiScore, ProofStatus xiState, SgfNode xiMoves)
  {
    return new EvaluationResult(xiMoves, xiScore, xiState, "test", List.of(), "");
  }

  private static SolverNode child(SolverNode xiNode, int xiIndex)
  {
    return (SolverNode)xiNode.getChild(xiIndex);
  }

  /**
   * @return the node under the root after loading "(;B[aa](;W[bb])(;W[cc])...)".
   */
  private SolverNode loadBlackWithReplies(String... xiReplies) throws Exception
  {
    StringBuilder lRecord = new StringBuilder("(;B[aa]");
    for (String lReply : xiReplies)
    {
      lRecord.append("(;W[").append(lReply).append("])");
    }
    lRecord.append(")");
    return (SolverNode)mTree.load(lRecord.toString()).getFirstChild();
  }

  @Test(expected = IllegalStateException.class)
  public void testSelectWithoutTree()
  {
    mTree.select();
  }

  @Test
  public void testSelectReachesLeaf() throws Exception
  {
    SolverNode lBlack = (SolverNode)mTree.load("(;B[aa])").getFirstChild();
    assertSame(lBlack, mTree.select());
    assertSame(lBlack, mTree.getProblemNode());
  }

  @Test
  public void testUnvisitedChildPreferred() throws Exception
  {
    SolverNode lBlack = loadBlackWithReplies("bb", "cc", "dd");
    lBlack.setStatistics(20, 0);
    child(lBlack, 0).setStatistics(10, 9);
    child(lBlack, 2).setStatistics(10, 9);

    assertSame(child(lBlack, 1), mTree.select());
  }

  @Test
  public void testTiesGoToFirstChild() throws Exception
  {
    SolverNode lBlack = loadBlackWithReplies("bb", "cc", "dd");
    assertSame(child(lBlack, 0), mTree.select());

    lBlack.setStatistics(20, 0);
    for (int i = 0; i < 3; i++)
    {
      child(lBlack, i).setStatistics(5, 1);
    }
    assertSame(child(lBlack, 0), mTree.select());
  }

  @Test
  public void testBestAverageWinsWithEqualVisits() throws Exception
  {
    SolverNode lBlack = loadBlackWithReplies("bb", "cc");
    lBlack.setStatistics(20, 0);
    child(lBlack, 0).setStatistics(10, 2);
    child(lBlack, 1).setStatistics(10, 5);

    assertSame(child(lBlack, 1), mTree.select());
  }

  @Test
  public void testVirtualLossSteersSelection() throws Exception
  {
    SolverNode lBlack = loadBlackWithReplies("bb", "cc");
    SolverNode lFirst = mTree.select();
    mTree.addVirtualLoss(lFirst);

    assertTrue(lFirst.isPending());
    assertEquals(1, lFirst.getVisitCount());
    assertSame(child(lBlack, 1), mTree.select());

    mTree.removeVirtualLoss(lFirst);
    assertFalse(lFirst.isPending());
    assertEquals(0, lFirst.getVisitCount());
  }

  @Test
  public void testBackpropagateUpdatesPathToRoot() throws Exception
  {
    SolverNode lRoot = mTree.load("(;B[aa];W[bb];B[cc])");
    SolverNode lLeaf = (SolverNode)lRoot.getMainLineEnd();
    assertEquals(3, lLeaf.getDepth());

    assertEquals(4, mTree.backpropagate(lLeaf, 0.5));
    for (SolverNode lNode = lLeaf; lNode != null; lNode = lNode.getSolverParent())
    {
      assertEquals(1, lNode.getVisitCount());
    }
  }

  @Test
  public void testScoresKeptInFrameOfMover() throws Exception
  {
    SolverNode lRoot = mTree.load("(;B[aa];W[bb])");
    SolverNode lBlack = child(lRoot, 0);
    SolverNode lWhite = child(lBlack, 0);

    mTree.backpropagate(lWhite, 0.6);

    assertEquals(-0.6, lWhite.getScoreSum(), 1e-9);
    assertEquals(0.6, lBlack.getScoreSum(), 1e-9);

    // Black is to move at the root, so its statistics are in White's frame.
    assertEquals(-0.6, lRoot.getScoreSum(), 1e-9);
  }

  @Test
  public void testWinForSideToMoveNeedsOneChild() throws Exception
  {
    SolverNode lBlack = loadBlackWithReplies("bb", "cc");
    SolverNode lRoot = mTree.getRoot();

    mTree.expand(child(lBlack, 1), result(-1, ProofStatus.WIN_WHITE, null));
    mTree.backpropagate(child(lBlack, 1), -1);

    assertEquals(ProofStatus.WIN_WHITE, lBlack.getStatus());
    assertEquals(ProofStatus.WIN_WHITE, lRoot.getStatus());
    assertTrue(mTree.isSolved());
  }

  @Test
  public void testWinForOpponentNeedsAllChildren() throws Exception
  {
    SolverNode lBlack = loadBlackWithReplies("bb", "cc");

    mTree.expand(child(lBlack, 0), result(1, ProofStatus.WIN_BLACK, null));
    mTree.backpropagate(child(lBlack, 0), 1);
    assertEquals(ProofStatus.UNRESOLVED, lBlack.getStatus());
    assertFalse(mTree.isSolved());

    mTree.expand(child(lBlack, 1), result(1, ProofStatus.WIN_BLACK, null));
    mTree.backpropagate(child(lBlack, 1), 1);
    assertEquals(ProofStatus.WIN_BLACK, lBlack.getStatus());
    assertEquals(ProofStatus.WIN_BLACK, mTree.getRoot().getStatus());
  }

  @Test
  public void testProvenStatusNeverDowngraded() throws Exception
  {
    SolverNode lBlack = loadBlackWithReplies("bb");
    mTree.expand(lBlack, result(1, ProofStatus.WIN_BLACK, null));
    mTree.backpropagate(lBlack, 1);

    mTree.updateStatus(lBlack);
    assertEquals(ProofStatus.WIN_BLACK, lBlack.getStatus());
  }

  @Test
  public void testExpandCopiesPlainCandidates() throws Exception
  {
    SolverNode lBlack = (SolverNode)mTree.load("(;B[aa])").getFirstChild();
    EvaluationResult lResult = new OracleOutputParser().parse("a-b:B1 ;W[bb];B[cc];C[a-b:B1]");
    SgfNode lPlain = lResult.getMoves();

    mTree.expand(lBlack, lResult);

    assertEquals(1, lBlack.getNumChildren());
    SolverNode lReply = child(lBlack, 0);
    assertNotSame(lPlain, lReply);
    assertEquals("W[bb]", lReply.getMoveString());
    assertEquals("B[cc]", lReply.getFirstChild().getMoveString());
    assertTrue(lReply.getFirstChild() instanceof SolverNode);
    assertEquals(ProofStatus.UNRESOLVED, lBlack.getStatus());
  }

  @Test
  public void testExpandAdoptsSearchNodes() throws Exception
  {
    SolverNode lBlack = (SolverNode)mTree.load("(;B[aa])").getFirstChild();
    SgfParser<SolverNode> lParser = new SgfParser<>(SolverNode::new);
    SolverNode lCandidates = (SolverNode)lParser.parse("(;B[zz](;W[bb])(;W[cc]))").getFirstChild();
    child(lCandidates, 0).setStatistics(3, 1);

    mTree.expand(lBlack, result(0, ProofStatus.UNRESOLVED, lCandidates.getFirstChild()));

    assertEquals(2, lBlack.getNumChildren());
    assertEquals(0, lCandidates.getNumChildren());
    assertSame(lBlack, child(lBlack, 0).getParent());
    assertEquals(0, child(lBlack, 0).getVisitCount());
    assertEquals("W[cc]", child(lBlack, 1).getMoveString());
  }

  @Test
  public void testExpandSetsAssertedStatus() throws Exception
  {
    SolverNode lBlack = (SolverNode)mTree.load("(;B[aa])").getFirstChild();
    mTree.expand(lBlack, result(-1, ProofStatus.WIN_WHITE, null));
    assertEquals(ProofStatus.WIN_WHITE, lBlack.getStatus());
    assertTrue(lBlack.isLeaf());
  }

  @Test(expected = IllegalStateException.class)
  public void testExpandInFlightNode() throws Exception
  {
    SolverNode lBlack = (SolverNode)mTree.load("(;B[aa])").getFirstChild();
    mTree.addVirtualLoss(lBlack);
    mTree.expand(lBlack, result(0, ProofStatus.UNRESOLVED, null));
  }

  @Test
  public void testRankingIsByVisitsNotScore() throws Exception
  {
    SolverNode lRoot = mTree.load("(;B[aa](;W[bb])(;W[cc])(;W[dd]))");
    SolverNode lBlack = child(lRoot, 0);
    child(lBlack, 0).setStatistics(5, 4.5);
    child(lBlack, 1).setStatistics(40, 24);
    child(lBlack, 2).setStatistics(5, 1);

    List<SolverNode> lRanked = SearchTree.rankChildren(lBlack);
    assertSame(child(lBlack, 1), lRanked.get(0));
    assertSame(child(lBlack, 0), lRanked.get(1));
    assertSame(child(lBlack, 2), lRanked.get(2));
  }

  @Test
  public void testColourToMove() throws Exception
  {
    assertEquals(Colour.BLACK, SearchTree.getColourToMove(new SolverNode()));
    SolverNode lRoot = mTree.load("(;AB[aa];W[bb])");
    assertEquals(Colour.BLACK, SearchTree.getColourToMove(lRoot));
    assertEquals(Colour.WHITE, SearchTree.getColourToMove(lRoot.getFirstChild()));
    assertEquals(Colour.BLACK, SearchTree.getColourToMove(lRoot.getMainLineEnd()));
    assertEquals(Colour.WHITE, SearchTree.getMover(lRoot));
  }
}
