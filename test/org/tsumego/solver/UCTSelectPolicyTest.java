package org.tsumego.solver;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import org.junit.Before;
import org.junit.Test;

public class UCTSelectPolicyTest
{
  private SolverNode mParent;
  private SolverNode mStrong;
  private SolverNode mRare;

  @Before
  public void setUp()
  {
    mParent = new SolverNode();
    mStrong = new SolverNode();
    mRare = new SolverNode();
    mParent.addChild(mStrong);
    mParent.addChild(mRare);

    mParent.setStatistics(10, 0);
    mStrong.setStatistics(5, 4);
    mRare.setStatistics(1, 0);
  }

  @Test
  public void testDefaultConstant()
  {
    assertEquals(Math.sqrt(2), new UCTSelectPolicy().getExplorationConstant(), 0);
    assertEquals(0.25, new UCTSelectPolicy(0.25).getExplorationConstant(), 0);
  }

  @Test
  public void testExplorationFavoursRarelyVisitedChild()
  {
    assertSame(mRare, new UCTSelectPolicy().selectChild(mParent));
  }

  @Test
  public void testNoExplorationIsGreedy()
  {
    UCTSelectPolicy lPolicy = new UCTSelectPolicy(0);
    assertEquals(0.8, lPolicy.value(mStrong, Math.log(10)), 1e-9);
    assertSame(mStrong, lPolicy.selectChild(mParent));
  }
}
