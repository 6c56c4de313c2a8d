package org.tsumego.sgf;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Before;
import org.junit.Test;

public class SgfNodeTest
{
  private SgfNode mRoot;
  private SgfNode mA;
  private SgfNode mB;
  private SgfNode mC;

  private static SgfNode move(Colour xiColour, String xiCoordinate)
  {
    SgfNode lNode = new SgfNode();
    lNode.addPropertyValue(xiColour.mKey, xiCoordinate);
    return lNode;
  }

  @Before
  public void setUp()
  {
    mRoot = new SgfNode();
    mA = move(Colour.BLACK, "aa");
    mB = move(Colour.BLACK, "bb");
    mC = move(Colour.BLACK, "cc");
    mRoot.addChild(mA);
    mRoot.addChild(mB);
    mRoot.addChild(mC);
  }

  @Test
  public void testChildrenInOrder()
  {
    assertEquals(3, mRoot.getNumChildren());
    assertEquals(List.of(mA, mB, mC), mRoot.getChildren());
    assertSame(mB, mRoot.getChild(1));
    assertSame(mC, mB.getNextSibling());
    assertNull(mC.getNextSibling());
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void testBadChildIndex()
  {
    mRoot.getChild(3);
  }

  @Test
  public void testDetachMiddleAndLast()
  {
    mB.detach();
    assertEquals(List.of(mA, mC), mRoot.getChildren());
    assertNull(mB.getParent());
    assertNull(mB.getNextSibling());

    mC.detach();
    assertEquals(List.of(mA), mRoot.getChildren());

    // The tail of the chain must have been repaired so that appending still works.
    mRoot.addChild(mB);
    assertEquals(List.of(mA, mB), mRoot.getChildren());
    assertEquals(2, mRoot.getNumChildren());
  }

  @Test
  public void testDetachFirst()
  {
    mA.detach();
    assertSame(mB, mRoot.getFirstChild());
    assertEquals(2, mRoot.getNumChildren());
  }

  @Test
  public void testReparenting()
  {
    mA.addChild(mC);
    assertEquals(List.of(mA, mB), mRoot.getChildren());
    assertSame(mA, mC.getParent());
    assertEquals(2, mC.getDepth());
    assertSame(mRoot, mC.getRoot());
  }

  @Test
  public void testCyclesRefused()
  {
    mA.addChild(mB);
    try
    {
      mB.addChild(mRoot);
      fail("Added an ancestor as a child");
    }
    catch (IllegalArgumentException lEx)
    {
      // Expected
    }

    try
    {
      mB.addChild(mB);
      fail("Added a node as its own child");
    }
    catch (IllegalArgumentException lEx)
    {
      // Expected
    }
  }

  @Test
  public void testMainLineEnd()
  {
    SgfNode lReply = move(Colour.WHITE, "dd");
    mA.addChild(lReply);
    assertSame(lReply, mRoot.getMainLineEnd());
    assertSame(mC, mC.getMainLineEnd());
  }

  @Test
  public void testMoveProperties()
  {
    SgfNode lNode = new SgfNode();
    lNode.addPropertyValue("C", "a comment");
    lNode.addPropertyValue("W", "ih");

    assertEquals(Colour.WHITE, lNode.getMoveColour());
    assertEquals(Colour.BLACK, lNode.getColourToMove());
    assertEquals("ih", lNode.getMoveCoordinate());
    assertEquals("W[ih]", lNode.getMoveString());

    lNode.removeProperty("W");
    assertNull(lNode.getMoveColour());
    assertNull(lNode.getColourToMove());
    assertNull(lNode.getMoveString());
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testPropertyViewsAreReadOnly()
  {
    mA.getProperty("B").add("zz");
  }
}
