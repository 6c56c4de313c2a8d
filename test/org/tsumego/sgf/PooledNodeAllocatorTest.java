package org.tsumego.sgf;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.Test;

public class PooledNodeAllocatorTest
{
  @Test
  public void testReserveThenAllocate()
  {
    TrackingNodeAllocator<SgfNode> lUnderlying = new TrackingNodeAllocator<>(SgfNode::new);
    PooledNodeAllocator<SgfNode> lAllocator = new PooledNodeAllocator<>(lUnderlying);

    lAllocator.reserve(3);
    assertEquals(3, lUnderlying.getNumAllocated());
    assertEquals(3, lAllocator.getAvailable());

    assertNotNull(lAllocator.allocate());
    assertEquals(2, lAllocator.getAvailable());
    assertEquals(1, lAllocator.getNumAllocated());
  }

  @Test
  public void testFallsBackOnceExhausted()
  {
    TrackingNodeAllocator<SgfNode> lUnderlying = new TrackingNodeAllocator<>(SgfNode::new);
    PooledNodeAllocator<SgfNode> lAllocator = new PooledNodeAllocator<>(lUnderlying);
    lAllocator.reserve(1);

    lAllocator.allocate();
    lAllocator.allocate();

    assertEquals(2, lUnderlying.getNumAllocated());
    assertEquals(0, lAllocator.getAvailable());
    assertEquals(2, lAllocator.getNumAllocated());
  }

  @Test
  public void testPresizedParse() throws Exception
  {
    String lRecord = "(;B[dd];W[cc](;B[ee])(;B[dc]))";
    ExecutorService lExecutor = Executors.newSingleThreadExecutor();
    try
    {
      TrackingNodeAllocator<SgfNode> lUnderlying = new TrackingNodeAllocator<>(SgfNode::new);
      PooledNodeAllocator<SgfNode> lAllocator = new PooledNodeAllocator<>(lUnderlying);
      lAllocator.reserveAsync(SgfParser.estimateCapacity(lRecord), lExecutor);

      SgfNode lRoot = new SgfParser<>(lAllocator).parse(lRecord);

      assertEquals("B[dd]", lRoot.getFirstChild().getMoveString());
      assertEquals(5, lUnderlying.getNumAllocated());
      assertEquals(0, lAllocator.getAvailable());
    }
    finally
    {
      lExecutor.shutdown();
    }
  }

  @Test
  public void testReleaseAll() throws Exception
  {
    TrackingNodeAllocator<SgfNode> lAllocator = new TrackingNodeAllocator<>(SgfNode::new);
    SgfNode lRoot = new SgfParser<>(lAllocator).parse("(;B[dd];W[cc])");

    lAllocator.releaseAll();
    assertEquals(0, lAllocator.getNumAllocated());
    assertEquals(0, lRoot.getNumChildren());
  }
}
