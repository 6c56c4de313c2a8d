package org.tsumego.util.pool;

import static org.junit.Assert.assertEquals;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;
import org.tsumego.util.pool.Pool.ObjectAllocator;

public class PreallocatedPoolTest
{
  private final List<Integer> mCreatedAt = new ArrayList<>();

  private final ObjectAllocator<StringBuilder> mAllocator = xiPoolIndex ->
  {
    mCreatedAt.add(xiPoolIndex);
    return new StringBuilder();
  };

  @Test
  public void testReservedItemsHandedOutFirst()
  {
    PreallocatedPool<StringBuilder> lPool = new PreallocatedPool<>();
    lPool.reserve(2, mAllocator);
    assertEquals(List.of(0, 1), mCreatedAt);
    assertEquals(2, lPool.getCapacity());

    lPool.allocate(mAllocator);
    lPool.allocate(mAllocator);
    assertEquals(2, mCreatedAt.size());
    assertEquals(0, lPool.getCapacity());
    assertEquals(2, lPool.getNumItemsInUse());

    lPool.allocate(mAllocator);
    assertEquals(List.of(0, 1, 2), mCreatedAt);
    assertEquals(3, lPool.getNumItemsInUse());
  }

  @Test
  public void testReserveOnlyTopsUp()
  {
    PreallocatedPool<StringBuilder> lPool = new PreallocatedPool<>();
    lPool.reserve(2, mAllocator);
    lPool.allocate(mAllocator);

    lPool.reserve(1, mAllocator);
    assertEquals(2, mCreatedAt.size());

    lPool.reserve(3, mAllocator);
    assertEquals(4, mCreatedAt.size());
    assertEquals(3, lPool.getCapacity());

    lPool.allocate(mAllocator);
    assertEquals(2, lPool.getNumItemsInUse());
  }
}
