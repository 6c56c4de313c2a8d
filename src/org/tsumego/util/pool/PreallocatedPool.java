package org.tsumego.util.pool;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A pool which can be filled in advance.
 *
 * Items are handed out from the pre-allocated set first.  Once that is exhausted, the pool falls back to allocating
 * fresh items, so running out of reserved capacity is never an error.  Items are not returned to the pool.
 *
 * {@link #reserve} and {@link #allocate} must not be called concurrently.  Callers that reserve on another thread
 * must join that work before allocating.
 *
 * @param <ItemType> the type of item to be kept in the pool.
 */
public class PreallocatedPool<ItemType> implements Pool<ItemType>
{
  private static final Logger LOGGER = LogManager.getLogger();

  // The reserved items and the index of the next one to hand out.
  private Object[] mItems = new Object[0];
  private int mNextFreeItem;

  // Number of items handed out (reserved and fresh).
  private int mNumItemsInUse;

  /**
   * Pre-allocate items so that the next xiCapacity calls to {@link #allocate} don't need to create any.
   *
   * @param xiCapacity  - the number of items to have ready.
   * @param xiAllocator - the allocator with which to create them.
   */
  public void reserve(int xiCapacity, ObjectAllocator<ItemType> xiAllocator)
  {
    int lAvailable = mItems.length - mNextFreeItem;
    if (lAvailable >= xiCapacity)
    {
      return;
    }

    Object[] lItems = new Object[xiCapacity];
    System.arraycopy(mItems, mNextFreeItem, lItems, 0, lAvailable);
    for (int i = lAvailable; i < xiCapacity; i++)
    {
      lItems[i] = xiAllocator.newObject(mNumItemsInUse + i);
    }

    mItems = lItems;
    mNextFreeItem = 0;
    LOGGER.trace("Reserved " + (xiCapacity - lAvailable) + " items (capacity now " + xiCapacity + ")");
  }

  @Override
  @SuppressWarnings("unchecked")
  public ItemType allocate(ObjectAllocator<ItemType> xiAllocator)
  {
    ItemType lAllocatedItem;

    if (mNextFreeItem < mItems.length)
    {
      lAllocatedItem = (ItemType)mItems[mNextFreeItem];
      mItems[mNextFreeItem++] = null;
    }
    else
    {
      lAllocatedItem = xiAllocator.newObject(mNumItemsInUse);
    }

    mNumItemsInUse++;
    return lAllocatedItem;
  }

  @Override
  public int getCapacity()
  {
    return mItems.length - mNextFreeItem;
  }

  @Override
  public int getNumItemsInUse()
  {
    return mNumItemsInUse;
  }
}
