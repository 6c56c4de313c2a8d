package org.tsumego.util.pool;

/**
 * A pool of items.
 *
 * @param <ItemType> - the type of items stored in this pool.
 */
public interface Pool<ItemType>
{
  /**
   * Interface to be implemented by classes capable of allocating objects for a pool.
   *
   * @param <ItemType> the type of item to be allocated.
   */
  public interface ObjectAllocator<ItemType>
  {
    /**
     * @return a newly allocated object.
     *
     * @param xiPoolIndex - index in the pool from which this object was allocated.
     */
    public ItemType newObject(int xiPoolIndex);
  }

  /**
   * Allocate a new item from the pool.
   *
   * @param xiAllocator - object allocator to use if no pre-allocated items are available.
   *
   * @return the new item.
   */
  public ItemType allocate(ObjectAllocator<ItemType> xiAllocator);

  /**
   * @return the number of items the pool holds ready for use without falling back to fresh allocation.
   */
  public int getCapacity();

  /**
   * @return the number of items handed out so far.
   */
  public int getNumItemsInUse();
}
