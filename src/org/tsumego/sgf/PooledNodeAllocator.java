package org.tsumego.sgf;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.tsumego.util.pool.Pool.ObjectAllocator;
import org.tsumego.util.pool.PreallocatedPool;

/**
 * Allocator that hands out nodes from a pre-sized pool before falling back to fresh allocation.
 *
 * Use is two-phase: size the pool with {@link SgfParser#estimateCapacity} and {@link #reserve} (or
 * {@link #reserveAsync} to overlap the work with other processing), then allocate.  Allocation waits for any
 * outstanding asynchronous reservation before touching the pool.
 *
 * @param <NodeType> the type of node allocated.
 */
public class PooledNodeAllocator<NodeType extends SgfNode> implements NodeAllocator<NodeType>
{
  private final PreallocatedPool<NodeType> mPool = new PreallocatedPool<>();
  private final ObjectAllocator<NodeType> mObjectAllocator;

  private CompletableFuture<Void> mPendingReservation = null;

  /**
   * Create a pooled allocator.
   *
   * @param xiUnderlying - the allocator used to fill the pool and once it is exhausted.
   */
  public PooledNodeAllocator(NodeAllocator<NodeType> xiUnderlying)
  {
    mObjectAllocator = xiPoolIndex -> xiUnderlying.allocate();
  }

  /**
   * Make sure that at least xiCapacity nodes are ready in the pool.
   *
   * @param xiCapacity - the number of nodes.
   */
  public void reserve(int xiCapacity)
  {
    awaitReservation();
    mPool.reserve(xiCapacity, mObjectAllocator);
  }

  /**
   * Start filling the pool on the specified executor.
   *
   * @param xiCapacity - the number of nodes.
   * @param xiExecutor - the executor to run the reservation on.
   *
   * @return a future which completes when the pool has been filled.
   */
  public CompletableFuture<Void> reserveAsync(int xiCapacity, Executor xiExecutor)
  {
    awaitReservation();
    mPendingReservation = CompletableFuture.runAsync(() -> mPool.reserve(xiCapacity, mObjectAllocator), xiExecutor);
    return mPendingReservation;
  }

  @Override
  public NodeType allocate()
  {
    awaitReservation();
    return mPool.allocate(mObjectAllocator);
  }

  /**
   * @return the number of pooled nodes that are still available.
   */
  public int getAvailable()
  {
    awaitReservation();
    return mPool.getCapacity();
  }

  /**
   * @return the number of nodes handed out so far.
   */
  public int getNumAllocated()
  {
    return mPool.getNumItemsInUse();
  }

  private void awaitReservation()
  {
    if (mPendingReservation != null)
    {
      // Pre-sizing is only an optimisation.  If it failed, the pool simply falls back to fresh allocation.
      mPendingReservation.exceptionally(lEx -> null).join();
      mPendingReservation = null;
    }
  }
}
