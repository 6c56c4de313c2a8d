package org.tsumego.sgf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Allocator that records every node it hands out, in allocation order.
 *
 * @param <NodeType> the type of node allocated.
 */
public class TrackingNodeAllocator<NodeType extends SgfNode> implements NodeAllocator<NodeType>
{
  private final NodeAllocator<NodeType> mUnderlying;
  private final List<NodeType> mAllocated = new ArrayList<>();

  /**
   * Create a tracking allocator.
   *
   * @param xiUnderlying - the allocator that actually creates the nodes.
   */
  public TrackingNodeAllocator(NodeAllocator<NodeType> xiUnderlying)
  {
    mUnderlying = xiUnderlying;
  }

  @Override
  public NodeType allocate()
  {
    NodeType lNode = mUnderlying.allocate();
    mAllocated.add(lNode);
    return lNode;
  }

  /**
   * @return the nodes allocated so far.
   */
  public List<NodeType> getAllocatedNodes()
  {
    return Collections.unmodifiableList(mAllocated);
  }

  /**
   * @return the number of nodes allocated so far.
   */
  public int getNumAllocated()
  {
    return mAllocated.size();
  }

  /**
   * Unlink every node allocated so far and forget about them.
   */
  public void releaseAll()
  {
    for (NodeType lNode : mAllocated)
    {
      lNode.detach();
    }
    mAllocated.clear();
  }
}
