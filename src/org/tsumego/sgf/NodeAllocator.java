package org.tsumego.sgf;

/**
 * Interface to be implemented by classes capable of allocating nodes for the parser.  This lets callers substitute
 * richer node types (for example, nodes carrying search statistics) without any change to the parser.
 *
 * @param <NodeType> the type of node allocated.
 */
@FunctionalInterface
public interface NodeAllocator<NodeType extends SgfNode>
{
  /**
   * @return a newly allocated, unattached node with no properties.
   */
  public NodeType allocate();
}
