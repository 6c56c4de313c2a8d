package org.tsumego.solver;

/**
 * Policy for choosing which child to descend into during selection.
 */
public interface SelectPolicy
{
  /**
   * @return the child of xiParent to descend into, or null if it has no children.
   *
   * @param xiParent - the node being descended through.
   */
  public SolverNode selectChild(SolverNode xiParent);
}
