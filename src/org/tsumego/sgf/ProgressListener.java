package org.tsumego.sgf;

/**
 * Observer of lexing progress.  Purely observational - it has no effect on tokenization.
 */
@FunctionalInterface
public interface ProgressListener
{
  /**
   * Callback made after each token.
   *
   * @param xiConsumed - the number of characters consumed so far.
   * @param xiTotal    - the total length of the source.
   */
  public void progress(int xiConsumed, int xiTotal);
}
