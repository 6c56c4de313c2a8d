package org.tsumego.oracle;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.tsumego.oracle.exceptions.OracleException;

/**
 * The external evaluation authority consulted at search leaves.
 */
public interface Oracle
{
  /**
   * Evaluate a position, blocking until the answer is available.
   *
   * @param xiJob        - the moves leading to the position, e.g. ";B[jj];W[ih]".
   * @param xiExclusions - moves the oracle must not suggest, in the same syntax, or null.
   *
   * @return the evaluation.
   *
   * @throws OracleException if no valid evaluation could be obtained.
   */
  public EvaluationResult evaluate(String xiJob, String xiExclusions) throws OracleException;

  /**
   * Evaluate a position without blocking.
   *
   * The default implementation runs {@link #evaluate} on the common fork-join pool.  A failed evaluation completes
   * the future exceptionally with the {@link OracleException} (possibly wrapped in a {@link CompletionException}).
   *
   * @param xiJob        - the moves leading to the position.
   * @param xiExclusions - moves the oracle must not suggest, or null.
   *
   * @return a future for the evaluation.
   */
  public default CompletableFuture<EvaluationResult> evaluateAsync(String xiJob, String xiExclusions)
  {
    return CompletableFuture.supplyAsync(() ->
    {
      try
      {
        return evaluate(xiJob, xiExclusions);
      }
      catch (OracleException lEx)
      {
        throw new CompletionException(lEx);
      }
    });
  }
}
