package org.tsumego.oracle.exceptions;

/**
 * Exception thrown when the oracle's output doesn't match the expected format, or reports a result that isn't in the
 * known vocabulary.
 */
public class OracleProtocolException extends OracleException
{
  private static final long serialVersionUID = 1L;

  private final String mOutput;

  /**
   * Create a protocol exception.
   *
   * @param xiMessage - what was wrong with the output.
   * @param xiOutput  - the offending output.
   */
  public OracleProtocolException(String xiMessage, String xiOutput)
  {
    super(xiMessage + ": '" + xiOutput + "'");
    mOutput = xiOutput;
  }

  /**
   * Create a protocol exception.
   *
   * @param xiMessage - what was wrong with the output.
   * @param xiOutput  - the offending output.
   * @param xiCause   - the underlying failure.
   */
  public OracleProtocolException(String xiMessage, String xiOutput, Throwable xiCause)
  {
    super(xiMessage + ": '" + xiOutput + "'", xiCause);
    mOutput = xiOutput;
  }

  /**
   * @return the offending output.
   */
  public String getOutput()
  {
    return mOutput;
  }
}
