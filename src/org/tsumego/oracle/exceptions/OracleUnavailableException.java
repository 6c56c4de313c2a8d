package org.tsumego.oracle.exceptions;

/**
 * Exception thrown when the oracle can't be reached - it couldn't be started, it failed, or it didn't answer in time.
 */
public class OracleUnavailableException extends OracleException
{
  private static final long serialVersionUID = 1L;

  public OracleUnavailableException(String xiMessage)
  {
    super(xiMessage);
  }

  public OracleUnavailableException(String xiMessage, Throwable xiCause)
  {
    super(xiMessage, xiCause);
  }
}
