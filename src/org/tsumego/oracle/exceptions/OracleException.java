package org.tsumego.oracle.exceptions;

/**
 * Abstract class for exceptions that are a result of failing to get an evaluation from the oracle.
 */
public abstract class OracleException extends Exception
{
  private static final long serialVersionUID = 1L;

  protected OracleException(String xiMessage)
  {
    super(xiMessage);
  }

  protected OracleException(String xiMessage, Throwable xiCause)
  {
    super(xiMessage, xiCause);
  }
}
