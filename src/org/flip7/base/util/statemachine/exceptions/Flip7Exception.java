package org.flip7.base.util.statemachine.exceptions;

/**
 * Abstract class for exceptions raised when the engine is asked to do something the rules do not allow.
 *
 * These are local to a single request.  Callers (including the search) may recover from them.
 */
public abstract class Flip7Exception extends Exception
{
  private static final long serialVersionUID = 1L;

  protected Flip7Exception(String xiMessage)
  {
    super(xiMessage);
  }
}
