package org.flip7.base.util.statemachine.exceptions;

/**
 * Thrown when a card is required but there is nothing left to draw, even after recycling the discard pile.
 */
public class EmptyDeckException extends Flip7Exception
{
  private static final long serialVersionUID = 1L;

  public EmptyDeckException()
  {
    super("Drawing from empty deck");
  }
}
