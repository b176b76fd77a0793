package org.flip7.base.util.statemachine;

/**
 * Status of a player's turn.  ACTIVE is the only non-terminal status.
 */
public enum TurnStatus
{
  ACTIVE,
  FROZEN,
  BUSTED,
  STAYED;

  /**
   * @return whether the turn is over.
   */
  public boolean isTerminal()
  {
    return this != ACTIVE;
  }
}
