package org.flip7.base.util.statemachine;

/**
 * The two decisions open to a player during a turn.  Declaration order is the tie-break order used by the search.
 */
public enum Action
{
  /**
   * Draw another card.
   */
  HIT,

  /**
   * Stop drawing and bank the turn's score.
   */
  STAY
}
