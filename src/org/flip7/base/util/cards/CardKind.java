package org.flip7.base.util.cards;

/**
 * The four families of card in a Flip 7 deck.
 */
public enum CardKind
{
  /**
   * Number card, 0 to 12.
   */
  NUMBER,

  /**
   * Flat score modifier, +2 to +10.
   */
  MODIFIER,

  /**
   * Action card - see {@link ActionType}.
   */
  ACTION,

  /**
   * Doubles the sum of the number cards.
   */
  MULTIPLIER
}
