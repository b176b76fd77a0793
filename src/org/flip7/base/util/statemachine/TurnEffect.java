package org.flip7.base.util.statemachine;

/**
 * What a single transition of the turn state machine did.
 */
public enum TurnEffect
{
  STAYED,
  NUMBER_ADDED,
  FLIP7,
  DUPLICATE_DISCARDED,
  BUST,
  MODIFIER_ADDED,
  MULTIPLIER_ADDED,
  FROZEN,
  FLIP_THREE,
  SECOND_CHANCE_ADDED,
  SECOND_CHANCE_DISCARDED
}
