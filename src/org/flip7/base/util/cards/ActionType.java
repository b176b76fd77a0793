package org.flip7.base.util.cards;

public enum ActionType
{
  FREEZE,
  FLIP_THREE,
  SECOND_CHANCE
}
