package org.flip7.base.util.statemachine;

/**
 * Result of one turn state machine step: the new state, what happened, and how many cards the acting player is now
 * obliged to draw before regaining control.
 */
public final class TurnTransition
{
  private final TurnState  mState;
  private final TurnEffect mEffect;
  private final int        mForcedDraws;

  TurnTransition(TurnState xiState, TurnEffect xiEffect, int xiForcedDraws)
  {
    mState = xiState;
    mEffect = xiEffect;
    mForcedDraws = xiForcedDraws;
  }

  TurnTransition(TurnState xiState, TurnEffect xiEffect)
  {
    this(xiState, xiEffect, 0);
  }

  public TurnState getState()
  {
    return mState;
  }

  public TurnEffect getEffect()
  {
    return mEffect;
  }

  public int getForcedDraws()
  {
    return mForcedDraws;
  }

  /**
   * @return whether the card that caused this transition stays on the player's line (as opposed to going straight to
   * the discard pile).
   */
  public boolean isCardKept()
  {
    return mEffect != TurnEffect.DUPLICATE_DISCARDED &&
           mEffect != TurnEffect.SECOND_CHANCE_DISCARDED &&
           mEffect != TurnEffect.STAYED;
  }

  @Override
  public String toString()
  {
    return mEffect + (mForcedDraws > 0 ? "(+" + mForcedDraws + " forced)" : "") + " -> " + mState;
  }
}
