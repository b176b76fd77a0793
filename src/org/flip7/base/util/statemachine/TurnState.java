package org.flip7.base.util.statemachine;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable state of one player's turn.
 *
 * The collected numbers are held as a bit set over the 13 face values, so a duplicate can never be inserted.  New
 * states are produced by {@link TurnStateMachine}.
 */
public final class TurnState
{
  /**
   * Number of distinct numbers that earns the Flip 7 bonus.
   */
  public static final int FLIP7_COUNT = 7;

  /**
   * Bonus for collecting {@link #FLIP7_COUNT} distinct numbers.
   */
  public static final int FLIP7_BONUS = 15;

  private static final TurnState INITIAL = new TurnState(0, 0, false, false, TurnStatus.ACTIVE);

  private final int        mNumbers;
  private final int        mModifierSum;
  private final boolean    mMultiplier;
  private final boolean    mSecondChance;
  private final TurnStatus mStatus;

  TurnState(int xiNumbers, int xiModifierSum, boolean xiMultiplier, boolean xiSecondChance, TurnStatus xiStatus)
  {
    mNumbers = xiNumbers;
    mModifierSum = xiModifierSum;
    mMultiplier = xiMultiplier;
    mSecondChance = xiSecondChance;
    mStatus = xiStatus;
  }

  /**
   * @return the state at the start of a turn: nothing collected, ACTIVE.
   */
  public static TurnState initial()
  {
    return INITIAL;
  }

  public boolean containsNumber(int xiValue)
  {
    return (mNumbers & (1 << xiValue)) != 0;
  }

  /**
   * @return the distinct numbers collected, in ascending order.
   */
  public List<Integer> getNumbers()
  {
    List<Integer> lNumbers = new ArrayList<>(FLIP7_COUNT);
    for (int lValue = 0; (mNumbers >>> lValue) != 0; lValue++)
    {
      if (containsNumber(lValue))
      {
        lNumbers.add(lValue);
      }
    }
    return lNumbers;
  }

  public int getNumberCount()
  {
    return Integer.bitCount(mNumbers);
  }

  public int getNumberSum()
  {
    int lSum = 0;
    for (int lValue = 0; (mNumbers >>> lValue) != 0; lValue++)
    {
      if (containsNumber(lValue))
      {
        lSum += lValue;
      }
    }
    return lSum;
  }

  public int getModifierSum()
  {
    return mModifierSum;
  }

  public boolean hasMultiplier()
  {
    return mMultiplier;
  }

  public boolean hasSecondChance()
  {
    return mSecondChance;
  }

  /**
   * @return whether the turn has collected enough distinct numbers for the Flip 7 bonus.
   */
  public boolean hasFlip7()
  {
    return getNumberCount() == FLIP7_COUNT;
  }

  public TurnStatus getStatus()
  {
    return mStatus;
  }

  /**
   * @return the score the line would bank if it were finalized now, ignoring a bust.
   */
  public int getLineScore()
  {
    return (getNumberSum() * (mMultiplier ? 2 : 1)) + mModifierSum + (hasFlip7() ? FLIP7_BONUS : 0);
  }

  /**
   * @return the score this turn contributes to the player's total - zero once busted.
   */
  public int getScore()
  {
    return mStatus == TurnStatus.BUSTED ? 0 : getLineScore();
  }

  TurnState withNumber(int xiValue)
  {
    return new TurnState(mNumbers | (1 << xiValue), mModifierSum, mMultiplier, mSecondChance, mStatus);
  }

  TurnState withModifier(int xiBonus)
  {
    return new TurnState(mNumbers, mModifierSum + xiBonus, mMultiplier, mSecondChance, mStatus);
  }

  TurnState withMultiplier()
  {
    return new TurnState(mNumbers, mModifierSum, true, mSecondChance, mStatus);
  }

  TurnState withSecondChance(boolean xiSecondChance)
  {
    return new TurnState(mNumbers, mModifierSum, mMultiplier, xiSecondChance, mStatus);
  }

  TurnState withStatus(TurnStatus xiStatus)
  {
    return new TurnState(mNumbers, mModifierSum, mMultiplier, mSecondChance, xiStatus);
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (!(xiOther instanceof TurnState))
    {
      return false;
    }
    TurnState lOther = (TurnState)xiOther;
    return mNumbers == lOther.mNumbers &&
           mModifierSum == lOther.mModifierSum &&
           mMultiplier == lOther.mMultiplier &&
           mSecondChance == lOther.mSecondChance &&
           mStatus == lOther.mStatus;
  }

  @Override
  public int hashCode()
  {
    int lHash = mNumbers;
    lHash = 31 * lHash + mModifierSum;
    lHash = 31 * lHash + (mMultiplier ? 1 : 0);
    lHash = 31 * lHash + (mSecondChance ? 1 : 0);
    lHash = 31 * lHash + mStatus.hashCode();
    return lHash;
  }

  @Override
  public String toString()
  {
    return "TurnState(numbers=" + getNumbers() + ", modifiers=" + mModifierSum + ", x2=" + mMultiplier +
           ", secondChance=" + mSecondChance + ", status=" + mStatus + ")";
  }
}
