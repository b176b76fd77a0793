package org.flip7.base.util.cards;

/**
 * An immutable Flip 7 card.
 *
 * A card is a tagged value: its {@link CardKind} says how the payload is to be read.  NUMBER and MODIFIER cards carry
 * a value, ACTION cards carry an {@link ActionType} and the MULTIPLIER carries nothing.  Instances are shared freely
 * (there are only 26 distinct cards) and compare by value.
 */
public final class Card
{
  public static final int MIN_NUMBER   = 0;
  public static final int MAX_NUMBER   = 12;
  public static final int MIN_MODIFIER = 2;
  public static final int MAX_MODIFIER = 10;

  private static final Card[] NUMBERS   = new Card[MAX_NUMBER + 1];
  private static final Card[] MODIFIERS = new Card[MAX_MODIFIER + 1];
  private static final Card[] ACTIONS   = new Card[ActionType.values().length];
  private static final Card   MULTIPLIER = new Card(CardKind.MULTIPLIER, 2, null);
  static
  {
    for (int lValue = MIN_NUMBER; lValue <= MAX_NUMBER; lValue++)
    {
      NUMBERS[lValue] = new Card(CardKind.NUMBER, lValue, null);
    }
    for (int lValue = MIN_MODIFIER; lValue <= MAX_MODIFIER; lValue++)
    {
      MODIFIERS[lValue] = new Card(CardKind.MODIFIER, lValue, null);
    }
    for (ActionType lType : ActionType.values())
    {
      ACTIONS[lType.ordinal()] = new Card(CardKind.ACTION, 0, lType);
    }
  }

  private final CardKind   mKind;
  private final int        mValue;
  private final ActionType mActionType;

  private Card(CardKind xiKind, int xiValue, ActionType xiActionType)
  {
    mKind = xiKind;
    mValue = xiValue;
    mActionType = xiActionType;
  }

  /**
   * @return the number card with the given face value.
   *
   * @param xiValue - face value, 0 to 12.
   */
  public static Card number(int xiValue)
  {
    if (xiValue < MIN_NUMBER || xiValue > MAX_NUMBER)
    {
      throw new IllegalArgumentException("No number card with value " + xiValue);
    }
    return NUMBERS[xiValue];
  }

  /**
   * @return the modifier card worth the given number of points.
   *
   * @param xiValue - bonus, 2 to 10.
   */
  public static Card modifier(int xiValue)
  {
    if (xiValue < MIN_MODIFIER || xiValue > MAX_MODIFIER)
    {
      throw new IllegalArgumentException("No modifier card with value " + xiValue);
    }
    return MODIFIERS[xiValue];
  }

  public static Card action(ActionType xiType)
  {
    return ACTIONS[xiType.ordinal()];
  }

  public static Card multiplier()
  {
    return MULTIPLIER;
  }

  public CardKind getKind()
  {
    return mKind;
  }

  /**
   * @return the face value of a NUMBER card, the bonus of a MODIFIER card or the factor of the MULTIPLIER.  Zero for
   * ACTION cards.
   */
  public int getValue()
  {
    return mValue;
  }

  /**
   * @return the action of an ACTION card, or null for any other kind.
   */
  public ActionType getActionType()
  {
    return mActionType;
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (this == xiOther)
    {
      return true;
    }
    if (!(xiOther instanceof Card))
    {
      return false;
    }
    Card lOther = (Card)xiOther;
    return mKind == lOther.mKind && mValue == lOther.mValue && mActionType == lOther.mActionType;
  }

  @Override
  public int hashCode()
  {
    int lHash = mKind.hashCode();
    lHash = 31 * lHash + mValue;
    lHash = 31 * lHash + (mActionType == null ? 0 : mActionType.hashCode());
    return lHash;
  }

  @Override
  public String toString()
  {
    switch (mKind)
    {
      case NUMBER:
        return "N" + mValue;
      case MODIFIER:
        return "+" + mValue;
      case MULTIPLIER:
        return "x2";
      default:
        return mActionType.name();
    }
  }
}
