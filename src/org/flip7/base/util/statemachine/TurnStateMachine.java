package org.flip7.base.util.statemachine;

import org.flip7.base.util.cards.Card;
import org.flip7.base.util.statemachine.exceptions.InvalidActionException;

/**
 * Pure transitions of a single player's turn.
 *
 * Nothing here touches a deck: a hit is resolved by the caller drawing a card and passing it to
 * {@link #applyCard(TurnState, Card)}.  FLIP_THREE is reported through {@link TurnTransition#getForcedDraws()} and the
 * caller performs the draws.
 */
public final class TurnStateMachine
{
  /**
   * Number of cards drawn when FLIP_THREE is revealed.
   */
  public static final int FLIP_THREE_DRAWS = 3;

  private TurnStateMachine()
  {
  }

  /**
   * Stop drawing.
   *
   * @param xiTurn - current state.
   * @return the transition to STAYED.
   * @throws InvalidActionException if the turn is already over.
   */
  public static TurnTransition stay(TurnState xiTurn) throws InvalidActionException
  {
    if (xiTurn.getStatus().isTerminal())
    {
      throw new InvalidActionException(Action.STAY, xiTurn.getStatus());
    }
    return new TurnTransition(xiTurn.withStatus(TurnStatus.STAYED), TurnEffect.STAYED);
  }

  /**
   * Resolve a card drawn by the acting player.
   *
   * @param xiTurn - current state.
   * @param xiCard - the card drawn.
   * @return the resulting transition.
   * @throws InvalidActionException if the turn is already over.
   */
  public static TurnTransition applyCard(TurnState xiTurn, Card xiCard) throws InvalidActionException
  {
    if (xiTurn.getStatus().isTerminal())
    {
      throw new InvalidActionException(Action.HIT, xiTurn.getStatus());
    }

    switch (xiCard.getKind())
    {
      case NUMBER:
        return applyNumber(xiTurn, xiCard.getValue());

      case MODIFIER:
        return new TurnTransition(xiTurn.withModifier(xiCard.getValue()), TurnEffect.MODIFIER_ADDED);

      case MULTIPLIER:
        return new TurnTransition(xiTurn.withMultiplier(), TurnEffect.MULTIPLIER_ADDED);

      case ACTION:
        switch (xiCard.getActionType())
        {
          case FREEZE:
            // Only the acting player's line is in scope, so Freeze always targets its drawer.
            return new TurnTransition(xiTurn.withStatus(TurnStatus.FROZEN), TurnEffect.FROZEN);

          case FLIP_THREE:
            return new TurnTransition(xiTurn, TurnEffect.FLIP_THREE, FLIP_THREE_DRAWS);

          case SECOND_CHANCE:
            if (xiTurn.hasSecondChance())
            {
              return new TurnTransition(xiTurn, TurnEffect.SECOND_CHANCE_DISCARDED);
            }
            return new TurnTransition(xiTurn.withSecondChance(true), TurnEffect.SECOND_CHANCE_ADDED);

          default:
            throw new IllegalStateException("Unknown action card " + xiCard);
        }

      default:
        throw new IllegalStateException("Unknown card kind " + xiCard);
    }
  }

  private static TurnTransition applyNumber(TurnState xiTurn, int xiValue)
  {
    if (xiTurn.containsNumber(xiValue))
    {
      if (xiTurn.hasSecondChance())
      {
        return new TurnTransition(xiTurn.withSecondChance(false), TurnEffect.DUPLICATE_DISCARDED);
      }
      return new TurnTransition(xiTurn.withStatus(TurnStatus.BUSTED), TurnEffect.BUST);
    }

    TurnState lNext = xiTurn.withNumber(xiValue);
    if (lNext.hasFlip7())
    {
      // Seven distinct numbers ends the turn.  The line never holds more than seven.
      return new TurnTransition(lNext.withStatus(TurnStatus.STAYED), TurnEffect.FLIP7);
    }
    return new TurnTransition(lNext, TurnEffect.NUMBER_ADDED);
  }
}
