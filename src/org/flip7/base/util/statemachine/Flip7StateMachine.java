package org.flip7.base.util.statemachine;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.flip7.base.util.cards.Deck;
import org.flip7.base.util.statemachine.exceptions.EmptyDeckException;
import org.flip7.base.util.statemachine.exceptions.InvalidActionException;

/**
 * The Flip 7 rules, presented as a state machine over immutable-by-convention {@link GameState}s.
 *
 * Every method here leaves its input state untouched.  Code that needs raw speed (the search) works directly on
 * private copies through {@link GameState#applyAction(Action, Random)} instead.
 */
public class Flip7StateMachine
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Create a new game.
   *
   * @param xiPlayerIds - distinct player ids, in seating order.
   * @param xiRandom - used to shuffle the deck.
   *
   * @return the initial state: shuffled deck, zero totals, first seat to act.
   */
  public GameState getInitialState(List<String> xiPlayerIds, Random xiRandom)
  {
    if (xiPlayerIds == null || xiPlayerIds.isEmpty())
    {
      throw new IllegalArgumentException("A game needs at least one player");
    }
    Set<String> lUnique = new HashSet<>(xiPlayerIds);
    if (lUnique.size() != xiPlayerIds.size())
    {
      throw new IllegalArgumentException("Duplicate player id in " + xiPlayerIds);
    }

    LOGGER.debug("New game for " + xiPlayerIds);
    return new GameState(xiPlayerIds, Deck.shuffle(Deck.newDeck(), xiRandom));
  }

  /**
   * @return the actions legal in the given state.  Never contains HIT once the acting turn has busted or stayed,
   * and is empty once the game is over.
   */
  public Set<Action> getLegalMoves(GameState xiState)
  {
    return xiState.getLegalActions();
  }

  /**
   * Commit an action.
   *
   * @param xiState - current state.  Not modified.
   * @param xiAction - the acting player's action.
   * @param xiRandom - used if the discard pile has to be recycled.
   *
   * @return the resulting state.
   * @throws InvalidActionException if the action is not legal in xiState.
   */
  public GameState getNextState(GameState xiState, Action xiAction, Random xiRandom) throws InvalidActionException
  {
    if (!xiState.getLegalActions().contains(xiAction))
    {
      if (xiState.isTerminal())
      {
        throw new InvalidActionException(xiAction, "the game is over");
      }
      if (xiState.getCurrentTurn().getStatus().isTerminal())
      {
        throw new InvalidActionException(xiAction, xiState.getCurrentTurn().getStatus());
      }
      throw new InvalidActionException(xiAction, "there is nothing left to draw");
    }

    GameState lNext = xiState.copy();
    try
    {
      lNext.applyAction(xiAction, xiRandom);
    }
    catch (EmptyDeckException lEx)
    {
      // Legal HIT guarantees a card, so this means the state was corrupt.
      throw new IllegalStateException("Legal hit found nothing to draw in " + xiState, lEx);
    }
    return lNext;
  }

  /**
   * @return whether the game is over - somebody reached the winning score at the end of a round.
   */
  public boolean isTerminal(GameState xiState)
  {
    return xiState.isTerminal();
  }

  /**
   * @return the id of the winner of a finished game, or null if the game is still going.
   */
  public String getWinner(GameState xiState)
  {
    return xiState.isTerminal() ? xiState.getPlayerIds().get(xiState.getWinner()) : null;
  }

  /**
   * @return a player's banked total.
   */
  public int getScore(GameState xiState, int xiPlayer)
  {
    return xiState.getTotal(xiPlayer);
  }
}
