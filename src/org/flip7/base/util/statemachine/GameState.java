package org.flip7.base.util.statemachine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.flip7.base.util.cards.ActionType;
import org.flip7.base.util.cards.Card;
import org.flip7.base.util.cards.Deck;
import org.flip7.base.util.statemachine.exceptions.EmptyDeckException;
import org.flip7.base.util.statemachine.exceptions.InvalidActionException;

/**
 * Full state of a Flip 7 game: every player's turn and total, the deck, the discard pile and whose turn it is.
 *
 * A game state is mutable and owned by exactly one holder.  Anything exploring a hypothetical future works on a
 * {@link #copy()}; {@link Flip7StateMachine} does this for callers that want value semantics.
 */
public class GameState
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Total at which the game ends, checked at the end of each round.
   */
  public static final int WINNING_SCORE = 200;

  private final String[]    mPlayerIds;
  private final TurnState[] mTurns;
  private final int[]       mTotals;
  private Deck              mDeck;
  private final List<Card>  mDiscards;

  // Cards on the acting player's line.  They move to the discard pile when the turn ends.
  private final List<Card>  mLine;

  private int               mCurrentPlayer;
  private int               mRound;
  private boolean           mTerminal;
  private int               mWinner;

  /**
   * Create a game at the start of the first round.
   *
   * @param xiPlayerIds - ids of the players, in seating order.
   * @param xiDeck - the deck to play with.  Ownership passes to the new state.
   */
  public GameState(List<String> xiPlayerIds, Deck xiDeck)
  {
    mPlayerIds = xiPlayerIds.toArray(new String[xiPlayerIds.size()]);
    mTurns = new TurnState[mPlayerIds.length];
    Arrays.fill(mTurns, TurnState.initial());
    mTotals = new int[mPlayerIds.length];
    mDeck = xiDeck;
    mDiscards = new ArrayList<>();
    mLine = new ArrayList<>();
    mCurrentPlayer = 0;
    mRound = 1;
    mTerminal = false;
    mWinner = -1;
  }

  private GameState(GameState xiOther)
  {
    mPlayerIds = xiOther.mPlayerIds;
    mTurns = xiOther.mTurns.clone();
    mTotals = xiOther.mTotals.clone();
    mDeck = xiOther.mDeck.copy();
    mDiscards = new ArrayList<>(xiOther.mDiscards);
    mLine = new ArrayList<>(xiOther.mLine);
    mCurrentPlayer = xiOther.mCurrentPlayer;
    mRound = xiOther.mRound;
    mTerminal = xiOther.mTerminal;
    mWinner = xiOther.mWinner;
  }

  /**
   * @return an independent copy.  Nothing mutable is shared with this state.
   */
  public GameState copy()
  {
    return new GameState(this);
  }

  /**
   * @return the actions the acting player may take: none once the game is over, otherwise STAY and - while there
   * is anything left to draw - HIT.
   */
  public Set<Action> getLegalActions()
  {
    if (mTerminal || mTurns[mCurrentPlayer].getStatus().isTerminal())
    {
      return EnumSet.noneOf(Action.class);
    }
    if (mDeck.isEmpty() && mDiscards.isEmpty())
    {
      return EnumSet.of(Action.STAY);
    }
    return EnumSet.of(Action.HIT, Action.STAY);
  }

  /**
   * Apply an action for the acting player, in place.
   *
   * If the action ends the turn, the turn score is banked, the line is discarded and play passes to the next seat.
   * If that completes a round and somebody has reached {@link #WINNING_SCORE}, the game ends.
   *
   * @param xiAction - the action.
   * @param xiRandom - used only if the discard pile has to be shuffled back into the deck.
   *
   * @return what happened.
   * @throws InvalidActionException if the game is over.
   * @throws EmptyDeckException if HIT is requested and there is nothing to draw.  The state is unchanged.
   */
  public ActionOutcome applyAction(Action xiAction, Random xiRandom)
      throws InvalidActionException, EmptyDeckException
  {
    if (mTerminal)
    {
      throw new InvalidActionException(xiAction, "the game is over");
    }

    ActionOutcome lOutcome = new ActionOutcome(xiAction, mCurrentPlayer);

    if (xiAction == Action.STAY)
    {
      TurnTransition lTransition = TurnStateMachine.stay(mTurns[mCurrentPlayer]);
      mTurns[mCurrentPlayer] = lTransition.getState();
      lOutcome.noteEffect(lTransition.getEffect());
      endTurn(lOutcome);
      return lOutcome;
    }

    if (mTurns[mCurrentPlayer].getStatus().isTerminal())
    {
      throw new InvalidActionException(xiAction, mTurns[mCurrentPlayer].getStatus());
    }

    Card lCard = drawCard(xiRandom);
    int lPendingDraws = 0;

    while (true)
    {
      TurnTransition lTransition = TurnStateMachine.applyCard(mTurns[mCurrentPlayer], lCard);
      mTurns[mCurrentPlayer] = lTransition.getState();
      lOutcome.noteDraw(lCard, lTransition.getEffect());
      placeCard(lCard, lTransition);

      if (lTransition.getState().getStatus().isTerminal())
      {
        endTurn(lOutcome);
        break;
      }

      lPendingDraws += lTransition.getForcedDraws();
      if (lPendingDraws == 0)
      {
        break;
      }

      lPendingDraws--;
      if (mDeck.isEmpty() && mDiscards.isEmpty())
      {
        LOGGER.debug("Out of cards with " + (lPendingDraws + 1) + " forced draws outstanding");
        break;
      }
      lCard = drawCard(xiRandom);
    }

    return lOutcome;
  }

  /**
   * Replace the undrawn part of the deck with a random permutation of the same cards.  Everything the acting
   * player has seen (lines, discards, totals) is left alone.
   *
   * @param xiRandom - source of randomness.
   */
  public void reshuffleDeck(Random xiRandom)
  {
    mDeck = Deck.shuffle(mDeck, xiRandom);
  }

  private Card drawCard(Random xiRandom) throws EmptyDeckException
  {
    if (mDeck.isEmpty() && !mDiscards.isEmpty())
    {
      LOGGER.debug("Deck exhausted - shuffling " + mDiscards.size() + " discarded cards back in");
      mDeck = Deck.shuffle(new Deck(mDiscards), xiRandom);
      mDiscards.clear();
    }
    return mDeck.draw();
  }

  private void placeCard(Card xiCard, TurnTransition xiTransition)
  {
    if (xiTransition.isCardKept())
    {
      mLine.add(xiCard);
      return;
    }

    mDiscards.add(xiCard);
    if (xiTransition.getEffect() == TurnEffect.DUPLICATE_DISCARDED)
    {
      // The SecondChance that absorbed the duplicate goes with it.
      Card lSecondChance = Card.action(ActionType.SECOND_CHANCE);
      mLine.remove(lSecondChance);
      mDiscards.add(lSecondChance);
    }
  }

  private void endTurn(ActionOutcome xoOutcome)
  {
    TurnState lFinal = mTurns[mCurrentPlayer];
    int lBanked = lFinal.getScore();
    mTotals[mCurrentPlayer] += lBanked;
    xoOutcome.noteTurnEnd(lFinal, lBanked);

    LOGGER.debug(mPlayerIds[mCurrentPlayer] + " ends turn " + lFinal.getStatus() + " with " + lFinal.getNumbers() +
                 ", banking " + lBanked + " (total " + mTotals[mCurrentPlayer] + ")");

    mDiscards.addAll(mLine);
    mLine.clear();
    mTurns[mCurrentPlayer] = TurnState.initial();

    mCurrentPlayer++;
    if (mCurrentPlayer == mPlayerIds.length)
    {
      mCurrentPlayer = 0;
      endRound(xoOutcome);
    }
  }

  private void endRound(ActionOutcome xoOutcome)
  {
    int lBest = 0;
    for (int lPlayer = 1; lPlayer < mTotals.length; lPlayer++)
    {
      if (mTotals[lPlayer] > mTotals[lBest])
      {
        lBest = lPlayer;
      }
    }

    if (mTotals[lBest] >= WINNING_SCORE)
    {
      mTerminal = true;
      mWinner = lBest;
      LOGGER.debug("Game over after round " + mRound + ": " + mPlayerIds[lBest] + " wins with " + mTotals[lBest]);
    }
    else
    {
      mRound++;
    }
    xoOutcome.noteRoundEnd(mTerminal);
  }

  public List<String> getPlayerIds()
  {
    return Collections.unmodifiableList(Arrays.asList(mPlayerIds));
  }

  public int getNumPlayers()
  {
    return mPlayerIds.length;
  }

  /**
   * @return the seat of the acting player.
   */
  public int getCurrentPlayer()
  {
    return mCurrentPlayer;
  }

  public String getCurrentPlayerId()
  {
    return mPlayerIds[mCurrentPlayer];
  }

  /**
   * @return the acting player's turn state.
   */
  public TurnState getCurrentTurn()
  {
    return mTurns[mCurrentPlayer];
  }

  public TurnState getTurnState(int xiPlayer)
  {
    return mTurns[xiPlayer];
  }

  /**
   * @return the points banked by a player in completed turns.
   */
  public int getTotal(int xiPlayer)
  {
    return mTotals[xiPlayer];
  }

  public int getRound()
  {
    return mRound;
  }

  public boolean isTerminal()
  {
    return mTerminal;
  }

  /**
   * @return the seat of the winner, or -1 while the game is in progress.
   */
  public int getWinner()
  {
    return mWinner;
  }

  public int getDeckSize()
  {
    return mDeck.size();
  }

  /**
   * @return the undrawn cards, next card first.  This is hidden information to the players.
   */
  public List<Card> getDeckCards()
  {
    return mDeck.getCards();
  }

  public List<Card> getDiscards()
  {
    return Collections.unmodifiableList(mDiscards);
  }

  /**
   * @return the cards on the acting player's line.
   */
  public List<Card> getLineCards()
  {
    return Collections.unmodifiableList(mLine);
  }

  @Override
  public String toString()
  {
    return "GameState(round=" + mRound + ", totals=" + Arrays.toString(mTotals) + ", current=" +
           mPlayerIds[mCurrentPlayer] + ", turn=" + mTurns[mCurrentPlayer] + ", deck=" + mDeck.size() +
           ", discards=" + mDiscards.size() + ")";
  }
}
