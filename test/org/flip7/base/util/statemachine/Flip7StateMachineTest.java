package org.flip7.base.util.statemachine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Random;

import org.flip7.base.util.cards.Card;
import org.flip7.base.util.cards.Deck;
import org.flip7.base.util.statemachine.exceptions.InvalidActionException;
import org.flip7.base.util.statemachine.playoutPolicy.PlayoutPolicyRandom;
import org.junit.Assert;
import org.junit.Test;

import com.google.common.collect.HashMultiset;

public class Flip7StateMachineTest extends Assert
{
  private static final List<String> PLAYERS = Arrays.asList("p1", "p2", "p3");

  private final Flip7StateMachine mStateMachine = new Flip7StateMachine();

  @Test
  public void testInitialState()
  {
    GameState lState = mStateMachine.getInitialState(PLAYERS, new Random(1));

    assertEquals(PLAYERS, lState.getPlayerIds());
    assertEquals(Deck.FULL_SIZE, lState.getDeckSize());
    assertEquals(Deck.composition(), HashMultiset.create(lState.getDeckCards()));
    assertEquals(1, lState.getRound());
    assertEquals(0, lState.getCurrentPlayer());
    for (int lPlayer = 0; lPlayer < PLAYERS.size(); lPlayer++)
    {
      assertEquals(0, mStateMachine.getScore(lState, lPlayer));
    }
    assertEquals(EnumSet.of(Action.HIT, Action.STAY), mStateMachine.getLegalMoves(lState));
    assertFalse(mStateMachine.isTerminal(lState));
    assertNull(mStateMachine.getWinner(lState));
  }

  @Test
  public void testInitialStateDependsOnlyOnSeed()
  {
    GameState lFirst = mStateMachine.getInitialState(PLAYERS, new Random(5));
    GameState lSecond = mStateMachine.getInitialState(PLAYERS, new Random(5));
    assertEquals(lFirst.getDeckCards(), lSecond.getDeckCards());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNoPlayers()
  {
    mStateMachine.getInitialState(Collections.<String>emptyList(), new Random(1));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testDuplicatePlayers()
  {
    mStateMachine.getInitialState(Arrays.asList("p1", "p2", "p1"), new Random(1));
  }

  @Test
  public void testNextStateLeavesInputAlone() throws Exception
  {
    GameState lState = mStateMachine.getInitialState(PLAYERS, new Random(2));
    List<Card> lDeckBefore = lState.getDeckCards();

    GameState lNext = mStateMachine.getNextState(lState, Action.HIT, new Random(2));

    assertEquals(lDeckBefore, lState.getDeckCards());
    assertEquals(TurnState.initial(), lState.getCurrentTurn());
    assertTrue(lState.getLineCards().isEmpty() && lState.getDiscards().isEmpty());
    assertTrue(lNext.getDeckSize() < Deck.FULL_SIZE);
    assertEquals(Deck.FULL_SIZE, lNext.getDeckSize() + lNext.getDiscards().size() + lNext.getLineCards().size());
  }

  @Test
  public void testFinishedGame() throws Exception
  {
    GameState lState = StackedDecks.finishedGame();
    assertTrue(mStateMachine.isTerminal(lState));
    assertEquals("solo", mStateMachine.getWinner(lState));
    assertTrue(mStateMachine.getLegalMoves(lState).isEmpty());

    try
    {
      mStateMachine.getNextState(lState, Action.HIT, new Random(1));
      fail("Move accepted after the game ended");
    }
    catch (InvalidActionException lEx)
    {
      assertEquals(Action.HIT, lEx.getAction());
    }
  }

  @Test(expected = InvalidActionException.class)
  public void testHitWithNothingToDraw() throws Exception
  {
    GameState lState = StackedDecks.state(Arrays.asList("solo"));
    assertEquals(EnumSet.of(Action.STAY), mStateMachine.getLegalMoves(lState));
    mStateMachine.getNextState(lState, Action.HIT, new Random(1));
  }

  @Test
  public void testRandomGamesKeepInvariants() throws Exception
  {
    for (int lSeed = 0; lSeed < 20; lSeed++)
    {
      Random lRandom = new Random(lSeed);
      PlayoutPolicyRandom lPolicy = new PlayoutPolicyRandom(lRandom);
      GameState lState = mStateMachine.getInitialState(PLAYERS, lRandom);
      int lLastRound = 1;

      while (!mStateMachine.isTerminal(lState))
      {
        // Every card is somewhere.
        assertEquals(Deck.FULL_SIZE,
                     lState.getDeckSize() + lState.getDiscards().size() + lState.getLineCards().size());

        TurnState lTurn = lState.getCurrentTurn();
        assertTrue(lTurn.getNumberCount() <= TurnState.FLIP7_COUNT);
        assertEquals(TurnStatus.ACTIVE, lTurn.getStatus());
        assertFalse(mStateMachine.getLegalMoves(lState).isEmpty());

        lState = mStateMachine.getNextState(lState, lPolicy.decide(lState), lRandom);
        assertTrue(lState.getRound() >= lLastRound);
        lLastRound = lState.getRound();
      }

      assertTrue(mStateMachine.getLegalMoves(lState).isEmpty());
      int lWinner = lState.getWinner();
      assertTrue(lState.getTotal(lWinner) >= GameState.WINNING_SCORE);
      for (int lPlayer = 0; lPlayer < PLAYERS.size(); lPlayer++)
      {
        assertTrue(lState.getTotal(lPlayer) <= lState.getTotal(lWinner));
        if (lState.getTotal(lPlayer) == lState.getTotal(lWinner))
        {
          assertTrue(lWinner <= lPlayer);
        }
      }
      assertEquals(PLAYERS.get(lWinner), mStateMachine.getWinner(lState));
    }
  }

  @Test
  public void testGamesDependOnlyOnSeed() throws Exception
  {
    assertEquals(playOut(17), playOut(17));
  }

  private List<Integer> playOut(long xiSeed) throws Exception
  {
    Random lRandom = new Random(xiSeed);
    PlayoutPolicyRandom lPolicy = new PlayoutPolicyRandom(lRandom);
    GameState lState = mStateMachine.getInitialState(PLAYERS, lRandom);
    while (!mStateMachine.isTerminal(lState))
    {
      lState = mStateMachine.getNextState(lState, lPolicy.decide(lState), lRandom);
    }

    List<Integer> lTotals = new ArrayList<>();
    for (int lPlayer = 0; lPlayer < PLAYERS.size(); lPlayer++)
    {
      lTotals.add(lState.getTotal(lPlayer));
    }
    lTotals.add(lState.getRound());
    return lTotals;
  }
}
