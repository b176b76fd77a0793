package org.flip7.base.util.statemachine.playoutPolicy;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.flip7.base.util.cards.Card;
import org.flip7.base.util.statemachine.Action;
import org.flip7.base.util.statemachine.GameState;
import org.flip7.base.util.statemachine.StackedDecks;
import org.junit.Assert;
import org.junit.Test;

public class PlayoutPolicyTest extends Assert
{
  private static final List<String> PLAYERS = Arrays.asList("p1", "p2");

  @Test
  public void testThresholdStaysAtFifteen() throws Exception
  {
    Random lRandom = new Random(0);
    GameState lState = StackedDecks.state(PLAYERS, Card.number(12), Card.number(3), Card.number(1));
    IPlayoutPolicy lPolicy = new PlayoutPolicyThreshold();

    assertEquals(Action.HIT, lPolicy.decide(lState));
    lState.applyAction(Action.HIT, lRandom);
    assertEquals(12, lState.getCurrentTurn().getLineScore());
    assertEquals(Action.HIT, lPolicy.decide(lState));
    lState.applyAction(Action.HIT, lRandom);
    assertEquals(15, lState.getCurrentTurn().getLineScore());
    assertEquals(Action.STAY, lPolicy.decide(lState));
  }

  @Test
  public void testThresholdIsConfigurable() throws Exception
  {
    GameState lState = StackedDecks.state(PLAYERS, Card.number(12), Card.number(3));
    lState.applyAction(Action.HIT, new Random(0));

    assertEquals(Action.STAY, new PlayoutPolicyThreshold(10).decide(lState));
    assertEquals(Action.HIT, new PlayoutPolicyThreshold(13).decide(lState));
    assertEquals(13, new PlayoutPolicyThreshold(13).getThreshold());
  }

  @Test
  public void testPoliciesStayWhenNothingToDraw()
  {
    GameState lState = StackedDecks.state(PLAYERS);
    assertEquals(Action.STAY, new PlayoutPolicyThreshold().decide(lState));
    for (int i = 0; i < 20; i++)
    {
      assertEquals(Action.STAY, new PlayoutPolicyRandom(new Random(i)).decide(lState));
    }
  }

  @Test
  public void testRandomPolicyUsesBothActions()
  {
    GameState lState = StackedDecks.state(PLAYERS, Card.number(1));
    IPlayoutPolicy lPolicy = new PlayoutPolicyRandom(new Random(11));
    Set<Action> lSeen = EnumSet.noneOf(Action.class);
    for (int i = 0; i < 100; i++)
    {
      lSeen.add(lPolicy.decide(lState));
    }
    assertEquals(EnumSet.allOf(Action.class), lSeen);
  }

  @Test
  public void testRandomPolicyDependsOnlyOnSeed()
  {
    GameState lState = StackedDecks.state(PLAYERS, Card.number(1));
    IPlayoutPolicy lFirst = new PlayoutPolicyRandom(new Random(4));
    IPlayoutPolicy lSecond = new PlayoutPolicyRandom(new Random(4));
    for (int i = 0; i < 50; i++)
    {
      assertEquals(lFirst.decide(lState), lSecond.decide(lState));
    }
  }

  @Test
  public void testFactory()
  {
    assertTrue(PlayoutPolicyFactory.create("random", new Random(0), 15) instanceof PlayoutPolicyRandom);
    assertTrue(PlayoutPolicyFactory.create(" Heuristic ", new Random(0), 15) instanceof PlayoutPolicyThreshold);
    IPlayoutPolicy lPolicy = PlayoutPolicyFactory.create("threshold", new Random(0), 20);
    assertEquals(20, ((PlayoutPolicyThreshold)lPolicy).getThreshold());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testFactoryRejectsUnknownName()
  {
    PlayoutPolicyFactory.create("greedy", new Random(0), 15);
  }
}
