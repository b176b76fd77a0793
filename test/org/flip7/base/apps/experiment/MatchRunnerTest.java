package org.flip7.base.apps.experiment;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.apache.logging.log4j.ThreadContext;
import org.flip7.base.util.statemachine.Action;
import org.flip7.base.util.statemachine.GameState;
import org.flip7.base.util.statemachine.playoutPolicy.IPlayoutPolicy;
import org.flip7.base.util.statemachine.playoutPolicy.PlayoutPolicyRandom;
import org.flip7.base.util.statemachine.playoutPolicy.PlayoutPolicyThreshold;
import org.junit.Assert;
import org.junit.Test;

public class MatchRunnerTest extends Assert
{
  private final MatchRunner mRunner = new MatchRunner();

  @Test
  public void testGameHasAWinner() throws Exception
  {
    List<IPlayoutPolicy> lPolicies =
      Arrays.<IPlayoutPolicy>asList(new PlayoutPolicyThreshold(), new PlayoutPolicyRandom(new Random(1)));
    int lWinner = mRunner.playGame("test", lPolicies, new Random(1));

    assertTrue(lWinner == 0 || lWinner == 1);
    assertNull(ThreadContext.get("matchID"));
  }

  @Test
  public void testGamesDependOnlyOnSeed() throws Exception
  {
    for (long lSeed = 0; lSeed < 10; lSeed++)
    {
      int lFirst = mRunner.playGame("a",
                                    Arrays.<IPlayoutPolicy>asList(new PlayoutPolicyRandom(new Random(lSeed)),
                                                                  new PlayoutPolicyRandom(new Random(lSeed + 1))),
                                    new Random(lSeed));
      int lSecond = mRunner.playGame("b",
                                     Arrays.<IPlayoutPolicy>asList(new PlayoutPolicyRandom(new Random(lSeed)),
                                                                   new PlayoutPolicyRandom(new Random(lSeed + 1))),
                                     new Random(lSeed));
      assertEquals(lFirst, lSecond);
    }
  }

  @Test
  public void testGameThatNeverScoresIsAbandoned() throws Exception
  {
    IPlayoutPolicy lAlwaysStay = new IPlayoutPolicy()
    {
      @Override
      public Action decide(GameState xiState)
      {
        return Action.STAY;
      }
    };

    assertEquals(-1, mRunner.playGame("stay", Arrays.asList(lAlwaysStay, lAlwaysStay), new Random(2)));
    assertNull(ThreadContext.get("matchID"));
  }
}
