package org.flip7.base.util.statemachine.playoutPolicy;

import java.util.Random;
import java.util.Set;

import org.flip7.base.util.statemachine.Action;
import org.flip7.base.util.statemachine.GameState;

/**
 * Playout policy that picks uniformly amongst the legal actions.
 */
public class PlayoutPolicyRandom implements IPlayoutPolicy
{
  private final Random mRandom;

  /**
   * @param xiRandom - source of randomness.  Seed it to make playouts reproducible.
   */
  public PlayoutPolicyRandom(Random xiRandom)
  {
    mRandom = xiRandom;
  }

  @Override
  public Action decide(GameState xiState)
  {
    Set<Action> lLegal = xiState.getLegalActions();
    if (lLegal.isEmpty())
    {
      return Action.STAY;
    }

    int lChoice = mRandom.nextInt(lLegal.size());
    for (Action lAction : lLegal)
    {
      if (lChoice-- == 0)
      {
        return lAction;
      }
    }
    throw new IllegalStateException("Unreachable");
  }

  @Override
  public String toString()
  {
    return "Random";
  }
}
