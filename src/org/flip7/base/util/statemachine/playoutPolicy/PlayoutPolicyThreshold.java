package org.flip7.base.util.statemachine.playoutPolicy;

import org.flip7.base.util.statemachine.Action;
import org.flip7.base.util.statemachine.GameState;

/**
 * Playout policy that keeps hitting until the line is worth at least a fixed number of points, then stays.
 */
public class PlayoutPolicyThreshold implements IPlayoutPolicy
{
  /**
   * Line score at which the classic heuristic player stops.
   */
  public static final int DEFAULT_THRESHOLD = 15;

  private final int mThreshold;

  public PlayoutPolicyThreshold()
  {
    this(DEFAULT_THRESHOLD);
  }

  /**
   * @param xiThreshold - line score at or above which to stay.
   */
  public PlayoutPolicyThreshold(int xiThreshold)
  {
    mThreshold = xiThreshold;
  }

  @Override
  public Action decide(GameState xiState)
  {
    if (!xiState.getLegalActions().contains(Action.HIT))
    {
      return Action.STAY;
    }
    return xiState.getCurrentTurn().getLineScore() >= mThreshold ? Action.STAY : Action.HIT;
  }

  public int getThreshold()
  {
    return mThreshold;
  }

  @Override
  public String toString()
  {
    return "Threshold(" + mThreshold + ")";
  }
}
