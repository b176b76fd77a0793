package org.flip7.base.util.statemachine.playoutPolicy;

import org.flip7.base.util.statemachine.Action;
import org.flip7.base.util.statemachine.GameState;

/**
 * Interface for anything that can choose an action for the acting player: baseline opponents, rollout policies used
 * by the search, and the search itself when seated at a table.
 *
 * The engine and the search depend only on this interface.
 */
public interface IPlayoutPolicy
{
  /**
   * Choose an action for the acting player.
   *
   * @param xiState - current state.  Implementations must not modify it.
   *
   * @return an action legal in xiState.  If the state offers no legal actions, STAY.
   */
  public Action decide(GameState xiState);
}
