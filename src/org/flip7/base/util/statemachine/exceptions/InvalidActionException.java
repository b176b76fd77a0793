package org.flip7.base.util.statemachine.exceptions;

import org.flip7.base.util.statemachine.Action;
import org.flip7.base.util.statemachine.TurnStatus;

/**
 * Thrown when an action is not among the legal actions of the state it is applied to - for example, a hit after the
 * turn has already busted.
 */
public class InvalidActionException extends Flip7Exception
{
  private static final long serialVersionUID = 1L;

  private final Action mAction;

  public InvalidActionException(Action xiAction, TurnStatus xiStatus)
  {
    super("Action " + xiAction + " is not legal for a turn with status " + xiStatus);
    mAction = xiAction;
  }

  public InvalidActionException(Action xiAction, String xiReason)
  {
    super("Action " + xiAction + " is not legal: " + xiReason);
    mAction = xiAction;
  }

  /**
   * @return the rejected action, or null if the rejected request was a card rather than a player action.
   */
  public Action getAction()
  {
    return mAction;
  }
}
