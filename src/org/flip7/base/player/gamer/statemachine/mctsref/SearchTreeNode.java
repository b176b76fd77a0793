package org.flip7.base.player.gamer.statemachine.mctsref;

import java.util.EnumSet;
import java.util.Set;

import org.flip7.base.util.statemachine.Action;

/**
 * A node in the search tree.
 *
 * Nodes do not hold game states.  A node stands for the sequence of actions on the path from the root; each
 * simulation replays that sequence against its own determinized state.  Links are arena indices into the owning
 * {@link SearchTree}, so a node has exactly one parent by construction.
 */
public class SearchTreeNode
{
  /**
   * Index used for "no node".
   */
  public static final int NONE = -1;

  private final int         mIndex;
  private final int         mParent;
  private final Action      mAction;
  private final int[]       mChildren;
  private final Set<Action> mUntried;
  private int               mNumVisits = 0;
  private double            mTotalReward = 0;

  /**
   * @param xiIndex - this node's index in the arena.
   * @param xiParent - parent index, or {@link #NONE} for the root.
   * @param xiAction - action that leads from the parent to this node, or null for the root.
   * @param xiUntried - actions still to be expanded from this node.
   */
  SearchTreeNode(int xiIndex, int xiParent, Action xiAction, Set<Action> xiUntried)
  {
    mIndex = xiIndex;
    mParent = xiParent;
    mAction = xiAction;
    mChildren = new int[Action.values().length];
    for (int i = 0; i < mChildren.length; i++)
    {
      mChildren[i] = NONE;
    }
    mUntried = xiUntried.isEmpty() ? EnumSet.noneOf(Action.class) : EnumSet.copyOf(xiUntried);
  }

  public int getIndex()
  {
    return mIndex;
  }

  public int getParent()
  {
    return mParent;
  }

  public boolean isRoot()
  {
    return mParent == NONE;
  }

  public Action getAction()
  {
    return mAction;
  }

  /**
   * @return the arena index of the child reached by the given action, or {@link #NONE}.
   */
  public int getChild(Action xiAction)
  {
    return mChildren[xiAction.ordinal()];
  }

  public boolean hasChildren()
  {
    for (int lChild : mChildren)
    {
      if (lChild != NONE)
      {
        return true;
      }
    }
    return false;
  }

  /**
   * @return the actions not yet expanded, in action order.
   */
  public Set<Action> getUntried()
  {
    return mUntried;
  }

  public int getNumVisits()
  {
    return mNumVisits;
  }

  public double getTotalReward()
  {
    return mTotalReward;
  }

  /**
   * @return mean reward per visit, or 0 before the first visit.
   */
  public double getMeanReward()
  {
    return mNumVisits == 0 ? 0 : mTotalReward / mNumVisits;
  }

  /**
   * UCB1 value of this node as seen from its parent.
   *
   * @param xiParentVisits - visit count of the parent.
   * @param xiExplorationBias - exploration constant.
   *
   * @return the score.  Unvisited nodes score positive infinity.
   */
  public double ucb1(int xiParentVisits, double xiExplorationBias)
  {
    if (mNumVisits == 0)
    {
      return Double.POSITIVE_INFINITY;
    }
    return getMeanReward() + xiExplorationBias * Math.sqrt(Math.log(xiParentVisits) / mNumVisits);
  }

  void linkChild(Action xiAction, int xiChild)
  {
    assert(mChildren[xiAction.ordinal()] == NONE) : "Action " + xiAction + " expanded twice";
    mChildren[xiAction.ordinal()] = xiChild;
    mUntried.remove(xiAction);
  }

  void update(double xiReward)
  {
    mNumVisits++;
    mTotalReward += xiReward;
  }

  @Override
  public String toString()
  {
    return "Node " + mIndex + " (" + mAction + "): " + mNumVisits + " visits, mean " + getMeanReward();
  }
}
