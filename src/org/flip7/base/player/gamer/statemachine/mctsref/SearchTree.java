package org.flip7.base.player.gamer.statemachine.mctsref;

import java.util.EnumSet;
import java.util.Random;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.flip7.base.util.statemachine.Action;
import org.flip7.base.util.statemachine.ActionOutcome;
import org.flip7.base.util.statemachine.GameState;
import org.flip7.base.util.statemachine.exceptions.Flip7Exception;
import org.flip7.base.util.statemachine.playoutPolicy.IPlayoutPolicy;

/**
 * Single-turn search tree over {HIT, STAY} for the acting player of a root state.
 *
 * Nodes are allocated from a fixed-size arena and addressed by index.  Each call to {@link #grow()} runs one
 * determinized simulation and adds at most one node, so a tree built for N simulations never needs more than N + 1
 * slots.  The tree is thrown away once a decision has been taken.
 */
public class SearchTree
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Arena index of the root.
   */
  public static final int ROOT = 0;

  private final GameState        mRootState;
  private final SearchTreeNode[] mNodes;
  private int                    mNumNodes;
  private final double           mExplorationBias;
  private final double           mFlip7Weight;
  private final IPlayoutPolicy   mRolloutPolicy;
  private final Random           mRandom;

  /**
   * Create a tree holding just the root.
   *
   * @param xiRootState - the real state to decide in.  Never modified.
   * @param xiCapacity - maximum number of nodes.
   * @param xiExplorationBias - UCB1 exploration constant.
   * @param xiFlip7Weight - extra reward for a simulated turn that ends in Flip 7.
   * @param xiRolloutPolicy - policy used to finish the turn from a leaf.
   * @param xiRandom - source of all randomness in the search.
   */
  public SearchTree(GameState xiRootState,
                    int xiCapacity,
                    double xiExplorationBias,
                    double xiFlip7Weight,
                    IPlayoutPolicy xiRolloutPolicy,
                    Random xiRandom)
  {
    mRootState = xiRootState;
    mNodes = new SearchTreeNode[xiCapacity];
    mExplorationBias = xiExplorationBias;
    mFlip7Weight = xiFlip7Weight;
    mRolloutPolicy = xiRolloutPolicy;
    mRandom = xiRandom;

    mNodes[ROOT] = new SearchTreeNode(ROOT, SearchTreeNode.NONE, null, xiRootState.getLegalActions());
    mNumNodes = 1;
  }

  /**
   * Run one simulation: determinize, select, expand, roll out, back-propagate.
   */
  public void grow()
  {
    Simulation lSim = new Simulation(determinize());
    SearchTreeNode lNode = mNodes[ROOT];

    while (!lSim.mTurnOver)
    {
      Set<Action> lLegal = lSim.mState.getLegalActions();

      Action lUntried = firstUntried(lNode, lLegal);
      if (lUntried != null)
      {
        lNode = expand(lNode, lUntried);
        lSim.play(lUntried);
        break;
      }

      SearchTreeNode lChild = select(lNode, lLegal);
      if (lChild == null)
      {
        break;
      }
      lSim.play(lChild.getAction());
      lNode = lChild;
    }

    while (!lSim.mTurnOver)
    {
      lSim.play(mRolloutPolicy.decide(lSim.mState));
    }

    backPropagate(lNode, lSim.mReward);
  }

  /**
   * @return the root action with the most visits.  Ties go to the higher mean reward and then to the earlier action.
   * Null if nothing has been expanded.
   */
  public Action getBestAction()
  {
    SearchTreeNode lRoot = mNodes[ROOT];
    SearchTreeNode lBest = null;

    for (Action lAction : Action.values())
    {
      int lIndex = lRoot.getChild(lAction);
      if (lIndex == SearchTreeNode.NONE)
      {
        continue;
      }

      SearchTreeNode lChild = mNodes[lIndex];
      if (lBest == null ||
          lChild.getNumVisits() > lBest.getNumVisits() ||
          (lChild.getNumVisits() == lBest.getNumVisits() && lChild.getMeanReward() > lBest.getMeanReward()))
      {
        lBest = lChild;
      }
    }

    return lBest == null ? null : lBest.getAction();
  }

  /**
   * Choose the child to descend into.
   *
   * @param xiNode - the node to select from.
   * @param xiLegal - actions legal in the current simulation.
   *
   * @return the legal child with the highest UCB1 score (the earliest action on ties), or null if there is none.
   */
  SearchTreeNode select(SearchTreeNode xiNode, Set<Action> xiLegal)
  {
    SearchTreeNode lResult = null;
    double lBestScore = Double.NEGATIVE_INFINITY;

    for (Action lAction : Action.values())
    {
      int lIndex = xiNode.getChild(lAction);
      if (lIndex == SearchTreeNode.NONE || !xiLegal.contains(lAction))
      {
        continue;
      }

      SearchTreeNode lChild = mNodes[lIndex];
      double lScore = lChild.ucb1(xiNode.getNumVisits(), mExplorationBias);
      if (lResult == null || lScore > lBestScore)
      {
        lBestScore = lScore;
        lResult = lChild;
      }
    }

    return lResult;
  }

  /**
   * Add a child to a node.
   *
   * @param xiParent - the parent.
   * @param xiAction - an untried action of the parent.
   *
   * @return the new child.
   */
  SearchTreeNode expand(SearchTreeNode xiParent, Action xiAction)
  {
    if (mNumNodes == mNodes.length)
    {
      throw new IllegalStateException("Search tree full at " + mNumNodes + " nodes");
    }

    // Staying always ends the turn, so there is nothing below a STAY node.
    Set<Action> lUntried = (xiAction == Action.STAY) ? EnumSet.noneOf(Action.class) : EnumSet.allOf(Action.class);

    SearchTreeNode lChild = new SearchTreeNode(mNumNodes, xiParent.getIndex(), xiAction, lUntried);
    mNodes[mNumNodes++] = lChild;
    xiParent.linkChild(xiAction, lChild.getIndex());
    return lChild;
  }

  /**
   * Add a reward to every node from the given one up to the root.
   */
  void backPropagate(SearchTreeNode xiNode, double xiReward)
  {
    SearchTreeNode lNode = xiNode;
    while (true)
    {
      lNode.update(xiReward);
      if (lNode.isRoot())
      {
        break;
      }
      lNode = mNodes[lNode.getParent()];
    }
  }

  private GameState determinize()
  {
    // The acting player has seen lines, discards and totals; only the order of the undrawn cards is unknown.
    GameState lState = mRootState.copy();
    lState.reshuffleDeck(mRandom);
    return lState;
  }

  private static Action firstUntried(SearchTreeNode xiNode, Set<Action> xiLegal)
  {
    for (Action lAction : xiNode.getUntried())
    {
      if (xiLegal.contains(lAction))
      {
        return lAction;
      }
    }
    return null;
  }

  public SearchTreeNode getRoot()
  {
    return mNodes[ROOT];
  }

  /**
   * @return the node at the given arena index.
   */
  public SearchTreeNode getNode(int xiIndex)
  {
    if (xiIndex < 0 || xiIndex >= mNumNodes)
    {
      throw new IndexOutOfBoundsException("No node " + xiIndex + " in a tree of " + mNumNodes);
    }
    return mNodes[xiIndex];
  }

  public int getNumNodes()
  {
    return mNumNodes;
  }

  /**
   * Log the statistics of the immediate children of the root.
   */
  public void dumpRootData()
  {
    SearchTreeNode lRoot = mNodes[ROOT];
    for (Action lAction : Action.values())
    {
      int lIndex = lRoot.getChild(lAction);
      if (lIndex != SearchTreeNode.NONE)
      {
        SearchTreeNode lChild = mNodes[lIndex];
        LOGGER.debug("Move " + lAction + " scores: " + lChild.getMeanReward() + " after " + lChild.getNumVisits() +
                     " visits");
      }
    }
  }

  /**
   * One determinized play-through of the acting player's turn.
   */
  private final class Simulation
  {
    final GameState mState;
    boolean         mTurnOver = false;
    double          mReward = 0;

    Simulation(GameState xiState)
    {
      mState = xiState;
    }

    void play(Action xiAction)
    {
      try
      {
        ActionOutcome lOutcome = mState.applyAction(xiAction, mRandom);
        if (lOutcome.isTurnEnded())
        {
          mTurnOver = true;
          mReward = lOutcome.getBankedScore() + (lOutcome.isFlip7() ? mFlip7Weight : 0);
        }
      }
      catch (Flip7Exception lEx)
      {
        // The line as it stands is taken as final.
        LOGGER.debug("Simulation stopped early: " + lEx.getMessage());
        mTurnOver = true;
        mReward = mState.getCurrentTurn().getScore();
      }
    }
  }
}
