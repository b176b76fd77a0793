package org.flip7.base.player.gamer.statemachine.mctsref;

import java.util.Random;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.flip7.base.util.statemachine.Action;
import org.flip7.base.util.statemachine.GameState;
import org.flip7.base.util.statemachine.playoutPolicy.IPlayoutPolicy;

/**
 * Determinized Monte Carlo Tree Search over the acting player's current turn.
 *
 * Each decision builds a fresh tree, runs a fixed number of simulations against independently shuffled copies of the
 * hidden deck and plays the most visited root action.  All randomness comes from the Random supplied at construction,
 * so two agents seeded alike make identical decisions from identical inputs.
 */
public class MctsRefAgent
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Default UCB1 exploration constant.
   */
  public static final double DEFAULT_EXPLORATION_BIAS = 1.4;

  private final Random mRandom;
  private final double mExplorationBias;

  private int          mLastNumNodes = 0;

  public MctsRefAgent(Random xiRandom)
  {
    this(xiRandom, DEFAULT_EXPLORATION_BIAS);
  }

  /**
   * @param xiRandom - source of randomness for determinization and deck recycling.
   * @param xiExplorationBias - UCB1 exploration constant.
   */
  public MctsRefAgent(Random xiRandom, double xiExplorationBias)
  {
    if (xiRandom == null)
    {
      throw new IllegalArgumentException("A search needs an explicit random source");
    }
    mRandom = xiRandom;
    mExplorationBias = xiExplorationBias;
  }

  /**
   * Choose an action for the acting player.
   *
   * @param xiState - the real game state.  Not modified.
   * @param xiSimulationBudget - number of simulations to run.  Must be positive.
   * @param xiFlip7Weight - extra reward for simulated turns that reach Flip 7.  May be negative.
   * @param xiRolloutPolicy - policy used to finish simulated turns.
   *
   * @return the chosen action, always legal in xiState.
   * @throws IllegalArgumentException if the arguments are unusable.  Nothing has been simulated in that case.
   */
  public Action decide(GameState xiState, int xiSimulationBudget, double xiFlip7Weight, IPlayoutPolicy xiRolloutPolicy)
  {
    if (xiSimulationBudget <= 0)
    {
      throw new IllegalArgumentException("Simulation budget must be positive, not " + xiSimulationBudget);
    }
    if (xiRolloutPolicy == null)
    {
      throw new IllegalArgumentException("No rollout policy");
    }
    if (xiState == null || xiState.getLegalActions().isEmpty())
    {
      throw new IllegalArgumentException("No decision to take in " + xiState);
    }

    SearchTree lTree = new SearchTree(xiState,
                                      xiSimulationBudget + 1,
                                      mExplorationBias,
                                      xiFlip7Weight,
                                      xiRolloutPolicy,
                                      mRandom);

    for (int lIteration = 0; lIteration < xiSimulationBudget; lIteration++)
    {
      lTree.grow();
    }

    lTree.dumpRootData();
    mLastNumNodes = lTree.getNumNodes();

    Action lBestAction = lTree.getBestAction();
    LOGGER.debug("Processed " + xiSimulationBudget + " iterations (" + mLastNumNodes + " nodes), and playing: " +
                 lBestAction);
    return lBestAction;
  }

  public double getExplorationBias()
  {
    return mExplorationBias;
  }

  /**
   * @return the size of the tree built by the most recent decision.
   */
  public int getLastNumNodes()
  {
    return mLastNumNodes;
  }
}
