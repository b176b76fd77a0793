package org.flip7.base.player.gamer.statemachine.mctsref;

import java.util.Random;

import org.flip7.base.util.configuration.MachineSpecificConfiguration;
import org.flip7.base.util.configuration.MachineSpecificConfiguration.CfgItem;
import org.flip7.base.util.statemachine.Action;
import org.flip7.base.util.statemachine.GameState;
import org.flip7.base.util.statemachine.playoutPolicy.IPlayoutPolicy;
import org.flip7.base.util.statemachine.playoutPolicy.PlayoutPolicyFactory;

/**
 * Seats an {@link MctsRefAgent} at the table: a policy that runs a full search for every decision.
 */
public class MctsRefGamer implements IPlayoutPolicy
{
  private final MctsRefAgent   mAgent;
  private final int            mSimulationBudget;
  private final double         mFlip7Weight;
  private final IPlayoutPolicy mRolloutPolicy;
  private int                  mDecisionCount = 0;

  /**
   * @param xiAgent - the search.
   * @param xiSimulationBudget - simulations per decision.  Must be positive.
   * @param xiFlip7Weight - reward bonus for simulated Flip 7s.
   * @param xiRolloutPolicy - rollout policy.
   */
  public MctsRefGamer(MctsRefAgent xiAgent, int xiSimulationBudget, double xiFlip7Weight, IPlayoutPolicy xiRolloutPolicy)
  {
    if (xiSimulationBudget <= 0)
    {
      throw new IllegalArgumentException("Simulation budget must be positive, not " + xiSimulationBudget);
    }
    if (xiAgent == null || xiRolloutPolicy == null)
    {
      throw new IllegalArgumentException("An MCTS gamer needs an agent and a rollout policy");
    }
    mAgent = xiAgent;
    mSimulationBudget = xiSimulationBudget;
    mFlip7Weight = xiFlip7Weight;
    mRolloutPolicy = xiRolloutPolicy;
  }

  /**
   * Create a gamer with the configured exploration bias, rollout policy and heuristic threshold.
   *
   * @param xiRandom - source of randomness, shared by the search and its rollout policy.
   * @param xiSimulationBudget - simulations per decision.
   * @param xiFlip7Weight - reward bonus for simulated Flip 7s.
   *
   * @return the gamer.
   */
  public static MctsRefGamer fromConfiguration(Random xiRandom, int xiSimulationBudget, double xiFlip7Weight)
  {
    IPlayoutPolicy lRollout =
      PlayoutPolicyFactory.create(MachineSpecificConfiguration.getCfgStr(CfgItem.ROLLOUT_POLICY),
                                  xiRandom,
                                  MachineSpecificConfiguration.getCfgInt(CfgItem.HEURISTIC_THRESHOLD));
    MctsRefAgent lAgent =
      new MctsRefAgent(xiRandom, MachineSpecificConfiguration.getCfgDouble(CfgItem.EXPLORATION_BIAS));
    return new MctsRefGamer(lAgent, xiSimulationBudget, xiFlip7Weight, lRollout);
  }

  @Override
  public Action decide(GameState xiState)
  {
    mDecisionCount++;
    return mAgent.decide(xiState, mSimulationBudget, mFlip7Weight, mRolloutPolicy);
  }

  public int getSimulationBudget()
  {
    return mSimulationBudget;
  }

  public double getFlip7Weight()
  {
    return mFlip7Weight;
  }

  /**
   * @return the number of decisions taken so far.
   */
  public int getDecisionCount()
  {
    return mDecisionCount;
  }

  @Override
  public String toString()
  {
    return "MCTS(" + mSimulationBudget + " sims, flip7 weight " + mFlip7Weight + ", rollout " + mRolloutPolicy + ")";
  }
}
