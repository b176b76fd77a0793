package org.flip7.base.apps.experiment;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.flip7.base.player.gamer.statemachine.mctsref.MctsRefGamer;
import org.flip7.base.util.configuration.MachineSpecificConfiguration;
import org.flip7.base.util.configuration.MachineSpecificConfiguration.CfgItem;
import org.flip7.base.util.statemachine.Action;
import org.flip7.base.util.statemachine.Flip7StateMachine;
import org.flip7.base.util.statemachine.GameState;
import org.flip7.base.util.statemachine.exceptions.InvalidActionException;
import org.flip7.base.util.statemachine.playoutPolicy.IPlayoutPolicy;
import org.flip7.base.util.statemachine.playoutPolicy.PlayoutPolicyFactory;

/**
 * Plays complete games between policies.
 *
 * Run from the command line, it seats the configured MCTS player against the configured opponent.
 */
public final class MatchRunner
{
  private static final Logger LOGGER = LogManager.getLogger();

  private static final String sHelp = "Args: [<Number of games> [<Seed>]]\n";

  /**
   * Upper bound on actions in one game.  Only reachable with policies that never score (e.g. always STAY).
   */
  public static final int MAX_ACTIONS = 100000;

  private final Flip7StateMachine mStateMachine = new Flip7StateMachine();

  /**
   * @param args
   * - args[0] = number of games (optional, default NUM_GAMES)
   * - args[1] = seed (optional, default RANDOM_SEED)
   *
   * @throws InvalidActionException if a policy plays an illegal action.
   */
  public static void main(String[] args) throws InvalidActionException
  {
    if (args.length > 2)
    {
      System.err.println(sHelp);
      System.exit(1);
    }

    MachineSpecificConfiguration.logConfig();

    int lGames = (args.length > 0) ? Integer.valueOf(args[0]) :
                                     MachineSpecificConfiguration.getCfgInt(CfgItem.NUM_GAMES);
    long lSeed = (args.length > 1) ? Long.valueOf(args[1]) :
                                     MachineSpecificConfiguration.getCfgInt(CfgItem.RANDOM_SEED);

    int lBudget = MachineSpecificConfiguration.getCfgInt(CfgItem.SIMULATION_BUDGET);
    double lWeight = MachineSpecificConfiguration.getCfgDouble(CfgItem.FLIP7_WEIGHT);
    String lOpponentName = MachineSpecificConfiguration.getCfgStr(CfgItem.OPPONENT_POLICY);
    int lThreshold = MachineSpecificConfiguration.getCfgInt(CfgItem.HEURISTIC_THRESHOLD);

    MatchRunner lRunner = new MatchRunner();
    Random lMaster = new Random(lSeed);
    int[] lWins = new int[2];

    for (int lGame = 0; lGame < lGames; lGame++)
    {
      Random lGameRandom = new Random(lMaster.nextLong());
      List<IPlayoutPolicy> lPolicies = new ArrayList<>();
      lPolicies.add(MctsRefGamer.fromConfiguration(new Random(lGameRandom.nextLong()), lBudget, lWeight));
      lPolicies.add(PlayoutPolicyFactory.create(lOpponentName, new Random(lGameRandom.nextLong()), lThreshold));

      int lWinner = lRunner.playGame("game" + lGame, lPolicies, lGameRandom);
      if (lWinner >= 0)
      {
        lWins[lWinner]++;
      }
    }

    LOGGER.info("MCTS won " + lWins[0] + ", " + lOpponentName + " won " + lWins[1] + " of " + lGames + " games");
  }

  /**
   * Play one game.
   *
   * @param xiMatchID - identifier for log messages.
   * @param xiPolicies - one policy per seat, in seating order.
   * @param xiRandom - randomness for the deal and deck recycling.
   *
   * @return the winning seat, or -1 if the game hit {@link #MAX_ACTIONS} without a winner.
   * @throws InvalidActionException if a policy chose an illegal action.
   */
  public int playGame(String xiMatchID, List<IPlayoutPolicy> xiPolicies, Random xiRandom)
      throws InvalidActionException
  {
    ThreadContext.put("matchID", xiMatchID);
    try
    {
      List<String> lPlayerIds = new ArrayList<>();
      for (int lSeat = 0; lSeat < xiPolicies.size(); lSeat++)
      {
        lPlayerIds.add("seat" + lSeat);
      }

      GameState lState = mStateMachine.getInitialState(lPlayerIds, xiRandom);
      int lNumActions = 0;

      while (!mStateMachine.isTerminal(lState))
      {
        if (lNumActions++ == MAX_ACTIONS)
        {
          LOGGER.warn("Abandoning game after " + MAX_ACTIONS + " actions: " + lState);
          return -1;
        }

        IPlayoutPolicy lPolicy = xiPolicies.get(lState.getCurrentPlayer());
        Action lAction = lPolicy.decide(lState);
        lState = mStateMachine.getNextState(lState, lAction, xiRandom);
      }

      LOGGER.info("Game over in round " + lState.getRound() + ": " + mStateMachine.getWinner(lState) + " (" +
                  xiPolicies.get(lState.getWinner()) + ") wins with " +
                  mStateMachine.getScore(lState, lState.getWinner()));
      return lState.getWinner();
    }
    finally
    {
      ThreadContext.remove("matchID");
    }
  }
}
