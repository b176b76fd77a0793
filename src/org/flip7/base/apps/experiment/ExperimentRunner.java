package org.flip7.base.apps.experiment;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.apache.commons.lang.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.flip7.base.player.gamer.statemachine.mctsref.MctsRefAgent;
import org.flip7.base.player.gamer.statemachine.mctsref.MctsRefGamer;
import org.flip7.base.util.configuration.MachineSpecificConfiguration;
import org.flip7.base.util.configuration.MachineSpecificConfiguration.CfgItem;
import org.flip7.base.util.statemachine.exceptions.InvalidActionException;
import org.flip7.base.util.statemachine.playoutPolicy.IPlayoutPolicy;
import org.flip7.base.util.statemachine.playoutPolicy.PlayoutPolicyFactory;

/**
 * ExperimentRunner plays the MCTS player against baseline opponents over a grid of simulation budgets and Flip 7
 * weights, and writes one CSV row per setting.
 *
 * See {@link #main(String[])} for the command-line arguments.
 */
public final class ExperimentRunner
{
  private static final Logger LOGGER = LogManager.getLogger();

  private static final String sHelp =
    "Args: [<Games per setting> [<Results file>]]\n" +
    "      Budgets, weights, opponents and seed come from the machine-specific configuration.\n";

  /**
   * Column headings of the results table.
   */
  public static final List<String> HEADER =
    Arrays.asList("mcts_sims", "flip7_weight", "opponent", "games", "mcts_wins", "opponent_wins");

  private final long        mSeed;
  private final double      mExplorationBias;
  private final String      mRolloutPolicy;
  private final int         mThreshold;
  private final MatchRunner mMatchRunner = new MatchRunner();

  /**
   * @param xiSeed - seed of the master random source.  Every game's randomness is derived from it.
   * @param xiExplorationBias - UCB1 exploration constant for the MCTS player.
   * @param xiRolloutPolicy - name of the MCTS rollout policy.
   * @param xiThreshold - stay threshold for heuristic policies.
   */
  public ExperimentRunner(long xiSeed, double xiExplorationBias, String xiRolloutPolicy, int xiThreshold)
  {
    mSeed = xiSeed;
    mExplorationBias = xiExplorationBias;
    mRolloutPolicy = xiRolloutPolicy;
    mThreshold = xiThreshold;
  }

  /**
   * Run the experiment from the command line.
   *
   * @param args
   * - args[0] = games per setting (optional, default NUM_GAMES)
   * - args[1] = results file (optional, default RESULTS_FILE)
   *
   * @throws IOException if the results cannot be written.
   * @throws InvalidActionException if a policy plays an illegal action.
   */
  public static void main(String[] args) throws IOException, InvalidActionException
  {
    if (args.length > 2)
    {
      System.err.println(sHelp);
      System.exit(1);
    }

    MachineSpecificConfiguration.logConfig();

    int lGames = (args.length > 0) ? Integer.valueOf(args[0]) :
                                     MachineSpecificConfiguration.getCfgInt(CfgItem.NUM_GAMES);
    String lResultsFile = (args.length > 1) ? args[1] : MachineSpecificConfiguration.getCfgStr(CfgItem.RESULTS_FILE);

    List<Integer> lSims = new ArrayList<>();
    for (String lValue : MachineSpecificConfiguration.getCfgList(CfgItem.EXPERIMENT_SIMS))
    {
      lSims.add(Integer.valueOf(lValue));
    }
    List<Double> lWeights = new ArrayList<>();
    for (String lValue : MachineSpecificConfiguration.getCfgList(CfgItem.EXPERIMENT_WEIGHTS))
    {
      lWeights.add(Double.valueOf(lValue));
    }
    List<String> lOpponents = MachineSpecificConfiguration.getCfgList(CfgItem.EXPERIMENT_OPPONENTS);

    ExperimentRunner lRunner =
      new ExperimentRunner(MachineSpecificConfiguration.getCfgInt(CfgItem.RANDOM_SEED),
                           MachineSpecificConfiguration.getCfgDouble(CfgItem.EXPLORATION_BIAS),
                           MachineSpecificConfiguration.getCfgStr(CfgItem.ROLLOUT_POLICY),
                           MachineSpecificConfiguration.getCfgInt(CfgItem.HEURISTIC_THRESHOLD));

    List<SettingResult> lResults = lRunner.run(lSims, lWeights, lOpponents, lGames);
    writeResults(new File(lResultsFile), lResults);
    LOGGER.info("Results saved to " + lResultsFile);
  }

  /**
   * Play every setting of the grid.
   *
   * @param xiSims - simulation budgets.
   * @param xiWeights - Flip 7 weights.
   * @param xiOpponents - opponent policy names.
   * @param xiGamesPerSetting - games per setting.
   *
   * @return one result per setting, budgets outermost and opponents innermost.
   * @throws IllegalArgumentException if any setting is unusable.  Nothing has been played in that case.
   * @throws InvalidActionException if a policy plays an illegal action.
   */
  public List<SettingResult> run(List<Integer> xiSims,
                                 List<Double> xiWeights,
                                 List<String> xiOpponents,
                                 int xiGamesPerSetting) throws InvalidActionException
  {
    validate(xiSims, xiOpponents, xiGamesPerSetting);

    Random lMaster = new Random(mSeed);
    List<SettingResult> lResults = new ArrayList<>();

    for (int lSims : xiSims)
    {
      for (double lWeight : xiWeights)
      {
        for (String lOpponentName : xiOpponents)
        {
          SettingResult lResult = new SettingResult(lSims, lWeight, lOpponentName, xiGamesPerSetting);

          for (int lGame = 0; lGame < xiGamesPerSetting; lGame++)
          {
            Random lGameRandom = new Random(lMaster.nextLong());
            IPlayoutPolicy lMcts = createMctsPlayer(lSims, lWeight, new Random(lGameRandom.nextLong()));
            IPlayoutPolicy lOpponent =
              PlayoutPolicyFactory.create(lOpponentName, new Random(lGameRandom.nextLong()), mThreshold);

            String lMatchID = "sims" + lSims + ".w" + lWeight + "." + lOpponentName + "." + lGame;
            int lWinner = mMatchRunner.playGame(lMatchID, Arrays.asList(lMcts, lOpponent), lGameRandom);
            lResult.noteWinner(lWinner);
          }

          LOGGER.info("sims=" + lSims + " weight=" + lWeight + " vs=" + lOpponentName + " -> mcts_wins=" +
                      lResult.getMctsWins() + " / " + xiGamesPerSetting);
          lResults.add(lResult);
        }
      }
    }

    return lResults;
  }

  /**
   * Write a results table.
   *
   * @param xiFile - destination.  Overwritten if it exists.
   * @param xiResults - rows to write.
   *
   * @throws IOException if the file cannot be written.
   */
  public static void writeResults(File xiFile, List<SettingResult> xiResults) throws IOException
  {
    try (BufferedWriter lWriter = new BufferedWriter(new FileWriter(xiFile)))
    {
      lWriter.write(StringUtils.join(HEADER, ','));
      lWriter.newLine();
      for (SettingResult lResult : xiResults)
      {
        lWriter.write(lResult.toCsvRow());
        lWriter.newLine();
      }
    }
  }

  private IPlayoutPolicy createMctsPlayer(int xiSims, double xiWeight, Random xiRandom)
  {
    IPlayoutPolicy lRollout = PlayoutPolicyFactory.create(mRolloutPolicy, xiRandom, mThreshold);
    return new MctsRefGamer(new MctsRefAgent(xiRandom, mExplorationBias), xiSims, xiWeight, lRollout);
  }

  private void validate(List<Integer> xiSims, List<String> xiOpponents, int xiGamesPerSetting)
  {
    if (xiGamesPerSetting <= 0)
    {
      throw new IllegalArgumentException("Games per setting must be positive, not " + xiGamesPerSetting);
    }
    for (int lSims : xiSims)
    {
      if (lSims <= 0)
      {
        throw new IllegalArgumentException("Simulation budget must be positive, not " + lSims);
      }
    }

    // Resolve every policy name once so that a typo fails before any game is played.
    Random lScratch = new Random(0);
    PlayoutPolicyFactory.create(mRolloutPolicy, lScratch, mThreshold);
    for (String lOpponent : xiOpponents)
    {
      PlayoutPolicyFactory.create(lOpponent, lScratch, mThreshold);
    }
  }

  /**
   * Outcome of all the games played at one setting.
   */
  public static class SettingResult
  {
    private final int    mSims;
    private final double mWeight;
    private final String mOpponent;
    private final int    mGames;
    private int          mMctsWins = 0;
    private int          mOpponentWins = 0;

    public SettingResult(int xiSims, double xiWeight, String xiOpponent, int xiGames)
    {
      mSims = xiSims;
      mWeight = xiWeight;
      mOpponent = xiOpponent;
      mGames = xiGames;
    }

    void noteWinner(int xiSeat)
    {
      if (xiSeat == 0)
      {
        mMctsWins++;
      }
      else if (xiSeat == 1)
      {
        mOpponentWins++;
      }
    }

    public int getSims()
    {
      return mSims;
    }

    public double getWeight()
    {
      return mWeight;
    }

    public String getOpponent()
    {
      return mOpponent;
    }

    public int getGames()
    {
      return mGames;
    }

    public int getMctsWins()
    {
      return mMctsWins;
    }

    public int getOpponentWins()
    {
      return mOpponentWins;
    }

    /**
     * @return this result as a line of the results table, without the line terminator.
     */
    public String toCsvRow()
    {
      return StringUtils.join(new Object[] {mSims, mWeight, mOpponent, mGames, mMctsWins, mOpponentWins}, ',');
    }
  }
}
