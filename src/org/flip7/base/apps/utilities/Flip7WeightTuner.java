package org.flip7.base.apps.utilities;

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
import org.flip7.base.util.configuration.MachineSpecificConfiguration;
import org.flip7.base.util.configuration.MachineSpecificConfiguration.CfgItem;
import org.flip7.base.util.statemachine.Action;
import org.flip7.base.util.statemachine.ActionOutcome;
import org.flip7.base.util.statemachine.Flip7StateMachine;
import org.flip7.base.util.statemachine.GameState;
import org.flip7.base.util.statemachine.exceptions.Flip7Exception;
import org.flip7.base.util.statemachine.playoutPolicy.IPlayoutPolicy;
import org.flip7.base.util.statemachine.playoutPolicy.PlayoutPolicyRandom;

/**
 * Compares opening a turn with HIT against opening it with STAY, from a fixed position, for a range of Flip 7
 * weights.  Each sample shuffles the undrawn cards, plays the opening action and finishes the turn with the random
 * policy.
 */
public final class Flip7WeightTuner
{
  private static final Logger LOGGER = LogManager.getLogger();

  private static final String sHelp = "Args: [<Position seed> [<Results file>]]\n";

  /**
   * Seed of the position tuned from when none is given.
   */
  public static final long DEFAULT_POSITION_SEED = 123;

  /**
   * Column headings of the results table.
   */
  public static final List<String> HEADER =
    Arrays.asList("weight", "sims", "hit_bust_rate", "stay_bust_rate", "hit_avg_points", "stay_avg_points");

  private final GameState mPosition;
  private final Random    mRandom;

  /**
   * @param xiPosition - the position to sample from.  Never modified.
   * @param xiRandom - source of randomness for shuffles and rollouts.
   */
  public Flip7WeightTuner(GameState xiPosition, Random xiRandom)
  {
    if (xiPosition.getLegalActions().size() < 2)
    {
      throw new IllegalArgumentException("Both HIT and STAY must be legal in " + xiPosition);
    }
    mPosition = xiPosition;
    mRandom = xiRandom;
  }

  /**
   * @param args
   * - args[0] = seed of the two-player position to tune from (optional, default 123)
   * - args[1] = results file (optional, default TUNING_FILE)
   *
   * @throws IOException if the results cannot be written.
   */
  public static void main(String[] args) throws IOException
  {
    if (args.length > 2)
    {
      System.err.println(sHelp);
      System.exit(1);
    }

    long lPositionSeed = (args.length > 0) ? Long.valueOf(args[0]) : DEFAULT_POSITION_SEED;
    String lResultsFile = (args.length > 1) ? args[1] : MachineSpecificConfiguration.getCfgStr(CfgItem.TUNING_FILE);

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

    GameState lPosition = new Flip7StateMachine().getInitialState(Arrays.asList("seat0", "seat1"),
                                                                  new Random(lPositionSeed));
    LOGGER.info("Tuning from " + lPosition);

    Flip7WeightTuner lTuner =
      new Flip7WeightTuner(lPosition, new Random(MachineSpecificConfiguration.getCfgInt(CfgItem.RANDOM_SEED)));

    try (BufferedWriter lWriter = new BufferedWriter(new FileWriter(new File(lResultsFile))))
    {
      lWriter.write(StringUtils.join(HEADER, ','));
      lWriter.newLine();
      for (double lWeight : lWeights)
      {
        LOGGER.info("Running tuning for weight=" + lWeight);
        for (int lSamples : lSims)
        {
          lWriter.write(lTuner.compare(lWeight, lSamples).toCsvRow());
          lWriter.newLine();
        }
      }
    }
    LOGGER.info("Tuning results saved to " + lResultsFile);
  }

  /**
   * Sample both opening actions.
   *
   * @param xiFlip7Weight - bonus added to a sample's points when its turn ends in Flip 7.
   * @param xiSamples - samples per action.  Must be positive.
   *
   * @return the comparison.
   */
  public Comparison compare(double xiFlip7Weight, int xiSamples)
  {
    if (xiSamples <= 0)
    {
      throw new IllegalArgumentException("Sample count must be positive, not " + xiSamples);
    }

    IPlayoutPolicy lRollout = new PlayoutPolicyRandom(mRandom);
    Comparison lResult = new Comparison(xiFlip7Weight, xiSamples);

    for (int lSample = 0; lSample < xiSamples; lSample++)
    {
      Sample lHit = sample(Action.HIT, xiFlip7Weight, lRollout);
      lResult.mHitBusts += lHit.mBust ? 1 : 0;
      lResult.mHitPoints += lHit.mPoints;

      Sample lStay = sample(Action.STAY, xiFlip7Weight, lRollout);
      lResult.mStayBusts += lStay.mBust ? 1 : 0;
      lResult.mStayPoints += lStay.mPoints;
    }

    return lResult;
  }

  private Sample sample(Action xiOpening, double xiFlip7Weight, IPlayoutPolicy xiRollout)
  {
    GameState lState = mPosition.copy();
    lState.reshuffleDeck(mRandom);
    Sample lSample = new Sample();

    try
    {
      ActionOutcome lOutcome = lState.applyAction(xiOpening, mRandom);
      while (!lOutcome.isTurnEnded())
      {
        lOutcome = lState.applyAction(xiRollout.decide(lState), mRandom);
      }
      lSample.mBust = lOutcome.isBust();
      lSample.mPoints = lOutcome.getBankedScore() + (lOutcome.isFlip7() ? xiFlip7Weight : 0);
    }
    catch (Flip7Exception lEx)
    {
      LOGGER.debug("Sample stopped early: " + lEx.getMessage());
      lSample.mPoints = lState.getCurrentTurn().getScore();
    }

    return lSample;
  }

  private static class Sample
  {
    boolean mBust = false;
    double  mPoints = 0;
  }

  /**
   * Bust rates and average points of the two opening actions at one weight.
   */
  public static class Comparison
  {
    private final double mWeight;
    private final int    mSamples;
    int                  mHitBusts = 0;
    int                  mStayBusts = 0;
    double               mHitPoints = 0;
    double               mStayPoints = 0;

    Comparison(double xiWeight, int xiSamples)
    {
      mWeight = xiWeight;
      mSamples = xiSamples;
    }

    public double getWeight()
    {
      return mWeight;
    }

    public int getSamples()
    {
      return mSamples;
    }

    public double getHitBustRate()
    {
      return (double)mHitBusts / mSamples;
    }

    public double getStayBustRate()
    {
      return (double)mStayBusts / mSamples;
    }

    public double getHitAvgPoints()
    {
      return mHitPoints / mSamples;
    }

    public double getStayAvgPoints()
    {
      return mStayPoints / mSamples;
    }

    public String toCsvRow()
    {
      return StringUtils.join(new Object[] {mWeight,
                                            mSamples,
                                            getHitBustRate(),
                                            getStayBustRate(),
                                            getHitAvgPoints(),
                                            getStayAvgPoints()}, ',');
    }
  }
}
