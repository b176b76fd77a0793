package org.flip7.base.util.configuration;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map.Entry;
import java.util.Properties;

import org.apache.commons.lang.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Class giving access to machine-specific configuration.
 *
 * Values come from a properties file named by the <code>flip7.cfg</code> system property or, failing that, from
 * <code>data/cfg/&lt;computer name&gt;.properties</code>.  Anything not configured takes the default in
 * {@link CfgItem}.
 */
public class MachineSpecificConfiguration
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * System property naming an explicit configuration file.
   */
  public static final String CFG_FILE_PROPERTY = "flip7.cfg";

  /**
   * Available configuration items.
   */
  public static enum CfgItem
  {
    /**
     * Number of MCTS simulations per decision.
     */
    SIMULATION_BUDGET(1000),

    /**
     * Extra reward given to a simulated turn that ends in Flip 7.  May be negative.
     */
    FLIP7_WEIGHT("50.0"),

    /**
     * UCB1 exploration constant.
     */
    EXPLORATION_BIAS("1.4"),

    /**
     * Policy used to finish simulated turns ("random" or "heuristic").
     */
    ROLLOUT_POLICY("random"),

    /**
     * Policy the MCTS player is matched against ("random" or "heuristic").
     */
    OPPONENT_POLICY("random"),

    /**
     * Line score at which the heuristic policy stays.
     */
    HEURISTIC_THRESHOLD(15),

    /**
     * Games per experiment setting.
     */
    NUM_GAMES(2),

    /**
     * Seed for the experiment's master random source.
     */
    RANDOM_SEED(0),

    /**
     * Simulation budgets swept by the experiment runner (comma-separated).
     */
    EXPERIMENT_SIMS("10,100,1000"),

    /**
     * Flip 7 weights swept by the experiment runner and the tuner (comma-separated).
     */
    EXPERIMENT_WEIGHTS("0,10,25,50,100"),

    /**
     * Opponents swept by the experiment runner (comma-separated).
     */
    EXPERIMENT_OPPONENTS("random,heuristic"),

    /**
     * Where the experiment runner writes its results table.
     */
    RESULTS_FILE("experiment_results.csv"),

    /**
     * Where the tuner writes its results table.
     */
    TUNING_FILE("flip7_weight_tuning.csv");

    /**
     * Default value, as a string.
     */
    public final String mDefault;

    private CfgItem(String xiDefault)
    {
      mDefault = xiDefault;
    }

    private CfgItem(int xiDefault)
    {
      mDefault = "" + xiDefault;
    }
  }

  private static final Properties MACHINE_PROPERTIES = new Properties();
  static
  {
    String lFileName = System.getProperty(CFG_FILE_PROPERTY);

    if (lFileName == null)
    {
      // Computer is identified by the COMPUTERNAME environment variable (Windows) or HOSTNAME (Linux).
      String lComputerName = System.getenv("COMPUTERNAME");
      if (lComputerName == null)
      {
        lComputerName = System.getenv("HOSTNAME");
      }
      if (lComputerName != null)
      {
        lFileName = "data/cfg/" + lComputerName + ".properties";
      }
    }

    if (lFileName != null && new File(lFileName).isFile())
    {
      try (InputStream lPropStream = new FileInputStream(lFileName))
      {
        MACHINE_PROPERTIES.load(lPropStream);
      }
      catch (IOException lEx)
      {
        LOGGER.warn("Invalid configuration file " + lFileName + " - using defaults", lEx);
      }
    }
    else
    {
      LOGGER.debug("No configuration file" + (lFileName == null ? "" : " at " + lFileName) + " - using defaults");
    }
  }

  private MachineSpecificConfiguration()
  {
  }

  /**
   * @return the specified String configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   */
  public static String getCfgStr(CfgItem xiKey)
  {
    return MACHINE_PROPERTIES.getProperty(xiKey.toString(), xiKey.mDefault);
  }

  /**
   * @return the specified integer configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   * @throws IllegalArgumentException if the configured value is not an integer.
   */
  public static int getCfgInt(CfgItem xiKey)
  {
    String lValue = getCfgStr(xiKey);
    try
    {
      return Integer.parseInt(lValue.trim());
    }
    catch (NumberFormatException lEx)
    {
      throw new IllegalArgumentException("Configuration item " + xiKey + " must be an integer, not '" + lValue + "'",
                                         lEx);
    }
  }

  /**
   * @return the specified floating point configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   * @throws IllegalArgumentException if the configured value is not a number.
   */
  public static double getCfgDouble(CfgItem xiKey)
  {
    String lValue = getCfgStr(xiKey);
    try
    {
      return Double.parseDouble(lValue.trim());
    }
    catch (NumberFormatException lEx)
    {
      throw new IllegalArgumentException("Configuration item " + xiKey + " must be a number, not '" + lValue + "'",
                                         lEx);
    }
  }

  /**
   * @return the specified comma-separated configuration value as a list of trimmed, non-empty strings.
   *
   * @param xiKey - the item.
   */
  public static List<String> getCfgList(CfgItem xiKey)
  {
    List<String> lResult = new ArrayList<>();
    for (String lPart : StringUtils.split(getCfgStr(xiKey), ','))
    {
      if (StringUtils.isNotBlank(lPart))
      {
        lResult.add(lPart.trim());
      }
    }
    return lResult;
  }

  /**
   * Log all machine-specific configuration.
   */
  public static void logConfig()
  {
    LOGGER.info("Running with machine-specific properties:");
    for (Entry<Object, Object> e : MACHINE_PROPERTIES.entrySet())
    {
      String lKey = (String)e.getKey();

      // Check that this is a known configuration parameter (and not a typo in the config file).
      try
      {
        CfgItem lItem = CfgItem.valueOf(lKey);
        LOGGER.info("\t" + lKey + " = " + e.getValue() + " (default: " + lItem.mDefault + ")");
      }
      catch (IllegalArgumentException lEx)
      {
        LOGGER.warn("Unknown configuration parameter: '" + lKey + "'");
      }
    }
  }

  /**
   * UT-only method for overriding configuration.
   *
   * @param xiKey - the property to override.
   * @param xiValue - the new value, or null to revert to the default.
   */
  public static void utOverrideCfgVal(CfgItem xiKey, String xiValue)
  {
    if (xiValue == null)
    {
      MACHINE_PROPERTIES.remove(xiKey.toString());
    }
    else
    {
      MACHINE_PROPERTIES.setProperty(xiKey.toString(), xiValue);
    }
  }
}
