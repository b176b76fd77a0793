package org.flip7.base.util.statemachine.playoutPolicy;

import java.util.Random;

/**
 * Resolves policy names from configuration into policy instances.
 */
public final class PlayoutPolicyFactory
{
  /**
   * Name of {@link PlayoutPolicyRandom}.
   */
  public static final String RANDOM = "random";

  /**
   * Name of {@link PlayoutPolicyThreshold}.
   */
  public static final String HEURISTIC = "heuristic";

  private PlayoutPolicyFactory()
  {
  }

  /**
   * Create a policy.
   *
   * @param xiName - policy name (case-insensitive).
   * @param xiRandom - randomness for policies that need it.
   * @param xiThreshold - stay threshold for the heuristic policy.
   *
   * @return the policy.
   * @throws IllegalArgumentException if the name is unknown.
   */
  public static IPlayoutPolicy create(String xiName, Random xiRandom, int xiThreshold)
  {
    if (xiName != null)
    {
      String lName = xiName.trim().toLowerCase();
      if (RANDOM.equals(lName))
      {
        return new PlayoutPolicyRandom(xiRandom);
      }
      if (HEURISTIC.equals(lName) || "threshold".equals(lName))
      {
        return new PlayoutPolicyThreshold(xiThreshold);
      }
    }
    throw new IllegalArgumentException("Unknown policy '" + xiName + "' - expected '" + RANDOM + "' or '" +
                                       HEURISTIC + "'");
  }
}
