package org.tsumego.util.configuration;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map.Entry;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Class giving access to machine-specific configuration.
 *
 * Configuration is read from the properties file named by the "tsumego.cfg" system property or, if that isn't set,
 * from data/cfg/&lt;computer name&gt;.properties.  Anything not configured takes its default.
 */
public class SolverConfiguration
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * System property naming the configuration file.
   */
  public static final String CONFIG_FILE_PROPERTY = "tsumego.cfg";

  /**
   * Available configuration items.
   */
  public static enum CfgItem
  {
    /**
     * Path of the oracle executable.
     */
    ORACLE_EXECUTABLE("NCTU6/exec"),

    /**
     * Directory to run the oracle in.  By default, the directory containing the executable.
     */
    ORACLE_WORKING_DIR(null),

    /**
     * Time, in milliseconds, after which an oracle evaluation is abandoned.
     */
    ORACLE_TIMEOUT((int)TimeUnit.MINUTES.toMillis(1)),

    /**
     * The number of threads available for asynchronous oracle evaluations.
     */
    ORACLE_THREADS(4),

    /**
     * The default simulation budget for a solve.
     */
    SIMULATIONS(100),

    /**
     * The UCT exploration constant.
     */
    EXPLORATION_CONSTANT(Math.sqrt(2)),

    /**
     * Whether each simulation also re-evaluates the parent of the selected leaf, excluding the moves already there,
     * to widen the search near the root.
     */
    WIDEN_PARENT(false),

    /**
     * The maximum number of simulations with oracle evaluations in flight at once.  1 means fully synchronous.
     */
    MAX_IN_FLIGHT(1),

    /**
     * What to do when an oracle evaluation fails - ABORT or SKIP.
     */
    FAILURE_POLICY("ABORT"),

    /**
     * Whether to pre-size the node pool before parsing a record.
     */
    PRESIZE_NODE_POOL(true);

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

    private CfgItem(double xiDefault)
    {
      mDefault = "" + xiDefault;
    }

    private CfgItem(boolean xiDefault)
    {
      mDefault = xiDefault ? "true" : "false";
    }
  }

  private static final Properties MACHINE_PROPERTIES = new Properties();
  static
  {
    String lFileName = System.getProperty(CONFIG_FILE_PROPERTY);

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

    if (lFileName != null)
    {
      try (InputStream lPropStream = new FileInputStream(lFileName))
      {
        MACHINE_PROPERTIES.load(lPropStream);
      }
      catch (IOException lEx)
      {
        LOGGER.debug("No machine-specific configuration in " + lFileName + " - using defaults");
      }
    }
    else
    {
      LOGGER.debug("Failed to identify computer name - using default configuration");
    }
  }

  /**
   * @return the specified String configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   */
  public static String getCfgStr(CfgItem xiKey)
  {
    return (MACHINE_PROPERTIES.getProperty(xiKey.toString(), xiKey.mDefault));
  }

  /**
   * @return the specified integer configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   */
  public static int getCfgInt(CfgItem xiKey)
  {
    return Integer.parseInt(getCfgStr(xiKey).trim());
  }

  /**
   * @return the specified floating point configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   */
  public static double getCfgDouble(CfgItem xiKey)
  {
    return Double.parseDouble(getCfgStr(xiKey).trim());
  }

  /**
   * @return the specified boolean configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   */
  public static boolean getCfgBool(CfgItem xiKey)
  {
    return Boolean.parseBoolean(getCfgStr(xiKey).trim());
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
   * @param xiKey   - the property to override.
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
