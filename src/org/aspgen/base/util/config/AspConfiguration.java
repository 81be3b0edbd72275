package org.aspgen.base.util.config;

import java.io.File;
import java.net.URL;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.PropertiesConfiguration;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.base.Enums;

/**
 * Class giving access to configuration.
 *
 * Configuration is read from the file named by the <tt>aspgen.config</tt> system property if there is one, or else
 * from <tt>aspgen.properties</tt> on the classpath.  Anything not configured takes the default given by its
 * {@link CfgItem}.
 */
public class AspConfiguration
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Available configuration items.
   */
  public static enum CfgItem
  {
    /**
     * The solver executable to run.  Either a full path or a name to look up on the PATH.
     */
    CLINGO_EXECUTABLE("clingo"),

    /**
     * Maximum number of models to ask the solver for, when the caller asks for "all" of them.
     */
    MAX_MODELS(1000),

    /**
     * Solver time limit, in seconds.  0 for no limit.
     */
    SOLVE_TIMEOUT_SECONDS(0),

    /**
     * Extra time, in seconds, to allow the solver process beyond its own time limit before killing it.
     */
    PROCESS_GRACE_SECONDS(5),

    /**
     * The lowest level of solver message that aborts a solve.
     */
    STOP_ON_MESSAGE_LEVEL("INFO"),

    /**
     * The name of the segment that rules go into when no segment is specified.
     */
    DEFAULT_SEGMENT("Rules");

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

  /**
   * System property naming an explicit configuration file.
   */
  public static final String CONFIG_FILE_PROPERTY = "aspgen.config";

  private static final String DEFAULT_RESOURCE = "aspgen.properties";

  private static final PropertiesConfiguration PROPERTIES = new PropertiesConfiguration();
  static
  {
    PROPERTIES.setDelimiterParsingDisabled(true);

    String lFileName = System.getProperty(CONFIG_FILE_PROPERTY);
    try
    {
      if (lFileName != null)
      {
        PROPERTIES.load(new File(lFileName));
      }
      else
      {
        URL lResource = AspConfiguration.class.getClassLoader().getResource(DEFAULT_RESOURCE);
        if (lResource != null)
        {
          PROPERTIES.load(lResource);
        }
        else
        {
          LOGGER.warn("No " + DEFAULT_RESOURCE + " on the classpath - using default configuration");
        }
      }
    }
    catch (ConfigurationException lEx)
    {
      LOGGER.error("Missing/invalid configuration" + ((lFileName == null) ? "" : " in " + lFileName) +
                   " - using defaults", lEx);
    }

    logConfig();
  }

  /**
   * @return the specified String configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   */
  public static String getCfgStr(CfgItem xiKey)
  {
    return PROPERTIES.getString(xiKey.toString(), xiKey.mDefault);
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
   * Log the effective value of every configuration item, and warn about any configured key that isn't one.
   *
   * Called once when the configuration is loaded.
   *
   * @return the configured keys that don't name a {@link CfgItem}.
   */
  public static List<String> logConfig()
  {
    LOGGER.info("Running with configuration:");
    for (CfgItem lItem : CfgItem.values())
    {
      String lKey = lItem.toString();
      LOGGER.info("\t" + lKey + " = " + getCfgStr(lItem) + (PROPERTIES.containsKey(lKey) ? "" : " (default)"));
    }

    List<String> lUnknown = new ArrayList<>();
    Iterator<String> lKeys = PROPERTIES.getKeys();
    while (lKeys.hasNext())
    {
      String lKey = lKeys.next();
      if (!Enums.getIfPresent(CfgItem.class, lKey).isPresent())
      {
        LOGGER.warn("Unknown configuration parameter: '" + lKey + "'");
        lUnknown.add(lKey);
      }
    }
    return lUnknown;
  }

  /**
   * UT-only method for overriding configuration.
   *
   * @param xiKey - the property to override.
   * @param xiValue - the new value, or null to remove it (so the default applies).
   */
  public static void utOverrideCfgVal(CfgItem xiKey, String xiValue)
  {
    utOverrideRawVal(xiKey.toString(), xiValue);
  }

  /**
   * UT-only method for setting an arbitrary key, including ones that aren't configuration items.
   *
   * @param xiKey - the key.
   * @param xiValue - the new value, or null to remove it.
   */
  public static void utOverrideRawVal(String xiKey, String xiValue)
  {
    if (xiValue == null)
    {
      PROPERTIES.clearProperty(xiKey);
    }
    else
    {
      PROPERTIES.setProperty(xiKey, xiValue);
    }
  }

  /**
   * UT-only method for overriding configuration.
   *
   * @param xiKey - the property to override.
   * @param xiValue - the new value.
   */
  public static void utOverrideCfgVal(CfgItem xiKey, int xiValue)
  {
    utOverrideCfgVal(xiKey, Integer.toString(xiValue));
  }
}
