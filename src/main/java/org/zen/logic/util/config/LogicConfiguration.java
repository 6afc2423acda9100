package org.zen.logic.util.config;

import java.net.URL;
import java.util.Iterator;

import org.apache.commons.configuration.AbstractConfiguration;
import org.apache.commons.configuration.BaseConfiguration;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.PropertiesConfiguration;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Class giving access to logic-system configuration.
 *
 * Values are looked up, in order, in system properties named <code>zen.logic.&lt;ITEM&gt;</code>, in
 * <code>zen-logic.properties</code> on the classpath and finally in the defaults below.
 */
public class LogicConfiguration
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Available configuration items.
   */
  public static enum CfgItem
  {
    /**
     * Advisory verification time, in milliseconds.  Slower verifications are logged, never failed.
     */
    VERIFICATION_TARGET_MILLIS(1000),

    /**
     * Whether init() seeds the laws of excluded middle and non-contradiction.
     */
    SEED_FOUNDATIONAL_AXIOMS(true),

    /**
     * Largest number of distinct propositions a truth table may range over.
     */
    TRUTH_TABLE_MAX_VARIABLES(16),

    /**
     * Default deadline, in milliseconds, for a bounded verification.
     */
    BOUNDED_VERIFY_TIMEOUT_MILLIS(5000);

    /**
     * Default value, as a string.
     */
    public final String mDefault;

    private CfgItem(int xiDefault)
    {
      mDefault = "" + xiDefault;
    }

    private CfgItem(boolean xiDefault)
    {
      mDefault = xiDefault ? "true" : "false";
    }
  }

  private static final String PROPS_FILE             = "zen-logic.properties";
  private static final String SYSTEM_PROPERTY_PREFIX = "zen.logic.";

  private static final AbstractConfiguration CONFIGURATION = load();

  private static AbstractConfiguration load()
  {
    URL lPropsUrl = LogicConfiguration.class.getClassLoader().getResource(PROPS_FILE);
    if (lPropsUrl == null)
    {
      LOGGER.debug("No " + PROPS_FILE + " on the classpath - using defaults");
      return new BaseConfiguration();
    }

    try
    {
      return new PropertiesConfiguration(lPropsUrl);
    }
    catch (ConfigurationException lEx)
    {
      LOGGER.warn("Invalid logic configuration in " + lPropsUrl + " - using defaults", lEx);
      return new BaseConfiguration();
    }
  }

  /**
   * @return the specified String configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   */
  public static String getCfgStr(CfgItem xiKey)
  {
    String lOverride = System.getProperty(SYSTEM_PROPERTY_PREFIX + xiKey.toString());
    if (lOverride != null)
    {
      return lOverride.trim();
    }

    synchronized (CONFIGURATION)
    {
      return CONFIGURATION.getString(xiKey.toString(), xiKey.mDefault).trim();
    }
  }

  /**
   * @return the specified integer configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   */
  public static int getCfgInt(CfgItem xiKey)
  {
    return Integer.parseInt(getCfgStr(xiKey));
  }

  /**
   * @return the specified boolean configuration value, or the default if not configured.
   *
   * @param xiKey - the item.
   */
  public static boolean getCfgBool(CfgItem xiKey)
  {
    return Boolean.parseBoolean(getCfgStr(xiKey));
  }

  /**
   * Log all configuration loaded from file.
   */
  public static void logConfig()
  {
    LOGGER.info("Running with logic-system properties:");
    synchronized (CONFIGURATION)
    {
      Iterator<String> lKeys = CONFIGURATION.getKeys();
      while (lKeys.hasNext())
      {
        String lKey = lKeys.next();

        // Check that this is a known configuration parameter (and not a typo in the config file).
        try
        {
          CfgItem lItem = CfgItem.valueOf(lKey);
          LOGGER.info("\t" + lKey + " = " + CONFIGURATION.getString(lKey) + " (default: " + lItem.mDefault + ")");
        }
        catch (IllegalArgumentException lEx)
        {
          LOGGER.warn("Unknown configuration parameter: '" + lKey + "'");
        }
      }
    }
  }

  /**
   * UT-only method for overriding configuration.
   *
   * @param xiKey - the property to override.
   * @param xiValue - the new value, or null to fall back to the default.
   */
  public static void utOverrideCfgVal(CfgItem xiKey, String xiValue)
  {
    synchronized (CONFIGURATION)
    {
      if (xiValue == null)
      {
        CONFIGURATION.clearProperty(xiKey.toString());
      }
      else
      {
        CONFIGURATION.setProperty(xiKey.toString(), xiValue);
      }
    }
  }
}
