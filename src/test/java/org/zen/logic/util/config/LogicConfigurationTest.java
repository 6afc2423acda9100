package org.zen.logic.util.config;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.After;
import org.junit.Test;
import org.zen.logic.util.config.LogicConfiguration.CfgItem;

public class LogicConfigurationTest
{
  @After
  public void tearDown()
  {
    LogicConfiguration.utOverrideCfgVal(CfgItem.TRUTH_TABLE_MAX_VARIABLES, null);
    LogicConfiguration.utOverrideCfgVal(CfgItem.SEED_FOUNDATIONAL_AXIOMS, null);
    System.clearProperty("zen.logic.VERIFICATION_TARGET_MILLIS");
  }

  @Test
  public void testDefaults()
  {
    assertEquals(1000, LogicConfiguration.getCfgInt(CfgItem.VERIFICATION_TARGET_MILLIS));
    assertTrue(LogicConfiguration.getCfgBool(CfgItem.SEED_FOUNDATIONAL_AXIOMS));
    assertEquals(16, LogicConfiguration.getCfgInt(CfgItem.TRUTH_TABLE_MAX_VARIABLES));
    assertEquals("5000", LogicConfiguration.getCfgStr(CfgItem.BOUNDED_VERIFY_TIMEOUT_MILLIS));
  }

  @Test
  public void testOverride()
  {
    LogicConfiguration.utOverrideCfgVal(CfgItem.TRUTH_TABLE_MAX_VARIABLES, " 4 ");
    LogicConfiguration.utOverrideCfgVal(CfgItem.SEED_FOUNDATIONAL_AXIOMS, "false");
    assertEquals(4, LogicConfiguration.getCfgInt(CfgItem.TRUTH_TABLE_MAX_VARIABLES));
    assertFalse(LogicConfiguration.getCfgBool(CfgItem.SEED_FOUNDATIONAL_AXIOMS));

    LogicConfiguration.utOverrideCfgVal(CfgItem.TRUTH_TABLE_MAX_VARIABLES, null);
    assertEquals(16, LogicConfiguration.getCfgInt(CfgItem.TRUTH_TABLE_MAX_VARIABLES));
  }

  @Test
  public void testSystemPropertyWins()
  {
    System.setProperty("zen.logic.VERIFICATION_TARGET_MILLIS", "250");
    assertEquals(250, LogicConfiguration.getCfgInt(CfgItem.VERIFICATION_TARGET_MILLIS));
  }
}
