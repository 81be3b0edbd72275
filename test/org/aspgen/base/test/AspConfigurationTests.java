package org.aspgen.base.test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.aspgen.base.util.asp.compose.ProgramComposer;
import org.aspgen.base.util.asp.program.Program;
import org.aspgen.base.util.config.AspConfiguration;
import org.aspgen.base.util.config.AspConfiguration.CfgItem;
import org.aspgen.base.util.solver.MessageLevel;
import org.aspgen.base.util.solver.SolveSettings;
import org.junit.After;
import org.junit.Test;

public class AspConfigurationTests
{
  @After
  public void tearDown()
  {
    for (CfgItem lItem : CfgItem.values())
    {
      AspConfiguration.utOverrideCfgVal(lItem, null);
    }
    AspConfiguration.utOverrideRawVal("MAX_MODEL", null);
  }

  @Test
  public void testDefaults()
  {
    assertEquals("clingo", AspConfiguration.getCfgStr(CfgItem.CLINGO_EXECUTABLE));
    assertEquals(1000, AspConfiguration.getCfgInt(CfgItem.MAX_MODELS));
    assertEquals(0, AspConfiguration.getCfgInt(CfgItem.SOLVE_TIMEOUT_SECONDS));
    assertEquals(5, AspConfiguration.getCfgInt(CfgItem.PROCESS_GRACE_SECONDS));
    assertEquals("Rules", AspConfiguration.getCfgStr(CfgItem.DEFAULT_SEGMENT));
    assertTrue(AspConfiguration.logConfig().isEmpty());
  }

  @Test
  public void testUnknownKeysReported()
  {
    AspConfiguration.utOverrideRawVal("MAX_MODEL", "5");
    assertEquals(Arrays.asList("MAX_MODEL"), AspConfiguration.logConfig());
  }

  @Test
  public void testSolveSettingsFollowConfiguration()
  {
    AspConfiguration.utOverrideCfgVal(CfgItem.MAX_MODELS, 7);
    AspConfiguration.utOverrideCfgVal(CfgItem.SOLVE_TIMEOUT_SECONDS, 30);
    AspConfiguration.utOverrideCfgVal(CfgItem.STOP_ON_MESSAGE_LEVEL, "error");

    SolveSettings lSettings = SolveSettings.fromConfiguration();
    assertEquals(0, lSettings.getMaxModels());
    assertEquals(7, lSettings.getEffectiveMaxModels());
    assertEquals(30, lSettings.getTimeoutSeconds());
    assertEquals(MessageLevel.ERROR, lSettings.getStopOnLevel());
    assertEquals(2, lSettings.withMaxModels(2).getEffectiveMaxModels());
  }

  @Test
  public void testDefaultSegmentName()
  {
    AspConfiguration.utOverrideCfgVal(CfgItem.DEFAULT_SEGMENT, "Base");
    assertEquals("Base", new ProgramComposer("Configured").getProgram().getDefaultSegment());
  }

  @Test
  public void testProgramDefaultSegmentIgnoresConfiguration()
  {
    AspConfiguration.utOverrideCfgVal(CfgItem.DEFAULT_SEGMENT, "Base");
    assertEquals(Program.DEFAULT_SEGMENT, new Program().getDefaultSegment());
    assertEquals("Rules", new Program("Header").getDefaultSegment());
    assertEquals("Grid", new Program(null, "Grid").getDefaultSegment());
  }

  @Test(expected=IllegalArgumentException.class)
  public void testBlankDefaultSegment()
  {
    new Program(null, " ");
  }

  @Test(expected=IllegalArgumentException.class)
  public void testNegativeTimeout()
  {
    SolveSettings.fromConfiguration().withTimeoutSeconds(-1);
  }
}
