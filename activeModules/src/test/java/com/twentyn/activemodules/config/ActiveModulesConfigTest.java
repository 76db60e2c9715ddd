/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.activemodules.config;

import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ActiveModulesConfigTest {

  private File tempDir;

  @Before
  public void setUp() throws IOException {
    tempDir = Files.createTempDirectory("active-modules-config-test").toFile();
  }

  @After
  public void tearDown() throws IOException {
    FileUtils.deleteDirectory(tempDir);
  }

  private File writeConfig(String json) throws IOException {
    File file = new File(tempDir, "config.json");
    FileUtils.writeStringToFile(file, json, StandardCharsets.UTF_8);
    return file;
  }

  private void assertRejected(ActiveModulesConfig config, String parameter) {
    try {
      config.validate();
      fail("Configuration should be rejected for " + parameter);
    } catch (ConfigurationException e) {
      assertEquals("Exception should name the parameter", parameter, e.getParameter());
    }
  }

  @Test
  public void testDefaults() {
    ActiveModulesConfig config = new ActiveModulesConfig();
    config.validate();

    assertEquals(Integer.valueOf(10), config.getSearch().getTargetModuleCount());
    assertEquals(Arrays.asList(0.25, 0.5, 0.75), config.getSearch().getOverlapThresholds());
    assertEquals(Integer.valueOf(2), config.getSearch().getMaxDepth());
    assertTrue(config.getSearch().getSizeAdjustment());
    assertTrue(config.getSearch().getRegionalScoring());
    assertNull("Seeds default to every metabolite", config.getSearch().getSeedIds());
    assertEquals(Integer.valueOf(1), config.getSelection().getMinReactions());
    assertEquals(Integer.valueOf(3), config.getSelection().getMaxReactions());
    assertEquals(0.5, config.getSelection().getMinCoverage(), 0.0);
    assertEquals(0.05, config.getSelection().getSignificanceCutoff(), 0.0);
    assertEquals(0.25, config.getSelection().getContextCutoff(), 0.0);
    assertEquals(FoldChangeScale.LOG2, config.getScoring().getFoldChangeScale());
    assertEquals("Unlisted studies weigh 1", 1.0, config.getScoring().getStudyWeight("any"), 0.0);
  }

  @Test
  public void testReadPartialFile() throws Exception {
    // Arrange
    File file = writeConfig("{\"search\": {\"target_module_count\": 5, \"overlap_thresholds\": [0.5], " +
        "\"max_depth\": 3}, \"scoring\": {\"fold_change_scale\": \"RATIO\", \"study_weights\": {\"s1\": 2.0}}}");

    // Act
    ActiveModulesConfig config = ActiveModulesConfig.readFromJsonFile(file);

    // Assert
    assertEquals(Integer.valueOf(5), config.getSearch().getTargetModuleCount());
    assertEquals(Collections.singletonList(0.5), config.getSearch().getOverlapThresholds());
    assertEquals(Integer.valueOf(3), config.getSearch().getMaxDepth());
    assertEquals(FoldChangeScale.RATIO, config.getScoring().getFoldChangeScale());
    assertEquals(2.0, config.getScoring().getStudyWeight("s1"), 0.0);
    assertEquals("Absent sections keep their defaults", Integer.valueOf(3), config.getSelection().getMaxReactions());
  }

  @Test
  public void testWrittenConfigReadsBack() throws Exception {
    ActiveModulesConfig config = new ActiveModulesConfig();
    config.getSearch().setSeedIds(Arrays.asList("m1", "m2"));
    config.getSelection().setMinCoverage(0.75);
    File file = new File(tempDir, "written.json");

    config.writeToJsonFile(file);
    ActiveModulesConfig read = ActiveModulesConfig.readFromJsonFile(file);

    assertEquals(Arrays.asList("m1", "m2"), read.getSearch().getSeedIds());
    assertEquals(0.75, read.getSelection().getMinCoverage(), 0.0);
  }

  @Test
  public void testOutOfRangeFileValueRejected() throws Exception {
    File file = writeConfig("{\"search\": {\"target_module_count\": 0}}");
    try {
      ActiveModulesConfig.readFromJsonFile(file);
      fail("K of 0 should be rejected");
    } catch (ConfigurationException e) {
      assertEquals("search.target_module_count", e.getParameter());
    }
  }

  @Test
  public void testUnknownOptionRejected() throws Exception {
    File file = writeConfig("{\"search\": {\"max_dpeth\": 2}}");
    try {
      ActiveModulesConfig.readFromJsonFile(file);
      fail("A misspelled option should be rejected");
    } catch (ConfigurationException e) {
      assertEquals("max_dpeth", e.getParameter());
    }
  }

  @Test(expected = IOException.class)
  public void testMissingFileRejected() throws Exception {
    ActiveModulesConfig.readFromJsonFile(new File(tempDir, "absent.json"));
  }

  @Test
  public void testSearchRanges() {
    ActiveModulesConfig config = new ActiveModulesConfig();
    config.getSearch().setTargetModuleCount(26);
    assertRejected(config, "search.target_module_count");

    config = new ActiveModulesConfig();
    config.getSearch().setMaxDepth(0);
    assertRejected(config, "search.max_depth");

    config = new ActiveModulesConfig();
    config.getSearch().setOverlapThresholds(Collections.emptyList());
    assertRejected(config, "search.overlap_thresholds");

    config = new ActiveModulesConfig();
    config.getSearch().setOverlapThresholds(Arrays.asList(0.5, 1.5));
    assertRejected(config, "search.overlap_thresholds");

    config = new ActiveModulesConfig();
    config.getSearch().setNumThreads(0);
    assertRejected(config, "search.num_threads");

    config = new ActiveModulesConfig();
    config.getSearch().setTimeBudgetMillis(-1L);
    assertRejected(config, "search.time_budget_millis");

    config = new ActiveModulesConfig();
    config.getSearch().setSeedIds(Collections.emptyList());
    assertRejected(config, "search.seed_ids");
  }

  @Test
  public void testInvertedReactionBoundsRejected() {
    ActiveModulesConfig config = new ActiveModulesConfig();
    config.getSelection().setMinReactions(4);
    config.getSelection().setMaxReactions(2);
    assertRejected(config, "selection.min_reactions");
  }

  @Test
  public void testSelectionCutoffsRejected() {
    ActiveModulesConfig config = new ActiveModulesConfig();
    config.getSelection().setMinCoverage(1.1);
    assertRejected(config, "selection.min_coverage");

    config = new ActiveModulesConfig();
    config.getSelection().setSignificanceCutoff(0.0);
    assertRejected(config, "selection.significance_cutoff");

    config = new ActiveModulesConfig();
    config.getSelection().setContextCutoff(null);
    assertRejected(config, "selection.context_cutoff");
  }

  @Test
  public void testBadStudyWeightRejected() {
    ActiveModulesConfig config = new ActiveModulesConfig();
    config.getScoring().setStudyWeights(Collections.singletonMap("s1", -1.0));
    assertRejected(config, "scoring.study_weights.s1");
  }

  @Test
  public void testRatioScaleConversion() {
    assertEquals(3.0, FoldChangeScale.RATIO.toLog2(8.0), 1e-12);
    assertEquals(-0.7, FoldChangeScale.LOG2.toLog2(-0.7), 0.0);
    assertFalse("Log2 scale accepts negative values", Double.isNaN(FoldChangeScale.LOG2.toLog2(-3.0)));
  }
}
