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

package com.twentyn.activemodules.export;

import com.twentyn.activemodules.config.ScoringConfig;
import com.twentyn.activemodules.config.SearchConfig;
import com.twentyn.activemodules.network.BipartiteNetwork;
import com.twentyn.activemodules.network.NetworkBuilder;
import com.twentyn.activemodules.network.NetworkNode;
import com.twentyn.activemodules.scoring.CompositeScoreTable;
import com.twentyn.activemodules.scoring.SignificanceScorer;
import com.twentyn.activemodules.search.Module;
import com.twentyn.activemodules.search.ModuleScorer;
import com.twentyn.activemodules.search.PooledSearchResult;
import com.twentyn.activemodules.search.SearchResult;
import com.twentyn.activemodules.search.SeedFailure;
import com.twentyn.activemodules.selection.SelectedModule;
import com.twentyn.activemodules.selection.SelectionResult;
import com.twentyn.activemodules.selection.SelectionRule;
import com.twentyn.activemodules.utils.TSVParser;
import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class ResultExporterTest {

  private File tempDir;
  private BipartiteNetwork network;
  private CompositeScoreTable scores;

  @Before
  public void setUp() throws IOException {
    tempDir = Files.createTempDirectory("active-modules-export-test").toFile();
    network = new NetworkBuilder()
        .addMetabolite("m1").addMetabolite("m2").addMetabolite("m3").addReaction("r1").addReaction("r2")
        .addEdge("m1", "r1").addEdge("r1", "m2").addEdge("m2", "r2").addEdge("r2", "m3")
        .addMeasurement("m1", "s1", 1.5, 0.01)
        .addMeasurement("m1", "s2", 0.5, 0.2)
        .addMeasurement("m2", "s1", -2.5, 0.001)
        .build();
    scores = new SignificanceScorer(new ScoringConfig()).scoreNetwork(network);
  }

  @After
  public void tearDown() throws IOException {
    FileUtils.deleteDirectory(tempDir);
  }

  @Test
  public void testEnrichedNetworkReadsBackAsSameNetwork() throws Exception {
    // Arrange
    EnrichedNetwork enriched = ResultExporter.enrichNetwork(network, scores);
    File file = new File(tempDir, ResultExporter.NETWORK_FILE_NAME);

    // Act
    ResultExporter.writeNetwork(enriched, file);
    BipartiteNetwork read = EnrichedNetwork.readFromJsonFile(file).toNetwork();

    // Assert
    assertEquals("Nodes and their measurements survive export",
        new HashSet<>(network.getNodes()), new HashSet<>(read.getNodes()));
    assertEquals("Edges survive export", new HashSet<>(network.getEdges()), new HashSet<>(read.getEdges()));
    for (NetworkNode node : network.getNodes()) {
      assertEquals(node.getMeasurements(), read.getNodeById(node.getId()).getMeasurements());
    }
  }

  @Test
  public void testNodeDataCarriesCompositeScores() {
    EnrichedNetwork enriched = ResultExporter.enrichNetwork(network, scores);

    EnrichedNetwork.NodeData m1 = null;
    EnrichedNetwork.NodeData r1 = null;
    for (EnrichedNetwork.NodeElement element : enriched.getElements().getNodes()) {
      if ("m1".equals(element.getData().getId())) {
        m1 = element.getData();
      } else if ("r1".equals(element.getData().getId())) {
        r1 = element.getData();
      }
    }

    assertEquals(scores.getScore("m1").getZScore(), m1.getCompositeZ(), 0.0);
    assertEquals(1.0, m1.getCompositeFoldChange(), 1e-12);
    assertEquals(2, m1.getContributingStudies());
    assertEquals(2, m1.getStudies().size());
    assertTrue("Reactions are exported as missing", r1.isMissing());
    assertNull(r1.getCompositeZ());
    assertTrue(r1.getStudies().isEmpty());
    assertEquals(4, enriched.getElements().getEdges().size());
  }

  @Test
  public void testSummaryCoversAllMeasurements() {
    EnrichedNetwork.Summary summary = ResultExporter.enrichNetwork(network, scores).getSummary();

    assertEquals(Arrays.asList("s1", "s2"), summary.getStudyIds());
    assertEquals(-2.5, summary.getFoldChangeMin(), 0.0);
    assertEquals(1.5, summary.getFoldChangeMax(), 0.0);
    assertEquals(-3.0, summary.getPValueLogMin(), 1e-12);
  }

  @Test
  public void testSummaryOfUnmeasuredNetworkIsEmpty() {
    BipartiteNetwork bare = new NetworkBuilder().addMetabolite("m1").build();

    EnrichedNetwork.Summary summary = ResultExporter.enrichNetwork(bare,
        new SignificanceScorer(new ScoringConfig()).scoreNetwork(bare)).getSummary();

    assertTrue(summary.getStudyIds().isEmpty());
    assertNull(summary.getFoldChangeMin());
    assertNull(summary.getPValueLogMin());
  }

  private SelectedModule selectedModule() {
    ModuleScorer scorer = new ModuleScorer(network, scores, new SearchConfig());
    Module module = scorer.createModule("m1", new HashSet<>(Arrays.asList("m1", "r1", "m2")));
    return new SelectedModule(module, 1.0, 2, new TreeSet<>(Arrays.asList(0.25, 0.5)), 1);
  }

  @Test
  public void testModulesTSV() throws Exception {
    // Arrange
    SelectedModule selected = selectedModule();
    File file = new File(tempDir, ResultExporter.MODULES_TSV_FILE_NAME);

    // Act
    ResultExporter.writeModulesTSV(Collections.singletonList(selected), file);

    // Assert
    TSVParser parser = new TSVParser(file.getName());
    parser.parse(file);
    parser.verifyColumns(ResultExporter.TSV_HEADER);
    List<TSVParser.Row> rows = parser.getResults();
    assertEquals(1, rows.size());
    TSVParser.Row row = rows.get(0);
    assertEquals("1", row.getRequired(ResultExporter.RANK));
    assertEquals("m1", row.getRequired(ResultExporter.SEED_ID));
    assertEquals("m1,m2,r1", row.getRequired(ResultExporter.NODE_IDS));
    assertEquals("0.25,0.5", row.getRequired(ResultExporter.OVERLAP_THRESHOLDS));
    assertEquals(selected.getModule().getScore(), row.getDouble(ResultExporter.AGGREGATE_SCORE), 0.0);
    assertEquals("1", row.getRequired(ResultExporter.REACTION_COUNT));
    assertEquals("2", row.getRequired(ResultExporter.PRUNED_COUNT));
  }

  @Test
  public void testReportRecordsModulesAndSearchSummary() throws Exception {
    // Arrange
    SelectedModule selected = selectedModule();
    Map<SelectionRule, Integer> rejections = new EnumMap<>(SelectionRule.class);
    rejections.put(SelectionRule.DIRECTIONALITY, 4);
    SelectionResult selection = new SelectionResult(Collections.singletonList(selected), rejections);
    PooledSearchResult search = new PooledSearchResult(
        Collections.singletonList(new SearchResult(0.5, Collections.singletonList(selected.getModule()), true)),
        3, 2, 1, Collections.singletonList(new SeedFailure("m3", 0, "broken")));

    // Act
    ModuleReport report = ResultExporter.buildReport(selection, search);
    File file = new File(tempDir, ResultExporter.MODULES_JSON_FILE_NAME);
    ResultExporter.writeReport(report, file);

    // Assert
    ModuleReport.ModuleRecord record = report.getModules().get(0);
    assertEquals(Arrays.asList("m1", "m2", "r1"), record.getNodeIds());
    assertEquals(2, record.getEdges().size());
    assertEquals(2, record.getMetaboliteCount());
    assertEquals(Arrays.asList(0.25, 0.5), record.getOverlapThresholds());
    assertEquals(Integer.valueOf(4), report.getRejections().get("directionality"));
    assertEquals(Integer.valueOf(0), report.getRejections().get("size"));
    assertEquals(3, report.getSearch().getSearches());
    assertTrue(report.getSearch().isBudgetExhausted());
    assertEquals("m3", report.getSearch().getFailures().get(0).getSeedId());
    String json = FileUtils.readFileToString(file, "UTF-8");
    assertTrue("Report names its fields in snake case", json.contains("\"combined_p_value\""));
    assertFalse(json.contains("combinedPValue"));
  }
}
