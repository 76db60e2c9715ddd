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

import com.twentyn.activemodules.network.BipartiteNetwork;
import com.twentyn.activemodules.network.Measurement;
import com.twentyn.activemodules.network.NetworkEdge;
import com.twentyn.activemodules.network.NetworkNode;
import com.twentyn.activemodules.scoring.CompositeScore;
import com.twentyn.activemodules.scoring.CompositeScoreTable;
import com.twentyn.activemodules.search.Module;
import com.twentyn.activemodules.search.PooledSearchResult;
import com.twentyn.activemodules.search.SearchResult;
import com.twentyn.activemodules.search.SeedFailure;
import com.twentyn.activemodules.selection.SelectedModule;
import com.twentyn.activemodules.selection.SelectionResult;
import com.twentyn.activemodules.selection.SelectionRule;
import com.twentyn.activemodules.utils.TSVWriter;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns analysis results into their exported forms.  The build methods are pure transforms of their inputs and
 * never filter anything; the write methods only serialize what they are given.
 */
public class ResultExporter {

  private static final Logger LOGGER = LogManager.getFormatterLogger(ResultExporter.class);

  public static final String NETWORK_FILE_NAME = "network_cytoscape.json";
  public static final String MODULES_JSON_FILE_NAME = "modules.json";
  public static final String MODULES_TSV_FILE_NAME = "modules.tsv";

  public static final String RANK = "rank";
  public static final String SEED_ID = "seed_id";
  public static final String AGGREGATE_SCORE = "aggregate_score";
  public static final String COMBINED_P_VALUE = "combined_p_value";
  public static final String REACTION_COUNT = "reaction_count";
  public static final String METABOLITE_COUNT = "metabolite_count";
  public static final String COVERAGE = "coverage";
  public static final String PRUNED_COUNT = "pruned_count";
  public static final String OVERLAP_THRESHOLDS = "overlap_thresholds";
  public static final String NODE_IDS = "node_ids";

  public static final List<String> TSV_HEADER = Arrays.asList(RANK, SEED_ID, AGGREGATE_SCORE, COMBINED_P_VALUE,
      REACTION_COUNT, METABOLITE_COUNT, COVERAGE, PRUNED_COUNT, OVERLAP_THRESHOLDS, NODE_IDS);

  private static final String LIST_SEPARATOR = ",";

  private ResultExporter() {
  }

  public static EnrichedNetwork enrichNetwork(BipartiteNetwork network, CompositeScoreTable scores) {
    List<EnrichedNetwork.NodeElement> nodes = new ArrayList<>(network.getNodes().size());
    Double foldMin = null;
    Double foldMax = null;
    Double pLogMin = null;
    for (NetworkNode node : network.getNodes()) {
      CompositeScore score = scores.getScore(node.getId());
      boolean missing = score.isMissing();
      nodes.add(new EnrichedNetwork.NodeElement(new EnrichedNetwork.NodeData(
          node.getId(),
          node.getType().getName(),
          missing,
          missing ? null : score.getZScore(),
          missing ? null : score.getPValue(),
          missing ? null : score.getFoldChange(),
          score.getContributingStudies(),
          node.getMeasurements())));

      for (Measurement measurement : node.getMeasurements().values()) {
        double fold = measurement.getFoldChange();
        double pLog = measurement.getPValueLog();
        foldMin = foldMin == null ? fold : Math.min(foldMin, fold);
        foldMax = foldMax == null ? fold : Math.max(foldMax, fold);
        pLogMin = pLogMin == null ? pLog : Math.min(pLogMin, pLog);
      }
    }

    List<EnrichedNetwork.EdgeElement> edges = new ArrayList<>(network.getEdges().size());
    for (NetworkEdge edge : network.getEdges()) {
      edges.add(new EnrichedNetwork.EdgeElement(toEdgeData(edge)));
    }

    EnrichedNetwork.Summary summary = new EnrichedNetwork.Summary(
        new ArrayList<>(network.getStudyIds()), foldMin, foldMax, pLogMin);
    return new EnrichedNetwork(new EnrichedNetwork.Elements(nodes, edges), summary);
  }

  public static ModuleReport buildReport(SelectionResult selection, PooledSearchResult search) {
    List<ModuleReport.ModuleRecord> records = new ArrayList<>(selection.getSelected().size());
    for (SelectedModule selected : selection.getSelected()) {
      records.add(toRecord(selected));
    }

    List<ModuleReport.ThresholdSummary> thresholds = new ArrayList<>();
    for (SearchResult result : search.getThresholdResults()) {
      thresholds.add(new ModuleReport.ThresholdSummary(
          result.getOverlapThreshold(), result.getModules().size(), result.isBudgetExhausted()));
    }
    List<ModuleReport.FailureRecord> failures = new ArrayList<>();
    for (SeedFailure failure : search.getFailures()) {
      failures.add(new ModuleReport.FailureRecord(failure.getSeedId(), failure.getRestartIndex(),
          failure.getMessage()));
    }
    ModuleReport.SearchSummary summary = new ModuleReport.SearchSummary(search.getSearchCount(),
        search.getCandidateCount(), search.getIncompleteSearchCount(), search.isBudgetExhausted(), thresholds,
        failures);

    Map<String, Integer> rejections = new LinkedHashMap<>();
    for (Map.Entry<SelectionRule, Integer> entry : selection.getRejections().entrySet()) {
      rejections.put(entry.getKey().name().toLowerCase(), entry.getValue());
    }
    return new ModuleReport(records, summary, rejections);
  }

  public static ModuleReport.ModuleRecord toRecord(SelectedModule selected) {
    Module module = selected.getModule();
    List<EnrichedNetwork.EdgeData> edges = new ArrayList<>(module.getEdges().size());
    module.getEdges().forEach(e -> edges.add(toEdgeData(e)));
    return new ModuleReport.ModuleRecord(selected.getRank(), module.getSeedId(),
        new ArrayList<>(module.getNodeIds()), edges, module.getScore(), module.getPValue(),
        module.getReactionCount(), module.getMetaboliteCount(), selected.getCoverage(), selected.getPrunedCount(),
        new ArrayList<>(selected.getAcceptingThresholds()));
  }

  public static Map<String, String> toTSVRow(SelectedModule selected) {
    Module module = selected.getModule();
    Map<String, String> row = new HashMap<>();
    row.put(RANK, String.valueOf(selected.getRank()));
    row.put(SEED_ID, module.getSeedId());
    row.put(AGGREGATE_SCORE, String.valueOf(module.getScore()));
    row.put(COMBINED_P_VALUE, String.valueOf(module.getPValue()));
    row.put(REACTION_COUNT, String.valueOf(module.getReactionCount()));
    row.put(METABOLITE_COUNT, String.valueOf(module.getMetaboliteCount()));
    row.put(COVERAGE, String.valueOf(selected.getCoverage()));
    row.put(PRUNED_COUNT, String.valueOf(selected.getPrunedCount()));
    row.put(OVERLAP_THRESHOLDS, StringUtils.join(selected.getAcceptingThresholds(), LIST_SEPARATOR));
    row.put(NODE_IDS, StringUtils.join(module.getNodeIds(), LIST_SEPARATOR));
    return row;
  }

  private static EnrichedNetwork.EdgeData toEdgeData(NetworkEdge edge) {
    return new EnrichedNetwork.EdgeData(edge.getId(), edge.getSource(), edge.getTarget());
  }

  public static void writeModulesTSV(List<SelectedModule> modules, File outputFile) throws IOException {
    try (TSVWriter<String, String> writer = new TSVWriter<>(TSV_HEADER)) {
      writer.open(outputFile);
      for (SelectedModule module : modules) {
        writer.append(toTSVRow(module));
      }
    }
    LOGGER.info("Wrote %d modules to %s", modules.size(), outputFile.getAbsolutePath());
  }

  public static void writeNetwork(EnrichedNetwork network, File outputFile) throws IOException {
    network.writeToJsonFile(outputFile);
    LOGGER.info("Wrote enriched network with %d nodes to %s",
        network.getElements().getNodes().size(), outputFile.getAbsolutePath());
  }

  public static void writeReport(ModuleReport report, File outputFile) throws IOException {
    report.writeToJsonFile(outputFile);
    LOGGER.info("Wrote module report to %s", outputFile.getAbsolutePath());
  }
}
