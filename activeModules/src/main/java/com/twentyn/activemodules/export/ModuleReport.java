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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * The ranked module list of one analysis run and a summary of the search that produced it, as written to
 * modules.json.
 */
public class ModuleReport {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  static {
    OBJECT_MAPPER.enable(SerializationFeature.INDENT_OUTPUT);
  }

  @JsonProperty("modules")
  private List<ModuleRecord> modules;

  @JsonProperty("search")
  private SearchSummary search;

  // rule name -> number of modules it rejected
  @JsonProperty("rejections")
  private Map<String, Integer> rejections;

  public ModuleReport(List<ModuleRecord> modules, SearchSummary search, Map<String, Integer> rejections) {
    this.modules = modules;
    this.search = search;
    this.rejections = rejections;
  }

  public List<ModuleRecord> getModules() {
    return modules;
  }

  public SearchSummary getSearch() {
    return search;
  }

  public Map<String, Integer> getRejections() {
    return rejections;
  }

  public void writeToJsonFile(File outputFile) throws IOException {
    try (BufferedWriter writer = new BufferedWriter(new FileWriter(outputFile))) {
      OBJECT_MAPPER.writeValue(writer, this);
    }
  }

  public static class ModuleRecord {
    @JsonProperty("rank")
    private int rank;

    @JsonProperty("seed_id")
    private String seedId;

    @JsonProperty("node_ids")
    private List<String> nodeIds;

    @JsonProperty("edges")
    private List<EnrichedNetwork.EdgeData> edges;

    @JsonProperty("aggregate_score")
    private double aggregateScore;

    @JsonProperty("combined_p_value")
    private double combinedPValue;

    @JsonProperty("reaction_count")
    private int reactionCount;

    @JsonProperty("metabolite_count")
    private int metaboliteCount;

    @JsonProperty("coverage")
    private double coverage;

    @JsonProperty("pruned_count")
    private int prunedCount;

    @JsonProperty("overlap_thresholds")
    private List<Double> overlapThresholds;

    public ModuleRecord(int rank, String seedId, List<String> nodeIds, List<EnrichedNetwork.EdgeData> edges,
                        double aggregateScore, double combinedPValue, int reactionCount, int metaboliteCount,
                        double coverage, int prunedCount, List<Double> overlapThresholds) {
      this.rank = rank;
      this.seedId = seedId;
      this.nodeIds = nodeIds;
      this.edges = edges;
      this.aggregateScore = aggregateScore;
      this.combinedPValue = combinedPValue;
      this.reactionCount = reactionCount;
      this.metaboliteCount = metaboliteCount;
      this.coverage = coverage;
      this.prunedCount = prunedCount;
      this.overlapThresholds = overlapThresholds;
    }

    public int getRank() {
      return rank;
    }

    public String getSeedId() {
      return seedId;
    }

    public List<String> getNodeIds() {
      return nodeIds;
    }

    public List<EnrichedNetwork.EdgeData> getEdges() {
      return edges;
    }

    public double getAggregateScore() {
      return aggregateScore;
    }

    public double getCombinedPValue() {
      return combinedPValue;
    }

    public int getReactionCount() {
      return reactionCount;
    }

    public int getMetaboliteCount() {
      return metaboliteCount;
    }

    public double getCoverage() {
      return coverage;
    }

    public int getPrunedCount() {
      return prunedCount;
    }

    public List<Double> getOverlapThresholds() {
      return overlapThresholds;
    }
  }

  public static class SearchSummary {
    @JsonProperty("searches")
    private int searches;

    @JsonProperty("candidates")
    private int candidates;

    @JsonProperty("incomplete_searches")
    private int incompleteSearches;

    @JsonProperty("budget_exhausted")
    private boolean budgetExhausted;

    @JsonProperty("thresholds")
    private List<ThresholdSummary> thresholds;

    @JsonProperty("failures")
    private List<FailureRecord> failures;

    public SearchSummary(int searches, int candidates, int incompleteSearches, boolean budgetExhausted,
                         List<ThresholdSummary> thresholds, List<FailureRecord> failures) {
      this.searches = searches;
      this.candidates = candidates;
      this.incompleteSearches = incompleteSearches;
      this.budgetExhausted = budgetExhausted;
      this.thresholds = thresholds;
      this.failures = failures;
    }

    public int getSearches() {
      return searches;
    }

    public int getCandidates() {
      return candidates;
    }

    public int getIncompleteSearches() {
      return incompleteSearches;
    }

    public boolean isBudgetExhausted() {
      return budgetExhausted;
    }

    public List<ThresholdSummary> getThresholds() {
      return thresholds;
    }

    public List<FailureRecord> getFailures() {
      return failures;
    }
  }

  public static class ThresholdSummary {
    @JsonProperty("overlap_threshold")
    private double overlapThreshold;

    @JsonProperty("accepted")
    private int accepted;

    @JsonProperty("budget_exhausted")
    private boolean budgetExhausted;

    public ThresholdSummary(double overlapThreshold, int accepted, boolean budgetExhausted) {
      this.overlapThreshold = overlapThreshold;
      this.accepted = accepted;
      this.budgetExhausted = budgetExhausted;
    }

    public double getOverlapThreshold() {
      return overlapThreshold;
    }

    public int getAccepted() {
      return accepted;
    }

    public boolean isBudgetExhausted() {
      return budgetExhausted;
    }
  }

  public static class FailureRecord {
    @JsonProperty("seed_id")
    private String seedId;

    @JsonProperty("restart")
    private int restart;

    @JsonProperty("message")
    private String message;

    public FailureRecord(String seedId, int restart, String message) {
      this.seedId = seedId;
      this.restart = restart;
      this.message = message;
    }

    public String getSeedId() {
      return seedId;
    }

    public int getRestart() {
      return restart;
    }

    public String getMessage() {
      return message;
    }
  }
}
