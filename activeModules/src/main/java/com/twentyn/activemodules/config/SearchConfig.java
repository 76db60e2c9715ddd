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

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Parameters of the module search.  Defaults reproduce the three-threshold sweep at depth 2.
 */
public class SearchConfig {

  public static final int MIN_TARGET_MODULE_COUNT = 5;
  public static final int MAX_TARGET_MODULE_COUNT = 25;
  public static final int MAX_DEPTH_LIMIT = 10;
  public static final int MAX_RESTARTS_PER_SEED = 100;
  public static final List<Double> DEFAULT_OVERLAP_THRESHOLDS = Arrays.asList(0.25, 0.50, 0.75);

  // Upper bound on modules accepted per threshold run.
  @JsonProperty("target_module_count")
  private Integer targetModuleCount = 10;

  // Each value runs its own acceptance pass; the accepted modules of all passes are pooled.
  @JsonProperty("overlap_thresholds")
  private List<Double> overlapThresholds = new ArrayList<>(DEFAULT_OVERLAP_THRESHOLDS);

  // Bounds both the neighborhood of an expansion step and the regional scoring window.
  @JsonProperty("max_depth")
  private Integer maxDepth = 2;

  @JsonProperty("size_adjustment")
  private Boolean sizeAdjustment = true;

  @JsonProperty("regional_scoring")
  private Boolean regionalScoring = true;

  @JsonProperty("restarts_per_seed")
  private Integer restartsPerSeed = 0;

  @JsonProperty("random_seed")
  private Long randomSeed = 42L;

  // Hill-climbing steps allowed per search before it stops with its best-so-far module.
  @JsonProperty("max_iterations")
  private Integer maxIterations = 1000;

  // Wall-clock budget for the whole exploration phase; 0 means unbounded.
  @JsonProperty("time_budget_millis")
  private Long timeBudgetMillis = 0L;

  @JsonProperty("num_threads")
  private Integer numThreads = Runtime.getRuntime().availableProcessors();

  // Explicit seeds; when absent every metabolite node is a seed.
  @JsonProperty("seed_ids")
  private List<String> seedIds = null;

  @JsonProperty("main_component_only")
  private Boolean mainComponentOnly = false;

  public SearchConfig() {
  }

  public Integer getTargetModuleCount() {
    return targetModuleCount;
  }

  public void setTargetModuleCount(Integer targetModuleCount) {
    this.targetModuleCount = targetModuleCount;
  }

  public List<Double> getOverlapThresholds() {
    return overlapThresholds;
  }

  public void setOverlapThresholds(List<Double> overlapThresholds) {
    this.overlapThresholds = overlapThresholds;
  }

  public Integer getMaxDepth() {
    return maxDepth;
  }

  public void setMaxDepth(Integer maxDepth) {
    this.maxDepth = maxDepth;
  }

  public Boolean getSizeAdjustment() {
    return sizeAdjustment;
  }

  public void setSizeAdjustment(Boolean sizeAdjustment) {
    this.sizeAdjustment = sizeAdjustment;
  }

  public Boolean getRegionalScoring() {
    return regionalScoring;
  }

  public void setRegionalScoring(Boolean regionalScoring) {
    this.regionalScoring = regionalScoring;
  }

  public Integer getRestartsPerSeed() {
    return restartsPerSeed;
  }

  public void setRestartsPerSeed(Integer restartsPerSeed) {
    this.restartsPerSeed = restartsPerSeed;
  }

  public Long getRandomSeed() {
    return randomSeed;
  }

  public void setRandomSeed(Long randomSeed) {
    this.randomSeed = randomSeed;
  }

  public Integer getMaxIterations() {
    return maxIterations;
  }

  public void setMaxIterations(Integer maxIterations) {
    this.maxIterations = maxIterations;
  }

  public Long getTimeBudgetMillis() {
    return timeBudgetMillis;
  }

  public void setTimeBudgetMillis(Long timeBudgetMillis) {
    this.timeBudgetMillis = timeBudgetMillis;
  }

  public Integer getNumThreads() {
    return numThreads;
  }

  public void setNumThreads(Integer numThreads) {
    this.numThreads = numThreads;
  }

  public List<String> getSeedIds() {
    return seedIds;
  }

  public void setSeedIds(List<String> seedIds) {
    this.seedIds = seedIds;
  }

  public Boolean getMainComponentOnly() {
    return mainComponentOnly;
  }

  public void setMainComponentOnly(Boolean mainComponentOnly) {
    this.mainComponentOnly = mainComponentOnly;
  }

  public void validate() {
    requireInRange("search.target_module_count", targetModuleCount, MIN_TARGET_MODULE_COUNT,
        MAX_TARGET_MODULE_COUNT);
    if (overlapThresholds == null || overlapThresholds.isEmpty()) {
      throw new ConfigurationException("search.overlap_thresholds", "at least one threshold is required");
    }
    for (Double threshold : overlapThresholds) {
      if (threshold == null || threshold.isNaN() || threshold < 0.0 || threshold > 1.0) {
        throw new ConfigurationException("search.overlap_thresholds",
            "each threshold must lie in [0, 1], got " + threshold);
      }
    }
    requireInRange("search.max_depth", maxDepth, 1, MAX_DEPTH_LIMIT);
    requireNonNull("search.size_adjustment", sizeAdjustment);
    requireNonNull("search.regional_scoring", regionalScoring);
    requireInRange("search.restarts_per_seed", restartsPerSeed, 0, MAX_RESTARTS_PER_SEED);
    requireNonNull("search.random_seed", randomSeed);
    requireInRange("search.max_iterations", maxIterations, 1, Integer.MAX_VALUE);
    requireNonNull("search.time_budget_millis", timeBudgetMillis);
    if (timeBudgetMillis < 0) {
      throw new ConfigurationException("search.time_budget_millis", "must be 0 (unbounded) or positive");
    }
    requireInRange("search.num_threads", numThreads, 1, Integer.MAX_VALUE);
    if (seedIds != null && seedIds.isEmpty()) {
      throw new ConfigurationException("search.seed_ids", "omit the option to seed from every metabolite");
    }
    requireNonNull("search.main_component_only", mainComponentOnly);
  }

  private static void requireNonNull(String parameter, Object value) {
    if (value == null) {
      throw new ConfigurationException(parameter, "must not be null");
    }
  }

  private static void requireInRange(String parameter, Integer value, int min, int max) {
    requireNonNull(parameter, value);
    if (value < min || value > max) {
      throw new ConfigurationException(parameter,
          String.format("must lie in [%d, %d], got %d", min, max, value));
    }
  }
}
