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

/**
 * Thresholds of the rules that turn candidate modules into reported clusters.
 */
public class SelectionConfig {

  @JsonProperty("min_reactions")
  private Integer minReactions = 1;

  @JsonProperty("max_reactions")
  private Integer maxReactions = 3;

  // Fraction of a module's metabolites that must carry at least one measurement.
  @JsonProperty("min_coverage")
  private Double minCoverage = 0.5;

  // A module's combined p-value must be strictly below this.
  @JsonProperty("significance_cutoff")
  private Double significanceCutoff = 0.05;

  // Non-significant metabolites that aren't needed for connectivity stay only below this p-value.
  @JsonProperty("context_cutoff")
  private Double contextCutoff = 0.25;

  public SelectionConfig() {
  }

  public Integer getMinReactions() {
    return minReactions;
  }

  public void setMinReactions(Integer minReactions) {
    this.minReactions = minReactions;
  }

  public Integer getMaxReactions() {
    return maxReactions;
  }

  public void setMaxReactions(Integer maxReactions) {
    this.maxReactions = maxReactions;
  }

  public Double getMinCoverage() {
    return minCoverage;
  }

  public void setMinCoverage(Double minCoverage) {
    this.minCoverage = minCoverage;
  }

  public Double getSignificanceCutoff() {
    return significanceCutoff;
  }

  public void setSignificanceCutoff(Double significanceCutoff) {
    this.significanceCutoff = significanceCutoff;
  }

  public Double getContextCutoff() {
    return contextCutoff;
  }

  public void setContextCutoff(Double contextCutoff) {
    this.contextCutoff = contextCutoff;
  }

  public void validate() {
    if (minReactions == null || minReactions < 0) {
      throw new ConfigurationException("selection.min_reactions", "must be a non-negative integer, got "
          + minReactions);
    }
    if (maxReactions == null || maxReactions < 0) {
      throw new ConfigurationException("selection.max_reactions", "must be a non-negative integer, got "
          + maxReactions);
    }
    if (minReactions > maxReactions) {
      throw new ConfigurationException("selection.min_reactions", String.format(
          "reaction bounds are inverted: min %d > max %d", minReactions, maxReactions));
    }
    if (minCoverage == null || minCoverage.isNaN() || minCoverage < 0.0 || minCoverage > 1.0) {
      throw new ConfigurationException("selection.min_coverage", "must lie in [0, 1], got " + minCoverage);
    }
    requireProbability("selection.significance_cutoff", significanceCutoff);
    requireProbability("selection.context_cutoff", contextCutoff);
  }

  private static void requireProbability(String parameter, Double value) {
    if (value == null || value.isNaN() || value <= 0.0 || value > 1.0) {
      throw new ConfigurationException(parameter, "must lie in (0, 1], got " + value);
    }
  }
}
