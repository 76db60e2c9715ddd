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

import java.util.Map;
import java.util.TreeMap;

public class ScoringConfig {

  // Per-study weights for the Stouffer combination.  Studies that aren't listed weigh 1.0.
  @JsonProperty("study_weights")
  private Map<String, Double> studyWeights = new TreeMap<>();

  @JsonProperty("fold_change_scale")
  private FoldChangeScale foldChangeScale = FoldChangeScale.LOG2;

  public ScoringConfig() {
  }

  public Map<String, Double> getStudyWeights() {
    return studyWeights;
  }

  public void setStudyWeights(Map<String, Double> studyWeights) {
    this.studyWeights = studyWeights;
  }

  public double getStudyWeight(String studyId) {
    Double weight = studyWeights == null ? null : studyWeights.get(studyId);
    return weight == null ? 1.0 : weight;
  }

  public FoldChangeScale getFoldChangeScale() {
    return foldChangeScale;
  }

  public void setFoldChangeScale(FoldChangeScale foldChangeScale) {
    this.foldChangeScale = foldChangeScale;
  }

  public void validate() {
    if (foldChangeScale == null) {
      throw new ConfigurationException("scoring.fold_change_scale", "must be one of LOG2, RATIO");
    }
    if (studyWeights == null) {
      throw new ConfigurationException("scoring.study_weights", "must be an object, not null");
    }
    for (Map.Entry<String, Double> entry : studyWeights.entrySet()) {
      Double weight = entry.getValue();
      if (weight == null || weight.isNaN() || weight.isInfinite() || weight <= 0.0) {
        throw new ConfigurationException("scoring.study_weights." + entry.getKey(),
            "weight must be a positive finite number, got " + weight);
      }
    }
  }
}
