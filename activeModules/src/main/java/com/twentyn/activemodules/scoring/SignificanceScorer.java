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

package com.twentyn.activemodules.scoring;

import com.twentyn.activemodules.config.ScoringConfig;
import com.twentyn.activemodules.network.BipartiteNetwork;
import com.twentyn.activemodules.network.Measurement;
import com.twentyn.activemodules.network.NetworkNode;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Turns per-study (fold-change, p-value) pairs into one signed composite z-score per node with a weighted Stouffer
 * combination.  Each study's two-sided p-value becomes a z-score whose sign is the direction of its fold-change.
 */
public class SignificanceScorer {

  private static final Logger LOGGER = LogManager.getFormatterLogger(SignificanceScorer.class);

  public static final double MIN_P_VALUE = 1e-15;
  public static final double MAX_P_VALUE = 1.0 - 1e-15;

  private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0.0, 1.0);

  private final ScoringConfig config;

  public SignificanceScorer(ScoringConfig config) {
    this.config = config;
  }

  /**
   * Scores every node of the network.  Reaction nodes and unmeasured metabolites get missing scores.
   *
   * @throws IllegalArgumentException if a fold-change can't be converted under the configured scale.
   */
  public CompositeScoreTable scoreNetwork(BipartiteNetwork network) {
    Map<String, CompositeScore> scores = new HashMap<>();
    int missing = 0;
    for (NetworkNode node : network.getNodes()) {
      CompositeScore score = scoreNode(node);
      if (score.isMissing()) {
        missing++;
      }
      scores.put(node.getId(), score);
    }
    LOGGER.info("Scored %d nodes over %d studies; %d have no measurement",
        scores.size(), network.getStudyIds().size(), missing);
    return new CompositeScoreTable(scores);
  }

  /**
   * @return The node's composite score; missing for reactions, even those carrying measurements.
   */
  public CompositeScore scoreNode(NetworkNode node) {
    if (node.isReaction() || !node.isMeasured()) {
      return CompositeScore.missing();
    }

    double weightedZ = 0.0;
    double squaredWeights = 0.0;
    double weightedFold = 0.0;
    double weights = 0.0;
    for (Map.Entry<String, Measurement> entry : node.getMeasurements().entrySet()) {
      double weight = config.getStudyWeight(entry.getKey());
      double logFold;
      try {
        logFold = config.getFoldChangeScale().toLog2(entry.getValue().getFoldChange());
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException(String.format("Bad fold change for node %s in study %s: %s",
            node.getId(), entry.getKey(), e.getMessage()), e);
      }
      weightedZ += weight * toZScore(logFold, entry.getValue().getPValue());
      squaredWeights += weight * weight;
      weightedFold += weight * logFold;
      weights += weight;
    }

    double z = weightedZ / Math.sqrt(squaredWeights);
    return new CompositeScore(z, toPValue(z), weightedFold / weights, node.getMeasurements().size());
  }

  /**
   * Converts one study's result to a signed z-score.  The two-sided p-value is halved to the one-sided tail in the
   * direction of the change.  A fold-change of exactly zero has no direction and scores zero.
   *
   * @param logFoldChange A signed log fold-change.
   * @param pValue A two-sided p-value in [0, 1]; clamped away from 0 and 1.
   */
  public static double toZScore(double logFoldChange, double pValue) {
    if (logFoldChange == 0.0) {
      return 0.0;
    }
    double clamped = Math.min(MAX_P_VALUE, Math.max(MIN_P_VALUE, pValue));
    // Quantile of the lower tail, negated: keeps precision for very small p-values.
    double magnitude = -STANDARD_NORMAL.inverseCumulativeProbability(clamped / 2.0);
    return Math.signum(logFoldChange) * magnitude;
  }

  /**
   * @return The two-sided p-value of a standard normal z-score.
   */
  public static double toPValue(double zScore) {
    return 2.0 * STANDARD_NORMAL.cumulativeProbability(-Math.abs(zScore));
  }

  /**
   * Combines the evidence of a group of nodes regardless of direction: Stouffer's sum over the magnitudes of all
   * non-missing scores.
   *
   * @return The combined p-value, or 1.0 if no score is present.
   */
  public static double combineMagnitudes(Collection<CompositeScore> scores) {
    double sum = 0.0;
    int count = 0;
    for (CompositeScore score : scores) {
      if (!score.isMissing()) {
        sum += score.getMagnitude();
        count++;
      }
    }
    if (count == 0) {
      return 1.0;
    }
    return toPValue(sum / Math.sqrt(count));
  }
}
