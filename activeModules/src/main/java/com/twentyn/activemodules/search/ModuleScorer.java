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

package com.twentyn.activemodules.search;

import com.twentyn.activemodules.config.SearchConfig;
import com.twentyn.activemodules.network.BipartiteNetwork;
import com.twentyn.activemodules.scoring.CompositeScore;
import com.twentyn.activemodules.scoring.CompositeScoreTable;
import com.twentyn.activemodules.scoring.SignificanceScorer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Computes the aggregate score of a candidate member set.  Each scored member contributes the magnitude of its
 * composite z-score; with regional scoring only members near the seed count, and with size adjustment the sum is
 * divided by the square root of the member count.
 *
 * The sum is over |Z| rather than signed Z, so a module holding both accumulated and depleted metabolites scores
 * higher instead of cancelling out.  The member z-scores come from two-sided p-values (see
 * {@link SignificanceScorer#toZScore}), with direction taken from the fold-change.
 */
public class ModuleScorer {

  private final BipartiteNetwork network;
  private final CompositeScoreTable scores;
  private final boolean sizeAdjustment;
  private final boolean regionalScoring;
  private final int maxDepth;

  public ModuleScorer(BipartiteNetwork network, CompositeScoreTable scores, SearchConfig config) {
    this.network = network;
    this.scores = scores;
    this.sizeAdjustment = config.getSizeAdjustment();
    this.regionalScoring = config.getRegionalScoring();
    this.maxDepth = config.getMaxDepth();
  }

  public BipartiteNetwork getNetwork() {
    return network;
  }

  public CompositeScoreTable getScores() {
    return scores;
  }

  /**
   * @return The nodes allowed to contribute to modules grown from this seed, or null if every node may.
   */
  public Set<String> getScoringRegion(String seedId) {
    if (!regionalScoring) {
      return null;
    }
    return network.getNodesWithinHops(seedId, maxDepth).keySet();
  }

  public double score(Collection<String> members, Set<String> region) {
    double sum = 0.0;
    for (String id : members) {
      if (region == null || region.contains(id)) {
        sum += scores.getScore(id).getMagnitude();
      }
    }
    return sizeAdjustment ? sum / Math.sqrt(members.size()) : sum;
  }

  public double combinedPValue(Collection<String> members) {
    List<CompositeScore> memberScores = new ArrayList<>(members.size());
    for (String id : members) {
      memberScores.add(scores.getScore(id));
    }
    return SignificanceScorer.combineMagnitudes(memberScores);
  }

  public Module createModule(String seedId, Set<String> members, Set<String> region) {
    return new Module(network, seedId, members, score(members, region), combinedPValue(members));
  }

  public Module createModule(String seedId, Set<String> members) {
    return createModule(seedId, members, getScoringRegion(seedId));
  }
}
