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

import com.twentyn.activemodules.network.NodeNotFoundException;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Read-only map from node id to composite score, covering every node of one network.
 */
public class CompositeScoreTable {

  private final SortedMap<String, CompositeScore> scores;

  public CompositeScoreTable(Map<String, CompositeScore> scores) {
    this.scores = Collections.unmodifiableSortedMap(new TreeMap<>(scores));
  }

  /**
   * @throws NodeNotFoundException if the table has no entry for this id.
   */
  public CompositeScore getScore(String nodeId) {
    CompositeScore score = scores.get(nodeId);
    if (score == null) {
      throw new NodeNotFoundException(nodeId);
    }
    return score;
  }

  public boolean isMissing(String nodeId) {
    return getScore(nodeId).isMissing();
  }

  public SortedMap<String, CompositeScore> getScores() {
    return scores;
  }

  public int size() {
    return scores.size();
  }

  public int getScoredCount() {
    return (int) scores.values().stream().filter(s -> !s.isMissing()).count();
  }
}
