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

import com.twentyn.activemodules.network.BipartiteNetwork;
import com.twentyn.activemodules.network.NetworkEdge;
import com.twentyn.activemodules.network.NetworkNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A connected set of network nodes with its induced edges and scores.  Immutable; two modules with the same members
 * are equal regardless of the seed that found them.
 */
public class Module {

  /**
   * Best first: higher aggregate score, then the lexicographically smaller sorted member list.
   */
  public static final Comparator<Module> RANKING_ORDER = (a, b) -> {
    int byScore = Double.compare(b.score, a.score);
    return byScore != 0 ? byScore : compareMemberLists(a.nodeIds, b.nodeIds);
  };

  private final String seedId;
  private final SortedSet<String> nodeIds;
  private final List<NetworkEdge> edges;
  private final double score;
  private final double pValue;
  private final int reactionCount;
  private final int metaboliteCount;

  /**
   * @param network The network the members belong to.
   * @param seedId The node the search that found this module started from.
   * @param nodeIds The members.
   * @param score The aggregate score.
   * @param pValue The combined p-value of the members.
   * @throws IllegalArgumentException if the members don't induce a connected subgraph.
   */
  public Module(BipartiteNetwork network, String seedId, Set<String> nodeIds, double score, double pValue) {
    if (!network.isConnected(nodeIds)) {
      throw new IllegalArgumentException("Module members must form a connected subgraph: " + nodeIds);
    }
    this.seedId = seedId;
    this.nodeIds = Collections.unmodifiableSortedSet(new TreeSet<>(nodeIds));
    this.edges = Collections.unmodifiableList(new ArrayList<>(network.getInducedEdges(this.nodeIds)));
    this.score = score;
    this.pValue = pValue;
    int reactions = 0;
    for (String id : this.nodeIds) {
      NetworkNode node = network.getNodeById(id);
      if (node.isReaction()) {
        reactions++;
      }
    }
    this.reactionCount = reactions;
    this.metaboliteCount = this.nodeIds.size() - reactions;
  }

  public String getSeedId() {
    return seedId;
  }

  public SortedSet<String> getNodeIds() {
    return nodeIds;
  }

  public List<NetworkEdge> getEdges() {
    return edges;
  }

  public double getScore() {
    return score;
  }

  public double getPValue() {
    return pValue;
  }

  public int getReactionCount() {
    return reactionCount;
  }

  public int getMetaboliteCount() {
    return metaboliteCount;
  }

  public int size() {
    return nodeIds.size();
  }

  public boolean contains(String nodeId) {
    return nodeIds.contains(nodeId);
  }

  /**
   * @return The number of shared members divided by the size of the smaller module.
   */
  public double overlapRatio(Module other) {
    SortedSet<String> smaller = size() <= other.size() ? nodeIds : other.nodeIds;
    SortedSet<String> larger = smaller == nodeIds ? other.nodeIds : nodeIds;
    int shared = 0;
    for (String id : smaller) {
      if (larger.contains(id)) {
        shared++;
      }
    }
    return (double) shared / (double) smaller.size();
  }

  static int compareMemberLists(SortedSet<String> a, SortedSet<String> b) {
    Iterator<String> left = a.iterator();
    Iterator<String> right = b.iterator();
    while (left.hasNext() && right.hasNext()) {
      int cmp = left.next().compareTo(right.next());
      if (cmp != 0) {
        return cmp;
      }
    }
    return Boolean.compare(left.hasNext(), right.hasNext());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return nodeIds.equals(((Module) o).nodeIds);
  }

  @Override
  public int hashCode() {
    return nodeIds.hashCode();
  }

  @Override
  public String toString() {
    return String.format("Module{score=%.4f, p=%.4g, nodes=%s}", score, pValue, nodeIds);
  }
}
