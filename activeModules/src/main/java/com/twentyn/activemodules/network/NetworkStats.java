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

package com.twentyn.activemodules.network;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Basic statistics about a metabolic network and how much of it was measured.
 */
public class NetworkStats {

  private static final Logger LOGGER = LogManager.getFormatterLogger(NetworkStats.class);

  private final int nodeCount;
  private final int edgeCount;
  private final int metaboliteCount;
  private final int reactionCount;
  private final int measuredMetaboliteCount;
  private final int studyCount;
  private final int componentCount;

  public NetworkStats(BipartiteNetwork network) {
    this.nodeCount = network.getNodes().size();
    this.edgeCount = network.getEdges().size();
    this.metaboliteCount = network.getMetabolites().size();
    this.reactionCount = network.getReactions().size();
    this.measuredMetaboliteCount = (int) network.getMetabolites().stream().filter(NetworkNode::isMeasured).count();
    this.studyCount = network.getStudyIds().size();
    this.componentCount = network.getConnectedComponents().size();
  }

  public int getNodeCount() {
    return nodeCount;
  }

  public int getEdgeCount() {
    return edgeCount;
  }

  public int getMetaboliteCount() {
    return metaboliteCount;
  }

  public int getReactionCount() {
    return reactionCount;
  }

  public int getMeasuredMetaboliteCount() {
    return measuredMetaboliteCount;
  }

  public int getStudyCount() {
    return studyCount;
  }

  public int getComponentCount() {
    return componentCount;
  }

  public void log() {
    LOGGER.info("Total nodes: %d (%d metabolites, %d reactions)", nodeCount, metaboliteCount, reactionCount);
    LOGGER.info("Total edges: %d in %d connected component(s)", edgeCount, componentCount);
    LOGGER.info("Measured metabolites: %d of %d across %d studies",
        measuredMetaboliteCount, metaboliteCount, studyCount);
  }
}
