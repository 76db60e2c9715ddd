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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Assembles a {@link BipartiteNetwork} from a node list, an edge list and a sparse measurement table.
 * Structural problems are reported when {@link #build()} constructs the network; problems with individual
 * measurement rows are logged and the rows skipped, since a measurement that cannot be attached is a data gap.
 */
public class NetworkBuilder {

  private static final Logger LOGGER = LogManager.getFormatterLogger(NetworkBuilder.class);

  private final Map<String, NodeType> nodeTypes = new LinkedHashMap<>();
  private final List<NetworkEdge> edges = new ArrayList<>();
  // node id -> study id -> measurement
  private final Map<String, Map<String, Measurement>> measurements = new LinkedHashMap<>();

  public NetworkBuilder addNode(String id, NodeType type) {
    if (nodeTypes.containsKey(id)) {
      throw new StructuralException(id, "Duplicate node id " + id);
    }
    nodeTypes.put(id, type);
    return this;
  }

  public NetworkBuilder addMetabolite(String id) {
    return addNode(id, NodeType.METABOLITE);
  }

  public NetworkBuilder addReaction(String id) {
    return addNode(id, NodeType.REACTION);
  }

  public NetworkBuilder addEdge(String source, String target) {
    edges.add(new NetworkEdge(source, target));
    return this;
  }

  /**
   * Adds one row of the measurement table.
   *
   * @throws StructuralException if the table already holds a measurement for this node and study.
   */
  public NetworkBuilder addMeasurement(String nodeId, String studyId, Measurement measurement) {
    Map<String, Measurement> nodeMeasurements = measurements.computeIfAbsent(nodeId, k -> new TreeMap<>());
    if (nodeMeasurements.containsKey(studyId)) {
      throw new StructuralException(nodeId,
          String.format("Duplicate measurement for node %s in study %s", nodeId, studyId));
    }
    nodeMeasurements.put(studyId, measurement);
    return this;
  }

  public NetworkBuilder addMeasurement(String nodeId, String studyId, double foldChange, double pValue) {
    return addMeasurement(nodeId, studyId, new Measurement(foldChange, pValue));
  }

  /**
   * @return The validated network.
   * @throws StructuralException if the nodes and edges do not form a valid bipartite network.
   */
  public BipartiteNetwork build() {
    Map<String, Map<String, Measurement>> attached = new HashMap<>();
    int skipped = 0;
    for (Map.Entry<String, Map<String, Measurement>> entry : measurements.entrySet()) {
      NodeType type = nodeTypes.get(entry.getKey());
      if (type == null) {
        LOGGER.warn("Skipping %d measurement(s) for unknown node %s", entry.getValue().size(), entry.getKey());
        skipped += entry.getValue().size();
      } else if (type == NodeType.REACTION) {
        LOGGER.warn("Skipping %d measurement(s) for reaction node %s; only metabolites are measured",
            entry.getValue().size(), entry.getKey());
        skipped += entry.getValue().size();
      } else {
        attached.put(entry.getKey(), entry.getValue());
      }
    }
    if (skipped > 0) {
      LOGGER.warn("%d measurement row(s) could not be attached to metabolite nodes", skipped);
    }

    List<NetworkNode> nodes = new ArrayList<>(nodeTypes.size());
    nodeTypes.forEach((id, type) -> nodes.add(new NetworkNode(id, type, attached.get(id))));
    return new BipartiteNetwork(nodes, edges);
  }
}
