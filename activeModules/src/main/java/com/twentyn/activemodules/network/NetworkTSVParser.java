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

import com.twentyn.activemodules.utils.FileChecker;
import com.twentyn.activemodules.utils.TSVParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;

/**
 * Loads a network definition and its measurement table from tab-separated files.
 *
 * Nodes:        id, type           (type is "metabolite" or "reaction")
 * Edges:        source, target     (one metabolite and one reaction, either order)
 * Measurements: node_id, study_id, fold_change, p_value
 */
public class NetworkTSVParser {

  private static final Logger LOGGER = LogManager.getFormatterLogger(NetworkTSVParser.class);

  public static final String NODE_ID_KEY = "id";
  public static final String NODE_TYPE_KEY = "type";
  public static final String EDGE_SOURCE_KEY = "source";
  public static final String EDGE_TARGET_KEY = "target";
  public static final String MEASUREMENT_NODE_KEY = "node_id";
  public static final String MEASUREMENT_STUDY_KEY = "study_id";
  public static final String MEASUREMENT_FOLD_KEY = "fold_change";
  public static final String MEASUREMENT_P_VALUE_KEY = "p_value";

  private static final List<String> NODE_COLUMNS = Arrays.asList(NODE_ID_KEY, NODE_TYPE_KEY);
  private static final List<String> EDGE_COLUMNS = Arrays.asList(EDGE_SOURCE_KEY, EDGE_TARGET_KEY);
  private static final List<String> MEASUREMENT_COLUMNS = Arrays.asList(
      MEASUREMENT_NODE_KEY, MEASUREMENT_STUDY_KEY, MEASUREMENT_FOLD_KEY, MEASUREMENT_P_VALUE_KEY);

  private NetworkTSVParser() {
    // There's no reason to instantiate this class.
  }

  /**
   * Parses all three files and builds the network.
   *
   * @param nodesFile The node list.
   * @param edgesFile The edge list.
   * @param measurementsFile The measurement table, or null if nothing was measured.
   * @return The validated network with measurements attached.
   * @throws IOException if a file is missing or malformed.
   * @throws StructuralException if the definition is not a valid bipartite network.
   */
  public static BipartiteNetwork parseNetwork(File nodesFile, File edgesFile, File measurementsFile)
      throws IOException {
    NetworkBuilder builder = new NetworkBuilder();
    parseNodes(nodesFile, builder);
    parseEdges(edgesFile, builder);
    if (measurementsFile != null) {
      parseMeasurements(measurementsFile, builder);
    }
    return builder.build();
  }

  public static void parseNodes(File nodesFile, NetworkBuilder builder) throws IOException {
    TSVParser parser = openAndParse(nodesFile, NODE_COLUMNS);
    for (TSVParser.Row row : parser.getResults()) {
      String id = row.getRequired(NODE_ID_KEY);
      String typeName = row.getRequired(NODE_TYPE_KEY);
      NodeType type;
      try {
        type = NodeType.fromName(typeName);
      } catch (IllegalArgumentException e) {
        throw new IOException(String.format("%s line %d: %s", parser.getSourceName(), row.getLineNumber(),
            e.getMessage()), e);
      }
      builder.addNode(id, type);
    }
    LOGGER.info("Read %d nodes from %s", parser.getResults().size(), nodesFile.getName());
  }

  public static void parseEdges(File edgesFile, NetworkBuilder builder) throws IOException {
    TSVParser parser = openAndParse(edgesFile, EDGE_COLUMNS);
    for (TSVParser.Row row : parser.getResults()) {
      builder.addEdge(row.getRequired(EDGE_SOURCE_KEY), row.getRequired(EDGE_TARGET_KEY));
    }
    LOGGER.info("Read %d edges from %s", parser.getResults().size(), edgesFile.getName());
  }

  public static void parseMeasurements(File measurementsFile, NetworkBuilder builder) throws IOException {
    TSVParser parser = openAndParse(measurementsFile, MEASUREMENT_COLUMNS);
    for (TSVParser.Row row : parser.getResults()) {
      String nodeId = row.getRequired(MEASUREMENT_NODE_KEY);
      String studyId = row.getRequired(MEASUREMENT_STUDY_KEY);
      Measurement measurement;
      try {
        measurement = new Measurement(row.getDouble(MEASUREMENT_FOLD_KEY), row.getDouble(MEASUREMENT_P_VALUE_KEY));
      } catch (IllegalArgumentException e) {
        throw new IOException(String.format("%s line %d: invalid measurement for node %s in study %s: %s",
            parser.getSourceName(), row.getLineNumber(), nodeId, studyId, e.getMessage()), e);
      }
      builder.addMeasurement(nodeId, studyId, measurement);
    }
    LOGGER.info("Read %d measurements from %s", parser.getResults().size(), measurementsFile.getName());
  }

  private static TSVParser openAndParse(File file, List<String> requiredColumns) throws IOException {
    FileChecker.verifyInputFile(file);
    TSVParser parser = new TSVParser(file.getName());
    parser.parse(file);
    parser.verifyColumns(requiredColumns);
    return parser;
  }
}
