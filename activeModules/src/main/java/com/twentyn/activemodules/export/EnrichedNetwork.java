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

package com.twentyn.activemodules.export;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.twentyn.activemodules.network.BipartiteNetwork;
import com.twentyn.activemodules.network.Measurement;
import com.twentyn.activemodules.network.NetworkEdge;
import com.twentyn.activemodules.network.NetworkNode;
import com.twentyn.activemodules.network.NodeType;
import com.twentyn.activemodules.utils.FileChecker;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The whole network in the element layout Cytoscape reads, with every node's composite score and per-study values
 * merged into its data record.  Derived from a network and its scores; never used as analysis state.
 */
public class EnrichedNetwork {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  static {
    OBJECT_MAPPER.enable(SerializationFeature.INDENT_OUTPUT);
  }

  @JsonProperty("elements")
  private Elements elements;

  @JsonProperty("summary")
  private Summary summary;

  @JsonCreator
  public EnrichedNetwork(@JsonProperty("elements") Elements elements,
                         @JsonProperty("summary") Summary summary) {
    this.elements = elements;
    this.summary = summary;
  }

  public Elements getElements() {
    return elements;
  }

  public Summary getSummary() {
    return summary;
  }

  /**
   * Rebuilds the network this export was made from, with the same nodes, edges and measurements.
   *
   * @throws com.twentyn.activemodules.network.StructuralException if the export doesn't describe a valid network.
   */
  public BipartiteNetwork toNetwork() {
    List<NetworkNode> nodes = new ArrayList<>(elements.getNodes().size());
    for (NodeElement element : elements.getNodes()) {
      NodeData data = element.getData();
      nodes.add(new NetworkNode(data.getId(), NodeType.fromName(data.getType()), data.getStudies()));
    }
    List<NetworkEdge> edges = new ArrayList<>(elements.getEdges().size());
    for (EdgeElement element : elements.getEdges()) {
      edges.add(new NetworkEdge(element.getData().getSource(), element.getData().getTarget()));
    }
    return new BipartiteNetwork(nodes, edges);
  }

  public void writeToJsonFile(File outputFile) throws IOException {
    try (BufferedWriter writer = new BufferedWriter(new FileWriter(outputFile))) {
      OBJECT_MAPPER.writeValue(writer, this);
    }
  }

  public static EnrichedNetwork readFromJsonFile(File inputFile) throws IOException {
    FileChecker.verifyInputFile(inputFile);
    return OBJECT_MAPPER.readValue(inputFile, EnrichedNetwork.class);
  }

  public static class Elements {
    @JsonProperty("nodes")
    private List<NodeElement> nodes;

    @JsonProperty("edges")
    private List<EdgeElement> edges;

    @JsonCreator
    public Elements(@JsonProperty("nodes") List<NodeElement> nodes,
                    @JsonProperty("edges") List<EdgeElement> edges) {
      this.nodes = nodes == null ? Collections.emptyList() : nodes;
      this.edges = edges == null ? Collections.emptyList() : edges;
    }

    public List<NodeElement> getNodes() {
      return nodes;
    }

    public List<EdgeElement> getEdges() {
      return edges;
    }
  }

  public static class NodeElement {
    @JsonProperty("data")
    private NodeData data;

    @JsonCreator
    public NodeElement(@JsonProperty("data") NodeData data) {
      this.data = data;
    }

    public NodeData getData() {
      return data;
    }
  }

  public static class EdgeElement {
    @JsonProperty("data")
    private EdgeData data;

    @JsonCreator
    public EdgeElement(@JsonProperty("data") EdgeData data) {
      this.data = data;
    }

    public EdgeData getData() {
      return data;
    }
  }

  /**
   * One node's attribute record.  The composite fields are null when the node is missing a score.
   */
  public static class NodeData {
    @JsonProperty("id")
    private String id;

    @JsonProperty("type")
    private String type;

    @JsonProperty("missing")
    private boolean missing;

    @JsonProperty("composite_z")
    private Double compositeZ;

    @JsonProperty("composite_p")
    private Double compositeP;

    @JsonProperty("composite_fold_change")
    private Double compositeFoldChange;

    @JsonProperty("contributing_studies")
    private int contributingStudies;

    // study id -> raw values as measured
    @JsonProperty("studies")
    private Map<String, Measurement> studies;

    @JsonCreator
    public NodeData(@JsonProperty("id") String id,
                    @JsonProperty("type") String type,
                    @JsonProperty("missing") boolean missing,
                    @JsonProperty("composite_z") Double compositeZ,
                    @JsonProperty("composite_p") Double compositeP,
                    @JsonProperty("composite_fold_change") Double compositeFoldChange,
                    @JsonProperty("contributing_studies") int contributingStudies,
                    @JsonProperty("studies") Map<String, Measurement> studies) {
      this.id = id;
      this.type = type;
      this.missing = missing;
      this.compositeZ = compositeZ;
      this.compositeP = compositeP;
      this.compositeFoldChange = compositeFoldChange;
      this.contributingStudies = contributingStudies;
      this.studies = studies == null ? new TreeMap<>() : new TreeMap<>(studies);
    }

    public String getId() {
      return id;
    }

    public String getType() {
      return type;
    }

    public boolean isMissing() {
      return missing;
    }

    public Double getCompositeZ() {
      return compositeZ;
    }

    public Double getCompositeP() {
      return compositeP;
    }

    public Double getCompositeFoldChange() {
      return compositeFoldChange;
    }

    public int getContributingStudies() {
      return contributingStudies;
    }

    public Map<String, Measurement> getStudies() {
      return studies;
    }
  }

  public static class EdgeData {
    @JsonProperty("id")
    private String id;

    @JsonProperty("source")
    private String source;

    @JsonProperty("target")
    private String target;

    @JsonCreator
    public EdgeData(@JsonProperty("id") String id,
                    @JsonProperty("source") String source,
                    @JsonProperty("target") String target) {
      this.id = id;
      this.source = source;
      this.target = target;
    }

    public String getId() {
      return id;
    }

    public String getSource() {
      return source;
    }

    public String getTarget() {
      return target;
    }
  }

  /**
   * Extremes over all raw measurements, for setting color scales.  Null when nothing is measured.
   */
  public static class Summary {
    @JsonProperty("study_ids")
    private List<String> studyIds;

    @JsonProperty("fold_change_min")
    private Double foldChangeMin;

    @JsonProperty("fold_change_max")
    private Double foldChangeMax;

    @JsonProperty("p_value_log_min")
    private Double pValueLogMin;

    @JsonCreator
    public Summary(@JsonProperty("study_ids") List<String> studyIds,
                   @JsonProperty("fold_change_min") Double foldChangeMin,
                   @JsonProperty("fold_change_max") Double foldChangeMax,
                   @JsonProperty("p_value_log_min") Double pValueLogMin) {
      this.studyIds = studyIds == null ? Collections.emptyList() : studyIds;
      this.foldChangeMin = foldChangeMin;
      this.foldChangeMax = foldChangeMax;
      this.pValueLogMin = pValueLogMin;
    }

    public List<String> getStudyIds() {
      return studyIds;
    }

    public Double getFoldChangeMin() {
      return foldChangeMin;
    }

    public Double getFoldChangeMax() {
      return foldChangeMax;
    }

    @JsonProperty("p_value_log_min")
    public Double getPValueLogMin() {
      return pValueLogMin;
    }
  }
}
