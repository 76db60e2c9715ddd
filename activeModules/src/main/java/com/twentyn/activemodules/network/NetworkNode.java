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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Represents a node of the bipartite network: either a metabolite or a reaction.  Metabolite nodes may carry one
 * measurement per study; a node with no measurements is unmeasured, which is a data gap and not an error.
 */
public class NetworkNode {

  @JsonProperty("id")
  private final String id;

  @JsonProperty("type")
  private final NodeType type;

  // Keyed by study id.  Sorted so that serialization and iteration order never depend on insertion order.
  @JsonProperty("measurements")
  private final SortedMap<String, Measurement> measurements;

  @JsonCreator
  public NetworkNode(@JsonProperty("id") String id,
                     @JsonProperty("type") NodeType type,
                     @JsonProperty("measurements") Map<String, Measurement> measurements) {
    if (id == null || id.isEmpty()) {
      throw new IllegalArgumentException("Cannot create network node with an empty id.");
    }
    if (type == null) {
      throw new IllegalArgumentException("Cannot create network node " + id + " without a type.");
    }
    this.id = id;
    this.type = type;
    this.measurements = measurements == null ? new TreeMap<>() : new TreeMap<>(measurements);
  }

  public NetworkNode(String id, NodeType type) {
    this(id, type, null);
  }

  public String getId() {
    return id;
  }

  public NodeType getType() {
    return type;
  }

  @JsonIgnore
  public boolean isMetabolite() {
    return type == NodeType.METABOLITE;
  }

  @JsonIgnore
  public boolean isReaction() {
    return type == NodeType.REACTION;
  }

  /**
   * @return An unmodifiable, study-id ordered view of this node's measurements.
   */
  public SortedMap<String, Measurement> getMeasurements() {
    return Collections.unmodifiableSortedMap(measurements);
  }

  public Optional<Measurement> getMeasurement(String studyId) {
    return Optional.ofNullable(measurements.get(studyId));
  }

  @JsonIgnore
  public boolean isMeasured() {
    return !measurements.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    NetworkNode that = (NetworkNode) o;
    return id.equals(that.id) && type == that.type && measurements.equals(that.measurements);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, type);
  }

  @Override
  public String toString() {
    return type.getName() + ":" + id;
  }
}
