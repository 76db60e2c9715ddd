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

import java.util.Objects;

/**
 * Represents an undirected link between a metabolite and a reaction in which it takes part.  Inside a
 * {@link BipartiteNetwork} the source is always the metabolite and the target always the reaction.
 */
public class NetworkEdge implements Comparable<NetworkEdge> {

  private static final String ID_SEPARATOR = "--";

  @JsonProperty("source")
  private final String source;

  @JsonProperty("target")
  private final String target;

  @JsonCreator
  public NetworkEdge(@JsonProperty("source") String source,
                     @JsonProperty("target") String target) {
    if (source == null || target == null) {
      throw new IllegalArgumentException("Cannot create network edge with null endpoints.");
    }
    this.source = source;
    this.target = target;
  }

  public String getSource() {
    return source;
  }

  public String getTarget() {
    return target;
  }

  @JsonIgnore
  public String getId() {
    return source + ID_SEPARATOR + target;
  }

  public boolean touches(String nodeId) {
    return source.equals(nodeId) || target.equals(nodeId);
  }

  /**
   * @param nodeId One endpoint of this edge.
   * @return The other endpoint.
   * @throws IllegalArgumentException if nodeId is not an endpoint.
   */
  public String getOtherEnd(String nodeId) {
    if (source.equals(nodeId)) {
      return target;
    }
    if (target.equals(nodeId)) {
      return source;
    }
    throw new IllegalArgumentException("Node " + nodeId + " is not an endpoint of edge " + getId());
  }

  /**
   * Edges are undirected, so two edges are equal when they join the same pair of nodes in either orientation.
   */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    NetworkEdge that = (NetworkEdge) o;
    return (source.equals(that.source) && target.equals(that.target))
        || (source.equals(that.target) && target.equals(that.source));
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(source) ^ Objects.hashCode(target);
  }

  @Override
  public int compareTo(NetworkEdge other) {
    int cmp = source.compareTo(other.source);
    return cmp != 0 ? cmp : target.compareTo(other.target);
  }

  @Override
  public String toString() {
    return getId();
  }
}
