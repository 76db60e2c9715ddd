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
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The two kinds of node in a bipartite metabolic network.  Every edge joins one of each.
 */
public enum NodeType {
  METABOLITE("metabolite"),
  REACTION("reaction");

  private final String name;

  NodeType(String name) {
    this.name = name;
  }

  @JsonValue
  public String getName() {
    return name;
  }

  /**
   * Parses a node type from its serialized name, ignoring case.
   *
   * @param name The name, e.g. "metabolite".
   * @return The matching type.
   * @throws IllegalArgumentException if the name matches no type.
   */
  @JsonCreator
  public static NodeType fromName(String name) {
    if (name != null) {
      for (NodeType type : values()) {
        if (type.name.equalsIgnoreCase(name.trim())) {
          return type;
        }
      }
    }
    throw new IllegalArgumentException("Unknown node type: " + name);
  }
}
