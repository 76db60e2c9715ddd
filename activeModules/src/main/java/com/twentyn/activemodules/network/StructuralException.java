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

/**
 * Thrown while building a network whose definition breaks the bipartite contract: an edge between two nodes of the
 * same type, an edge to an unknown node, or a duplicated node or edge.
 */
public class StructuralException extends IllegalArgumentException {

  private final String elementId;

  public StructuralException(String elementId, String message) {
    super(message);
    this.elementId = elementId;
  }

  /**
   * @return The id of the node or edge that caused the failure.
   */
  public String getElementId() {
    return elementId;
  }
}
