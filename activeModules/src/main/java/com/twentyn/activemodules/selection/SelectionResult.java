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

package com.twentyn.activemodules.selection;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class SelectionResult {

  private final List<SelectedModule> selected;
  private final Map<SelectionRule, Integer> rejections;

  public SelectionResult(List<SelectedModule> selected, Map<SelectionRule, Integer> rejections) {
    this.selected = Collections.unmodifiableList(selected);
    EnumMap<SelectionRule, Integer> counts = new EnumMap<>(SelectionRule.class);
    for (SelectionRule rule : SelectionRule.values()) {
      counts.put(rule, rejections.getOrDefault(rule, 0));
    }
    this.rejections = Collections.unmodifiableMap(counts);
  }

  /**
   * @return The selected modules, best first.
   */
  public List<SelectedModule> getSelected() {
    return selected;
  }

  public Map<SelectionRule, Integer> getRejections() {
    return rejections;
  }

  public int getRejectionCount(SelectionRule rule) {
    return rejections.get(rule);
  }
}
