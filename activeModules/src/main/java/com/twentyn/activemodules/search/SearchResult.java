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

import java.util.Collections;
import java.util.List;

/**
 * The modules accepted by one greedy pass at one overlap threshold.
 */
public class SearchResult {

  private final double overlapThreshold;
  private final List<Module> modules;
  private final boolean budgetExhausted;

  public SearchResult(double overlapThreshold, List<Module> modules, boolean budgetExhausted) {
    this.overlapThreshold = overlapThreshold;
    this.modules = Collections.unmodifiableList(modules);
    this.budgetExhausted = budgetExhausted;
  }

  public double getOverlapThreshold() {
    return overlapThreshold;
  }

  /**
   * @return The accepted modules in acceptance order, which is ranking order.
   */
  public List<Module> getModules() {
    return modules;
  }

  /**
   * @return True if the candidates ran out before the target module count was reached.
   */
  public boolean isBudgetExhausted() {
    return budgetExhausted;
  }
}
