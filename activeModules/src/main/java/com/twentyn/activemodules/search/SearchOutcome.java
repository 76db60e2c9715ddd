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

/**
 * The result of one hill-climbing search: the best module it reached and whether it stopped at a local optimum.
 */
public class SearchOutcome {

  private final String seedId;
  private final int restartIndex;
  private final Module module;
  private final int iterations;
  private final boolean complete;

  public SearchOutcome(String seedId, int restartIndex, Module module, int iterations, boolean complete) {
    this.seedId = seedId;
    this.restartIndex = restartIndex;
    this.module = module;
    this.iterations = iterations;
    this.complete = complete;
  }

  public String getSeedId() {
    return seedId;
  }

  public int getRestartIndex() {
    return restartIndex;
  }

  public Module getModule() {
    return module;
  }

  public int getIterations() {
    return iterations;
  }

  // False when the search ran out of iterations or time, or was interrupted, before reaching a local optimum.
  public boolean isComplete() {
    return complete;
  }
}
