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

import com.twentyn.activemodules.search.Module;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A module that passed selection, after context pruning, with its place in the final ranking.
 */
public class SelectedModule {

  private final Module module;
  private final double coverage;
  private final int prunedCount;
  private final SortedSet<Double> acceptingThresholds;
  private final int rank;

  public SelectedModule(Module module, double coverage, int prunedCount, SortedSet<Double> acceptingThresholds,
                        int rank) {
    this.module = module;
    this.coverage = coverage;
    this.prunedCount = prunedCount;
    this.acceptingThresholds = Collections.unmodifiableSortedSet(new TreeSet<>(acceptingThresholds));
    this.rank = rank;
  }

  public Module getModule() {
    return module;
  }

  // Fraction of the module's metabolites with at least one measurement.
  public double getCoverage() {
    return coverage;
  }

  public int getPrunedCount() {
    return prunedCount;
  }

  public SortedSet<Double> getAcceptingThresholds() {
    return acceptingThresholds;
  }

  // 1-based.
  public int getRank() {
    return rank;
  }

  SelectedModule withRank(int newRank) {
    return new SelectedModule(module, coverage, prunedCount, acceptingThresholds, newRank);
  }

  @Override
  public String toString() {
    return String.format("SelectedModule{rank=%d, coverage=%.2f, pruned=%d, %s}", rank, coverage, prunedCount,
        module);
  }
}
