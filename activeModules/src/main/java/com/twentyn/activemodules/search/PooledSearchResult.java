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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * All threshold runs of one search, with their accepted modules pooled into a single ranked list.
 */
public class PooledSearchResult {

  private final List<SearchResult> thresholdResults;
  private final List<Module> modules;
  private final Map<Module, SortedSet<Double>> acceptingThresholds;
  private final int searchCount;
  private final int candidateCount;
  private final int incompleteSearchCount;
  private final List<SeedFailure> failures;

  public PooledSearchResult(List<SearchResult> thresholdResults, int searchCount, int candidateCount,
                            int incompleteSearchCount, List<SeedFailure> failures) {
    this.thresholdResults = Collections.unmodifiableList(new ArrayList<>(thresholdResults));
    this.searchCount = searchCount;
    this.candidateCount = candidateCount;
    this.incompleteSearchCount = incompleteSearchCount;
    this.failures = Collections.unmodifiableList(new ArrayList<>(failures));

    Map<Module, SortedSet<Double>> thresholds = new LinkedHashMap<>();
    for (SearchResult result : thresholdResults) {
      for (Module module : result.getModules()) {
        thresholds.computeIfAbsent(module, k -> new TreeSet<>()).add(result.getOverlapThreshold());
      }
    }
    List<Module> pooled = new ArrayList<>(thresholds.keySet());
    pooled.sort(Module.RANKING_ORDER);
    this.modules = Collections.unmodifiableList(pooled);
    this.acceptingThresholds = thresholds;
  }

  public List<SearchResult> getThresholdResults() {
    return thresholdResults;
  }

  /**
   * @return The union of all accepted modules, each once, in ranking order.
   */
  public List<Module> getModules() {
    return modules;
  }

  public SortedSet<Double> getAcceptingThresholds(Module module) {
    SortedSet<Double> thresholds = acceptingThresholds.get(module);
    return thresholds == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(thresholds);
  }

  public boolean isBudgetExhausted() {
    return thresholdResults.stream().anyMatch(SearchResult::isBudgetExhausted);
  }

  public int getSearchCount() {
    return searchCount;
  }

  public int getCandidateCount() {
    return candidateCount;
  }

  public int getIncompleteSearchCount() {
    return incompleteSearchCount;
  }

  public List<SeedFailure> getFailures() {
    return failures;
  }
}
