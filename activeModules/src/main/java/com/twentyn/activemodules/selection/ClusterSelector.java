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

import com.twentyn.activemodules.config.SelectionConfig;
import com.twentyn.activemodules.network.BipartiteNetwork;
import com.twentyn.activemodules.scoring.CompositeScore;
import com.twentyn.activemodules.scoring.CompositeScoreTable;
import com.twentyn.activemodules.search.Module;
import com.twentyn.activemodules.search.ModuleScorer;
import com.twentyn.activemodules.search.PooledSearchResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Filters candidate modules down to reportable clusters.
 *
 * A module must pass the size, coverage, directionality and significance rules in that order.  Survivors are then
 * pruned of context metabolites: a metabolite that is unmeasured or not significant on its own stays only if the
 * module falls apart without it, or if its own p-value is below the context cutoff.  The pruned module is
 * re-scored and must pass the rules again.
 */
public class ClusterSelector {

  private static final Logger LOGGER = LogManager.getFormatterLogger(ClusterSelector.class);

  private final SelectionConfig config;
  private final ModuleScorer scorer;
  private final BipartiteNetwork network;
  private final CompositeScoreTable scores;

  public ClusterSelector(SelectionConfig config, ModuleScorer scorer) {
    this.config = config;
    this.scorer = scorer;
    this.network = scorer.getNetwork();
    this.scores = scorer.getScores();
  }

  public SelectionResult select(PooledSearchResult searchResult) {
    return select(searchResult.getModules(), searchResult::getAcceptingThresholds);
  }

  public SelectionResult select(List<Module> modules) {
    return select(modules, m -> Collections.emptySortedSet());
  }

  /**
   * @param modules Candidate modules.
   * @param thresholds The overlap thresholds whose runs accepted each module.
   * @return The selected, pruned modules ranked best first, with rejection counts per rule.
   */
  public SelectionResult select(List<Module> modules, Function<Module, SortedSet<Double>> thresholds) {
    Map<SelectionRule, Integer> rejections = new EnumMap<>(SelectionRule.class);
    Map<SortedSet<String>, SelectedModule> selected = new LinkedHashMap<>();

    for (Module module : modules) {
      Optional<SelectionRule> failed = findFailedRule(module);
      if (failed.isPresent()) {
        LOGGER.debug("Rejecting %s: fails %s rule", module, failed.get());
        rejections.merge(failed.get(), 1, Integer::sum);
        continue;
      }

      SortedSet<String> members = pruneContext(module);
      int pruned = module.size() - members.size();
      Module result = module;
      if (pruned > 0) {
        result = scorer.createModule(module.getSeedId(), members);
        failed = findFailedRule(result);
        if (failed.isPresent()) {
          LOGGER.debug("Dropping %s after pruning %d nodes: fails %s rule", result, pruned, failed.get());
          rejections.merge(failed.get(), 1, Integer::sum);
          continue;
        }
      }

      SelectedModule candidate = new SelectedModule(result, coverage(result), pruned, thresholds.apply(module), 0);
      selected.merge(result.getNodeIds(), candidate, ClusterSelector::mergeDuplicates);
    }

    List<SelectedModule> ranked = new ArrayList<>(selected.values());
    ranked.sort(Comparator.comparing(SelectedModule::getModule, Module.RANKING_ORDER));
    List<SelectedModule> output = new ArrayList<>(ranked.size());
    for (int i = 0; i < ranked.size(); i++) {
      output.add(ranked.get(i).withRank(i + 1));
    }

    SelectionResult selectionResult = new SelectionResult(output, rejections);
    LOGGER.info("Selected %d of %d modules; rejected by size: %d, coverage: %d, directionality: %d, " +
            "significance: %d", output.size(), modules.size(),
        selectionResult.getRejectionCount(SelectionRule.SIZE),
        selectionResult.getRejectionCount(SelectionRule.COVERAGE),
        selectionResult.getRejectionCount(SelectionRule.DIRECTIONALITY),
        selectionResult.getRejectionCount(SelectionRule.SIGNIFICANCE));
    return selectionResult;
  }

  // Two candidates can prune down to the same members; keep the better copy and every threshold that found either.
  private static SelectedModule mergeDuplicates(SelectedModule kept, SelectedModule found) {
    SortedSet<Double> thresholds = new TreeSet<>(kept.getAcceptingThresholds());
    thresholds.addAll(found.getAcceptingThresholds());
    SelectedModule better = Module.RANKING_ORDER.compare(found.getModule(), kept.getModule()) < 0 ? found : kept;
    return new SelectedModule(better.getModule(), better.getCoverage(), better.getPrunedCount(), thresholds, 0);
  }

  /**
   * @return The first required rule the module fails, if any.
   */
  public Optional<SelectionRule> findFailedRule(Module module) {
    if (module.getReactionCount() < config.getMinReactions() ||
        module.getReactionCount() > config.getMaxReactions()) {
      return Optional.of(SelectionRule.SIZE);
    }
    if (coverage(module) < config.getMinCoverage()) {
      return Optional.of(SelectionRule.COVERAGE);
    }
    if (!isBidirectional(module)) {
      return Optional.of(SelectionRule.DIRECTIONALITY);
    }
    if (!(module.getPValue() < config.getSignificanceCutoff())) {
      return Optional.of(SelectionRule.SIGNIFICANCE);
    }
    return Optional.empty();
  }

  /**
   * @return The fraction of the module's metabolites that carry a score; 0 for a module without metabolites.
   */
  public double coverage(Module module) {
    if (module.getMetaboliteCount() == 0) {
      return 0.0;
    }
    int measured = 0;
    for (String id : module.getNodeIds()) {
      if (network.getNodeById(id).isMetabolite() && !scores.isMissing(id)) {
        measured++;
      }
    }
    return (double) measured / (double) module.getMetaboliteCount();
  }

  public boolean isBidirectional(Module module) {
    boolean up = false;
    boolean down = false;
    for (String id : module.getNodeIds()) {
      CompositeScore score = scores.getScore(id);
      if (!network.getNodeById(id).isMetabolite() || score.isMissing()) {
        continue;
      }
      up |= score.getFoldChange() > 0.0;
      down |= score.getFoldChange() < 0.0;
    }
    return up && down;
  }

  /**
   * Removes context metabolites one at a time, weakest evidence first: unmeasured nodes, then by descending
   * p-value, then by id.  Reactions left dangling by a removal are dropped too.  A node kept only to hold the
   * module together is tried again after later removals, so passes repeat until one removes nothing.
   *
   * @return The remaining members, still connected.
   */
  public SortedSet<String> pruneContext(Module module) {
    List<String> contextNodes = new ArrayList<>();
    for (String id : module.getNodeIds()) {
      if (network.getNodeById(id).isMetabolite() && !isSignificant(id)
          && (scores.isMissing(id) || scores.getScore(id).getPValue() >= config.getContextCutoff())) {
        contextNodes.add(id);
      }
    }
    contextNodes.sort(Comparator.comparing((String id) -> !scores.isMissing(id))
        .thenComparing(id -> scores.isMissing(id) ? 0.0 : -scores.getScore(id).getPValue())
        .thenComparing(Comparator.naturalOrder()));

    SortedSet<String> members = new TreeSet<>(module.getNodeIds());
    boolean removed = true;
    while (removed) {
      removed = false;
      for (String id : contextNodes) {
        if (members.size() <= 1) {
          return members;
        }
        if (!members.contains(id)) {
          continue;
        }
        SortedSet<String> remaining = new TreeSet<>(members);
        remaining.remove(id);
        if (!network.isConnected(remaining)) {
          LOGGER.debug("Keeping %s in module seeded at %s: needed for connectivity", id, module.getSeedId());
          continue;
        }
        members = remaining;
        removed = true;
        dropDanglingReactions(id, members);
      }
    }
    return members;
  }

  // Reactions next to a removed node that are left with at most one member neighbor.
  private void dropDanglingReactions(String removedId, SortedSet<String> members) {
    for (String neighbor : network.getNeighbors(removedId)) {
      if (members.size() > 1 && members.contains(neighbor) && degreeWithin(neighbor, members) <= 1) {
        members.remove(neighbor);
      }
    }
  }

  private boolean isSignificant(String id) {
    CompositeScore score = scores.getScore(id);
    return !score.isMissing() && score.getPValue() < config.getSignificanceCutoff();
  }

  private int degreeWithin(String id, SortedSet<String> members) {
    int degree = 0;
    for (String neighbor : network.getNeighbors(id)) {
      if (members.contains(neighbor)) {
        degree++;
      }
    }
    return degree;
  }
}
