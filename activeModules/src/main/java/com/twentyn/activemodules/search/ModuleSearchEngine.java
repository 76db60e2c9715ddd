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

import com.twentyn.activemodules.config.ConfigurationException;
import com.twentyn.activemodules.config.SearchConfig;
import com.twentyn.activemodules.network.BipartiteNetwork;
import com.twentyn.activemodules.network.NetworkNode;
import com.twentyn.activemodules.scoring.CompositeScoreTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

/**
 * Finds high-scoring, mostly disjoint modules in a scored network.
 *
 * Every seed (and every restart of every seed) is an independent {@link SeedSearch} run on a fixed thread pool.
 * The locally optimal modules they return are pooled once, deduplicated and ranked; then a greedy acceptance pass
 * runs for each overlap threshold, as its own task, taking modules in ranking order and skipping any whose overlap
 * with an already accepted module exceeds the threshold.  Results are always gathered in submission order, so the
 * output does not depend on thread scheduling.
 */
public class ModuleSearchEngine {

  private static final Logger LOGGER = LogManager.getFormatterLogger(ModuleSearchEngine.class);

  private final BipartiteNetwork fullNetwork;
  private final BipartiteNetwork network;
  private final SearchConfig config;
  private final ModuleScorer scorer;

  /**
   * @param network The network to search.  Restricted to its largest component if the config asks for it.
   * @param scores Composite scores for every node of the network.
   * @param config A validated search configuration.
   */
  public ModuleSearchEngine(BipartiteNetwork network, CompositeScoreTable scores, SearchConfig config) {
    this.fullNetwork = network;
    this.network = config.getMainComponentOnly() ? network.getLargestComponent() : network;
    this.config = config;
    this.scorer = new ModuleScorer(this.network, scores, config);
  }

  public BipartiteNetwork getSearchedNetwork() {
    return network;
  }

  public ModuleScorer getScorer() {
    return scorer;
  }

  /**
   * @return The configured seeds, or every metabolite of the searched network if none are configured.
   * @throws ConfigurationException if a configured seed is not a node of the network.
   */
  public List<String> resolveSeeds() {
    if (config.getSeedIds() == null) {
      return network.getMetabolites().stream().map(NetworkNode::getId).collect(Collectors.toList());
    }
    Set<String> seeds = new LinkedHashSet<>();
    for (String id : config.getSeedIds()) {
      if (!fullNetwork.containsNode(id)) {
        throw new ConfigurationException("search.seed_ids", "unknown node id " + id);
      }
      if (!network.containsNode(id)) {
        LOGGER.warn("Seed %s lies outside the main component and will not be searched", id);
        continue;
      }
      seeds.add(id);
    }
    return new ArrayList<>(seeds);
  }

  public PooledSearchResult search() throws InterruptedException {
    return search(resolveSeeds());
  }

  /**
   * Explores from every given seed and runs the acceptance pass for every configured overlap threshold.
   *
   * @param seedIds The seed nodes, in the order their searches are submitted.
   * @return The per-threshold results and their pooled module list.
   * @throws InterruptedException if the calling thread is interrupted while waiting for searches.
   */
  public PooledSearchResult search(List<String> seedIds) throws InterruptedException {
    return search(seedIds, deadlineFor(System.currentTimeMillis(), config.getTimeBudgetMillis()));
  }

  /**
   * @return The epoch time at which a budget started at startMillis runs out; Long.MAX_VALUE for a budget of 0 or
   *         one that reaches past the end of time.
   */
  static long deadlineFor(long startMillis, long budgetMillis) {
    if (budgetMillis == 0L || budgetMillis > Long.MAX_VALUE - startMillis) {
      return Long.MAX_VALUE;
    }
    return startMillis + budgetMillis;
  }

  PooledSearchResult search(List<String> seedIds, long deadline) throws InterruptedException {
    List<SeedSearch> tasks = new ArrayList<>();
    for (String seedId : seedIds) {
      for (int restart = 0; restart <= config.getRestartsPerSeed(); restart++) {
        tasks.add(new SeedSearch(scorer, seedId, restart, config.getMaxDepth(), config.getMaxIterations(),
            config.getRandomSeed(), deadline));
      }
    }
    LOGGER.info("Running %d searches from %d seeds on %d threads",
        tasks.size(), seedIds.size(), config.getNumThreads());

    ExecutorService executor = Executors.newFixedThreadPool(config.getNumThreads());
    try {
      List<Future<SearchOutcome>> futures = new ArrayList<>(tasks.size());
      for (SeedSearch task : tasks) {
        futures.add(executor.submit(task));
      }

      List<SearchOutcome> outcomes = new ArrayList<>(tasks.size());
      List<SeedFailure> failures = new ArrayList<>();
      for (int i = 0; i < futures.size(); i++) {
        SeedSearch task = tasks.get(i);
        try {
          outcomes.add(futures.get(i).get());
        } catch (ExecutionException e) {
          Throwable cause = e.getCause() == null ? e : e.getCause();
          String message = cause.getMessage() == null ? cause.toString() : cause.getMessage();
          LOGGER.error("Search from seed %s (restart %d) failed: %s",
              task.getSeedId(), task.getRestartIndex(), message);
          failures.add(new SeedFailure(task.getSeedId(), task.getRestartIndex(), message));
        }
      }

      int incomplete = (int) outcomes.stream().filter(o -> !o.isComplete()).count();
      if (incomplete > 0) {
        LOGGER.warn("%d of %d searches stopped before reaching a local optimum", incomplete, outcomes.size());
      }

      List<Module> candidates = poolCandidates(outcomes);
      LOGGER.info("Pooled %d distinct candidate modules from %d searches", candidates.size(), outcomes.size());

      int target = config.getTargetModuleCount();
      List<Future<SearchResult>> acceptances = new ArrayList<>();
      for (Double threshold : config.getOverlapThresholds()) {
        acceptances.add(executor.submit(() -> accept(candidates, threshold, target)));
      }
      List<SearchResult> results = new ArrayList<>(acceptances.size());
      for (Future<SearchResult> acceptance : acceptances) {
        try {
          results.add(acceptance.get());
        } catch (ExecutionException e) {
          throw new IllegalStateException("Acceptance pass failed", e.getCause());
        }
      }

      return new PooledSearchResult(results, tasks.size(), candidates.size(), incomplete, failures);
    } finally {
      executor.shutdownNow();
    }
  }

  /**
   * Deduplicates the modules found by all searches by member set, keeping the higher-scoring copy, and sorts them
   * best first.
   */
  public static List<Module> poolCandidates(List<SearchOutcome> outcomes) {
    Map<SortedSet<String>, Module> distinct = new LinkedHashMap<>();
    for (SearchOutcome outcome : outcomes) {
      Module module = outcome.getModule();
      distinct.merge(module.getNodeIds(), module,
          (kept, found) -> Module.RANKING_ORDER.compare(found, kept) < 0 ? found : kept);
    }
    List<Module> candidates = new ArrayList<>(distinct.values());
    candidates.sort(Module.RANKING_ORDER);
    return candidates;
  }

  /**
   * Greedily accepts ranked candidates whose overlap with every accepted module is at most the threshold.
   *
   * @param candidates Candidate modules, best first.
   * @param overlapThreshold Largest overlap ratio allowed between two accepted modules.
   * @param targetCount Stop once this many modules are accepted.
   */
  public static SearchResult accept(List<Module> candidates, double overlapThreshold, int targetCount) {
    List<Module> accepted = new ArrayList<>();
    for (Module candidate : candidates) {
      if (accepted.size() >= targetCount) {
        break;
      }
      boolean overlaps = false;
      for (Module module : accepted) {
        if (candidate.overlapRatio(module) > overlapThreshold) {
          overlaps = true;
          break;
        }
      }
      if (!overlaps) {
        accepted.add(candidate);
      }
    }

    boolean exhausted = accepted.size() < targetCount;
    if (exhausted) {
      LOGGER.info("Overlap threshold %.2f: only %d of %d modules could be accepted",
          overlapThreshold, accepted.size(), targetCount);
    } else {
      LOGGER.info("Overlap threshold %.2f: accepted %d modules", overlapThreshold, accepted.size());
    }
    return new SearchResult(overlapThreshold, Collections.unmodifiableList(accepted), exhausted);
  }
}
