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

import com.twentyn.activemodules.network.BipartiteNetwork;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.Callable;

/**
 * Grows one module from one seed by steepest-ascent hill climbing.
 *
 * Each step considers adding any node within the depth bound of the module, together with the shortest path that
 * connects it, and removing any non-seed member whose removal keeps the module connected.  The best strictly
 * improving move is applied until none is left or a budget runs out.
 *
 * Restart 0 starts from the seed alone and breaks ties by the smallest sorted member list.  Later restarts start
 * from a random walk around the seed and break ties at random, drawing from a generator derived from the random
 * seed, the seed node and the restart index so that results don't depend on which thread runs the search.
 */
public class SeedSearch implements Callable<SearchOutcome> {

  private static final Logger LOGGER = LogManager.getFormatterLogger(SeedSearch.class);

  // A move must raise the score by more than this to be taken; scores closer than this are ties.
  static final double MIN_IMPROVEMENT = 1e-12;

  private final ModuleScorer scorer;
  private final String seedId;
  private final int restartIndex;
  private final int maxDepth;
  private final int maxIterations;
  private final long randomSeed;
  private final long deadlineMillis;

  /**
   * @param deadlineMillis Epoch time after which the search stops with its best-so-far module; Long.MAX_VALUE for
   *                       no deadline.
   */
  public SeedSearch(ModuleScorer scorer, String seedId, int restartIndex, int maxDepth, int maxIterations,
                    long randomSeed, long deadlineMillis) {
    this.scorer = scorer;
    this.seedId = seedId;
    this.restartIndex = restartIndex;
    this.maxDepth = maxDepth;
    this.maxIterations = maxIterations;
    this.randomSeed = randomSeed;
    this.deadlineMillis = deadlineMillis;
  }

  public String getSeedId() {
    return seedId;
  }

  public int getRestartIndex() {
    return restartIndex;
  }

  static long deriveSeed(long randomSeed, String seedId, int restartIndex) {
    long seed = randomSeed;
    seed = seed * 1_000_003L + seedId.hashCode();
    seed = seed * 1_000_003L + restartIndex;
    return seed;
  }

  @Override
  public SearchOutcome call() {
    BipartiteNetwork network = scorer.getNetwork();
    network.getNodeById(seedId);

    Random random = restartIndex == 0 ? null : new Random(deriveSeed(randomSeed, seedId, restartIndex));
    Set<String> region = scorer.getScoringRegion(seedId);

    SortedSet<String> members = random == null ? new TreeSet<>() : randomWalk(network, random);
    members.add(seedId);
    double currentScore = scorer.score(members, region);

    int iterations = 0;
    boolean complete = false;
    while (true) {
      if (Thread.currentThread().isInterrupted()) {
        LOGGER.debug("Search from %s (restart %d) interrupted after %d iterations", seedId, restartIndex, iterations);
        break;
      }
      if (System.currentTimeMillis() > deadlineMillis) {
        LOGGER.debug("Search from %s (restart %d) hit the time budget after %d iterations",
            seedId, restartIndex, iterations);
        break;
      }

      SortedSet<String> next = findBestMove(network, members, currentScore, region, random);
      if (next == null) {
        complete = true;
        break;
      }
      if (iterations >= maxIterations) {
        LOGGER.debug("Search from %s (restart %d) used its %d iterations", seedId, restartIndex, maxIterations);
        break;
      }
      members = next;
      currentScore = scorer.score(members, region);
      iterations++;
    }

    Module module = scorer.createModule(seedId, members, region);
    LOGGER.debug("Search from %s (restart %d) finished after %d iterations: %s",
        seedId, restartIndex, iterations, module);
    return new SearchOutcome(seedId, restartIndex, module, iterations, complete);
  }

  private SortedSet<String> randomWalk(BipartiteNetwork network, Random random) {
    SortedSet<String> visited = new TreeSet<>();
    String current = seedId;
    visited.add(current);
    int steps = 1 + random.nextInt(maxDepth);
    for (int i = 0; i < steps; i++) {
      List<String> neighbors = new ArrayList<>(network.getNeighbors(current));
      if (neighbors.isEmpty()) {
        break;
      }
      current = neighbors.get(random.nextInt(neighbors.size()));
      visited.add(current);
    }
    return visited;
  }

  /**
   * @return The member set after the best strictly improving move, or null at a local optimum.
   */
  private SortedSet<String> findBestMove(BipartiteNetwork network, SortedSet<String> members, double currentScore,
                                         Set<String> region, Random random) {
    List<SortedSet<String>> candidates = new ArrayList<>();

    Map<String, List<String>> paths = network.findShortestPaths(members, maxDepth);
    for (List<String> path : paths.values()) {
      if (path.isEmpty()) {
        continue;
      }
      SortedSet<String> grown = new TreeSet<>(members);
      grown.addAll(path);
      candidates.add(grown);
    }

    for (String member : members) {
      if (member.equals(seedId)) {
        continue;
      }
      SortedSet<String> shrunk = new TreeSet<>(members);
      shrunk.remove(member);
      if (network.isConnected(shrunk)) {
        candidates.add(shrunk);
      }
    }

    double bestScore = Double.NEGATIVE_INFINITY;
    List<SortedSet<String>> best = new ArrayList<>();
    for (SortedSet<String> candidate : candidates) {
      double score = scorer.score(candidate, region);
      if (score <= currentScore + MIN_IMPROVEMENT) {
        continue;
      }
      if (best.isEmpty() || score > bestScore + MIN_IMPROVEMENT) {
        bestScore = score;
        best.clear();
        best.add(candidate);
      } else if (score >= bestScore - MIN_IMPROVEMENT) {
        best.add(candidate);
      }
    }

    if (best.isEmpty()) {
      return null;
    }
    best.sort(Module::compareMemberLists);
    return random == null ? best.get(0) : best.get(random.nextInt(best.size()));
  }
}
