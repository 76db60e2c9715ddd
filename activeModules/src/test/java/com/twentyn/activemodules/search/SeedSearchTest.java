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

import com.twentyn.activemodules.config.ScoringConfig;
import com.twentyn.activemodules.config.SearchConfig;
import com.twentyn.activemodules.network.BipartiteNetwork;
import com.twentyn.activemodules.scoring.CompositeScoreTable;
import com.twentyn.activemodules.scoring.SignificanceScorer;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SeedSearchTest {

  private BipartiteNetwork network;
  private CompositeScoreTable scores;
  private SearchConfig config;

  @Before
  public void setUp() {
    network = SearchTestNetworks.triple();
    scores = new SignificanceScorer(new ScoringConfig()).scoreNetwork(network);
    config = new SearchConfig();
  }

  private SearchOutcome runSearch(String seed, int restart) {
    ModuleScorer scorer = new ModuleScorer(network, scores, config);
    return new SeedSearch(scorer, seed, restart, config.getMaxDepth(), config.getMaxIterations(),
        config.getRandomSeed(), Long.MAX_VALUE).call();
  }

  @Test
  public void testClimbsToStrongNeighborThroughReaction() {
    // Act
    SearchOutcome outcome = runSearch("m1", 0);

    // Assert
    assertEquals("Module should join m1 and m2 through r1",
        new HashSet<>(Arrays.asList("m1", "r1", "m2")), outcome.getModule().getNodeIds());
    assertTrue("Search should stop at a local optimum", outcome.isComplete());
    assertEquals("One move reaches the optimum", 1, outcome.getIterations());
    assertEquals("Module remembers its seed", "m1", outcome.getModule().getSeedId());
  }

  @Test
  public void testWeakNodeIsNotAdded() {
    SearchOutcome outcome = runSearch("m2", 0);
    assertFalse("Adding m3 with r2 would lower the size-adjusted score", outcome.getModule().contains("m3"));
  }

  @Test
  public void testScoreMatchesModuleScorer() {
    // Arrange
    ModuleScorer scorer = new ModuleScorer(network, scores, config);
    Set<String> members = new HashSet<>(Arrays.asList("m1", "r1", "m2"));

    // Act
    double score = scorer.score(members, scorer.getScoringRegion("m1"));

    // Assert
    double z = scores.getScore("m1").getMagnitude() + scores.getScore("m2").getMagnitude();
    assertEquals("Size-adjusted sum of magnitudes", z / Math.sqrt(3.0), score, 1e-12);
    assertEquals(score, runSearch("m1", 0).getModule().getScore(), 1e-12);
  }

  @Test
  public void testRegionalScoringIgnoresDistantNodes() {
    ModuleScorer scorer = new ModuleScorer(network, scores, config);
    Set<String> region = scorer.getScoringRegion("m1");

    assertTrue(region.contains("m2"));
    assertFalse("m3 is four hops from m1", region.contains("m3"));
    double withM3 = scorer.score(new HashSet<>(Arrays.asList("m1", "r1", "m2", "r2", "m3")), region);
    double withoutM3 = scorer.score(new HashSet<>(Arrays.asList("m1", "r1", "m2", "r2", "m3")), null);
    assertTrue("Distant members only count without regional scoring", withoutM3 > withM3);
  }

  @Test
  public void testUnadjustedScoreIsPlainSum() {
    config.setSizeAdjustment(false);
    ModuleScorer scorer = new ModuleScorer(network, scores, config);

    double score = scorer.score(new HashSet<>(Arrays.asList("m1", "r1")), null);

    assertEquals(scores.getScore("m1").getMagnitude(), score, 1e-12);
  }

  @Test
  public void testIterationBudgetStopsSearch() {
    config.setMaxIterations(1);
    config.setSizeAdjustment(false);
    config.setRegionalScoring(false);
    network = SearchTestNetworks.chain(8);
    scores = new SignificanceScorer(new ScoringConfig()).scoreNetwork(network);

    SearchOutcome outcome = runSearch(SearchTestNetworks.metabolite(3), 0);

    assertFalse("Search with moves left over is incomplete", outcome.isComplete());
    assertEquals(1, outcome.getIterations());
    assertTrue("Best-so-far module is connected", network.isConnected(outcome.getModule().getNodeIds()));
  }

  @Test
  public void testExpiredDeadlineReturnsSeedOnly() {
    ModuleScorer scorer = new ModuleScorer(network, scores, config);

    SearchOutcome outcome = new SeedSearch(scorer, "m1", 0, 2, 100, 42L, 0L).call();

    assertFalse(outcome.isComplete());
    assertEquals(new HashSet<>(Arrays.asList("m1")), outcome.getModule().getNodeIds());
  }

  @Test
  public void testRestartsAreReproducible() {
    network = SearchTestNetworks.chain(12);
    scores = new SignificanceScorer(new ScoringConfig()).scoreNetwork(network);

    SearchOutcome first = runSearch(SearchTestNetworks.metabolite(5), 3);
    SearchOutcome second = runSearch(SearchTestNetworks.metabolite(5), 3);

    assertEquals("Same seed and restart give the same module",
        first.getModule().getNodeIds(), second.getModule().getNodeIds());
    assertTrue("Restarts keep their seed", first.getModule().contains(SearchTestNetworks.metabolite(5)));
  }

  @Test
  public void testDerivedSeedsDiffer() {
    assertFalse(SeedSearch.deriveSeed(42L, "m1", 1) == SeedSearch.deriveSeed(42L, "m1", 2));
    assertFalse(SeedSearch.deriveSeed(42L, "m1", 1) == SeedSearch.deriveSeed(42L, "m2", 1));
  }
}
