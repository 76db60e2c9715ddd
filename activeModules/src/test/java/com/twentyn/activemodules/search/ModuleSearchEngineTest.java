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
import com.twentyn.activemodules.config.ScoringConfig;
import com.twentyn.activemodules.config.SearchConfig;
import com.twentyn.activemodules.network.BipartiteNetwork;
import com.twentyn.activemodules.network.NetworkBuilder;
import com.twentyn.activemodules.scoring.CompositeScoreTable;
import com.twentyn.activemodules.scoring.SignificanceScorer;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mockito;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.stream.Collectors;

import static com.twentyn.activemodules.search.SearchTestNetworks.metabolite;
import static com.twentyn.activemodules.search.SearchTestNetworks.reaction;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ModuleSearchEngineTest {

  private BipartiteNetwork network;
  private CompositeScoreTable scores;
  private SearchConfig config;

  @Before
  public void setUp() {
    network = SearchTestNetworks.chain(20);
    scores = new SignificanceScorer(new ScoringConfig()).scoreNetwork(network);
    config = new SearchConfig();
    config.setTargetModuleCount(5);
    config.setOverlapThresholds(Collections.singletonList(0.5));
    config.setNumThreads(4);
  }

  @Test
  public void testTwentySeedsYieldAtMostFiveModulesWithBoundedOverlap() throws Exception {
    // Arrange
    ModuleSearchEngine engine = new ModuleSearchEngine(network, scores, config);

    // Act
    PooledSearchResult result = engine.search();

    // Assert
    assertEquals("Every metabolite seeds one search", 20, result.getSearchCount());
    assertEquals("One threshold gives one run", 1, result.getThresholdResults().size());
    List<Module> accepted = result.getThresholdResults().get(0).getModules();
    assertTrue("At most K modules are accepted", accepted.size() <= 5);
    assertFalse("The chain holds more than enough candidates", accepted.isEmpty());
    for (int i = 0; i < accepted.size(); i++) {
      assertTrue("Accepted modules are connected", network.isConnected(accepted.get(i).getNodeIds()));
      for (int j = i + 1; j < accepted.size(); j++) {
        assertTrue("No two modules share more than half of the smaller one",
            accepted.get(i).overlapRatio(accepted.get(j)) <= 0.5);
      }
    }
    assertTrue("No search should fail", result.getFailures().isEmpty());
  }

  @Test
  public void testSearchIsDeterministic() throws Exception {
    config.setOverlapThresholds(SearchConfig.DEFAULT_OVERLAP_THRESHOLDS);
    config.setRestartsPerSeed(2);

    PooledSearchResult first = new ModuleSearchEngine(network, scores, config).search();
    config.setNumThreads(1);
    PooledSearchResult second = new ModuleSearchEngine(network, scores, config).search();

    assertEquals("Three searches per seed", 60, first.getSearchCount());
    assertEquals("Thread count doesn't change the outcome", describe(first.getModules()),
        describe(second.getModules()));
    for (Module module : first.getModules()) {
      assertEquals(first.getAcceptingThresholds(module), second.getAcceptingThresholds(module));
    }
  }

  private static List<String> describe(List<Module> modules) {
    return modules.stream().map(m -> m.getNodeIds() + "@" + m.getScore()).collect(Collectors.toList());
  }

  @Test
  public void testPooledModulesAreTaggedWithThresholds() throws Exception {
    config.setOverlapThresholds(Arrays.asList(0.25, 0.5, 0.75));

    PooledSearchResult result = new ModuleSearchEngine(network, scores, config).search();

    assertEquals(3, result.getThresholdResults().size());
    for (Module module : result.getModules()) {
      assertFalse("Every pooled module was accepted by some threshold",
          result.getAcceptingThresholds(module).isEmpty());
    }
    List<Module> sorted = new ArrayList<>(result.getModules());
    sorted.sort(Module.RANKING_ORDER);
    assertEquals("Pooled modules are ranked", sorted, result.getModules());
    assertEquals("Pooled modules are distinct", new HashSet<>(result.getModules()).size(),
        result.getModules().size());
  }

  @Test
  public void testAcceptSkipsOverlappingCandidates() {
    // Arrange
    ModuleScorer scorer = new ModuleScorer(network, scores, config);
    Module a = scorer.createModule(metabolite(0),
        new HashSet<>(Arrays.asList(metabolite(0), reaction(0), metabolite(1))));
    Module b = scorer.createModule(metabolite(1),
        new HashSet<>(Arrays.asList(metabolite(1), reaction(1), metabolite(2))));
    Module c = scorer.createModule(metabolite(0),
        new HashSet<>(Arrays.asList(metabolite(0), reaction(0), metabolite(1), reaction(1))));

    // Act
    SearchResult result = ModuleSearchEngine.accept(Arrays.asList(a, b, c), 0.5, 5);

    // Assert
    assertEquals("a and b share a third of their nodes", 1.0 / 3.0, a.overlapRatio(b), 1e-12);
    assertEquals("a lies inside c", 1.0, a.overlapRatio(c), 0.0);
    assertEquals(Arrays.asList(a, b), result.getModules());
    assertTrue("Fewer than K modules were found", result.isBudgetExhausted());
  }

  @Test
  public void testAcceptStopsAtTarget() {
    ModuleScorer scorer = new ModuleScorer(network, scores, config);
    List<Module> candidates = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      candidates.add(scorer.createModule(metabolite(2 * i), Collections.singleton(metabolite(2 * i))));
    }

    SearchResult result = ModuleSearchEngine.accept(candidates, 0.0, 5);

    assertEquals(5, result.getModules().size());
    assertFalse(result.isBudgetExhausted());
  }

  @Test
  public void testSmallNetworkExhaustsBudget() throws Exception {
    network = SearchTestNetworks.chain(3);
    scores = new SignificanceScorer(new ScoringConfig()).scoreNetwork(network);

    PooledSearchResult result = new ModuleSearchEngine(network, scores, config).search();

    assertTrue("Three seeds can't produce five disjoint modules", result.isBudgetExhausted());
    assertTrue(result.getThresholdResults().get(0).getModules().size() < 5);
  }

  @Test
  public void testPoolKeepsBestCopyOfDuplicateModules() {
    ModuleScorer scorer = new ModuleScorer(network, scores, config);
    HashSet<String> members = new HashSet<>(Arrays.asList(metabolite(0), reaction(0), metabolite(1)));
    Module weak = new Module(network, metabolite(0), members, 1.0, 0.5);
    Module strong = new Module(network, metabolite(1), members, 2.0, 0.5);
    Module other = scorer.createModule(metabolite(5), Collections.singleton(metabolite(5)));

    List<Module> pooled = ModuleSearchEngine.poolCandidates(Arrays.asList(
        new SearchOutcome(metabolite(0), 0, weak, 1, true),
        new SearchOutcome(metabolite(1), 0, strong, 1, true),
        new SearchOutcome(metabolite(5), 0, other, 0, true)));

    assertEquals("Duplicates collapse to one candidate", 2, pooled.size());
    assertTrue("The stronger copy survives", pooled.stream().anyMatch(m -> m.getScore() == 2.0));
    assertFalse(pooled.stream().anyMatch(m -> m.getScore() == 1.0));
  }

  @Test
  public void testFailingSeedDoesNotAbortOthers() throws Exception {
    // Arrange
    CompositeScoreTable brokenScores = Mockito.spy(scores);
    Mockito.doThrow(new IllegalStateException("corrupt score for m19"))
        .when(brokenScores).getScore(metabolite(19));

    // Act
    PooledSearchResult result = new ModuleSearchEngine(network, brokenScores, config).search();

    // Assert
    List<String> failedSeeds = result.getFailures().stream().map(SeedFailure::getSeedId)
        .collect(Collectors.toList());
    assertTrue("The seed on the broken node fails", failedSeeds.contains(metabolite(19)));
    assertFalse("Seeds far from the broken node succeed", failedSeeds.contains(metabolite(0)));
    assertTrue("The failure message is kept", result.getFailures().get(0).getMessage().contains("corrupt"));
    assertFalse("Other seeds still produce modules", result.getModules().isEmpty());
    for (Module module : result.getModules()) {
      assertFalse(module.contains(metabolite(19)));
    }
  }

  @Test
  public void testMainComponentOnlyRestrictsSeeds() throws Exception {
    // Arrange
    network = new NetworkBuilder()
        .addMetabolite("a1").addMetabolite("a2").addMetabolite("a3").addReaction("ra1").addReaction("ra2")
        .addMetabolite("b1").addMetabolite("b2").addReaction("rb1")
        .addEdge("a1", "ra1").addEdge("a2", "ra1").addEdge("a2", "ra2").addEdge("a3", "ra2")
        .addEdge("b1", "rb1").addEdge("b2", "rb1")
        .addMeasurement("a1", "s1", 1.0, 0.01)
        .addMeasurement("b1", "s1", 1.0, 0.01)
        .build();
    scores = new SignificanceScorer(new ScoringConfig()).scoreNetwork(network);
    config.setMainComponentOnly(true);

    // Act
    ModuleSearchEngine engine = new ModuleSearchEngine(network, scores, config);

    // Assert
    assertEquals(Arrays.asList("a1", "a2", "a3"), engine.resolveSeeds());
    assertFalse(engine.getSearchedNetwork().containsNode("b1"));
  }

  @Test
  public void testExplicitSeeds() throws Exception {
    config.setSeedIds(Arrays.asList(metabolite(3), metabolite(3), metabolite(10)));

    PooledSearchResult result = new ModuleSearchEngine(network, scores, config).search();

    assertEquals("Repeated seeds are searched once", 2, result.getSearchCount());
  }

  @Test
  public void testUnknownSeedRejected() {
    config.setSeedIds(Collections.singletonList("nowhere"));
    try {
      new ModuleSearchEngine(network, scores, config).resolveSeeds();
      org.junit.Assert.fail("Unknown seed should be rejected");
    } catch (ConfigurationException e) {
      assertEquals("search.seed_ids", e.getParameter());
    }
  }

  @Test
  public void testDeadline() {
    assertEquals("No budget means no deadline", Long.MAX_VALUE, ModuleSearchEngine.deadlineFor(1000L, 0L));
    assertEquals(1500L, ModuleSearchEngine.deadlineFor(1000L, 500L));
    assertEquals("A budget past the end of time means no deadline", Long.MAX_VALUE,
        ModuleSearchEngine.deadlineFor(System.currentTimeMillis(), Long.MAX_VALUE));
  }

  @Test
  public void testHugeTimeBudgetDoesNotCutSearchesShort() throws Exception {
    // Arrange
    network = SearchTestNetworks.triple();
    scores = new SignificanceScorer(new ScoringConfig()).scoreNetwork(network);
    PooledSearchResult unbounded = new ModuleSearchEngine(network, scores, config).search();
    config.setTimeBudgetMillis(Long.MAX_VALUE);
    config.validate();

    // Act
    PooledSearchResult result = new ModuleSearchEngine(network, scores, config).search();

    // Assert
    assertEquals("Every search reaches a local optimum", 0, result.getIncompleteSearchCount());
    assertEquals(describe(unbounded.getModules()), describe(result.getModules()));
    assertTrue(result.getModules().stream().anyMatch(m -> m.size() > 1));
  }

  @Test
  public void testExpiredDeadlineKeepsPartialResults() throws Exception {
    // Arrange
    network = SearchTestNetworks.triple();
    scores = new SignificanceScorer(new ScoringConfig()).scoreNetwork(network);
    ModuleSearchEngine engine = new ModuleSearchEngine(network, scores, config);

    // Act
    PooledSearchResult result = engine.search(engine.resolveSeeds(), 0L);

    // Assert
    assertEquals(3, result.getSearchCount());
    assertEquals("Every search stops before its first move", 3, result.getIncompleteSearchCount());
    assertTrue("Failures are for errors, not for running out of time", result.getFailures().isEmpty());
    assertFalse("Best-so-far modules are still accepted", result.getModules().isEmpty());
    for (Module module : result.getModules()) {
      assertEquals("Only the seed is in each module", 1, module.size());
    }
  }
}
