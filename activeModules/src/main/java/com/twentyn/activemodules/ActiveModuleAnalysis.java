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

package com.twentyn.activemodules;

import com.twentyn.activemodules.config.ActiveModulesConfig;
import com.twentyn.activemodules.export.EnrichedNetwork;
import com.twentyn.activemodules.export.ModuleReport;
import com.twentyn.activemodules.export.ResultExporter;
import com.twentyn.activemodules.network.BipartiteNetwork;
import com.twentyn.activemodules.network.NetworkStats;
import com.twentyn.activemodules.network.NetworkTSVParser;
import com.twentyn.activemodules.scoring.CompositeScoreTable;
import com.twentyn.activemodules.scoring.SignificanceScorer;
import com.twentyn.activemodules.search.ModuleSearchEngine;
import com.twentyn.activemodules.search.PooledSearchResult;
import com.twentyn.activemodules.selection.ClusterSelector;
import com.twentyn.activemodules.selection.SelectedModule;
import com.twentyn.activemodules.selection.SelectionResult;
import com.twentyn.activemodules.utils.CLIUtil;
import com.twentyn.activemodules.utils.FileChecker;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the whole active module workflow over files: read and score the network, search for modules at every
 * configured overlap threshold, select and rank clusters, and write the results.
 */
public class ActiveModuleAnalysis {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ActiveModuleAnalysis.class);

  public static final String OPTION_NODES = "n";
  public static final String OPTION_EDGES = "e";
  public static final String OPTION_MEASUREMENTS = "m";
  public static final String OPTION_CONFIG = "c";
  public static final String OPTION_OUTPUT_DIR = "o";

  public static final String EFFECTIVE_CONFIG_FILE_NAME = "effective_config.json";

  public static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "Finds active modules in a metabolite-reaction network: connected groups of metabolites whose measured ",
      "changes across studies are jointly significant.  Writes the ranked modules (JSON and TSV) and the network ",
      "annotated with composite scores to the output directory."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_NODES)
        .argName("nodes file")
        .desc("TSV of network nodes with columns 'id' and 'type' (metabolite or reaction)")
        .hasArg().required()
        .longOpt("nodes")
    );
    add(Option.builder(OPTION_EDGES)
        .argName("edges file")
        .desc("TSV of metabolite-reaction edges with columns 'source' and 'target'")
        .hasArg().required()
        .longOpt("edges")
    );
    add(Option.builder(OPTION_MEASUREMENTS)
        .argName("measurements file")
        .desc("TSV of per-study measurements with columns 'node_id', 'study_id', 'fold_change' and 'p_value'")
        .hasArg().required()
        .longOpt("measurements")
    );
    add(Option.builder(OPTION_CONFIG)
        .argName("config file")
        .desc("JSON configuration with optional 'scoring', 'search' and 'selection' sections; defaults apply " +
            "when absent")
        .hasArg()
        .longOpt("config")
    );
    add(Option.builder(OPTION_OUTPUT_DIR)
        .argName("output directory")
        .desc("Directory to write results to; created if it doesn't exist")
        .hasArg().required()
        .longOpt("output-dir")
    );
  }};

  /**
   * Everything one analysis computed, before anything is written.
   */
  public static class AnalysisResult {
    private final BipartiteNetwork network;
    private final CompositeScoreTable scores;
    private final PooledSearchResult searchResult;
    private final SelectionResult selectionResult;

    public AnalysisResult(BipartiteNetwork network, CompositeScoreTable scores, PooledSearchResult searchResult,
                          SelectionResult selectionResult) {
      this.network = network;
      this.scores = scores;
      this.searchResult = searchResult;
      this.selectionResult = selectionResult;
    }

    public BipartiteNetwork getNetwork() {
      return network;
    }

    public CompositeScoreTable getScores() {
      return scores;
    }

    public PooledSearchResult getSearchResult() {
      return searchResult;
    }

    public SelectionResult getSelectionResult() {
      return selectionResult;
    }

    public List<SelectedModule> getSelectedModules() {
      return selectionResult.getSelected();
    }
  }

  public static void main(String[] args) {
    CLIUtil cliUtil = new CLIUtil(ActiveModuleAnalysis.class, HELP_MESSAGE, OPTION_BUILDERS);
    CommandLine cl;
    try {
      cl = cliUtil.parseCommandLine(args);
    } catch (ParseException e) {
      System.exit(1);
      return;
    }
    if (cl.hasOption(CLIUtil.OPTION_HELP)) {
      cliUtil.printHelp();
      return;
    }

    try {
      run(CLIUtil.getFileOption(cl, OPTION_NODES),
          CLIUtil.getFileOption(cl, OPTION_EDGES),
          CLIUtil.getFileOption(cl, OPTION_MEASUREMENTS),
          CLIUtil.getFileOption(cl, OPTION_CONFIG),
          CLIUtil.getFileOption(cl, OPTION_OUTPUT_DIR));
    } catch (IOException | IllegalArgumentException | IllegalStateException e) {
      LOGGER.error("Analysis failed: %s", e.getMessage());
      System.exit(1);
    } catch (InterruptedException e) {
      LOGGER.error("Analysis interrupted");
      Thread.currentThread().interrupt();
      System.exit(1);
    }
  }

  /**
   * Runs the analysis over files and writes the results.
   *
   * @param configFile A JSON config file, or null to use defaults.
   * @throws IOException if an input is unreadable or malformed, or an output can't be written.
   * @throws com.twentyn.activemodules.config.ConfigurationException for an invalid configuration, raised before
   *         the network is read.
   * @throws com.twentyn.activemodules.network.StructuralException if the network isn't bipartite.
   */
  public static AnalysisResult run(File nodesFile, File edgesFile, File measurementsFile, File configFile,
                                   File outputDir) throws IOException, InterruptedException {
    ActiveModulesConfig config = configFile == null ? new ActiveModulesConfig() :
        ActiveModulesConfig.readFromJsonFile(configFile);
    config.validate();
    LOGGER.info("Loaded configuration from %s", configFile == null ? "defaults" : configFile.getAbsolutePath());

    FileChecker.verifyOrCreateDirectory(outputDir);
    File networkFile = FileChecker.resolveOutputFile(outputDir, ResultExporter.NETWORK_FILE_NAME);
    File modulesJsonFile = FileChecker.resolveOutputFile(outputDir, ResultExporter.MODULES_JSON_FILE_NAME);
    File modulesTsvFile = FileChecker.resolveOutputFile(outputDir, ResultExporter.MODULES_TSV_FILE_NAME);
    File effectiveConfigFile = FileChecker.resolveOutputFile(outputDir, EFFECTIVE_CONFIG_FILE_NAME);

    BipartiteNetwork network = NetworkTSVParser.parseNetwork(nodesFile, edgesFile, measurementsFile);
    AnalysisResult result = analyze(network, config);

    EnrichedNetwork enriched = ResultExporter.enrichNetwork(result.getNetwork(), result.getScores());
    ResultExporter.writeNetwork(enriched, networkFile);
    ModuleReport report = ResultExporter.buildReport(result.getSelectionResult(), result.getSearchResult());
    ResultExporter.writeReport(report, modulesJsonFile);
    ResultExporter.writeModulesTSV(result.getSelectedModules(), modulesTsvFile);
    config.writeToJsonFile(effectiveConfigFile);

    LOGGER.info("Done: %d modules written to %s", result.getSelectedModules().size(), outputDir.getAbsolutePath());
    return result;
  }

  /**
   * Scores, searches and selects over an in-memory network.  Does no I/O.
   *
   * @param config A validated configuration.
   */
  public static AnalysisResult analyze(BipartiteNetwork network, ActiveModulesConfig config)
      throws InterruptedException {
    new NetworkStats(network).log();

    SignificanceScorer scorer = new SignificanceScorer(config.getScoring());
    CompositeScoreTable scores = scorer.scoreNetwork(network);

    ModuleSearchEngine engine = new ModuleSearchEngine(network, scores, config.getSearch());
    PooledSearchResult searchResult = engine.search();
    if (!searchResult.getFailures().isEmpty()) {
      LOGGER.warn("%d of %d searches failed; see the module report for details",
          searchResult.getFailures().size(), searchResult.getSearchCount());
    }

    ClusterSelector selector = new ClusterSelector(config.getSelection(), engine.getScorer());
    SelectionResult selectionResult = selector.select(searchResult);
    return new AnalysisResult(network, scores, searchResult, selectionResult);
  }
}
