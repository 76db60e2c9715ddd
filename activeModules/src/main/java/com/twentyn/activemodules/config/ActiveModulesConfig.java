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

package com.twentyn.activemodules.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.twentyn.activemodules.utils.FileChecker;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;

/**
 * All parameters of one analysis run, read from a JSON file with "scoring", "search" and "selection" sections.
 * Every section is optional and falls back to its defaults.
 */
public class ActiveModulesConfig {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  static {
    OBJECT_MAPPER.enable(SerializationFeature.INDENT_OUTPUT);
  }

  @JsonProperty("scoring")
  private ScoringConfig scoring = new ScoringConfig();

  @JsonProperty("search")
  private SearchConfig search = new SearchConfig();

  @JsonProperty("selection")
  private SelectionConfig selection = new SelectionConfig();

  public ActiveModulesConfig() {
  }

  public ActiveModulesConfig(ScoringConfig scoring, SearchConfig search, SelectionConfig selection) {
    this.scoring = scoring;
    this.search = search;
    this.selection = selection;
  }

  public ScoringConfig getScoring() {
    return scoring;
  }

  public SearchConfig getSearch() {
    return search;
  }

  public SelectionConfig getSelection() {
    return selection;
  }

  /**
   * Checks every section, failing on the first bad value.
   *
   * @throws ConfigurationException naming the parameter at fault.
   */
  public void validate() {
    if (scoring == null) {
      throw new ConfigurationException("scoring", "section must not be null");
    }
    if (search == null) {
      throw new ConfigurationException("search", "section must not be null");
    }
    if (selection == null) {
      throw new ConfigurationException("selection", "section must not be null");
    }
    scoring.validate();
    search.validate();
    selection.validate();
  }

  /**
   * Reads and validates a configuration file.
   *
   * @throws IOException if the file can't be read or isn't valid JSON.
   * @throws ConfigurationException if an option is unknown or out of range.
   */
  public static ActiveModulesConfig readFromJsonFile(File inputFile) throws IOException {
    FileChecker.verifyInputFile(inputFile);
    ActiveModulesConfig config;
    try {
      config = OBJECT_MAPPER.readValue(inputFile, ActiveModulesConfig.class);
    } catch (UnrecognizedPropertyException e) {
      throw new ConfigurationException(e.getPropertyName(), "unknown option in " + inputFile.getName());
    }
    config.validate();
    return config;
  }

  public void writeToJsonFile(File outputFile) throws IOException {
    try (BufferedWriter writer = new BufferedWriter(new FileWriter(outputFile))) {
      OBJECT_MAPPER.writeValue(writer, this);
    }
  }
}
