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

package com.twentyn.activemodules.utils;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Reads a tab-separated file with a header line into one map per row.  Rows remember the line they came from so
 * that callers can point at the offending line when a value is bad.
 */
public class TSVParser {

  public static final CSVFormat TSV_FORMAT = CSVFormat.TDF.builder()
      .setHeader()
      .setSkipHeaderRecord(true)
      .setIgnoreEmptyLines(true)
      .setTrim(true)
      .build();

  private final String sourceName;
  private List<Row> results = null;
  private Map<String, Integer> headerMap = null;

  public TSVParser(String sourceName) {
    this.sourceName = sourceName;
  }

  public void parse(File file) throws IOException {
    try (InputStream in = new FileInputStream(file)) {
      parse(in);
    }
  }

  public void parse(InputStream inStream) throws IOException {
    List<Row> rows = new ArrayList<>();
    try (CSVParser parser = new CSVParser(new InputStreamReader(inStream, StandardCharsets.UTF_8), TSV_FORMAT)) {
      headerMap = parser.getHeaderMap();
      for (CSVRecord record : parser) {
        rows.add(new Row(parser.getCurrentLineNumber(), record.toMap()));
      }
    }
    this.results = rows;
  }

  /**
   * @throws IOException if the parsed header lacks any of the required columns.
   */
  public void verifyColumns(Collection<String> requiredColumns) throws IOException {
    for (String column : requiredColumns) {
      if (headerMap == null || !headerMap.containsKey(column)) {
        throw new IOException(String.format("%s is missing required column '%s'", sourceName, column));
      }
    }
  }

  public List<Row> getResults() {
    return Collections.unmodifiableList(results);
  }

  public String getSourceName() {
    return sourceName;
  }

  /**
   * One parsed line of the file.
   */
  public class Row {
    private final long lineNumber;
    private final Map<String, String> values;

    Row(long lineNumber, Map<String, String> values) {
      this.lineNumber = lineNumber;
      this.values = values;
    }

    public long getLineNumber() {
      return lineNumber;
    }

    /**
     * @throws IOException if the value is absent or blank.
     */
    public String getRequired(String column) throws IOException {
      String value = values.get(column);
      if (value == null || value.isEmpty()) {
        throw new IOException(String.format("%s line %d: empty value in column '%s'",
            sourceName, lineNumber, column));
      }
      return value;
    }

    /**
     * @throws IOException if the value is absent or not a number.
     */
    public double getDouble(String column) throws IOException {
      String value = getRequired(column);
      try {
        return Double.parseDouble(value);
      } catch (NumberFormatException e) {
        throw new IOException(String.format("%s line %d: '%s' in column '%s' is not a number",
            sourceName, lineNumber, value, column), e);
      }
    }
  }
}
