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
import org.apache.commons.csv.CSVPrinter;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes rows of column-keyed values as a tab-separated file.  Columns are written in header order and values
 * absent from a row are written empty.
 */
public class TSVWriter<K, V> implements AutoCloseable {
  public static final CSVFormat TSV_FORMAT = CSVFormat.TDF.builder()
      .setRecordSeparator('\n')
      .build();

  private final List<K> header;
  private CSVPrinter printer;

  public TSVWriter(List<K> header) {
    this.header = header;
  }

  public void open(File f) throws IOException {
    open(new OutputStreamWriter(new FileOutputStream(f), StandardCharsets.UTF_8));
  }

  public void open(Writer writer) throws IOException {
    String[] headerStrings = new String[header.size()];
    for (int i = 0; i < header.size(); i++) {
      headerStrings[i] = header.get(i).toString();
    }
    printer = new CSVPrinter(writer, TSV_FORMAT.builder().setHeader(headerStrings).build());
  }

  @Override
  public void close() throws IOException {
    if (printer != null) {
      printer.close();
      printer = null;
    }
  }

  public void append(Map<K, V> row) throws IOException {
    if (printer == null) {
      throw new IllegalStateException("TSVWriter must be opened before rows are appended");
    }
    List<V> vals = new ArrayList<>(header.size());
    for (K field : header) {
      vals.add(row.get(field));
    }
    printer.printRecord(vals);
  }

  public void append(List<Map<K, V>> rows) throws IOException {
    for (Map<K, V> row : rows) {
      append(row);
    }
    printer.flush();
  }
}
