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

import com.twentyn.activemodules.ActiveModuleAnalysis;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.ParseException;
import org.junit.Before;
import org.junit.Test;

import java.io.File;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class CLIUtilTest {

  private CLIUtil cliUtil;

  @Before
  public void setUp() {
    cliUtil = new CLIUtil(ActiveModuleAnalysis.class, ActiveModuleAnalysis.HELP_MESSAGE,
        ActiveModuleAnalysis.OPTION_BUILDERS);
  }

  @Test
  public void testParsesFileOptions() throws Exception {
    CommandLine cl = cliUtil.parseCommandLine(new String[]{
        "-n", "nodes.tsv", "--edges", "edges.tsv", "-m", "measurements.tsv", "-o", "out"});

    assertEquals(new File("nodes.tsv"), CLIUtil.getFileOption(cl, ActiveModuleAnalysis.OPTION_NODES));
    assertEquals(new File("edges.tsv"), CLIUtil.getFileOption(cl, ActiveModuleAnalysis.OPTION_EDGES));
    assertNull("Config is optional", CLIUtil.getFileOption(cl, ActiveModuleAnalysis.OPTION_CONFIG));
  }

  @Test(expected = ParseException.class)
  public void testMissingRequiredOptionRejected() throws Exception {
    cliUtil.parseCommandLine(new String[]{"-n", "nodes.tsv"});
  }

  @Test
  public void testHelpSkipsRequiredOptions() throws Exception {
    CommandLine cl = cliUtil.parseCommandLine(new String[]{"--help"});
    assertTrue(cl.hasOption(CLIUtil.OPTION_HELP));
  }
}
