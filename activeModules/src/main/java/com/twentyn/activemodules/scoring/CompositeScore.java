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

package com.twentyn.activemodules.scoring;

/**
 * The combined evidence of change for one node across all studies that measured it.  A node no study measured has
 * a missing score, which is distinct from a score of zero: its z-score and p-value cannot be read.
 */
public class CompositeScore {

  private static final CompositeScore MISSING = new CompositeScore(0.0, 1.0, 0.0, 0);

  private final double zScore;
  private final double pValue;
  private final double foldChange;
  private final int contributingStudies;

  public CompositeScore(double zScore, double pValue, double foldChange, int contributingStudies) {
    if (contributingStudies < 0) {
      throw new IllegalArgumentException("Contributing study count must be non-negative: " + contributingStudies);
    }
    this.zScore = zScore;
    this.pValue = pValue;
    this.foldChange = foldChange;
    this.contributingStudies = contributingStudies;
  }

  public static CompositeScore missing() {
    return MISSING;
  }

  public boolean isMissing() {
    return contributingStudies == 0;
  }

  /**
   * @return The signed composite z-score: positive for accumulation, negative for depletion.
   * @throws IllegalStateException if the score is missing.
   */
  public double getZScore() {
    checkNotMissing();
    return zScore;
  }

  /**
   * @return The two-sided p-value of the composite z-score.
   * @throws IllegalStateException if the score is missing.
   */
  public double getPValue() {
    checkNotMissing();
    return pValue;
  }

  /**
   * @return The weighted mean log2 fold-change over contributing studies.
   * @throws IllegalStateException if the score is missing.
   */
  public double getFoldChange() {
    checkNotMissing();
    return foldChange;
  }

  /**
   * @return The absolute z-score, or 0 for a missing score.  This is what a node adds to a module's score.
   */
  public double getMagnitude() {
    return isMissing() ? 0.0 : Math.abs(zScore);
  }

  public int getContributingStudies() {
    return contributingStudies;
  }

  private void checkNotMissing() {
    if (isMissing()) {
      throw new IllegalStateException("Score is missing: no study measured this node");
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    CompositeScore that = (CompositeScore) o;
    if (isMissing() || that.isMissing()) {
      return isMissing() == that.isMissing();
    }
    return Double.compare(zScore, that.zScore) == 0 &&
        Double.compare(pValue, that.pValue) == 0 &&
        Double.compare(foldChange, that.foldChange) == 0 &&
        contributingStudies == that.contributingStudies;
  }

  @Override
  public int hashCode() {
    if (isMissing()) {
      return 0;
    }
    int result = Double.hashCode(zScore);
    result = 31 * result + Double.hashCode(pValue);
    result = 31 * result + Double.hashCode(foldChange);
    result = 31 * result + contributingStudies;
    return result;
  }

  @Override
  public String toString() {
    if (isMissing()) {
      return "CompositeScore{missing}";
    }
    return String.format("CompositeScore{z=%.4f, p=%.4g, fold_change=%.4f, studies=%d}",
        zScore, pValue, foldChange, contributingStudies);
  }
}
