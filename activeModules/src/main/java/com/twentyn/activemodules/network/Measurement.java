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

package com.twentyn.activemodules.network;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single study's measured change for one metabolite: a fold-change and the p-value of the test behind it.
 */
@JsonIgnoreProperties(value = {"p_value_log"}, allowGetters = true)
public class Measurement {

  @JsonProperty("fold_change")
  private final Double foldChange;

  @JsonProperty("p_value")
  private final Double pValue;

  @JsonCreator
  public Measurement(@JsonProperty("fold_change") Double foldChange,
                     @JsonProperty("p_value") Double pValue) {
    if (foldChange == null || pValue == null) {
      throw new IllegalArgumentException("Measurement needs both a fold change and a p-value.");
    }
    if (foldChange.isNaN() || foldChange.isInfinite()) {
      throw new IllegalArgumentException("Fold change must be finite, got " + foldChange);
    }
    if (pValue.isNaN() || pValue < 0.0 || pValue > 1.0) {
      throw new IllegalArgumentException("P-value must lie in [0, 1], got " + pValue);
    }
    this.foldChange = foldChange;
    this.pValue = pValue;
  }

  public Double getFoldChange() {
    return foldChange;
  }

  @JsonProperty("p_value")
  public Double getPValue() {
    return pValue;
  }

  /**
   * Base-10 logarithm of the p-value, as reported alongside fold changes for color scales.
   */
  @JsonProperty("p_value_log")
  public Double getPValueLog() {
    return Math.log10(pValue);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Measurement that = (Measurement) o;
    return foldChange.equals(that.foldChange) && pValue.equals(that.pValue);
  }

  @Override
  public int hashCode() {
    return Objects.hash(foldChange, pValue);
  }

  @Override
  public String toString() {
    return String.format("Measurement{fold_change=%s, p_value=%s}", foldChange, pValue);
  }
}
