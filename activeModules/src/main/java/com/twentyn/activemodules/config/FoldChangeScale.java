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

/**
 * How fold-change values in the measurement table are expressed.
 */
public enum FoldChangeScale {
  // Signed base-2 logarithm of the ratio; used as-is.
  LOG2,
  // Plain ratio of the two group means; must be positive.
  RATIO;

  /**
   * Converts a fold-change on this scale to a signed log2 fold-change.
   *
   * @throws IllegalArgumentException for a non-positive ratio.
   */
  public double toLog2(double foldChange) {
    switch (this) {
      case LOG2:
        return foldChange;
      case RATIO:
        if (foldChange <= 0.0) {
          throw new IllegalArgumentException("Fold change ratio must be positive, got " + foldChange);
        }
        return Math.log(foldChange) / Math.log(2.0);
      default:
        throw new IllegalStateException("Unhandled fold change scale " + this);
    }
  }
}
