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

public class SeedFailure {

  private final String seedId;
  private final int restartIndex;
  private final String message;

  public SeedFailure(String seedId, int restartIndex, String message) {
    this.seedId = seedId;
    this.restartIndex = restartIndex;
    this.message = message;
  }

  public String getSeedId() {
    return seedId;
  }

  public int getRestartIndex() {
    return restartIndex;
  }

  public String getMessage() {
    return message;
  }

  @Override
  public String toString() {
    return String.format("SeedFailure{seed=%s, restart=%d, message=%s}", seedId, restartIndex, message);
  }
}
