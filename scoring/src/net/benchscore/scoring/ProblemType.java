/*
 * Copyright Myrrix Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.benchscore.scoring;

import java.util.Locale;

/**
 * Kind of learning problem whose predictions are scored.
 */
public enum ProblemType {

  BINARY,
  MULTICLASS,
  REGRESSION,
  TIMESERIES;

  /**
   * @return lower-case name, as recorded in scoreboards and messages
   */
  public String getName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @Override
  public String toString() {
    return getName();
  }

}
