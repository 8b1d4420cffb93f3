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

package net.benchscore.scoring.validation;

/**
 * Thrown when a predictions file violates the structure that predictions must have, such as its required
 * columns or the consistency of its predictions with its class probabilities.
 */
public final class InvalidPredictionsException extends Exception {

  public InvalidPredictionsException(String message) {
    super(message);
  }

}
