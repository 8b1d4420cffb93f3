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

package net.benchscore.scoring.result;

import com.google.common.base.Preconditions;

/**
 * A {@link NoResult} for a run whose predictions could not be loaded. Its info is the error, shortened to a
 * maximum length.
 */
public final class ErrorResult extends NoResult {

  private static final char ELLIPSIS = '…';

  private final Throwable error;

  /**
   * @param error why the predictions could not be loaded
   * @param maxLength maximum length of the recorded message, at least 2
   */
  public ErrorResult(Throwable error, int maxLength) {
    super(describe(error, maxLength));
    this.error = error;
  }

  public Throwable getError() {
    return error;
  }

  static String describe(Throwable error, int maxLength) {
    Preconditions.checkArgument(maxLength > 1, "maxLength must be at least 2: %s", maxLength);
    String message = error.getMessage() == null ?
        error.getClass().getSimpleName() :
        error.getClass().getSimpleName() + ": " + error.getMessage();
    if (message.length() > maxLength) {
      message = message.substring(0, maxLength - 1) + ELLIPSIS;
    }
    return message;
  }

  @Override
  public String toString() {
    return "ErrorResult[" + getInfo() + ']';
  }

}
