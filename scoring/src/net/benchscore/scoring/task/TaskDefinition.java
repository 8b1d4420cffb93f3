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

package net.benchscore.scoring.task;

import com.google.common.base.Preconditions;

/**
 * Identity of a benchmark task: its id, like an OpenML task id, and its name.
 */
public final class TaskDefinition {

  private final String id;
  private final String name;

  public TaskDefinition(String id, String name) {
    Preconditions.checkNotNull(name);
    this.id = id;
    this.name = name;
  }

  /**
   * @return definition of a task known only by name, whose id is its name
   */
  public static TaskDefinition named(String name) {
    return new TaskDefinition(name, name);
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  @Override
  public String toString() {
    return name;
  }

}
