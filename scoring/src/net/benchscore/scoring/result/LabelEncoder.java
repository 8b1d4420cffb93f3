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

import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

/**
 * Maps class labels to indices {@code 0 .. n-1}, in the order the labels are given.
 */
public final class LabelEncoder {

  private final List<String> labels;
  private final Map<String,Integer> indices;

  public LabelEncoder(List<String> labels) {
    this.labels = ImmutableList.copyOf(labels);
    this.indices = Maps.newHashMapWithExpectedSize(labels.size());
    for (int i = 0; i < labels.size(); i++) {
      Integer previous = indices.put(labels.get(i), i);
      Preconditions.checkArgument(previous == null, "Duplicate label: %s", labels.get(i));
    }
  }

  public List<String> getLabels() {
    return labels;
  }

  public int size() {
    return labels.size();
  }

  /**
   * @throws IllegalArgumentException if the label is unknown
   */
  public int encode(String label) {
    Integer index = indices.get(label);
    Preconditions.checkArgument(index != null, "Previously unseen label: %s", label);
    return index;
  }

  public int[] encodeAll(List<String> values) {
    int[] encoded = new int[values.size()];
    for (int i = 0; i < encoded.length; i++) {
      encoded[i] = encode(values.get(i));
    }
    return encoded;
  }

}
