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

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * What a framework run recorded about itself in its {@code metadata.json}. Any field may be absent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class RunMetadata {

  private String framework;
  private String frameworkVersion;
  private Long seed;
  private String type;
  private String metric;
  private List<String> metrics;
  private Map<String,Object> frameworkParams;

  public String getFramework() {
    return framework;
  }

  public void setFramework(String framework) {
    this.framework = framework;
  }

  @JsonProperty("framework_version")
  public String getFrameworkVersion() {
    return frameworkVersion;
  }

  @JsonProperty("framework_version")
  public void setFrameworkVersion(String frameworkVersion) {
    this.frameworkVersion = frameworkVersion;
  }

  public Long getSeed() {
    return seed;
  }

  public void setSeed(Long seed) {
    this.seed = seed;
  }

  /**
   * @return problem type, like {@code binary}
   */
  @JsonProperty("type_")
  public String getType() {
    return type;
  }

  @JsonProperty("type_")
  public void setType(String type) {
    this.type = type;
  }

  /**
   * @return primary metric, reported as the result of the run
   */
  public String getMetric() {
    return metric;
  }

  public void setMetric(String metric) {
    this.metric = metric;
  }

  /**
   * @return all metrics to compute, possibly empty
   */
  public List<String> getMetrics() {
    return metrics == null ? Collections.<String>emptyList() : metrics;
  }

  public void setMetrics(List<String> metrics) {
    this.metrics = metrics;
  }

  @JsonProperty("framework_params")
  public Map<String,Object> getFrameworkParams() {
    return frameworkParams == null ? Collections.<String,Object>emptyMap() : frameworkParams;
  }

  @JsonProperty("framework_params")
  public void setFrameworkParams(Map<String,Object> frameworkParams) {
    this.frameworkParams = frameworkParams;
  }

  @Override
  public String toString() {
    return "RunMetadata[framework=" + framework + ", version=" + frameworkVersion + ", metric=" + metric +
        ", metrics=" + metrics + ']';
  }

}
