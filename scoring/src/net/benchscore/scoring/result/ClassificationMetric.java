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

/**
 * Metrics of {@link ClassificationResult}s.
 */
public enum ClassificationMetric implements ScoringFunction<ClassificationResult> {

  /** Fraction of correct predictions. */
  ACC("acc", MetricDirection.HIGHER_IS_BETTER) {
    @Override
    public double score(ClassificationResult result) {
      return result.accuracy();
    }
  },

  /** Area under the ROC curve; binary problems only. */
  AUC("auc", MetricDirection.HIGHER_IS_BETTER) {
    @Override
    public double score(ClassificationResult result) {
      return result.auc();
    }
  },

  /** Averaged AUC of each pair of classes. */
  AUC_OVO("auc_ovo", MetricDirection.HIGHER_IS_BETTER) {
    @Override
    public double score(ClassificationResult result) {
      return result.aucOneVsOne();
    }
  },

  /** Averaged AUC of each class against the rest. */
  AUC_OVR("auc_ovr", MetricDirection.HIGHER_IS_BETTER) {
    @Override
    public double score(ClassificationResult result) {
      return result.aucOneVsRest();
    }
  },

  /** Mean recall over classes. */
  BALACC("balacc", MetricDirection.HIGHER_IS_BETTER) {
    @Override
    public double score(ClassificationResult result) {
      return result.balancedAccuracy();
    }
  },

  F05("f05", MetricDirection.HIGHER_IS_BETTER) {
    @Override
    public double score(ClassificationResult result) {
      return result.fbeta(0.5);
    }
  },

  F1("f1", MetricDirection.HIGHER_IS_BETTER) {
    @Override
    public double score(ClassificationResult result) {
      return result.fbeta(1.0);
    }
  },

  F2("f2", MetricDirection.HIGHER_IS_BETTER) {
    @Override
    public double score(ClassificationResult result) {
      return result.fbeta(2.0);
    }
  },

  LOGLOSS("logloss", MetricDirection.LOWER_IS_BETTER) {
    @Override
    public double score(ClassificationResult result) {
      return result.logLoss();
    }
  },

  /** Largest fraction of misclassified examples of any class. */
  MAX_PCE("max_pce", MetricDirection.LOWER_IS_BETTER) {
    @Override
    public double score(ClassificationResult result) {
      return result.maxPerClassError();
    }
  },

  /** Mean fraction of misclassified examples per class. */
  MEAN_PCE("mean_pce", MetricDirection.LOWER_IS_BETTER) {
    @Override
    public double score(ClassificationResult result) {
      return result.meanPerClassError();
    }
  },

  /** Average precision; binary problems only. */
  PR_AUC("pr_auc", MetricDirection.HIGHER_IS_BETTER) {
    @Override
    public double score(ClassificationResult result) {
      return result.prAuc();
    }
  };

  private final String name;
  private final MetricDirection direction;

  ClassificationMetric(String name, MetricDirection direction) {
    this.name = name;
    this.direction = direction;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public MetricDirection getDirection() {
    return direction;
  }

}
