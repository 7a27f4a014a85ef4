/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.jobs;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Configuration of the field value backfill job and the metric summary rebuild job. */
@NoArgsConstructor
@Getter
@Setter
public class BackfillConfig {
  private static final int DEFAULT_BATCH_SIZE = 500;
  private static final int DEFAULT_FREQUENCY_MINUTES = 0;

  @Min(1)
  @JsonProperty("batchSize")
  private int batchSize = DEFAULT_BATCH_SIZE;

  @Min(0)
  @JsonProperty("frequencyMinutes")
  private int frequencyMinutes = DEFAULT_FREQUENCY_MINUTES;

  @Min(0)
  @JsonProperty("metricSummaryFrequencyMinutes")
  private int metricSummaryFrequencyMinutes = DEFAULT_FREQUENCY_MINUTES;

  /** Returns {@code true} if the backfill job should be scheduled. */
  public boolean hasBackfillSchedule() {
    return frequencyMinutes > 0;
  }

  /** Returns {@code true} if the metric summary rebuild job should be scheduled. */
  public boolean hasMetricSummarySchedule() {
    return metricSummaryFrequencyMinutes > 0;
  }
}
