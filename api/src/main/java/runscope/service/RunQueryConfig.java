/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.service;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Limits and caching of run queries. */
@NoArgsConstructor
@Getter
@Setter
public class RunQueryConfig {
  public static final int DEFAULT_MAX_PAGE_SIZE = 200;
  public static final int DEFAULT_MAX_OFFSET = 100_000;
  public static final int DEFAULT_METRIC_NAME_LIMIT = 500;
  public static final int DEFAULT_SCOPED_METRIC_NAME_LIMIT = 10_000;
  public static final int DEFAULT_COLUMN_KEY_LIMIT = 500;
  public static final int DEFAULT_CACHE_TTL_SECONDS = 30;
  public static final int DEFAULT_CACHE_MAX_ENTRIES = 10_000;
  public static final String DEFAULT_ID_ALPHABET =
      "k3G7QAe51FCsPW92uEOyq4Bg6Sp8YzVTmnU0liwDdHXLajZrfxNhobJIRcMvKt";
  public static final int DEFAULT_ID_MIN_LENGTH = 5;

  @Min(1)
  @JsonProperty("maxPageSize")
  private int maxPageSize = DEFAULT_MAX_PAGE_SIZE;

  /** Ceiling on offsets of field and metric sorted listings. */
  @Min(0)
  @JsonProperty("maxOffset")
  private int maxOffset = DEFAULT_MAX_OFFSET;

  @Min(1)
  @JsonProperty("metricNameLimit")
  private int metricNameLimit = DEFAULT_METRIC_NAME_LIMIT;

  /** Metric name limit when the lookup is scoped to given runs. */
  @Min(1)
  @JsonProperty("scopedMetricNameLimit")
  private int scopedMetricNameLimit = DEFAULT_SCOPED_METRIC_NAME_LIMIT;

  @Min(1)
  @JsonProperty("columnKeyLimit")
  private int columnKeyLimit = DEFAULT_COLUMN_KEY_LIMIT;

  /** Zero disables caching. */
  @Min(0)
  @JsonProperty("cacheTtlSeconds")
  private int cacheTtlSeconds = DEFAULT_CACHE_TTL_SECONDS;

  @Min(1)
  @JsonProperty("cacheMaxEntries")
  private int cacheMaxEntries = DEFAULT_CACHE_MAX_ENTRIES;

  @NotEmpty
  @JsonProperty("idAlphabet")
  private String idAlphabet = DEFAULT_ID_ALPHABET;

  @Min(0)
  @JsonProperty("idMinLength")
  private int idMinLength = DEFAULT_ID_MIN_LENGTH;

  public boolean isCacheEnabled() {
    return cacheTtlSeconds > 0;
  }
}
