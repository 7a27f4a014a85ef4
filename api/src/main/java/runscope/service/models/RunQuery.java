/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.service.models;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A request for a page of runs of one project. At most one continuation token is honoured: {@code
 * cursor} for the default ordering, {@code sortCursor} for system column sorts, and {@code offset}
 * for JSON field and metric sorts.
 */
@Value
@Builder(toBuilder = true)
@JsonDeserialize(builder = RunQuery.RunQueryBuilder.class)
public class RunQuery {
  public static final int DEFAULT_LIMIT = 10;

  @NonNull String organizationId;
  @NonNull String projectName;
  @Nullable String search;
  @Singular List<String> tags;
  @Singular("status") List<String> statuses;
  @Singular List<DateFilter> dateFilters;
  @Singular List<FieldFilter> fieldFilters;
  @Singular List<MetricFilter> metricFilters;
  @Singular List<SystemFilter> systemFilters;
  @Builder.Default int limit = DEFAULT_LIMIT;
  @Nullable Long cursor;
  @Builder.Default @NonNull PageDirection direction = PageDirection.FORWARD;
  @Nullable String sortCursor;
  @Nullable Integer offset;
  @Nullable SortSpec sort;

  public Optional<String> getSearch() {
    return search == null || search.isBlank() ? Optional.empty() : Optional.of(search.trim());
  }

  public Optional<SortSpec> getSort() {
    return Optional.ofNullable(sort);
  }

  /** True when any filter evaluated by the relational store is present, search excluded. */
  public boolean hasRelationalFilters() {
    return !tags.isEmpty()
        || !statuses.isEmpty()
        || !dateFilters.isEmpty()
        || !fieldFilters.isEmpty()
        || !systemFilters.isEmpty();
  }

  public boolean hasMetricFilters() {
    return !metricFilters.isEmpty();
  }

  @JsonPOJOBuilder(withPrefix = "")
  public static class RunQueryBuilder {}
}
