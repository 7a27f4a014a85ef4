/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.db;

import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import runscope.service.models.DateFilter;
import runscope.service.models.FieldFilter;
import runscope.service.models.SystemFilter;

/**
 * Relational filters over runs of one organization. The project is scoped by id when known and by
 * name otherwise; {@code restrictToIds}, when set, limits the result to the given runs.
 */
@Value
@Builder(toBuilder = true)
public class RunFilter {
  @NonNull String organizationId;
  @Nullable Long projectId;
  @Nullable String projectName;
  @Nullable String search;
  @Singular List<String> tags;
  @Singular("status") List<String> statuses;
  @Singular List<DateFilter> dateFilters;
  @Singular List<FieldFilter> fieldFilters;
  @Singular List<SystemFilter> systemFilters;
  @Nullable Set<Long> restrictToIds;

  public static RunFilter forProject(@NonNull String organizationId, long projectId) {
    return RunFilter.builder().organizationId(organizationId).projectId(projectId).build();
  }

  /** True when the filter narrows runs beyond the organization and project. */
  public boolean hasConditions() {
    return (search != null && !search.isBlank())
        || !tags.isEmpty()
        || !statuses.isEmpty()
        || !dateFilters.isEmpty()
        || !fieldFilters.isEmpty()
        || !systemFilters.isEmpty()
        || restrictToIds != null;
  }
}
