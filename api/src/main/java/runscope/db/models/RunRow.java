/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.db.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import runscope.common.models.RunStatus;

@Value
@Builder
@With
public class RunRow {
  @JsonIgnore long id;
  @Nullable String encodedId;
  @NonNull String organizationId;
  long projectId;
  @NonNull String name;
  @NonNull RunStatus status;
  @NonNull List<String> tags;
  @Nullable String notes;
  @Nullable String createdById;
  @NonNull JsonNode config;
  @NonNull JsonNode systemMetadata;
  @NonNull Instant createdAt;
  @NonNull Instant updatedAt;
  @Nullable Instant statusUpdatedAt;

  public Optional<String> getNotes() {
    return Optional.ofNullable(notes);
  }

  public Optional<Instant> getStatusUpdatedAt() {
    return Optional.ofNullable(statusUpdatedAt);
  }
}
