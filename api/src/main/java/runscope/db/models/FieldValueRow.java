/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.db.models;

import javax.annotation.Nullable;

/** One row of {@code run_field_values}: a flattened leaf of a run's config or metadata. */
public record FieldValueRow(
    long runId,
    String organizationId,
    long projectId,
    String source,
    String key,
    @Nullable String textValue,
    @Nullable Double numericValue) {}
