/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.db.models;

/** One row of {@code project_column_keys}. */
public record ColumnKeyRow(
    String organizationId, long projectId, String source, String key, String dataType) {}
