/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.db.models;

import javax.annotation.Nullable;

/** The columns the field value backfill needs for one run, with JSON kept as text. */
public record RunBatchRow(
    long id,
    String organizationId,
    long projectId,
    @Nullable String config,
    @Nullable String systemMetadata) {}
