/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.db.models;

public record MetricSortRow(long runId, double sortValue) {}
