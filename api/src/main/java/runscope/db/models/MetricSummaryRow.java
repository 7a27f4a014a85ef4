/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.db.models;

import runscope.service.models.MetricSummaryState;

/** Merged partial state of one metric of one run. */
public record MetricSummaryRow(long runId, String logName, MetricSummaryState state) {}
