/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.service.models;

/** How a search term is matched against metric names. */
public enum MetricNameMatch {
  PREFIX,
  SUBSTRING,
  REGEX
}
