/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.db;

import lombok.NonNull;
import runscope.db.sql.SqlFragment;

/** A rendered {@link RunFilter}: the WHERE condition and the joins it reads from. */
public record RunFilterClause(
    @NonNull SqlFragment where, boolean needsProjectJoin, boolean needsCreatorJoin) {

  /** FROM clause with {@code runs r} and the joins the condition needs. */
  public String fromClause() {
    final StringBuilder from = new StringBuilder("FROM runs r");
    if (needsProjectJoin) {
      from.append(" JOIN projects p ON p.id = r.project_id");
    }
    if (needsCreatorJoin) {
      from.append(" LEFT JOIN users u ON u.id = r.created_by_id");
    }
    return from.toString();
  }
}
