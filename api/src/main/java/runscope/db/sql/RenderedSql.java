/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.db.sql;

import java.util.List;
import lombok.NonNull;
import org.jdbi.v3.core.statement.SqlStatement;

/** Statement text with numbered placeholders; {@code params().get(n - 1)} binds {@code pn}. */
public record RenderedSql(
    @NonNull String sql, @NonNull List<FilterValue> params, @NonNull ListBinding listBinding) {

  public static String placeholderName(final int position) {
    return "p" + position;
  }

  public <S extends SqlStatement<S>> S bind(@NonNull final S statement) {
    for (int i = 0; i < params.size(); i++) {
      params.get(i).bindTo(statement, placeholderName(i + 1), listBinding);
    }
    return statement;
  }
}
