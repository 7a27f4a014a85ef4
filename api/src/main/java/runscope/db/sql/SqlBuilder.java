/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.db.sql;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import lombok.NonNull;

/**
 * Append-only assembly of a statement from {@link SqlFragment}s. Placeholders are numbered only in
 * {@link #render}, walking the fragments in append order, so the n-th marker is always bound to
 * the n-th value.
 */
public final class SqlBuilder {
  private final List<SqlFragment> parts = new ArrayList<>();

  public SqlBuilder append(@NonNull final String sql, @NonNull final FilterValue... params) {
    parts.add(SqlFragment.of(sql, params));
    return this;
  }

  public SqlBuilder append(@NonNull final SqlFragment fragment) {
    parts.add(fragment);
    return this;
  }

  public RenderedSql render(@NonNull final ListBinding listBinding) {
    final StringBuilder sql = new StringBuilder();
    final ImmutableList.Builder<FilterValue> params = ImmutableList.builder();
    int position = 0;
    for (SqlFragment part : parts) {
      final String text = part.sql();
      int next = 0;
      for (int i = 0; i < text.length(); i++) {
        final char c = text.charAt(i);
        if (c != SqlFragment.MARKER) {
          sql.append(c);
          continue;
        }
        final FilterValue value = part.params().get(next++);
        position++;
        sql.append(listBinding.placeholder(position, value.isList()));
        params.add(value);
      }
    }
    return new RenderedSql(sql.toString(), params.build(), listBinding);
  }
}
