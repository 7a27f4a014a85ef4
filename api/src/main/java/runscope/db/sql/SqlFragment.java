/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.db.sql;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;

/**
 * A piece of SQL whose parameters are written as {@code ?} markers, paired with the values for
 * those markers in order. Fragments never carry placeholder numbers; {@link SqlBuilder#render}
 * assigns them once the whole statement is assembled.
 */
@EqualsAndHashCode
@ToString
public final class SqlFragment {
  static final char MARKER = '?';

  private final String sql;
  private final ImmutableList<FilterValue> params;

  private SqlFragment(final String sql, final ImmutableList<FilterValue> params) {
    final int markers = countMarkers(sql);
    if (markers != params.size()) {
      throw new IllegalArgumentException(
          String.format(
              "Fragment '%s' has %d markers but %d values", sql, markers, params.size()));
    }
    this.sql = sql;
    this.params = params;
  }

  public static SqlFragment of(@NonNull final String sql, @NonNull final FilterValue... params) {
    return new SqlFragment(sql, ImmutableList.copyOf(params));
  }

  public static SqlFragment of(@NonNull final String sql, @NonNull final List<FilterValue> params) {
    return new SqlFragment(sql, ImmutableList.copyOf(params));
  }

  /** Joins fragments with a literal delimiter, keeping their values in order. */
  public static SqlFragment join(
      @NonNull final String delimiter, @NonNull final List<SqlFragment> parts) {
    final StringBuilder sql = new StringBuilder();
    final ImmutableList.Builder<FilterValue> params = ImmutableList.builder();
    for (int i = 0; i < parts.size(); i++) {
      if (i > 0) {
        sql.append(delimiter);
      }
      sql.append(parts.get(i).sql);
      params.addAll(parts.get(i).params);
    }
    return new SqlFragment(sql.toString(), params.build());
  }

  public static SqlFragment join(
      @NonNull final String delimiter, @NonNull final SqlFragment... parts) {
    return join(delimiter, Arrays.asList(parts));
  }

  public SqlFragment wrap(@NonNull final String prefix, @NonNull final String suffix) {
    return new SqlFragment(prefix + sql + suffix, params);
  }

  public String sql() {
    return sql;
  }

  public List<FilterValue> params() {
    return params;
  }

  static int countMarkers(final String sql) {
    int count = 0;
    for (int i = 0; i < sql.length(); i++) {
      if (sql.charAt(i) == MARKER) {
        count++;
      }
    }
    return count;
  }
}
