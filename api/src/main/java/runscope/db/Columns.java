/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.db;

import com.google.common.collect.ImmutableList;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import javax.annotation.Nullable;
import lombok.NonNull;

/** Column names of the relational schema and null-aware {@link ResultSet} readers. */
public final class Columns {
  private Columns() {}

  /* RUN COLUMNS */
  public static final String ROW_ID = "id";
  public static final String ORGANIZATION_ID = "organization_id";
  public static final String PROJECT_ID = "project_id";
  public static final String NAME = "name";
  public static final String STATUS = "status";
  public static final String TAGS = "tags";
  public static final String NOTES = "notes";
  public static final String CREATED_BY_ID = "created_by_id";
  public static final String CONFIG = "config";
  public static final String SYSTEM_METADATA = "system_metadata";
  public static final String CREATED_AT = "created_at";
  public static final String UPDATED_AT = "updated_at";
  public static final String STATUS_UPDATED_AT = "status_updated_at";

  /* FIELD VALUE COLUMNS */
  public static final String RUN_ID = "run_id";
  public static final String SOURCE = "source";
  public static final String KEY = "key";
  public static final String TEXT_VALUE = "text_value";
  public static final String NUMERIC_VALUE = "numeric_value";
  public static final String DATA_TYPE = "data_type";

  public static long longOrThrow(final ResultSet results, final String column)
      throws SQLException {
    final long value = results.getLong(column);
    if (results.wasNull()) {
      throw new IllegalArgumentException("Column '" + column + "' is null");
    }
    return value;
  }

  public static String stringOrThrow(final ResultSet results, final String column)
      throws SQLException {
    final String value = results.getString(column);
    if (value == null) {
      throw new IllegalArgumentException("Column '" + column + "' is null");
    }
    return value;
  }

  @Nullable
  public static String stringOrNull(final ResultSet results, final String column)
      throws SQLException {
    return results.getString(column);
  }

  @Nullable
  public static Double doubleOrNull(final ResultSet results, final String column)
      throws SQLException {
    final double value = results.getDouble(column);
    return results.wasNull() ? null : value;
  }

  public static Instant timestampOrThrow(final ResultSet results, final String column)
      throws SQLException {
    final Timestamp timestamp = results.getTimestamp(column);
    if (timestamp == null) {
      throw new IllegalArgumentException("Column '" + column + "' is null");
    }
    return timestamp.toInstant();
  }

  @Nullable
  public static Instant timestampOrNull(final ResultSet results, final String column)
      throws SQLException {
    final Timestamp timestamp = results.getTimestamp(column);
    return timestamp == null ? null : timestamp.toInstant();
  }

  public static List<String> stringArrayOrEmpty(final ResultSet results, final String column)
      throws SQLException {
    final Array array = results.getArray(column);
    if (array == null) {
      return ImmutableList.of();
    }
    return ImmutableList.copyOf(Arrays.asList((String[]) array.getArray()));
  }

  public static boolean exists(@NonNull final ResultSet results, @NonNull final String column)
      throws SQLException {
    final int count = results.getMetaData().getColumnCount();
    for (int i = 1; i <= count; i++) {
      if (column.equalsIgnoreCase(results.getMetaData().getColumnName(i))) {
        return true;
      }
    }
    return false;
  }
}
