/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.db;

import static runscope.db.sql.FilterValue.id;
import static runscope.db.sql.FilterValue.ids;
import static runscope.db.sql.FilterValue.text;

import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.List;
import javax.annotation.Nullable;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.jdbi.v3.core.Jdbi;
import runscope.common.models.FieldSource;
import runscope.db.mappers.RunRowMapper;
import runscope.db.models.RunRow;
import runscope.db.sql.ListBinding;
import runscope.db.sql.RenderedSql;
import runscope.db.sql.SqlBuilder;
import runscope.service.models.PageDirection;
import runscope.service.models.SortCursor;
import runscope.service.models.SortDirection;

/**
 * Queries over runs built from a {@link RunFilterClause}. Used whenever a listing carries
 * relational filters, a search or a custom sort, which the fixed queries of {@link RunDao} cannot
 * express.
 */
@Slf4j
public class RunSearchDao {
  private static final RunRowMapper RUN_ROW_MAPPER = new RunRowMapper();

  private final Jdbi jdbi;

  public RunSearchDao(@NonNull final Jdbi jdbi) {
    this.jdbi = jdbi;
  }

  /** Ids of all runs matching the clause, newest first. */
  public List<Long> findRunIds(@NonNull final RunFilterClause clause) {
    final RenderedSql sql =
        new SqlBuilder()
            .append("SELECT r.id " + clause.fromClause() + " WHERE ")
            .append(clause.where())
            .append(" ORDER BY r.created_at DESC, r.id DESC")
            .render(ListBinding.ARRAY);
    return jdbi.withHandle(
        handle -> sql.bind(handle.createQuery(sql.sql())).mapTo(Long.class).list());
  }

  public long countRuns(@NonNull final RunFilterClause clause) {
    final RenderedSql sql =
        new SqlBuilder()
            .append("SELECT COUNT(*) " + clause.fromClause() + " WHERE ")
            .append(clause.where())
            .render(ListBinding.ARRAY);
    return jdbi.withHandle(
        handle -> sql.bind(handle.createQuery(sql.sql())).mapTo(Long.class).one());
  }

  /**
   * Runs ordered by creation time, newest first when paging forward. A cursor continues after the
   * run with that id; paging backward returns the runs newer than the cursor, oldest first.
   */
  public List<RunRow> findRunsByCreatedAt(
      @NonNull final RunFilterClause clause,
      @Nullable final Long cursor,
      @NonNull final PageDirection direction,
      final int limit) {
    final boolean forward = direction == PageDirection.FORWARD;
    final SqlBuilder builder = selectRuns(clause);
    if (cursor != null) {
      builder.append(
          " AND (r.created_at, r.id) "
              + (forward ? "<" : ">")
              + " (SELECT c.created_at, c.id FROM runs c WHERE c.id = ?)",
          id(cursor));
    }
    final String order = forward ? "DESC" : "ASC";
    builder.append(" ORDER BY r.created_at " + order + ", r.id " + order + " LIMIT ?", id(limit));
    return list(builder.render(ListBinding.ARRAY));
  }

  /** Keyset page over a run column, continuing strictly after {@code after} when given. */
  public List<RunRow> findRunsBySystemColumn(
      @NonNull final RunFilterClause clause,
      @NonNull final SystemSortColumn column,
      @NonNull final SortDirection direction,
      @Nullable final SortCursor after,
      final int limit) {
    final SqlBuilder builder = selectRuns(clause);
    if (after != null) {
      builder.append(
          " AND ("
              + column.getExpression()
              + ", r.id) "
              + (direction == SortDirection.ASC ? ">" : "<")
              + " ("
              + column.valuePlaceholder()
              + ", ?)",
          text(after.value()),
          id(after.id()));
    }
    builder.append(
        " ORDER BY "
            + column.getExpression()
            + " "
            + direction.sql()
            + ", r.id "
            + direction.sql()
            + " LIMIT ?",
        id(limit));
    return list(builder.render(ListBinding.ARRAY));
  }

  /**
   * Runs ordered by one flattened value: numeric value first, then text value, both with nulls
   * last, so runs without the key come after every run that has it.
   */
  public List<RunRow> findRunsByFieldValue(
      @NonNull final RunFilterClause clause,
      @NonNull final FieldSource source,
      @NonNull final String key,
      @NonNull final SortDirection direction,
      final int offset,
      final int limit) {
    final String dir = direction.sql();
    final RenderedSql sql =
        new SqlBuilder()
            .append(
                "SELECT r.* "
                    + clause.fromClause()
                    + " LEFT JOIN run_field_values sf"
                    + " ON sf.run_id = r.id AND sf.source = ? AND sf.key = ?"
                    + " WHERE ",
                text(source.getValue()),
                text(key))
            .append(clause.where())
            .append(
                " ORDER BY sf.numeric_value "
                    + dir
                    + " NULLS LAST, sf.text_value "
                    + dir
                    + " NULLS LAST, r.id "
                    + dir
                    + " LIMIT ? OFFSET ?",
                id(limit),
                id(offset))
            .render(ListBinding.ARRAY);
    return list(sql);
  }

  /** Runs with the given ids, in no particular order. */
  public List<RunRow> findRunsByIds(
      @NonNull final String organizationId, @NonNull final Collection<Long> runIds) {
    if (runIds.isEmpty()) {
      return ImmutableList.of();
    }
    return list(
        new SqlBuilder()
            .append(
                "SELECT r.* FROM runs r WHERE r.organization_id = ? AND r.id = ANY(?::bigint[])",
                text(organizationId),
                ids(runIds))
            .render(ListBinding.ARRAY));
  }

  private static SqlBuilder selectRuns(final RunFilterClause clause) {
    return new SqlBuilder()
        .append("SELECT r.* " + clause.fromClause() + " WHERE ")
        .append(clause.where());
  }

  private List<RunRow> list(final RenderedSql sql) {
    log.debug("Executing run query: {}", sql.sql());
    return jdbi.withHandle(
        handle -> sql.bind(handle.createQuery(sql.sql())).map(RUN_ROW_MAPPER).list());
  }
}
