/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.db;

import java.util.Collection;
import java.util.List;
import javax.annotation.Nullable;
import org.jdbi.v3.sqlobject.config.RegisterRowMapper;
import org.jdbi.v3.sqlobject.customizer.BindList;
import org.jdbi.v3.sqlobject.customizer.BindMethods;
import org.jdbi.v3.sqlobject.statement.SqlBatch;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;
import runscope.db.mappers.ColumnKeyRowMapper;
import runscope.db.mappers.FieldValueRowMapper;
import runscope.db.models.ColumnKeyRow;
import runscope.db.models.FieldValueRow;

/** The flattened field index ({@code run_field_values}) and the key registry of each project. */
@RegisterRowMapper(FieldValueRowMapper.class)
@RegisterRowMapper(ColumnKeyRowMapper.class)
public interface FieldValueDao {

  @SqlUpdate("DELETE FROM run_field_values WHERE run_id = :runId")
  int deleteForRun(long runId);

  @SqlBatch(
      """
      INSERT INTO run_field_values
        (run_id, organization_id, project_id, source, key, text_value, numeric_value)
      VALUES
        (:runId, :organizationId, :projectId, :source, :key, :textValue, :numericValue)
      ON CONFLICT (run_id, source, key) DO NOTHING
      """)
  void insertFieldValues(@BindMethods Collection<FieldValueRow> rows);

  /** Registers keys; a key already registered keeps the data type it was first seen with. */
  @SqlBatch(
      """
      INSERT INTO project_column_keys (organization_id, project_id, source, key, data_type)
      VALUES (:organizationId, :projectId, :source, :key, :dataType)
      ON CONFLICT (project_id, source, key) DO NOTHING
      """)
  void insertColumnKeys(@BindMethods Collection<ColumnKeyRow> rows);

  @SqlQuery(
      """
      SELECT organization_id, project_id, source, key, data_type
      FROM project_column_keys
      WHERE organization_id = :organizationId AND project_id = :projectId
        AND (CAST(:search AS TEXT) IS NULL OR key ILIKE '%' || CAST(:search AS TEXT) || '%')
      ORDER BY source, key
      LIMIT :limit
      """)
  List<ColumnKeyRow> findColumnKeys(
      String organizationId, long projectId, @Nullable String search, int limit);

  @SqlQuery(
      """
      SELECT run_id, organization_id, project_id, source, key, text_value, numeric_value
      FROM run_field_values
      WHERE organization_id = :organizationId AND run_id IN (<runIds>)
      ORDER BY run_id, source, key
      """)
  List<FieldValueRow> findFieldValues(
      String organizationId, @BindList("runIds") Collection<Long> runIds);
}
