/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.db;

import java.util.List;
import java.util.Optional;
import org.jdbi.v3.sqlobject.config.RegisterRowMapper;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import runscope.db.mappers.RunBatchRowMapper;
import runscope.db.mappers.RunRowMapper;
import runscope.db.models.RunBatchRow;
import runscope.db.models.RunRow;

/**
 * Fixed queries over runs and projects, used when a listing has no relational filters. Listings
 * are newest first and continue from the id of the last run returned.
 */
@RegisterRowMapper(RunRowMapper.class)
@RegisterRowMapper(RunBatchRowMapper.class)
public interface RunDao {

  @SqlQuery(
      """
      SELECT id FROM projects
      WHERE organization_id = :organizationId AND name = :projectName
      """)
  Optional<Long> findProjectId(String organizationId, String projectName);

  @SqlQuery(
      """
      SELECT * FROM runs
      WHERE organization_id = :organizationId AND project_id = :projectId
      ORDER BY created_at DESC, id DESC
      LIMIT :limit
      """)
  List<RunRow> findLatestRuns(String organizationId, long projectId, int limit);

  /** Runs older than the cursor run, newest first. */
  @SqlQuery(
      """
      SELECT r.* FROM runs r
      WHERE r.organization_id = :organizationId AND r.project_id = :projectId
        AND (r.created_at, r.id) < (SELECT c.created_at, c.id FROM runs c WHERE c.id = :cursor)
      ORDER BY r.created_at DESC, r.id DESC
      LIMIT :limit
      """)
  List<RunRow> findRunsBefore(String organizationId, long projectId, long cursor, int limit);

  /** Runs newer than the cursor run, oldest first. */
  @SqlQuery(
      """
      SELECT r.* FROM runs r
      WHERE r.organization_id = :organizationId AND r.project_id = :projectId
        AND (r.created_at, r.id) > (SELECT c.created_at, c.id FROM runs c WHERE c.id = :cursor)
      ORDER BY r.created_at ASC, r.id ASC
      LIMIT :limit
      """)
  List<RunRow> findRunsAfter(String organizationId, long projectId, long cursor, int limit);

  @SqlQuery("SELECT * FROM runs WHERE organization_id = :organizationId AND id = :id")
  Optional<RunRow> findRun(String organizationId, long id);

  @SqlQuery(
      """
      SELECT DISTINCT t.tag FROM runs r, unnest(r.tags) AS t(tag)
      WHERE r.organization_id = :organizationId AND r.project_id = :projectId
      ORDER BY t.tag
      """)
  List<String> findDistinctTags(String organizationId, long projectId);

  /** Runs with an id greater than {@code afterId}, in ascending id order. */
  @SqlQuery(
      """
      SELECT id, organization_id, project_id, config::text AS config,
             system_metadata::text AS system_metadata
      FROM runs
      WHERE id > :afterId
      ORDER BY id
      LIMIT :limit
      """)
  List<RunBatchRow> findRunBatch(long afterId, int limit);
}
