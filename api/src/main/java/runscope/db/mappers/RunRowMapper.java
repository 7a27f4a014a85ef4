package runscope.db.mappers;

import static runscope.db.Columns.longOrThrow;
import static runscope.db.Columns.stringArrayOrEmpty;
import static runscope.db.Columns.stringOrNull;
import static runscope.db.Columns.stringOrThrow;
import static runscope.db.Columns.timestampOrNull;
import static runscope.db.Columns.timestampOrThrow;

import java.sql.ResultSet;
import java.sql.SQLException;
import lombok.NonNull;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import runscope.common.Utils;
import runscope.common.models.RunStatus;
import runscope.db.Columns;
import runscope.db.models.RunRow;

public class RunRowMapper implements RowMapper<RunRow> {

  @Override
  public RunRow map(@NonNull ResultSet results, @NonNull StatementContext context)
      throws SQLException {
    final String status = stringOrThrow(results, Columns.STATUS);
    return RunRow.builder()
        .id(longOrThrow(results, Columns.ROW_ID))
        .organizationId(stringOrThrow(results, Columns.ORGANIZATION_ID))
        .projectId(longOrThrow(results, Columns.PROJECT_ID))
        .name(stringOrThrow(results, Columns.NAME))
        .status(
            RunStatus.fromString(status)
                .orElseThrow(() -> new IllegalArgumentException("Unknown run status: " + status)))
        .tags(stringArrayOrEmpty(results, Columns.TAGS))
        .notes(stringOrNull(results, Columns.NOTES))
        .createdById(stringOrNull(results, Columns.CREATED_BY_ID))
        .config(Utils.toJsonNode(stringOrNull(results, Columns.CONFIG)))
        .systemMetadata(Utils.toJsonNode(stringOrNull(results, Columns.SYSTEM_METADATA)))
        .createdAt(timestampOrThrow(results, Columns.CREATED_AT))
        .updatedAt(timestampOrThrow(results, Columns.UPDATED_AT))
        .statusUpdatedAt(timestampOrNull(results, Columns.STATUS_UPDATED_AT))
        .build();
  }
}
