package runscope.db.mappers;

import static runscope.db.Columns.longOrThrow;
import static runscope.db.Columns.stringOrNull;
import static runscope.db.Columns.stringOrThrow;

import java.sql.ResultSet;
import java.sql.SQLException;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import runscope.db.Columns;
import runscope.db.models.RunBatchRow;

public class RunBatchRowMapper implements RowMapper<RunBatchRow> {
  @Override
  public RunBatchRow map(ResultSet results, StatementContext context) throws SQLException {
    return new RunBatchRow(
        longOrThrow(results, Columns.ROW_ID),
        stringOrThrow(results, Columns.ORGANIZATION_ID),
        longOrThrow(results, Columns.PROJECT_ID),
        stringOrNull(results, Columns.CONFIG),
        stringOrNull(results, Columns.SYSTEM_METADATA));
  }
}
