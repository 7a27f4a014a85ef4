package runscope.db.mappers;

import static runscope.db.Columns.doubleOrNull;
import static runscope.db.Columns.longOrThrow;
import static runscope.db.Columns.stringOrNull;
import static runscope.db.Columns.stringOrThrow;

import java.sql.ResultSet;
import java.sql.SQLException;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import runscope.db.Columns;
import runscope.db.models.FieldValueRow;

public class FieldValueRowMapper implements RowMapper<FieldValueRow> {

  @Override
  public FieldValueRow map(ResultSet rs, StatementContext ctx) throws SQLException {
    return new FieldValueRow(
        longOrThrow(rs, Columns.RUN_ID),
        stringOrThrow(rs, Columns.ORGANIZATION_ID),
        longOrThrow(rs, Columns.PROJECT_ID),
        stringOrThrow(rs, Columns.SOURCE),
        stringOrThrow(rs, Columns.KEY),
        stringOrNull(rs, Columns.TEXT_VALUE),
        doubleOrNull(rs, Columns.NUMERIC_VALUE));
  }
}
