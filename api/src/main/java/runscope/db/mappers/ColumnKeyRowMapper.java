package runscope.db.mappers;

import java.sql.ResultSet;
import java.sql.SQLException;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import runscope.db.Columns;
import runscope.db.models.ColumnKeyRow;

public class ColumnKeyRowMapper implements RowMapper<ColumnKeyRow> {

  @Override
  public ColumnKeyRow map(ResultSet rs, StatementContext ctx) throws SQLException {
    return new ColumnKeyRow(
        rs.getString(Columns.ORGANIZATION_ID),
        rs.getLong(Columns.PROJECT_ID),
        rs.getString(Columns.SOURCE),
        rs.getString(Columns.KEY),
        rs.getString(Columns.DATA_TYPE));
  }
}
