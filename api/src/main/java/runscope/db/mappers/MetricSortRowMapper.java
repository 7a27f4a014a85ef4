package runscope.db.mappers;

import java.sql.ResultSet;
import java.sql.SQLException;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import runscope.db.models.MetricSortRow;

public class MetricSortRowMapper implements RowMapper<MetricSortRow> {
  @Override
  public MetricSortRow map(ResultSet results, StatementContext context) throws SQLException {
    return new MetricSortRow(results.getLong("runId"), results.getDouble("sort_value"));
  }
}
