package runscope.db.mappers;

import java.sql.ResultSet;
import java.sql.SQLException;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;
import runscope.db.models.MetricSummaryRow;
import runscope.service.models.MetricSummaryState;

/** Maps the merged columns of a grouped summary query; the step behind the last value is lost. */
public class MetricSummaryRowMapper implements RowMapper<MetricSummaryRow> {
  @Override
  public MetricSummaryRow map(ResultSet results, StatementContext context) throws SQLException {
    return new MetricSummaryRow(
        results.getLong("runId"),
        results.getString("logName"),
        new MetricSummaryState(
            results.getDouble("merged_min"),
            results.getDouble("merged_max"),
            results.getDouble("merged_sum"),
            results.getLong("merged_count"),
            results.getDouble("merged_last"),
            MetricSummaryState.UNKNOWN_STEP,
            results.getDouble("merged_sum_sq")));
  }
}
