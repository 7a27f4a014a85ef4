/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.db;

import static org.assertj.core.api.Assertions.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import runscope.db.sql.FilterValue;
import runscope.db.sql.SqlFragment;
import runscope.service.models.SystemFilter;

public class SystemFilterConditionsTest {

  @Test
  public void testNameContains() {
    SqlFragment condition =
        SystemFilterConditions.build(SystemFilter.of("name", "contains", "resnet")).orElseThrow();

    assertThat(condition.sql()).isEqualTo("r.name ILIKE '%' || ? || '%'");
    assertThat(condition.params()).containsExactly(FilterValue.text("resnet"));
  }

  @Test
  public void testNegatedTextMatchesNullColumn() {
    SqlFragment condition =
        SystemFilterConditions.build(SystemFilter.of("notes", "does not contain", "wip"))
            .orElseThrow();

    assertThat(condition.sql())
        .isEqualTo("(r.notes IS NULL OR NOT (r.notes ILIKE '%' || ? || '%'))");
  }

  @Test
  public void testNotesExistence() {
    assertThat(SystemFilterConditions.build(SystemFilter.of("notes", "exists")))
        .map(SqlFragment::sql)
        .contains("(r.notes IS NOT NULL AND r.notes <> '')");
    assertThat(SystemFilterConditions.build(SystemFilter.of("notes", "not exists")))
        .map(SqlFragment::sql)
        .contains("(r.notes IS NULL OR r.notes = '')");
  }

  @Test
  public void testCreatorNameNeedsJoin() {
    SystemFilter filter = SystemFilter.of("creator.name", "starts with", "ali");

    assertThat(SystemFilterConditions.build(filter))
        .map(SqlFragment::sql)
        .contains("u.name ILIKE ? || '%'");
    assertThat(SystemFilterConditions.needsCreatorJoin(filter)).isTrue();
    assertThat(SystemFilterConditions.needsCreatorJoin(SystemFilter.of("name", "is", "x")))
        .isFalse();
  }

  @Test
  public void testStatusDropsUnknownValues() {
    // Given
    SystemFilter filter = SystemFilter.of("status", "is any of", "running", "bogus", "FAILED");

    // When
    SqlFragment condition = SystemFilterConditions.build(filter).orElseThrow();

    // Then
    assertThat(condition.sql()).isEqualTo("r.status = ANY(?::run_status[])");
    assertThat(condition.params())
        .containsExactly(FilterValue.texts(ImmutableList.of("RUNNING", "FAILED")));
  }

  @Test
  public void testStatusWithOnlyUnknownValuesIsDropped() {
    assertThat(SystemFilterConditions.build(SystemFilter.of("status", "is", "bogus"))).isEmpty();
  }

  @Test
  public void testTagOperators() {
    assertThat(SystemFilterConditions.build(SystemFilter.of("tags", "include", "a")))
        .map(SqlFragment::sql)
        .contains("? = ANY(r.tags)");
    assertThat(SystemFilterConditions.build(SystemFilter.of("tags", "include all of", "a", "b")))
        .map(SqlFragment::sql)
        .contains("r.tags @> ?::text[]");
    assertThat(SystemFilterConditions.build(SystemFilter.of("tags", "exclude if any of", "a")))
        .map(SqlFragment::sql)
        .contains("NOT (r.tags && ?::text[])");
  }

  @Test
  public void testUnknownFieldOrOperatorIsDropped() {
    assertThat(SystemFilterConditions.build(SystemFilter.of("color", "is", "red"))).isEmpty();
    assertThat(SystemFilterConditions.build(SystemFilter.of("name", "sounds like", "x")))
        .isEmpty();
    assertThat(SystemFilterConditions.build(SystemFilter.of("name", "contains"))).isEmpty();
    Optional<SqlFragment> noneOf =
        SystemFilterConditions.build(SystemFilter.of("name", "is none of", "x"));
    assertThat(noneOf).isEmpty();
  }
}
