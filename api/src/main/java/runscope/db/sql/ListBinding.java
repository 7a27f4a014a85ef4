/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.db.sql;

import java.util.List;
import org.jdbi.v3.core.statement.SqlStatement;

/** How list-valued parameters reach the driver. */
public enum ListBinding {
  /** One SQL array parameter, rendered {@code :pN}; the SQL casts it (Postgres). */
  ARRAY {
    @Override
    String placeholder(int position, boolean list) {
      return ":p" + position;
    }

    @Override
    void bind(SqlStatement<?> statement, String name, Class<?> elementType, List<?> values) {
      statement.bindArray(name, elementType, values);
    }
  },
  /** One parameter per element, rendered {@code <pN>} and expanded by Jdbi (ClickHouse). */
  EXPANDED {
    @Override
    String placeholder(int position, boolean list) {
      return list ? "<p" + position + ">" : ":p" + position;
    }

    @Override
    void bind(SqlStatement<?> statement, String name, Class<?> elementType, List<?> values) {
      statement.bindList(name, values);
    }
  };

  abstract String placeholder(int position, boolean list);

  abstract void bind(SqlStatement<?> statement, String name, Class<?> elementType, List<?> values);
}
