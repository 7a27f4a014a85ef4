/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.db.sql;

import com.google.common.collect.ImmutableList;
import java.util.Collection;
import java.util.List;
import lombok.NonNull;
import org.jdbi.v3.core.statement.SqlStatement;

/**
 * A value bound to one placeholder of a {@link SqlFragment}. Each variant knows how to bind
 * itself, so the shape an operator expects is fixed by the variant it constructs.
 */
public interface FilterValue {

  void bindTo(SqlStatement<?> statement, String name, ListBinding listBinding);

  default boolean isList() {
    return false;
  }

  static FilterValue text(@NonNull final String value) {
    return new Text(value);
  }

  static FilterValue number(final double value) {
    return new Number(value);
  }

  static FilterValue id(final long value) {
    return new Id(value);
  }

  static FilterValue bool(final boolean value) {
    return new Bool(value);
  }

  static FilterValue texts(@NonNull final Collection<String> values) {
    return new TextList(ImmutableList.copyOf(values));
  }

  static FilterValue numbers(@NonNull final Collection<Double> values) {
    return new NumberList(ImmutableList.copyOf(values));
  }

  static FilterValue ids(@NonNull final Collection<Long> values) {
    return new IdList(ImmutableList.copyOf(values));
  }

  record Text(@NonNull String value) implements FilterValue {
    @Override
    public void bindTo(SqlStatement<?> statement, String name, ListBinding listBinding) {
      statement.bind(name, value);
    }
  }

  record Number(double value) implements FilterValue {
    @Override
    public void bindTo(SqlStatement<?> statement, String name, ListBinding listBinding) {
      statement.bind(name, value);
    }
  }

  record Id(long value) implements FilterValue {
    @Override
    public void bindTo(SqlStatement<?> statement, String name, ListBinding listBinding) {
      statement.bind(name, value);
    }
  }

  record Bool(boolean value) implements FilterValue {
    @Override
    public void bindTo(SqlStatement<?> statement, String name, ListBinding listBinding) {
      statement.bind(name, value);
    }
  }

  record TextList(@NonNull List<String> values) implements FilterValue {
    @Override
    public void bindTo(SqlStatement<?> statement, String name, ListBinding listBinding) {
      listBinding.bind(statement, name, String.class, values);
    }

    @Override
    public boolean isList() {
      return true;
    }
  }

  record NumberList(@NonNull List<Double> values) implements FilterValue {
    @Override
    public void bindTo(SqlStatement<?> statement, String name, ListBinding listBinding) {
      listBinding.bind(statement, name, Double.class, values);
    }

    @Override
    public boolean isList() {
      return true;
    }
  }

  record IdList(@NonNull List<Long> values) implements FilterValue {
    @Override
    public void bindTo(SqlStatement<?> statement, String name, ListBinding listBinding) {
      listBinding.bind(statement, name, Long.class, values);
    }

    @Override
    public boolean isList() {
      return true;
    }
  }
}
