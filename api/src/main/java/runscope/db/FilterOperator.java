/*
 * Copyright 2024 contributors to the Runscope project
 * SPDX-License-Identifier: Apache-2.0
 */

package runscope.db;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import javax.annotation.Nullable;
import lombok.Getter;

/**
 * Operators accepted by run filters. Each operator has a canonical label plus the aliases clients
 * send; negated operators name the positive operator they negate so that conditions can be
 * rendered as {@code NOT (positive)} with the right null handling.
 */
public enum FilterOperator {
  CONTAINS("contains"),
  DOES_NOT_CONTAIN("does not contain", "not contains"),
  IS("is", "=", "equals"),
  IS_NOT("is not", "!=", "not equals"),
  STARTS_WITH("starts with"),
  ENDS_WITH("ends with"),
  REGEX("regex", "matches regex"),
  IS_ANY_OF("is any of"),
  IS_NONE_OF("is none of"),
  INCLUDE("include", "includes"),
  EXCLUDE("exclude", "excludes"),
  INCLUDE_ANY_OF("include any of"),
  INCLUDE_ALL_OF("include all of"),
  EXCLUDE_IF_ALL("exclude if all", "exclude if all of"),
  EXCLUDE_IF_ANY_OF("exclude if any of"),
  BEFORE("before", "is before"),
  AFTER("after", "is after"),
  BETWEEN("between", "is between"),
  NOT_BETWEEN("not between", "is not between"),
  GREATER_THAN(">", "is greater than"),
  LESS_THAN("<", "is less than"),
  GREATER_THAN_OR_EQUAL(">=", "is greater than or equal to"),
  LESS_THAN_OR_EQUAL("<=", "is less than or equal to"),
  EXISTS("exists"),
  NOT_EXISTS("not exists", "does not exist");

  private static final ImmutableMap<String, FilterOperator> BY_LABEL;

  static {
    final ImmutableMap.Builder<String, FilterOperator> labels = ImmutableMap.builder();
    for (final FilterOperator operator : values()) {
      operator.aliases.forEach(alias -> labels.put(alias, operator));
    }
    BY_LABEL = labels.build();
  }

  @Getter private final String label;
  private final List<String> aliases;

  FilterOperator(final String label, final String... aliases) {
    this.label = label;
    this.aliases = ImmutableList.<String>builder().add(label).add(aliases).build();
  }

  /** Resolves a client supplied operator label, ignoring case and surrounding whitespace. */
  public static Optional<FilterOperator> fromLabel(@Nullable final String label) {
    if (label == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_LABEL.get(label.trim().toLowerCase(Locale.ROOT)));
  }

  /** Returns the operator this one negates, or itself when it is not a negation. */
  public FilterOperator positive() {
    switch (this) {
      case DOES_NOT_CONTAIN:
        return CONTAINS;
      case IS_NOT:
        return IS;
      case IS_NONE_OF:
        return IS_ANY_OF;
      case EXCLUDE:
        return INCLUDE;
      case EXCLUDE_IF_ALL:
        return INCLUDE_ALL_OF;
      case EXCLUDE_IF_ANY_OF:
        return INCLUDE_ANY_OF;
      case NOT_BETWEEN:
        return BETWEEN;
      case NOT_EXISTS:
        return EXISTS;
      default:
        return this;
    }
  }

  public boolean isNegated() {
    return positive() != this;
  }
}
