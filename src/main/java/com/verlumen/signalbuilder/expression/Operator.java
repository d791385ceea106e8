package com.verlumen.signalbuilder.expression;

import java.util.Locale;
import java.util.Optional;

/** Logical connective between two conditions. */
public enum Operator {
  AND,
  OR;

  /** Parses an operator keyword in any letter case. */
  public static Optional<Operator> fromKeyword(String keyword) {
    if (keyword == null) {
      return Optional.empty();
    }
    switch (keyword.trim().toUpperCase(Locale.ROOT)) {
      case "AND":
        return Optional.of(AND);
      case "OR":
        return Optional.of(OR);
      default:
        return Optional.empty();
    }
  }

  /** Keyword as written in a canonical expression. */
  public String keyword() {
    return name();
  }

  /** Lower-cased word used when joining natural-language clauses. */
  public String connective() {
    return name().toLowerCase(Locale.ROOT);
  }
}
