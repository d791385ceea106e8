package com.verlumen.signalbuilder.rows;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Ascii;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.signalbuilder.catalog.ConditionCatalog;
import com.verlumen.signalbuilder.catalog.IndicatorInstance;
import com.verlumen.signalbuilder.expression.ConditionResolver;
import com.verlumen.signalbuilder.expression.ExpressionToken;
import com.verlumen.signalbuilder.expression.ExpressionTokenizer;
import com.verlumen.signalbuilder.expression.Operator;
import com.verlumen.signalbuilder.expression.ResolvedCondition;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts between the flat row list and the canonical expression.
 *
 * <p>The row list has no grouping, so rows become a plain left-to-right sequence of conditions and
 * operators. Parsing goes the other way on a best-effort basis: parentheses are flattened and terms
 * that do not resolve against the selection are dropped.
 */
public final class RowExpressionCompiler {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final Joiner SPACE = Joiner.on(' ');
  static final String NO_CONDITIONS = "No conditions set";

  private final ConditionCatalog catalog;
  private final ExpressionTokenizer tokenizer;
  private final ConditionResolver resolver;

  @Inject
  public RowExpressionCompiler(
      ConditionCatalog catalog, ExpressionTokenizer tokenizer, ConditionResolver resolver) {
    this.catalog = checkNotNull(catalog);
    this.tokenizer = checkNotNull(tokenizer);
    this.resolver = checkNotNull(resolver);
  }

  /**
   * Writes the rows as an expression. Rows without a condition are skipped; every kept row after
   * the first is preceded by its operator, or AND when it carries none.
   *
   * @return the expression, or "" when no row has a condition
   */
  public String toExpression(List<ConditionRow> rows) {
    List<String> parts = new ArrayList<>();
    for (ConditionRow row : rows) {
      if (!row.hasCondition()) {
        continue;
      }
      if (!parts.isEmpty()) {
        parts.add(row.precedingOperator().orElse(Operator.AND).keyword());
      }
      parts.add(row.conditionName().get());
    }
    return SPACE.join(parts);
  }

  /**
   * Reads an expression back into rows. Each resolved term becomes a row carrying the operator
   * seen last before it; the first resolved row never carries one. A non-blank expression in which
   * nothing resolves yields a single empty row so there is something to edit.
   */
  public ImmutableList<ConditionRow> toRows(String expression, List<IndicatorInstance> selection) {
    if (expression == null || expression.isBlank()) {
      return ImmutableList.of();
    }

    ImmutableList.Builder<ConditionRow> rows = ImmutableList.builder();
    boolean first = true;
    Optional<Operator> pendingOperator = Optional.empty();
    for (ExpressionToken token : tokenizer.tokenize(expression)) {
      if (token.isOperator()) {
        pendingOperator = Optional.of(token.operator());
        continue;
      }

      Optional<ResolvedCondition> resolved = resolver.resolve(token.text(), selection);
      if (resolved.isEmpty()) {
        logger.atFine().log("Dropping unresolved term %s", token.text());
        continue;
      }

      Operator operator = first ? null : pendingOperator.orElse(Operator.AND);
      rows.add(
          ConditionRow.create(
              resolved.get().indicatorId(), resolved.get().conditionName(), operator));
      first = false;
      pendingOperator = Optional.empty();
    }

    ImmutableList<ConditionRow> result = rows.build();
    if (result.isEmpty()) {
      return ImmutableList.of(ConditionRow.empty());
    }
    return result;
  }

  /**
   * Readable rendering of the rows using catalog descriptions, for example "RSI &lt; oversold
   * threshold and MACD line crosses above signal line".
   */
  public String preview(List<ConditionRow> rows) {
    List<String> parts = new ArrayList<>();
    for (ConditionRow row : rows) {
      if (!row.hasCondition()) {
        continue;
      }
      if (!parts.isEmpty()) {
        parts.add(row.precedingOperator().orElse(Operator.AND).connective());
      }
      parts.add(describe(row));
    }
    if (parts.isEmpty()) {
      return NO_CONDITIONS;
    }
    String first = parts.get(0);
    if (!first.isEmpty()) {
      parts.set(0, Ascii.toUpperCase(first.substring(0, 1)) + first.substring(1));
    }
    return SPACE.join(parts);
  }

  private String describe(ConditionRow row) {
    String conditionName = row.conditionName().get();
    return row.indicatorId()
        .flatMap(indicatorId -> catalog.conditionDescription(indicatorId, conditionName))
        .orElse(conditionName);
  }
}
