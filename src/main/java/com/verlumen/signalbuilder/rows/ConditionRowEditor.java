package com.verlumen.signalbuilder.rows;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import com.verlumen.signalbuilder.catalog.IndicatorInstance;
import com.verlumen.signalbuilder.expression.Operator;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Editable state behind the condition list. Every edit keeps the first row free of an operator and
 * every later row bound to one.
 *
 * <p>Instances hold per-session state and are not thread-safe.
 */
public final class ConditionRowEditor {
  private final RowExpressionCompiler compiler;
  private final List<ConditionRow> rows = new ArrayList<>();

  @Inject
  public ConditionRowEditor(RowExpressionCompiler compiler) {
    this.compiler = checkNotNull(compiler);
  }

  /** Replaces the rows with those parsed from {@code expression}. */
  public void load(String expression, List<IndicatorInstance> selection) {
    rows.clear();
    rows.addAll(compiler.toRows(expression, selection));
  }

  /** Appends a row bound to the first selected indicator with no condition chosen yet. */
  public void addRow(List<IndicatorInstance> selection) {
    String indicatorId = selection.isEmpty() ? null : selection.get(0).indicatorId();
    rows.add(ConditionRow.create(indicatorId, null, rows.isEmpty() ? null : Operator.AND));
  }

  public void removeRow(int index) {
    checkElementIndex(index, rows.size());
    rows.remove(index);
    if (!rows.isEmpty()) {
      rows.set(0, rows.get(0).withOperator(null));
    }
  }

  /** Binds the row to another indicator. Switching indicators clears the chosen condition. */
  public void setIndicator(int index, String indicatorId) {
    checkElementIndex(index, rows.size());
    ConditionRow row = rows.get(index);
    if (Objects.equals(row.indicatorId().orElse(null), indicatorId)) {
      return;
    }
    rows.set(index, row.withIndicator(indicatorId).withCondition(null));
  }

  public void setCondition(int index, String conditionName) {
    checkElementIndex(index, rows.size());
    rows.set(index, rows.get(index).withCondition(conditionName));
  }

  public void setOperator(int index, Operator operator) {
    checkElementIndex(index, rows.size());
    checkArgument(index > 0, "The first row has no preceding operator");
    rows.set(index, rows.get(index).withOperator(checkNotNull(operator)));
  }

  public ImmutableList<ConditionRow> rows() {
    return ImmutableList.copyOf(rows);
  }

  public String expression() {
    return compiler.toExpression(rows);
  }

  public String preview() {
    return compiler.preview(rows);
  }
}
