package com.verlumen.signalbuilder.rows;

import com.google.auto.value.AutoValue;
import com.verlumen.signalbuilder.expression.Operator;
import java.util.Optional;

/**
 * One line of the flat condition list. The operator joins this row to the one before it and is
 * absent on the first row of a list.
 */
@AutoValue
public abstract class ConditionRow {
  public static ConditionRow create(
      String indicatorId, String conditionName, Operator precedingOperator) {
    return new AutoValue_ConditionRow(
        Optional.ofNullable(indicatorId),
        Optional.ofNullable(conditionName),
        Optional.ofNullable(precedingOperator));
  }

  /** A row with nothing chosen yet. */
  public static ConditionRow empty() {
    return create(null, null, null);
  }

  public abstract Optional<String> indicatorId();

  public abstract Optional<String> conditionName();

  public abstract Optional<Operator> precedingOperator();

  public boolean hasCondition() {
    return conditionName().filter(name -> !name.isEmpty()).isPresent();
  }

  ConditionRow withIndicator(String indicatorId) {
    return create(indicatorId, conditionName().orElse(null), precedingOperator().orElse(null));
  }

  ConditionRow withCondition(String conditionName) {
    return create(indicatorId().orElse(null), conditionName, precedingOperator().orElse(null));
  }

  ConditionRow withOperator(Operator operator) {
    return create(indicatorId().orElse(null), conditionName().orElse(null), operator);
  }
}
