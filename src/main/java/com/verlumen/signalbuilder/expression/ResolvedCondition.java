package com.verlumen.signalbuilder.expression;

import com.google.auto.value.AutoValue;

/** A term attributed to a known condition of a selected indicator. */
@AutoValue
public abstract class ResolvedCondition {
  public static ResolvedCondition create(String indicatorId, String conditionName) {
    return new AutoValue_ResolvedCondition(indicatorId, conditionName);
  }

  public abstract String indicatorId();

  /** Condition name exactly as the catalog declares it. */
  public abstract String conditionName();
}
