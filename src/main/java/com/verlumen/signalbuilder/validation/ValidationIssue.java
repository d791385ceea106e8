package com.verlumen.signalbuilder.validation;

import com.google.auto.value.AutoValue;

/** A problem or hint found while checking a strategy before it is backtested. */
@AutoValue
public abstract class ValidationIssue {
  /** How strongly the issue blocks a backtest. Only errors do. */
  public enum Severity {
    ERROR,
    WARNING,
    SUGGESTION,
    INFO
  }

  public static ValidationIssue create(
      Severity severity, String message, String suggestion, String field) {
    return new AutoValue_ValidationIssue(severity, message, suggestion, field);
  }

  public abstract Severity severity();

  public abstract String message();

  /** What the user can do about it. */
  public abstract String suggestion();

  /** The strategy field the issue is about, such as "indicators" or "expression". */
  public abstract String field();

  public boolean isError() {
    return severity() == Severity.ERROR;
  }
}
