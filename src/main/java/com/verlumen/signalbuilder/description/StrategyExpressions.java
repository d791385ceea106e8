package com.verlumen.signalbuilder.description;

import com.google.auto.value.AutoValue;

/**
 * The expressions that make up a strategy: either one expression for entering long, or separate
 * long, cash and short expressions.
 */
@AutoValue
public abstract class StrategyExpressions {
  public abstract String expression();

  public abstract String longExpression();

  public abstract String cashExpression();

  public abstract String shortExpression();

  public abstract boolean useSeparateExpressions();

  public abstract StrategyType strategyType();

  /** The expression that opens a long position in the current mode. */
  public String activeExpression() {
    return useSeparateExpressions() ? longExpression() : expression();
  }

  public static StrategyExpressions single(String expression) {
    return builder().setExpression(expression).build();
  }

  public static Builder builder() {
    return new AutoValue_StrategyExpressions.Builder()
        .setExpression("")
        .setLongExpression("")
        .setCashExpression("")
        .setShortExpression("")
        .setUseSeparateExpressions(false)
        .setStrategyType(StrategyType.LONG_CASH);
  }

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setExpression(String expression);

    public abstract Builder setLongExpression(String longExpression);

    public abstract Builder setCashExpression(String cashExpression);

    public abstract Builder setShortExpression(String shortExpression);

    public abstract Builder setUseSeparateExpressions(boolean useSeparateExpressions);

    public abstract Builder setStrategyType(StrategyType strategyType);

    public abstract StrategyExpressions build();
  }
}
