package com.verlumen.signalbuilder.expression;

import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import java.util.Optional;

/** One item of a tokenized expression: either a condition term or an {@link Operator}. */
@AutoValue
public abstract class ExpressionToken {
  /** Kind of token. */
  public enum Kind {
    TERM,
    OPERATOR
  }

  static ExpressionToken term(String text) {
    return new AutoValue_ExpressionToken(Kind.TERM, text, Optional.empty());
  }

  static ExpressionToken operator(Operator operator) {
    return new AutoValue_ExpressionToken(Kind.OPERATOR, operator.keyword(), Optional.of(operator));
  }

  public abstract Kind kind();

  /** Term text with parentheses stripped, or the operator keyword. */
  public abstract String text();

  abstract Optional<Operator> operatorValue();

  public boolean isOperator() {
    return kind() == Kind.OPERATOR;
  }

  public Operator operator() {
    checkState(isOperator(), "Not an operator token: %s", text());
    return operatorValue().get();
  }
}
