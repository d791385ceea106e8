package com.verlumen.signalbuilder.expression;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a raw expression into condition terms and operators.
 *
 * <p>Operators are recognised only when surrounded by whitespace and in any letter case. Terms are
 * trimmed and stripped of every parenthesis, so grouping is flattened. Segments left empty, for
 * example by leading or consecutive operators, are dropped.
 */
public final class ExpressionTokenizer {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final Pattern OPERATOR_PATTERN =
      Pattern.compile("\\s+(AND|OR)\\s+", Pattern.CASE_INSENSITIVE);
  private static final CharMatcher PARENTHESES = CharMatcher.anyOf("()");

  @Inject
  public ExpressionTokenizer() {}

  public ImmutableList<ExpressionToken> tokenize(String expression) {
    if (expression == null || expression.isBlank()) {
      return ImmutableList.of();
    }

    ImmutableList.Builder<ExpressionToken> tokens = ImmutableList.builder();
    Matcher matcher = OPERATOR_PATTERN.matcher(expression);
    int segmentStart = 0;
    while (matcher.find()) {
      addTerm(tokens, expression.substring(segmentStart, matcher.start()));
      // The pattern only captures AND/OR, so the keyword always parses.
      tokens.add(ExpressionToken.operator(Operator.fromKeyword(matcher.group(1)).get()));
      segmentStart = matcher.end();
    }
    addTerm(tokens, expression.substring(segmentStart));

    ImmutableList<ExpressionToken> result = tokens.build();
    logger.atFine().log("Tokenized %s into %d tokens", expression, result.size());
    return result;
  }

  private static void addTerm(ImmutableList.Builder<ExpressionToken> tokens, String segment) {
    String term = PARENTHESES.removeFrom(segment.trim()).trim();
    if (!term.isEmpty()) {
      tokens.add(ExpressionToken.term(term));
    }
  }
}
