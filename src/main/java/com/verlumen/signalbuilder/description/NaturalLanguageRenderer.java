package com.verlumen.signalbuilder.description;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Ascii;
import com.google.common.base.Joiner;
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
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders expressions as English sentences using the parameter values bound to the selected
 * indicators, for example "RSI(14) is below 30 (oversold) and MACD(12,26,9) crosses above signal
 * line".
 */
public final class NaturalLanguageRenderer {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final Joiner SPACE = Joiner.on(' ');
  static final String NO_CONDITIONS = "No strategy conditions defined.";

  private final ConditionCatalog catalog;
  private final ExpressionTokenizer tokenizer;
  private final ConditionResolver resolver;

  @Inject
  public NaturalLanguageRenderer(
      ConditionCatalog catalog, ExpressionTokenizer tokenizer, ConditionResolver resolver) {
    this.catalog = checkNotNull(catalog);
    this.tokenizer = checkNotNull(tokenizer);
    this.resolver = checkNotNull(resolver);
  }

  /**
   * One clause for a resolved condition. Families with hand-written phrasing use it; any other
   * condition reads as its catalog description with parameter names replaced by their values, or
   * as its bare name when the catalog has no description.
   */
  public String renderCondition(ResolvedCondition condition, IndicatorInstance instance) {
    String name = condition.conditionName();
    BoundParameters params = new BoundParameters(instance.parameters());
    return IndicatorFamily.forCondition(name)
        .render(name, params)
        .orElseGet(() -> describeGenerically(condition, params));
  }

  /**
   * The expression as a sentence. Unresolved terms are skipped; each rendered clause after the
   * first is preceded by the last operator seen before it. Only the first clause is capitalized.
   *
   * @return the sentence, or "" when no term resolves
   */
  public String render(String expression, List<IndicatorInstance> selection) {
    List<String> clauses = new ArrayList<>();
    Optional<Operator> lastOperator = Optional.empty();
    for (ExpressionToken token : tokenizer.tokenize(expression)) {
      if (token.isOperator()) {
        lastOperator = Optional.of(token.operator());
        continue;
      }

      Optional<ResolvedCondition> resolved = resolver.resolve(token.text(), selection);
      if (resolved.isEmpty()) {
        logger.atFine().log("Not describing unresolved term %s", token.text());
        continue;
      }

      String clause = renderCondition(resolved.get(), instanceOf(resolved.get(), selection));
      if (lastOperator.isPresent() && !clauses.isEmpty()) {
        clauses.add(lastOperator.get().connective());
      }
      clauses.add(clause);
      lastOperator = Optional.empty();
    }

    if (clauses.isEmpty()) {
      return "";
    }
    String first = clauses.get(0);
    if (!first.isEmpty()) {
      clauses.set(0, Ascii.toUpperCase(first.substring(0, 1)) + first.substring(1));
    }
    return SPACE.join(clauses);
  }

  /** Summarizes every expression of the strategy in one paragraph. */
  public String describe(StrategyExpressions strategy, List<IndicatorInstance> selection) {
    if (!strategy.useSeparateExpressions()) {
      String description = render(strategy.expression(), selection);
      return description.isEmpty()
          ? NO_CONDITIONS
          : "Strategy goes long when " + Ascii.toLowerCase(description);
    }

    List<String> parts = new ArrayList<>();
    String longDescription = render(strategy.longExpression(), selection);
    if (!longDescription.isEmpty()) {
      parts.add("Goes LONG when " + Ascii.toLowerCase(longDescription));
    }

    switch (strategy.strategyType()) {
      case LONG_CASH -> {
        if (!strategy.cashExpression().isBlank()) {
          String cashDescription = render(strategy.cashExpression(), selection);
          if (!cashDescription.isEmpty()) {
            parts.add("Goes to CASH when " + Ascii.toLowerCase(cashDescription));
          }
        } else if (!strategy.longExpression().isBlank()) {
          parts.add("Goes to CASH when LONG conditions are false");
        }
      }
      case LONG_SHORT -> {
        String shortDescription = render(strategy.shortExpression(), selection);
        if (!shortDescription.isEmpty()) {
          parts.add("Goes SHORT when " + Ascii.toLowerCase(shortDescription));
        }
      }
    }

    return parts.isEmpty() ? NO_CONDITIONS : Joiner.on(". ").join(parts) + ".";
  }

  private String describeGenerically(ResolvedCondition condition, BoundParameters params) {
    return catalog
        .conditionDescription(condition.indicatorId(), condition.conditionName())
        .map(description -> substitute(description, params))
        .orElse(condition.conditionName());
  }

  /** Replaces "{name}" placeholders, then bare parameter names, in any letter case. */
  private static String substitute(String description, BoundParameters params) {
    String result = description;
    for (Map.Entry<String, Double> param : params.asMap().entrySet()) {
      String value = Matcher.quoteReplacement(BoundParameters.format(param.getValue()));
      String key = Pattern.quote(param.getKey());
      result =
          Pattern.compile("\\{" + key + "\\}", Pattern.CASE_INSENSITIVE)
              .matcher(result)
              .replaceAll(value);
      result =
          Pattern.compile("\\b" + key + "\\b", Pattern.CASE_INSENSITIVE)
              .matcher(result)
              .replaceAll(value);
    }
    return result;
  }

  private static IndicatorInstance instanceOf(
      ResolvedCondition condition, List<IndicatorInstance> selection) {
    return selection.stream()
        .filter(instance -> instance.indicatorId().equals(condition.indicatorId()))
        .findFirst()
        .orElseGet(() -> IndicatorInstance.create(condition.indicatorId()));
  }
}
