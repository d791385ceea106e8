package com.verlumen.signalbuilder.validation;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.signalbuilder.catalog.ConditionCatalog;
import com.verlumen.signalbuilder.catalog.IndicatorInstance;
import com.verlumen.signalbuilder.description.StrategyExpressions;
import com.verlumen.signalbuilder.description.StrategyType;
import com.verlumen.signalbuilder.expression.ConditionResolver;
import com.verlumen.signalbuilder.expression.ResolvedCondition;
import com.verlumen.signalbuilder.validation.ValidationIssue.Severity;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pre-flight checks of a strategy against the indicator selection. Checks never throw; everything
 * they find is reported as an issue, in a fixed order.
 */
public final class StrategyValidator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final Pattern OPERATOR_WORD =
      Pattern.compile("\\b(AND|OR)\\b", Pattern.CASE_INSENSITIVE);
  private static final ImmutableSet<String> VOLUME_INDICATORS =
      ImmutableSet.of("OBV", "Volume_SMA");
  private static final int MAX_INDICATORS = 10;
  private static final int MAX_OPERATORS = 10;

  private final ConditionCatalog catalog;
  private final ConditionResolver resolver;

  @Inject
  public StrategyValidator(ConditionCatalog catalog, ConditionResolver resolver) {
    this.catalog = checkNotNull(catalog);
    this.resolver = checkNotNull(resolver);
  }

  /** True when none of the issues is an error. */
  public static boolean isValid(List<ValidationIssue> issues) {
    return issues.stream().noneMatch(ValidationIssue::isError);
  }

  public ImmutableList<ValidationIssue> validate(
      StrategyExpressions strategy, List<IndicatorInstance> selection) {
    ImmutableList.Builder<ValidationIssue> issues = ImmutableList.builder();
    if (selection.isEmpty()) {
      issues.add(
          ValidationIssue.create(
              Severity.ERROR,
              "No indicators selected",
              "Add at least one indicator from the library to build your strategy",
              "indicators"));
      return issues.build();
    }

    String activeExpression = strategy.activeExpression();
    boolean hasExpression = !activeExpression.isBlank();
    if (!hasExpression) {
      issues.add(
          ValidationIssue.create(
              Severity.ERROR,
              "No strategy expression defined",
              strategy.useSeparateExpressions()
                  ? "Define your LONG expression to specify when to enter long positions"
                  : "Build an expression using conditions from your selected indicators",
              "expression"));
    }
    if (strategy.useSeparateExpressions()) {
      checkSeparateExpressions(strategy, issues);
    }

    if (hasExpression) {
      for (String term : resolver.unresolvedTerms(activeExpression, selection)) {
        issues.add(
            ValidationIssue.create(
                Severity.WARNING,
                "Unknown condition '" + term + "'",
                "Use a condition of one of the selected indicators; unknown conditions are ignored",
                "expression"));
      }
      checkConflicts(activeExpression, selection, issues);
    }

    if (selection.size() > MAX_INDICATORS) {
      issues.add(
          ValidationIssue.create(
              Severity.INFO,
              "Many indicators selected",
              "Using many indicators may slow down backtesting. Consider simplifying your strategy",
              "indicators"));
    }

    if (hasExpression && countOperators(activeExpression) > MAX_OPERATORS) {
      issues.add(
          ValidationIssue.create(
              Severity.WARNING,
              "Very complex expression",
              "Consider breaking down into simpler sub-expressions or using visual grouping",
              "expression"));
    }

    if (selection.size() == 1 && hasExpression) {
      issues.add(
          ValidationIssue.create(
              Severity.SUGGESTION,
              "Single indicator strategy",
              "Consider adding complementary indicators (e.g., RSI + MACD) for better signal"
                  + " confirmation",
              "indicators"));
    }

    if (selection.stream().anyMatch(i -> VOLUME_INDICATORS.contains(i.indicatorId()))) {
      issues.add(
          ValidationIssue.create(
              Severity.INFO,
              "Volume indicators selected",
              "Ensure your data source includes volume data",
              "indicators"));
    }

    ImmutableList<ValidationIssue> result = issues.build();
    logger.atFine().log("Validation found %d issues", result.size());
    return result;
  }

  private static void checkSeparateExpressions(
      StrategyExpressions strategy, ImmutableList.Builder<ValidationIssue> issues) {
    if (strategy.longExpression().isBlank()) {
      issues.add(
          ValidationIssue.create(
              Severity.ERROR,
              "LONG expression is required",
              "Define when to go LONG using indicator conditions",
              "longExpression"));
    }
    if (strategy.strategyType() == StrategyType.LONG_SHORT
        && strategy.shortExpression().isBlank()) {
      issues.add(
          ValidationIssue.create(
              Severity.ERROR,
              "SHORT expression is required for Long/Short strategy",
              "Define when to go SHORT using indicator conditions",
              "shortExpression"));
    }
  }

  /** Flags an indicator whose conditions in the expression ask for both oversold and overbought. */
  private void checkConflicts(
      String expression,
      List<IndicatorInstance> selection,
      ImmutableList.Builder<ValidationIssue> issues) {
    SetMultimap<String, String> conditionsByIndicator = LinkedHashMultimap.create();
    for (ResolvedCondition resolved : resolver.resolveAll(expression, selection)) {
      conditionsByIndicator.put(resolved.indicatorId(), resolved.conditionName());
    }

    for (Map.Entry<String, Collection<String>> entry : conditionsByIndicator.asMap().entrySet()) {
      Collection<String> conditions = entry.getValue();
      boolean oversold = conditions.stream().anyMatch(name -> name.contains("oversold"));
      boolean overbought = conditions.stream().anyMatch(name -> name.contains("overbought"));
      if (oversold && overbought) {
        issues.add(
            ValidationIssue.create(
                Severity.WARNING,
                "Conflicting conditions detected for " + catalog.displayName(entry.getKey()),
                "Consider using OR logic if you want either condition, or remove one condition",
                "expression"));
      }
    }
  }

  private static int countOperators(String expression) {
    Matcher matcher = OPERATOR_WORD.matcher(expression);
    int count = 0;
    while (matcher.find()) {
      count++;
    }
    return count;
  }
}
