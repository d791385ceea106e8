package com.verlumen.signalbuilder.expression;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.signalbuilder.catalog.ConditionCatalog;
import com.verlumen.signalbuilder.catalog.IndicatorInstance;
import java.util.List;
import java.util.Optional;

/**
 * Attributes expression terms to the conditions of the selected indicators.
 *
 * <p>An exact name match anywhere in the selection beats a case-insensitive one. Within each pass
 * the indicator selected first wins, which is how a name shared by two indicators is attributed.
 * Terms that match nothing are reported as empty and left for the caller to drop or flag.
 */
public final class ConditionResolver {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ConditionCatalog catalog;
  private final ExpressionTokenizer tokenizer;

  @Inject
  public ConditionResolver(ConditionCatalog catalog, ExpressionTokenizer tokenizer) {
    this.catalog = checkNotNull(catalog);
    this.tokenizer = checkNotNull(tokenizer);
  }

  public Optional<ResolvedCondition> resolve(String term, List<IndicatorInstance> selection) {
    if (term == null || term.isEmpty()) {
      return Optional.empty();
    }

    for (IndicatorInstance instance : selection) {
      if (catalog.conditions(instance.indicatorId()).containsKey(term)) {
        return Optional.of(ResolvedCondition.create(instance.indicatorId(), term));
      }
    }

    for (IndicatorInstance instance : selection) {
      for (String name : catalog.conditions(instance.indicatorId()).keySet()) {
        if (name.equalsIgnoreCase(term)) {
          return Optional.of(ResolvedCondition.create(instance.indicatorId(), name));
        }
      }
    }

    logger.atFine().log("No selected indicator declares condition %s", term);
    return Optional.empty();
  }

  /** Every resolvable term of the expression, in expression order. */
  public ImmutableList<ResolvedCondition> resolveAll(
      String expression, List<IndicatorInstance> selection) {
    return tokenizer.tokenize(expression).stream()
        .filter(token -> !token.isOperator())
        .map(token -> resolve(token.text(), selection))
        .flatMap(Optional::stream)
        .collect(toImmutableList());
  }

  /** Terms of the expression that cannot be attributed to any selected indicator. */
  public ImmutableList<String> unresolvedTerms(
      String expression, List<IndicatorInstance> selection) {
    return tokenizer.tokenize(expression).stream()
        .filter(token -> !token.isOperator())
        .map(ExpressionToken::text)
        .filter(term -> resolve(term, selection).isEmpty())
        .distinct()
        .collect(toImmutableList());
  }

  /** Conditions of one indicator that the expression refers to. */
  public ImmutableList<String> activeConditions(
      String expression, List<IndicatorInstance> selection, String indicatorId) {
    return resolveAll(expression, selection).stream()
        .filter(resolved -> resolved.indicatorId().equals(indicatorId))
        .map(ResolvedCondition::conditionName)
        .collect(toImmutableList());
  }
}
