package com.verlumen.signalbuilder.expression;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import com.verlumen.signalbuilder.catalog.ConditionCatalog;
import com.verlumen.signalbuilder.catalog.ExpressionTemplate;
import com.verlumen.signalbuilder.catalog.IndicatorInstance;
import java.util.List;
import java.util.Optional;

/** Offers the catalog's expression templates that the current selection can satisfy. */
public final class ExpressionTemplates {
  static final String ALL_CATEGORIES = "All";

  private final ConditionCatalog catalog;
  private final ExpressionTokenizer tokenizer;
  private final ConditionResolver resolver;

  @Inject
  public ExpressionTemplates(
      ConditionCatalog catalog, ExpressionTokenizer tokenizer, ConditionResolver resolver) {
    this.catalog = checkNotNull(catalog);
    this.tokenizer = checkNotNull(tokenizer);
    this.resolver = checkNotNull(resolver);
  }

  /**
   * Templates whose every term resolves against the selection.
   *
   * @param category when present and not "All", only templates of this category are returned
   */
  public ImmutableList<ExpressionTemplate> available(
      List<IndicatorInstance> selection, Optional<String> category) {
    return catalog.templates().stream()
        .filter(template -> matchesCategory(template, category))
        .filter(template -> isSatisfiable(template.getExpression(), selection))
        .collect(toImmutableList());
  }

  /** Distinct template categories in declaration order, preceded by "All". */
  public ImmutableList<String> categories() {
    return ImmutableList.<String>builder()
        .add(ALL_CATEGORIES)
        .addAll(
            catalog.templates().stream()
                .map(ExpressionTemplate::getCategory)
                .distinct()
                .collect(toImmutableList()))
        .build();
  }

  private static boolean matchesCategory(ExpressionTemplate template, Optional<String> category) {
    return category
        .filter(name -> !ALL_CATEGORIES.equals(name))
        .map(name -> name.equals(template.getCategory()))
        .orElse(true);
  }

  private boolean isSatisfiable(String expression, List<IndicatorInstance> selection) {
    ImmutableList<ExpressionToken> tokens = tokenizer.tokenize(expression);
    return !tokens.isEmpty()
        && tokens.stream()
            .filter(token -> !token.isOperator())
            .allMatch(token -> resolver.resolve(token.text(), selection).isPresent());
  }
}
