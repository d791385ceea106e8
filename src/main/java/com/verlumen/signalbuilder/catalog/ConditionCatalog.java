package com.verlumen.signalbuilder.catalog;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Strings.isNullOrEmpty;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import com.google.common.flogger.FluentLogger;
import com.google.mu.util.stream.BiStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the indicators a strategy can be built from and the named boolean conditions
 * each of them exposes.
 *
 * <p>Condition names are unique within an indicator but may repeat across indicators. Lookups that
 * take a selection resolve such clashes in favour of the indicator selected first.
 */
public final class ConditionCatalog {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ImmutableMap<String, IndicatorDefinition> indicators;
  private final ImmutableMap<String, ImmutableMap<String, String>> conditions;
  private final ImmutableMap<String, ImmutableMap<String, ParameterDefinition>> parameters;
  private final ImmutableList<ExpressionTemplate> templates;

  private ConditionCatalog(
      ImmutableMap<String, IndicatorDefinition> indicators,
      ImmutableMap<String, ImmutableMap<String, String>> conditions,
      ImmutableMap<String, ImmutableMap<String, ParameterDefinition>> parameters,
      ImmutableList<ExpressionTemplate> templates) {
    this.indicators = indicators;
    this.conditions = conditions;
    this.parameters = parameters;
    this.templates = templates;
  }

  /**
   * Builds a catalog from its file representation.
   *
   * @throws IllegalArgumentException if an indicator has no id or an id is declared twice
   */
  public static ConditionCatalog fromConfig(CatalogConfig config) {
    Map<String, IndicatorDefinition> indicators = new LinkedHashMap<>();
    ImmutableMap.Builder<String, ImmutableMap<String, String>> conditions = ImmutableMap.builder();
    ImmutableMap.Builder<String, ImmutableMap<String, ParameterDefinition>> parameters =
        ImmutableMap.builder();
    SetMultimap<String, String> owners = LinkedHashMultimap.create();

    List<IndicatorDefinition> declared =
        config.getIndicators() == null ? ImmutableList.of() : config.getIndicators();
    for (IndicatorDefinition definition : declared) {
      String id = definition.getId();
      checkArgument(!isNullOrEmpty(id), "Indicator without an id: %s", definition);
      checkArgument(!indicators.containsKey(id), "Indicator declared twice: %s", id);
      indicators.put(id, definition);

      ImmutableMap<String, String> declaredConditions =
          definition.getConditions() == null
              ? ImmutableMap.of()
              : ImmutableMap.copyOf(definition.getConditions());
      conditions.put(id, declaredConditions);
      parameters.put(
          id,
          definition.getParameters() == null
              ? ImmutableMap.of()
              : ImmutableMap.copyOf(definition.getParameters()));
      declaredConditions.keySet().forEach(name -> owners.put(name, id));
    }

    owners.asMap().forEach(
        (name, ids) -> {
          if (ids.size() > 1) {
            logger.atFine().log("Condition %s is declared by %s; first selected wins", name, ids);
          }
        });

    ConditionCatalog catalog =
        new ConditionCatalog(
            ImmutableMap.copyOf(indicators),
            conditions.buildOrThrow(),
            parameters.buildOrThrow(),
            config.getTemplates() == null
                ? ImmutableList.of()
                : ImmutableList.copyOf(config.getTemplates()));
    logger.atInfo().log(
        "Catalog %s ready with %d indicators", config.getName(), indicators.size());
    return catalog;
  }

  public ImmutableList<String> indicatorIds() {
    return indicators.keySet().asList();
  }

  public boolean containsIndicator(String indicatorId) {
    return indicators.containsKey(indicatorId);
  }

  /** Human readable name of the indicator, falling back to its id. */
  public String displayName(String indicatorId) {
    IndicatorDefinition definition = indicators.get(indicatorId);
    if (definition == null || isNullOrEmpty(definition.getName())) {
      return indicatorId;
    }
    return definition.getName();
  }

  /** Conditions declared by the indicator, name to description, in declaration order. */
  public ImmutableMap<String, String> conditions(String indicatorId) {
    return conditions.getOrDefault(indicatorId, ImmutableMap.of());
  }

  /** The indicator's first declared condition, if it declares any. */
  public Optional<String> firstCondition(String indicatorId) {
    return conditions(indicatorId).keySet().stream().findFirst();
  }

  /** The condition's catalog text; blank descriptions count as absent. */
  public Optional<String> conditionDescription(String indicatorId, String conditionName) {
    return Optional.ofNullable(conditions(indicatorId).get(conditionName))
        .filter(description -> !description.isBlank());
  }

  public ImmutableMap<String, ParameterDefinition> parameters(String indicatorId) {
    return parameters.getOrDefault(indicatorId, ImmutableMap.of());
  }

  /** Default value of every parameter that declares one. */
  public ImmutableMap<String, Double> defaultParameters(String indicatorId) {
    return BiStream.from(parameters(indicatorId))
        .filterValues(definition -> definition.getDefaultValue() != null)
        .mapValues(definition -> definition.getDefaultValue().doubleValue())
        .collect(ImmutableMap::toImmutableMap);
  }

  /**
   * Union of the conditions of the selected indicators, name to description. On a name declared
   * by several selected indicators the first one in selection order wins.
   */
  public ImmutableMap<String, String> availableConditions(List<IndicatorInstance> selection) {
    Map<String, String> available = new LinkedHashMap<>();
    for (IndicatorInstance instance : selection) {
      conditions(instance.indicatorId()).forEach(available::putIfAbsent);
    }
    return ImmutableMap.copyOf(available);
  }

  /**
   * Creates an instance of the indicator bound to its catalog defaults.
   *
   * @throws IllegalArgumentException if the catalog does not declare the indicator
   */
  public IndicatorInstance newInstance(String indicatorId) {
    checkArgument(containsIndicator(indicatorId), "Unknown indicator: %s", indicatorId);
    return IndicatorInstance.create(indicatorId, defaultParameters(indicatorId));
  }

  public ImmutableList<ExpressionTemplate> templates() {
    return templates;
  }
}
