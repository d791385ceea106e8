package com.verlumen.signalbuilder.catalog;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An indicator the user has added to the strategy session, with the parameter values chosen for
 * it. The id refers to an indicator declared in the {@link ConditionCatalog}.
 */
@AutoValue
public abstract class IndicatorInstance {
  public static IndicatorInstance create(String indicatorId, Map<String, Double> parameters) {
    return new AutoValue_IndicatorInstance(
        checkNotNull(indicatorId), ImmutableMap.copyOf(parameters));
  }

  public static IndicatorInstance create(String indicatorId) {
    return create(indicatorId, ImmutableMap.of());
  }

  public abstract String indicatorId();

  public abstract ImmutableMap<String, Double> parameters();

  /** Returns a copy with {@code name} bound to {@code value}, keeping parameter order. */
  public IndicatorInstance withParameter(String name, double value) {
    Map<String, Double> updated = new LinkedHashMap<>(parameters());
    updated.put(name, value);
    return create(indicatorId(), updated);
  }
}
