package com.verlumen.signalbuilder.description;

import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.util.Map;

/**
 * Parameter values bound to one indicator instance, with lookups that fall back to a default when a
 * parameter is absent.
 */
public final class BoundParameters {
  private final ImmutableMap<String, Double> params;

  public BoundParameters(Map<String, Double> params) {
    this.params = ImmutableMap.copyOf(params);
  }

  public double getDouble(String key, double defaultValue) {
    Double value = params.get(key);
    return value == null ? defaultValue : value;
  }

  /** The value of {@code key}, or {@code defaultValue}, formatted by {@link #format(double)}. */
  public String format(String key, double defaultValue) {
    return format(getDouble(key, defaultValue));
  }

  public ImmutableMap<String, Double> asMap() {
    return params;
  }

  /** Whole numbers print without a fraction, so 14.0 reads "14" and 2.5 reads "2.5". */
  public static String format(double value) {
    if (value == Math.rint(value) && !Double.isInfinite(value)) {
      return BigDecimal.valueOf(value).toBigInteger().toString();
    }
    return Double.toString(value);
  }
}
