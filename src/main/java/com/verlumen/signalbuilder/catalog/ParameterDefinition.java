package com.verlumen.signalbuilder.catalog;

import java.io.Serializable;
import java.util.Objects;

/**
 * Definition of one tunable indicator parameter: its numeric kind, allowed range and default
 * value. The parameter name is the key under which the definition is declared in its indicator.
 */
public final class ParameterDefinition implements Serializable {
  private static final long serialVersionUID = 1L;

  private ParameterType type;
  private Number defaultValue;
  private Number min;
  private Number max;
  private String description;

  public ParameterDefinition() {}

  public ParameterDefinition(
      ParameterType type, Number defaultValue, Number min, Number max, String description) {
    this.type = type;
    this.defaultValue = defaultValue;
    this.min = min;
    this.max = max;
    this.description = description;
  }

  public ParameterType getType() {
    return type;
  }

  public void setType(ParameterType type) {
    this.type = type;
  }

  public Number getDefaultValue() {
    return defaultValue;
  }

  public void setDefaultValue(Number defaultValue) {
    this.defaultValue = defaultValue;
  }

  public Number getMin() {
    return min;
  }

  public void setMin(Number min) {
    this.min = min;
  }

  public Number getMax() {
    return max;
  }

  public void setMax(Number max) {
    this.max = max;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ParameterDefinition that = (ParameterDefinition) o;
    return type == that.type
        && Objects.equals(defaultValue, that.defaultValue)
        && Objects.equals(min, that.min)
        && Objects.equals(max, that.max)
        && Objects.equals(description, that.description);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, defaultValue, min, max, description);
  }

  @Override
  public String toString() {
    return "ParameterDefinition{"
        + "type="
        + type
        + ", defaultValue="
        + defaultValue
        + ", min="
        + min
        + ", max="
        + max
        + ", description='"
        + description
        + '\''
        + '}';
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private ParameterType type;
    private Number defaultValue;
    private Number min;
    private Number max;
    private String description;

    private Builder() {}

    public Builder type(ParameterType type) {
      this.type = type;
      return this;
    }

    public Builder defaultValue(Number defaultValue) {
      this.defaultValue = defaultValue;
      return this;
    }

    public Builder min(Number min) {
      this.min = min;
      return this;
    }

    public Builder max(Number max) {
      this.max = max;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public ParameterDefinition build() {
      return new ParameterDefinition(type, defaultValue, min, max, description);
    }
  }
}
