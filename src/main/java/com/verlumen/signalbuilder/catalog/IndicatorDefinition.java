package com.verlumen.signalbuilder.catalog;

import java.io.Serializable;
import java.util.Map;
import java.util.Objects;

/**
 * Catalog entry for a single indicator as declared in the catalog file: display metadata, its
 * tunable parameters and the named boolean conditions it exposes. Both maps keep declaration order.
 */
public final class IndicatorDefinition implements Serializable {
  private static final long serialVersionUID = 1L;

  private String id;
  private String name;
  private String description;
  private String category;
  private Map<String, ParameterDefinition> parameters;
  private Map<String, String> conditions;

  public IndicatorDefinition() {}

  public IndicatorDefinition(
      String id,
      String name,
      String description,
      String category,
      Map<String, ParameterDefinition> parameters,
      Map<String, String> conditions) {
    this.id = id;
    this.name = name;
    this.description = description;
    this.category = category;
    this.parameters = parameters;
    this.conditions = conditions;
  }

  public String getId() {
    return id;
  }

  public void setId(String id) {
    this.id = id;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public String getCategory() {
    return category;
  }

  public void setCategory(String category) {
    this.category = category;
  }

  public Map<String, ParameterDefinition> getParameters() {
    return parameters;
  }

  public void setParameters(Map<String, ParameterDefinition> parameters) {
    this.parameters = parameters;
  }

  public Map<String, String> getConditions() {
    return conditions;
  }

  public void setConditions(Map<String, String> conditions) {
    this.conditions = conditions;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    IndicatorDefinition that = (IndicatorDefinition) o;
    return Objects.equals(id, that.id)
        && Objects.equals(name, that.name)
        && Objects.equals(description, that.description)
        && Objects.equals(category, that.category)
        && Objects.equals(parameters, that.parameters)
        && Objects.equals(conditions, that.conditions);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, name, description, category, parameters, conditions);
  }

  @Override
  public String toString() {
    return "IndicatorDefinition{"
        + "id='"
        + id
        + '\''
        + ", name='"
        + name
        + '\''
        + ", category='"
        + category
        + '\''
        + ", parameters="
        + parameters
        + ", conditions="
        + conditions
        + '}';
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String id;
    private String name;
    private String description;
    private String category;
    private Map<String, ParameterDefinition> parameters;
    private Map<String, String> conditions;

    private Builder() {}

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder category(String category) {
      this.category = category;
      return this;
    }

    public Builder parameters(Map<String, ParameterDefinition> parameters) {
      this.parameters = parameters;
      return this;
    }

    public Builder conditions(Map<String, String> conditions) {
      this.conditions = conditions;
      return this;
    }

    public IndicatorDefinition build() {
      return new IndicatorDefinition(id, name, description, category, parameters, conditions);
    }
  }
}
