package com.verlumen.signalbuilder.catalog;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * POJO representing a condition catalog file loaded from YAML/JSON. This is the top-level object
 * binding the declared indicators and the expression templates offered on top of them.
 */
public final class CatalogConfig implements Serializable {
  private static final long serialVersionUID = 1L;

  private String name;
  private List<IndicatorDefinition> indicators;
  private List<ExpressionTemplate> templates;

  public CatalogConfig() {}

  public CatalogConfig(
      String name, List<IndicatorDefinition> indicators, List<ExpressionTemplate> templates) {
    this.name = name;
    this.indicators = indicators;
    this.templates = templates;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public List<IndicatorDefinition> getIndicators() {
    return indicators;
  }

  public void setIndicators(List<IndicatorDefinition> indicators) {
    this.indicators = indicators;
  }

  public List<ExpressionTemplate> getTemplates() {
    return templates;
  }

  public void setTemplates(List<ExpressionTemplate> templates) {
    this.templates = templates;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    CatalogConfig that = (CatalogConfig) o;
    return Objects.equals(name, that.name)
        && Objects.equals(indicators, that.indicators)
        && Objects.equals(templates, that.templates);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, indicators, templates);
  }

  @Override
  public String toString() {
    return "CatalogConfig{"
        + "name='"
        + name
        + '\''
        + ", indicators="
        + indicators
        + ", templates="
        + templates
        + '}';
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String name;
    private List<IndicatorDefinition> indicators;
    private List<ExpressionTemplate> templates;

    private Builder() {}

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder indicators(List<IndicatorDefinition> indicators) {
      this.indicators = indicators;
      return this;
    }

    public Builder templates(List<ExpressionTemplate> templates) {
      this.templates = templates;
      return this;
    }

    public CatalogConfig build() {
      return new CatalogConfig(name, indicators, templates);
    }
  }
}
