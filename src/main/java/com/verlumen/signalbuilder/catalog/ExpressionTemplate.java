package com.verlumen.signalbuilder.catalog;

import java.io.Serializable;
import java.util.Objects;

/** A ready-made expression offered to the user when its conditions are available. */
public final class ExpressionTemplate implements Serializable {
  private static final long serialVersionUID = 1L;

  private String name;
  private String description;
  private String category;
  private String expression;
  private String example;

  public ExpressionTemplate() {}

  public ExpressionTemplate(
      String name, String description, String category, String expression, String example) {
    this.name = name;
    this.description = description;
    this.category = category;
    this.expression = expression;
    this.example = example;
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

  public String getExpression() {
    return expression;
  }

  public void setExpression(String expression) {
    this.expression = expression;
  }

  public String getExample() {
    return example;
  }

  public void setExample(String example) {
    this.example = example;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ExpressionTemplate that = (ExpressionTemplate) o;
    return Objects.equals(name, that.name)
        && Objects.equals(description, that.description)
        && Objects.equals(category, that.category)
        && Objects.equals(expression, that.expression)
        && Objects.equals(example, that.example);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, description, category, expression, example);
  }

  @Override
  public String toString() {
    return "ExpressionTemplate{"
        + "name='"
        + name
        + '\''
        + ", category='"
        + category
        + '\''
        + ", expression='"
        + expression
        + '\''
        + '}';
  }
}
