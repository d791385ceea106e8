package com.verlumen.signalbuilder.graph;

import com.google.auto.value.AutoValue;
import com.verlumen.signalbuilder.expression.Operator;

/** Directed edge declaring how the source node's expression combines into the target's. */
@AutoValue
public abstract class SignalEdge {
  public static SignalEdge create(String from, String to, Operator operator) {
    return new AutoValue_SignalEdge(from, to, operator);
  }

  public abstract String from();

  public abstract String to();

  public abstract Operator operator();
}
