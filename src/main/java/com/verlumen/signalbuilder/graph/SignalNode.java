package com.verlumen.signalbuilder.graph;

import com.google.auto.value.AutoValue;

/**
 * A node of the signal graph, backed by one selected indicator. The node id is its own identity
 * and need not equal the indicator id. {@code x} is the horizontal canvas position, used only to
 * pick a starting node when the graph has no entry node.
 */
@AutoValue
public abstract class SignalNode {
  public static SignalNode create(String id, String indicatorId) {
    return create(id, indicatorId, 0);
  }

  public static SignalNode create(String id, String indicatorId, double x) {
    return new AutoValue_SignalNode(id, indicatorId, x);
  }

  public abstract String id();

  public abstract String indicatorId();

  public abstract double x();
}
