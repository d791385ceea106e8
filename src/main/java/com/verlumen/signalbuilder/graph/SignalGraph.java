package com.verlumen.signalbuilder.graph;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.collect.ImmutableSet.toImmutableSet;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multimaps;
import com.verlumen.signalbuilder.catalog.IndicatorInstance;
import com.verlumen.signalbuilder.expression.Operator;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Immutable node and edge sets of the visual signal graph. Editing operations return a new graph.
 */
@AutoValue
public abstract class SignalGraph {
  static final double FIRST_NODE_X = 400;
  static final double NODE_SPACING = 250;

  public static SignalGraph create(List<SignalNode> nodes, List<SignalEdge> edges) {
    ImmutableList<SignalNode> nodeList = ImmutableList.copyOf(nodes);
    long distinctIds = nodeList.stream().map(SignalNode::id).distinct().count();
    checkArgument(distinctIds == nodeList.size(), "Duplicate node ids in %s", nodeList);
    return new AutoValue_SignalGraph(nodeList, ImmutableList.copyOf(edges));
  }

  public static SignalGraph empty() {
    return create(ImmutableList.of(), ImmutableList.of());
  }

  public abstract ImmutableList<SignalNode> nodes();

  public abstract ImmutableList<SignalEdge> edges();

  public Optional<SignalNode> node(String nodeId) {
    return nodes().stream().filter(node -> node.id().equals(nodeId)).findFirst();
  }

  public ImmutableSet<String> nodeIds() {
    return nodes().stream().map(SignalNode::id).collect(toImmutableSet());
  }

  /** Edges grouped by target node, each group in edge order. */
  public ImmutableListMultimap<String, SignalEdge> incomingEdges() {
    return Multimaps.index(edges(), SignalEdge::to);
  }

  /** Nodes no edge points to, in node order. */
  public ImmutableList<SignalNode> entryNodes() {
    Set<String> targets = incomingEdges().keySet();
    return nodes().stream().filter(node -> !targets.contains(node.id())).collect(toImmutableList());
  }

  public SignalGraph withNode(SignalNode node) {
    checkArgument(node(node.id()).isEmpty(), "Node already present: %s", node.id());
    return create(
        ImmutableList.<SignalNode>builder().addAll(nodes()).add(node).build(), edges());
  }

  /** Removes the node together with every edge touching it. */
  public SignalGraph withoutNode(String nodeId) {
    return create(
        nodes().stream().filter(node -> !node.id().equals(nodeId)).collect(toImmutableList()),
        edges().stream()
            .filter(edge -> !edge.from().equals(nodeId) && !edge.to().equals(nodeId))
            .collect(toImmutableList()));
  }

  /**
   * Connects two existing nodes. An edge already joining the same ordered pair is replaced, so a
   * pair carries at most one operator.
   */
  public SignalGraph withEdge(String from, String to, Operator operator) {
    checkArgument(!from.equals(to), "Cannot connect node %s to itself", from);
    checkArgument(node(from).isPresent(), "Unknown source node: %s", from);
    checkArgument(node(to).isPresent(), "Unknown target node: %s", to);
    List<SignalEdge> updated = new ArrayList<>();
    for (SignalEdge edge : edges()) {
      if (!(edge.from().equals(from) && edge.to().equals(to))) {
        updated.add(edge);
      }
    }
    updated.add(SignalEdge.create(from, to, operator));
    return create(nodes(), updated);
  }

  public SignalGraph withoutEdge(String from, String to) {
    return create(
        nodes(),
        edges().stream()
            .filter(edge -> !(edge.from().equals(from) && edge.to().equals(to)))
            .collect(toImmutableList()));
  }

  /**
   * Brings the nodes in line with the indicator selection: one node per selected indicator.
   * Existing nodes keep their id and position, nodes of deselected indicators are removed with
   * their edges, and newly selected indicators get a node to the right of the rightmost one.
   */
  public SignalGraph syncedWith(List<IndicatorInstance> selection) {
    ImmutableSet<String> selected =
        selection.stream().map(IndicatorInstance::indicatorId).collect(toImmutableSet());
    SignalGraph graph = this;
    for (SignalNode node : nodes()) {
      if (!selected.contains(node.indicatorId())) {
        graph = graph.withoutNode(node.id());
      }
    }

    for (String indicatorId : selected) {
      boolean present =
          graph.nodes().stream().anyMatch(node -> node.indicatorId().equals(indicatorId));
      if (!present) {
        graph =
            graph.withNode(
                SignalNode.create(graph.freeId(indicatorId), indicatorId, graph.nextX()));
      }
    }
    return graph;
  }

  private String freeId(String preferred) {
    ImmutableSet<String> taken = nodeIds();
    String candidate = preferred;
    for (int suffix = 2; taken.contains(candidate); suffix++) {
      candidate = preferred + "-" + suffix;
    }
    return candidate;
  }

  private double nextX() {
    OptionalDouble rightmost = nodes().stream().mapToDouble(SignalNode::x).max();
    return rightmost.isPresent() ? rightmost.getAsDouble() + NODE_SPACING : FIRST_NODE_X;
  }
}
