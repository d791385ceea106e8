package com.verlumen.signalbuilder.graph;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.signalbuilder.catalog.ConditionCatalog;
import com.verlumen.signalbuilder.expression.Operator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Compiles a {@link SignalGraph} into a canonical expression.
 *
 * <p>A node with no incoming edge contributes the first condition its indicator declares. Any other
 * node aggregates the expressions of its sources, grouped by edge operator. Every node is expanded
 * at most once per call; a node reached again, through a cycle or a second path, contributes
 * nothing.
 */
public final class GraphExpressionSynthesizer {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final Joiner AND_JOINER = Joiner.on(" AND ");
  private static final Joiner OR_JOINER = Joiner.on(" OR ");
  private static final Comparator<SignalNode> LEFTMOST_FIRST =
      Comparator.comparingDouble(SignalNode::x).thenComparing(SignalNode::id);

  private final ConditionCatalog catalog;

  @Inject
  public GraphExpressionSynthesizer(ConditionCatalog catalog) {
    this.catalog = checkNotNull(catalog);
  }

  /**
   * Expression for the whole graph.
   *
   * <ul>
   *   <li>Without edges, every node is a leaf and the leaves are joined with AND.
   *   <li>Otherwise every entry node is expanded, sharing one visited set, and the results are
   *       joined with AND.
   *   <li>When every node has an incoming edge, only the leftmost node is expanded, ties broken by
   *       node id.
   * </ul>
   *
   * @return the expression, or "" when nothing contributes a condition
   */
  public String synthesize(SignalGraph graph) {
    if (graph.nodes().isEmpty()) {
      return "";
    }
    warnOnDanglingEdges(graph);

    if (graph.edges().isEmpty()) {
      logger.atFine().log("No edges, joining %d nodes as leaves", graph.nodes().size());
      List<String> leaves = new ArrayList<>();
      for (SignalNode node : graph.nodes()) {
        leafCondition(node).ifPresent(leaves::add);
      }
      return AND_JOINER.join(leaves);
    }

    ImmutableListMultimap<String, SignalEdge> incoming = graph.incomingEdges();
    ImmutableList<SignalNode> entryNodes = graph.entryNodes();
    if (entryNodes.isEmpty()) {
      SignalNode start = graph.nodes().stream().min(LEFTMOST_FIRST).get();
      logger.atFine().log("No entry node, expanding from %s", start.id());
      return synthesize(start.id(), graph, incoming, new HashSet<>());
    }

    Set<String> visited = new HashSet<>();
    List<String> parts = new ArrayList<>();
    for (SignalNode entry : entryNodes) {
      String part = synthesize(entry.id(), graph, incoming, visited);
      if (!part.isEmpty()) {
        parts.add(part);
      }
    }
    return AND_JOINER.join(parts);
  }

  /** Expression aggregated at one node, expanded with a fresh visited set. */
  public String synthesizeNode(SignalGraph graph, String nodeId) {
    return synthesize(nodeId, graph, graph.incomingEdges(), new HashSet<>());
  }

  private String synthesize(
      String nodeId,
      SignalGraph graph,
      ImmutableListMultimap<String, SignalEdge> incoming,
      Set<String> visited) {
    if (!visited.add(nodeId)) {
      return "";
    }

    Optional<SignalNode> node = graph.node(nodeId);
    if (node.isEmpty()) {
      return "";
    }

    ImmutableList<SignalEdge> edges = incoming.get(nodeId);
    if (edges.isEmpty()) {
      return leafCondition(node.get()).orElse("");
    }

    List<String> andBucket = new ArrayList<>();
    List<String> orBucket = new ArrayList<>();
    for (SignalEdge edge : edges) {
      String source = synthesize(edge.from(), graph, incoming, visited);
      if (source.isEmpty()) {
        continue;
      }
      if (edge.operator() == Operator.AND) {
        andBucket.add(source);
      } else {
        orBucket.add(source);
      }
    }
    return combine(andBucket, orBucket);
  }

  /**
   * Joins the buckets. With both present, a bucket holding more than one expression is
   * parenthesized before the two are joined with AND.
   */
  private static String combine(List<String> andBucket, List<String> orBucket) {
    String conjunction = AND_JOINER.join(andBucket);
    String disjunction = OR_JOINER.join(orBucket);
    if (orBucket.isEmpty()) {
      return conjunction;
    }
    if (andBucket.isEmpty()) {
      return disjunction;
    }
    return AND_JOINER.join(
        group(conjunction, andBucket.size()), group(disjunction, orBucket.size()));
  }

  private static String group(String joined, int size) {
    return size > 1 ? "(" + joined + ")" : joined;
  }

  private Optional<String> leafCondition(SignalNode node) {
    Optional<String> condition = catalog.firstCondition(node.indicatorId());
    if (condition.isEmpty()) {
      logger.atFine().log(
          "Indicator %s of node %s declares no condition", node.indicatorId(), node.id());
    }
    return condition;
  }

  private static void warnOnDanglingEdges(SignalGraph graph) {
    ImmutableSet<String> nodeIds = graph.nodeIds();
    for (SignalEdge edge : graph.edges()) {
      if (!nodeIds.contains(edge.from()) || !nodeIds.contains(edge.to())) {
        logger.atWarning().log("Edge %s references a node outside the graph", edge);
      }
    }
  }
}
