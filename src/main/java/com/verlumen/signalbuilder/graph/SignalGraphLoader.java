package com.verlumen.signalbuilder.graph;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.verlumen.signalbuilder.expression.Operator;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads signal graphs from JSON documents of the form
 *
 * <pre>{@code
 * {"nodes": [{"id": "n1", "indicatorId": "RSI", "x": 100}],
 *  "edges": [{"from": "n1", "to": "n2", "type": "AND"}]}
 * }</pre>
 *
 * <p>{@code x} is optional. Edge types are read in any letter case.
 */
public final class SignalGraphLoader {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private SignalGraphLoader() {}

  public static SignalGraph load(String path) {
    String content;
    try {
      content = Files.readString(Path.of(path), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new RuntimeException("Failed to load graph from: " + path, e);
    }
    SignalGraph graph = parseJson(content);
    logger.atInfo().log(
        "Loaded graph %s with %d nodes and %d edges",
        path, graph.nodes().size(), graph.edges().size());
    return graph;
  }

  /**
   * Parses a graph document.
   *
   * @throws JsonParseException if the document is malformed, a required field is missing or an
   *     edge type is neither AND nor OR
   */
  public static SignalGraph parseJson(String json) {
    JsonElement root = JsonParser.parseString(json);
    if (!root.isJsonObject()) {
      throw new JsonParseException("Graph document must be a JSON object");
    }
    JsonObject document = root.getAsJsonObject();

    ImmutableList.Builder<SignalNode> nodes = ImmutableList.builder();
    for (JsonElement element : array(document, "nodes")) {
      JsonObject node = element.getAsJsonObject();
      double x = node.has("x") ? node.get("x").getAsDouble() : 0;
      nodes.add(SignalNode.create(string(node, "id"), string(node, "indicatorId"), x));
    }

    ImmutableList.Builder<SignalEdge> edges = ImmutableList.builder();
    for (JsonElement element : array(document, "edges")) {
      JsonObject edge = element.getAsJsonObject();
      String type = string(edge, "type");
      Operator operator =
          Operator.fromKeyword(type)
              .orElseThrow(() -> new JsonParseException("Unknown edge type: " + type));
      edges.add(SignalEdge.create(string(edge, "from"), string(edge, "to"), operator));
    }
    return SignalGraph.create(nodes.build(), edges.build());
  }

  private static JsonArray array(JsonObject object, String field) {
    return object.has(field) ? object.getAsJsonArray(field) : new JsonArray();
  }

  private static String string(JsonObject object, String field) {
    JsonElement value = object.get(field);
    if (value == null || value.isJsonNull()) {
      throw new JsonParseException("Missing field '" + field + "' in " + object);
    }
    return value.getAsString();
  }
}
