package com.verlumen.signalbuilder.graph;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.gson.JsonParseException;
import com.verlumen.signalbuilder.expression.Operator;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class SignalGraphLoaderTest {
  private static final String GRAPH_JSON =
      "{\"nodes\": ["
          + "{\"id\": \"n1\", \"indicatorId\": \"RSI\", \"x\": 100},"
          + "{\"id\": \"n2\", \"indicatorId\": \"MACD\", \"x\": 350.5},"
          + "{\"id\": \"n3\", \"indicatorId\": \"SMA\"}],"
          + " \"edges\": ["
          + "{\"from\": \"n1\", \"to\": \"n3\", \"type\": \"AND\"},"
          + "{\"from\": \"n2\", \"to\": \"n3\", \"type\": \"or\"}]}";

  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();

  @Test
  public void parseJson_readsNodesAndEdges() {
    // Act
    SignalGraph graph = SignalGraphLoader.parseJson(GRAPH_JSON);

    // Assert
    assertThat(graph.nodes())
        .containsExactly(
            SignalNode.create("n1", "RSI", 100),
            SignalNode.create("n2", "MACD", 350.5),
            SignalNode.create("n3", "SMA", 0))
        .inOrder();
    assertThat(graph.edges())
        .containsExactly(
            SignalEdge.create("n1", "n3", Operator.AND),
            SignalEdge.create("n2", "n3", Operator.OR))
        .inOrder();
  }

  @Test
  public void parseJson_missingSections_returnsEmptyGraph() {
    assertThat(SignalGraphLoader.parseJson("{}")).isEqualTo(SignalGraph.empty());
  }

  @Test
  public void parseJson_unknownEdgeType_throwsJsonParseException() {
    // Arrange
    String json =
        "{\"nodes\": [{\"id\": \"a\", \"indicatorId\": \"RSI\"}],"
            + " \"edges\": [{\"from\": \"a\", \"to\": \"a\", \"type\": \"XOR\"}]}";

    // Act
    JsonParseException thrown =
        assertThrows(JsonParseException.class, () -> SignalGraphLoader.parseJson(json));

    // Assert
    assertThat(thrown).hasMessageThat().contains("XOR");
  }

  @Test
  public void parseJson_nodeWithoutIndicator_throwsJsonParseException() {
    assertThrows(
        JsonParseException.class,
        () -> SignalGraphLoader.parseJson("{\"nodes\": [{\"id\": \"a\"}]}"));
  }

  @Test
  public void parseJson_notAnObject_throwsJsonParseException() {
    assertThrows(JsonParseException.class, () -> SignalGraphLoader.parseJson("[]"));
  }

  @Test
  public void load_readsFile() throws Exception {
    // Arrange
    File file = temporaryFolder.newFile("graph.json");
    Files.writeString(file.toPath(), GRAPH_JSON, StandardCharsets.UTF_8);

    // Act
    SignalGraph graph = SignalGraphLoader.load(file.getPath());

    // Assert
    assertThat(graph.nodeIds()).containsExactly("n1", "n2", "n3").inOrder();
  }

  @Test
  public void load_missingFile_throwsRuntimeException() {
    String path = new File(temporaryFolder.getRoot(), "absent.json").getPath();

    assertThrows(RuntimeException.class, () -> SignalGraphLoader.load(path));
  }
}
