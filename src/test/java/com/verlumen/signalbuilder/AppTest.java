package com.verlumen.signalbuilder;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.inject.Guice;
import com.google.inject.Inject;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AppTest {
  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();

  @Inject private App app;

  @Before
  public void setUp() {
    Guice.createInjector(SignalBuilderModule.create()).injectMembers(this);
  }

  @Test
  public void execute_defaultCommand_describesExpression() throws Exception {
    // Act
    ImmutableList<String> lines =
        execute("--indicators", "RSI,MACD", "--expression", "rsi_oversold AND macd_cross_up");

    // Assert
    assertThat(lines)
        .containsExactly(
            "Strategy goes long when rsi(14) is below 30 (oversold) and macd(12,26,9) crosses"
                + " above signal line");
  }

  @Test
  public void execute_rows_printsRowsExpressionAndPreview() throws Exception {
    // Act
    ImmutableList<String> lines =
        execute(
            "--command", "rows",
            "--indicators", "RSI, MACD",
            "--expression", "rsi_oversold AND macd_cross_up");

    // Assert
    assertThat(lines).hasSize(4);
    assertThat(lines.get(0)).endsWith("RSI        rsi_oversold");
    assertThat(lines.get(1)).startsWith("AND  MACD");
    assertThat(lines.get(2)).isEqualTo("Expression: rsi_oversold AND macd_cross_up");
    assertThat(lines.get(3))
        .isEqualTo("Preview: RSI < oversold threshold and MACD line crosses above signal line");
  }

  @Test
  public void execute_validate_listsIssues() throws Exception {
    // Act
    ImmutableList<String> lines =
        execute("--command", "validate", "--indicators", "RSI", "--expression", "rsi_oversold");

    // Assert
    assertThat(lines).hasSize(1);
    assertThat(lines.get(0)).startsWith("SUGGESTION: Single indicator strategy (");
  }

  @Test
  public void execute_validate_soundStrategy_saysValid() throws Exception {
    assertThat(
            execute(
                "--command", "validate",
                "--indicators", "RSI,MACD",
                "--expression", "rsi_oversold OR macd_cross_up"))
        .containsExactly(App.VALID);
  }

  @Test
  public void execute_graphWithoutFile_joinsFirstConditions() throws Exception {
    assertThat(execute("--command", "graph", "--indicators", "RSI,EMA_Cross"))
        .containsExactly("rsi_oversold AND ema_fast_gt_slow");
  }

  @Test
  public void execute_graphFile_synthesizesGraph() throws Exception {
    // Arrange
    File file = temporaryFolder.newFile("graph.json");
    Files.writeString(
        file.toPath(),
        "{\"nodes\": [{\"id\": \"a\", \"indicatorId\": \"MACD\"},"
            + " {\"id\": \"b\", \"indicatorId\": \"SMA\"}], \"edges\": []}",
        StandardCharsets.UTF_8);

    // Act
    ImmutableList<String> lines = execute("--command", "graph", "--graph", file.getPath());

    // Assert
    assertThat(lines).containsExactly("macd_cross_up AND sma_price_above");
  }

  @Test
  public void execute_templates_listsSatisfiableTemplates() throws Exception {
    assertThat(execute("--command", "templates", "--indicators", "RSI,MACD"))
        .containsExactly(
            "RSI Oversold: rsi_oversold",
            "RSI Oversold + MACD Cross: rsi_oversold AND macd_cross_up",
            "MACD Cross Up: macd_cross_up")
        .inOrder();
  }

  @Test
  public void execute_unknownIndicator_isSkipped() throws Exception {
    assertThat(execute("--command", "graph", "--indicators", "Nope,SMA"))
        .containsExactly("sma_price_above");
  }

  @Test
  public void parseArgs_unknownCommand_throwsArgumentParserException() {
    assertThrows(
        ArgumentParserException.class,
        () -> App.createArgumentParser().parseArgs(new String[] {"--command", "run"}));
  }

  private ImmutableList<String> execute(String... args) throws ArgumentParserException {
    return app.execute(App.createArgumentParser().parseArgs(args));
  }
}
