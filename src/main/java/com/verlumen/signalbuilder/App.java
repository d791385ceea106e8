package com.verlumen.signalbuilder;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.verlumen.signalbuilder.catalog.ConditionCatalog;
import com.verlumen.signalbuilder.catalog.IndicatorInstance;
import com.verlumen.signalbuilder.description.NaturalLanguageRenderer;
import com.verlumen.signalbuilder.description.StrategyExpressions;
import com.verlumen.signalbuilder.expression.ExpressionTemplates;
import com.verlumen.signalbuilder.graph.GraphExpressionSynthesizer;
import com.verlumen.signalbuilder.graph.SignalGraph;
import com.verlumen.signalbuilder.graph.SignalGraphLoader;
import com.verlumen.signalbuilder.rows.ConditionRow;
import com.verlumen.signalbuilder.rows.RowExpressionCompiler;
import com.verlumen.signalbuilder.validation.StrategyValidator;
import com.verlumen.signalbuilder.validation.ValidationIssue;
import java.util.List;
import java.util.Optional;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

/**
 * Command line front end. Compiles, describes or validates an expression against a set of
 * indicators bound to their catalog defaults, and prints the result.
 */
final class App {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final Splitter COMMA = Splitter.on(',').trimResults().omitEmptyStrings();
  static final String VALID = "Strategy is valid and ready to backtest";

  private final ConditionCatalog catalog;
  private final RowExpressionCompiler rowCompiler;
  private final GraphExpressionSynthesizer graphSynthesizer;
  private final NaturalLanguageRenderer renderer;
  private final StrategyValidator validator;
  private final ExpressionTemplates templates;

  @Inject
  App(
      ConditionCatalog catalog,
      RowExpressionCompiler rowCompiler,
      GraphExpressionSynthesizer graphSynthesizer,
      NaturalLanguageRenderer renderer,
      StrategyValidator validator,
      ExpressionTemplates templates) {
    this.catalog = catalog;
    this.rowCompiler = rowCompiler;
    this.graphSynthesizer = graphSynthesizer;
    this.renderer = renderer;
    this.validator = validator;
    this.templates = templates;
  }

  /** Runs the command named in the parsed arguments and returns the lines to print. */
  ImmutableList<String> execute(Namespace namespace) {
    ImmutableList<IndicatorInstance> selection = selection(namespace.getString("indicators"));
    String expression = namespace.getString("expression");
    String command = namespace.getString("command");
    logger.atInfo().log("Running %s with %d indicators", command, selection.size());

    switch (command) {
      case "rows":
        return rows(expression, selection);
      case "describe":
        return ImmutableList.of(
            renderer.describe(StrategyExpressions.single(expression), selection));
      case "validate":
        return validate(expression, selection);
      case "graph":
        SignalGraph graph = graph(Optional.ofNullable(namespace.getString("graph")), selection);
        return ImmutableList.of(graphSynthesizer.synthesize(graph));
      case "templates":
        return templates.available(selection, Optional.empty()).stream()
            .map(template -> template.getName() + ": " + template.getExpression())
            .collect(ImmutableList.toImmutableList());
      default:
        throw new IllegalArgumentException("Unknown command: " + command);
    }
  }

  private ImmutableList<String> rows(String expression, List<IndicatorInstance> selection) {
    ImmutableList<ConditionRow> rows = rowCompiler.toRows(expression, selection);
    ImmutableList.Builder<String> lines = ImmutableList.builder();
    for (ConditionRow row : rows) {
      lines.add(
          String.format(
              "%-4s %-10s %s",
              row.precedingOperator().map(Enum::name).orElse(""),
              row.indicatorId().orElse("-"),
              row.conditionName().orElse("-")));
    }
    return lines
        .add("Expression: " + rowCompiler.toExpression(rows))
        .add("Preview: " + rowCompiler.preview(rows))
        .build();
  }

  private ImmutableList<String> validate(String expression, List<IndicatorInstance> selection) {
    ImmutableList<ValidationIssue> issues =
        validator.validate(StrategyExpressions.single(expression), selection);
    if (issues.isEmpty()) {
      return ImmutableList.of(VALID);
    }
    return issues.stream()
        .map(
            issue ->
                String.format(
                    "%s: %s (%s)", issue.severity(), issue.message(), issue.suggestion()))
        .collect(ImmutableList.toImmutableList());
  }

  /** The graph file when one is given, otherwise one unconnected node per selected indicator. */
  private static SignalGraph graph(Optional<String> path, List<IndicatorInstance> selection) {
    return path.map(SignalGraphLoader::load)
        .orElseGet(() -> SignalGraph.empty().syncedWith(selection));
  }

  private ImmutableList<IndicatorInstance> selection(String indicators) {
    ImmutableList.Builder<IndicatorInstance> selection = ImmutableList.builder();
    for (String id : COMMA.split(indicators)) {
      if (catalog.containsIndicator(id)) {
        selection.add(catalog.newInstance(id));
      } else {
        logger.atFine().log("Skipping unknown indicator %s", id);
      }
    }
    return selection.build();
  }

  public static void main(String[] args) {
    logger.atInfo().log("Signal builder starting with %d arguments", args.length);
    ArgumentParser parser = createArgumentParser();
    Namespace namespace;
    try {
      namespace = parser.parseArgs(args);
    } catch (ArgumentParserException e) {
      parser.handleError(e);
      System.exit(1);
      return;
    }

    App app =
        Guice.createInjector(SignalBuilderModule.create(namespace.getString("catalog")))
            .getInstance(App.class);
    app.execute(namespace).forEach(System.out::println);
  }

  static ArgumentParser createArgumentParser() {
    ArgumentParser parser =
        ArgumentParsers.newFor("SignalBuilder")
            .build()
            .defaultHelp(true)
            .description("Compiles trading-signal conditions between graph, row and text forms");

    parser.addArgument("--catalog")
        .setDefault(SignalBuilderModule.DEFAULT_CATALOG)
        .help("Classpath resource holding the condition catalog");

    parser.addArgument("--indicators")
        .setDefault("")
        .help("Comma separated indicator ids, in selection order");

    parser.addArgument("--expression")
        .setDefault("")
        .help("Expression over the selected indicators' conditions");

    parser.addArgument("--graph")
        .help("JSON file holding a signal graph");

    parser.addArgument("--command")
        .choices("rows", "describe", "validate", "graph", "templates")
        .setDefault("describe")
        .help("What to do with the expression");

    return parser;
  }
}
