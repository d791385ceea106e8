package com.verlumen.signalbuilder.rows;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.testing.fieldbinder.Bind;
import com.google.inject.testing.fieldbinder.BoundFieldModule;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import com.verlumen.signalbuilder.catalog.ConditionCatalog;
import com.verlumen.signalbuilder.catalog.IndicatorInstance;
import com.verlumen.signalbuilder.catalog.TestCatalogs;
import com.verlumen.signalbuilder.expression.ConditionResolver;
import com.verlumen.signalbuilder.expression.ExpressionTokenizer;
import com.verlumen.signalbuilder.expression.Operator;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class RowExpressionCompilerTest {
  private static final ImmutableList<IndicatorInstance> SELECTION =
      ImmutableList.of(
          IndicatorInstance.create("RSI"),
          IndicatorInstance.create("MACD"),
          IndicatorInstance.create("EMA_Cross"),
          IndicatorInstance.create("Bollinger"));

  /** Row lists made only of resolvable, distinct conditions. */
  enum ResolvableRows {
    SINGLE(ConditionRow.create("RSI", "rsi_oversold", null)),
    TWO_WITH_AND(
        ConditionRow.create("RSI", "rsi_oversold", null),
        ConditionRow.create("MACD", "macd_cross_up", Operator.AND)),
    TWO_WITH_OR(
        ConditionRow.create("EMA_Cross", "ema_cross_up", null),
        ConditionRow.create("Bollinger", "bb_price_squeeze", Operator.OR)),
    MIXED_FOUR(
        ConditionRow.create("MACD", "macd_above_zero", null),
        ConditionRow.create("RSI", "rsi_overbought", Operator.OR),
        ConditionRow.create("Bollinger", "bb_price_touch_lower", Operator.AND),
        ConditionRow.create("EMA_Cross", "ema_slow_gt_fast", Operator.OR)),
    SAME_INDICATOR_TWICE(
        ConditionRow.create("RSI", "rsi_oversold", null),
        ConditionRow.create("RSI", "rsi_cross_above_oversold", Operator.AND));

    private final ImmutableList<ConditionRow> rows;

    ResolvableRows(ConditionRow... rows) {
      this.rows = ImmutableList.copyOf(rows);
    }
  }

  @Bind private ConditionCatalog catalog = TestCatalogs.builtIn();

  @Inject private RowExpressionCompiler compiler;

  @Before
  public void setUp() {
    Guice.createInjector(BoundFieldModule.of(this)).injectMembers(this);
  }

  @Test
  public void rowsToExpressionToRows_reproducesRows(@TestParameter ResolvableRows testCase) {
    // Act
    String expression = compiler.toExpression(testCase.rows);
    ImmutableList<ConditionRow> reconstructed = compiler.toRows(expression, SELECTION);

    // Assert
    assertThat(reconstructed).containsExactlyElementsIn(testCase.rows).inOrder();
  }

  @Test
  public void roundTrip_rsiAndMacd_reconstructsRowsAndExpression() {
    // Arrange
    String expression = "rsi_oversold AND macd_cross_up";
    ImmutableList<IndicatorInstance> selection =
        ImmutableList.of(IndicatorInstance.create("RSI"), IndicatorInstance.create("MACD"));

    // Act
    ImmutableList<ConditionRow> rows = compiler.toRows(expression, selection);

    // Assert
    assertThat(rows)
        .containsExactly(
            ConditionRow.create("RSI", "rsi_oversold", null),
            ConditionRow.create("MACD", "macd_cross_up", Operator.AND))
        .inOrder();
    assertThat(compiler.toExpression(rows)).isEqualTo(expression);
  }

  @Test
  public void toExpression_skipsRowsWithoutCondition() {
    // Arrange
    ImmutableList<ConditionRow> rows =
        ImmutableList.of(
            ConditionRow.create("RSI", null, null),
            ConditionRow.create("MACD", "macd_cross_up", Operator.OR),
            ConditionRow.create("RSI", "", Operator.AND),
            ConditionRow.create("RSI", "rsi_oversold", Operator.OR));

    // Act
    String expression = compiler.toExpression(rows);

    // Assert
    assertThat(expression).isEqualTo("macd_cross_up OR rsi_oversold");
  }

  @Test
  public void toExpression_laterRowWithoutOperator_usesAnd() {
    // Arrange
    ImmutableList<ConditionRow> rows =
        ImmutableList.of(
            ConditionRow.create("RSI", "rsi_oversold", null),
            ConditionRow.create("MACD", "macd_cross_up", null));

    // Act & Assert
    assertThat(compiler.toExpression(rows)).isEqualTo("rsi_oversold AND macd_cross_up");
  }

  @Test
  public void toExpression_noConditions_returnsEmptyString() {
    assertThat(compiler.toExpression(ImmutableList.of())).isEmpty();
    assertThat(compiler.toExpression(ImmutableList.of(ConditionRow.empty()))).isEmpty();
  }

  @Test
  public void toRows_blankExpression_returnsNoRows() {
    assertThat(compiler.toRows("", SELECTION)).isEmpty();
    assertThat(compiler.toRows("  ", SELECTION)).isEmpty();
    assertThat(compiler.toRows(null, SELECTION)).isEmpty();
  }

  @Test
  public void toRows_nothingResolves_returnsSingleEmptyRow() {
    assertThat(compiler.toRows("nope AND missing", SELECTION))
        .containsExactly(ConditionRow.empty());
  }

  @Test
  public void toRows_leadingUnresolvedTerm_firstResolvedRowHasNoOperator() {
    // Act
    ImmutableList<ConditionRow> rows =
        compiler.toRows("nope AND rsi_oversold OR macd_cross_up", SELECTION);

    // Assert
    assertThat(rows)
        .containsExactly(
            ConditionRow.create("RSI", "rsi_oversold", null),
            ConditionRow.create("MACD", "macd_cross_up", Operator.OR))
        .inOrder();
  }

  @Test
  public void toRows_droppedTermInMiddle_keepsOperatorClosestToNextRow() {
    // Act
    ImmutableList<ConditionRow> rows =
        compiler.toRows("rsi_oversold AND nope OR macd_cross_up", SELECTION);

    // Assert
    assertThat(rows.get(1)).isEqualTo(ConditionRow.create("MACD", "macd_cross_up", Operator.OR));
  }

  @Test
  public void toRows_parenthesizedExpression_isFlattened() {
    // Act
    ImmutableList<ConditionRow> rows =
        compiler.toRows("(rsi_oversold AND macd_cross_up) OR ema_cross_up", SELECTION);

    // Assert
    assertThat(rows)
        .containsExactly(
            ConditionRow.create("RSI", "rsi_oversold", null),
            ConditionRow.create("MACD", "macd_cross_up", Operator.AND),
            ConditionRow.create("EMA_Cross", "ema_cross_up", Operator.OR))
        .inOrder();
  }

  @Test
  public void toRows_caseInsensitiveTerm_usesCatalogName() {
    assertThat(compiler.toRows("RSI_OVERSOLD", SELECTION))
        .containsExactly(ConditionRow.create("RSI", "rsi_oversold", null));
  }

  @Test
  public void preview_usesCatalogDescriptionsAndLowerCaseConnectives() {
    // Arrange
    ImmutableList<ConditionRow> rows =
        ImmutableList.of(
            ConditionRow.create("RSI", "rsi_oversold", null),
            ConditionRow.create("MACD", "macd_cross_up", Operator.OR));

    // Act
    String preview = compiler.preview(rows);

    // Assert
    assertThat(preview)
        .isEqualTo("RSI < oversold threshold or MACD line crosses above signal line");
  }

  @Test
  public void preview_unknownCondition_fallsBackToCapitalizedName() {
    // Arrange
    ImmutableList<ConditionRow> rows =
        ImmutableList.of(ConditionRow.create(null, "custom_signal", null));

    // Act & Assert
    assertThat(compiler.preview(rows)).isEqualTo("Custom_signal");
  }

  @Test
  public void preview_noConditions_saysSo() {
    assertThat(compiler.preview(ImmutableList.of(ConditionRow.create("RSI", null, null))))
        .isEqualTo(RowExpressionCompiler.NO_CONDITIONS);
  }

  @Test
  public void preview_blankDescription_fallsBackToConditionName() {
    // Arrange
    ConditionCatalog volume =
        TestCatalogs.withDescriptions("VOL", ImmutableMap.of("vol_spike", "", "vol_dry", " "));
    ExpressionTokenizer tokenizer = new ExpressionTokenizer();
    RowExpressionCompiler volumeCompiler =
        new RowExpressionCompiler(volume, tokenizer, new ConditionResolver(volume, tokenizer));
    ImmutableList<ConditionRow> rows =
        ImmutableList.of(
            ConditionRow.create("VOL", "vol_spike", null),
            ConditionRow.create("VOL", "vol_dry", Operator.OR));

    // Act & Assert
    assertThat(volumeCompiler.preview(rows)).isEqualTo("Vol_spike or vol_dry");
  }
}
