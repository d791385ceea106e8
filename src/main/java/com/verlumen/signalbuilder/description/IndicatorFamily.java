package com.verlumen.signalbuilder.description;

import java.util.Optional;

/**
 * Families of indicators that have hand-written phrasing for their conditions. A condition belongs
 * to the first family whose prefix it starts with; {@link #GENERIC} takes everything else.
 *
 * <p>Each family renders only the conditions it knows and substitutes its documented default for
 * every parameter the instance does not bind.
 */
public enum IndicatorFamily {
  RSI("rsi_") {
    @Override
    public Optional<String> render(String conditionName, BoundParameters params) {
      String period = params.format("period", 14);
      String oversold = params.format("oversold", 30);
      String overbought = params.format("overbought", 70);
      return Optional.ofNullable(
          switch (conditionName) {
            case "rsi_oversold" ->
                String.format("RSI(%s) is below %s (oversold)", period, oversold);
            case "rsi_overbought" ->
                String.format("RSI(%s) is above %s (overbought)", period, overbought);
            case "rsi_cross_above_oversold" ->
                String.format("RSI(%s) crosses above %s", period, oversold);
            case "rsi_cross_below_overbought" ->
                String.format("RSI(%s) crosses below %s", period, overbought);
            default -> null;
          });
    }
  },

  MACD("macd_") {
    @Override
    public Optional<String> render(String conditionName, BoundParameters params) {
      String macd =
          String.format(
              "MACD(%s,%s,%s)",
              params.format("fast", 12), params.format("slow", 26), params.format("signal", 9));
      return Optional.ofNullable(
          switch (conditionName) {
            case "macd_cross_up" -> macd + " crosses above signal line";
            case "macd_cross_down" -> macd + " crosses below signal line";
            case "macd_above_signal" -> macd + " is above signal line";
            case "macd_below_signal" -> macd + " is below signal line";
            case "macd_above_zero" -> macd + " is above zero";
            case "macd_below_zero" -> macd + " is below zero";
            default -> null;
          });
    }
  },

  SMA("sma_") {
    @Override
    public Optional<String> render(String conditionName, BoundParameters params) {
      String sma = "SMA(" + params.format("period", 20) + ")";
      return Optional.ofNullable(
          switch (conditionName) {
            case "sma_price_above" -> "Price is above " + sma;
            case "sma_price_below" -> "Price is below " + sma;
            case "sma_price_cross_above" -> "Price crosses above " + sma;
            case "sma_price_cross_below" -> "Price crosses below " + sma;
            default -> null;
          });
    }
  },

  EMA_PRICE("ema_price_") {
    @Override
    public Optional<String> render(String conditionName, BoundParameters params) {
      String ema = "EMA(" + params.format("period", 20) + ")";
      return Optional.ofNullable(
          switch (conditionName) {
            case "ema_price_above" -> "Price is above " + ema;
            case "ema_price_below" -> "Price is below " + ema;
            case "ema_price_cross_above" -> "Price crosses above " + ema;
            case "ema_price_cross_below" -> "Price crosses below " + ema;
            default -> null;
          });
    }
  },

  EMA_CROSS("ema_") {
    @Override
    public Optional<String> render(String conditionName, BoundParameters params) {
      String fast = "EMA(" + params.format("fast_period", 12) + ")";
      String slow = "EMA(" + params.format("slow_period", 26) + ")";
      return Optional.ofNullable(
          switch (conditionName) {
            case "ema_cross_up" -> fast + " crosses above " + slow;
            case "ema_cross_down" -> fast + " crosses below " + slow;
            case "ema_fast_gt_slow" -> fast + " is above " + slow;
            case "ema_slow_gt_fast" -> slow + " is above " + fast;
            default -> null;
          });
    }
  },

  BOLLINGER("bb_") {
    @Override
    public Optional<String> render(String conditionName, BoundParameters params) {
      String bands = params.format("window", 20) + ", " + params.format("num_std", 2.0);
      return Optional.ofNullable(
          switch (conditionName) {
            case "bb_price_above_upper" -> "Price is above upper Bollinger Band(" + bands + ")";
            case "bb_price_below_lower" -> "Price is below lower Bollinger Band(" + bands + ")";
            case "bb_price_touch_upper" -> "Price touches upper Bollinger Band(" + bands + ")";
            case "bb_price_touch_lower" -> "Price touches lower Bollinger Band(" + bands + ")";
            case "bb_price_squeeze" -> "Bollinger Bands(" + bands + ") squeeze (low volatility)";
            default -> null;
          });
    }
  },

  /** Conditions without hand-written phrasing; callers fall back to the catalog description. */
  GENERIC("") {
    @Override
    public Optional<String> render(String conditionName, BoundParameters params) {
      return Optional.empty();
    }
  };

  private final String prefix;

  IndicatorFamily(String prefix) {
    this.prefix = prefix;
  }

  public String getPrefix() {
    return prefix;
  }

  /** Phrasing for the condition, or empty when this family has none for it. */
  public abstract Optional<String> render(String conditionName, BoundParameters params);

  public static IndicatorFamily forCondition(String conditionName) {
    for (IndicatorFamily family : values()) {
      if (family != GENERIC && conditionName.startsWith(family.prefix)) {
        return family;
      }
    }
    return GENERIC;
  }
}
