package com.verlumen.signalbuilder.description;

/** Position the strategy takes when its long conditions stop holding. */
public enum StrategyType {
  /** Alternates between a long position and cash. */
  LONG_CASH,
  /** Alternates between a long and a short position. */
  LONG_SHORT
}
