package com.verlumen.signalbuilder.catalog;

/** Numeric kind of an indicator parameter. */
public enum ParameterType {
  INT,
  FLOAT
}
