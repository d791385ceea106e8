package com.verlumen.signalbuilder.description;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class BoundParametersTest {
  private final BoundParameters params =
      new BoundParameters(ImmutableMap.of("period", 14.0, "num_std", 2.5));

  @Test
  public void getDouble_presentKey_returnsValue() {
    assertThat(params.getDouble("period", 20)).isEqualTo(14.0);
  }

  @Test
  public void getDouble_withDefault_returnsDefault_whenMissing() {
    assertThat(params.getDouble("window", 20)).isEqualTo(20.0);
  }

  @Test
  public void format_wholeNumber_hasNoFraction() {
    assertThat(params.format("period", 20)).isEqualTo("14");
    assertThat(BoundParameters.format(2.0)).isEqualTo("2");
    assertThat(BoundParameters.format(-3.0)).isEqualTo("-3");
  }

  @Test
  public void format_fraction_isKept() {
    assertThat(params.format("num_std", 2.0)).isEqualTo("2.5");
    assertThat(BoundParameters.format(0.75)).isEqualTo("0.75");
  }

  @Test
  public void format_largeWholeNumber_printsExactDigits() {
    assertThat(BoundParameters.format(1e20)).isEqualTo("100000000000000000000");
    assertThat(BoundParameters.format(-1e19)).isEqualTo("-10000000000000000000");
  }

  @Test
  public void asMap_keepsBoundValues() {
    assertThat(params.asMap()).containsExactly("period", 14.0, "num_std", 2.5);
  }
}
