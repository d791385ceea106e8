package com.verlumen.signalbuilder.expression;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.testing.fieldbinder.Bind;
import com.google.inject.testing.fieldbinder.BoundFieldModule;
import com.verlumen.signalbuilder.catalog.ConditionCatalog;
import com.verlumen.signalbuilder.catalog.IndicatorInstance;
import com.verlumen.signalbuilder.catalog.TestCatalogs;
import java.util.Optional;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ConditionResolverTest {
  private static final IndicatorInstance FIRST = IndicatorInstance.create("First");
  private static final IndicatorInstance SECOND = IndicatorInstance.create("Second");
  private static final IndicatorInstance MIXED_CASE = IndicatorInstance.create("MixedCase");

  @Bind
  private ConditionCatalog catalog =
      TestCatalogs.withConditions(
          ImmutableMap.of(
              "First", ImmutableList.of("cross_up", "first_only"),
              "Second", ImmutableList.of("cross_up", "second_only"),
              "MixedCase", ImmutableList.of("Cross_Up")));

  @Inject private ConditionResolver resolver;

  @Before
  public void setUp() {
    Guice.createInjector(BoundFieldModule.of(this)).injectMembers(this);
  }

  @Test
  public void resolve_sharedName_attributesToFirstSelected() {
    assertThat(resolver.resolve("cross_up", ImmutableList.of(FIRST, SECOND)))
        .hasValue(ResolvedCondition.create("First", "cross_up"));
    assertThat(resolver.resolve("cross_up", ImmutableList.of(SECOND, FIRST)))
        .hasValue(ResolvedCondition.create("Second", "cross_up"));
  }

  @Test
  public void resolve_sharedName_isRepeatable() {
    ImmutableList<IndicatorInstance> selection = ImmutableList.of(FIRST, SECOND);

    for (int i = 0; i < 5; i++) {
      assertThat(resolver.resolve("cross_up", selection).get().indicatorId()).isEqualTo("First");
    }
  }

  @Test
  public void resolve_exactMatchLaterInSelection_beatsCaseInsensitiveMatch() {
    // Act
    Optional<ResolvedCondition> resolved =
        resolver.resolve("cross_up", ImmutableList.of(MIXED_CASE, SECOND));

    // Assert
    assertThat(resolved).hasValue(ResolvedCondition.create("Second", "cross_up"));
  }

  @Test
  public void resolve_caseInsensitiveMatch_returnsCatalogName() {
    // Act
    Optional<ResolvedCondition> resolved =
        resolver.resolve("CROSS_UP", ImmutableList.of(MIXED_CASE, SECOND));

    // Assert
    assertThat(resolved).hasValue(ResolvedCondition.create("MixedCase", "Cross_Up"));
  }

  @Test
  public void resolve_conditionOfUnselectedIndicator_isEmpty() {
    assertThat(resolver.resolve("second_only", ImmutableList.of(FIRST))).isEmpty();
  }

  @Test
  public void resolve_unknownOrEmptyTerm_isEmpty() {
    assertThat(resolver.resolve("nope", ImmutableList.of(FIRST, SECOND))).isEmpty();
    assertThat(resolver.resolve("", ImmutableList.of(FIRST))).isEmpty();
    assertThat(resolver.resolve(null, ImmutableList.of(FIRST))).isEmpty();
  }

  @Test
  public void resolveAll_skipsUnresolvedTerms() {
    // Act
    ImmutableList<ResolvedCondition> resolved =
        resolver.resolveAll(
            "first_only AND nope OR (second_only)", ImmutableList.of(FIRST, SECOND));

    // Assert
    assertThat(resolved)
        .containsExactly(
            ResolvedCondition.create("First", "first_only"),
            ResolvedCondition.create("Second", "second_only"))
        .inOrder();
  }

  @Test
  public void unresolvedTerms_returnsDistinctUnknownTerms() {
    String expression = "nope AND first_only OR nope AND other";

    assertThat(resolver.unresolvedTerms(expression, ImmutableList.of(FIRST)))
        .containsExactly("nope", "other")
        .inOrder();
  }

  @Test
  public void activeConditions_keepsConditionsOfOneIndicator() {
    // Arrange
    String expression = "cross_up AND second_only AND first_only";

    // Act
    ImmutableList<String> active =
        resolver.activeConditions(expression, ImmutableList.of(FIRST, SECOND), "First");

    // Assert
    assertThat(active).containsExactly("cross_up", "first_only").inOrder();
  }
}
