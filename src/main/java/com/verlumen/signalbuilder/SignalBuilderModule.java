package com.verlumen.signalbuilder;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.verlumen.signalbuilder.catalog.ConditionCatalog;
import com.verlumen.signalbuilder.catalog.ConditionCatalogLoader;

/** Binds the condition catalog every compiler service reads from. */
@AutoValue
public abstract class SignalBuilderModule extends AbstractModule {
  public static final String DEFAULT_CATALOG = "/indicator_catalog.yaml";

  public static SignalBuilderModule create(String catalogResource) {
    return new AutoValue_SignalBuilderModule(catalogResource);
  }

  public static SignalBuilderModule create() {
    return create(DEFAULT_CATALOG);
  }

  abstract String catalogResource();

  @Provides
  @Singleton
  ConditionCatalog provideConditionCatalog() {
    return ConditionCatalogLoader.loadResource(catalogResource());
  }
}
