package com.verlumen.signalbuilder.catalog;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.flogger.FluentLogger;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import org.yaml.snakeyaml.Yaml;

/** Utility class for loading condition catalogs from JSON and YAML files or classpath resources. */
public final class ConditionCatalogLoader {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private static final Gson GSON =
      new GsonBuilder()
          .registerTypeAdapter(ParameterType.class, new ParameterTypeAdapter())
          .create();

  private ConditionCatalogLoader() {}

  /**
   * Loads a catalog from a file, auto-detecting format based on extension.
   *
   * @param path The path to the catalog file (.json or .yaml/.yml)
   * @return The loaded catalog
   */
  public static ConditionCatalog load(String path) {
    String content;
    try {
      content = Files.readString(Path.of(path), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new RuntimeException("Failed to load catalog from: " + path, e);
    }
    logger.atInfo().log("Loaded catalog file %s", path);
    return ConditionCatalog.fromConfig(parse(path, content));
  }

  /**
   * Loads a catalog from a classpath resource, auto-detecting format based on extension.
   *
   * @param resourcePath The classpath resource path (.json or .yaml/.yml)
   * @return The loaded catalog
   */
  public static ConditionCatalog loadResource(String resourcePath) {
    String normalizedPath = resourcePath.startsWith("/") ? resourcePath : "/" + resourcePath;
    String content;
    try (InputStream is = ConditionCatalogLoader.class.getResourceAsStream(normalizedPath)) {
      if (is == null) {
        throw new RuntimeException("Resource not found: " + resourcePath);
      }
      content = new String(is.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new RuntimeException("Failed to load catalog from resource: " + resourcePath, e);
    }
    logger.atInfo().log("Loaded catalog resource %s", normalizedPath);
    return ConditionCatalog.fromConfig(parse(resourcePath, content));
  }

  /** Parses a catalog configuration from a JSON string. */
  public static CatalogConfig parseJson(String jsonContent) {
    return GSON.fromJson(jsonContent, CatalogConfig.class);
  }

  /** Parses a catalog configuration from a YAML string. */
  public static CatalogConfig parseYaml(String yamlContent) {
    Map<String, Object> yamlMap = new Yaml().load(yamlContent);
    return GSON.fromJson(GSON.toJson(yamlMap), CatalogConfig.class);
  }

  private static CatalogConfig parse(String path, String content) {
    String lowerPath = path.toLowerCase(Locale.ROOT);
    CatalogConfig config;
    if (lowerPath.endsWith(".yaml") || lowerPath.endsWith(".yml")) {
      config = parseYaml(content);
    } else if (lowerPath.endsWith(".json")) {
      config = parseJson(content);
    } else {
      throw new IllegalArgumentException(
          "Unsupported file format. Use .json, .yaml, or .yml: " + path);
    }
    checkArgument(config != null, "Catalog is empty: %s", path);
    return config;
  }

  /** Reads parameter types case-insensitively, so catalogs may say "int" or "INT". */
  private static final class ParameterTypeAdapter implements JsonDeserializer<ParameterType> {

    @Override
    public ParameterType deserialize(
        JsonElement json, Type typeOfT, JsonDeserializationContext context)
        throws JsonParseException {
      try {
        return ParameterType.valueOf(json.getAsString().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new JsonParseException("Unknown parameter type: " + json, e);
      }
    }
  }
}
