package com.resumebuilder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Classpath resource loading and the shared JSON mapper.
 */
public final class Resources {
  private static final Logger LOGGER = LoggerFactory.getLogger(Resources.class);

  public static final ObjectMapper MAPPER = new ObjectMapper(createJsonFactory())
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private Resources() {
  }

  /**
   * @return A JsonFactory that tolerates hand-written configuration and request bodies.
   */
  private static JsonFactory createJsonFactory() {
    JsonFactoryBuilder builder = new JsonFactoryBuilder();

    builder.enable(JsonReadFeature.ALLOW_MISSING_VALUES);
    builder.enable(JsonReadFeature.ALLOW_TRAILING_COMMA);
    builder.enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES);
    builder.enable(JsonReadFeature.ALLOW_SINGLE_QUOTES);
    builder.enable(JsonReadFeature.ALLOW_JAVA_COMMENTS);

    return builder.build();
  }

  public static String loadString(String path) {
    URL url = Resources.class.getResource(path);
    if (url == null) {
      throw new IllegalStateException("Missing classpath resource " + path);
    }
    try {
      String ret = IOUtils.toString(url, StandardCharsets.UTF_8);
      LOGGER.info("Loaded resource file '{}' with {} chars", path, ret.length());
      return ret;
    } catch (IOException e) {
      LOGGER.error("FATAL - Unable to load resource file '{}'", path, e);
      throw new UncheckedIOException(e);
    }
  }

  public static <T> T loadJson(String path, Class<T> type) {
    String json = loadString(path);
    try {
      return MAPPER.readValue(json, type);
    } catch (IOException e) {
      LOGGER.error("FATAL - Resource file '{}' is not valid {}", path, type.getSimpleName(), e);
      throw new UncheckedIOException(e);
    }
  }
}
