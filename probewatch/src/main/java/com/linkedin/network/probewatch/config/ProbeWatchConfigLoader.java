/*
 * Copyright 2026 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.linkedin.network.probewatch.config;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.google.gson.stream.JsonReader;
import com.linkedin.probewatch.common.config.ConfigException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;


/**
 * Loads {@link ProbeWatchConfig} from a file. Two formats are accepted:
 * <ul>
 *   <li>JSON with one object per config section, e.g. <code>{"thresholds": {"latency_spike_ms": 300}}</code>. Each
 *   field of a section is mapped to the <code>section.field</code> config.</li>
 *   <li>Java properties with the flat config names, e.g. <code>thresholds.latency_spike_ms=300</code>.</li>
 * </ul>
 * Only present fields override their defaults. A missing or unreadable file, malformed content or an invalid value
 * results in the default configuration.
 */
public final class ProbeWatchConfigLoader {
  private static final Logger LOG = LoggerFactory.getLogger(ProbeWatchConfigLoader.class);
  private static final String PROPERTIES_SUFFIX = ".properties";
  private static final String KEY_SEPARATOR = ".";

  private ProbeWatchConfigLoader() {

  }

  /**
   * Load the configuration from the given file, falling back to defaults on any failure.
   *
   * @param configFile Path of the configuration file, or {@code null} to use the default configuration.
   * @return The loaded configuration.
   */
  public static ProbeWatchConfig load(String configFile) {
    if (configFile == null) {
      LOG.info("No configuration file given, using the default configuration.");
      return new ProbeWatchConfig(new HashMap<>(), true);
    }
    Path path = Path.of(configFile);
    if (!Files.isRegularFile(path)) {
      LOG.warn("Configuration file {} does not exist, using the default configuration.", configFile);
      return new ProbeWatchConfig(new HashMap<>(), true);
    }
    try {
      return new ProbeWatchConfig(readOverrides(path), true);
    } catch (IOException | JsonParseException | IllegalStateException e) {
      LOG.warn("Failed to read configuration file {}, using the default configuration.", configFile, e);
    } catch (ConfigException e) {
      LOG.warn("Invalid configuration in {}: {}. Using the default configuration.", configFile, e.getMessage());
    }
    return new ProbeWatchConfig(new HashMap<>(), true);
  }

  /**
   * Read the overrides in the given file as flat config names to values.
   *
   * @param path Path of a JSON or properties configuration file.
   * @return Flat config overrides.
   * @throws IOException If the file cannot be read.
   */
  static Map<String, Object> readOverrides(Path path) throws IOException {
    if (path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(PROPERTIES_SUFFIX)) {
      return readProperties(path);
    }
    try (JsonReader reader = new JsonReader(new InputStreamReader(Files.newInputStream(path), StandardCharsets.UTF_8))) {
      JsonElement root = JsonParser.parseReader(reader);
      if (!root.isJsonObject()) {
        throw new JsonParseException("Configuration root must be a JSON object.");
      }
      return flatten(root.getAsJsonObject());
    }
  }

  /**
   * Package private for testing. Flattens nested objects into <code>section.field</code> keys. {@code null} fields
   * are dropped so that they keep their defaults.
   *
   * @param root The JSON configuration.
   * @return Flat config overrides.
   * @throws JsonParseException If a field is an array.
   */
  static Map<String, Object> flatten(JsonObject root) {
    Map<String, Object> overrides = new HashMap<>();
    flatten("", root, overrides);
    return overrides;
  }

  private static void flatten(String prefix, JsonObject object, Map<String, Object> overrides) {
    for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
      String key = prefix + entry.getKey();
      JsonElement value = entry.getValue();
      if (value.isJsonObject()) {
        flatten(key + KEY_SEPARATOR, value.getAsJsonObject(), overrides);
      } else if (value.isJsonPrimitive()) {
        overrides.put(key, toValue(value.getAsJsonPrimitive()));
      } else if (!value.isJsonNull()) {
        throw new JsonParseException("Configuration " + key + " must be a string, a number or a boolean, but was " + value);
      }
    }
  }

  private static Object toValue(JsonPrimitive primitive) {
    if (primitive.isBoolean()) {
      return primitive.getAsBoolean();
    }
    if (primitive.isNumber()) {
      return primitive.getAsDouble();
    }
    return primitive.getAsString();
  }

  private static Map<String, Object> readProperties(Path path) throws IOException {
    Properties props = new Properties();
    try (InputStream propStream = Files.newInputStream(path)) {
      props.load(propStream);
    }
    Map<String, Object> overrides = new HashMap<>();
    props.stringPropertyNames().forEach(name -> overrides.put(name, props.getProperty(name).trim()));
    return overrides;
  }
}
