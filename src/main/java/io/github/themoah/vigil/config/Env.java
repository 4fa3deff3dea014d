package io.github.themoah.vigil.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Typed lookups over an environment map. Invalid values fall back to the default with a warning.
 */
final class Env {

  private static final Logger log = LoggerFactory.getLogger(Env.class);

  private final Map<String, String> source;

  Env(Map<String, String> source) {
    this.source = source;
  }

  static Env system() {
    return new Env(System.getenv());
  }

  String getString(String name, String defaultValue) {
    String value = source.get(name);
    return (value == null || value.isBlank()) ? defaultValue : value.trim();
  }

  boolean getBoolean(String name, boolean defaultValue) {
    String value = source.get(name);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  int getInt(String name, int defaultValue) {
    String value = source.get(name);
    if (value != null && !value.isBlank()) {
      try {
        return Integer.parseInt(value.trim());
      } catch (NumberFormatException e) {
        log.warn("Invalid integer for {}: '{}', using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }

  long getLong(String name, long defaultValue) {
    String value = source.get(name);
    if (value != null && !value.isBlank()) {
      try {
        return Long.parseLong(value.trim());
      } catch (NumberFormatException e) {
        log.warn("Invalid long for {}: '{}', using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }

  double getDouble(String name, double defaultValue) {
    String value = source.get(name);
    if (value != null && !value.isBlank()) {
      try {
        return Double.parseDouble(value.trim());
      } catch (NumberFormatException e) {
        log.warn("Invalid double for {}: '{}', using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }

  /**
   * Splits a comma-separated value, dropping blank entries.
   */
  List<String> getList(String name) {
    List<String> items = new ArrayList<>();
    String value = source.get(name);
    if (value == null || value.isBlank()) {
      return items;
    }
    for (String item : value.split(",")) {
      if (!item.isBlank()) {
        items.add(item.trim());
      }
    }
    return items;
  }
}
