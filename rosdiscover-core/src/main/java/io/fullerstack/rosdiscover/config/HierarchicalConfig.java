package io.fullerstack.rosdiscover.config;

import java.util.*;

/**
 * Layered interpreter configuration backed by {@link ResourceBundle}.
 *
 * <p>Lookup order for a key:
 * <ol>
 *   <li>System property with the same name</li>
 *   <li>rosdiscover_{profile}.properties (when a profile is selected)</li>
 *   <li>rosdiscover.properties (global defaults)</li>
 * </ol>
 *
 * <p>Profiles ride on the {@link Locale} fallback of {@code ResourceBundle}: the profile
 * name is used as a language tag, so {@code forProfile("turtlebot")} reads
 * {@code rosdiscover_turtlebot.properties} and falls back to {@code rosdiscover.properties}.
 *
 * <p><strong>Example:</strong>
 * <pre>
 * # rosdiscover.properties
 * interpreter.missing-model-policy=placeholder
 * shell.timeout-ms=30000
 *
 * # rosdiscover_strict.properties
 * interpreter.missing-model-policy=fail
 * </pre>
 * <pre>
 * HierarchicalConfig config = HierarchicalConfig.forProfile("strict");
 * MissingModelPolicy policy = config.getEnum("interpreter.missing-model-policy", MissingModelPolicy.class);
 * </pre>
 */
public class HierarchicalConfig {

  static final String BUNDLE_NAME = "rosdiscover";

  private final ResourceBundle bundle;
  private final String context;

  private HierarchicalConfig(ResourceBundle bundle, String context) {
    this.bundle = bundle;
    this.context = context;
  }

  /**
   * Global configuration (rosdiscover.properties).
   */
  public static HierarchicalConfig global() {
    ResourceBundle bundle = ResourceBundle.getBundle(BUNDLE_NAME, Locale.ROOT);
    return new HierarchicalConfig(bundle, "global");
  }

  /**
   * Profile-specific configuration, falling back to the global defaults.
   *
   * @param profile profile name (e.g., "strict", "turtlebot")
   * @return configuration for the profile
   */
  public static HierarchicalConfig forProfile(String profile) {
    Objects.requireNonNull(profile, "profile cannot be null");
    if (profile.isBlank()) {
      throw new IllegalArgumentException("profile cannot be blank");
    }

    Locale profileLocale = Locale.forLanguageTag(profile);
    ResourceBundle bundle = ResourceBundle.getBundle(BUNDLE_NAME, profileLocale);
    return new HierarchicalConfig(bundle, "profile:" + profile);
  }

  /**
   * Get string value.
   *
   * @param key property key
   * @return property value
   * @throws ConfigurationException if the key is not defined at any level
   */
  public String getString(String key) {
    String sysProp = System.getProperty(key);
    if (sysProp != null) {
      return sysProp;
    }

    try {
      return bundle.getString(key);
    } catch (MissingResourceException e) {
      throw new ConfigurationException(
        "Missing config key '" + key + "' in context: " + context, e
      );
    }
  }

  /**
   * Get string value with default.
   */
  public String getString(String key, String defaultValue) {
    String sysProp = System.getProperty(key);
    if (sysProp != null) {
      return sysProp;
    }

    try {
      return bundle.getString(key);
    } catch (MissingResourceException e) {
      return defaultValue;
    }
  }

  /**
   * Get long value.
   *
   * @throws ConfigurationException if the key is missing or not a number
   */
  public long getLong(String key) {
    String value = getString(key);
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException(
        "Invalid long value for key '" + key + "': " + value, e
      );
    }
  }

  public long getLong(String key, long defaultValue) {
    String value = getString(key, null);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      return defaultValue;
    }
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    String value = getString(key, null);
    if (value == null) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  /**
   * Get an enum constant. Values are matched case-insensitively, with '-' standing in for '_'.
   *
   * @throws ConfigurationException if the key is missing or names no constant of {@code type}
   */
  public <E extends Enum<E>> E getEnum(String key, Class<E> type) {
    String value = getString(key);
    String constant = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    try {
      return Enum.valueOf(type, constant);
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException(
        "Invalid " + type.getSimpleName() + " value for key '" + key + "': " + value, e
      );
    }
  }

  public <E extends Enum<E>> E getEnum(String key, Class<E> type, E defaultValue) {
    if (!contains(key)) {
      return defaultValue;
    }
    return getEnum(key, type);
  }

  public boolean contains(String key) {
    if (System.getProperty(key) != null) {
      return true;
    }
    return bundle.containsKey(key);
  }

  /**
   * @return context description (e.g., "global", "profile:strict")
   */
  public String context() {
    return context;
  }

  @Override
  public String toString() {
    return "HierarchicalConfig[context=" + context + "]";
  }
}
