package io.dbkit.config;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Locates and parses YAML configuration files.
 *
 * <p>Discovery walks upward from a start directory looking for {@code config/<name>}. The walk
 * is bounded by {@code maxDepth} levels and stops early at a directory containing the project
 * root marker ({@code README.md} by default). If nothing is found on the way, the directory
 * where the walk stopped gets one last look.
 *
 * <pre>{@code
 * ConfigResolver resolver = ConfigResolver.defaults();
 * Path file = resolver.findNearestConfig(Path.of("").toAbsolutePath(), "database.yaml");
 * ConnectionConfig config = resolver.connectionConfig(file);
 * }</pre>
 */
public final class ConfigResolver {
  private static final Logger logger = Logger.getLogger(ConfigResolver.class.getName());

  public static final String DEFAULT_ROOT_MARKER = "README.md";
  public static final int DEFAULT_MAX_DEPTH = 5;
  public static final String CONFIG_DIR = "config";
  public static final String DATABASE_SECTION = "database";
  public static final String LOGGING_SECTION = "logging";

  private final String rootMarker;
  private final int maxDepth;

  public ConfigResolver(String rootMarker, int maxDepth) {
    this.rootMarker = Objects.requireNonNull(rootMarker, "rootMarker");
    if (maxDepth <= 0) {
      throw new IllegalArgumentException("maxDepth must be > 0");
    }
    this.maxDepth = maxDepth;
  }

  public static ConfigResolver defaults() {
    return new ConfigResolver(DEFAULT_ROOT_MARKER, DEFAULT_MAX_DEPTH);
  }

  public String rootMarker() {
    return rootMarker;
  }

  public int maxDepth() {
    return maxDepth;
  }

  /**
   * Finds the nearest {@code config/<configName>} at or above {@code start}.
   *
   * @throws ConfigNotFoundException if no such file exists within the search bounds
   */
  public Path findNearestConfig(Path start, String configName) {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(configName, "configName");
    Path current = start.toAbsolutePath().normalize();
    for (int depth = 0; depth < maxDepth && current != null; depth++) {
      Path candidate = current.resolve(CONFIG_DIR).resolve(configName);
      if (Files.isRegularFile(candidate)) {
        return candidate;
      }
      if (Files.exists(current.resolve(rootMarker))) {
        break;
      }
      current = current.getParent();
    }
    if (current != null) {
      Path fallback = current.resolve(CONFIG_DIR).resolve(configName);
      if (Files.isRegularFile(fallback)) {
        return fallback;
      }
    }
    throw new ConfigNotFoundException(
        "No " + configName + " found in hierarchy starting from " + start);
  }

  /**
   * Returns the nearest directory at or above {@code start} that contains the root marker.
   *
   * @throws ConfigNotFoundException if none is found within {@code maxDepth} levels
   */
  public Path findProjectRoot(Path start) {
    Objects.requireNonNull(start, "start");
    Path current = start.toAbsolutePath().normalize();
    for (int depth = 0; depth < maxDepth && current != null; depth++) {
      if (Files.exists(current.resolve(rootMarker))) {
        return current;
      }
      current = current.getParent();
    }
    throw new ConfigNotFoundException(
        "No " + rootMarker + " found within " + maxDepth + " levels of " + start);
  }

  /**
   * Parses a YAML file into a mapping.
   *
   * @throws ConfigNotFoundException if the file is missing or unreadable
   * @throws ConfigParseException    if the YAML is malformed or its root is not a mapping
   */
  public Map<String, Object> load(Path file) {
    Objects.requireNonNull(file, "file");
    Object root;
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      root = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (NoSuchFileException e) {
      throw new ConfigNotFoundException("Config file not found: " + file, e);
    } catch (IOException e) {
      throw new ConfigNotFoundException("Config file could not be read: " + file, e);
    } catch (YAMLException e) {
      throw new ConfigParseException("Invalid YAML in config file " + file + ": " + e.getMessage(), e);
    }
    if (root == null) {
      return new LinkedHashMap<>();
    }
    if (!(root instanceof Map<?, ?> map)) {
      throw new ConfigParseException("Config file " + file + " must contain a mapping at the top level");
    }
    logger.fine(() -> "Loaded config file " + file);
    return stringKeys(map, file.toString());
  }

  /**
   * Loads {@code file} and validates its {@code database} section.
   */
  public ConnectionConfig connectionConfig(Path file) {
    return ConnectionConfigValidator.validate(databaseSection(file));
  }

  /**
   * Loads {@code file} and returns its {@code database} section unvalidated.
   */
  public Map<String, Object> databaseSection(Path file) {
    return section(load(file), DATABASE_SECTION, file);
  }

  /**
   * Loads {@code file} and reads its {@code logging} section.
   */
  public LoggingConfig loggingConfig(Path file) {
    return LoggingConfig.fromMap(section(load(file), LOGGING_SECTION, file));
  }

  private static Map<String, Object> section(Map<String, Object> root, String name, Path file) {
    Object section = root.get(name);
    if (section == null) {
      throw new ConfigParseException("Config file " + file + " has no '" + name + "' section");
    }
    if (!(section instanceof Map<?, ?> map)) {
      throw new ConfigParseException("Section '" + name + "' in " + file + " must be a mapping");
    }
    return stringKeys(map, name);
  }

  private static Map<String, Object> stringKeys(Map<?, ?> map, String where) {
    Map<String, Object> result = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : map.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new ConfigParseException("Non-string key '" + entry.getKey() + "' in " + where);
      }
      result.put(key, entry.getValue());
    }
    return result;
  }
}
