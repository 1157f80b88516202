package com.gentoro.govdir;

import com.gentoro.govdir.exception.ConfigException;
import com.gentoro.govdir.exception.SerializationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Loads the crawler's YAML configuration.
 *
 * <p>Locations: {@code classpath:<resource>}, a {@code file:} URI, or a filesystem path. A blank
 * location means {@code classpath:application.yaml}.
 *
 * <p>{@code ${env:NAME}} placeholders resolve against the process environment first, then against
 * a {@code .env.local} file of {@code NAME=value} lines. The file is looked up next to the
 * configuration file, then in the working directory.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.govdir.logging.LoggingService.getLogger(ConfigurationProvider.class);

  static final String ENV_FILE = ".env.local";
  private static final String CLASSPATH_PREFIX = "classpath:";

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    String loc = location == null || location.isBlank() ? "classpath:application.yaml" : location;
    loc = loc.trim();
    if (loc.startsWith(CLASSPATH_PREFIX)) {
      this.configuration = fromClasspath(loc.substring(CLASSPATH_PREFIX.length()));
    } else {
      this.configuration = fromFile(toPath(loc));
    }
  }

  public Configuration config() {
    return configuration;
  }

  private static Path toPath(String loc) {
    if (loc.regionMatches(true, 0, "file:", 0, 5)) {
      try {
        return Path.of(URI.create(loc));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Invalid configuration URI: " + loc, e);
      }
    }
    return Path.of(loc);
  }

  private static Configuration fromClasspath(String resource) {
    ClassLoader loader = Thread.currentThread().getContextClassLoader();
    try (InputStream input = loader.getResourceAsStream(resource)) {
      if (input == null) {
        log.warn("Configuration resource {} not found; using built-in defaults", resource);
        return withEnvLookup(new YAMLConfiguration(), envFileCandidates(null));
      }
      log.info("Loading configuration from classpath resource: {}", resource);
      return read(new InputStreamReader(input, StandardCharsets.UTF_8), null, resource);
    } catch (IOException e) {
      throw new SerializationException("Failed to read classpath resource: " + resource, e);
    }
  }

  private static Configuration fromFile(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new ConfigException("Configuration file not found: " + file.toAbsolutePath());
    }
    log.info("Loading configuration from file: {}", file.toAbsolutePath());
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return read(reader, file.toAbsolutePath().getParent(), file.toString());
    } catch (IOException e) {
      throw new ConfigException("Failed to read configuration file: " + file, e);
    }
  }

  private static Configuration read(Reader reader, Path configDir, String source) {
    YAMLConfiguration config = new YAMLConfiguration();
    try {
      config.read(reader);
    } catch (ConfigurationException e) {
      throw new ConfigException("Invalid YAML in " + source, e);
    }
    return withEnvLookup(config, envFileCandidates(configDir));
  }

  private static List<Path> envFileCandidates(Path configDir) {
    List<Path> candidates = new ArrayList<>();
    if (configDir != null) candidates.add(configDir.resolve(ENV_FILE));
    candidates.add(Path.of(ENV_FILE));
    return candidates;
  }

  private static Configuration withEnvLookup(YAMLConfiguration config, List<Path> envFiles) {
    config.getInterpolator().registerLookup("env", new EnvLookup(envFiles));
    return config;
  }

  /** Environment variables, falling back to the first {@code .env.local} that exists. */
  static final class EnvLookup implements Lookup {
    private final List<Path> candidates;
    private volatile Map<String, String> fileValues;

    EnvLookup(List<Path> candidates) {
      this.candidates = List.copyOf(candidates);
    }

    @Override
    public Object lookup(String name) {
      String value = System.getenv(name);
      if (value != null && !value.isEmpty()) return value;
      return fileValues().get(name);
    }

    private Map<String, String> fileValues() {
      Map<String, String> values = fileValues;
      if (values == null) {
        synchronized (this) {
          if (fileValues == null) {
            fileValues =
                candidates.stream()
                    .filter(Files::isRegularFile)
                    .findFirst()
                    .map(EnvLookup::parse)
                    .orElseGet(Map::of);
          }
          values = fileValues;
        }
      }
      return values;
    }

    static Map<String, String> parse(Path file) {
      log.info("Reading environment fallback file {}", file.toAbsolutePath());
      Map<String, String> values = new HashMap<>();
      try {
        for (String raw : Files.readAllLines(file, StandardCharsets.UTF_8)) {
          String line = raw.trim();
          int eq = line.indexOf('=');
          if (line.startsWith("#") || eq <= 0) continue;
          values.put(line.substring(0, eq).trim(), unquote(line.substring(eq + 1).trim()));
        }
      } catch (IOException e) {
        throw new ConfigException("Failed to read " + file, e);
      }
      return values;
    }

    private static String unquote(String value) {
      if (value.length() >= 2
          && (value.startsWith("\"") && value.endsWith("\"")
              || value.startsWith("'") && value.endsWith("'"))) {
        return value.substring(1, value.length() - 1);
      }
      return value;
    }
  }
}
