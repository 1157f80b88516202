package com.gentoro.govdir;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import com.gentoro.govdir.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @TempDir Path tmp;

  @Test
  void loadsBundledDefaultsFromClasspath() {
    Configuration cfg = new ConfigurationProvider("classpath:application.yaml").config();

    assertEquals(3, cfg.getInt("crawler.retry.maxAttempts"));
    assertEquals(180_000L, cfg.getLong("crawler.pacing.backoff.initialPauseMs"));
    assertEquals("data", cfg.getString("crawler.store.directory"));
  }

  @Test
  void missingClasspathResourceGivesEmptyConfiguration() {
    Configuration cfg = new ConfigurationProvider("classpath:nope/missing.yaml").config();

    assertTrue(cfg.isEmpty());
  }

  @Test
  void loadsFileByPathAndByUri() throws Exception {
    Path file = tmp.resolve("local.yaml");
    Files.writeString(file, "crawler:\n  workers:\n    size: 3\n");

    Configuration byPath = new ConfigurationProvider(file.toString()).config();
    Configuration byUri = new ConfigurationProvider(file.toUri().toString()).config();

    assertEquals(3, byPath.getInt("crawler.workers.size"));
    assertEquals(3, byUri.getInt("crawler.workers.size"));
  }

  @Test
  void missingFileIsAConfigError() {
    assertThrows(
        ConfigException.class,
        () -> new ConfigurationProvider(tmp.resolve("absent.yaml").toString()));
  }

  @Test
  void envPlaceholdersFallBackToEnvFileNextToTheConfig() throws Exception {
    Path file = tmp.resolve("env.yaml");
    Files.writeString(
        file,
        "crawler:\n"
            + "  http:\n"
            + "    userAgent: ${env:GOVDIR_TEST_USER_AGENT}\n"
            + "  store:\n"
            + "    directory: ${env:GOVDIR_TEST_STORE_DIR}\n");
    Files.writeString(
        tmp.resolve(ConfigurationProvider.ENV_FILE),
        "# local overrides\n"
            + "GOVDIR_TEST_USER_AGENT=\"govdir-test/1.0 (ops)\"\n"
            + "GOVDIR_TEST_STORE_DIR = '/var/govdir'\n"
            + "not a pair\n");

    Configuration cfg = new ConfigurationProvider(file.toString()).config();

    assertEquals("govdir-test/1.0 (ops)", cfg.getString("crawler.http.userAgent"));
    assertEquals("/var/govdir", cfg.getString("crawler.store.directory"));
  }

  @Test
  void processEnvironmentWinsOverEnvFile() throws Exception {
    String path = System.getenv("PATH");
    assumeTrue(path != null && !path.isEmpty());
    Path file = tmp.resolve("path.yaml");
    Files.writeString(file, "search:\n  path: ${env:PATH}\n");
    Files.writeString(tmp.resolve(ConfigurationProvider.ENV_FILE), "PATH=from-file\n");

    Configuration cfg = new ConfigurationProvider(file.toString()).config();

    assertEquals(path, cfg.getString("search.path"));
  }
}
