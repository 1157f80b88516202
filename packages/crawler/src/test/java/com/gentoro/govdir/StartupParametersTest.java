package com.gentoro.govdir;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  void defaultsToCrawlWithBundledConfiguration() {
    StartupParameters params = new StartupParameters(new String[0]);

    assertEquals(StartupParameters.MODE_CRAWL, params.mode());
    assertEquals("classpath:application.yaml", params.configFile());
    assertFalse(params.isOffline());
  }

  @Test
  void parsesNamedArguments() {
    StartupParameters params =
        new StartupParameters(
            new String[] {"--config-file", "/etc/govdir.yaml", "--mode", "offline", "stray"});

    assertEquals("/etc/govdir.yaml", params.configFile());
    assertTrue(params.isOffline());
    assertTrue(params.isParameterPresent("mode"));
    assertFalse(params.isParameterPresent("stray"));
  }

  @Test
  void rejectsUnknownMode() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--mode", "turbo"}));
  }

  @Test
  void flagWithoutValueIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--mode", "--config-file", "x.yaml"}));
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--config-file"}));
  }
}
