package com.gentoro.govdir.pipeline;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.govdir.exception.ConfigException;
import java.nio.file.Path;
import java.util.Set;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;

class CrawlSettingsTest {

  @Test
  void emptyConfigurationUsesDefaults() {
    CrawlSettings settings = CrawlSettings.fromConfiguration(new BaseConfiguration());

    assertEquals(CrawlSettings.DEFAULT_FAQ_SEED, settings.faqSeedUrl());
    assertEquals(Path.of("data"), settings.storeDirectory());
    assertEquals(Path.of("data/processed"), settings.outputDirectory());
    assertEquals(Set.of("csv", "json"), settings.outputFormats());
    assertEquals(0, settings.discrepancyTolerance());
  }

  @Test
  void formatListIsCommaSeparatedAndCaseInsensitive() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("crawler.output.formats", " JSON ");

    assertEquals(Set.of("json"), CrawlSettings.fromConfiguration(cfg).outputFormats());
  }

  @Test
  void unknownFormatIsRejected() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("crawler.output.formats", "parquet");

    assertThrows(ConfigException.class, () -> CrawlSettings.fromConfiguration(cfg));
  }

  @Test
  void negativeToleranceIsRejected() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("crawler.validation.discrepancyTolerance", -1);

    assertThrows(ConfigException.class, () -> CrawlSettings.fromConfiguration(cfg));
  }
}
