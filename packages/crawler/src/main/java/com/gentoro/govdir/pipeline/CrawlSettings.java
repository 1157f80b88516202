package com.gentoro.govdir.pipeline;

import com.gentoro.govdir.exception.ConfigException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.apache.commons.configuration2.Configuration;

/** Run-level settings read from the {@code crawler.*} configuration keys. */
public record CrawlSettings(
    String faqSeedUrl,
    String agencyDirectorySeedUrl,
    String ministryListSeedUrl,
    String userAgent,
    long connectTimeoutSeconds,
    Path storeDirectory,
    Path outputDirectory,
    Set<String> outputFormats,
    int workers,
    int discrepancyTolerance,
    long progressMinIntervalMs,
    long progressMinDelta) {

  public static final String DEFAULT_FAQ_SEED = "https://ecitizen.go.ke/en/help-and-support";
  public static final String DEFAULT_AGENCIES_SEED = "https://ecitizen.go.ke/en/agencies";
  public static final String DEFAULT_MINISTRIES_SEED =
      "https://accounts.ecitizen.go.ke/en/home/national-ministries";
  public static final String DEFAULT_USER_AGENT =
      "govdir-crawler/0.1 (public service directory research)";

  private static final Set<String> KNOWN_FORMATS = Set.of("csv", "json");

  public CrawlSettings {
    outputFormats = Set.copyOf(outputFormats);
    for (String f : outputFormats) {
      if (!KNOWN_FORMATS.contains(f)) {
        throw new ConfigException("Unknown output format '" + f + "'; expected csv or json");
      }
    }
    if (discrepancyTolerance < 0) {
      throw new ConfigException("crawler.validation.discrepancyTolerance must be >= 0");
    }
  }

  public static CrawlSettings fromConfiguration(Configuration cfg) {
    return new CrawlSettings(
        cfg.getString("crawler.seeds.faq", DEFAULT_FAQ_SEED),
        cfg.getString("crawler.seeds.agencies", DEFAULT_AGENCIES_SEED),
        cfg.getString("crawler.seeds.ministries", DEFAULT_MINISTRIES_SEED),
        cfg.getString("crawler.http.userAgent", DEFAULT_USER_AGENT),
        cfg.getLong("crawler.http.connectTimeoutSeconds", 10L),
        Path.of(cfg.getString("crawler.store.directory", "data")),
        Path.of(cfg.getString("crawler.output.directory", "data/processed")),
        parseFormats(cfg.getList(String.class, "crawler.output.formats", List.of("csv", "json"))),
        cfg.getInt("crawler.workers.size", 0),
        cfg.getInt("crawler.validation.discrepancyTolerance", 0),
        cfg.getLong("crawler.progress.minIntervalMs", 1000L),
        cfg.getLong("crawler.progress.minDelta", 5L));
  }

  private static Set<String> parseFormats(List<String> raw) {
    Set<String> formats = new LinkedHashSet<>();
    for (String entry : raw) {
      Arrays.stream(entry.split(","))
          .map(s -> s.trim().toLowerCase(Locale.ROOT))
          .filter(s -> !s.isEmpty())
          .forEach(formats::add);
    }
    return formats;
  }
}
