package com.gentoro.govdir;

import com.gentoro.govdir.exception.StateException;
import com.gentoro.govdir.extract.FieldExtractors;
import com.gentoro.govdir.fetch.FetchGovernor;
import com.gentoro.govdir.fetch.HttpPageFetcher;
import com.gentoro.govdir.fetch.PacingPolicy;
import com.gentoro.govdir.fetch.RetryPolicy;
import com.gentoro.govdir.fetch.Sleeper;
import com.gentoro.govdir.http.OkHttpFactory;
import com.gentoro.govdir.output.DatasetWriters;
import com.gentoro.govdir.output.RunReportWriter;
import com.gentoro.govdir.pipeline.CrawlRunner;
import com.gentoro.govdir.pipeline.CrawlSettings;
import com.gentoro.govdir.pipeline.RunReport;
import com.gentoro.govdir.progress.LoggingProgressSink;
import com.gentoro.govdir.store.FileSystemArtifactStore;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.apache.commons.configuration2.Configuration;

/**
 * Application context: loads configuration, wires the crawl components for the selected mode and
 * runs them once.
 */
public class GovDir {

  private static final org.slf4j.Logger log =
      com.gentoro.govdir.logging.LoggingService.getLogger(GovDir.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private CrawlSettings settings;
  private FileSystemArtifactStore store;
  private FetchGovernor governor;
  private CrawlRunner runner;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

  public GovDir(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    // Route everything through SLF4J; OkHttp uses java.util.logging internally.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    com.gentoro.govdir.logging.LoggingService.applyConfiguration(configuration());

    this.settings = CrawlSettings.fromConfiguration(configuration());
    this.store = new FileSystemArtifactStore(settings.storeDirectory());

    if (!startupParameters.isOffline()) {
      this.governor =
          new FetchGovernor(
              new HttpPageFetcher(
                  OkHttpFactory.create(settings.userAgent(), settings.connectTimeoutSeconds())),
              PacingPolicy.fromConfiguration(configuration()),
              RetryPolicy.fromConfiguration(configuration()),
              Sleeper.SYSTEM,
              new SecureRandom());
    }

    this.runner =
        new CrawlRunner(
            settings,
            store,
            governor,
            FieldExtractors.jsoup(),
            DatasetWriters.forFormats(settings.outputFormats()),
            new RunReportWriter(),
            new LoggingProgressSink(
                com.gentoro.govdir.logging.LoggingService.getLogger(CrawlRunner.class),
                settings.progressMinIntervalMs(),
                settings.progressMinDelta()),
            Clock.systemUTC());
    log.info(
        "GovDir initialized in {} mode (store: {}, output: {})",
        startupParameters.mode(),
        store.root(),
        settings.outputDirectory().toAbsolutePath());
  }

  public RunReport run() {
    if (runner == null) {
      throw new StateException("GovDir not initialized. Call initialize() first.");
    }
    try {
      return runner.run();
    } finally {
      shutdown();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true) && governor != null) {
      governor.close();
    }
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("GovDir not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public CrawlSettings settings() {
    return settings;
  }
}
