package com.gentoro.govdir;

import com.gentoro.govdir.pipeline.RunReport;
import com.gentoro.govdir.pipeline.RunStatus;

public class GovDirApp {

  private static final org.slf4j.Logger log =
      com.gentoro.govdir.logging.LoggingService.getLogger(GovDirApp.class);

  public static void main(String[] args) {
    System.exit(execute(args));
  }

  /** Run once and map the outcome to a process exit code. */
  static int execute(String[] args) {
    GovDir app;
    try {
      app = new GovDir(args);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.err.println(StartupParameters.usage());
      return 64;
    }
    if (StartupParameters.MODE_HELP.equals(app.startupParameters().mode())) {
      System.out.println(StartupParameters.usage());
      return 0;
    }
    try {
      app.initialize();
      RunReport report = app.run();
      return report.status().exitCode();
    } catch (Exception e) {
      log.error("Crawl failed", e);
      app.shutdown();
      return RunStatus.FAILED.exitCode();
    }
  }
}
