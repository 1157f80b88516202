package com.gentoro.govdir.output;

import com.gentoro.govdir.pipeline.RunReport;
import com.gentoro.govdir.utility.FileUtility;
import com.gentoro.govdir.utility.JacksonUtility;
import java.nio.file.Path;

public class RunReportWriter {
  public static final String FILE_NAME = "run_report.json";

  public Path write(RunReport report, Path directory) {
    Path file = directory.resolve(FILE_NAME);
    FileUtility.writeAtomically(file, JacksonUtility.toJson(report) + "\n");
    return file;
  }
}
