package com.gentoro.govdir.output;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public final class DatasetWriters {
  private DatasetWriters() {}

  /** Writers for the requested formats, CSV first. Unknown format names are ignored. */
  public static List<DatasetWriter> forFormats(Collection<String> formats) {
    List<DatasetWriter> writers = new ArrayList<>();
    if (formats.contains("csv")) writers.add(new CsvDatasetWriter());
    if (formats.contains("json")) writers.add(new JsonDatasetWriter());
    return writers;
  }
}
