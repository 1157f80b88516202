package com.gentoro.govdir.output;

import com.gentoro.govdir.graph.EntityGraph;
import com.gentoro.govdir.graph.EntityType;
import com.gentoro.govdir.utility.FileUtility;
import com.gentoro.govdir.utility.JacksonUtility;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Pretty-printed JSON array of records per collection; absent fields are written as null. */
public class JsonDatasetWriter implements DatasetWriter {
  private static final org.slf4j.Logger log =
      com.gentoro.govdir.logging.LoggingService.getLogger(JsonDatasetWriter.class);

  @Override
  public String format() {
    return "json";
  }

  @Override
  public List<Path> write(EntityGraph graph, Path directory) {
    List<Path> files = new ArrayList<>();
    files.add(writeCollection(directory, EntityType.MINISTRY, graph.ministries()));
    files.add(writeCollection(directory, EntityType.DEPARTMENT, graph.departments()));
    files.add(writeCollection(directory, EntityType.AGENCY, graph.agencies()));
    files.add(writeCollection(directory, EntityType.SERVICE, graph.services()));
    files.add(writeCollection(directory, EntityType.FAQ, graph.faqs()));
    return files;
  }

  private Path writeCollection(Path dir, EntityType type, List<?> records) {
    Path file = dir.resolve(type.collection() + ".json");
    FileUtility.writeAtomically(file, JacksonUtility.toJson(records) + "\n");
    log.info("Wrote {} {} to {}", records.size(), type.collection(), file);
    return file;
  }
}
