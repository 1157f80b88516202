package com.gentoro.govdir.output;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.gentoro.govdir.exception.SerializationException;
import com.gentoro.govdir.graph.Agency;
import com.gentoro.govdir.graph.Department;
import com.gentoro.govdir.graph.EntityGraph;
import com.gentoro.govdir.graph.EntityType;
import com.gentoro.govdir.graph.Faq;
import com.gentoro.govdir.graph.Ministry;
import com.gentoro.govdir.graph.Service;
import com.gentoro.govdir.utility.FileUtility;
import com.gentoro.govdir.utility.JacksonUtility;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** CSV with a header row; column order follows each entity's declared property order. */
public class CsvDatasetWriter implements DatasetWriter {
  private static final org.slf4j.Logger log =
      com.gentoro.govdir.logging.LoggingService.getLogger(CsvDatasetWriter.class);

  private final CsvMapper mapper = JacksonUtility.getCsvMapper();

  @Override
  public String format() {
    return "csv";
  }

  @Override
  public List<Path> write(EntityGraph graph, Path directory) {
    List<Path> files = new ArrayList<>();
    files.add(writeCollection(directory, EntityType.MINISTRY, Ministry.class, graph.ministries()));
    files.add(
        writeCollection(directory, EntityType.DEPARTMENT, Department.class, graph.departments()));
    files.add(writeCollection(directory, EntityType.AGENCY, Agency.class, graph.agencies()));
    files.add(writeCollection(directory, EntityType.SERVICE, Service.class, graph.services()));
    files.add(writeCollection(directory, EntityType.FAQ, Faq.class, graph.faqs()));
    return files;
  }

  private <T> Path writeCollection(Path dir, EntityType type, Class<T> cls, List<T> records) {
    Path file = dir.resolve(type.collection() + ".csv");
    CsvSchema schema = mapper.schemaFor(cls).withHeader();
    String csv;
    try {
      csv = mapper.writer(schema).writeValueAsString(records);
    } catch (Exception e) {
      throw new SerializationException("Failed to write " + type.collection() + " as CSV", e);
    }
    FileUtility.writeAtomically(file, csv);
    log.info("Wrote {} {} to {}", records.size(), type.collection(), file);
    return file;
  }
}
