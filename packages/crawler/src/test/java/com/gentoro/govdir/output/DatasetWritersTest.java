package com.gentoro.govdir.output;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.govdir.graph.EntityGraph;
import com.gentoro.govdir.graph.Faq;
import com.gentoro.govdir.graph.Ministry;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DatasetWritersTest {

  @TempDir Path out;

  private static EntityGraph graph() {
    Ministry health =
        new Ministry("a1b2c3d4e5f6", "Ministry of Health", null, 12, null, 2, 11, 40, null);
    return new EntityGraph(
        List.of(health),
        List.of(),
        List.of(),
        List.of(),
        List.of(new Faq("0f0f0f0f0f0f", "How, exactly?", "Like \"this\".")));
  }

  @Test
  void writersFollowRequestedFormatsCsvFirst() {
    List<DatasetWriter> writers = DatasetWriters.forFormats(Set.of("json", "csv"));

    assertEquals(List.of("csv", "json"), writers.stream().map(DatasetWriter::format).toList());
    assertTrue(DatasetWriters.forFormats(Set.of()).isEmpty());
  }

  @Test
  void csvHasHeaderInDeclaredColumnOrder() throws Exception {
    List<Path> files = new CsvDatasetWriter().write(graph(), out);

    assertEquals(5, files.size());
    List<String> lines = Files.readAllLines(out.resolve("ministries.csv"));
    assertEquals(
        "ministry_id,ministry_name,ministry_description,reported_agency_count,"
            + "reported_service_count,observed_department_count,observed_agency_count,"
            + "observed_service_count,ministry_url",
        lines.get(0));
    assertTrue(lines.get(1).startsWith("a1b2c3d4e5f6,"));
    assertTrue(lines.get(1).endsWith(",12,,2,11,40,"));
    // header only for empty collections
    assertEquals(1, Files.readAllLines(out.resolve("services.csv")).size());
    assertTrue(Files.readString(out.resolve("faqs.csv")).contains("\"How, exactly?\""));
  }

  @Test
  void jsonKeepsAbsentFieldsAsNull() throws Exception {
    new JsonDatasetWriter().write(graph(), out);

    String json = Files.readString(out.resolve("ministries.json"));
    assertTrue(json.contains("\"ministry_description\" : null"));
    assertTrue(json.contains("\"reported_agency_count\" : 12"));
    assertTrue(json.endsWith("\n"));
    assertEquals("[ ]\n", Files.readString(out.resolve("agencies.json")));
  }
}
