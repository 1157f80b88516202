package com.gentoro.govdir.graph;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.govdir.graph.DataQualityReport.CollectionQuality;
import com.gentoro.govdir.graph.DataQualityReport.MissingField;
import com.gentoro.govdir.utility.JacksonUtility;
import java.util.List;
import org.junit.jupiter.api.Test;

class DataQualityReportTest {

  private static Agency agency(String id, String description, String logo, String url) {
    return new Agency(
        id, "h-" + id, "m1", "d1", "Agency " + id, description, logo, url, 0, "https://s/" + id);
  }

  @Test
  void countsNullFieldsPerColumnAndCapsTheIdLists() {
    EntityGraph graph =
        new EntityGraph(
            List.of(),
            List.of(),
            List.of(
                agency("a1", "Known", "https://x/logo.png", "https://x"),
                agency("a2", null, null, "https://y"),
                agency("a3", null, null, null)),
            List.of(),
            List.of());

    CollectionQuality agencies = DataQualityReport.of(graph, 1).collection(EntityType.AGENCY);

    assertEquals(3, agencies.records());
    assertEquals(3, agencies.uniqueIds());
    assertEquals(5, agencies.missingCells());
    assertEquals(30, agencies.totalCells());
    MissingField description = agencies.missingFor("agency_description");
    assertEquals(2, description.count());
    assertEquals(List.of("a2"), description.ids());
    assertTrue(description.truncated());
    MissingField url = agencies.missingFor("agency_url");
    assertEquals(List.of("a3"), url.ids());
    assertFalse(url.truncated());
    assertEquals(0, agencies.missingFor("agency_name").count());
  }

  @Test
  void repeatedIdsAreCountedAsDuplicateRecords() {
    Faq faq = new Faq("f1", "Q", "A");
    EntityGraph graph =
        new EntityGraph(
            List.of(),
            List.of(),
            List.of(),
            List.of(),
            List.of(faq, faq, new Faq("f2", "R", null)));

    CollectionQuality faqs = DataQualityReport.of(graph).collection(EntityType.FAQ);

    assertEquals(3, faqs.records());
    assertEquals(2, faqs.uniqueIds());
    assertEquals(2, faqs.duplicateIdRecords());
    assertEquals(List.of("f2"), faqs.missingFor("answer").ids());
  }

  @Test
  void reservedServiceColumnsAreIgnored() {
    EntityGraph graph =
        new EntityGraph(
            List.of(),
            List.of(),
            List.of(),
            List.of(Service.of("s1", "m1", "d1", "a1", "Permit", "https://x/permit")),
            List.of());

    CollectionQuality services = DataQualityReport.of(graph).collection(EntityType.SERVICE);

    assertTrue(services.missing().isEmpty());
    assertEquals(List.of("service_description", "service_requirements"), services.ignoredFields());
    assertEquals(6, services.totalCells());
  }

  @Test
  void serializesWithSnakeCaseKeys() {
    String json = JacksonUtility.toJson(DataQualityReport.of(EntityGraph.empty()));

    assertTrue(json.contains("\"max_ids_per_field\" : 100"));
    assertTrue(json.contains("\"duplicate_id_records\" : 0"));
    assertFalse(json.contains("missingFor"));
  }
}
