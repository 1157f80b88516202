package com.gentoro.govdir.graph;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.govdir.exception.ResolutionException;
import com.gentoro.govdir.identity.EntityIds;
import java.util.List;
import org.junit.jupiter.api.Test;

class GraphAssemblerTest {

  private static Agency agency(String id, String ministryId, String departmentId, String name) {
    return new Agency(
        id, "hash-" + id, ministryId, departmentId, name, null, null, null, null, null);
  }

  @Test
  void repeatedDiscoveryKeepsTheFirstRecord() {
    GraphAssembler assembler = new GraphAssembler();

    assertTrue(
        assembler.addMinistry(
            Ministry.seed("m1", "Ministry of Health", "https://x/a"),
            List.of("Ministry of Health")));
    assertFalse(
        assembler.addMinistry(
            Ministry.seed("m1", "MINISTRY OF HEALTH", "https://x/b"),
            List.of("ministry of health")));

    EntityGraph graph = assembler.materialize();
    assertEquals(1, graph.ministries().size());
    assertEquals("https://x/a", graph.ministries().get(0).url());
    assertTrue(assembler.collisions().isEmpty());
  }

  @Test
  void differentIdentityUnderTheSameIdIsACollision() {
    GraphAssembler assembler = new GraphAssembler();
    assembler.addFaq(new Faq("f1", "Q one", "A"), List.of("Q one", "A"));

    assertFalse(assembler.addFaq(new Faq("f1", "Q two", "B"), List.of("Q two", "B")));

    List<Finding> collisions = assembler.collisions();
    assertEquals(1, collisions.size());
    assertEquals(FindingType.HASH_COLLISION, collisions.get(0).type());
    assertEquals(EntityType.FAQ, collisions.get(0).entityType());
    assertEquals("f1", collisions.get(0).entityId());
    assertTrue(collisions.get(0).isFatal());
    assertEquals("Q one", assembler.materialize().faqs().get(0).question());
  }

  @Test
  void faqsWithShiftedQuestionAnswerBoundaryCollide() {
    String first = EntityIds.faqId("How to pay", "Online");
    String second = EntityIds.faqId("How to", "Pay online");
    assertEquals(first, second);

    GraphAssembler assembler = new GraphAssembler();
    assembler.addFaq(
        new Faq(first, "How to pay", "Online"), EntityIds.faqParts("How to pay", "Online"));
    assertFalse(
        assembler.addFaq(
            new Faq(second, "How to", "Pay online"), EntityIds.faqParts("How to", "Pay online")));

    assertEquals(1, assembler.collisions().size());
    assertEquals(FindingType.HASH_COLLISION, assembler.collisions().get(0).type());
  }

  @Test
  void materializeSortsByIdAndDerivesObservedCounts() {
    GraphAssembler assembler = new GraphAssembler();
    assembler.addMinistry(Ministry.seed("m2", "B", null), List.of("B"));
    assembler.addMinistry(Ministry.seed("m1", "A", null), List.of("A"));
    assembler.addDepartment(Department.of("d1", "m1", "Finance", null), List.of("m1", "Finance"));
    assembler.addDepartment(
        Department.of("d2", "m1", "Planning", null), List.of("m1", "Planning"));
    assembler.addAgency(agency("a2", "m1", "d1", "Two"), List.of("m1", "d1", "Two"));
    assembler.addAgency(agency("a1", "m1", "d1", "One"), List.of("m1", "d1", "One"));
    assembler.addService(
        Service.of("s1", "m1", "d1", "a1", "Permit", null), List.of("m1", "d1", "a1", "Permit"));
    assembler.addService(
        Service.of("s2", "m1", "d1", "a1", "Licence", null), List.of("m1", "d1", "a1", "Licence"));

    EntityGraph graph = assembler.materialize();

    assertEquals(
        List.of("m1", "m2"), graph.ministries().stream().map(Ministry::ministryId).toList());
    assertEquals(List.of("a1", "a2"), graph.agencies().stream().map(Agency::agencyId).toList());

    Ministry m1 = graph.ministries().get(0);
    assertEquals(2, m1.observedDepartmentCount());
    assertEquals(2, m1.observedAgencyCount());
    assertEquals(2, m1.observedServiceCount());
    assertEquals(0, graph.ministries().get(1).observedAgencyCount());

    Department finance = graph.departments().get(0);
    assertEquals(2, finance.observedAgencyCount());
    assertEquals(2, finance.observedServiceCount());
    assertEquals(0, graph.departments().get(1).observedAgencyCount());

    assertEquals(2, graph.agencies().get(0).observedServiceCount());
    assertEquals(0, graph.agencies().get(1).observedServiceCount());
  }

  @Test
  void enrichingUnknownMinistryFails() {
    GraphAssembler assembler = new GraphAssembler();
    assertThrows(ResolutionException.class, () -> assembler.enrichMinistry("nope", "d", 1, 2));
  }

  @Test
  void enrichmentKeepsValuesNotOnThePage() {
    GraphAssembler assembler = new GraphAssembler();
    assembler.addMinistry(Ministry.seed("m1", "A", "https://x/a"), List.of("A"));
    assembler.enrichMinistry("m1", "About A", 4, null);
    assembler.enrichMinistry("m1", null, null, 9);

    Ministry m = assembler.materialize().ministries().get(0);
    assertEquals("About A", m.description());
    assertEquals(4, m.reportedAgencyCount());
    assertEquals(9, m.reportedServiceCount());
  }
}
