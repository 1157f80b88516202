package com.gentoro.govdir.extract;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.govdir.Fixtures;
import com.gentoro.govdir.extract.MinistryPageCandidate.DepartmentCandidate;
import org.junit.jupiter.api.Test;

class MinistryPageExtractorTest {

  private static final String URL = Fixtures.BASE + "/ministries/finance";

  private final MinistryPageExtractor extractor = new MinistryPageExtractor();

  @Test
  void readsOverviewAndReportedCounts() {
    MinistryPageCandidate page = extractor.extract(Fixtures.html("ministry-finance.html"), URL);

    assertEquals("Manages public finance and economic policy.", page.description());
    assertEquals(3, page.reportedAgencyCount());
    assertEquals(8, page.reportedServiceCount());
  }

  @Test
  void readsDepartmentsWithTheirPlacements() {
    MinistryPageCandidate page = extractor.extract(Fixtures.html("ministry-finance.html"), URL);

    // the block without a name is skipped
    assertEquals(2, page.departments().size());
    DepartmentCandidate finance = page.departments().get(0);
    assertEquals("Finance", finance.name());
    assertEquals(URL + "?department=fin", finance.url());
    assertEquals(2, finance.placements().size());
    assertEquals("Kenya Revenue Authority", finance.placements().get(0).name());
    assertEquals(
        Fixtures.BASE + "/ministries/finance/services?department=fin&agency=kra",
        finance.placements().get(0).url());

    DepartmentCandidate planning = page.departments().get(1);
    assertEquals("Planning", planning.name());
    assertEquals(1, planning.placements().size());
  }

  @Test
  void pageWithoutStructureYieldsEmptyCandidate() {
    MinistryPageCandidate page =
        extractor.extract("<html><body><h2>Overview</h2></body></html>", URL);

    assertNull(page.description());
    assertNull(page.reportedAgencyCount());
    assertNull(page.reportedServiceCount());
    assertTrue(page.departments().isEmpty());
  }

  @Test
  void nonNumericCountsAreAbsent() {
    MinistryPageCandidate page =
        extractor.extract("<html><body><dl><dd>many</dd><dd>12</dd></dl></body></html>", URL);

    assertNull(page.reportedAgencyCount());
    assertEquals(12, page.reportedServiceCount());
  }

  @Test
  void departmentWithoutParameterKeepsMinistryUrl() {
    String html =
        "<html><body><ul role=\"listbox\"><div><span>Admin</span>"
            + "<ul><li><a href=\"/x/services\">Registry</a></li></ul></div></ul></body></html>";

    MinistryPageCandidate page = extractor.extract(html, URL);

    assertEquals(URL, page.departments().get(0).url());
  }
}
