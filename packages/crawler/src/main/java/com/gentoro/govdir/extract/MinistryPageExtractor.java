package com.gentoro.govdir.extract;

import com.gentoro.govdir.extract.MinistryPageCandidate.DepartmentCandidate;
import com.gentoro.govdir.extract.MinistryPageCandidate.PlacementCandidate;
import java.util.ArrayList;
import java.util.List;
import okhttp3.HttpUrl;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

/**
 * Ministry overview plus department/agency navigation.
 *
 * <ul>
 *   <li>reported agency and service counts: first and second {@code dd}
 *   <li>description: {@code article}
 *   <li>departments: direct {@code div} children of {@code ul[role=listbox]}, named by their
 *       {@code span}; each {@code ul a[href]} inside is an agency placement
 * </ul>
 *
 * A page without the listbox yields no departments. Blocks without a name and links without text
 * are skipped.
 */
public class MinistryPageExtractor implements PageExtractor<MinistryPageCandidate> {
  static final String DEPARTMENT_PARAM = "department";

  @Override
  public PageType pageType() {
    return PageType.MINISTRY_PAGE;
  }

  @Override
  public MinistryPageCandidate extract(String html, String pageUrl) {
    Document doc = Jsoup.parse(html, pageUrl);
    Elements dds = doc.select("dd");
    Integer reportedAgencies = dds.isEmpty() ? null : Markup.count(dds.get(0).text());
    Integer reportedServices = dds.size() < 2 ? null : Markup.count(dds.get(1).text());
    String description = Markup.text(doc.selectFirst("article"));

    List<DepartmentCandidate> departments = new ArrayList<>();
    Element listbox = doc.selectFirst("ul[role=listbox]");
    if (listbox != null) {
      for (Element block : listbox.children()) {
        if (!block.tagName().equals("div")) continue;
        String name = Markup.text(block.selectFirst("span"));
        if (name == null) continue;

        List<PlacementCandidate> placements = new ArrayList<>();
        for (Element link : block.select("ul a[href]")) {
          String agencyName = Markup.text(link);
          if (agencyName == null) continue;
          placements.add(new PlacementCandidate(agencyName, Markup.url(link, "href")));
        }
        departments.add(
            new DepartmentCandidate(name, departmentUrl(block, pageUrl), placements));
      }
    }
    return new MinistryPageCandidate(description, reportedAgencies, reportedServices, departments);
  }

  /** Ministry URL scoped by the {@code department} parameter of the block's first agency link. */
  static String departmentUrl(Element block, String ministryUrl) {
    String first = Markup.url(block.selectFirst("ul a[href]"), "href");
    HttpUrl firstUrl = first == null ? null : HttpUrl.parse(first);
    String department = firstUrl == null ? null : firstUrl.queryParameter(DEPARTMENT_PARAM);
    HttpUrl ministry = HttpUrl.parse(ministryUrl);
    if (department == null || department.isBlank() || ministry == null) {
      return ministryUrl;
    }
    return ministry.newBuilder().setQueryParameter(DEPARTMENT_PARAM, department).build().toString();
  }
}
