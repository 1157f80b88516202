package com.gentoro.govdir.extract;

import com.gentoro.govdir.fetch.ReadyCondition;

/** Kinds of pages the crawler loads, each with the structure that marks it as loaded. */
public enum PageType {
  FAQ(ReadyCondition.atLeastOne("li[id^=faq_]")),
  AGENCY_DIRECTORY(ReadyCondition.atLeastOne("a:has(h4)")),
  MINISTRY_LIST(ReadyCondition.atLeastOne(MinistryListExtractor.MINISTRY_LINK)),
  MINISTRY_PAGE(ReadyCondition.atLeastOne("h2:contains(Overview), ul[role=listbox], dd")),
  AGENCY_SERVICES(ReadyCondition.atLeastOne(AgencyServicesExtractor.CONTAINER));

  private final ReadyCondition readyCondition;

  PageType(ReadyCondition readyCondition) {
    this.readyCondition = readyCondition;
  }

  public ReadyCondition readyCondition() {
    return readyCondition;
  }
}
