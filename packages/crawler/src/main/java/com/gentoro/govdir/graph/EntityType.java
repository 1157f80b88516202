package com.gentoro.govdir.graph;

public enum EntityType {
  MINISTRY("ministries", "ministry_id"),
  DEPARTMENT("departments", "department_id"),
  AGENCY("agencies", "agency_id"),
  SERVICE("services", "service_id"),
  FAQ("faqs", "faq_id");

  private final String collection;
  private final String idColumn;

  EntityType(String collection, String idColumn) {
    this.collection = collection;
    this.idColumn = idColumn;
  }

  /** Plural name used for output files and report keys. */
  public String collection() {
    return collection;
  }

  /** Column holding the record's identifier in the written datasets. */
  public String idColumn() {
    return idColumn;
  }
}
