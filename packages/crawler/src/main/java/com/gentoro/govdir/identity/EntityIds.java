package com.gentoro.govdir.identity;

import java.util.List;

/**
 * The identifier recipes for each entity type. Identity parts are returned alongside ids so the
 * assembler can tell a repeated discovery from a collision.
 */
public final class EntityIds {
  private EntityIds() {}

  public static List<String> ministryParts(String ministryName) {
    return List.of(ministryName);
  }

  public static String ministryId(String ministryName) {
    return IdentifierEngine.scopedHash(ministryParts(ministryName));
  }

  public static List<String> departmentParts(String ministryId, String departmentName) {
    return List.of(ministryId, departmentName);
  }

  public static String departmentId(String ministryId, String departmentName) {
    return IdentifierEngine.scopedHash(departmentParts(ministryId, departmentName));
  }

  /** Name-only key used to join global directory metadata onto placements. */
  public static String agencyNameHash(String agencyName) {
    return IdentifierEngine.scopedHash(List.of(agencyName));
  }

  public static List<String> agencyParts(
      String ministryId, String departmentId, String agencyName) {
    return List.of(ministryId, departmentId, agencyName);
  }

  public static String agencyId(String ministryId, String departmentId, String agencyName) {
    return IdentifierEngine.scopedHash(agencyParts(ministryId, departmentId, agencyName));
  }

  public static List<String> serviceParts(
      String ministryId, String departmentId, String agencyId, String serviceName) {
    return List.of(ministryId, departmentId, agencyId, serviceName);
  }

  public static String serviceId(
      String ministryId, String departmentId, String agencyId, String serviceName) {
    return IdentifierEngine.scopedHash(
        serviceParts(ministryId, departmentId, agencyId, serviceName));
  }

  public static List<String> faqParts(String question, String answer) {
    return List.of(question, answer);
  }

  public static String faqId(String question, String answer) {
    return IdentifierEngine.scopedHash(faqParts(question, answer));
  }
}
