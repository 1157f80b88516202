package com.gentoro.govdir.store;

import com.gentoro.govdir.exception.ValidationException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Stable address of a raw artifact, derived from the page's position in the hierarchy, for example
 * {@code ministries/<ministry_id>/<department_id>/<agency_id>/services}.
 *
 * <p>Segments are restricted to {@code [a-z0-9_-]} so the key maps directly onto a relative file
 * path on every platform.
 */
public record ArtifactKey(List<String> segments) implements Comparable<ArtifactKey> {
  private static final Pattern SEGMENT = Pattern.compile("[a-z0-9_-]+");

  public ArtifactKey {
    if (segments == null || segments.isEmpty()) {
      throw new ValidationException("Artifact key needs at least one segment");
    }
    for (String s : segments) {
      if (s == null || !SEGMENT.matcher(s).matches()) {
        throw new ValidationException("Invalid artifact key segment: '" + s + "'");
      }
    }
    segments = List.copyOf(segments);
  }

  public static ArtifactKey of(String... segments) {
    return new ArtifactKey(Arrays.asList(segments));
  }

  /** Parse the string form produced by {@link #value()}. */
  public static ArtifactKey parse(String value) {
    if (value == null || value.isBlank()) {
      throw new ValidationException("Artifact key must not be blank");
    }
    return new ArtifactKey(Arrays.asList(value.split("/")));
  }

  public ArtifactKey child(String... more) {
    List<String> all = new ArrayList<>(segments);
    all.addAll(Arrays.asList(more));
    return new ArtifactKey(all);
  }

  public String value() {
    return String.join("/", segments);
  }

  @Override
  public int compareTo(ArtifactKey other) {
    return value().compareTo(other.value());
  }

  @Override
  public String toString() {
    return value();
  }
}
