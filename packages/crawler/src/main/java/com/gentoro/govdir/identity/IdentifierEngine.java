package com.gentoro.govdir.identity;

import com.gentoro.govdir.exception.StateException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.Normalizer;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Text normalization and scoped, deterministic identifiers.
 *
 * <p>An identifier is the first {@value #ID_LENGTH} hex characters of the SHA-256 digest of the
 * normalized parts joined by {@code '-'} and normalized again, so the delimiter never reaches the
 * digest. Ancestor identifiers go first, the entity's own name last, so the same leaf name under
 * different parents never yields the same identifier.
 *
 * <p>Stateless and thread-safe.
 */
public final class IdentifierEngine {
  public static final int ID_LENGTH = 12;
  public static final String PART_DELIMITER = "-";

  private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
  private static final Pattern NOT_ALPHANUMERIC = Pattern.compile("[^a-z0-9]");

  private IdentifierEngine() {}

  /**
   * Lowercase, decompose, drop combining marks and every character outside {@code [a-z0-9]}.
   * {@code null}, empty and whitespace-only input all normalize to the empty string.
   */
  public static String normalize(String text) {
    if (text == null || text.isEmpty()) return "";
    String lower = text.toLowerCase(Locale.ROOT);
    String decomposed = Normalizer.normalize(lower, Normalizer.Form.NFD);
    String unmarked = COMBINING_MARKS.matcher(decomposed).replaceAll("");
    return NOT_ALPHANUMERIC.matcher(unmarked).replaceAll("");
  }

  /** Identifier for an ordered list of parts. Each part is normalized before joining. */
  public static String scopedHash(List<String> parts) {
    Objects.requireNonNull(parts, "parts");
    return sha256Prefix(normalize(identityKey(parts)));
  }

  public static String scopedHash(String... parts) {
    return scopedHash(Arrays.asList(parts));
  }

  /**
   * Normalized parts joined by {@code '-'}. Part boundaries survive here but not in the digest, so
   * {@code ["ab", "c"]} and {@code ["a", "bc"]} share an identifier with different identity keys,
   * which the assembler reports as a hash collision.
   */
  public static String identityKey(List<String> parts) {
    return parts.stream()
        .map(IdentifierEngine::normalize)
        .collect(Collectors.joining(PART_DELIMITER));
  }

  private static String sha256Prefix(String joined) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(joined.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash).substring(0, ID_LENGTH);
    } catch (NoSuchAlgorithmException e) {
      throw new StateException("SHA-256 is not available in this JVM", e);
    }
  }
}
