package com.gentoro.govdir.resolve;

import com.gentoro.govdir.graph.EntityType;
import com.gentoro.govdir.graph.Finding;
import com.gentoro.govdir.graph.FindingType;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Join index from {@code agency_name_hash} to directory metadata, shared by all workers.
 *
 * <p>Every read and write goes through a single {@link ConcurrentHashMap#compute} on the key, so
 * contention is per name hash. The first entry registered for a hash wins; later ones are
 * counted and dropped. The index also remembers which entries were joined by a placement.
 */
public class AgencyIndex {
  private static final org.slf4j.Logger log =
      com.gentoro.govdir.logging.LoggingService.getLogger(AgencyIndex.class);

  private static final class IndexSlot {
    final AgencyDirectoryEntry entry;
    volatile boolean joined;

    IndexSlot(AgencyDirectoryEntry entry) {
      this.entry = entry;
    }
  }

  private final ConcurrentHashMap<String, IndexSlot> slots = new ConcurrentHashMap<>();
  private final AtomicInteger duplicates = new AtomicInteger();

  /** @return true if the entry was stored, false if an entry with that hash already existed */
  public boolean register(AgencyDirectoryEntry entry) {
    boolean[] stored = {false};
    slots.compute(
        entry.agencyNameHash(),
        (hash, current) -> {
          if (current != null) {
            return current;
          }
          stored[0] = true;
          return new IndexSlot(entry);
        });
    if (!stored[0]) {
      duplicates.incrementAndGet();
      log.debug("Directory entry '{}' duplicates {}", entry.name(), entry.agencyNameHash());
    }
    return stored[0];
  }

  /** Look up and mark joined. Empty when the directory has no entry for this hash. */
  public Optional<AgencyDirectoryEntry> join(String agencyNameHash) {
    IndexSlot slot =
        slots.computeIfPresent(
            agencyNameHash,
            (hash, current) -> {
              current.joined = true;
              return current;
            });
    return slot == null ? Optional.empty() : Optional.of(slot.entry);
  }

  public int size() {
    return slots.size();
  }

  public int duplicates() {
    return duplicates.get();
  }

  /** Directory entries no placement joined, as warnings sorted by name hash. */
  public List<Finding> unplacedFindings() {
    return slots.values().stream()
        .filter(s -> !s.joined)
        .map(s -> s.entry)
        .sorted(Comparator.comparing(AgencyDirectoryEntry::agencyNameHash))
        .map(
            e ->
                Finding.of(
                    FindingType.UNPLACED_DIRECTORY_AGENCY,
                    EntityType.AGENCY,
                    e.agencyNameHash(),
                    "Directory agency '%s' has no placement under any ministry"
                        .formatted(e.name())))
        .toList();
  }
}
