package hdlrefine.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Collects non-fatal findings, grouped by message and deduplicated by subject.
 * {@link #report()} prints one warning line per message naming all new subjects.
 */
public class WarningList {
  protected static final Logger logger = LogManager.getLogger();

  private final LinkedHashMap<String, LinkedHashSet<String>> subjectsByMessage = new LinkedHashMap<>();
  private final LinkedHashMap<String, Integer> reportedCount = new LinkedHashMap<>();

  /**
   * Adds a subject to a message.
   * @return true iff the subject was not yet listed for the message
   */
  public boolean add(String message, String subject) {
    return subjectsByMessage.computeIfAbsent(message, msg -> new LinkedHashSet<>()).add(subject);
  }

  public boolean contains(String message) { return subjectsByMessage.containsKey(message); }

  /** @return the subjects listed for a message (may be empty) */
  public Set<String> getSubjects(String message) {
    var subjects = subjectsByMessage.get(message);
    return subjects == null ? Set.of() : Collections.unmodifiableSet(subjects);
  }

  public Set<String> getMessages() { return Collections.unmodifiableSet(subjectsByMessage.keySet()); }

  public boolean isEmpty() { return subjectsByMessage.isEmpty(); }

  /** Logs every subject that was not reported yet. */
  public void report() {
    subjectsByMessage.forEach((message, subjects) -> {
      int alreadyReported = reportedCount.getOrDefault(message, 0);
      if (subjects.size() == alreadyReported)
        return;
      List<String> fresh = new ArrayList<>(subjects).subList(alreadyReported, subjects.size());
      logger.warn("{} Affected: {}", message, String.join(", ", fresh));
      reportedCount.put(message, subjects.size());
    });
  }
}
