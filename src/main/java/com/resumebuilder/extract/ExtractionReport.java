package com.resumebuilder.extract;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.resumebuilder.Entity;

public final class ExtractionReport {
  public enum Notice {
    /** No section heading was recognized; everything landed in the header region. */
    NO_SECTIONS_DETECTED,
    NAME_NOT_FOUND,
    NO_CONTACT_DETAILS,
    /** PDF text order comes from page position; multi-column pages may interleave. */
    READING_ORDER_APPROXIMATED,
    /** An experience, education or project entry has no title structure at all. */
    UNSTRUCTURED_ENTRIES
  }

  private final Entity.ResumeEntity resume;
  private final Set<Notice> notices;

  ExtractionReport(Entity.ResumeEntity resume, Set<Notice> notices) {
    this.resume = resume;
    this.notices = notices.isEmpty() ? EnumSet.noneOf(Notice.class) : EnumSet.copyOf(notices);
  }

  @JsonProperty
  public Entity.ResumeEntity getResume() {
    return resume;
  }

  @JsonProperty
  public List<Notice> getNotices() {
    return List.copyOf(notices);
  }

  public boolean has(Notice notice) {
    return notices.contains(notice);
  }

  @JsonProperty
  public boolean needsReview() {
    return !notices.isEmpty();
  }
}
