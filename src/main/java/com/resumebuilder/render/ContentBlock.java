package com.resumebuilder.render;

import java.util.List;

/**
 * A format-independent piece of a rendered resume. The planner fills in display text;
 * encoders only decide how each field looks.
 * <p>
 * Field use by kind:
 * <ul>
 *   <li>HEADER: title is the name, items are the contact details;</li>
 *   <li>HEADING: title is the section title;</li>
 *   <li>SUMMARY and SKILLS: body holds the text;</li>
 *   <li>EXPERIENCE, EDUCATION, PROJECT: title, subtitle (organization, institution or
 *       link), period, body and items (achievements) as present.</li>
 * </ul>
 */
public final class ContentBlock {
  public enum Kind {
    HEADER,
    HEADING,
    SUMMARY,
    EXPERIENCE,
    EDUCATION,
    SKILLS,
    PROJECT;

    public boolean isEntry() {
      return this == EXPERIENCE || this == EDUCATION || this == PROJECT;
    }
  }

  private final Kind kind;
  private final String title;
  private final String subtitle;
  private final String period;
  private final String body;
  private final List<String> items;

  ContentBlock(Kind kind, String title, String subtitle, String period, String body, List<String> items) {
    this.kind = kind;
    this.title = title;
    this.subtitle = subtitle;
    this.period = period;
    this.body = body;
    this.items = List.copyOf(items);
  }

  static ContentBlock text(Kind kind, String body) {
    return new ContentBlock(kind, null, null, null, body, List.of());
  }

  static ContentBlock heading(String title) {
    return new ContentBlock(Kind.HEADING, title, null, null, null, List.of());
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isEntry() {
    return kind.isEntry();
  }

  public String getTitle() {
    return title;
  }

  public String getSubtitle() {
    return subtitle;
  }

  public String getPeriod() {
    return period;
  }

  public String getBody() {
    return body;
  }

  public List<String> getItems() {
    return items;
  }

  public boolean hasItems() {
    return !items.isEmpty();
  }

  @Override
  public String toString() {
    return kind + (title == null ? "" : "(" + title + ")");
  }
}
