package com.resumebuilder.extract;

import java.util.List;

import com.resumebuilder.reader.TextLine;

public final class Section {
  private final SectionKind kind;
  private final String heading;
  private final List<TextLine> lines;

  Section(SectionKind kind, String heading, List<TextLine> lines) {
    this.kind = kind;
    this.heading = heading;
    this.lines = List.copyOf(lines);
  }

  public SectionKind getKind() {
    return kind;
  }

  /** The heading text as it appeared, or null for the unassigned region. */
  public String getHeading() {
    return heading;
  }

  public List<TextLine> getLines() {
    return lines;
  }
}
