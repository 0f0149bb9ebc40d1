package com.resumebuilder.reader;

import java.util.List;

public final class DocumentText {
  private final DocumentFormat format;
  private final List<TextLine> lines;
  private final boolean readingOrderApproximated;

  public DocumentText(DocumentFormat format, List<TextLine> lines, boolean readingOrderApproximated) {
    this.format = format;
    this.lines = List.copyOf(lines);
    this.readingOrderApproximated = readingOrderApproximated;
  }

  public DocumentFormat getFormat() {
    return format;
  }

  public List<TextLine> getLines() {
    return lines;
  }

  /**
   * True when text was ordered purely by page position (left to right, top to bottom)
   * without column detection, so multi-column pages may interleave.
   */
  public boolean isReadingOrderApproximated() {
    return readingOrderApproximated;
  }
}
