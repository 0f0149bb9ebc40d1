package com.resumebuilder.reader;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public final class TextLine {
  private static final Pattern SEGMENT_BREAK = Pattern.compile("\\t+| {2,}");
  private static final Pattern SPACES = Pattern.compile("\\s+");

  private static final TextLine BLANK = new TextLine("", Collections.emptyList(), false, 0);

  private final String text;
  private final List<String> segments;
  private final boolean headingLike;
  private final int indent;

  private TextLine(String text, List<String> segments, boolean headingLike, int indent) {
    this.text = text;
    this.segments = segments;
    this.headingLike = headingLike;
    this.indent = indent;
  }

  public static TextLine blank() {
    return BLANK;
  }

  public static TextLine of(String raw) {
    return of(raw, false, 0);
  }

  /**
   * Builds a line from raw text. Runs of two or more spaces or tabs are kept as segment
   * boundaries before the text itself is collapsed to single spaces.
   */
  public static TextLine of(String raw, boolean headingLike, int indent) {
    String cleaned = LineNormalizer.clean(raw);
    if (cleaned.isEmpty()) {
      return BLANK;
    }
    List<String> segments = Arrays.stream(SEGMENT_BREAK.split(cleaned))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .map(s -> SPACES.matcher(s).replaceAll(" "))
        .collect(Collectors.toUnmodifiableList());
    String text = String.join(" ", segments);
    return new TextLine(text, segments, headingLike, Math.max(0, indent));
  }

  public String getText() {
    return text;
  }

  /** Pieces of the line that were separated by wide whitespace in the source. */
  public List<String> getSegments() {
    return segments;
  }

  public boolean isHeadingLike() {
    return headingLike;
  }

  public int getIndent() {
    return indent;
  }

  public boolean isBlank() {
    return text.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TextLine)) {
      return false;
    }
    TextLine other = (TextLine) o;
    return headingLike == other.headingLike && indent == other.indent && text.equals(other.text);
  }

  @Override
  public int hashCode() {
    return Objects.hash(text, headingLike, indent);
  }

  @Override
  public String toString() {
    return (headingLike ? "[H] " : "") + text;
  }
}
