package com.resumebuilder.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiPredicate;

import com.resumebuilder.reader.TextLine;

/**
 * Splits a section's lines into entries. An entry ends at a blank line, before a
 * heading-like line, before a plain line that follows a list item (unless it reads as the
 * wrapped tail of that item), or wherever the section-specific rule says a new entry starts.
 */
class EntryGrouper {
  private final ExtractionRules rules;

  EntryGrouper(ExtractionRules rules) {
    this.rules = rules;
  }

  List<List<TextLine>> group(List<TextLine> lines) {
    return group(lines, (line, entry) -> false);
  }

  /**
   * @param startsEntry section rule deciding whether a line opens a new entry given the
   *                    lines collected so far for the current one
   */
  List<List<TextLine>> group(List<TextLine> lines, BiPredicate<TextLine, List<TextLine>> startsEntry) {
    List<List<TextLine>> entries = new ArrayList<>();
    List<TextLine> current = new ArrayList<>();
    boolean previousBullet = false;

    for (TextLine line : lines) {
      if (line.isBlank()) {
        close(entries, current);
        current = new ArrayList<>();
        previousBullet = false;
        continue;
      }
      boolean bullet = rules.isBullet(line.getText());
      if (!current.isEmpty() && !bullet) {
        boolean boundary = line.isHeadingLike()
            || previousBullet && !isContinuation(line)
            || startsEntry.test(line, current);
        if (boundary) {
          close(entries, current);
          current = new ArrayList<>();
        }
      }
      current.add(line);
      previousBullet = bullet || previousBullet && isContinuation(line);
    }
    close(entries, current);
    return entries;
  }

  /** A wrapped list item: indented, or starting in lower case. */
  boolean isContinuation(TextLine line) {
    String text = line.getText();
    return line.getIndent() > 0 || !text.isEmpty() && Character.isLowerCase(text.charAt(0));
  }

  private static void close(List<List<TextLine>> entries, List<TextLine> current) {
    if (!current.isEmpty()) {
      entries.add(current);
    }
  }
}
