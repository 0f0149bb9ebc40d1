package com.resumebuilder.extract;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.resumebuilder.reader.TextLine;

/**
 * Recognizes the heading of one section kind from its keyword set.
 * <p>
 * A line is a heading when its folded, undecorated text
 * <ul>
 *   <li>equals one of the keywords, or</li>
 *   <li>starts with a keyword, has at most {@value #MAX_PREFIX_WORDS} words and looks like a
 *       heading (layout hint, all capitals or a trailing colon), or</li>
 *   <li>carries the layout heading hint, has at most {@value #MAX_HINTED_WORDS} words and
 *       contains a keyword anywhere.</li>
 * </ul>
 */
final class HeadingMatcher {
  static final int MAX_PREFIX_WORDS = 4;
  static final int MAX_HINTED_WORDS = 5;

  /** Where a heading matched, used to break ties between section kinds. */
  static final class Match {
    final SectionKind kind;
    final int position;
    final int keywordLength;
    final int order;

    Match(SectionKind kind, int position, int keywordLength, int order) {
      this.kind = kind;
      this.position = position;
      this.keywordLength = keywordLength;
      this.order = order;
    }

    boolean beats(Match other) {
      if (position != other.position) {
        return position < other.position;
      }
      if (keywordLength != other.keywordLength) {
        return keywordLength > other.keywordLength;
      }
      return order < other.order;
    }
  }

  private final SectionKind kind;
  private final List<String> keywords;
  private final Pattern anyKeyword;
  private final int order;

  HeadingMatcher(SectionKind kind, List<String> keywords, int order) {
    this.kind = kind;
    this.keywords = keywords;
    this.anyKeyword = Text.wholeWords(keywords);
    this.order = order;
  }

  SectionKind getKind() {
    return kind;
  }

  /**
   * @return the match, or null when this line is not a heading of this kind
   */
  Match match(TextLine line, String folded) {
    if (keywords.contains(folded)) {
      return new Match(kind, 0, folded.length(), order);
    }
    int words = Text.wordCount(folded);
    Matcher matcher = anyKeyword.matcher(folded);
    if (!matcher.find()) {
      return null;
    }
    Match found = new Match(kind, matcher.start(), matcher.end() - matcher.start(), order);
    if (matcher.start() == 0 && words <= MAX_PREFIX_WORDS && looksLikeHeading(line)) {
      return found;
    }
    if (line.isHeadingLike() && words <= MAX_HINTED_WORDS) {
      return found;
    }
    return null;
  }

  private static boolean looksLikeHeading(TextLine line) {
    String text = line.getText();
    if (line.isHeadingLike() || text.endsWith(":")) {
      return true;
    }
    boolean hasLetter = false;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (Character.isLetter(c)) {
        hasLetter = true;
        if (Character.isLowerCase(c)) {
          return false;
        }
      }
    }
    return hasLetter;
  }
}
