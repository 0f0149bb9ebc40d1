package com.resumebuilder.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits an entry's first line into a primary and a secondary part using an ordered list
 * of separator patterns; the first pattern present in the line wins.
 */
final class TitleParser {
  /** Dash, en/em dash or pipe between two parts. */
  static final Pattern DASH = Pattern.compile("\\s*[—–]\\s*|\\s+-\\s+|\\s+\\|\\s+|\\s*\\|\\s*");
  /** "Engineer at Acme", "Analista na Empresa", "Dev @ Corp". */
  static final Pattern WORD = Pattern.compile("\\s+(?:at|@|na|no|em)\\s+", Pattern.CASE_INSENSITIVE);
  static final Pattern COMMA = Pattern.compile("\\s*,\\s+");
  static final Pattern COLON = Pattern.compile("\\s*:\\s+");

  static final class Parts {
    final String first;
    final String second;
    /** Anything after a further separator, kept for a catch-all field. */
    final String rest;
    final boolean split;

    Parts(String first, String second, String rest, boolean split) {
      this.first = first;
      this.second = second;
      this.rest = rest;
      this.split = split;
    }
  }

  private final List<Pattern> separators;

  TitleParser(Pattern... separators) {
    this.separators = List.of(separators);
  }

  Parts parse(String line) {
    String text = line.strip();
    for (Pattern separator : separators) {
      Matcher matcher = separator.matcher(text);
      if (!matcher.find() || matcher.start() == 0 || matcher.end() == text.length()) {
        continue;
      }
      String first = text.substring(0, matcher.start()).strip();
      String tail = text.substring(matcher.end()).strip();
      Matcher further = separator.matcher(tail);
      if (further.find() && further.start() > 0) {
        return new Parts(first, tail.substring(0, further.start()).strip(),
            tail.substring(further.end()).strip(), true);
      }
      return new Parts(first, tail, null, true);
    }
    return new Parts(text, null, null, false);
  }

  /** Splits on every occurrence of the first matching separator. */
  List<String> splitAll(String line) {
    String text = line.strip();
    for (Pattern separator : separators) {
      if (separator.matcher(text).find()) {
        List<String> parts = new ArrayList<>();
        for (String part : separator.split(text)) {
          if (!part.isBlank()) {
            parts.add(part.strip());
          }
        }
        return parts;
      }
    }
    return List.of(text);
  }
}
