package com.resumebuilder.extract;

import java.text.Normalizer;
import java.util.Collection;
import java.util.Locale;
import java.util.regex.Pattern;

final class Text {
  private static final Pattern MARKS = Pattern.compile("\\p{M}+");
  private static final Pattern EDGE_DECORATION = Pattern.compile("^[^\\p{L}\\p{N}]+|[^\\p{L}\\p{N}]+$");
  private static final Pattern WORD_SPLIT = Pattern.compile("\\s+");

  private Text() {
  }

  /** Lower-cases and removes diacritics: "Experiência" becomes "experiencia". */
  static String fold(String text) {
    if (text == null) {
      return "";
    }
    String decomposed = Normalizer.normalize(text, Normalizer.Form.NFD);
    return MARKS.matcher(decomposed).replaceAll("").toLowerCase(Locale.ROOT);
  }

  /** Strips leading and trailing punctuation/decoration ("## Skills:" becomes "Skills"). */
  static String undecorate(String text) {
    return EDGE_DECORATION.matcher(text).replaceAll("");
  }

  static int wordCount(String text) {
    String trimmed = text.strip();
    return trimmed.isEmpty() ? 0 : WORD_SPLIT.split(trimmed).length;
  }

  /** Pattern matching any of the folded phrases as whole words. */
  static Pattern wholeWords(Collection<String> phrases) {
    StringBuilder alternation = new StringBuilder();
    phrases.stream()
        .map(Text::fold)
        .sorted((a, b) -> b.length() - a.length())
        .forEach(phrase -> {
          if (alternation.length() > 0) {
            alternation.append('|');
          }
          alternation.append(Pattern.quote(phrase));
        });
    return Pattern.compile("(?<![\\p{L}\\p{N}])(?:" + alternation + ")(?![\\p{L}\\p{N}])");
  }

  static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  static String emptyToNull(String value) {
    return isBlank(value) ? null : value.strip();
  }
}
