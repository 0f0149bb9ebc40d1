package com.resumebuilder.reader;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

public final class LineNormalizer {
  private static final Pattern CONTROL = Pattern.compile("[\\p{Cc}&&[^\\t]]|[\\u200B-\\u200D\\uFEFF]");
  private static final Pattern ODD_SPACES = Pattern.compile("[\\u00A0\\u2007\\u202F\\u2000-\\u2006\\u2008-\\u200A]");
  private static final Pattern NEWLINES = Pattern.compile("\\r\\n?|\\n|\\u2028|\\u2029|\\f");

  private LineNormalizer() {
  }

  /**
   * NFC-normalizes, drops control and zero-width characters, turns exotic spaces into plain
   * ones and trims. Tabs and space runs survive so segments can still be told apart.
   */
  public static String clean(String raw) {
    if (raw == null) {
      return "";
    }
    String text = Normalizer.normalize(raw, Normalizer.Form.NFC);
    text = CONTROL.matcher(text).replaceAll("");
    text = ODD_SPACES.matcher(text).replaceAll(" ");
    return text.strip();
  }

  /**
   * Splits free text into lines: one {@link TextLine} per source line, consecutive blank
   * lines collapsed and leading/trailing blanks removed.
   */
  public static List<TextLine> fromText(String text) {
    List<TextLine> lines = new ArrayList<>();
    if (text == null) {
      return lines;
    }
    for (String raw : NEWLINES.split(text, -1)) {
      lines.add(TextLine.of(raw, false, leadingIndent(raw)));
    }
    return tidy(lines);
  }

  /**
   * Collapses blank runs to a single blank line and strips blanks at both ends.
   */
  public static List<TextLine> tidy(List<TextLine> lines) {
    List<TextLine> out = new ArrayList<>(lines.size());
    for (TextLine line : lines) {
      if (line.isBlank()) {
        if (!out.isEmpty() && !out.get(out.size() - 1).isBlank()) {
          out.add(TextLine.blank());
        }
      } else {
        out.add(line);
      }
    }
    while (!out.isEmpty() && out.get(out.size() - 1).isBlank()) {
      out.remove(out.size() - 1);
    }
    return out;
  }

  private static int leadingIndent(String raw) {
    if (raw == null) {
      return 0;
    }
    int width = 0;
    for (int i = 0; i < raw.length(); i++) {
      char c = raw.charAt(i);
      if (c == ' ') {
        width++;
      } else if (c == '\t') {
        width += 4;
      } else {
        break;
      }
    }
    return width / 4;
  }
}
