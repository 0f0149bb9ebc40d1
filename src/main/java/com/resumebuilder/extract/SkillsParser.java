package com.resumebuilder.extract;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.resumebuilder.reader.TextLine;

public class SkillsParser {
  private static final Pattern DELIMITERS = Pattern.compile("\\s*[,;|•·●▪◦‣]\\s*");
  private static final Pattern CATEGORY = Pattern.compile("^([\\p{L}][\\p{L} /&-]{0,30}):\\s*(.+)$");
  private static final int MAX_CATEGORY_WORDS = 3;
  private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.;:]+$");

  private final ExtractionRules rules;

  SkillsParser(ExtractionRules rules) {
    this.rules = rules;
  }

  List<String> parse(List<TextLine> lines) {
    List<String> skills = new ArrayList<>();
    for (TextLine line : lines) {
      if (line.isBlank()) {
        continue;
      }
      for (String segment : line.getSegments()) {
        String text = rules.stripBullet(segment);
        Matcher category = CATEGORY.matcher(text);
        if (category.matches() && Text.wordCount(category.group(1)) <= MAX_CATEGORY_WORDS) {
          text = category.group(2);
        }
        for (String token : DELIMITERS.split(text)) {
          String skill = TRAILING_PUNCTUATION.matcher(rules.stripBullet(token.strip())).replaceAll("").strip();
          if (!skill.isEmpty()) {
            skills.add(skill);
          }
        }
      }
    }
    return distinct(skills);
  }

  /** Case-insensitive de-duplication preserving first-seen spelling and order. */
  public static List<String> distinct(List<String> skills) {
    Map<String, String> unique = new LinkedHashMap<>();
    for (String skill : skills) {
      if (skill == null || skill.isBlank()) {
        continue;
      }
      String trimmed = skill.strip();
      unique.putIfAbsent(trimmed.toLowerCase(Locale.ROOT), trimmed);
    }
    return new ArrayList<>(unique.values());
  }
}
