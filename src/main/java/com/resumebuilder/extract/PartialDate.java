package com.resumebuilder.extract;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

final class PartialDate {
  private static final Pattern YEAR = Pattern.compile("(?<!\\d)((?:19|20)\\d{2})(?!\\d)");
  private static final Pattern MONTH_FIRST = Pattern.compile("^(\\d{1,2})[/.](\\d{4})$");
  private static final Pattern YEAR_FIRST = Pattern.compile("^(\\d{4})[/.-](\\d{1,2})$");
  private static final Pattern LETTERS = Pattern.compile("\\p{L}+");

  final int year;
  /** 1-12, or 0 when only the year is known. */
  final int month;

  private PartialDate(int year, int month) {
    this.year = year;
    this.month = month;
  }

  static PartialDate parse(String raw, Map<String, Integer> months) {
    if (raw == null) {
      return null;
    }
    String text = raw.strip();
    Matcher numeric = MONTH_FIRST.matcher(text);
    if (numeric.matches()) {
      return of(Integer.parseInt(numeric.group(2)), Integer.parseInt(numeric.group(1)));
    }
    numeric = YEAR_FIRST.matcher(text);
    if (numeric.matches()) {
      return of(Integer.parseInt(numeric.group(1)), Integer.parseInt(numeric.group(2)));
    }
    Matcher year = YEAR.matcher(text);
    if (!year.find()) {
      return null;
    }
    int month = 0;
    Matcher word = LETTERS.matcher(Text.fold(text));
    while (word.find()) {
      Integer number = months.get(word.group());
      if (number != null) {
        month = number;
        break;
      }
    }
    return of(Integer.parseInt(year.group(1)), month);
  }

  private static PartialDate of(int year, int month) {
    if (month < 0 || month > 12) {
      return null;
    }
    return new PartialDate(year, month);
  }

  /** True only when this date is certainly later than the other one. */
  boolean isAfter(PartialDate other) {
    if (year != other.year) {
      return year > other.year;
    }
    return month != 0 && other.month != 0 && month > other.month;
  }
}
