package com.resumebuilder.extract;

final class DateRange {
  final String start;
  final String end;
  final boolean current;
  final int from;
  final int to;

  DateRange(String start, String end, boolean current, int from, int to) {
    this.start = start;
    this.end = end;
    this.current = current;
    this.from = from;
    this.to = to;
  }

  DateRange swapped() {
    return new DateRange(end, start, current, from, to);
  }

  /** The line with the date span removed and left-over brackets or separators trimmed. */
  String removeFrom(String line) {
    String rest = line.substring(0, from) + " " + line.substring(to);
    rest = rest.replaceAll("\\(\\s*\\)|\\[\\s*\\]", " ");
    rest = rest.replaceAll("^[\\s|,;:()\\[\\]—–-]+|[\\s|,;:()\\[\\]—–-]+$", "");
    return rest.replaceAll("\\s{2,}", " ");
  }
}
