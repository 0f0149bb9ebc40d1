package com.resumebuilder.extract;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds employment/study periods in text using an ordered list of patterns:
 * <ol>
 *   <li>{@code <date> <separator> <date | ongoing marker>}, e.g. "Jan 2020 - Atual",
 *       "03/2018 até 12/2019", "2015 – 2019";</li>
 *   <li>{@code <since marker> <date>}, e.g. "desde 2021", meaning an ongoing period.</li>
 * </ol>
 * Dates are {@code Mon YYYY}, {@code Mês de YYYY}, {@code MM/YYYY}, {@code MM.YYYY},
 * {@code YYYY-MM}, {@code YYYY/MM} or a bare {@code YYYY}.
 */
final class DateRangeMatcher {
  private static final Logger LOGGER = LoggerFactory.getLogger(DateRangeMatcher.class);

  private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
  private static final String YEAR = "(?:19|20)\\d{2}";

  private final ExtractionRules rules;
  private final List<Pattern> patterns = new ArrayList<>();
  private final Pattern datePattern;

  DateRangeMatcher(ExtractionRules rules) {
    this.rules = rules;
    String month = "(?:" + alternation(rules.getMonths().keySet(), true) + ")";
    String date = "(?<![\\p{L}\\d])(?:"
        + month + "\\.?(?:\\s+de)?[\\s/.-]*" + YEAR
        + "|\\d{1,2}[/.]" + YEAR
        + "|" + YEAR + "[/.](?:0?[1-9]|1[0-2])"
        + "|" + YEAR + "-(?:0[1-9]|1[0-2])"
        + "|" + YEAR
        + ")(?!\\d)";
    String ongoing = "(?:" + alternation(rules.getOngoingMarkers(), false) + ")(?![\\p{L}])";
    String separator = "(?:\\s*[-–—~]\\s*|\\s+(?:" + alternation(rules.getRangeWords(), false) + ")\\s+)";
    String since = "(?<![\\p{L}])(?:" + alternation(rules.getSinceMarkers(), false) + ")\\s+";

    patterns.add(Pattern.compile("(?<start>" + date + ")" + separator
        + "(?:(?<end>" + date + ")|(?<ongoing>" + ongoing + "))", FLAGS));
    patterns.add(Pattern.compile(since + "(?<start>" + date + ")", FLAGS));
    datePattern = Pattern.compile(date, FLAGS);
  }

  /**
   * @return the first period found in the text, or null
   */
  DateRange find(String text) {
    for (Pattern pattern : patterns) {
      Matcher matcher = pattern.matcher(text);
      if (!matcher.find()) {
        continue;
      }
      String start = matcher.group("start").strip();
      String end = groupOrNull(matcher, "end");
      String ongoing = groupOrNull(matcher, "ongoing");
      boolean current = end == null;
      DateRange range = new DateRange(start, end != null ? end : ongoing, current,
          matcher.start(), matcher.end());
      return ordered(range);
    }
    return null;
  }

  /** Finds a lone date (a graduation year, say) when no full period is present. */
  DateRange findDate(String text) {
    Matcher matcher = datePattern.matcher(text);
    if (!matcher.find()) {
      return null;
    }
    return new DateRange(matcher.group().strip(), null, false, matcher.start(), matcher.end());
  }

  private DateRange ordered(DateRange range) {
    if (range.current || range.end == null) {
      return range;
    }
    PartialDate start = PartialDate.parse(range.start, rules.getMonths());
    PartialDate end = PartialDate.parse(range.end, rules.getMonths());
    if (start != null && end != null && start.isAfter(end)) {
      LOGGER.debug("Swapping reversed period {} - {}", range.start, range.end);
      return range.swapped();
    }
    return range;
  }

  private static String groupOrNull(Matcher matcher, String group) {
    try {
      String value = matcher.group(group);
      return value == null ? null : value.strip();
    } catch (IllegalArgumentException e) {
      // group absent from this pattern
      return null;
    }
  }

  private static String alternation(Collection<String> words, boolean accentInsensitive) {
    List<String> sorted = new ArrayList<>(words);
    sorted.sort((a, b) -> b.length() - a.length());
    StringBuilder out = new StringBuilder();
    for (String word : sorted) {
      if (out.length() > 0) {
        out.append('|');
      }
      out.append(accentInsensitive ? accentClass(word) : Pattern.quote(word).replace(" ", "\\E\\s+\\Q"));
    }
    return out.toString();
  }

  /** "marco" also matches "março". */
  private static String accentClass(String folded) {
    StringBuilder out = new StringBuilder();
    for (char c : folded.toCharArray()) {
      switch (c) {
        case 'a': out.append("[aáàâã]"); break;
        case 'e': out.append("[eéê]"); break;
        case 'i': out.append("[ií]"); break;
        case 'o': out.append("[oóôõ]"); break;
        case 'u': out.append("[uúü]"); break;
        case 'c': out.append("[cç]"); break;
        default: out.append(Pattern.quote(String.valueOf(c)));
      }
    }
    return out.toString();
  }
}
