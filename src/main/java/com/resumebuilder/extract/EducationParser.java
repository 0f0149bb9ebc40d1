package com.resumebuilder.extract;

import java.util.ArrayList;
import java.util.List;

import com.resumebuilder.Entity;
import com.resumebuilder.reader.TextLine;

class EducationParser {
  static final String DETAILS_SEPARATOR = "; ";

  private final ExtractionRules rules;
  private final EntryGrouper grouper;
  private final DateRangeMatcher dates;
  private final TitleParser titles = new TitleParser(TitleParser.DASH, TitleParser.COMMA);

  EducationParser(ExtractionRules rules, EntryGrouper grouper, DateRangeMatcher dates) {
    this.rules = rules;
    this.grouper = grouper;
    this.dates = dates;
  }

  List<Entity.Education> parse(List<TextLine> lines) {
    List<Entity.Education> educations = new ArrayList<>();
    for (List<TextLine> entry : grouper.group(lines, this::opensEntry)) {
      Entity.Education education = parseEntry(entry);
      if (education != null) {
        educations.add(education);
      }
    }
    return educations;
  }

  /** One degree per entry: a second line naming a degree starts the next one. */
  private boolean opensEntry(TextLine line, List<TextLine> entry) {
    if (rules.isBullet(line.getText()) || !rules.hasDegreeKeyword(line.getText())) {
      return false;
    }
    for (TextLine seen : entry) {
      if (rules.hasDegreeKeyword(seen.getText())) {
        return true;
      }
    }
    return false;
  }

  Entity.Education parseEntry(List<TextLine> entry) {
    Entity.Education education = new Entity.Education();
    List<String> details = new ArrayList<>();
    String title = null;

    for (TextLine line : entry) {
      String text = line.getText();
      if (title != null || rules.isBullet(text)) {
        String detail = rules.stripBullet(text);
        if (!detail.isEmpty()) {
          details.add(detail);
        }
        continue;
      }
      DateRange period = dates.find(text);
      if (period == null) {
        period = dates.findDate(text);
      }
      String remainder = period == null ? text : period.removeFrom(text);
      if (period != null) {
        details.add(text.substring(period.from, period.to).strip());
      }
      if (!remainder.isEmpty()) {
        title = remainder;
      }
    }

    if (title == null && details.isEmpty()) {
      return null;
    }
    if (title != null) {
      TitleParser.Parts parts = titles.parse(title);
      education.degree = parts.first;
      education.institution = parts.second;
      if (parts.rest != null && !parts.rest.isEmpty()) {
        details.add(0, parts.rest);
      }
    }
    education.details = details.isEmpty() ? null : String.join(DETAILS_SEPARATOR, details);
    return education;
  }
}
