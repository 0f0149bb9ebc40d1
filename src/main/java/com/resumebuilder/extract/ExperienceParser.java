package com.resumebuilder.extract;

import java.util.ArrayList;
import java.util.List;

import com.resumebuilder.Entity;
import com.resumebuilder.reader.TextLine;

/**
 * Builds experience entries: title line into role/organization, the first period found
 * anywhere in the entry into start/end dates, list items into achievements and any other
 * line into the free-text description.
 */
class ExperienceParser {
  private final ExtractionRules rules;
  private final EntryGrouper grouper;
  private final DateRangeMatcher dates;
  private final TitleParser titles = new TitleParser(TitleParser.DASH, TitleParser.WORD);

  ExperienceParser(ExtractionRules rules, EntryGrouper grouper, DateRangeMatcher dates) {
    this.rules = rules;
    this.grouper = grouper;
    this.dates = dates;
  }

  List<Entity.Experience> parse(List<TextLine> lines) {
    List<Entity.Experience> experiences = new ArrayList<>();
    for (List<TextLine> group : grouper.group(lines)) {
      for (List<TextLine> entry : splitOnPeriods(group)) {
        experiences.add(parseEntry(entry));
      }
    }
    return experiences;
  }

  /**
   * Jobs listed without blank lines or bullets between them still carry one period each.
   * A second period starts a new entry, taking along the plain line just before it when
   * that line is the new job's title.
   */
  List<List<TextLine>> splitOnPeriods(List<TextLine> group) {
    List<List<TextLine>> entries = new ArrayList<>();
    List<TextLine> current = new ArrayList<>();
    boolean hasPeriod = false;
    for (TextLine line : group) {
      boolean period = !rules.isBullet(line.getText()) && dates.find(line.getText()) != null;
      if (period && hasPeriod) {
        TextLine title = null;
        TextLine last = current.get(current.size() - 1);
        if (current.size() > 2 && !rules.isBullet(last.getText()) && dates.find(last.getText()) == null) {
          title = current.remove(current.size() - 1);
        }
        entries.add(current);
        current = new ArrayList<>();
        if (title != null) {
          current.add(title);
        }
        hasPeriod = false;
      }
      current.add(line);
      hasPeriod |= period;
    }
    if (!current.isEmpty()) {
      entries.add(current);
    }
    return entries;
  }

  Entity.Experience parseEntry(List<TextLine> entry) {
    Entity.Experience experience = new Entity.Experience();
    List<String> description = new ArrayList<>();
    DateRange range = null;
    String title = null;

    for (TextLine line : entry) {
      String text = line.getText();
      DateRange found = range == null && !rules.isBullet(text) ? dates.find(text) : null;
      String body = text;
      if (found != null) {
        range = found;
        body = found.removeFrom(text);
        if (body.isEmpty()) {
          continue;
        }
      }
      if (title == null && !rules.isBullet(body)) {
        title = body;
      } else {
        addBody(experience, description, line, body);
      }
    }

    if (title != null) {
      TitleParser.Parts parts = titles.parse(title);
      if (parts.split && rules.hasRoleKeyword(parts.second) && !rules.hasRoleKeyword(parts.first)) {
        experience.role = parts.second;
        experience.organization = parts.first;
      } else {
        experience.role = parts.first;
        experience.organization = parts.second;
      }
      if (parts.rest != null && !parts.rest.isEmpty()) {
        description.add(0, parts.rest);
      }
    }
    if (range != null) {
      experience.startDate = range.start;
      experience.endDate = range.end;
      experience.current = range.current;
    }
    experience.description = description.isEmpty() ? null : String.join(" ", description);
    return experience;
  }

  private void addBody(Entity.Experience experience, List<String> description, TextLine line, String text) {
    if (rules.isBullet(text)) {
      String achievement = rules.stripBullet(text);
      if (!achievement.isEmpty()) {
        experience.achievements.add(achievement);
      }
    } else if (!experience.achievements.isEmpty() && grouper.isContinuation(line)) {
      int last = experience.achievements.size() - 1;
      experience.achievements.set(last, experience.achievements.get(last) + " " + text);
    } else {
      description.add(text);
    }
  }
}
