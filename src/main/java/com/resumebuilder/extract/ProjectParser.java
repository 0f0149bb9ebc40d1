package com.resumebuilder.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.resumebuilder.Entity;
import com.resumebuilder.reader.TextLine;

class ProjectParser {
  private static final Pattern URL = Pattern.compile(
      "(?i)(?:https?://|www\\.)[^\\s|,;•()]+|(?<![\\w.@])(?:github|gitlab|bitbucket)\\.(?:com|org)/[^\\s|,;•()]+");
  private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.,;:]+$");
  private static final Pattern EDGE_SEPARATORS = Pattern.compile("^[\\s|:—–-]+|[\\s|:—–-]+$");

  private final ExtractionRules rules;
  private final EntryGrouper grouper;
  private final TitleParser titles = new TitleParser(TitleParser.COLON, TitleParser.DASH);

  ProjectParser(ExtractionRules rules, EntryGrouper grouper) {
    this.rules = rules;
    this.grouper = grouper;
  }

  List<Entity.Project> parse(List<TextLine> lines) {
    List<Entity.Project> projects = new ArrayList<>();
    for (List<TextLine> entry : grouper.group(lines, this::opensEntry)) {
      Entity.Project project = parseEntry(entry);
      if (project != null) {
        projects.add(project);
      }
    }
    return projects;
  }

  /** In a "Name: description" list, every line in that shape is its own project. */
  private boolean opensEntry(TextLine line, List<TextLine> entry) {
    return !rules.isBullet(line.getText())
        && !grouper.isContinuation(line)
        && titles.parse(line.getText()).split
        && titles.parse(entry.get(0).getText()).split;
  }

  Entity.Project parseEntry(List<TextLine> entry) {
    Entity.Project project = new Entity.Project();
    List<String> description = new ArrayList<>();
    String title = null;

    for (TextLine line : entry) {
      String text = line.getText();
      if (project.link == null) {
        Matcher url = URL.matcher(text);
        if (url.find()) {
          project.link = TRAILING_PUNCTUATION.matcher(url.group()).replaceAll("");
          text = (text.substring(0, url.start()) + " " + text.substring(url.end())).strip();
          text = EDGE_SEPARATORS.matcher(text).replaceAll("").replaceAll("\\(\\s*\\)", "").strip();
        }
      }
      if (text.isEmpty()) {
        continue;
      }
      if (title == null && !rules.isBullet(text)) {
        title = text;
      } else {
        description.add(rules.stripBullet(text));
      }
    }

    if (title == null && description.isEmpty() && project.link == null) {
      return null;
    }
    if (title != null) {
      TitleParser.Parts parts = titles.parse(title);
      project.name = parts.first;
      if (parts.rest != null && !parts.rest.isEmpty()) {
        description.add(0, parts.rest);
      }
      if (parts.second != null) {
        description.add(0, parts.second);
      }
    }
    project.description = description.isEmpty() ? null : String.join(" ", description);
    return project;
  }
}
