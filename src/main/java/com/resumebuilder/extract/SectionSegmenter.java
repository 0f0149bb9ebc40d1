package com.resumebuilder.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.resumebuilder.reader.TextLine;

/**
 * Splits the line sequence into sections at recognized headings.
 * <p>
 * Matchers run independently, one per section kind; when several claim the same line the
 * keyword found earliest in the line wins, then the longer keyword, then declaration order.
 */
public class SectionSegmenter {
  private static final Logger LOGGER = LoggerFactory.getLogger(SectionSegmenter.class);

  private final List<HeadingMatcher> matchers = new ArrayList<>();
  private final ExtractionRules rules;

  public SectionSegmenter(ExtractionRules rules) {
    this.rules = rules;
    int order = 0;
    for (Map.Entry<SectionKind, List<String>> entry : rules.getSectionKeywords().entrySet()) {
      matchers.add(new HeadingMatcher(entry.getKey(), entry.getValue(), order++));
    }
  }

  public List<Section> segment(List<TextLine> lines) {
    List<Section> sections = new ArrayList<>();
    SectionKind kind = SectionKind.UNASSIGNED;
    String heading = null;
    List<TextLine> current = new ArrayList<>();

    for (TextLine line : lines) {
      SectionKind detected = line.isBlank() ? null : detect(line);
      if (detected == null) {
        current.add(line);
        continue;
      }
      if (kind != SectionKind.UNASSIGNED || !current.isEmpty()) {
        sections.add(new Section(kind, heading, trimBlanks(current)));
      }
      kind = detected;
      heading = line.getText();
      current = new ArrayList<>();
    }
    if (kind != SectionKind.UNASSIGNED || !current.isEmpty()) {
      sections.add(new Section(kind, heading, trimBlanks(current)));
    }
    return sections;
  }

  /**
   * @return the section kind this line opens, or null when it is ordinary content
   */
  public SectionKind detect(TextLine line) {
    if (rules.isBullet(line.getText())) {
      return null;
    }
    String folded = Text.undecorate(Text.fold(line.getText()));
    if (folded.isEmpty()) {
      return null;
    }
    HeadingMatcher.Match best = null;
    for (HeadingMatcher matcher : matchers) {
      HeadingMatcher.Match match = matcher.match(line, folded);
      if (match != null && (best == null || match.beats(best))) {
        best = match;
      }
    }
    if (best != null) {
      LOGGER.debug("Heading '{}' opens {}", line.getText(), best.kind);
      return best.kind;
    }
    return null;
  }

  private static List<TextLine> trimBlanks(List<TextLine> lines) {
    int from = 0;
    int to = lines.size();
    while (from < to && lines.get(from).isBlank()) {
      from++;
    }
    while (to > from && lines.get(to - 1).isBlank()) {
      to--;
    }
    return lines.subList(from, to);
  }
}
