package com.resumebuilder.extract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.resumebuilder.Resources;

/**
 * The heuristic tables behind extraction: section keywords, bullet markers, date words,
 * role and degree vocabularies. Loaded once from {@code /rules/extraction-rules.json} and
 * read-only afterwards.
 */
public final class ExtractionRules {
  public static final String DEFAULT_RESOURCE = "/rules/extraction-rules.json";

  private static final Pattern NUMBERED_BULLET = Pattern.compile("^\\d{1,2}[.)]\\s+");

  static class SectionEntity {
    @JsonProperty
    public SectionKind kind;

    @JsonProperty
    @JsonDeserialize(as=ArrayList.class, contentAs=String.class)
    public List<String> keywords;
  }

  static class RulesEntity {
    @JsonProperty
    @JsonDeserialize(as=ArrayList.class, contentAs=SectionEntity.class)
    public List<SectionEntity> sections;

    @JsonProperty
    public List<String> bulletMarkers;

    @JsonProperty
    public List<String> ongoingMarkers;

    @JsonProperty
    public List<String> sinceMarkers;

    @JsonProperty
    public List<String> rangeWords;

    @JsonProperty
    public Map<String, Integer> months;

    @JsonProperty
    public List<String> roleKeywords;

    @JsonProperty
    public List<String> degreeKeywords;

    @JsonProperty
    public List<String> headerNoise;

    @JsonProperty
    public List<String> contactLabels;
  }

  private static final class Holder {
    static final ExtractionRules DEFAULTS = load(DEFAULT_RESOURCE);
  }

  private final Map<SectionKind, List<String>> sectionKeywords;
  private final List<String> bulletMarkers;
  private final List<String> ongoingMarkers;
  private final List<String> sinceMarkers;
  private final List<String> rangeWords;
  private final Map<String, Integer> months;
  private final Pattern roleKeywords;
  private final Pattern degreeKeywords;
  private final List<String> headerNoise;
  private final List<String> contactLabels;

  private ExtractionRules(RulesEntity entity) {
    Map<SectionKind, List<String>> sections = new LinkedHashMap<>();
    for (SectionEntity section : entity.sections) {
      List<String> folded = new ArrayList<>();
      section.keywords.forEach(keyword -> folded.add(Text.fold(keyword)));
      sections.put(section.kind, List.copyOf(folded));
    }
    this.sectionKeywords = Collections.unmodifiableMap(sections);
    this.bulletMarkers = List.copyOf(entity.bulletMarkers);
    this.ongoingMarkers = List.copyOf(entity.ongoingMarkers);
    this.sinceMarkers = List.copyOf(entity.sinceMarkers);
    this.rangeWords = List.copyOf(entity.rangeWords);
    Map<String, Integer> folded = new LinkedHashMap<>();
    entity.months.forEach((name, number) -> folded.put(Text.fold(name), number));
    this.months = Collections.unmodifiableMap(folded);
    this.roleKeywords = Text.wholeWords(entity.roleKeywords);
    this.degreeKeywords = Text.wholeWords(entity.degreeKeywords);
    this.headerNoise = foldAll(entity.headerNoise);
    this.contactLabels = foldAll(entity.contactLabels);
  }

  public static ExtractionRules defaults() {
    return Holder.DEFAULTS;
  }

  public static ExtractionRules load(String resource) {
    return new ExtractionRules(Resources.loadJson(resource, RulesEntity.class));
  }

  private static List<String> foldAll(List<String> values) {
    List<String> folded = new ArrayList<>(values.size());
    values.forEach(value -> folded.add(Text.fold(value)));
    return List.copyOf(folded);
  }

  /** Section keywords in declaration order, already folded. */
  public Map<SectionKind, List<String>> getSectionKeywords() {
    return sectionKeywords;
  }

  public List<String> getOngoingMarkers() {
    return ongoingMarkers;
  }

  public List<String> getSinceMarkers() {
    return sinceMarkers;
  }

  public List<String> getRangeWords() {
    return rangeWords;
  }

  /** Month names and abbreviations (folded) to month number. */
  public Map<String, Integer> getMonths() {
    return months;
  }

  public boolean isBullet(String text) {
    return bulletLength(text) > 0;
  }

  /**
   * Removes a leading list marker, returning the text unchanged when there is none.
   */
  public String stripBullet(String text) {
    int length = bulletLength(text);
    return length == 0 ? text : text.substring(length).strip();
  }

  private int bulletLength(String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    Matcher numbered = NUMBERED_BULLET.matcher(text);
    if (numbered.find()) {
      return numbered.end();
    }
    for (String marker : bulletMarkers) {
      if (!text.startsWith(marker)) {
        continue;
      }
      String rest = text.substring(marker.length());
      // dash-like markers need a following space, otherwise "-" is part of the word
      if (!isDashLike(marker) || rest.isEmpty() || Character.isWhitespace(rest.charAt(0))) {
        return marker.length();
      }
    }
    return 0;
  }

  private static boolean isDashLike(String marker) {
    return "-".equals(marker) || "–".equals(marker) || "—".equals(marker)
        || "*".equals(marker) || ">".equals(marker);
  }

  public boolean hasRoleKeyword(String text) {
    return roleKeywords.matcher(Text.fold(text)).find();
  }

  public boolean hasDegreeKeyword(String text) {
    return degreeKeywords.matcher(Text.fold(text)).find();
  }

  public boolean isHeaderNoise(String text) {
    return headerNoise.contains(Text.undecorate(Text.fold(text)));
  }

  public boolean isContactLabel(String text) {
    return contactLabels.contains(Text.undecorate(Text.fold(text)));
  }
}
