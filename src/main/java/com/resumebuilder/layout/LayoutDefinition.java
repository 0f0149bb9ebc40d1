package com.resumebuilder.layout;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class LayoutDefinition {
  private final String id;
  private final String name;
  private final String description;
  private final List<String> tags;
  private final LayoutStyle style;
  private final SectionTitles titles;

  LayoutDefinition(String id, String name, String description, List<String> tags,
      LayoutStyle style, SectionTitles titles) {
    this.id = id;
    this.name = name;
    this.description = description;
    this.tags = List.copyOf(tags);
    this.style = style;
    this.titles = titles;
  }

  @JsonProperty
  public String getId() {
    return id;
  }

  @JsonProperty
  public String getName() {
    return name;
  }

  @JsonProperty
  public String getDescription() {
    return description;
  }

  @JsonProperty
  public List<String> getTags() {
    return tags;
  }

  @JsonIgnore
  public LayoutStyle getStyle() {
    return style;
  }

  @JsonIgnore
  public SectionTitles getTitles() {
    return titles;
  }

  @Override
  public String toString() {
    return id;
  }
}
