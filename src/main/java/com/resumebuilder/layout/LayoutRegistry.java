package com.resumebuilder.layout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.resumebuilder.Entity;
import com.resumebuilder.Resources;
import com.resumebuilder.UnknownLayoutException;

/**
 * The fixed layout catalog, read from {@code layouts.json} on first use and never changed
 * afterwards. Lookups need no locking since nothing writes after construction.
 */
public final class LayoutRegistry {
  private static final Logger LOGGER = LoggerFactory.getLogger(LayoutRegistry.class);

  public static final String CATALOG_RESOURCE = "/layouts.json";

  private static final Pattern KEBAB_CASE = Pattern.compile("[a-z0-9]+(?:-[a-z0-9]+)*");

  private static final class Holder {
    static final LayoutRegistry INSTANCE = load(CATALOG_RESOURCE);
  }

  private final Map<String, LayoutDefinition> layouts;
  private final List<LayoutDefinition> ordered;
  private final String untitledName;
  private final String ongoingLabel;

  private LayoutRegistry(Map<String, LayoutDefinition> layouts, String untitledName, String ongoingLabel) {
    this.layouts = Collections.unmodifiableMap(layouts);
    this.ordered = List.copyOf(layouts.values());
    this.untitledName = untitledName;
    this.ongoingLabel = ongoingLabel;
  }

  public static LayoutRegistry getInstance() {
    return Holder.INSTANCE;
  }

  static LayoutRegistry load(String resource) {
    Entity.LayoutCatalogEntity catalog = Resources.loadJson(resource, Entity.LayoutCatalogEntity.class);
    if (catalog.layouts == null || catalog.layouts.isEmpty()) {
      throw new IllegalStateException("Layout catalog " + resource + " declares no layouts");
    }

    Map<String, LayoutDefinition> layouts = new LinkedHashMap<>();
    for (Entity.LayoutEntity entity : catalog.layouts) {
      LayoutDefinition layout = toDefinition(entity);
      if (layouts.putIfAbsent(layout.getId(), layout) != null) {
        throw new IllegalStateException("Duplicate layout id '" + layout.getId() + "' in " + resource);
      }
    }
    LOGGER.info("Loaded {} layouts: {}", layouts.size(), layouts.keySet());
    String untitled = catalog.untitledName == null ? "" : catalog.untitledName;
    String ongoing = catalog.ongoingLabel == null ? "" : catalog.ongoingLabel;
    return new LayoutRegistry(layouts, untitled, ongoing);
  }

  private static LayoutDefinition toDefinition(Entity.LayoutEntity entity) {
    if (entity.id == null || !KEBAB_CASE.matcher(entity.id).matches()) {
      throw new IllegalStateException("Layout id must be kebab-case: " + entity.id);
    }
    if (entity.style == null || entity.headings == null) {
      throw new IllegalStateException("Layout '" + entity.id + "' needs both style and headings");
    }

    Entity.StyleEntity s = entity.style;
    LayoutStyle style;
    try {
      style = new LayoutStyle(
          s.accentColor,
          s.textColor,
          s.columns,
          Typography.valueOf(upper(s.typography, "SANS")),
          s.baseFontSize,
          HeaderAlignment.valueOf(upper(s.headerAlignment, "CENTER")),
          BulletStyle.valueOf(upper(s.bulletStyle, "BULLET")),
          s.skillSeparator == null ? ", " : s.skillSeparator);
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException("Layout '" + entity.id + "' has an invalid style: " + e.getMessage(), e);
    }

    Entity.Headings h = entity.headings;
    if (h.summary == null || h.experience == null || h.education == null || h.skills == null || h.projects == null) {
      throw new IllegalStateException("Layout '" + entity.id + "' must title every section");
    }
    SectionTitles titles = new SectionTitles(h.summary, h.experience, h.education, h.skills, h.projects);
    List<String> tags = entity.tags == null ? new ArrayList<>() : entity.tags;
    return new LayoutDefinition(entity.id, entity.name, entity.description, tags, style, titles);
  }

  private static String upper(String value, String fallback) {
    return value == null ? fallback : value.toUpperCase(Locale.ROOT);
  }

  /**
   * @throws UnknownLayoutException when no layout has this identifier
   */
  public LayoutDefinition get(String id) {
    LayoutDefinition layout = id == null ? null : layouts.get(id);
    if (layout == null) {
      LOGGER.warn("Tried to use non-existent layout: {}", id);
      throw new UnknownLayoutException(id);
    }
    return layout;
  }

  /**
   * @return every layout in catalog order
   */
  public List<LayoutDefinition> list() {
    return ordered;
  }

  /** Name printed in the header when the resume has none. */
  public String getUntitledName() {
    return untitledName;
  }

  /** End label of a period that is still running and has no end text of its own. */
  public String getOngoingLabel() {
    return ongoingLabel;
  }
}
