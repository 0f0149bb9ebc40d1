package com.resumebuilder.layout;

import java.util.Locale;
import java.util.regex.Pattern;

public final class LayoutStyle {
  private static final Pattern HEX_COLOR = Pattern.compile("#[0-9A-Fa-f]{6}");

  private final String accentColor;
  private final String textColor;
  private final int columns;
  private final Typography typography;
  private final float baseFontSize;
  private final HeaderAlignment headerAlignment;
  private final BulletStyle bulletStyle;
  private final String skillSeparator;

  LayoutStyle(String accentColor, String textColor, int columns, Typography typography,
      float baseFontSize, HeaderAlignment headerAlignment, BulletStyle bulletStyle, String skillSeparator) {
    this.accentColor = color(accentColor, "accentColor");
    this.textColor = color(textColor, "textColor");
    if (columns != 1 && columns != 2) {
      throw new IllegalArgumentException("columns must be 1 or 2, was " + columns);
    }
    if (baseFontSize <= 0) {
      throw new IllegalArgumentException("baseFontSize must be positive, was " + baseFontSize);
    }
    this.columns = columns;
    this.typography = typography;
    this.baseFontSize = baseFontSize;
    this.headerAlignment = headerAlignment;
    this.bulletStyle = bulletStyle;
    this.skillSeparator = skillSeparator;
  }

  private static String color(String value, String field) {
    if (value == null || !HEX_COLOR.matcher(value).matches()) {
      throw new IllegalArgumentException(field + " must be a #RRGGBB color, was " + value);
    }
    return value.toUpperCase(Locale.ROOT);
  }

  /** @return the accent as {@code #RRGGBB} */
  public String getAccentColor() {
    return accentColor;
  }

  /** @return the accent as {@code RRGGBB}, the form Word run colors take */
  public String getAccentHex() {
    return accentColor.substring(1);
  }

  public String getTextColor() {
    return textColor;
  }

  public String getTextHex() {
    return textColor.substring(1);
  }

  public int getColumns() {
    return columns;
  }

  public boolean isTwoColumn() {
    return columns == 2;
  }

  public Typography getTypography() {
    return typography;
  }

  public float getBaseFontSize() {
    return baseFontSize;
  }

  public HeaderAlignment getHeaderAlignment() {
    return headerAlignment;
  }

  public BulletStyle getBulletStyle() {
    return bulletStyle;
  }

  public String getSkillSeparator() {
    return skillSeparator;
  }
}
