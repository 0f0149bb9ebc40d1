package com.resumebuilder.layout;

import java.util.Locale;

public enum HeaderAlignment {
  LEFT,
  CENTER;

  public String cssValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
