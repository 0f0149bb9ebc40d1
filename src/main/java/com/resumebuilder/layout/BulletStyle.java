package com.resumebuilder.layout;

public enum BulletStyle {
  BULLET,
  NUMBERED;

  /**
   * @param index zero-based position in the list
   * @return the marker text, including its trailing space
   */
  public String marker(int index) {
    return this == NUMBERED ? (index + 1) + ". " : "• ";
  }
}
