package com.resumebuilder;

public class UnknownLayoutException extends ResumeException {
  private static final long serialVersionUID = 1L;

  private final String layoutId;

  public UnknownLayoutException(String layoutId) {
    super(ErrorKind.UNKNOWN_LAYOUT, "Unknown layout: " + layoutId);
    this.layoutId = layoutId;
  }

  public String getLayoutId() {
    return layoutId;
  }
}
