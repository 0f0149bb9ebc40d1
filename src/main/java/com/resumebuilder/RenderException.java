package com.resumebuilder;

public class RenderException extends ResumeException {
  private static final long serialVersionUID = 1L;

  public RenderException(String message, Throwable cause) {
    super(ErrorKind.RENDER_ERROR, message, cause);
  }
}
