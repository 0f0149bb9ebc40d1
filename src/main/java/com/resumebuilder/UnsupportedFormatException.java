package com.resumebuilder;

public class UnsupportedFormatException extends ResumeException {
  private static final long serialVersionUID = 1L;

  public UnsupportedFormatException(String message) {
    super(ErrorKind.UNSUPPORTED_FORMAT, message);
  }
}
