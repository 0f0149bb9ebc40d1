package com.resumebuilder;

public class CorruptDocumentException extends ResumeException {
  private static final long serialVersionUID = 1L;

  public CorruptDocumentException(String message, Throwable cause) {
    super(ErrorKind.CORRUPT_DOCUMENT, message, cause);
  }
}
