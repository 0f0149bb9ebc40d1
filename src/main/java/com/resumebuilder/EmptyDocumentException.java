package com.resumebuilder;

public class EmptyDocumentException extends ResumeException {
  private static final long serialVersionUID = 1L;

  public EmptyDocumentException(String message) {
    super(ErrorKind.EMPTY_DOCUMENT, message);
  }
}
