package com.resumebuilder;

/**
 * Base class of every failure raised by the core. A partially extracted resume is not a
 * failure and never surfaces as one of these.
 */
public abstract class ResumeException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;

  protected ResumeException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  protected ResumeException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind getKind() {
    return kind;
  }
}
