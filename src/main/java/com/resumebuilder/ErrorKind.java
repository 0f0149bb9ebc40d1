package com.resumebuilder;

public enum ErrorKind {
  UNSUPPORTED_FORMAT,
  CORRUPT_DOCUMENT,
  EMPTY_DOCUMENT,
  UNKNOWN_LAYOUT,
  RENDER_ERROR;
}
