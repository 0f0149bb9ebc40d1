package com.resumebuilder.render;

import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.resumebuilder.UnsupportedFormatException;

public enum OutputFormat {
  PDF("pdf", "application/pdf"),
  DOCX("docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document");

  private static final Logger LOGGER = LoggerFactory.getLogger(OutputFormat.class);

  public final String id;
  public final String mediaType;

  private OutputFormat(String id, String mediaType) {
    this.id = id;
    this.mediaType = mediaType;
  }

  /**
   * Accepts "pdf" or "docx" in any case, with or without a leading dot.
   * @throws UnsupportedFormatException for anything else
   */
  public static OutputFormat fromId(String value) {
    if (value != null) {
      String id = value.strip().toLowerCase(Locale.ROOT);
      if (id.startsWith(".")) {
        id = id.substring(1);
      }
      for (OutputFormat format : values()) {
        if (format.id.equals(id)) {
          return format;
        }
      }
    }
    LOGGER.warn("Tried to render to unsupported format: {}", value);
    throw new UnsupportedFormatException("Unsupported output format: " + value + " (expected pdf or docx)");
  }
}
