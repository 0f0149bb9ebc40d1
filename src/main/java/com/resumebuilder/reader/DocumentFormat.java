package com.resumebuilder.reader;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.openxml4j.opc.OPCPackage;
import org.apache.poi.poifs.filesystem.FileMagic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public enum DocumentFormat {
  PDF("pdf", "application/pdf"),
  DOCX("docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document"),
  DOC("doc", "application/msword");

  private static final Logger LOGGER = LoggerFactory.getLogger(DocumentFormat.class);

  private static final String PDF_HEADER = "%PDF-";
  // Some generators prepend garbage before the PDF header; readers accept it within 1 KiB.
  private static final int PDF_HEADER_WINDOW = 1024;
  private static final Pattern WORD_PART = Pattern.compile("/word/.*");

  public final String extension;
  public final String mediaType;

  private DocumentFormat(String extension, String mediaType) {
    this.extension = extension;
    this.mediaType = mediaType;
  }

  /**
   * Detects the format from the leading bytes.
   */
  public static Optional<DocumentFormat> sniff(byte[] content) {
    if (content == null || content.length == 0) {
      return Optional.empty();
    }
    switch (FileMagic.valueOf(content)) {
      case PDF:
        return Optional.of(PDF);
      case OLE2:
        return Optional.of(DOC);
      case OOXML:
        return isWordPackage(content) ? Optional.of(DOCX) : Optional.empty();
      default:
        return hasLatePdfHeader(content) ? Optional.of(PDF) : Optional.empty();
    }
  }

  /**
   * Resolves a declared format from a file name, an extension or a media type.
   */
  public static Optional<DocumentFormat> fromDeclared(String declared) {
    if (declared == null || declared.isBlank()) {
      return Optional.empty();
    }
    String value = declared.trim().toLowerCase(Locale.ROOT);
    int params = value.indexOf(';');
    if (params >= 0) {
      value = value.substring(0, params).trim();
    }
    for (DocumentFormat format : values()) {
      if (value.equals(format.mediaType)
          || value.equals(format.extension)
          || value.endsWith("." + format.extension)) {
        return Optional.of(format);
      }
    }
    return Optional.empty();
  }

  private static boolean isWordPackage(byte[] content) {
    try (OPCPackage pkg = OPCPackage.open(new ByteArrayInputStream(content))) {
      return !pkg.getPartsByName(WORD_PART).isEmpty();
    } catch (IOException | InvalidFormatException | RuntimeException e) {
      LOGGER.debug("ZIP content is not an Office package, leaving it to the declared format", e);
      return false;
    }
  }

  private static boolean hasLatePdfHeader(byte[] content) {
    int window = Math.min(content.length, PDF_HEADER_WINDOW);
    return new String(content, 0, window, StandardCharsets.ISO_8859_1).contains(PDF_HEADER);
  }
}
