package com.resumebuilder.reader;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.resumebuilder.CorruptDocumentException;
import com.resumebuilder.UnsupportedFormatException;

public class DocumentReader {
  private static final Logger LOGGER = LoggerFactory.getLogger(DocumentReader.class);

  private final WordLineReader wordReader = new WordLineReader();

  /**
   * @param content  the document bytes
   * @param declared optional file name, extension or media type supplied by the uploader;
   *                 used only when the bytes themselves are not recognized
   */
  public DocumentText read(byte[] content, String declared) {
    Optional<DocumentFormat> sniffed = DocumentFormat.sniff(content);
    DocumentFormat format = sniffed
        .or(() -> DocumentFormat.fromDeclared(declared))
        .orElseThrow(() -> {
          LOGGER.warn("Rejected upload with unrecognized format (declared: {})", declared);
          return new UnsupportedFormatException(
              "Unsupported document format" + (declared == null ? "" : " (declared: " + declared + ")")
              + ". Use PDF or Word.");
        });
    if (sniffed.isEmpty()) {
      LOGGER.debug("Content not recognized, trying declared format {}", format);
    }
    return read(content, format);
  }

  public DocumentText read(byte[] content, DocumentFormat format) {
    byte[] bytes = content == null ? new byte[0] : content;
    List<TextLine> lines;
    try {
      lines = parse(bytes, format);
    } catch (IOException | RuntimeException e) {
      LOGGER.warn("Unable to open {} document of {} bytes", format, bytes.length, e);
      throw new CorruptDocumentException(
          "The " + format.extension + " document could not be opened; it may be truncated, "
          + "password protected or not really a " + format.extension + " file", e);
    }
    LOGGER.debug("Read {} lines from {} document of {} bytes", lines.size(), format, bytes.length);
    return new DocumentText(format, lines, format == DocumentFormat.PDF);
  }

  private List<TextLine> parse(byte[] bytes, DocumentFormat format) throws IOException {
    switch (format) {
      case PDF:
        return readPdf(bytes);
      case DOCX:
        return wordReader.readDocx(bytes);
      default:
        return wordReader.readDoc(bytes);
    }
  }

  private static List<TextLine> readPdf(byte[] bytes) throws IOException {
    try (PDDocument document = PDDocument.load(bytes)) {
      return new PdfLineStripper().readLines(document);
    }
  }
}
