package com.resumebuilder.reader;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDFontDescriptor;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

/**
 * PDFBox text stripper that collects lines together with font size, boldness and start
 * position instead of writing plain text.
 * <p>
 * Text is sorted by position, so columns are not detected: a two column page reads
 * left to right across both columns.
 */
class PdfLineStripper extends PDFTextStripper {
  private static final float HEADING_SIZE_RATIO = 1.15f;
  private static final float BOLD_RATIO = 0.9f;
  private static final int MAX_BOLD_HEADING_CHARS = 60;
  private static final float INDENT_STEP_PT = 18f;

  private static final class RawLine {
    final String text;
    final float fontSize;
    final float startX;
    final boolean bold;

    RawLine(String text, float fontSize, float startX, boolean bold) {
      this.text = text;
      this.fontSize = fontSize;
      this.startX = startX;
      this.bold = bold;
    }
  }

  private final List<RawLine> rawLines = new ArrayList<>();
  private final StringBuilder current = new StringBuilder();
  private float maxFontSize;
  private float startX = -1f;
  private int glyphs;
  private int boldGlyphs;

  PdfLineStripper() throws IOException {
    super();
    setSortByPosition(true);
  }

  List<TextLine> readLines(PDDocument document) throws IOException {
    rawLines.clear();
    resetCurrent();
    getText(document);
    flushLine();
    return toTextLines();
  }

  @Override
  protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
    current.append(text);
    for (TextPosition position : textPositions) {
      if (startX < 0) {
        startX = position.getXDirAdj();
      }
      maxFontSize = Math.max(maxFontSize, position.getFontSizeInPt());
      String unicode = position.getUnicode();
      if (unicode != null && !unicode.isBlank()) {
        glyphs++;
        if (isBold(position.getFont())) {
          boldGlyphs++;
        }
      }
    }
  }

  @Override
  protected void writeWordSeparator() throws IOException {
    current.append(getWordSeparator());
  }

  @Override
  protected void writeLineSeparator() throws IOException {
    flushLine();
  }

  @Override
  protected void writeParagraphEnd() throws IOException {
    flushLine();
    rawLines.add(null);
  }

  @Override
  protected void writePageEnd() throws IOException {
    flushLine();
    rawLines.add(null);
  }

  private void flushLine() {
    String text = current.toString();
    if (!text.isBlank()) {
      boolean bold = glyphs > 0 && boldGlyphs >= glyphs * BOLD_RATIO;
      rawLines.add(new RawLine(text, maxFontSize, Math.max(0f, startX), bold));
    }
    resetCurrent();
  }

  private void resetCurrent() {
    current.setLength(0);
    maxFontSize = 0f;
    startX = -1f;
    glyphs = 0;
    boldGlyphs = 0;
  }

  private List<TextLine> toTextLines() {
    float bodySize = medianFontSize();
    float minX = Float.MAX_VALUE;
    for (RawLine line : rawLines) {
      if (line != null) {
        minX = Math.min(minX, line.startX);
      }
    }

    List<TextLine> lines = new ArrayList<>(rawLines.size());
    for (RawLine line : rawLines) {
      if (line == null) {
        lines.add(TextLine.blank());
        continue;
      }
      boolean larger = bodySize > 0 && line.fontSize >= bodySize * HEADING_SIZE_RATIO;
      boolean boldShort = line.bold && line.text.strip().length() <= MAX_BOLD_HEADING_CHARS;
      int indent = Math.round((line.startX - minX) / INDENT_STEP_PT);
      lines.add(TextLine.of(line.text, larger || boldShort, indent));
    }
    return LineNormalizer.tidy(lines);
  }

  private float medianFontSize() {
    List<Float> sizes = new ArrayList<>();
    for (RawLine line : rawLines) {
      if (line != null && line.fontSize > 0) {
        sizes.add(line.fontSize);
      }
    }
    if (sizes.isEmpty()) {
      return 0f;
    }
    Collections.sort(sizes);
    return sizes.get(sizes.size() / 2);
  }

  private static boolean isBold(PDFont font) {
    if (font == null) {
      return false;
    }
    String name = font.getName();
    if (name != null) {
      String lower = name.toLowerCase(Locale.ROOT);
      if (lower.contains("bold") || lower.contains("black") || lower.contains("heavy")) {
        return true;
      }
    }
    PDFontDescriptor descriptor = font.getFontDescriptor();
    return descriptor != null && (descriptor.isForceBold() || descriptor.getFontWeight() >= 700f);
  }
}
