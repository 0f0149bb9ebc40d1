package com.resumebuilder.reader;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.apache.poi.hwpf.extractor.WordExtractor;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;

/**
 * Reads Word documents paragraph by paragraph. For .docx the paragraph style, run
 * boldness/size, list numbering and left indentation become line hints; legacy .doc
 * only yields text.
 */
class WordLineReader {
  private static final int TWIPS_PER_INDENT = 720;
  private static final int HEADING_FONT_SIZE = 13;
  private static final int MAX_BOLD_HEADING_CHARS = 60;
  private static final String LIST_MARKER = "• ";

  List<TextLine> readDocx(byte[] content) throws IOException {
    List<TextLine> lines = new ArrayList<>();
    try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(content))) {
      for (IBodyElement element : document.getBodyElements()) {
        if (element instanceof XWPFParagraph) {
          addParagraph((XWPFParagraph) element, lines);
        } else if (element instanceof XWPFTable) {
          addTable((XWPFTable) element, lines);
        }
      }
    }
    return LineNormalizer.tidy(lines);
  }

  List<TextLine> readDoc(byte[] content) throws IOException {
    List<TextLine> lines = new ArrayList<>();
    try (WordExtractor extractor = new WordExtractor(new ByteArrayInputStream(content))) {
      for (String paragraph : extractor.getParagraphText()) {
        List<TextLine> paragraphLines = LineNormalizer.fromText(paragraph);
        if (paragraphLines.isEmpty()) {
          lines.add(TextLine.blank());
        } else {
          lines.addAll(paragraphLines);
        }
      }
    }
    return LineNormalizer.tidy(lines);
  }

  private void addTable(XWPFTable table, List<TextLine> lines) {
    for (XWPFTableRow row : table.getRows()) {
      for (XWPFTableCell cell : row.getTableCells()) {
        for (XWPFParagraph paragraph : cell.getParagraphs()) {
          addParagraph(paragraph, lines);
        }
      }
      lines.add(TextLine.blank());
    }
  }

  private void addParagraph(XWPFParagraph paragraph, List<TextLine> lines) {
    String text = paragraph.getText();
    if (text == null || text.isBlank()) {
      lines.add(TextLine.blank());
      return;
    }
    boolean heading = isHeadingStyle(paragraph.getStyleID()) || isEmphasized(paragraph, text);
    int indent = Math.max(0, paragraph.getIndentationLeft()) / TWIPS_PER_INDENT;
    boolean listItem = paragraph.getNumID() != null;

    boolean first = true;
    for (String raw : text.split("\\r?\\n")) {
      String lineText = listItem && first ? LIST_MARKER + raw : raw;
      lines.add(TextLine.of(lineText, heading, indent));
      first = false;
    }
  }

  private static boolean isHeadingStyle(String styleId) {
    if (styleId == null) {
      return false;
    }
    String style = styleId.toLowerCase(Locale.ROOT);
    return style.startsWith("heading") || style.startsWith("title")
        || style.startsWith("titulo") || style.startsWith("ttulo");
  }

  private static boolean isEmphasized(XWPFParagraph paragraph, String text) {
    boolean allBold = true;
    boolean large = false;
    boolean any = false;
    for (XWPFRun run : paragraph.getRuns()) {
      String runText = run.text();
      if (runText == null || runText.isBlank()) {
        continue;
      }
      any = true;
      allBold &= run.isBold();
      large |= run.getFontSize() >= HEADING_FONT_SIZE;
    }
    return any && (large || (allBold && text.strip().length() <= MAX_BOLD_HEADING_CHARS));
  }
}
