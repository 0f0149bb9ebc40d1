package com.resumebuilder.render;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

import org.apache.commons.io.IOUtils;
import org.apache.poi.xwpf.usermodel.Borders;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTable.XWPFBorderType;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.resumebuilder.layout.HeaderAlignment;
import com.resumebuilder.layout.LayoutDefinition;
import com.resumebuilder.layout.LayoutStyle;

/**
 * Word backend: paragraphs and runs carrying the layout's font, colors and sizes. Section
 * headings get an accent rule underneath, the same as the PDF's bottom border. Two-column
 * layouts put each section's entries in a borderless table with the period and subtitle on
 * the left.
 * <p>
 * POI stamps the package with the current time, so the created date is cleared and the
 * archive is rewritten with a fixed entry time.
 */
final class WordEncoder implements DocumentEncoder {
  private static final Logger LOGGER = LoggerFactory.getLogger(WordEncoder.class);

  /** Local time, so the stored DOS timestamp does not depend on the time zone. */
  static final LocalDateTime FIXED_ENTRY_TIME = LocalDateTime.of(2000, 1, 1, 0, 0);

  private static final int ITEM_INDENT_TWIPS = 360;

  @Override
  public byte[] encode(List<ContentBlock> blocks, LayoutDefinition layout) throws IOException {
    byte[] raw;
    try (XWPFDocument document = new XWPFDocument();
         ByteArrayOutputStream os = new ByteArrayOutputStream()) {
      new Writer(document, layout.getStyle()).write(blocks);
      document.getProperties().getCoreProperties().setTitle(blocks.isEmpty() ? layout.getName() : blocks.get(0).getTitle());
      document.getProperties().getCoreProperties().setCreated(Optional.empty());
      document.getProperties().getCoreProperties().setModified(Optional.empty());
      document.write(os);
      raw = os.toByteArray();
    }
    LOGGER.debug("POI produced {} bytes for layout {}", raw.length, layout.getId());
    return normalizeZip(raw);
  }

  /** Rewrites the archive with the same entries in the same order and a fixed entry time. */
  static byte[] normalizeZip(byte[] zip) throws IOException {
    try (ZipInputStream in = new ZipInputStream(new ByteArrayInputStream(zip));
         ByteArrayOutputStream bytes = new ByteArrayOutputStream()) {
      try (ZipOutputStream out = new ZipOutputStream(bytes)) {
        ZipEntry entry;
        while ((entry = in.getNextEntry()) != null) {
          ZipEntry copy = new ZipEntry(entry.getName());
          copy.setTimeLocal(FIXED_ENTRY_TIME);
          out.putNextEntry(copy);
          IOUtils.copy(in, out);
          out.closeEntry();
        }
      }
      return bytes.toByteArray();
    }
  }

  /** Per-call state: the document being filled and the open two-column table, if any. */
  private static final class Writer {
    private final XWPFDocument document;
    private final LayoutStyle style;
    private final String font;
    private final double body;
    private XWPFTable grid;

    Writer(XWPFDocument document, LayoutStyle style) {
      this.document = document;
      this.style = style;
      this.font = style.getTypography().wordFamily;
      this.body = style.getBaseFontSize();
    }

    void write(List<ContentBlock> blocks) {
      for (ContentBlock block : blocks) {
        if (!block.isEntry()) {
          grid = null;
        }
        switch (block.getKind()) {
          case HEADER:
            header(block);
            break;
          case HEADING:
            heading(block.getTitle());
            break;
          case SUMMARY:
          case SKILLS:
            run(document.createParagraph(), block.getBody(), body, style.getTextHex(), false, false);
            break;
          default:
            if (style.isTwoColumn()) {
              gridEntry(block);
            } else {
              entry(block, document::createParagraph);
            }
        }
      }
    }

    private void header(ContentBlock block) {
      ParagraphAlignment alignment = style.getHeaderAlignment() == HeaderAlignment.CENTER
          ? ParagraphAlignment.CENTER : ParagraphAlignment.LEFT;
      XWPFParagraph name = document.createParagraph();
      name.setAlignment(alignment);
      run(name, block.getTitle(), body * 2, style.getAccentHex(), true, false);

      if (block.hasItems()) {
        XWPFParagraph contact = document.createParagraph();
        contact.setAlignment(alignment);
        run(contact, String.join(" | ", block.getItems()), body - 1, style.getTextHex(), false, false);
      }
    }

    private void heading(String title) {
      XWPFParagraph heading = document.createParagraph();
      heading.setSpacingBefore(240);
      heading.setSpacingAfter(80);
      heading.setBorderBottom(Borders.SINGLE);
      run(heading, title, body * 1.25, style.getAccentHex(), true, false);
    }

    private void entry(ContentBlock block, Supplier<XWPFParagraph> paragraphs) {
      XWPFParagraph title = paragraphs.get();
      title.setSpacingBefore(80);
      if (block.getTitle() != null) {
        run(title, block.getTitle(), body, style.getTextHex(), true, false);
      }
      if (block.getSubtitle() != null) {
        String prefix = block.getTitle() != null ? " | " : "";
        run(title, prefix + block.getSubtitle(), body, style.getAccentHex(), false, false);
      }
      if (block.getPeriod() != null) {
        run(title, " (" + block.getPeriod() + ")", body, style.getTextHex(), false, true);
      }
      entryBody(block, paragraphs);
    }

    private void gridEntry(ContentBlock block) {
      XWPFTableRow row;
      if (grid == null) {
        grid = document.createTable(1, 2);
        grid.setWidth("100%");
        grid.setTopBorder(XWPFBorderType.NONE, 0, 0, "auto");
        grid.setBottomBorder(XWPFBorderType.NONE, 0, 0, "auto");
        grid.setLeftBorder(XWPFBorderType.NONE, 0, 0, "auto");
        grid.setRightBorder(XWPFBorderType.NONE, 0, 0, "auto");
        grid.setInsideHBorder(XWPFBorderType.NONE, 0, 0, "auto");
        grid.setInsideVBorder(XWPFBorderType.NONE, 0, 0, "auto");
        row = grid.getRow(0);
      } else {
        row = grid.createRow();
      }
      XWPFTableCell meta = row.getCell(0);
      XWPFTableCell main = row.getCell(1);
      meta.setWidth("30%");
      main.setWidth("70%");

      Supplier<XWPFParagraph> left = cellParagraphs(meta);
      if (block.getPeriod() != null) {
        run(left.get(), block.getPeriod(), body - 1, style.getTextHex(), false, true);
      }
      if (block.getSubtitle() != null) {
        run(left.get(), block.getSubtitle(), body - 1, style.getAccentHex(), false, false);
      }

      Supplier<XWPFParagraph> right = cellParagraphs(main);
      if (block.getTitle() != null) {
        run(right.get(), block.getTitle(), body, style.getTextHex(), true, false);
      }
      entryBody(block, right);
    }

    private void entryBody(ContentBlock block, Supplier<XWPFParagraph> paragraphs) {
      if (block.getBody() != null) {
        run(paragraphs.get(), block.getBody(), body, style.getTextHex(), false, false);
      }
      List<String> items = block.getItems();
      for (int i = 0; i < items.size(); i++) {
        XWPFParagraph item = paragraphs.get();
        item.setIndentationLeft(ITEM_INDENT_TWIPS);
        run(item, style.getBulletStyle().marker(i) + items.get(i), body, style.getTextHex(), false, false);
      }
    }

    /** A new cell already holds one empty paragraph; hand that out first. */
    private static Supplier<XWPFParagraph> cellParagraphs(XWPFTableCell cell) {
      boolean[] first = {true};
      return () -> {
        if (first[0]) {
          first[0] = false;
          return cell.getParagraphs().get(0);
        }
        return cell.addParagraph();
      };
    }

    private XWPFRun run(XWPFParagraph paragraph, String text, double size, String color,
        boolean bold, boolean italic) {
      XWPFRun run = paragraph.createRun();
      run.setText(text);
      run.setFontFamily(font);
      run.setFontSize(size);
      run.setColor(color);
      run.setBold(bold);
      run.setItalic(italic);
      return run;
    }
  }
}
