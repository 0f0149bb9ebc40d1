package com.resumebuilder.render;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;

import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSString;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;

import com.openhtmltopdf.pdfboxout.PdfRendererBuilder;
import com.openhtmltopdf.util.XRLog;
import com.resumebuilder.Resources;
import com.resumebuilder.layout.LayoutDefinition;
import com.resumebuilder.layout.LayoutStyle;

/**
 * PDF backend: content blocks go through the Thymeleaf XHTML template, openhtmltopdf lays
 * the page out, then PDFBox strips the creation date and pins the document id so equal
 * input gives equal bytes. Only the built-in Times and Helvetica fonts are used.
 */
final class PdfEncoder implements DocumentEncoder {
  private static final Logger LOGGER = LoggerFactory.getLogger(PdfEncoder.class);

  static final String TEMPLATE_RESOURCE = "/templates/resume.xhtml";
  private static final String LANG = "pt-BR";

  private static final TemplateEngine THYMELEAF = new TemplateEngine();
  private static final String TEMPLATE = Resources.loadString(TEMPLATE_RESOURCE);

  static {
    // Disable the chatty logging.
    XRLog.listRegisteredLoggers().forEach(logger -> XRLog.setLevel(logger, Level.WARNING));
  }

  @Override
  public byte[] encode(List<ContentBlock> blocks, LayoutDefinition layout) throws IOException {
    String html = toHtml(blocks, layout);

    byte[] raw;
    try (ByteArrayOutputStream os = new ByteArrayOutputStream()) {
      PdfRendererBuilder builder = new PdfRendererBuilder();
      builder.withHtmlContent(html, PdfEncoder.class.getResource(TEMPLATE_RESOURCE).toExternalForm());
      builder.useFastMode();
      builder.toStream(os);
      builder.run();
      raw = os.toByteArray();
    }
    LOGGER.debug("openhtmltopdf produced {} bytes for layout {}", raw.length, layout.getId());
    return normalize(raw, html);
  }

  String toHtml(List<ContentBlock> blocks, LayoutDefinition layout) {
    LayoutStyle style = layout.getStyle();
    Context ctx = new Context(Locale.ROOT);
    ctx.setVariable("lang", LANG);
    ctx.setVariable("title", blocks.isEmpty() ? layout.getName() : blocks.get(0).getTitle());
    ctx.setVariable("blocks", blocks);
    ctx.setVariable("style", style);
    ctx.setVariable("sizes", sizes(style.getBaseFontSize()));
    ctx.setVariable("twoColumn", style.isTwoColumn());
    ctx.setVariable("bullets", style.getBulletStyle());
    return THYMELEAF.process(TEMPLATE, ctx);
  }

  /** Point sizes relative to the layout's body size, formatted for CSS. */
  static Map<String, String> sizes(float base) {
    Map<String, String> sizes = new HashMap<>();
    sizes.put("body", points(base));
    sizes.put("small", points(base - 1f));
    sizes.put("heading", points(base * 1.25f));
    sizes.put("name", points(base * 2f));
    return sizes;
  }

  private static String points(float value) {
    return String.format(Locale.ROOT, "%.1f", value);
  }

  /**
   * Removes the timestamps openhtmltopdf writes and replaces the random trailer id with
   * one derived from the page source.
   */
  static byte[] normalize(byte[] pdf, String source) throws IOException {
    try (PDDocument document = PDDocument.load(pdf);
         ByteArrayOutputStream os = new ByteArrayOutputStream()) {
      PDDocumentInformation info = document.getDocumentInformation();
      info.setCreationDate(null);
      info.setModificationDate(null);

      byte[] id = Arrays.copyOf(sha256(source), 16);
      COSArray ids = new COSArray();
      ids.add(new COSString(id));
      ids.add(new COSString(id));
      document.getDocument().setDocumentID(ids);

      document.save(os);
      return os.toByteArray();
    }
  }

  private static byte[] sha256(String text) {
    try {
      return MessageDigest.getInstance("SHA-256").digest(text.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException(e);
    }
  }
}
