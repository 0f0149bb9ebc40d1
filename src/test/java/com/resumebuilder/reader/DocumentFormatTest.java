package com.resumebuilder.reader;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.junit.jupiter.api.Test;

class DocumentFormatTest {

  @Test
  void sniffsPdfHeaderEvenAfterLeadingJunk() {
    byte[] pdf = "\n\n%PDF-1.7\n...".getBytes(StandardCharsets.US_ASCII);

    assertThat(DocumentFormat.sniff(pdf)).contains(DocumentFormat.PDF);
  }

  @Test
  void sniffsLegacyWordFromOle2Signature() {
    byte[] doc = {(byte) 0xD0, (byte) 0xCF, 0x11, (byte) 0xE0, (byte) 0xA1, (byte) 0xB1, 0x1A, (byte) 0xE1, 0, 0};

    assertThat(DocumentFormat.sniff(doc)).contains(DocumentFormat.DOC);
  }

  @Test
  void sniffsDocxOnlyWhenPackageHoldsWordPart() throws IOException {
    ByteArrayOutputStream docx = new ByteArrayOutputStream();
    try (XWPFDocument doc = new XWPFDocument()) {
      doc.createParagraph().createRun().setText("Ana Lima");
      doc.write(docx);
    }
    ByteArrayOutputStream xlsx = new ByteArrayOutputStream();
    try (XSSFWorkbook workbook = new XSSFWorkbook()) {
      workbook.createSheet("Plan1").createRow(0).createCell(0).setCellValue("Ana Lima");
      workbook.write(xlsx);
    }

    assertThat(DocumentFormat.sniff(docx.toByteArray())).contains(DocumentFormat.DOCX);
    assertThat(DocumentFormat.sniff(xlsx.toByteArray())).isEmpty();
  }

  @Test
  void zipWithoutOfficeContentTypesIsNotSniffed() throws IOException {
    assertThat(DocumentFormat.sniff(zipWith("word/document.xml"))).isEmpty();
  }

  @Test
  void unknownOrEmptyContentIsNotSniffed() {
    assertThat(DocumentFormat.sniff(new byte[0])).isEmpty();
    assertThat(DocumentFormat.sniff(null)).isEmpty();
    assertThat(DocumentFormat.sniff("plain text".getBytes(StandardCharsets.UTF_8))).isEmpty();
  }

  @Test
  void declaredFormatAcceptsFileNamesExtensionsAndMediaTypes() {
    assertThat(DocumentFormat.fromDeclared("Curriculo Final.PDF")).contains(DocumentFormat.PDF);
    assertThat(DocumentFormat.fromDeclared("docx")).contains(DocumentFormat.DOCX);
    assertThat(DocumentFormat.fromDeclared("application/msword")).contains(DocumentFormat.DOC);
    assertThat(DocumentFormat.fromDeclared("application/pdf; charset=binary")).contains(DocumentFormat.PDF);
    assertThat(DocumentFormat.fromDeclared("resume.odt")).isEmpty();
    assertThat(DocumentFormat.fromDeclared(" ")).isEmpty();
  }

  private static byte[] zipWith(String entryName) throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
      zip.putNextEntry(new ZipEntry(entryName));
      zip.write("<xml/>".getBytes(StandardCharsets.UTF_8));
      zip.closeEntry();
    }
    return bytes.toByteArray();
  }
}
