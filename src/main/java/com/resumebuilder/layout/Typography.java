package com.resumebuilder.layout;

public enum Typography {
  SERIF("serif", "Times New Roman"),
  SANS("sans-serif", "Calibri");

  public final String pdfFamily;
  public final String wordFamily;

  private Typography(String pdfFamily, String wordFamily) {
    this.pdfFamily = pdfFamily;
    this.wordFamily = wordFamily;
  }
}
