package com.resumebuilder;

import java.util.List;

import com.resumebuilder.extract.ExtractionReport;
import com.resumebuilder.extract.ResumeExtractor;
import com.resumebuilder.layout.LayoutDefinition;
import com.resumebuilder.layout.LayoutRegistry;
import com.resumebuilder.reader.DocumentReader;
import com.resumebuilder.reader.DocumentText;
import com.resumebuilder.render.Renderer;

public class ResumeService {
  private final DocumentReader reader;
  private final ResumeExtractor extractor;
  private final LayoutRegistry layouts;
  private final Renderer renderer;

  public ResumeService() {
    this(new DocumentReader(), new ResumeExtractor(), LayoutRegistry.getInstance());
  }

  public ResumeService(DocumentReader reader, ResumeExtractor extractor, LayoutRegistry layouts) {
    this.reader = reader;
    this.extractor = extractor;
    this.layouts = layouts;
    this.renderer = new Renderer(layouts);
  }

  /**
   * @param declaredFormat file name, extension or media type from the uploader; may be null
   * @throws UnsupportedFormatException when the document is neither PDF nor Word
   * @throws CorruptDocumentException when the document cannot be opened
   * @throws EmptyDocumentException when it holds no text
   */
  public ExtractionReport extract(byte[] content, String declaredFormat) {
    DocumentText text = reader.read(content, declaredFormat);
    return extractor.extract(text);
  }

  /**
   * @throws UnknownLayoutException for a layout id not in the catalog
   * @throws UnsupportedFormatException for a format other than pdf or docx
   * @throws RenderException when the backend fails
   */
  public byte[] render(Entity.ResumeEntity resume, String layoutId, String format) {
    return renderer.render(resume, layoutId, format);
  }

  public List<LayoutDefinition> layouts() {
    return layouts.list();
  }
}
