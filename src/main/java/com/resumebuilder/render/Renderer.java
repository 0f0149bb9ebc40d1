package com.resumebuilder.render;

import java.io.IOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.resumebuilder.Entity;
import com.resumebuilder.RenderException;
import com.resumebuilder.layout.LayoutDefinition;
import com.resumebuilder.layout.LayoutRegistry;

public class Renderer {
  private static final Logger LOGGER = LoggerFactory.getLogger(Renderer.class);

  private final LayoutRegistry layouts;
  private final ContentPlanner planner;
  private final Map<OutputFormat, DocumentEncoder> encoders = new EnumMap<>(OutputFormat.class);

  public Renderer() {
    this(LayoutRegistry.getInstance());
  }

  public Renderer(LayoutRegistry layouts) {
    this.layouts = layouts;
    this.planner = new ContentPlanner(layouts.getUntitledName(), layouts.getOngoingLabel());
    encoders.put(OutputFormat.PDF, new PdfEncoder());
    encoders.put(OutputFormat.DOCX, new WordEncoder());
  }

  /**
   * @throws com.resumebuilder.UnknownLayoutException for a layout id not in the catalog
   * @throws com.resumebuilder.UnsupportedFormatException for a format other than pdf or docx
   * @throws RenderException when the backend fails to produce the document
   */
  public byte[] render(Entity.ResumeEntity resume, String layoutId, String format) {
    OutputFormat output = OutputFormat.fromId(format);
    return render(resume, layouts.get(layoutId), output);
  }

  public byte[] render(Entity.ResumeEntity resume, LayoutDefinition layout, OutputFormat format) {
    List<ContentBlock> blocks = planner.plan(resume == null ? new Entity.ResumeEntity() : resume, layout);
    byte[] bytes;
    try {
      bytes = encoders.get(format).encode(blocks, layout);
    } catch (IOException | RuntimeException e) {
      LOGGER.error("Unable to render {} with layout {}", format, layout.getId(), e);
      throw new RenderException("Unable to render " + format.id + " with layout " + layout.getId(), e);
    }
    LOGGER.info("Rendered {} with layout {}: {} blocks, {} bytes", format, layout.getId(), blocks.size(), bytes.length);
    return bytes;
  }
}
