package com.resumebuilder.render;

import java.io.IOException;
import java.util.List;

import com.resumebuilder.layout.LayoutDefinition;

interface DocumentEncoder {
  byte[] encode(List<ContentBlock> blocks, LayoutDefinition layout) throws IOException;
}
