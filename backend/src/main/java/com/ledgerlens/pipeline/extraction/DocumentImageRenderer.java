package com.ledgerlens.pipeline.extraction;

import java.util.List;

/**
 * Renders a stored document (PDF or image) into page images. An empty list means nothing could be rendered.
 */
public interface DocumentImageRenderer {

    List<RenderedPage> render(StorageReference document);
}
