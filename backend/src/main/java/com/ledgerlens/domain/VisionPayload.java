package com.ledgerlens.domain;

/**
 * Vision stage outcome. Chilean flags (tax id / IVA line present) are diagnostics only.
 */
public record VisionPayload(
        boolean success,
        ClassificationResult result,
        ChileanDocumentType chileanDocumentType,
        boolean hasRut,
        boolean hasIva,
        boolean fallbackUsed,
        String error
) implements StagePayload {

    @Override
    public ProcessingStage stage() {
        return ProcessingStage.VISION_ANALYSIS;
    }
}
