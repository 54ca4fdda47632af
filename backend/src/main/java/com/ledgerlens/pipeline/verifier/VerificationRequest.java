package com.ledgerlens.pipeline.verifier;

import com.ledgerlens.domain.ClassificationResult;
import com.ledgerlens.pipeline.classifier.DocumentContext;
import com.ledgerlens.pipeline.classifier.ExtractedDocument;

/**
 * What the verifier sees: the rule-based guess, the extracted data it came from, and the document context.
 */
public record VerificationRequest(ClassificationResult ruleBased, ExtractedDocument extracted, DocumentContext context) {
}
