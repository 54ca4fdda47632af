package com.ledgerlens.pipeline.classifier;

import com.ledgerlens.domain.DocumentType;

/**
 * What is known about a document besides its text: type hint, original file name, language.
 */
public record DocumentContext(DocumentType documentType, String fileName, String language) {
}
