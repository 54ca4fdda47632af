package com.ledgerlens.pipeline.verifier;

import com.ledgerlens.domain.ClassificationResult;

/**
 * Verifying model: confirms or corrects the rule-based classification. Implementations throw on any failure.
 */
public interface VerifierModelClient {

    ClassificationResult verify(VerificationRequest request);
}
