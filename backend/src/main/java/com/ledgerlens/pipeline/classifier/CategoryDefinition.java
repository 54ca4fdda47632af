package com.ledgerlens.pipeline.classifier;

import com.ledgerlens.domain.TransactionType;

import java.util.List;
import java.util.regex.Pattern;

/**
 * A transaction category with the keywords and merchant patterns used to score it.
 */
public record CategoryDefinition(
        String name,
        TransactionType transactionType,
        List<String> keywords,
        List<Pattern> patterns,
        List<Subcategory> subcategories
) {

    public record Subcategory(String name, List<String> keywords) {
    }
}
