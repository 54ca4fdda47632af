package com.ledgerlens.adapter.analyzer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Wire shape of {@code POST /render}; page data is base64.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record RenderResponse(List<Page> pages) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Page(Integer pageNumber, String mimeType, String data) {
    }
}
