package com.ledgerlens.domain;

import java.util.Locale;

/**
 * Channel a document arrived through. Priority orders upload jobs: higher runs first.
 */
public enum UploadSource {
    WHATSAPP(20),
    WEB(15),
    API(10);

    private final int priority;

    UploadSource(int priority) {
        this.priority = priority;
    }

    public int priority() {
        return priority;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static UploadSource fromLabel(String label) {
        if (label == null) {
            return API;
        }
        for (UploadSource s : values()) {
            if (s.label().equalsIgnoreCase(label.trim())) {
                return s;
            }
        }
        return API;
    }
}
